package com.flowgraph.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流运行状态枚举。
 * <p>
 * READY → RUNNING → {SUSPENDED, COMPLETED, FAILED}，SUSPENDED 在 resume 后回到 RUNNING。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
public enum RunStatusEnum {

    /**
     * 就绪 - 图已编译，尚未开始执行
     */
    READY("ready"),

    /**
     * 运行中
     */
    RUNNING("running"),

    /**
     * 挂起 - 停在人工节点前，等待外部反馈
     */
    SUSPENDED("suspended"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败 - 节点异常、路由错误或超出步数上限
     */
    FAILED("failed");

    private final String code;

    RunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static RunStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RunStatusEnum status : RunStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }
}
