package com.flowgraph.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 运行事件类型枚举。
 *
 * @author flowgraph
 * @since 2026-03-02
 */
public enum StreamEventTypeEnum {

    WORKFLOW_START("workflow_start"),
    WORKFLOW_END("workflow_end"),
    NODE_START("node_start"),
    NODE_END("node_end"),
    TOKEN("token"),
    TOOL_CALL("tool_call"),
    TOOL_RESULT("tool_result"),
    STATE_UPDATE("state_update"),
    HUMAN_INPUT("human_input"),
    CHECKPOINT("checkpoint"),
    ERROR("error");

    private final String code;

    StreamEventTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static StreamEventTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StreamEventTypeEnum type : StreamEventTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown stream event type: " + code);
    }
}
