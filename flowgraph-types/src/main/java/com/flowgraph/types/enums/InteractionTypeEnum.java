package com.flowgraph.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 人工节点交互方式。
 */
public enum InteractionTypeEnum {

    /** 审批：通过/驳回 */
    APPROVE("approve"),

    /** 编辑上游产出 */
    EDIT("edit"),

    /** 自由输入 */
    INPUT("input");

    private final String code;

    InteractionTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 未识别时按 APPROVE 处理。
     */
    public static InteractionTypeEnum fromCode(String code) {
        if (code == null) {
            return APPROVE;
        }
        for (InteractionTypeEnum type : InteractionTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return APPROVE;
    }
}
