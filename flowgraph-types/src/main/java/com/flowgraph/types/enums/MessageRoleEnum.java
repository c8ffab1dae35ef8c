package com.flowgraph.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对话消息角色枚举。
 */
public enum MessageRoleEnum {
    HUMAN("human"),
    AI("ai"),
    SYSTEM("system"),
    TOOL("tool");

    private final String code;

    MessageRoleEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static MessageRoleEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MessageRoleEnum role : MessageRoleEnum.values()) {
            if (role.code.equalsIgnoreCase(code) || role.name().equalsIgnoreCase(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown message role: " + code);
    }
}
