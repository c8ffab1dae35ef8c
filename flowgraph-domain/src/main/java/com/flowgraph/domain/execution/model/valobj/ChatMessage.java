package com.flowgraph.domain.execution.model.valobj;

import com.flowgraph.types.enums.MessageRoleEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * 执行状态中的对话消息。
 * <p>
 * id 用于消息合并去重：相同 id 的后写消息替换先前消息。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private String id;
    private MessageRoleEnum role;
    private String content;
    private String name;

    public static ChatMessage human(String content) {
        return of(MessageRoleEnum.HUMAN, content);
    }

    public static ChatMessage ai(String content) {
        return of(MessageRoleEnum.AI, content);
    }

    private static ChatMessage of(MessageRoleEnum role, String content) {
        return ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content == null ? "" : content)
                .build();
    }
}
