package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.enums.MessageRoleEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 工具增强的 Agent 节点，工具调用循环由模型网关完成。
 */
@Slf4j
public class AgentNodeBehavior extends AbstractNodeBehavior {

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    private static final int CONTEXT_MESSAGES = 10;

    public AgentNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "output");
        String userInput = resolveTemplate(configString("user_input", ""), state);
        List<ChatMessage> messages = StringUtils.isNotBlank(userInput)
                ? new ArrayList<>(List.of(ChatMessage.human(userInput)))
                : state.recentMessages(CONTEXT_MESSAGES);

        ModelRequest request = ModelRequest.builder()
                .modelId(configString("model_id", null))
                .systemPrompt(resolveTemplate(configString("system_prompt", ""), state))
                .messages(messages)
                .temperature(configDouble("temperature", 0.7))
                .toolIds(configStringList("tool_ids"))
                .maxIterations(configInt("max_iterations", DEFAULT_MAX_ITERATIONS))
                .build();

        String text;
        try {
            text = context.models().chat(request);
        } catch (Exception ex) {
            log.error("Agent invocation failed. nodeId={}, error={}", getId(), ex.getMessage());
            text = "Agent error: " + ex.getMessage();
        }
        text = stringify(text);
        StateUpdate update = setVariable(outputKey, text);
        update.setMessages(List.of(ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRoleEnum.AI)
                .content(text)
                .name(getId())
                .build()));
        update.setCurrentAgent(getId());
        return update;
    }
}
