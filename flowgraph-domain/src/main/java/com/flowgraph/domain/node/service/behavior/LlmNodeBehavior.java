package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.enums.StreamEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * 单次模型调用节点，模型片段以 token 事件推送。
 */
@Slf4j
public class LlmNodeBehavior extends AbstractNodeBehavior {

    public LlmNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "output");
        String userPrompt = resolveTemplate(configString("user_prompt", ""), state);
        if (StringUtils.isBlank(userPrompt)) {
            userPrompt = lastMessageText(state);
        }
        ModelRequest request = ModelRequest.builder()
                .modelId(configString("model_id", null))
                .systemPrompt(resolveTemplate(configString("system_prompt", ""), state))
                .messages(List.of(ChatMessage.human(userPrompt)))
                .temperature(configDouble("temperature", 0.7))
                .build();

        String result;
        try {
            result = context.models().streamChat(request,
                    token -> context.emit(StreamEventTypeEnum.TOKEN, Map.of("content", token)));
        } catch (Exception ex) {
            log.error("LLM invocation failed. nodeId={}, error={}", getId(), ex.getMessage());
            result = "Error: " + ex.getMessage();
        }
        result = stringify(result);
        StateUpdate update = setVariable(outputKey, result);
        update.setMessages(List.of(ChatMessage.ai(result)));
        return update;
    }
}
