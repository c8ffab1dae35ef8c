package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.enums.StreamEventTypeEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次工具调用节点，调用前后分别推送 tool_call / tool_result 事件。
 */
@Slf4j
public class ToolNodeBehavior extends AbstractNodeBehavior {

    public ToolNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "output");
        String toolId = configString("tool_id", "");
        Object input = resolveInput(state);

        Map<String, Object> callPayload = new LinkedHashMap<>();
        callPayload.put("tool_id", toolId);
        callPayload.put("input", input);
        context.emit(StreamEventTypeEnum.TOOL_CALL, callPayload);

        String result;
        try {
            result = stringify(context.tools().invoke(toolId, input));
        } catch (Exception ex) {
            log.error("Tool invocation failed. nodeId={}, toolId={}, error={}", getId(), toolId, ex.getMessage());
            result = "Tool error: " + ex.getMessage();
        }

        Map<String, Object> resultPayload = new LinkedHashMap<>();
        resultPayload.put("tool_id", toolId);
        resultPayload.put("result", result);
        context.emit(StreamEventTypeEnum.TOOL_RESULT, resultPayload);

        StateUpdate update = setVariable(outputKey, result);
        update.setMessages(List.of(ChatMessage.ai("Tool result: " + result)));
        return update;
    }

    private Object resolveInput(ExecutionState state) {
        Object raw = configValue("tool_input");
        if (raw instanceof Map<?, ?>) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : configMap("tool_input").entrySet()) {
                Object value = entry.getValue();
                if (value instanceof String text && text.contains("{{#")) {
                    value = resolveTemplate(text, state);
                }
                resolved.put(entry.getKey(), value);
            }
            return resolved;
        }
        if (raw instanceof String text) {
            return resolveTemplate(text, state);
        }
        return new LinkedHashMap<String, Object>();
    }
}
