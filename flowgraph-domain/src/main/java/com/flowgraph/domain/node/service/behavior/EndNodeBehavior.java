package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 结束节点：按 output_variable 取最终输出，取不到时使用最后一条消息。
 */
public class EndNodeBehavior extends AbstractNodeBehavior {

    public EndNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputVariable = configString("output_variable", "");
        Object value = null;
        if (!outputVariable.isEmpty()) {
            value = getVariable(state, outputVariable);
        }
        if (value == null && state.lastMessage() != null) {
            value = lastMessageText(state);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("end_time", LocalDateTime.now().toString());
        return StateUpdate.builder()
                .finalOutput(stringify(value))
                .metadata(metadata)
                .build();
    }
}
