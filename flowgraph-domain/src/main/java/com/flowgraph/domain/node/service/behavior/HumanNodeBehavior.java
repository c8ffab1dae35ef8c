package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.enums.InteractionTypeEnum;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 人工介入节点。
 * <p>
 * 总是在执行前中断；恢复后把注入的反馈写入 output_key 并清空 humanFeedback，
 * 保证反馈只被消费一次。
 * </p>
 */
public class HumanNodeBehavior extends AbstractNodeBehavior {

    public static final String DEFAULT_PROMPT = "Please review and provide feedback.";

    public HumanNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public Map<String, Object> interruptRequest(ExecutionState state) {
        InteractionTypeEnum interactionType = InteractionTypeEnum.fromCode(configString("interaction_type", null));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", interactionType.getCode());
        payload.put("prompt", resolveTemplate(configString("prompt", DEFAULT_PROMPT), state));
        payload.put("node_name", getName());
        return payload;
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "feedback");
        String feedback = state.getHumanFeedback();
        StateUpdate update = setVariable(outputKey, feedback == null ? "" : feedback);
        update.setClearHumanFeedback(true);
        return update;
    }
}
