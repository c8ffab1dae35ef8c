package com.flowgraph.test.domain;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.service.StateReducers;
import com.flowgraph.domain.node.service.behavior.HumanNodeBehavior;
import com.flowgraph.test.support.NodeContexts;
import com.flowgraph.types.enums.NodeTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.flowgraph.test.support.GraphDefinitions.config;
import static com.flowgraph.test.support.NodeContexts.spec;

public class HumanNodeBehaviorTest {

    @Test
    public void shouldBuildInterruptRequestFromConfig() {
        HumanNodeBehavior human = new HumanNodeBehavior(spec("approve", NodeTypeEnum.HUMAN,
                config("interaction_type", "edit", "prompt", "Check {{#draft.text#}}")));
        ExecutionState state = ExecutionState.initial();
        state.getVariables().put("draft", Map.of("text", "v1"));

        Map<String, Object> request = human.interruptRequest(state);

        Assertions.assertEquals("edit", request.get("type"));
        Assertions.assertEquals("Check v1", request.get("prompt"));
        Assertions.assertEquals("approve", request.get("node_name"));
    }

    @Test
    public void shouldDefaultToApproveInteraction() {
        HumanNodeBehavior human = new HumanNodeBehavior(spec("gate", NodeTypeEnum.HUMAN,
                config("interaction_type", "approval")));

        Map<String, Object> request = human.interruptRequest(ExecutionState.initial());

        Assertions.assertEquals("approve", request.get("type"));
        Assertions.assertEquals(HumanNodeBehavior.DEFAULT_PROMPT, request.get("prompt"));
    }

    @Test
    public void shouldConsumeFeedbackOnce() {
        HumanNodeBehavior human = new HumanNodeBehavior(spec("gate", NodeTypeEnum.HUMAN,
                config("output_key", "decision")));
        ExecutionState state = ExecutionState.initial();
        state.setHumanFeedback("looks good");

        ExecutionState next = StateReducers.apply(state,
                human.execute(NodeContexts.withModel(human.getSpec(), null), state));

        Assertions.assertEquals("looks good", next.resolveVariable("gate.decision"));
        Assertions.assertNull(next.getHumanFeedback());
    }
}
