package com.flowgraph.test.domain;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.execution.service.StateReducers;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.domain.node.service.behavior.ReflectionNodeBehavior;
import com.flowgraph.test.support.NodeContexts;
import com.flowgraph.test.support.ScriptedModelGateway;
import com.flowgraph.types.enums.NodeTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.flowgraph.test.support.GraphDefinitions.config;
import static com.flowgraph.test.support.NodeContexts.spec;

public class ReflectionNodeBehaviorTest {

    private static final List<String> TARGETS = List.of("draft", "publish");

    private ReflectionNodeBehavior behavior() {
        return new ReflectionNodeBehavior(spec("review", NodeTypeEnum.REFLECTION,
                config("input_variable", "draft.text", "max_reflections", 3,
                        "retry_target", "draft", "accept_target", "publish")));
    }

    private ExecutionState draftState() {
        ExecutionState state = ExecutionState.initial();
        state.getVariables().put("draft", Map.of("text", "first draft"));
        return state;
    }

    @Test
    public void shouldRetryWithFeedback() {
        ReflectionNodeBehavior review = behavior();
        ScriptedModelGateway model = ScriptedModelGateway.constant("RETRY: add examples");

        StateUpdate update = review.execute(NodeContexts.withModel(review.getSpec(), model), draftState());
        ExecutionState state = StateReducers.apply(draftState(), update);

        Assertions.assertEquals(Boolean.FALSE, state.resolveVariable("review.accepted"));
        Assertions.assertEquals("add examples", state.resolveVariable("review.feedback"));
        Assertions.assertEquals("RETRY: add examples", state.resolveVariable("review.evaluation"));
        Assertions.assertEquals(1, state.getIterationCount());
        Assertions.assertEquals("Reflection: RETRY: add examples", state.lastMessage().getContent());
        Assertions.assertEquals("draft", review.route(state, TARGETS));

        ModelRequest request = model.getRequests().get(0);
        Assertions.assertEquals(Double.valueOf(0.0), request.getTemperature());
        Assertions.assertTrue(ScriptedModelGateway.lastContent(request).contains("first draft"));
    }

    @Test
    public void shouldAcceptOnAcceptVerdict() {
        ReflectionNodeBehavior review = behavior();

        StateUpdate update = review.execute(
                NodeContexts.withModel(review.getSpec(), ScriptedModelGateway.constant("ACCEPT")), draftState());
        ExecutionState state = StateReducers.apply(draftState(), update);

        Assertions.assertEquals(Boolean.TRUE, state.resolveVariable("review.accepted"));
        Assertions.assertEquals("publish", review.route(state, TARGETS));
    }

    @Test
    public void shouldForceAcceptAfterMaxReflections() {
        ReflectionNodeBehavior review = behavior();
        ExecutionState state = draftState();
        state.setIterationCount(3);
        state.getVariables().put("review", Map.of("accepted", false));

        Assertions.assertEquals("publish", review.route(state, TARGETS));
    }

    @Test
    public void shouldAcceptWhenEvaluatorFails() {
        ReflectionNodeBehavior review = behavior();
        ScriptedModelGateway failing = new ScriptedModelGateway(request -> {
            throw new IllegalStateException("model down");
        });

        StateUpdate update = review.execute(NodeContexts.withModel(review.getSpec(), failing), draftState());
        ExecutionState state = StateReducers.apply(draftState(), update);

        Assertions.assertEquals(Boolean.TRUE, state.resolveVariable("review.accepted"));
    }

    @Test
    public void shouldSubstituteContentIntoCustomPrompt() {
        ReflectionNodeBehavior review = new ReflectionNodeBehavior(spec("review", NodeTypeEnum.REFLECTION,
                config("input_variable", "draft.text", "evaluation_prompt", "Judge: {{content}}")));
        ScriptedModelGateway model = ScriptedModelGateway.constant("ACCEPT");

        review.execute(NodeContexts.withModel(review.getSpec(), model), draftState());

        Assertions.assertEquals("Judge: first draft", ScriptedModelGateway.lastContent(model.getRequests().get(0)));
    }
}
