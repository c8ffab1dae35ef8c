package com.flowgraph.test.domain;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.node.service.behavior.ConditionNodeBehavior;
import com.flowgraph.types.enums.NodeTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowgraph.test.support.GraphDefinitions.config;
import static com.flowgraph.test.support.NodeContexts.spec;

public class ConditionNodeBehaviorTest {

    private static final List<String> TARGETS = List.of("approved", "rejected", "fallback");

    private ConditionNodeBehavior behavior(List<Map<String, Object>> cases, String defaultTarget) {
        return new ConditionNodeBehavior(spec("check", NodeTypeEnum.CONDITION,
                config("cases", cases, "default_target", defaultTarget)));
    }

    private ExecutionState stateWith(String namespace, String key, Object value) {
        ExecutionState state = ExecutionState.initial();
        state.getVariables().put(namespace, Map.of(key, value));
        return state;
    }

    @Test
    public void shouldRouteToFirstMatchingCase() {
        ConditionNodeBehavior behavior = behavior(List.of(
                config("id", "c1", "target", "approved", "conditions",
                        List.of(config("left_var", "score.value", "operator", "greater_than", "right_value", "80"))),
                config("id", "c2", "target", "rejected", "conditions",
                        List.of(config("left_var", "score.value", "operator", "greater_than", "right_value", "10")))
        ), "fallback");

        Assertions.assertEquals("approved", behavior.route(stateWith("score", "value", 95), TARGETS));
        Assertions.assertEquals("rejected", behavior.route(stateWith("score", "value", 50), TARGETS));
        Assertions.assertEquals("fallback", behavior.route(stateWith("score", "value", 5), TARGETS));
    }

    @Test
    public void shouldCombineConditionsWithOrLogic() {
        ConditionNodeBehavior behavior = behavior(List.of(
                config("id", "c1", "target", "approved", "logic", "or", "conditions", List.of(
                        config("left_var", "review.verdict", "operator", "equals", "right_value", "yes"),
                        config("left_var", "review.verdict", "operator", "starts_with", "right_value", "ok")))
        ), "rejected");

        Assertions.assertEquals("approved", behavior.route(stateWith("review", "verdict", "okay"), TARGETS));
        Assertions.assertEquals("rejected", behavior.route(stateWith("review", "verdict", "no"), TARGETS));
    }

    @Test
    public void shouldTreatUnparsableNumbersAsNoMatch() {
        ConditionNodeBehavior behavior = behavior(List.of(
                config("id", "c1", "target", "approved", "conditions",
                        List.of(config("left_var", "score.value", "operator", "less_than", "right_value", "10")))
        ), "rejected");

        Assertions.assertEquals("rejected", behavior.route(stateWith("score", "value", "n/a"), TARGETS));
    }

    @Test
    public void shouldFallBackToLastTargetWithoutDefault() {
        ConditionNodeBehavior behavior = behavior(List.of(), "");

        Assertions.assertEquals("fallback", behavior.route(ExecutionState.initial(), TARGETS));
    }

    @Test
    public void shouldExposeCaseAndDefaultTargetsForCompileCheck() {
        ConditionNodeBehavior behavior = behavior(List.of(
                config("id", "c1", "target", "approved", "conditions", List.of())
        ), "fallback");

        Assertions.assertEquals(Set.of("approved", "fallback"), behavior.referencedTargets());
    }

    @Test
    public void shouldRequireEveryAndConditionAndKeepCaseOrder() {
        List<String> targets = List.of("x1", "x2", "x3");
        ConditionNodeBehavior behavior = behavior(List.of(
                config("id", "x1", "logic", "and", "conditions", List.of(
                        config("left_var", "in.a", "operator", "greater_than", "right_value", "5"),
                        config("left_var", "in.b", "operator", "equals", "right_value", "x"))),
                config("id", "x2", "logic", "or", "conditions", List.of(
                        config("left_var", "in.c", "operator", "equals", "right_value", "y"),
                        config("left_var", "in.d", "operator", "not_equals", "right_value", "")))
        ), "x3");

        Assertions.assertEquals("x1", behavior.route(inputs(Map.of("a", 7, "b", "x")), targets));
        Assertions.assertEquals("x1", behavior.route(inputs(Map.of("a", 7, "b", "x", "c", "y")), targets));
        Assertions.assertEquals("x3", behavior.route(inputs(Map.of("a", 7, "b", "z")), targets));
        Assertions.assertEquals("x3", behavior.route(inputs(Map.of("a", 3, "b", "x")), targets));
        Assertions.assertEquals("x2", behavior.route(inputs(Map.of("a", 7, "b", "z", "d", "q")), targets));
        Assertions.assertEquals("x2", behavior.route(inputs(Map.of("a", 1, "c", "y")), targets));
    }

    private ExecutionState inputs(Map<String, Object> values) {
        ExecutionState state = ExecutionState.initial();
        state.getVariables().put("in", values);
        return state;
    }
}
