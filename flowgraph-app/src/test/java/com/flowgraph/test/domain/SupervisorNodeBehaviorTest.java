package com.flowgraph.test.domain;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.node.service.behavior.SupervisorNodeBehavior;
import com.flowgraph.test.support.NodeContexts;
import com.flowgraph.test.support.ScriptedModelGateway;
import com.flowgraph.types.common.Constants;
import com.flowgraph.types.enums.NodeTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flowgraph.test.support.GraphDefinitions.config;
import static com.flowgraph.test.support.NodeContexts.spec;

public class SupervisorNodeBehaviorTest {

    private static final List<String> TARGETS = List.of("researcher", "writer");

    private SupervisorNodeBehavior behavior(int maxRounds) {
        return new SupervisorNodeBehavior(spec("boss", NodeTypeEnum.SUPERVISOR,
                config("agent_nodes", List.of("researcher", "writer"), "max_rounds", maxRounds)));
    }

    private String decide(String reply) {
        SupervisorNodeBehavior boss = behavior(10);
        StateUpdate update = boss.execute(
                NodeContexts.withModel(boss.getSpec(), ScriptedModelGateway.constant(reply)), ExecutionState.initial());
        return update.getCurrentAgent();
    }

    @Test
    public void shouldResolveAgentFromDecision() {
        Assertions.assertEquals("writer", decide("Writer"));
        Assertions.assertEquals("researcher", decide("I think the researcher should dig deeper"));
        Assertions.assertEquals("researcher", decide("nobody in particular"));
        Assertions.assertEquals(Constants.END, decide("FINISH"));
    }

    @Test
    public void shouldFinishWhenModelFails() {
        SupervisorNodeBehavior boss = behavior(10);
        ScriptedModelGateway failing = new ScriptedModelGateway(request -> {
            throw new IllegalStateException("timeout");
        });

        StateUpdate update = boss.execute(NodeContexts.withModel(boss.getSpec(), failing), ExecutionState.initial());

        Assertions.assertEquals(Constants.END, update.getCurrentAgent());
    }

    @Test
    public void shouldStopAtMaxRoundsWithoutCallingModel() {
        SupervisorNodeBehavior boss = behavior(2);
        ScriptedModelGateway model = ScriptedModelGateway.constant("writer");
        ExecutionState state = ExecutionState.initial();
        state.setIterationCount(2);

        StateUpdate update = boss.execute(NodeContexts.withModel(boss.getSpec(), model), state);

        Assertions.assertEquals(Constants.END, update.getCurrentAgent());
        Assertions.assertTrue(model.getRequests().isEmpty());
    }

    @Test
    public void shouldRouteByCurrentAgent() {
        SupervisorNodeBehavior boss = behavior(10);
        ExecutionState state = ExecutionState.initial();

        state.setCurrentAgent("writer");
        Assertions.assertEquals("writer", boss.route(state, TARGETS));
        state.setCurrentAgent(Constants.END);
        Assertions.assertEquals(Constants.END, boss.route(state, TARGETS));
        state.setCurrentAgent("");
        Assertions.assertEquals(Constants.END, boss.route(state, TARGETS));
    }

    @Test
    public void shouldReportMissingAgents() {
        SupervisorNodeBehavior boss = new SupervisorNodeBehavior(spec("boss", NodeTypeEnum.SUPERVISOR, config()));

        StateUpdate update = boss.execute(NodeContexts.withModel(boss.getSpec(), null), ExecutionState.initial());

        Assertions.assertEquals("", update.getCurrentAgent());
        Assertions.assertEquals("No agents configured", update.getFinalOutput());
    }
}
