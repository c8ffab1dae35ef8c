package com.flowgraph.test.domain;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.execution.service.StateReducers;
import com.flowgraph.domain.node.service.behavior.MapReduceNodeBehavior;
import com.flowgraph.test.support.NodeContexts;
import com.flowgraph.test.support.ScriptedModelGateway;
import com.flowgraph.types.enums.NodeTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flowgraph.test.support.GraphDefinitions.config;
import static com.flowgraph.test.support.NodeContexts.spec;

public class MapReduceNodeBehaviorTest {

    private ExecutionState itemsState(Object items) {
        ExecutionState state = ExecutionState.initial();
        state.getVariables().put("input", Map.of("items", items));
        return state;
    }

    private MapReduceNodeBehavior behavior(boolean failFast) {
        return new MapReduceNodeBehavior(spec("summarize", NodeTypeEnum.MAP_REDUCE,
                config("input_variable", "input.items", "map_prompt", "Map {{item}}",
                        "max_concurrency", 3, "output_key", "summary", "fail_fast", failFast)));
    }

    @Test
    public void shouldKeepInputOrderRegardlessOfCompletion() {
        ScriptedModelGateway model = new ScriptedModelGateway(request -> {
            String prompt = ScriptedModelGateway.lastContent(request);
            if (prompt.equals("Map a")) {
                sleep(150);
            }
            return prompt.startsWith("Map ") ? prompt.substring(4).toUpperCase() : "reduced";
        });
        MapReduceNodeBehavior node = behavior(false);
        ExecutionState state = itemsState(List.of("a", "b", "c"));

        ExecutionState next = StateReducers.apply(state,
                node.execute(NodeContexts.withModel(node.getSpec(), model), state));

        Assertions.assertEquals(List.of("A", "B", "C"), next.resolveVariable("summarize.map_results"));
        Assertions.assertEquals("reduced", next.resolveVariable("summarize.summary"));
        Assertions.assertEquals(List.of("A", "B", "C"), next.getIntermediateResults());
        String reducePrompt = ScriptedModelGateway.lastContent(model.getRequests().get(model.getRequests().size() - 1));
        Assertions.assertTrue(reducePrompt.contains("[1] A\n---\n[2] B\n---\n[3] C"));
    }

    @Test
    public void shouldBoundMapWorkersByMaxConcurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<String> workerNames = ConcurrentHashMap.newKeySet();
        ScriptedModelGateway model = new ScriptedModelGateway(request -> {
            String prompt = ScriptedModelGateway.lastContent(request);
            if (!prompt.startsWith("Map ")) {
                return "reduced";
            }
            workerNames.add(Thread.currentThread().getName());
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                sleep(100);
                return prompt.substring(4);
            } finally {
                inFlight.decrementAndGet();
            }
        });
        MapReduceNodeBehavior node = new MapReduceNodeBehavior(spec("summarize", NodeTypeEnum.MAP_REDUCE,
                config("input_variable", "input.items", "map_prompt", "Map {{item}}", "max_concurrency", 2)));
        ExecutionState state = itemsState(List.of("a", "b", "c"));

        ExecutionState next = StateReducers.apply(state,
                node.execute(NodeContexts.withModel(node.getSpec(), model), state));

        Assertions.assertTrue(peak.get() <= 2, "peak=" + peak.get());
        Assertions.assertTrue(peak.get() >= 1);
        Assertions.assertEquals(List.of("a", "b", "c"), next.resolveVariable("summarize.map_results"));
        Assertions.assertTrue(workerNames.size() <= 2, "workers=" + workerNames);
        Assertions.assertTrue(workerNames.stream().allMatch(name -> name.startsWith("map-reduce-worker-")));
    }

    @Test
    public void shouldRecordItemErrorsWhenNotFailFast() {
        ScriptedModelGateway model = new ScriptedModelGateway(request -> {
            String prompt = ScriptedModelGateway.lastContent(request);
            if (prompt.equals("Map bad")) {
                throw new IllegalStateException("boom");
            }
            return "ok";
        });
        MapReduceNodeBehavior node = behavior(false);
        ExecutionState state = itemsState(List.of("good", "bad"));

        ExecutionState next = StateReducers.apply(state,
                node.execute(NodeContexts.withModel(node.getSpec(), model), state));

        Assertions.assertEquals(List.of("ok", "Error: boom"), next.resolveVariable("summarize.map_results"));
    }

    @Test
    public void shouldPropagateItemErrorsWhenFailFast() {
        ScriptedModelGateway model = new ScriptedModelGateway(request -> {
            throw new IllegalStateException("boom");
        });
        MapReduceNodeBehavior node = behavior(true);
        ExecutionState state = itemsState(List.of("x"));

        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                () -> node.execute(NodeContexts.withModel(node.getSpec(), model), state));
        Assertions.assertEquals("boom", ex.getMessage());
    }

    @Test
    public void shouldSplitTextInputIntoLines() {
        ScriptedModelGateway model = ScriptedModelGateway.echo();
        MapReduceNodeBehavior node = behavior(false);
        ExecutionState state = itemsState("first\n\n second \n");

        StateUpdate update = node.execute(NodeContexts.withModel(node.getSpec(), model), state);

        Assertions.assertEquals(List.of("reply:Map first", "reply:Map second"), update.getIntermediateResults());
    }

    @Test
    public void shouldShortCircuitWithoutItems() {
        ScriptedModelGateway model = ScriptedModelGateway.echo();
        MapReduceNodeBehavior node = behavior(false);
        ExecutionState state = itemsState(List.of());

        ExecutionState next = StateReducers.apply(state,
                node.execute(NodeContexts.withModel(node.getSpec(), model), state));

        Assertions.assertEquals("No items to process", next.resolveVariable("summarize.summary"));
        Assertions.assertTrue(model.getRequests().isEmpty());
    }

    private static void sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
