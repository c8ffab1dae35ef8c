package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.adapter.gateway.IModelGateway;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-Reduce 节点：对列表变量逐项并发调用模型，再把结果汇总为一次 reduce 调用。
 * <p>
 * 并发度为 min(max_concurrency, items)。map 结果按输入顺序排列，与完成顺序无关。
 * fail_fast=false 时单项失败记为 "Error: message"；fail_fast=true 时直接抛出。
 * </p>
 */
@Slf4j
public class MapReduceNodeBehavior extends AbstractNodeBehavior {

    public static final int DEFAULT_MAX_CONCURRENCY = 5;
    public static final String DEFAULT_MAP_PROMPT = "Process this item: {{item}}";
    public static final String DEFAULT_REDUCE_PROMPT = "Summarize these results:\n{{results}}";

    public MapReduceNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "output");
        List<Object> items = resolveItems(state);
        if (items.isEmpty()) {
            return setVariable(outputKey, "No items to process");
        }

        IModelGateway models = context.models();
        List<String> mapResults = mapItems(models, state, items);

        StringBuilder resultsText = new StringBuilder();
        for (int i = 0; i < mapResults.size(); i++) {
            String result = mapResults.get(i);
            if (StringUtils.isEmpty(result)) {
                continue;
            }
            if (resultsText.length() > 0) {
                resultsText.append("\n---\n");
            }
            resultsText.append('[').append(i + 1).append("] ").append(result);
        }
        String reducePrompt = configString("reduce_prompt", DEFAULT_REDUCE_PROMPT)
                .replace("{{results}}", resultsText.toString());
        reducePrompt = resolveTemplate(reducePrompt, state);

        String finalResult;
        try {
            finalResult = models.chat(request(reducePrompt));
        } catch (RuntimeException ex) {
            log.error("Map-reduce reduce phase failed. nodeId={}, error={}", getId(), ex.getMessage());
            if (configBoolean("fail_fast", false)) {
                throw ex;
            }
            finalResult = "Reduce error: " + ex.getMessage();
        }

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(outputKey, finalResult);
        values.put("map_results", new ArrayList<>(mapResults));
        StateUpdate update = StateUpdate.namespace(getId(), values);
        update.setMessages(List.of(ChatMessage.ai(finalResult)));
        update.setIntermediateResults(new ArrayList<>(mapResults));
        return update;
    }

    private List<Object> resolveItems(ExecutionState state) {
        String inputVariable = configString("input_variable", "");
        List<Object> items = new ArrayList<>();
        if (StringUtils.isBlank(inputVariable)) {
            return items;
        }
        Object value = getVariable(state, inputVariable);
        if (value instanceof List<?> list) {
            items.addAll(list);
        } else if (value instanceof String text) {
            for (String line : text.split("\n")) {
                if (StringUtils.isNotBlank(line)) {
                    items.add(line.trim());
                }
            }
        } else if (value != null) {
            items.add(value);
        }
        return items;
    }

    private List<String> mapItems(IModelGateway models, ExecutionState state, List<Object> items) {
        int poolSize = Math.max(1, Math.min(configInt("max_concurrency", DEFAULT_MAX_CONCURRENCY), items.size()));
        boolean failFast = configBoolean("fail_fast", false);
        String mapPrompt = configString("map_prompt", DEFAULT_MAP_PROMPT);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            List<Future<String>> futures = new ArrayList<>(items.size());
            for (Object item : items) {
                String prompt = resolveTemplate(mapPrompt.replace("{{item}}", stringify(item)), state);
                futures.add(executor.submit(() -> mapOne(models, prompt, failFast)));
            }
            List<String> results = new ArrayList<>(items.size());
            for (Future<String> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private String mapOne(IModelGateway models, String prompt, boolean failFast) {
        try {
            return models.chat(request(prompt));
        } catch (RuntimeException ex) {
            if (failFast) {
                throw ex;
            }
            log.warn("Map-reduce item failed. nodeId={}, error={}", getId(), ex.getMessage());
            return "Error: " + ex.getMessage();
        }
    }

    private String await(Future<String> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Map-reduce interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private ModelRequest request(String prompt) {
        return ModelRequest.builder()
                .modelId(configString("model_id", null))
                .messages(List.of(ChatMessage.human(prompt)))
                .temperature(configDouble("temperature", 0.7))
                .build();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger index = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("map-reduce-worker-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
