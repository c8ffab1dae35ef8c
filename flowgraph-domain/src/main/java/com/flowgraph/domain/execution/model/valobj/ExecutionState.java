package com.flowgraph.domain.execution.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流执行状态。
 * <p>
 * 所有节点共享的状态容器。节点不直接修改状态，而是返回 {@link StateUpdate}，
 * 由执行引擎通过 StateReducers 逐字段合并：
 * <ul>
 *   <li>messages：按 id 去重追加</li>
 *   <li>variables：nodeId → 命名空间，按命名空间整体覆盖</li>
 *   <li>currentAgent：覆盖</li>
 *   <li>iterationCount：累加</li>
 *   <li>intermediateResults：追加</li>
 *   <li>humanFeedback：覆盖或显式清空</li>
 *   <li>finalOutput：覆盖</li>
 *   <li>metadata：浅合并</li>
 * </ul>
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionState {

    /** 对话消息 */
    private List<ChatMessage> messages = new ArrayList<>();

    /** 节点变量，nodeId → (key → value) */
    private Map<String, Object> variables = new LinkedHashMap<>();

    /** 当前活跃 Agent */
    private String currentAgent = "";

    /** 共享迭代计数，循环/反思/调度节点共用 */
    private int iterationCount;

    /** Map-Reduce 中间结果 */
    private List<Object> intermediateResults = new ArrayList<>();

    /** 外部注入的人工反馈 */
    private String humanFeedback;

    /** 最终输出 */
    private String finalOutput;

    /** 运行元数据 */
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * 默认初始状态。
     */
    public static ExecutionState initial() {
        return new ExecutionState();
    }

    /**
     * 复制集合容器，命名空间内的 Map 同样复制一层。
     */
    public ExecutionState copy() {
        ExecutionState copy = new ExecutionState();
        copy.setMessages(messages == null ? new ArrayList<>() : new ArrayList<>(messages));
        Map<String, Object> copiedVariables = new LinkedHashMap<>();
        if (variables != null) {
            for (Map.Entry<String, Object> entry : variables.entrySet()) {
                Object value = entry.getValue();
                if (value instanceof Map<?, ?> namespace) {
                    copiedVariables.put(entry.getKey(), new LinkedHashMap<>(namespace));
                } else {
                    copiedVariables.put(entry.getKey(), value);
                }
            }
        }
        copy.setVariables(copiedVariables);
        copy.setCurrentAgent(currentAgent);
        copy.setIterationCount(iterationCount);
        copy.setIntermediateResults(intermediateResults == null ? new ArrayList<>() : new ArrayList<>(intermediateResults));
        copy.setHumanFeedback(humanFeedback);
        copy.setFinalOutput(finalOutput);
        copy.setMetadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
        return copy;
    }

    /**
     * 最后一条消息，无消息时返回 null。
     */
    public ChatMessage lastMessage() {
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        return messages.get(messages.size() - 1);
    }

    /**
     * 最近 limit 条消息。
     */
    public List<ChatMessage> recentMessages(int limit) {
        if (messages == null || messages.isEmpty() || limit <= 0) {
            return new ArrayList<>();
        }
        int from = Math.max(messages.size() - limit, 0);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }

    /**
     * 按 nodeId.key 或裸命名空间读取变量。
     */
    public Object resolveVariable(String reference) {
        if (reference == null || reference.isBlank() || variables == null) {
            return null;
        }
        String ref = reference.trim();
        int separator = ref.indexOf('.');
        if (separator < 0) {
            return variables.get(ref);
        }
        Object namespace = variables.get(ref.substring(0, separator));
        if (namespace instanceof Map<?, ?> values) {
            return values.get(ref.substring(separator + 1));
        }
        return null;
    }
}
