package com.flowgraph.domain.execution.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 节点返回的部分状态更新。
 * <p>
 * 字段为 null 表示不更新该字段。iterationCount 为增量而非绝对值。
 * humanFeedback 需要清空时设置 clearHumanFeedback。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateUpdate {

    private List<ChatMessage> messages;
    private Map<String, Object> variables;
    private String currentAgent;
    private Integer iterationCount;
    private List<Object> intermediateResults;
    private String humanFeedback;
    private boolean clearHumanFeedback;
    private String finalOutput;
    private Map<String, Object> metadata;

    public static StateUpdate empty() {
        return new StateUpdate();
    }

    /**
     * 仅写入单个节点命名空间的更新。
     */
    public static StateUpdate namespace(String nodeId, Map<String, Object> values) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put(nodeId, values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values));
        return StateUpdate.builder().variables(variables).build();
    }

    /**
     * 仅写入单个变量的更新。
     */
    public static StateUpdate variable(String nodeId, String key, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(key, value);
        return namespace(nodeId, values);
    }

    public boolean isEmpty() {
        return messages == null && variables == null && currentAgent == null && iterationCount == null
                && intermediateResults == null && humanFeedback == null && !clearHumanFeedback
                && finalOutput == null && metadata == null;
    }
}
