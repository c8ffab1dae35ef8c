package com.flowgraph.domain.execution.service;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 状态字段合并函数。
 * <p>
 * 每个字段一个具名合并函数，执行引擎在每次节点调用后通过 {@link #apply} 统一应用。
 * 所有函数不修改入参，返回新的容器。
 * </p>
 */
public final class StateReducers {

    private StateReducers() {
    }

    public static ExecutionState apply(ExecutionState state, StateUpdate update) {
        ExecutionState current = state == null ? ExecutionState.initial() : state;
        ExecutionState merged = current.copy();
        if (update == null || update.isEmpty()) {
            return merged;
        }
        merged.setMessages(mergeMessages(current.getMessages(), update.getMessages()));
        merged.setVariables(mergeVariables(current.getVariables(), update.getVariables()));
        merged.setCurrentAgent(replace(current.getCurrentAgent(), update.getCurrentAgent()));
        merged.setIterationCount(addIterations(current.getIterationCount(), update.getIterationCount()));
        merged.setIntermediateResults(appendResults(current.getIntermediateResults(), update.getIntermediateResults()));
        merged.setHumanFeedback(update.isClearHumanFeedback()
                ? null
                : replace(current.getHumanFeedback(), update.getHumanFeedback()));
        merged.setFinalOutput(replace(current.getFinalOutput(), update.getFinalOutput()));
        merged.setMetadata(mergeMetadata(current.getMetadata(), update.getMetadata()));
        return merged;
    }

    /**
     * 按 id 合并：已存在的 id 原位替换，其余按顺序追加。缺少 id 的消息分配新 id。
     */
    public static List<ChatMessage> mergeMessages(List<ChatMessage> left, List<ChatMessage> right) {
        List<ChatMessage> merged = left == null ? new ArrayList<>() : new ArrayList<>(left);
        if (right == null || right.isEmpty()) {
            return merged;
        }
        Map<String, Integer> indexById = new LinkedHashMap<>();
        for (int i = 0; i < merged.size(); i++) {
            ChatMessage message = merged.get(i);
            if (message != null && message.getId() != null) {
                indexById.put(message.getId(), i);
            }
        }
        for (ChatMessage message : right) {
            if (message == null) {
                continue;
            }
            if (message.getId() == null) {
                message = ChatMessage.builder()
                        .id(UUID.randomUUID().toString())
                        .role(message.getRole())
                        .content(message.getContent())
                        .name(message.getName())
                        .build();
            }
            Integer existing = indexById.get(message.getId());
            if (existing != null) {
                merged.set(existing, message);
            } else {
                indexById.put(message.getId(), merged.size());
                merged.add(message);
            }
        }
        return merged;
    }

    /**
     * 按节点命名空间覆盖：更新中出现的命名空间整体替换，其余命名空间不受影响。
     */
    public static Map<String, Object> mergeVariables(Map<String, Object> left, Map<String, Object> right) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (left != null) {
            merged.putAll(left);
        }
        if (right == null || right.isEmpty()) {
            return merged;
        }
        for (Map.Entry<String, Object> entry : right.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> namespace) {
                merged.put(entry.getKey(), new LinkedHashMap<>(namespace));
            } else {
                merged.put(entry.getKey(), value);
            }
        }
        return merged;
    }

    public static int addIterations(int left, Integer right) {
        return right == null ? left : left + right;
    }

    public static List<Object> appendResults(List<Object> left, List<Object> right) {
        List<Object> merged = left == null ? new ArrayList<>() : new ArrayList<>(left);
        if (right != null) {
            merged.addAll(right);
        }
        return merged;
    }

    /**
     * 浅合并，右侧覆盖左侧同名键。
     */
    public static Map<String, Object> mergeMetadata(Map<String, Object> left, Map<String, Object> right) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (left != null) {
            merged.putAll(left);
        }
        if (right != null) {
            merged.putAll(right);
        }
        return merged;
    }

    public static String replace(String left, String right) {
        return right == null ? left : right;
    }
}
