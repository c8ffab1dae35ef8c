package com.flowgraph.test.support;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用工作流定义构造器，产出与前端画布一致的 nodes/edges 结构。
 */
public class GraphDefinitions {

    private final List<Map<String, Object>> nodes = new ArrayList<>();
    private final List<Map<String, Object>> edges = new ArrayList<>();

    public static GraphDefinitions graph() {
        return new GraphDefinitions();
    }

    public GraphDefinitions node(String id, String type) {
        return node(id, type, new LinkedHashMap<>());
    }

    public GraphDefinitions node(String id, String type, Map<String, Object> config) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", id);
        data.put("type", type);
        data.put("name", id);
        data.put("config", new LinkedHashMap<>(config));
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", id);
        node.put("data", data);
        nodes.add(node);
        return this;
    }

    public GraphDefinitions edge(String source, String target) {
        Map<String, Object> edge = new LinkedHashMap<>();
        edge.put("id", source + "-" + target);
        edge.put("source", source);
        edge.put("target", target);
        edges.add(edge);
        return this;
    }

    public GraphDefinitions backEdge(String source, String target) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("back_edge", true);
        Map<String, Object> edge = new LinkedHashMap<>();
        edge.put("id", source + "-" + target);
        edge.put("source", source);
        edge.put("target", target);
        edge.put("data", data);
        edges.add(edge);
        return this;
    }

    public Map<String, Object> build() {
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("nodes", new ArrayList<>(nodes));
        definition.put("edges", new ArrayList<>(edges));
        return definition;
    }

    public static Map<String, Object> config(Object... keyValues) {
        Map<String, Object> config = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            config.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return config;
    }
}
