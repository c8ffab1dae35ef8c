package com.flowgraph.domain.graph.service;

import com.flowgraph.domain.graph.model.valobj.EdgeSpec;
import com.flowgraph.domain.graph.model.valobj.GraphSpec;
import com.flowgraph.domain.graph.model.valobj.GraphTopology;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.graph.model.valobj.ValidationReport;
import com.flowgraph.types.enums.NodeTypeEnum;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工作流 JSON 解析：节点/边类型化与拓扑分析。
 * <p>
 * 支持编辑器格式 node.data.{id, type, name, group_params} 与扁平格式 {id, type, name, config}。
 * note 节点静默跳过；缺少 id/type 或类型未知的节点、端点不存在的边记录告警后跳过。
 * </p>
 */
@Slf4j
@Service
public class GraphSpecParser {

    private static final String NOTE_TYPE = "note";

    public GraphSpec parse(Map<String, Object> raw) {
        if (raw == null) {
            throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR, "Workflow definition cannot be null");
        }
        List<NodeSpec> nodes = parseNodes(raw.get("nodes"));
        Set<String> nodeIds = new HashSet<>();
        for (NodeSpec node : nodes) {
            nodeIds.add(node.getId());
        }
        List<EdgeSpec> edges = parseEdges(raw.get("edges"), nodeIds);
        return GraphSpec.builder().nodes(nodes).edges(edges).build();
    }

    /**
     * 邻接关系与节点角色。target 保持边的声明顺序。
     */
    public GraphTopology analyze(GraphSpec spec) {
        Map<String, List<String>> targetMap = new LinkedHashMap<>();
        Map<String, List<String>> sourceMap = new LinkedHashMap<>();
        Set<String> backEdgeIds = new LinkedHashSet<>();
        for (EdgeSpec edge : spec.getEdges()) {
            targetMap.computeIfAbsent(edge.getSource(), key -> new ArrayList<>()).add(edge.getTarget());
            sourceMap.computeIfAbsent(edge.getTarget(), key -> new ArrayList<>()).add(edge.getSource());
            if (edge.isBackEdge()) {
                backEdgeIds.add(StringUtils.defaultIfBlank(edge.getId(), edge.getSource() + "->" + edge.getTarget()));
            }
        }

        String entryId = null;
        Set<String> terminalIds = new LinkedHashSet<>();
        Set<String> interruptIds = new LinkedHashSet<>();
        Set<String> routerIds = new LinkedHashSet<>();
        for (NodeSpec node : spec.getNodes()) {
            NodeTypeEnum type = node.getType();
            if (type == NodeTypeEnum.START) {
                entryId = node.getId();
            } else if (type == NodeTypeEnum.END) {
                terminalIds.add(node.getId());
            } else if (type == NodeTypeEnum.HUMAN) {
                interruptIds.add(node.getId());
            }
            if (type.isRouter()) {
                routerIds.add(node.getId());
            }
        }
        return GraphTopology.builder()
                .targetMap(targetMap)
                .sourceMap(sourceMap)
                .entryId(entryId)
                .terminalIds(terminalIds)
                .interruptIds(interruptIds)
                .routerIds(routerIds)
                .backEdgeIds(backEdgeIds)
                .nodeCount(spec.getNodes().size())
                .build();
    }

    /**
     * 不编译、不执行的结构校验。
     */
    public ValidationReport validate(Map<String, Object> raw) {
        ValidationReport report = ValidationReport.builder().build();
        GraphSpec spec;
        try {
            spec = parse(raw);
        } catch (AppException ex) {
            report.getErrors().add(ex.getInfo());
            return report;
        }
        GraphTopology topology = analyze(spec);
        report.setNodeCount(spec.getNodes().size());
        report.setEdgeCount(spec.getEdges().size());

        if (spec.getNodes().isEmpty()) {
            report.getErrors().add("Workflow has no nodes");
        }
        if (topology.getEntryId() == null) {
            report.getErrors().add("Workflow must have a start node");
        }
        if (topology.getTerminalIds().isEmpty()) {
            report.getErrors().add("Workflow must have at least one end node");
        }
        for (NodeSpec node : spec.getNodes()) {
            String nodeId = node.getId();
            boolean hasIncoming = topology.getSourceMap().containsKey(nodeId);
            boolean hasOutgoing = topology.getTargetMap().containsKey(nodeId);
            if (!hasIncoming && !hasOutgoing) {
                report.getWarnings().add("Node " + nodeId + " is disconnected");
            } else if (!hasIncoming && node.getType() != NodeTypeEnum.START) {
                report.getWarnings().add("Node " + nodeId + " is unreachable");
            } else if (!hasOutgoing && node.getType() != NodeTypeEnum.END) {
                report.getWarnings().add("Node " + nodeId + " has no outgoing edge and will end the run");
            }
        }
        for (EdgeSpec edge : spec.getEdges()) {
            if (!edge.isBackEdge()) {
                continue;
            }
            NodeSpec source = spec.findNode(edge.getSource());
            if (source != null && !source.getType().isRouter()) {
                report.getWarnings().add("Back-edge " + edge.getSource() + " -> " + edge.getTarget()
                        + " leaves a non-routing node");
            }
        }
        return report;
    }

    private List<NodeSpec> parseNodes(Object rawNodes) {
        List<NodeSpec> nodes = new ArrayList<>();
        if (!(rawNodes instanceof List<?> items)) {
            return nodes;
        }
        Set<String> seen = new HashSet<>();
        boolean hasStart = false;
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> rawNode)) {
                continue;
            }
            Map<?, ?> data = rawNode.get("data") instanceof Map<?, ?> nested ? nested : rawNode;
            String nodeId = trimToNull(data.get("id"));
            if (nodeId == null) {
                nodeId = trimToNull(rawNode.get("id"));
            }
            String typeCode = trimToNull(data.get("type"));
            if (typeCode == null) {
                typeCode = trimToNull(rawNode.get("type"));
            }
            if (NOTE_TYPE.equalsIgnoreCase(typeCode)) {
                continue;
            }
            if (nodeId == null || typeCode == null) {
                log.warn("Skip node without id or type. nodeId={}, type={}", nodeId, typeCode);
                continue;
            }
            NodeTypeEnum type = NodeTypeEnum.fromCode(typeCode);
            if (type == null) {
                log.warn("Skip node with unknown type. nodeId={}, type={}", nodeId, typeCode);
                continue;
            }
            if (!seen.add(nodeId)) {
                throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR, "Duplicate node id: " + nodeId);
            }
            if (type == NodeTypeEnum.START) {
                if (hasStart) {
                    throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR, "Workflow must have exactly one start node");
                }
                hasStart = true;
            }
            nodes.add(NodeSpec.builder()
                    .id(nodeId)
                    .type(type)
                    .name(trimToNull(data.get("name")))
                    .config(parseConfig(data))
                    .build());
        }
        return nodes;
    }

    /**
     * group_params[].params[].{key, value} 展平；扁平格式直接读取 config。
     */
    private Map<String, Object> parseConfig(Map<?, ?> data) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (data.get("group_params") instanceof List<?> groups) {
            for (Object group : groups) {
                if (!(group instanceof Map<?, ?> groupMap) || !(groupMap.get("params") instanceof List<?> params)) {
                    continue;
                }
                for (Object param : params) {
                    if (param instanceof Map<?, ?> paramMap) {
                        String key = trimToNull(paramMap.get("key"));
                        if (key != null) {
                            config.put(key, paramMap.get("value"));
                        }
                    }
                }
            }
        }
        if (data.get("config") instanceof Map<?, ?> flat) {
            for (Map.Entry<?, ?> entry : flat.entrySet()) {
                if (entry.getKey() != null) {
                    config.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
        }
        return config;
    }

    private List<EdgeSpec> parseEdges(Object rawEdges, Set<String> nodeIds) {
        if (!(rawEdges instanceof List<?> items)) {
            return Collections.emptyList();
        }
        List<EdgeSpec> edges = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> rawEdge)) {
                continue;
            }
            String source = trimToNull(rawEdge.get("source"));
            String target = trimToNull(rawEdge.get("target"));
            if (source == null || target == null || !nodeIds.contains(source) || !nodeIds.contains(target)) {
                log.warn("Skip edge with unknown endpoint. edgeId={}, source={}, target={}",
                        rawEdge.get("id"), source, target);
                continue;
            }
            Map<?, ?> data = rawEdge.get("data") instanceof Map<?, ?> nested ? nested : Collections.emptyMap();
            Object backEdge = data.containsKey("back_edge") ? data.get("back_edge") : rawEdge.get("back_edge");
            Object condition = data.containsKey("condition") ? data.get("condition") : rawEdge.get("condition");
            edges.add(EdgeSpec.builder()
                    .id(trimToNull(rawEdge.get("id")))
                    .source(source)
                    .target(target)
                    .backEdge(Boolean.TRUE.equals(backEdge) || "true".equalsIgnoreCase(String.valueOf(backEdge)))
                    .condition(condition)
                    .build());
        }
        return edges;
    }

    private String trimToNull(Object value) {
        return value == null ? null : StringUtils.trimToNull(String.valueOf(value));
    }
}
