package com.flowgraph.domain.graph.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流声明：类型化的节点与边。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSpec {

    @Builder.Default
    private List<NodeSpec> nodes = new ArrayList<>();
    @Builder.Default
    private List<EdgeSpec> edges = new ArrayList<>();

    public NodeSpec findNode(String nodeId) {
        if (nodeId == null || nodes == null) {
            return null;
        }
        for (NodeSpec node : nodes) {
            if (nodeId.equals(node.getId())) {
                return node;
            }
        }
        return null;
    }
}
