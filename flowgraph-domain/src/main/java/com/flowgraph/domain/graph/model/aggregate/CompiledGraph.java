package com.flowgraph.domain.graph.model.aggregate;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.node.service.NodeBehavior;
import com.flowgraph.types.common.Constants;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.exception.AppException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 编译后的可执行图，不可变，可在多次运行间复用。
 * <p>
 * 路由节点的决策必须落在 routeMaps 中（声明的 target 与 END），否则抛出 ROUTING_ERROR；
 * 普通节点沿 staticEdges 前进，没有出边时结束。
 * </p>
 */
@Getter
@Builder
public class CompiledGraph {

    private final String workflowId;
    private final ImmutableMap<String, NodeBehavior> behaviors;
    private final ImmutableMap<String, ImmutableList<String>> targetMap;
    private final String entryId;
    private final ImmutableSet<String> terminalIds;
    private final ImmutableSet<String> interruptIds;
    private final ImmutableMap<String, ImmutableMap<String, String>> routeMaps;
    private final ImmutableMap<String, String> staticEdges;
    private final int stepBound;
    private final boolean hasBackEdge;

    public NodeBehavior getBehavior(String nodeId) {
        return behaviors.get(nodeId);
    }

    public boolean isInterrupt(String nodeId) {
        return interruptIds.contains(nodeId);
    }

    public List<String> targetsOf(String nodeId) {
        ImmutableList<String> targets = targetMap.get(nodeId);
        return targets == null ? ImmutableList.of() : targets;
    }

    /**
     * 节点执行并合并状态后，计算下一个节点。
     */
    public String resolveNext(String nodeId, ExecutionState state) {
        Map<String, String> routeMap = routeMaps.get(nodeId);
        if (routeMap != null) {
            String decision = behaviors.get(nodeId).route(state, targetsOf(nodeId));
            String next = decision == null ? null : routeMap.get(decision);
            if (next == null) {
                throw new AppException(ResponseCode.ROUTING_ERROR,
                        "Node " + nodeId + " routed to undeclared target: " + decision);
            }
            return next;
        }
        return staticEdges.getOrDefault(nodeId, Constants.END);
    }
}
