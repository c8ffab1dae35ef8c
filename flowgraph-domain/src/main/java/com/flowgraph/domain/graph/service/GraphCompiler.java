package com.flowgraph.domain.graph.service;

import com.flowgraph.domain.execution.model.valobj.EngineSettings;
import com.flowgraph.domain.graph.model.aggregate.CompiledGraph;
import com.flowgraph.domain.graph.model.valobj.GraphSpec;
import com.flowgraph.domain.graph.model.valobj.GraphTopology;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.NodeBehavior;
import com.flowgraph.domain.node.service.NodeBehaviorRegistry;
import com.flowgraph.types.common.Constants;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.exception.AppException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 图编译：实例化节点行为、建立路由表、计算步数上限。
 * <p>
 * 步数上限：存在回边时 max(节点数 × maxSteps, 50)，否则 max(节点数 × 3, 50)。
 * 终止节点固定连到 END；路由节点的路由表为其声明的 target 加 END。
 * </p>
 */
@Slf4j
@Service
public class GraphCompiler {

    private final GraphSpecParser graphSpecParser;
    private final NodeBehaviorRegistry nodeBehaviorRegistry;
    private final EngineSettings engineSettings;

    public GraphCompiler(GraphSpecParser graphSpecParser,
                         NodeBehaviorRegistry nodeBehaviorRegistry,
                         EngineSettings engineSettings) {
        this.graphSpecParser = graphSpecParser;
        this.nodeBehaviorRegistry = nodeBehaviorRegistry;
        this.engineSettings = engineSettings;
    }

    public CompiledGraph compile(String workflowId, Map<String, Object> definition) {
        return compile(workflowId, graphSpecParser.parse(definition));
    }

    public CompiledGraph compile(String workflowId, GraphSpec spec) {
        GraphTopology topology = graphSpecParser.analyze(spec);
        if (topology.getEntryId() == null) {
            throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR, "Workflow must have a start node");
        }
        if (topology.getTerminalIds().isEmpty()) {
            throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR, "Workflow must have at least one end node");
        }

        ImmutableMap.Builder<String, NodeBehavior> behaviors = ImmutableMap.builder();
        ImmutableMap.Builder<String, ImmutableList<String>> targetMap = ImmutableMap.builder();
        ImmutableMap.Builder<String, ImmutableMap<String, String>> routeMaps = ImmutableMap.builder();
        ImmutableMap.Builder<String, String> staticEdges = ImmutableMap.builder();

        for (NodeSpec node : spec.getNodes()) {
            String nodeId = node.getId();
            NodeBehavior behavior = nodeBehaviorRegistry.create(node);
            behaviors.put(nodeId, behavior);
            List<String> targets = topology.getTargetMap().getOrDefault(nodeId, Collections.emptyList());
            targetMap.put(nodeId, ImmutableList.copyOf(targets));

            if (topology.getTerminalIds().contains(nodeId)) {
                staticEdges.put(nodeId, Constants.END);
                continue;
            }
            if (topology.getRouterIds().contains(nodeId)) {
                for (String referenced : behavior.referencedTargets()) {
                    if (!targets.contains(referenced)) {
                        throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR,
                                "Node " + nodeId + " references undeclared target: " + referenced);
                    }
                }
                Map<String, String> routeMap = new LinkedHashMap<>();
                for (String target : targets) {
                    routeMap.put(target, target);
                }
                routeMap.put(Constants.END, Constants.END);
                routeMaps.put(nodeId, ImmutableMap.copyOf(routeMap));
                continue;
            }
            if (targets.size() > 1) {
                log.warn("Node has several targets without routing, take the first. workflowId={}, nodeId={}, targets={}",
                        workflowId, nodeId, targets);
            }
            staticEdges.put(nodeId, targets.isEmpty() ? Constants.END : targets.get(0));
        }

        int nodeCount = spec.getNodes().size();
        int perNode = topology.hasBackEdge() ? engineSettings.getMaxSteps() : engineSettings.getAcyclicStepsPerNode();
        int stepBound = Math.max(nodeCount * perNode, EngineSettings.MIN_STEP_BOUND);

        log.info("Workflow compiled. workflowId={}, nodeCount={}, edgeCount={}, hasBackEdge={}, stepBound={}",
                workflowId, nodeCount, spec.getEdges().size(), topology.hasBackEdge(), stepBound);
        return CompiledGraph.builder()
                .workflowId(workflowId)
                .behaviors(behaviors.build())
                .targetMap(targetMap.build())
                .entryId(topology.getEntryId())
                .terminalIds(ImmutableSet.copyOf(topology.getTerminalIds()))
                .interruptIds(ImmutableSet.copyOf(topology.getInterruptIds()))
                .routeMaps(routeMaps.build())
                .staticEdges(staticEdges.build())
                .stepBound(stepBound)
                .hasBackEdge(topology.hasBackEdge())
                .build();
    }
}
