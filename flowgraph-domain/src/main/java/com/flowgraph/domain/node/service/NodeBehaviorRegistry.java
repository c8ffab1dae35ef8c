package com.flowgraph.domain.node.service;

import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.behavior.AgentNodeBehavior;
import com.flowgraph.domain.node.service.behavior.CodeNodeBehavior;
import com.flowgraph.domain.node.service.behavior.ConditionNodeBehavior;
import com.flowgraph.domain.node.service.behavior.EndNodeBehavior;
import com.flowgraph.domain.node.service.behavior.HumanNodeBehavior;
import com.flowgraph.domain.node.service.behavior.LlmNodeBehavior;
import com.flowgraph.domain.node.service.behavior.LoopNodeBehavior;
import com.flowgraph.domain.node.service.behavior.MapReduceNodeBehavior;
import com.flowgraph.domain.node.service.behavior.ReflectionNodeBehavior;
import com.flowgraph.domain.node.service.behavior.StartNodeBehavior;
import com.flowgraph.domain.node.service.behavior.SubgraphNodeBehavior;
import com.flowgraph.domain.node.service.behavior.SupervisorNodeBehavior;
import com.flowgraph.domain.node.service.behavior.ToolNodeBehavior;
import com.flowgraph.types.enums.NodeTypeEnum;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.exception.AppException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 节点类型 → 行为工厂注册表。
 */
@Component
public class NodeBehaviorRegistry {

    private final Map<NodeTypeEnum, Function<NodeSpec, NodeBehavior>> factories = new EnumMap<>(NodeTypeEnum.class);
    private final Map<NodeTypeEnum, List<String>> configKeys = new EnumMap<>(NodeTypeEnum.class);

    public NodeBehaviorRegistry() {
        register(NodeTypeEnum.START, StartNodeBehavior::new, List.of("current_time"));
        register(NodeTypeEnum.END, EndNodeBehavior::new, List.of("output_variable"));
        register(NodeTypeEnum.CONDITION, ConditionNodeBehavior::new, List.of("cases", "default_target"));
        register(NodeTypeEnum.LOOP, LoopNodeBehavior::new,
                List.of("max_iterations", "exit_condition", "exit_value", "loop_target", "exit_target"));
        register(NodeTypeEnum.REFLECTION, ReflectionNodeBehavior::new,
                List.of("model_id", "evaluation_prompt", "input_variable", "quality_threshold",
                        "max_reflections", "retry_target", "accept_target", "output_key"));
        register(NodeTypeEnum.SUPERVISOR, SupervisorNodeBehavior::new,
                List.of("model_id", "agent_nodes", "system_prompt", "max_rounds"));
        register(NodeTypeEnum.HUMAN, HumanNodeBehavior::new, List.of("interaction_type", "prompt", "output_key"));
        register(NodeTypeEnum.MAP_REDUCE, MapReduceNodeBehavior::new,
                List.of("input_variable", "map_prompt", "reduce_prompt", "model_id", "max_concurrency",
                        "temperature", "output_key", "fail_fast"));
        register(NodeTypeEnum.SUBGRAPH, SubgraphNodeBehavior::new,
                List.of("sub_workflow_id", "input_mapping", "output_mapping", "output_key"));
        register(NodeTypeEnum.AGENT, AgentNodeBehavior::new,
                List.of("model_id", "system_prompt", "user_input", "tool_ids", "max_iterations", "temperature", "output_key"));
        register(NodeTypeEnum.LLM, LlmNodeBehavior::new,
                List.of("model_id", "temperature", "system_prompt", "user_prompt", "output_key"));
        register(NodeTypeEnum.TOOL, ToolNodeBehavior::new, List.of("tool_id", "tool_input", "output_key"));
        register(NodeTypeEnum.CODE, CodeNodeBehavior::new, List.of("code", "code_input", "output_key"));
    }

    private void register(NodeTypeEnum type, Function<NodeSpec, NodeBehavior> factory, List<String> keys) {
        factories.put(type, factory);
        configKeys.put(type, keys);
    }

    public boolean isSupported(NodeTypeEnum type) {
        return type != null && factories.containsKey(type);
    }

    public NodeBehavior create(NodeSpec spec) {
        if (spec == null || !isSupported(spec.getType())) {
            throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR,
                    "Unsupported node type: " + (spec == null ? null : spec.getType()));
        }
        return factories.get(spec.getType()).apply(spec);
    }

    /**
     * 节点类型目录，供编辑器展示。
     */
    public List<Map<String, Object>> catalog() {
        List<Map<String, Object>> catalog = new ArrayList<>();
        for (Map.Entry<NodeTypeEnum, List<String>> entry : configKeys.entrySet()) {
            NodeTypeEnum type = entry.getKey();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", type.getCode());
            item.put("label", type.getLabel());
            item.put("router", type.isRouter());
            item.put("interrupt", type == NodeTypeEnum.HUMAN);
            item.put("configKeys", entry.getValue());
            catalog.add(item);
        }
        return catalog;
    }
}
