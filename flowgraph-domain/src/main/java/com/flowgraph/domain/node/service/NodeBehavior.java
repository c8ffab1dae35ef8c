package com.flowgraph.domain.node.service;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.types.common.Constants;
import com.flowgraph.types.enums.NodeTypeEnum;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点行为契约。
 * <p>
 * execute 读取状态并返回部分更新，不得直接修改状态。
 * route 仅对路由型节点生效，返回值必须是已声明的 target 或 {@link Constants#END}。
 * </p>
 */
public interface NodeBehavior {

    NodeSpec getSpec();

    default String getId() {
        return getSpec().getId();
    }

    default String getName() {
        return getSpec().displayName();
    }

    default NodeTypeEnum getType() {
        return getSpec().getType();
    }

    StateUpdate execute(NodeContext context, ExecutionState state);

    /**
     * 默认路由到第一个声明的 target，没有 target 时结束。
     */
    default String route(ExecutionState state, List<String> targets) {
        if (targets == null || targets.isEmpty()) {
            return Constants.END;
        }
        return targets.get(0);
    }

    /**
     * 配置中显式引用的路由目标，编译期校验必须是已声明的 target。
     */
    default Set<String> referencedTargets() {
        return Collections.emptySet();
    }

    /**
     * 中断前发给调用方的交互请求。
     */
    default Map<String, Object> interruptRequest(ExecutionState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node_name", getName());
        return payload;
    }

}
