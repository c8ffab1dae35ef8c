package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 循环控制节点。
 * <p>
 * 每次访问迭代计数加一；计数达到 max_iterations 或 exit_condition 变量等于 exit_value 时
 * 路由到 exit_target，否则路由回 loop_target。
 * </p>
 */
@Slf4j
public class LoopNodeBehavior extends AbstractNodeBehavior {

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public LoopNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        StateUpdate update = setVariable("current_iteration", state.getIterationCount() + 1);
        update.setIterationCount(1);
        return update;
    }

    @Override
    public String route(ExecutionState state, List<String> targets) {
        int maxIterations = configInt("max_iterations", DEFAULT_MAX_ITERATIONS);
        String exitTarget = declaredOr(configString("exit_target", ""), targets, lastTarget(targets));
        if (state.getIterationCount() >= maxIterations) {
            log.info("Loop reached max iterations. nodeId={}, maxIterations={}", getId(), maxIterations);
            return exitTarget;
        }
        String exitCondition = configString("exit_condition", "");
        if (StringUtils.isNotBlank(exitCondition)) {
            Object value = getVariable(state, exitCondition);
            if (stringify(value).equals(configString("exit_value", "true"))) {
                return exitTarget;
            }
        }
        return declaredOr(configString("loop_target", ""), targets, firstTarget(targets));
    }

    @Override
    public Set<String> referencedTargets() {
        Set<String> referenced = new LinkedHashSet<>();
        addIfPresent(referenced, configString("loop_target", ""));
        addIfPresent(referenced, configString("exit_target", ""));
        return referenced;
    }

    private void addIfPresent(Set<String> referenced, String target) {
        if (StringUtils.isNotBlank(target)) {
            referenced.add(target);
        }
    }
}
