package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * 条件分支节点，纯路由，不修改状态。
 * <p>
 * 按顺序评估 cases，每个 case 的 conditions 以 and/or 组合，第一个完全匹配的 case
 * 路由到其目标（case.target，缺省为 case.id，必须与已声明 target 完全相等）。
 * 都不匹配时路由到 default_target，未声明则取最后一个 target。
 * </p>
 */
@Slf4j
public class ConditionNodeBehavior extends AbstractNodeBehavior {

    public ConditionNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        return StateUpdate.empty();
    }

    @Override
    public String route(ExecutionState state, List<String> targets) {
        for (Object caseObj : configList("cases")) {
            if (!(caseObj instanceof Map<?, ?> conditionCase)) {
                continue;
            }
            Object conditionsObj = conditionCase.get("conditions");
            if (!(conditionsObj instanceof List<?> conditions) || conditions.isEmpty()) {
                continue;
            }
            String logic = StringUtils.defaultIfBlank(stringify(conditionCase.get("logic")), "and");
            if (!matches(state, conditions, logic)) {
                continue;
            }
            String caseTarget = resolveCaseTarget(conditionCase);
            if (targets.contains(caseTarget)) {
                return caseTarget;
            }
            log.warn("Condition case matched but target is not declared. nodeId={}, caseTarget={}, targets={}",
                    getId(), caseTarget, targets);
        }
        String defaultTarget = configString("default_target", "");
        return declaredOr(defaultTarget, targets, lastTarget(targets));
    }

    @Override
    public Set<String> referencedTargets() {
        Set<String> referenced = new LinkedHashSet<>();
        String defaultTarget = configString("default_target", "");
        if (StringUtils.isNotBlank(defaultTarget)) {
            referenced.add(defaultTarget);
        }
        for (Object caseObj : configList("cases")) {
            if (caseObj instanceof Map<?, ?> conditionCase) {
                String explicit = stringify(conditionCase.get("target"));
                if (StringUtils.isNotBlank(explicit)) {
                    referenced.add(explicit.trim());
                }
            }
        }
        return referenced;
    }

    private boolean matches(ExecutionState state, List<?> conditions, String logic) {
        List<Boolean> results = new ArrayList<>();
        for (Object conditionObj : conditions) {
            if (!(conditionObj instanceof Map<?, ?> condition)) {
                results.add(false);
                continue;
            }
            results.add(evaluate(state, condition));
        }
        if ("or".equalsIgnoreCase(logic.trim())) {
            return results.contains(Boolean.TRUE);
        }
        return !results.contains(Boolean.FALSE);
    }

    private boolean evaluate(ExecutionState state, Map<?, ?> condition) {
        String leftVar = stringify(condition.get("left_var"));
        Object left = leftVar.isEmpty() ? "" : getVariable(state, leftVar);
        Object right = condition.get("right_value");
        if (right == null) {
            right = "";
        }
        if (right instanceof String text && text.contains(".")) {
            Object resolved = getVariable(state, text);
            if (resolved != null) {
                right = resolved;
            }
        }
        Operator operator = Operator.fromName(stringify(condition.get("operator")));
        return operator.test(left, right);
    }

    private String resolveCaseTarget(Map<?, ?> conditionCase) {
        String explicit = stringify(conditionCase.get("target"));
        if (StringUtils.isNotBlank(explicit)) {
            return explicit.trim();
        }
        return stringify(conditionCase.get("id")).trim();
    }

    /**
     * 比较运算符。数值比较解析失败时结果为 false。
     */
    enum Operator {
        EQUALS("equals", (a, b) -> stringify(a).equals(stringify(b))),
        NOT_EQUALS("not_equals", (a, b) -> !stringify(a).equals(stringify(b))),
        CONTAINS("contains", (a, b) -> stringify(a).contains(stringify(b))),
        NOT_CONTAINS("not_contains", (a, b) -> !stringify(a).contains(stringify(b))),
        GREATER_THAN("greater_than", (a, b) -> compare(a, b) > 0),
        LESS_THAN("less_than", (a, b) -> compare(a, b) < 0),
        GREATER_EQUAL("greater_equal", (a, b) -> compare(a, b) >= 0),
        LESS_EQUAL("less_equal", (a, b) -> compare(a, b) <= 0),
        IS_EMPTY("is_empty", (a, b) -> isEmptyValue(a)),
        IS_NOT_EMPTY("is_not_empty", (a, b) -> !isEmptyValue(a)),
        STARTS_WITH("starts_with", (a, b) -> stringify(a).startsWith(stringify(b))),
        ENDS_WITH("ends_with", (a, b) -> stringify(a).endsWith(stringify(b)));

        private final String operatorName;
        private final BiPredicate<Object, Object> predicate;

        Operator(String operatorName, BiPredicate<Object, Object> predicate) {
            this.operatorName = operatorName;
            this.predicate = predicate;
        }

        boolean test(Object left, Object right) {
            try {
                return predicate.test(left, right);
            } catch (NumberFormatException ex) {
                return false;
            }
        }

        static Operator fromName(String name) {
            for (Operator operator : values()) {
                if (operator.operatorName.equalsIgnoreCase(StringUtils.trimToEmpty(name))) {
                    return operator;
                }
            }
            return EQUALS;
        }

        /**
         * 解析失败时抛出 NumberFormatException，由 test 统一转为 false。
         */
        private static int compare(Object left, Object right) {
            double a = toDouble(left);
            double b = toDouble(right);
            if (Double.isNaN(a) || Double.isNaN(b)) {
                throw new NumberFormatException("NaN operand");
            }
            return Double.compare(a, b);
        }

        private static double toDouble(Object value) {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            if (value == null) {
                throw new NumberFormatException("null operand");
            }
            return Double.parseDouble(String.valueOf(value).trim());
        }

        private static boolean isEmptyValue(Object value) {
            if (value == null) {
                return true;
            }
            if (value instanceof String text) {
                return text.isEmpty();
            }
            if (value instanceof Collection<?> collection) {
                return collection.isEmpty();
            }
            if (value instanceof Map<?, ?> map) {
                return map.isEmpty();
            }
            if (value instanceof Boolean bool) {
                return !bool;
            }
            if (value instanceof Number number) {
                return number.doubleValue() == 0D;
            }
            return false;
        }
    }
}
