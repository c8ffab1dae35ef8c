package com.flowgraph.domain.execution.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 执行引擎参数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineSettings {

    public static final int DEFAULT_MAX_STEPS = 50;
    public static final int MIN_STEP_BOUND = 50;

    /** 每节点步数系数，存在回边时参与步数上限计算 */
    @Builder.Default
    private int maxSteps = DEFAULT_MAX_STEPS;

    /** 无回边时的每节点步数系数 */
    @Builder.Default
    private int acyclicStepsPerNode = 3;

    /** 子工作流最大嵌套深度 */
    @Builder.Default
    private int maxSubgraphDepth = 5;

    /** 历史查询默认条数 */
    @Builder.Default
    private int historyLimit = 100;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
