package com.flowgraph.config;

import com.flowgraph.domain.execution.model.valobj.EngineSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 执行引擎参数，前缀 flowgraph.engine。
 */
@Data
@ConfigurationProperties(prefix = "flowgraph.engine", ignoreInvalidFields = true)
public class FlowGraphEngineProperties {

    /** 存在回边时每节点的步数系数 */
    private Integer maxSteps = EngineSettings.DEFAULT_MAX_STEPS;

    /** 无回边时每节点的步数系数 */
    private Integer acyclicStepsPerNode = 3;

    private Integer maxSubgraphDepth = 5;

    /** history 接口 limit 缺省值 */
    private Integer historyLimit = 100;

    public EngineSettings toSettings() {
        return EngineSettings.builder()
                .maxSteps(Math.max(maxSteps, 1))
                .acyclicStepsPerNode(Math.max(acyclicStepsPerNode, 1))
                .maxSubgraphDepth(Math.max(maxSubgraphDepth, 0))
                .historyLimit(Math.max(historyLimit, 1))
                .build();
    }
}
