package com.flowgraph.config;

import com.flowgraph.domain.execution.model.valobj.EngineSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 执行引擎配置。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FlowGraphEngineProperties.class)
public class FlowGraphEngineConfig {

    @Bean
    public EngineSettings engineSettings(FlowGraphEngineProperties properties) {
        EngineSettings settings = properties.toSettings();
        log.info("Engine settings loaded. maxSteps={}, acyclicStepsPerNode={}, maxSubgraphDepth={}, historyLimit={}",
                settings.getMaxSteps(), settings.getAcyclicStepsPerNode(),
                settings.getMaxSubgraphDepth(), settings.getHistoryLimit());
        return settings;
    }
}
