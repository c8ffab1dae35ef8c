package com.flowgraph.config;

import org.springframework.ai.tool.resolution.SpringBeanToolCallbackResolver;
import org.springframework.ai.tool.resolution.ToolCallbackResolver;
import org.springframework.ai.util.json.schema.SchemaType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.GenericApplicationContext;

/**
 * Spring AI 核心组件配置。
 * <p>
 * tool 节点与 agent 节点的 tool_ids 都按 bean 名称经 ToolCallbackResolver 解析。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@Configuration
public class AgentAiCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public ToolCallbackResolver toolCallbackResolver(GenericApplicationContext applicationContext) {
        return SpringBeanToolCallbackResolver.builder()
                .applicationContext(applicationContext)
                .schemaType(SchemaType.JSON_SCHEMA)
                .build();
    }
}
