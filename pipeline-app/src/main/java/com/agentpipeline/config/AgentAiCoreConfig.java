package com.agentpipeline.config;

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
 * ToolCallbackResolver 按 Bean 名称解析 Agent 配置中声明的工具，
 * 构造句柄时用于校验工具是否存在。
 * </p>
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
