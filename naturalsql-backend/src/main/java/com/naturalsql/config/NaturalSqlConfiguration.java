package com.naturalsql.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class NaturalSqlConfiguration {

    @Bean
    public LlmConfig llmConfig(Environment environment) {
        return LlmConfig.fromEnvironment(environment);
    }

    @Bean
    public PipelineSettings pipelineSettings(Environment environment) {
        return PipelineSettings.fromEnvironment(environment);
    }
}
