package com.text2sql.config;

import com.text2sql.llm.CompletionSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class LlmConfig {

    @Bean
    public CompletionSettings completionSettings(Environment environment) {
        return CompletionSettings.fromEnvironment(environment);
    }
}
