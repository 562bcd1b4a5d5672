package com.example.cpt.config;

import com.example.cpt.service.llm.GeminiLLMClient;
import com.example.cpt.service.llm.LLMClient;
import com.example.cpt.service.llm.MockLLMClient;
import com.example.cpt.service.llm.OpenAILLMClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 生成服务客户端配置
 */
@Slf4j
@Configuration
public class LLMConfiguration {

    @Bean
    public LLMClient llmClient(AppProperties appProperties) {
        AppProperties.LlmConfig.ModelConfig config = appProperties.getLlm().getPrimary();
        log.info("Configuring LLM Client: type={}, model={}", config.getType(), config.getModel());
        return createClient(config);
    }

    public static LLMClient createClient(AppProperties.LlmConfig.ModelConfig config) {
        String type = config.getType();

        if (type == null || "mock".equalsIgnoreCase(type)) {
            return new MockLLMClient();
        }
        if ("gemini".equalsIgnoreCase(type)) {
            return new GeminiLLMClient(config);
        }
        if ("openai".equalsIgnoreCase(type)) {
            return new OpenAILLMClient(config);
        }
        throw new IllegalArgumentException("Unsupported LLM client type: " + type);
    }
}
