package com.example.cpt.service.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Flux;

/**
 * 生成服务客户端接口
 */
public interface LLMClient {

    /**
     * 获取模型名称
     */
    String getModelName();

    /**
     * 流式生成，每个元素是一段增量文本；提供方返回用量时，用量挂在对应片段上
     */
    Flux<Generation> streamGenerate(GenerationRequest request);

    /**
     * 同步生成
     */
    Generation generate(GenerationRequest request);

    /**
     * 生成请求
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class GenerationRequest {
        private String prompt;
        private int maxTokens;
        private double temperature;
        private boolean jsonResponse;
    }

    /**
     * 生成结果（或流式片段）
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class Generation {
        private String text;
        private TokenUsage usage;

        public static Generation empty() {
            return new Generation("", null);
        }
    }

    /**
     * Token用量
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class TokenUsage {
        private long promptTokens;
        private long outputTokens;
        private long totalTokens;

        public TokenUsage plus(TokenUsage other) {
            if (other == null) {
                return this;
            }
            return new TokenUsage(promptTokens + other.promptTokens,
                    outputTokens + other.outputTokens,
                    totalTokens + other.totalTokens);
        }
    }
}
