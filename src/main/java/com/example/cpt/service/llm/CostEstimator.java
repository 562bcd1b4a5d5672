package com.example.cpt.service.llm;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按模型价目表估算一次生成请求的费用（美元）
 * <p>
 * 价格单位为每百万token；提示词超过 200k token 时按长上下文档位计价。
 */
public final class CostEstimator {

    private static final long LONG_CONTEXT_THRESHOLD = 200_000L;

    private static final Map<String, Pricing> PRICING_TABLE = new LinkedHashMap<>();

    static {
        PRICING_TABLE.put("gemini-3-pro-preview", new Pricing(2.00, 4.00, 12.00, 18.00));
        PRICING_TABLE.put("gemini-3-flash-preview", new Pricing(0.50, 0.50, 3.00, 3.00));
        PRICING_TABLE.put("gemini-2.5-pro", new Pricing(1.25, 2.50, 10.00, 15.00));
        PRICING_TABLE.put("gemini-2.5-flash", new Pricing(0.30, 0.30, 2.50, 2.50));
    }

    private CostEstimator() {
    }

    /**
     * @return 估算费用；未知模型返回 0
     */
    public static double estimate(String modelId, long promptTokens, long outputTokens) {
        Pricing pricing = lookup(modelId);
        if (pricing == null) {
            return 0.0;
        }

        boolean longContext = promptTokens > LONG_CONTEXT_THRESHOLD;
        double inputPrice = longContext ? pricing.inputLong : pricing.inputStandard;
        double outputPrice = longContext ? pricing.outputLong : pricing.outputStandard;

        return (promptTokens / 1_000_000.0) * inputPrice + (outputTokens / 1_000_000.0) * outputPrice;
    }

    public static double estimate(String modelId, LLMClient.TokenUsage usage) {
        if (usage == null) {
            return 0.0;
        }
        return estimate(modelId, usage.getPromptTokens(), usage.getOutputTokens());
    }

    private static Pricing lookup(String modelId) {
        if (modelId == null) {
            return null;
        }
        Pricing exact = PRICING_TABLE.get(modelId);
        if (exact != null) {
            return exact;
        }
        // 版本后缀，如 gemini-2.5-pro-001
        for (Map.Entry<String, Pricing> entry : PRICING_TABLE.entrySet()) {
            if (modelId.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static final class Pricing {
        final double inputStandard;
        final double inputLong;
        final double outputStandard;
        final double outputLong;

        Pricing(double inputStandard, double inputLong, double outputStandard, double outputLong) {
            this.inputStandard = inputStandard;
            this.inputLong = inputLong;
            this.outputStandard = outputStandard;
            this.outputLong = outputLong;
        }
    }
}
