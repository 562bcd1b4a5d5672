package com.example.cpt.service.llm;

import com.example.cpt.config.AppProperties;
import com.example.cpt.exception.LLMException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Gemini client for the Generative Language REST API
 * ({@code :generateContent} and {@code :streamGenerateContent?alt=sse}).
 * <p>
 * Parts flagged as {@code thought} are logged and never appended to the result text.
 */
@Slf4j
public class GeminiLLMClient implements LLMClient {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/models";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.LlmConfig.ModelConfig modelConfig;

    public GeminiLLMClient(AppProperties.LlmConfig.ModelConfig modelConfig) {
        this.modelConfig = modelConfig;
        this.objectMapper = new ObjectMapper();

        int timeout = modelConfig.getTimeout();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.MILLISECONDS)
                .writeTimeout(60, TimeUnit.SECONDS)
                .build();

        log.info("GeminiLLMClient initialized for model: {}", getModelName());
    }

    @Override
    public String getModelName() {
        return modelConfig.getModel();
    }

    private String baseUrl() {
        String endpoint = modelConfig.getEndpoint();
        String base = endpoint == null || endpoint.isEmpty() ? DEFAULT_BASE_URL : endpoint;
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public Flux<Generation> streamGenerate(GenerationRequest request) {
        return Flux.create(sink -> {
            try {
                String url = baseUrl() + "/" + getModelName() + ":streamGenerateContent?alt=sse";
                Request httpRequest = buildHttpRequest(url, buildRequestBody(request));
                EventSource.Factory factory = EventSources.createFactory(httpClient);
                EventSource eventSource = factory.newEventSource(httpRequest, new SSEListener(sink));
                sink.onCancel(eventSource::cancel);
            } catch (Exception e) {
                log.error("Failed to build stream request", e);
                sink.error(new LLMException(LLMException.LLMErrorType.INVALID_REQUEST,
                        "Request build failed: " + e.getMessage(), e));
            }
        });
    }

    @Override
    public Generation generate(GenerationRequest request) {
        try {
            String url = baseUrl() + "/" + getModelName() + ":generateContent";
            Request httpRequest = buildHttpRequest(url, buildRequestBody(request));

            try (Response response = httpClient.newCall(httpRequest).execute()) {
                if (!response.isSuccessful()) {
                    handleErrorResponse(response);
                }
                return parseResponse(objectMapper.readTree(response.body().string()));
            }
        } catch (LLMException e) {
            throw e;
        } catch (Exception e) {
            log.error("Gemini call failed", e);
            throw new LLMException(LLMException.LLMErrorType.NETWORK_ERROR,
                    "Network request failed: " + e.getMessage(), e);
        }
    }

    private Request buildHttpRequest(String url, String requestBody) {
        return new Request.Builder()
                .url(url)
                .header("x-goog-api-key", modelConfig.getApiKey() == null ? "" : modelConfig.getApiKey())
                .header("Content-Type", "application/json")
                .post(RequestBody.create(requestBody, MediaType.parse("application/json")))
                .build();
    }

    /**
     * 构建请求体
     * 格式: {"contents": [...], "generationConfig": {...}}
     */
    String buildRequestBody(GenerationRequest request) throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", request.getPrompt())))));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature",
                request.getTemperature() > 0 ? request.getTemperature() : modelConfig.getTemperature());
        generationConfig.put("maxOutputTokens",
                request.getMaxTokens() > 0 ? request.getMaxTokens() : modelConfig.getMaxTokens());
        if (request.isJsonResponse()) {
            generationConfig.put("responseMimeType", "application/json");
        }
        body.put("generationConfig", generationConfig);

        return objectMapper.writeValueAsString(body);
    }

    /**
     * 解析 GenerateContentResponse，跳过 thought 片段
     */
    Generation parseResponse(JsonNode root) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            if (part.path("thought").asBoolean(false)) {
                log.debug("[Thinking]: {}", part.path("text").asText(""));
                continue;
            }
            text.append(part.path("text").asText(""));
        }

        JsonNode usage = root.path("usageMetadata");
        TokenUsage tokenUsage = null;
        if (usage.isObject()) {
            tokenUsage = new TokenUsage(
                    usage.path("promptTokenCount").asLong(),
                    usage.path("candidatesTokenCount").asLong(),
                    usage.path("totalTokenCount").asLong());
        }
        return new Generation(text.toString(), tokenUsage);
    }

    private void handleErrorResponse(Response response) throws IOException {
        int code = response.code();
        String body = response.body() != null ? response.body().string() : "";
        log.error("Gemini API Error: status={}, body={}", code, body);
        throw new LLMException(LLMException.fromStatus(code), "API call failed: " + code + " - " + body);
    }

    private class SSEListener extends EventSourceListener {
        private final FluxSink<Generation> sink;

        SSEListener(FluxSink<Generation> sink) {
            this.sink = sink;
        }

        @Override
        public void onEvent(EventSource eventSource, String id, String type, String data) {
            try {
                Generation fragment = parseResponse(objectMapper.readTree(data));
                if (!fragment.getText().isEmpty() || fragment.getUsage() != null) {
                    sink.next(fragment);
                }
            } catch (Exception e) {
                log.warn("Failed to parse SSE data: {}", data);
            }
        }

        @Override
        public void onFailure(EventSource eventSource, Throwable t, Response response) {
            String detail = t != null ? t.getMessage() : (response != null ? "HTTP " + response.code() : "unknown");
            log.error("SSE connection failed: {}", detail);
            LLMException.LLMErrorType errorType = response != null && !response.isSuccessful()
                    ? LLMException.fromStatus(response.code())
                    : LLMException.LLMErrorType.NETWORK_ERROR;
            sink.error(new LLMException(errorType, "Stream connection failed: " + detail, t));
        }

        @Override
        public void onClosed(EventSource eventSource) {
            sink.complete();
        }
    }
}
