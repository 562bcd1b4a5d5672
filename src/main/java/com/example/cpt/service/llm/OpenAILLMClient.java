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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI-compatible Chat Completions client.
 * The endpoint is configurable so any compatible gateway can be used.
 */
@Slf4j
public class OpenAILLMClient implements LLMClient {

    static final String DEFAULT_API_URL = "https://api.openai.com/v1/chat/completions";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.LlmConfig.ModelConfig modelConfig;

    public OpenAILLMClient(AppProperties.LlmConfig.ModelConfig modelConfig) {
        this.modelConfig = modelConfig;
        this.objectMapper = new ObjectMapper();

        int timeout = modelConfig.getTimeout();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.MILLISECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String getModelName() {
        return modelConfig.getModel();
    }

    private String getEndpoint() {
        String endpoint = modelConfig.getEndpoint();
        return endpoint == null || endpoint.isEmpty() ? DEFAULT_API_URL : endpoint;
    }

    @Override
    public Flux<Generation> streamGenerate(GenerationRequest request) {
        return Flux.create(sink -> {
            try {
                Request httpRequest = buildHttpRequest(buildRequestBody(request, true));
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
            Request httpRequest = buildHttpRequest(buildRequestBody(request, false));

            try (Response response = httpClient.newCall(httpRequest).execute()) {
                if (!response.isSuccessful()) {
                    handleErrorResponse(response);
                }

                JsonNode root = objectMapper.readTree(response.body().string());
                String text = root.path("choices").path(0).path("message").path("content").asText("");
                return new Generation(text, parseUsage(root.path("usage")));
            }
        } catch (LLMException e) {
            throw e;
        } catch (Exception e) {
            log.error("LLM call failed", e);
            throw new LLMException(LLMException.LLMErrorType.NETWORK_ERROR,
                    "Network request failed: " + e.getMessage(), e);
        }
    }

    private Request buildHttpRequest(String requestBody) {
        return new Request.Builder()
                .url(getEndpoint())
                .header("Authorization", "Bearer " + modelConfig.getApiKey())
                .header("Content-Type", "application/json")
                .post(RequestBody.create(requestBody, MediaType.parse("application/json")))
                .build();
    }

    String buildRequestBody(GenerationRequest request, boolean stream) throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("model", getModelName());
        body.put("stream", stream);
        body.put("max_tokens", request.getMaxTokens() > 0 ? request.getMaxTokens() : modelConfig.getMaxTokens());
        body.put("temperature", request.getTemperature() > 0 ? request.getTemperature() : modelConfig.getTemperature());
        if (stream) {
            body.put("stream_options", Map.of("include_usage", true));
        }
        if (request.isJsonResponse()) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "user", "content", request.getPrompt()));

        body.put("messages", messages);
        return objectMapper.writeValueAsString(body);
    }

    private TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return null;
        }
        return new TokenUsage(
                usage.path("prompt_tokens").asLong(),
                usage.path("completion_tokens").asLong(),
                usage.path("total_tokens").asLong());
    }

    private void handleErrorResponse(Response response) throws IOException {
        int code = response.code();
        String body = response.body() != null ? response.body().string() : "";
        log.error("OpenAI API Error: status={}, body={}", code, body);
        throw new LLMException(LLMException.fromStatus(code), "API call failed: " + code + " - " + body);
    }

    private class SSEListener extends EventSourceListener {
        private final FluxSink<Generation> sink;

        SSEListener(FluxSink<Generation> sink) {
            this.sink = sink;
        }

        @Override
        public void onEvent(EventSource eventSource, String id, String type, String data) {
            if ("[DONE]".equals(data)) {
                sink.complete();
                return;
            }

            try {
                JsonNode root = objectMapper.readTree(data);
                String content = root.path("choices").path(0).path("delta").path("content").asText("");
                TokenUsage usage = parseUsage(root.path("usage"));

                if (!content.isEmpty() || usage != null) {
                    sink.next(new Generation(content, usage));
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
