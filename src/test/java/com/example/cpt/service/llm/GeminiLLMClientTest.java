package com.example.cpt.service.llm;

import com.example.cpt.config.AppProperties;
import com.example.cpt.exception.LLMException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("GeminiLLMClient")
class GeminiLLMClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private GeminiLLMClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        AppProperties.LlmConfig.ModelConfig config = new AppProperties.LlmConfig.ModelConfig();
        config.setType("gemini");
        config.setModel("gemini-2.5-flash");
        config.setApiKey("test-key");
        config.setEndpoint(server.url("/v1beta/models").toString());
        config.setTimeout(5000);
        client = new GeminiLLMClient(config);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private LLMClient.GenerationRequest request() {
        return LLMClient.GenerationRequest.builder()
                .prompt("extract codes")
                .temperature(0.1)
                .maxTokens(1024)
                .jsonResponse(true)
                .build();
    }

    @Test
    @DisplayName("同步生成: 请求JSON输出, 跳过 thought 片段, 映射用量")
    void shouldGenerateAndSkipThoughts() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"candidates\":[{\"content\":{\"parts\":["
                        + "{\"text\":\"thinking...\",\"thought\":true},"
                        + "{\"text\":\"{\\\"code\\\": \\\"29800\\\"}\"}]}}],"
                        + "\"usageMetadata\":{\"promptTokenCount\":120,\"candidatesTokenCount\":30,\"totalTokenCount\":150}}"));

        LLMClient.Generation generation = client.generate(request());

        assertThat(generation.getText()).isEqualTo("{\"code\": \"29800\"}");
        assertThat(generation.getUsage()).isEqualTo(new LLMClient.TokenUsage(120, 30, 150));

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/gemini-2.5-flash:generateContent");
        assertThat(recorded.getHeader("x-goog-api-key")).isEqualTo("test-key");
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.path("generationConfig").path("responseMimeType").asText()).isEqualTo("application/json");
        assertThat(body.path("generationConfig").path("temperature").asDouble()).isEqualTo(0.1);
        assertThat(body.path("contents").path(0).path("parts").path(0).path("text").asText()).isEqualTo("extract codes");
        assertThat(body.has("systemInstruction")).isFalse();
    }

    @Test
    @DisplayName("HTTP错误映射为对应的错误类型")
    void shouldMapHttpErrors() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"quota\"}"));

        LLMException error = catchThrowableOfType(() -> client.generate(request()), LLMException.class);

        assertThat(error).isNotNull();
        assertThat(error.getErrorType()).isEqualTo(LLMException.LLMErrorType.RATE_LIMIT);
    }

    @Test
    @DisplayName("流式生成按事件输出片段")
    void shouldStreamFragments() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"{\\\"code\\\": \"}]}}]}\n\n"
                        + "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"\\\"29800\\\"}\"}]}}],"
                        + "\"usageMetadata\":{\"promptTokenCount\":10,\"candidatesTokenCount\":5,\"totalTokenCount\":15}}\n\n"));

        List<LLMClient.Generation> fragments = client.streamGenerate(request()).collectList().block();

        assertThat(fragments).extracting(LLMClient.Generation::getText)
                .containsExactly("{\"code\": ", "\"29800\"}");
        assertThat(fragments.get(1).getUsage().getTotalTokens()).isEqualTo(15);
        assertThat(server.takeRequest().getPath())
                .isEqualTo("/v1beta/models/gemini-2.5-flash:streamGenerateContent?alt=sse");
    }
}
