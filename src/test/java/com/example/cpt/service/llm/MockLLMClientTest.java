package com.example.cpt.service.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MockLLMClient")
class MockLLMClientTest {

    private final LLMClient.GenerationRequest request =
            LLMClient.GenerationRequest.builder().prompt("0123456789ab").build();

    @Test
    @DisplayName("按顺序返回排队的响应, 队列为空时返回默认记录")
    void shouldReturnScriptedThenDefault() {
        MockLLMClient client = new MockLLMClient().enqueue("first");

        assertThat(client.generate(request).getText()).isEqualTo("first");
        assertThat(client.generate(request).getText()).contains("\"code\"");
        assertThat(client.getRequests()).hasSize(2);
    }

    @Test
    @DisplayName("排队的异常在对应调用时抛出")
    void shouldThrowScriptedFailure() {
        MockLLMClient client = new MockLLMClient().enqueueFailure(new IllegalStateException("boom"));

        assertThatThrownBy(() -> client.generate(request)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("流式输出按行拆分, 用量挂在最后一个片段")
    void shouldStreamLineFragments() {
        MockLLMClient client = new MockLLMClient().enqueue("line1\nline2");

        List<LLMClient.Generation> fragments = client.streamGenerate(request).collectList().block();

        assertThat(fragments).extracting(LLMClient.Generation::getText).containsExactly("line1\n", "line2", "");
        assertThat(fragments.get(2).getUsage().getPromptTokens()).isEqualTo(3);
    }
}
