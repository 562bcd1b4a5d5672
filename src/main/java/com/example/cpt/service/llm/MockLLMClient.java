package com.example.cpt.service.llm;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mock LLM客户端 - 用于开发测试
 * <p>
 * 可预先排队响应文本；队列为空时返回一行固定的示例记录。
 * 排队 {@link RuntimeException} 时对应那次调用抛出该异常。
 */
@Slf4j
public class MockLLMClient implements LLMClient {

    private static final String DEFAULT_RESPONSE =
            "{\"code\": \"00000\", \"code_description\": \"Mock procedure\", \"code_type\": \"CPT\"}";

    private final Deque<Object> scripted = new ArrayDeque<>();
    private final List<GenerationRequest> requests = new ArrayList<>();

    public MockLLMClient enqueue(String response) {
        scripted.addLast(response);
        return this;
    }

    public MockLLMClient enqueueFailure(RuntimeException failure) {
        scripted.addLast(failure);
        return this;
    }

    /**
     * 已收到的请求，按调用顺序
     */
    public List<GenerationRequest> getRequests() {
        return requests;
    }

    @Override
    public String getModelName() {
        return "mock-model";
    }

    @Override
    public Flux<Generation> streamGenerate(GenerationRequest request) {
        Generation generation = generate(request);
        String text = generation.getText();

        // 按行拆成片段模拟流式输出，用量挂在最后一个片段
        List<Generation> fragments = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            end = end < 0 ? text.length() : end + 1;
            fragments.add(new Generation(text.substring(start, end), null));
            start = end;
        }
        fragments.add(new Generation("", generation.getUsage()));
        return Flux.fromIterable(fragments)
                .doOnSubscribe(s -> log.debug("Mock LLM开始流式输出"))
                .doOnComplete(() -> log.debug("Mock LLM流式输出完成"));
    }

    @Override
    public Generation generate(GenerationRequest request) {
        requests.add(request);
        Object next = scripted.pollFirst();
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        String text = next != null ? (String) next : DEFAULT_RESPONSE;
        long promptTokens = request.getPrompt() == null ? 0 : request.getPrompt().length() / 4;
        long outputTokens = text.length() / 4;
        return new Generation(text, new TokenUsage(promptTokens, outputTokens, promptTokens + outputTokens));
    }
}
