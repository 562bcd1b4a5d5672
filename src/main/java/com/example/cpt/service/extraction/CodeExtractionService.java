package com.example.cpt.service.extraction;

import com.example.cpt.config.AppProperties;
import com.example.cpt.dto.ChunkResult;
import com.example.cpt.dto.CodeRecord;
import com.example.cpt.dto.ExtractionChunk;
import com.example.cpt.dto.ExtractionReport;
import com.example.cpt.dto.HierarchyContext;
import com.example.cpt.service.epub.EpubNavigator;
import com.example.cpt.service.epub.EpubNavigatorFactory;
import com.example.cpt.service.epub.PageRangeText;
import com.example.cpt.service.llm.CostEstimator;
import com.example.cpt.service.llm.LLMClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 编码抽取服务
 * <p>
 * 按页码顺序逐个处理chunk：取区间文本和层级上下文、构建提示词、调用模型、解析响应并写出产物。
 * 上一个成功chunk的最后一条记录作为下一个chunk的父编码上下文，保存在 {@link PipelineState} 中。
 * 单个chunk的模型调用失败、解析失败或产物写出失败都不会中断整次运行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeExtractionService {

    private final EpubNavigatorFactory navigatorFactory;
    private final ChunkPlanner chunkPlanner;
    private final PromptBuilder promptBuilder;
    private final ResponseParser responseParser;
    private final ArtifactWriter artifactWriter;
    private final LLMClient llmClient;
    private final AppProperties appProperties;

    public ExtractionReport extract(Path epubPath, ExtractionOptions options) {
        return extract(epubPath, options, llmClient);
    }

    /**
     * 使用指定的模型客户端抽取
     */
    public ExtractionReport extract(Path epubPath, ExtractionOptions options, LLMClient client) {
        log.info("打开EPUB: {}", epubPath);
        EpubNavigator navigator = navigatorFactory.open(epubPath);
        try {
            return extract(navigator, options, client);
        } finally {
            close(navigator, epubPath);
        }
    }

    private void close(EpubNavigator navigator, Path epubPath) {
        try {
            navigator.close();
        } catch (IOException e) {
            // 产物已写出，关闭失败只记录
            log.warn("关闭EPUB失败: {} - {}", epubPath, e.getMessage());
        }
    }

    public ExtractionReport extract(EpubNavigator navigator, ExtractionOptions options, LLMClient client) {
        List<ExtractionChunk> chunks = planChunks(navigator, options);
        log.info("=== 抽取开始: 页 {}-{}, 共 {} 个chunk, 模型 {} ===",
                options.getStartPage(), options.getEndPage(), chunks.size(), client.getModelName());

        PipelineState state = new PipelineState();
        List<ChunkResult> results = new ArrayList<>();
        List<CodeRecord> allRecords = new ArrayList<>();
        LLMClient.TokenUsage totalUsage = new LLMClient.TokenUsage(0, 0, 0);
        double totalCost = 0;

        for (ExtractionChunk chunk : chunks) {
            ChunkResult result = processChunk(navigator, chunk, state, options, client);
            results.add(result);
            if (result.getStatus() == ChunkResult.ChunkStatus.PARSED) {
                allRecords.addAll(result.getRecords());
            }
            totalUsage = totalUsage.plus(result.getUsage());
            totalCost += result.getEstimatedCost();
        }

        Path combined = null;
        if (options.isSkipCombinedOutput()) {
            log.info("抽取完成: 共 {} 条记录, 跳过合并输出", allRecords.size());
        } else {
            try {
                combined = artifactWriter.writeCombined(options.getOutputDir(), options.getCombinedOutputName(),
                        chunks, allRecords);
                log.info("抽取完成: 共 {} 条记录, 已保存到 {}", allRecords.size(), combined);
            } catch (UncheckedIOException e) {
                log.error("合并输出写出失败: {}", e.getMessage(), e);
            }
        }
        log.info("Token合计: 输入 {}, 输出 {}, 总计 {}, 预估费用 ${}",
                totalUsage.getPromptTokens(), totalUsage.getOutputTokens(), totalUsage.getTotalTokens(),
                String.format("%.4f", totalCost));

        return ExtractionReport.builder()
                .chunks(results)
                .parsedChunks(state.getProcessedChunks() - state.getFailedChunks())
                .failedChunks(state.getFailedChunks())
                .totalRecords(state.getTotalRecords())
                .totalUsage(totalUsage)
                .estimatedCost(totalCost)
                .combinedArtifact(combined)
                .finalState(state)
                .build();
    }

    private List<ExtractionChunk> planChunks(EpubNavigator navigator, ExtractionOptions options) {
        if (options.isByChapter()) {
            log.info("计算章节范围...");
            return chunkPlanner.planByChapter(navigator.getChapterBoundaries(),
                    options.getStartPage(), options.getEndPage());
        }
        return chunkPlanner.planFixed(options.getStartPage(), options.getEndPage(), options.getChunkSize());
    }

    /**
     * 处理单个chunk，按结果推进状态
     */
    ChunkResult processChunk(EpubNavigator navigator, ExtractionChunk chunk, PipelineState state,
                             ExtractionOptions options, LLMClient client) {
        log.info("--- 处理chunk: 页 {} 到 {} ---", chunk.getStartPage(), chunk.getEndPage());
        long startTime = System.currentTimeMillis();

        PageRangeText rangeText = navigator.getContentByPageRange(chunk.getStartPage(), chunk.getEndPage());
        if (rangeText.isMissing()) {
            log.warn("起始页 {} 不在页码索引中, 跳过模型调用", chunk.getStartPage());
            Path debug = writeDebug(options, chunk, rangeText.getText());
            state.recordFailure();
            return failed(chunk, null, 0, false, startTime, debug);
        }
        log.info("提取文本 {} 字符, 涉及文件 {}", rangeText.getText().length(), rangeText.getFileIds());

        HierarchyContext context;
        if (options.isUseHierarchy()) {
            context = navigator.getHierarchyContext(chunk.getStartPage());
            log.debug("层级上下文: {}", context);
        } else {
            log.info("跳过层级上下文解析");
            context = HierarchyContext.unresolved();
        }
        state.updateHierarchy(context);

        Prompt prompt = promptBuilder.build(rangeText.getText(), context, state.getLastRecord(),
                options.isSimpleSchema());
        log.info("提示词长度 {} 字符", prompt.getText().length());

        LLMClient.Generation generation = invoke(client, prompt, options.isStream());
        LLMClient.TokenUsage usage = generation.getUsage();
        double cost = 0;
        if (usage != null) {
            cost = CostEstimator.estimate(client.getModelName(), usage);
            log.info("Token用量: 输入 {}, 输出 {}, 总计 {}, 预估费用 ${}",
                    usage.getPromptTokens(), usage.getOutputTokens(), usage.getTotalTokens(),
                    String.format("%.4f", cost));
        }

        ParseResult parsed = responseParser.parse(generation.getText(), options.isSimpleSchema());
        if (!parsed.isParsed()) {
            log.warn("页 {}-{} 的响应解析失败", chunk.getStartPage(), chunk.getEndPage());
            Path debug = writeDebug(options, chunk, ResponseParser.stripCodeFence(parsed.getRawText()));
            state.recordFailure();
            return failed(chunk, usage, cost, prompt.isTruncated(), startTime, debug);
        }

        List<CodeRecord> records = parsed.getRecords();
        CodeRecord last = records.get(records.size() - 1);
        log.info("抽取到 {} 条编码, 最后一条: {}", records.size(), last.getCode() != null ? last.getCode() : "N/A");

        // 产物写出成功后才推进状态
        Path artifact;
        try {
            artifact = artifactWriter.writeChunk(options.getOutputDir(), chunk, records);
        } catch (UncheckedIOException e) {
            log.error("页 {}-{} 的产物写出失败: {}", chunk.getStartPage(), chunk.getEndPage(), e.getMessage(), e);
            state.recordFailure();
            return ChunkResult.builder()
                    .chunk(chunk)
                    .status(ChunkResult.ChunkStatus.WRITE_FAILED)
                    .records(records)
                    .usage(usage)
                    .estimatedCost(cost)
                    .inputTruncated(prompt.isTruncated())
                    .elapsedMillis(System.currentTimeMillis() - startTime)
                    .build();
        }
        state.recordSuccess(last, records.size());

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("chunk处理耗时 {} ms", elapsed);
        return ChunkResult.builder()
                .chunk(chunk)
                .status(ChunkResult.ChunkStatus.PARSED)
                .records(records)
                .usage(usage)
                .estimatedCost(cost)
                .inputTruncated(prompt.isTruncated())
                .elapsedMillis(elapsed)
                .artifact(artifact)
                .build();
    }

    /**
     * 调用模型；调用失败按空响应处理
     */
    private LLMClient.Generation invoke(LLMClient client, Prompt prompt, boolean stream) {
        AppProperties.LlmConfig.ModelConfig modelConfig = appProperties.getLlm().getPrimary();
        LLMClient.GenerationRequest request = LLMClient.GenerationRequest.builder()
                .prompt(prompt.getText())
                .maxTokens(modelConfig.getMaxTokens())
                .temperature(modelConfig.getTemperature())
                .jsonResponse(true)
                .build();
        try {
            if (stream) {
                return drainStream(client, request);
            }
            log.info("发送请求到 {}...", client.getModelName());
            LLMClient.Generation generation = client.generate(request);
            return generation != null ? generation : LLMClient.Generation.empty();
        } catch (Exception e) {
            log.error("模型调用失败: {}", e.getMessage(), e);
            return LLMClient.Generation.empty();
        }
    }

    private LLMClient.Generation drainStream(LLMClient client, LLMClient.GenerationRequest request) {
        log.info("以流式方式发送请求到 {}...", client.getModelName());
        List<LLMClient.Generation> fragments = client.streamGenerate(request).collectList().block();

        StringBuilder text = new StringBuilder();
        LLMClient.TokenUsage usage = null;
        if (fragments != null) {
            for (LLMClient.Generation fragment : fragments) {
                if (fragment.getText() != null) {
                    text.append(fragment.getText());
                }
                if (fragment.getUsage() != null) {
                    usage = fragment.getUsage();
                }
            }
            log.info("流式输出完成: {} 个片段, {} 字符", fragments.size(), text.length());
        }
        return new LLMClient.Generation(text.toString(), usage);
    }

    private Path writeDebug(ExtractionOptions options, ExtractionChunk chunk, String text) {
        try {
            return artifactWriter.writeDebug(options.getOutputDir(), chunk, text);
        } catch (UncheckedIOException e) {
            log.error("页 {}-{} 的调试文件写出失败: {}", chunk.getStartPage(), chunk.getEndPage(), e.getMessage(), e);
            return null;
        }
    }

    private ChunkResult failed(ExtractionChunk chunk, LLMClient.TokenUsage usage, double cost,
                               boolean truncated, long startTime, Path debug) {
        return ChunkResult.builder()
                .chunk(chunk)
                .status(ChunkResult.ChunkStatus.PARSE_FAILED)
                .records(List.of())
                .usage(usage)
                .estimatedCost(cost)
                .inputTruncated(truncated)
                .elapsedMillis(System.currentTimeMillis() - startTime)
                .artifact(debug)
                .build();
    }
}
