package com.example.cpt.dto;

import com.example.cpt.service.llm.LLMClient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个chunk的处理结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResult {

    private ExtractionChunk chunk;
    private ChunkStatus status;
    private List<CodeRecord> records;
    private LLMClient.TokenUsage usage;
    private double estimatedCost;
    private boolean inputTruncated;
    private long elapsedMillis;
    private Path artifact;

    public enum ChunkStatus {
        PARSED,
        PARSE_FAILED,
        /** 已解析但产物写出失败 */
        WRITE_FAILED
    }
}
