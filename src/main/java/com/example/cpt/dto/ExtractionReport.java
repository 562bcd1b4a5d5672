package com.example.cpt.dto;

import com.example.cpt.service.extraction.PipelineState;
import com.example.cpt.service.llm.LLMClient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;

/**
 * 一次抽取运行的汇总
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionReport {
    private List<ChunkResult> chunks;
    private int parsedChunks;
    private int failedChunks;
    private int totalRecords;
    private LLMClient.TokenUsage totalUsage;
    private double estimatedCost;
    private Path combinedArtifact;
    private PipelineState finalState;
}
