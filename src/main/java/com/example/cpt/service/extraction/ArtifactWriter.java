package com.example.cpt.service.extraction;

import com.example.cpt.dto.CodeRecord;
import com.example.cpt.dto.ExtractionChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 写出抽取产物：每个chunk的 JSONL、解析失败时的原始响应、以及整次运行的合并文件
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactWriter {

    private static final String JSONL = ".jsonl";
    private static final String JSON = ".json";

    private final ObjectMapper objectMapper;

    public Path writeChunk(Path outputDir, ExtractionChunk chunk, List<CodeRecord> records) {
        Path target = outputDir.resolve("cpt_" + chunk.label() + "_chapter.jsonl");
        writeRecords(target, records);
        log.info("已保存 {} 条记录到 {}", records.size(), target);
        return target;
    }

    public Path writeDebug(Path outputDir, ExtractionChunk chunk, String rawText) {
        Path target = outputDir.resolve("cpt_" + chunk.label() + "_raw_error.txt");
        try {
            ensureDirectory(outputDir);
            Files.writeString(target, rawText != null ? rawText : "", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("写入调试文件失败: " + target, e);
        }
        log.warn("已保存原始响应到 {}", target);
        return target;
    }

    public Path writeCombined(Path outputDir, String baseName, List<ExtractionChunk> chunks, List<CodeRecord> records) {
        Path target = outputDir.resolve(combinedFileName(baseName, chunks));
        writeRecords(target, records);
        log.info("合并输出 {} 条记录到 {}", records.size(), target);
        return target;
    }

    /**
     * 合并文件名加上实际处理的页码区间；已包含该区间时不重复添加，扩展名统一为 .jsonl
     */
    static String combinedFileName(String baseName, List<ExtractionChunk> chunks) {
        String stem = baseName;
        if (stem.endsWith(JSONL)) {
            stem = stem.substring(0, stem.length() - JSONL.length());
        } else if (stem.endsWith(JSON)) {
            stem = stem.substring(0, stem.length() - JSON.length());
        }
        if (!chunks.isEmpty()) {
            String rangeSuffix = "_" + chunks.get(0).getStartPage() + "_" + chunks.get(chunks.size() - 1).getEndPage();
            if (!stem.contains(rangeSuffix)) {
                stem = stem + rangeSuffix;
            }
        }
        return stem + JSONL;
    }

    private void writeRecords(Path target, List<CodeRecord> records) {
        try {
            ensureDirectory(target.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                for (CodeRecord record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.write("\n");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("写入产物失败: " + target, e);
        }
    }

    private void ensureDirectory(Path dir) throws IOException {
        if (dir != null) {
            Files.createDirectories(dir);
        }
    }
}
