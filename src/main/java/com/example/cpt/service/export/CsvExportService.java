package com.example.cpt.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 将抽取结果（JSONL 或 JSON 数组）展开为固定列的 CSV
 */
@Slf4j
@Service
public class CsvExportService {

    public static final List<String> COLUMNS = List.of(
            "code", "code_description", "code_type",
            "section", "section_text", "subsection", "subsection_text",
            "subheading", "subheading_text", "topic", "topic_text", "code_version");

    private static final String CODE_DESCRIPTION = "code_description";
    private static final String CODE_DESC_ALIAS = "code_desc";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * @param input  单个 .jsonl/.json 文件，或包含这些文件的目录
     * @param output CSV 输出路径
     * @return 写出的行数（不含表头）
     */
    public int export(Path input, Path output) {
        List<Path> files = collectInputs(input);
        if (files.isEmpty()) {
            log.warn("没有找到可导出的文件: {}", input);
        }

        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        COLUMNS.forEach(schemaBuilder::addColumn);
        CsvSchema schema = schemaBuilder.build();

        int rows = 0;
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
                 SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
                // 表头单独写出，没有记录时也保留
                sequence.write(headerRow());
                for (Path file : files) {
                    List<JsonNode> records = readRecords(file);
                    log.info("读取 {} 条记录: {}", records.size(), file);
                    for (JsonNode record : records) {
                        sequence.write(toRow(record));
                        rows++;
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("CSV导出失败: " + output, e);
        }

        log.info("CSV导出完成: {} 行 -> {}", rows, output);
        return rows;
    }

    private List<Path> collectInputs(Path input) {
        if (!Files.isDirectory(input)) {
            return Files.exists(input) ? List.of(input) : List.of();
        }
        try (Stream<Path> entries = Files.list(input)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                        return name.endsWith(".jsonl") || name.endsWith(".json");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("读取目录失败: " + input, e);
        }
    }

    private List<JsonNode> readRecords(Path file) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jsonl")) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        JsonNode node = objectMapper.readTree(line);
                        if (node.isObject()) {
                            records.add(node);
                        }
                    } catch (IOException e) {
                        log.warn("跳过无效行 {}:{} - {}", file.getFileName(), lineNumber, e.getMessage());
                    }
                }
            }
            return records;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("跳过无效的JSON文件: {} - {}", file, e.getMessage());
            return records;
        }
        if (root != null && root.isArray()) {
            root.forEach(node -> {
                if (node.isObject()) {
                    records.add(node);
                }
            });
        } else if (root != null && root.isObject()) {
            records.add(root);
        }
        return records;
    }

    private Map<String, String> headerRow() {
        Map<String, String> header = new LinkedHashMap<>();
        COLUMNS.forEach(column -> header.put(column, column));
        return header;
    }

    private Map<String, String> toRow(JsonNode record) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : COLUMNS) {
            JsonNode value = record.get(column);
            if ((value == null || value.isNull()) && CODE_DESCRIPTION.equals(column)) {
                value = record.get(CODE_DESC_ALIAS);
            }
            row.put(column, value == null || value.isNull() ? "" : (value.isValueNode() ? value.asText() : value.toString()));
        }
        return row;
    }
}
