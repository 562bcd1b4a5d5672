package com.example.cpt.service.extraction;

import com.example.cpt.config.AppProperties;
import com.example.cpt.dto.CodeRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模型响应解析
 * <p>
 * 先去掉首尾的代码围栏。整段是 JSON 数组时取其中的对象；否则逐行解析 JSON 对象（无效行直接丢弃），
 * 一行都没解析出来时，把整段文本当作一个 JSON 对象再试一次。
 */
@Slf4j
@Component
public class ResponseParser {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private static final Set<String> TEXT_FIELDS = Set.of("code", "code_description", "code_desc", "code_type",
            "section", "section_text", "subsection", "subsection_text",
            "subheading", "subheading_text", "topic", "topic_text", "code_version");

    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public ResponseParser(AppProperties appProperties) {
        this.appProperties = appProperties;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    public ParseResult parse(String responseText, boolean simpleSchema) {
        String raw = responseText != null ? responseText : "";
        String cleaned = stripCodeFence(raw);

        List<CodeRecord> records = new ArrayList<>();
        ParseResult.Strategy strategy = ParseResult.Strategy.WHOLE_ARRAY;

        // 多行排版的数组逐行解析时最后一个元素能单独成行解析，先按整段数组处理
        JsonNode whole = cleaned.startsWith("[") ? readWhole(cleaned) : null;
        if (whole != null && whole.isArray()) {
            for (JsonNode element : whole) {
                if (element.isObject()) {
                    records.add(toRecord(element));
                }
            }
        }

        if (records.isEmpty()) {
            records = parseLines(cleaned);
            strategy = ParseResult.Strategy.LINES;
        }

        if (records.isEmpty()) {
            whole = whole != null ? whole : readWhole(cleaned);
            if (whole != null && whole.isObject()) {
                records.add(toRecord(whole));
                strategy = ParseResult.Strategy.WHOLE_OBJECT;
            }
        }

        if (records.isEmpty()) {
            log.warn("响应中没有解析出任何记录, 长度 {}", raw.length());
            return ParseResult.unparseable(raw);
        }

        if (!simpleSchema) {
            AppProperties.ExtractionConfig config = appProperties.getExtraction();
            List<CodeRecord> tagged = new ArrayList<>(records.size());
            for (CodeRecord record : records) {
                tagged.add(record.withDefaultTags(config.getCodeType(), config.getCodeVersion()));
            }
            records = tagged;
        }
        log.debug("解析出 {} 条记录, 策略 {}", records.size(), strategy);
        return ParseResult.records(strategy, records, raw);
    }

    /**
     * 去掉开头的 ```json（或 ```）与结尾的 ```，各只去一次
     */
    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith(JSON_FENCE)) {
            cleaned = cleaned.substring(JSON_FENCE.length());
        } else if (cleaned.startsWith(FENCE)) {
            cleaned = cleaned.substring(FENCE.length());
        }
        if (cleaned.endsWith(FENCE)) {
            cleaned = cleaned.substring(0, cleaned.length() - FENCE.length());
        }
        return cleaned.trim();
    }

    private List<CodeRecord> parseLines(String text) {
        List<CodeRecord> records = new ArrayList<>();
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(trimmed);
            } catch (Exception e) {
                log.trace("跳过无法解析的行: {}", trimmed);
                continue;
            }
            if (node != null && node.isObject()) {
                records.add(toRecord(node));
            }
        }
        return records;
    }

    private JsonNode readWhole(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (Exception e) {
            log.debug("整段解析失败: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 已知的文本字段如果返回了数组或对象，按其 JSON 文本保存，记录不丢弃
     */
    private CodeRecord toRecord(JsonNode node) {
        ObjectNode copy = ((ObjectNode) node).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (TEXT_FIELDS.contains(field.getKey()) && field.getValue().isContainerNode()) {
                log.debug("字段 {} 不是文本, 按 JSON 文本保存", field.getKey());
                copy.set(field.getKey(), new TextNode(field.getValue().toString()));
            }
        }
        return objectMapper.convertValue(copy, CodeRecord.class);
    }
}
