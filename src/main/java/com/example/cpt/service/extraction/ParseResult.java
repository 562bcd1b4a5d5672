package com.example.cpt.service.extraction;

import com.example.cpt.dto.CodeRecord;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 模型响应的解析结果
 */
@Data
@AllArgsConstructor
public class ParseResult {

    private final Kind kind;
    private final Strategy strategy;
    private final List<CodeRecord> records;
    private final String rawText;

    public static ParseResult records(Strategy strategy, List<CodeRecord> records, String rawText) {
        return new ParseResult(Kind.RECORDS, strategy, List.copyOf(records), rawText);
    }

    public static ParseResult unparseable(String rawText) {
        return new ParseResult(Kind.UNPARSEABLE, null, List.of(), rawText);
    }

    public boolean isParsed() {
        return kind == Kind.RECORDS;
    }

    public enum Kind {
        RECORDS,
        UNPARSEABLE
    }

    /**
     * 成功解析时使用的策略
     */
    public enum Strategy {
        LINES,
        WHOLE_ARRAY,
        WHOLE_OBJECT
    }
}
