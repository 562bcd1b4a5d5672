package com.example.cpt.service.extraction;

import com.example.cpt.config.AppProperties;
import com.example.cpt.dto.CodeRecord;
import com.example.cpt.dto.HierarchyContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 抽取提示词构建
 * <p>
 * 包含层级上下文、上一个chunk的最后一条记录（父编码上下文）、分号续写规则、输出格式，
 * 以及按字符预算截断后的原文。截断不是错误，但会被标记并记录日志。
 */
@Slf4j
@Component
public class PromptBuilder {

    static final String UNKNOWN = "Unknown";

    private static final String PREVIOUS_CODE_TEMPLATE = "\n**Previous Code Context**:\n" +
            "The last CPT code extracted from the previous page range was:\n" +
            "%s\n" +
            "If the FIRST code in the current text is a child code (starts with a semicolon or is indented), " +
            "use the description from this previous code as the PARENT.\n";

    private static final String FULL_SCHEMA_TEMPLATE = "4. **Output Format**:\n" +
            "   Return the data as **JSON Lines** (ndjson).\n" +
            "   - Each line must be a valid, independent JSON object.\n" +
            "   - Do NOT wrap the output in a list `[...]`.\n" +
            "   - Do NOT use commas between lines.\n" +
            "   - Schema for each object:\n" +
            "   {\n" +
            "    \"code\": \"string\",\n" +
            "    \"code_description\": \"string (resolved full description)\",\n" +
            "    \"code_type\": \"%s\",\n" +
            "    \"section\": \"string\",\n" +
            "    \"section_text\": \"string\",\n" +
            "    \"subsection\": \"string\",\n" +
            "    \"subsection_text\": \"string\",\n" +
            "    \"subheading\": \"string\",\n" +
            "    \"subheading_text\": \"string\",\n" +
            "    \"topic\": \"string\",\n" +
            "    \"topic_text\": \"string\",\n" +
            "    \"code_version\": \"%s\"\n" +
            "   }\n";

    private static final String SIMPLE_SCHEMA = "4. **Output Format**:\n" +
            "   Return the data as **JSON Lines** (ndjson).\n" +
            "   - Each line must be a valid, independent JSON object.\n" +
            "   - Do NOT wrap the output in a list `[...]`.\n" +
            "   - Do NOT use commas between lines.\n" +
            "   - Schema for each object:\n" +
            "   {\n" +
            "    \"code\": \"string\",\n" +
            "    \"code_description\": \"string (resolved full description)\"\n" +
            "   }\n" +
            "   Do NOT include any other fields like section, subsection, etc.\n";

    private static final String PROMPT_TEMPLATE = "\nYou are an expert Medical Coder and Data Analyst.\n" +
            "Your task is to extract CPT codes from the provided text and format them as JSON Lines.\n\n" +
            "**Context (Hierarchy from previous pages)**:\n" +
            "- Current Section: %s\n" +
            "- Current Subsection: %s\n" +
            "- Current Subheading: %s\n" +
            "- Current Topic: %s\n" +
            "%s\n" +
            "**Rules**:\n" +
            "1. **Semicolon Rule**: This is CRITICAL. CPT codes often use a parent-child relationship.\n" +
            "   - If a code description starts with a semicolon (e.g., \"; surgical\") or is indented and lowercase, " +
            "it is a CHILD code.\n" +
            "   - You must find the immediately preceding PARENT code (which usually ends with a semicolon).\n" +
            "   - The full description for the child is: [Parent Description up to semicolon] + [Child Description].\n" +
            "   - Example:\n" +
            "     - Parent: \"29800 Arthroscopy, temporomandibular joint; diagnostic, with or without synovial " +
            "biopsy (separate procedure)\"\n" +
            "     - Child: \"29804 ; surgical\"\n" +
            "     - Result for 29804: \"Arthroscopy, temporomandibular joint, surgical\"\n" +
            "2. **Hierarchy Inheritance**:\n" +
            "   - For every code extracted, fill in the \"section\", \"subsection\", \"subheading\", and \"topic\" fields.\n" +
            "   - If the text explicitly introduces a new header (e.g., \"Respiratory System\"), update the context " +
            "for subsequent codes.\n" +
            "   - If no new header is found, use the **Context** provided above.\n" +
            "3. **Text Extraction**:\n" +
            "   - \"section_text\", \"subsection_text\", etc. should contain the introductory text paragraphs that " +
            "appear under those headers.\n" +
            "   - If the text is not present in this chunk, use \"See previous pages\" or leave empty. " +
            "Do not hallucinate.\n" +
            "%s\n" +
            "**Input Text**:\n" +
            "%s\n" +
            "(Note: Text truncated to fit context window if necessary)\n";

    private final AppProperties appProperties;
    private final ObjectMapper prettyMapper;

    public PromptBuilder(AppProperties appProperties) {
        this.appProperties = appProperties;
        this.prettyMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param rawText        区间原文
     * @param context        层级上下文，未解析的层级显示为 Unknown
     * @param previousRecord 上一个成功chunk的最后一条记录，首个chunk为 null
     * @param simpleSchema   是否只要求 code 与 code_description
     */
    public Prompt build(String rawText, HierarchyContext context, CodeRecord previousRecord, boolean simpleSchema) {
        AppProperties.ExtractionConfig config = appProperties.getExtraction();
        HierarchyContext ctx = context != null ? context : HierarchyContext.unresolved();

        String text = rawText != null ? rawText : "";
        int maxChars = config.getMaxInputChars();
        boolean truncated = text.length() > maxChars;
        if (truncated) {
            log.warn("输入文本被截断: {} -> {} 字符", text.length(), maxChars);
            text = text.substring(0, maxChars);
        }

        String schema = simpleSchema
                ? SIMPLE_SCHEMA
                : String.format(FULL_SCHEMA_TEMPLATE, config.getCodeType(), config.getCodeVersion());

        String promptText = String.format(PROMPT_TEMPLATE,
                orUnknown(ctx.getSection()),
                orUnknown(ctx.getSubsection()),
                orUnknown(ctx.getSubheading()),
                orUnknown(ctx.getTopic()),
                previousCodeSection(previousRecord),
                schema,
                text);
        return new Prompt(promptText, truncated, rawText != null ? rawText.length() : 0);
    }

    private String previousCodeSection(CodeRecord previousRecord) {
        if (previousRecord == null) {
            return "";
        }
        try {
            return String.format(PREVIOUS_CODE_TEMPLATE, prettyMapper.writeValueAsString(previousRecord));
        } catch (JsonProcessingException e) {
            log.warn("上一条记录序列化失败, 忽略父编码上下文: {}", e.getMessage());
            return "";
        }
    }

    private static String orUnknown(String value) {
        return value != null ? value : UNKNOWN;
    }
}
