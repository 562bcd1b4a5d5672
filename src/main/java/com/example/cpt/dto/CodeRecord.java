package com.example.cpt.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 抽取出的一条编码记录
 * <p>
 * 已知字段按输出schema映射；模型额外返回的字段原样保留在 {@link #getExtra()} 中，
 * 序列化时追加在已知字段之后。解析完成后不再修改。
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"code", "code_description", "code_type",
        "section", "section_text", "subsection", "subsection_text",
        "subheading", "subheading_text", "topic", "topic_text", "code_version"})
public class CodeRecord {

    @JsonProperty("code")
    private String code;

    @JsonProperty("code_description")
    @JsonAlias("code_desc")
    private String codeDescription;

    @JsonProperty("code_type")
    private String codeType;

    @JsonProperty("section")
    private String section;

    @JsonProperty("section_text")
    private String sectionText;

    @JsonProperty("subsection")
    private String subsection;

    @JsonProperty("subsection_text")
    private String subsectionText;

    @JsonProperty("subheading")
    private String subheading;

    @JsonProperty("subheading_text")
    private String subheadingText;

    @JsonProperty("topic")
    private String topic;

    @JsonProperty("topic_text")
    private String topicText;

    @JsonProperty("code_version")
    private String codeVersion;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    private CodeRecord() {
    }

    private CodeRecord(CodeRecord source) {
        this.code = source.code;
        this.codeDescription = source.codeDescription;
        this.codeType = source.codeType;
        this.section = source.section;
        this.sectionText = source.sectionText;
        this.subsection = source.subsection;
        this.subsectionText = source.subsectionText;
        this.subheading = source.subheading;
        this.subheadingText = source.subheadingText;
        this.topic = source.topic;
        this.topicText = source.topicText;
        this.codeVersion = source.codeVersion;
        this.extra.putAll(source.extra);
    }

    public static CodeRecord of(String code, String codeDescription) {
        CodeRecord record = new CodeRecord();
        record.code = code;
        record.codeDescription = codeDescription;
        return record;
    }

    /**
     * 返回补齐 code_type / code_version 的副本；已有值保持不变
     */
    public CodeRecord withDefaultTags(String defaultCodeType, String defaultCodeVersion) {
        CodeRecord copy = new CodeRecord(this);
        if (copy.codeType == null || copy.codeType.isEmpty()) {
            copy.codeType = defaultCodeType;
        }
        if (copy.codeVersion == null || copy.codeVersion.isEmpty()) {
            copy.codeVersion = defaultCodeVersion;
        }
        return copy;
    }

    @JsonAnySetter
    void putExtra(String name, Object value) {
        extra.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return Collections.unmodifiableMap(extra);
    }
}
