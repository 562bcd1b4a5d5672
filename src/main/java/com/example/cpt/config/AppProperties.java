package com.example.cpt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 应用配置属性
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private EpubConfig epub = new EpubConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private LlmConfig llm = new LlmConfig();

    @Data
    public static class EpubConfig {
        private String pageMarkerPattern = "^page_(\\d+)$";
        private String cacheSuffix = ".pagemap.json";
        private CacheValidation cacheValidation = CacheValidation.PRESENCE;
        private HierarchyStrictness hierarchyStrictness = HierarchyStrictness.FILE;
        private String sectionTag = "h1";
        private String subsectionTag = "h2";
        private String subheadingTag = "h3";
        private String topicTag = "h4";
    }

    /**
     * 页码缓存校验方式
     */
    public enum CacheValidation {
        PRESENCE,    // 缓存文件存在即加载
        FINGERPRINT  // 额外比对EPUB大小与修改时间
    }

    /**
     * 层级解析精度
     */
    public enum HierarchyStrictness {
        FILE,   // 文件内最后一个标题
        ANCHOR  // 起始文件内只取页码锚点之前的标题
    }

    @Data
    public static class ExtractionConfig {
        private String outputDir = "cpt_output";
        private int chunkSize = 5;
        private boolean byChapter = false;
        private boolean useHierarchy = true;
        private boolean stream = false;
        private boolean simpleSchema = false;
        private boolean skipCombinedOutput = false;
        private int maxInputChars = 300000;
        private String combinedOutputName = "cpt_output.jsonl";
        private String codeType = "CPT";
        private String codeVersion = "CPT 2024 AMA";
    }

    @Data
    public static class LlmConfig {
        private ModelConfig primary = new ModelConfig();

        @Data
        public static class ModelConfig {
            private String type = "mock"; // mock, openai, gemini
            private String apiKey;
            private String model = "gemini-2.5-pro";
            private String endpoint;
            private int timeout = 600000;
            private int maxTokens = 65536;
            private double temperature = 0.1;
        }
    }
}
