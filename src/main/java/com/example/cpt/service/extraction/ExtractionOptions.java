package com.example.cpt.service.extraction;

import com.example.cpt.config.AppProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 单次抽取运行的参数
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionOptions {
    private int startPage;
    private int endPage;
    private int chunkSize;
    private boolean byChapter;
    private boolean useHierarchy;
    private boolean stream;
    private boolean simpleSchema;
    private boolean skipCombinedOutput;
    private Path outputDir;
    private String combinedOutputName;

    /**
     * 以配置文件中的默认值构造
     */
    public static ExtractionOptions defaults(AppProperties.ExtractionConfig config, int startPage, int endPage) {
        return ExtractionOptions.builder()
                .startPage(startPage)
                .endPage(endPage)
                .chunkSize(config.getChunkSize())
                .byChapter(config.isByChapter())
                .useHierarchy(config.isUseHierarchy())
                .stream(config.isStream())
                .simpleSchema(config.isSimpleSchema())
                .skipCombinedOutput(config.isSkipCombinedOutput())
                .outputDir(Paths.get(config.getOutputDir()))
                .combinedOutputName(config.getCombinedOutputName())
                .build();
    }
}
