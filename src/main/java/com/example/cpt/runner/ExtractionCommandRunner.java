package com.example.cpt.runner;

import com.example.cpt.config.AppProperties;
import com.example.cpt.config.LLMConfiguration;
import com.example.cpt.dto.ExtractionReport;
import com.example.cpt.service.export.CsvExportService;
import com.example.cpt.service.extraction.CodeExtractionService;
import com.example.cpt.service.extraction.ExtractionOptions;
import com.example.cpt.service.llm.LLMClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 命令行入口
 * <p>
 * 抽取: {@code --epub=<file> --start=N --end=M [--chunk-size=N] [--by-chapter] [--no-hierarchy] [--stream]
 * [--simple-schema] [--skip-combined-output] [--output-dir=<dir>] [--model=<id>]}
 * <br>
 * 导出: {@code --export=<file|dir> [--csv=<file>]}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = "用法: --epub=<file> --start=N --end=M [--chunk-size=N] [--by-chapter] "
            + "[--no-hierarchy] [--stream] [--simple-schema] [--skip-combined-output] [--output-dir=<dir>] "
            + "[--model=<id>]  或  --export=<file|dir> [--csv=<file>]";

    private final CodeExtractionService extractionService;
    private final CsvExportService csvExportService;
    private final LLMClient llmClient;
    private final AppProperties appProperties;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (args.containsOption("export")) {
                runExport(args);
            } else if (args.containsOption("epub")) {
                runExtraction(args);
            } else {
                log.info(USAGE);
            }
        } catch (Exception e) {
            log.error("执行失败: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runExport(ApplicationArguments args) {
        Path input = Paths.get(requireValue(args, "export"));
        String csv = optionalValue(args, "csv");
        Path output = csv != null ? Paths.get(csv) : defaultCsvPath(input);
        int rows = csvExportService.export(input, output);
        log.info("已导出 {} 行到 {}", rows, output);
    }

    private void runExtraction(ApplicationArguments args) {
        Path epub = Paths.get(requireValue(args, "epub"));
        int start = Integer.parseInt(requireValue(args, "start"));
        int end = Integer.parseInt(requireValue(args, "end"));

        ExtractionOptions.ExtractionOptionsBuilder builder =
                ExtractionOptions.defaults(appProperties.getExtraction(), start, end).toBuilder();
        String chunkSize = optionalValue(args, "chunk-size");
        if (chunkSize != null) {
            builder.chunkSize(Integer.parseInt(chunkSize));
        }
        String outputDir = optionalValue(args, "output-dir");
        if (outputDir != null) {
            builder.outputDir(Paths.get(outputDir));
        }
        if (args.containsOption("by-chapter")) {
            builder.byChapter(true);
        }
        if (args.containsOption("no-hierarchy")) {
            builder.useHierarchy(false);
        }
        if (args.containsOption("stream")) {
            builder.stream(true);
        }
        if (args.containsOption("simple-schema")) {
            builder.simpleSchema(true);
        }
        if (args.containsOption("skip-combined-output")) {
            builder.skipCombinedOutput(true);
        }

        ExtractionReport report = extractionService.extract(epub, builder.build(), resolveClient(args));
        log.info("运行汇总: chunk {} 个 (成功 {}, 失败 {}), 记录 {} 条, 预估费用 ${}, 合并文件 {}",
                report.getChunks().size(), report.getParsedChunks(), report.getFailedChunks(),
                report.getTotalRecords(), String.format("%.4f", report.getEstimatedCost()),
                report.getCombinedArtifact() != null ? report.getCombinedArtifact() : "未生成");
    }

    private LLMClient resolveClient(ApplicationArguments args) {
        String model = optionalValue(args, "model");
        if (model == null) {
            return llmClient;
        }
        AppProperties.LlmConfig.ModelConfig primary = appProperties.getLlm().getPrimary();
        AppProperties.LlmConfig.ModelConfig override = new AppProperties.LlmConfig.ModelConfig();
        override.setType(primary.getType());
        override.setApiKey(primary.getApiKey());
        override.setEndpoint(primary.getEndpoint());
        override.setTimeout(primary.getTimeout());
        override.setMaxTokens(primary.getMaxTokens());
        override.setTemperature(primary.getTemperature());
        override.setModel(model);
        log.info("使用命令行指定的模型: {}", model);
        return LLMConfiguration.createClient(override);
    }

    static Path defaultCsvPath(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path parent = input.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(stem + ".csv") : Paths.get(stem + ".csv");
    }

    private static String requireValue(ApplicationArguments args, String name) {
        String value = optionalValue(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("缺少参数 --" + name + "\n" + USAGE);
        }
        return value;
    }

    private static String optionalValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
