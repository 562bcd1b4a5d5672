package com.example.cpt.runner;

import com.example.cpt.config.AppProperties;
import com.example.cpt.dto.ExtractionReport;
import com.example.cpt.exception.EpubProcessException;
import com.example.cpt.service.export.CsvExportService;
import com.example.cpt.service.extraction.CodeExtractionService;
import com.example.cpt.service.extraction.ExtractionOptions;
import com.example.cpt.service.llm.LLMClient;
import com.example.cpt.service.llm.MockLLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExtractionCommandRunner")
class ExtractionCommandRunnerTest {

    @Mock
    private CodeExtractionService extractionService;

    @Mock
    private CsvExportService csvExportService;

    private final LLMClient llmClient = new MockLLMClient();
    private AppProperties appProperties;
    private ExtractionCommandRunner runner;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        runner = new ExtractionCommandRunner(extractionService, csvExportService, llmClient, appProperties);
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    private static ExtractionReport emptyReport() {
        return ExtractionReport.builder()
                .chunks(List.of())
                .totalUsage(new LLMClient.TokenUsage())
                .build();
    }

    @Test
    @DisplayName("没有参数时只输出用法")
    void shouldOnlyLogUsageWithoutArguments() {
        runner.run(args());

        verifyNoInteractions(extractionService, csvExportService);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("命令行参数覆盖配置默认值")
    void shouldApplyOverrides() {
        when(extractionService.extract(any(Path.class), any(ExtractionOptions.class), any(LLMClient.class)))
                .thenReturn(emptyReport());

        runner.run(args("--epub=book.epub", "--start=12", "--end=40", "--chunk-size=3", "--no-hierarchy",
                "--stream", "--simple-schema", "--skip-combined-output", "--output-dir=out"));

        ArgumentCaptor<ExtractionOptions> captor = ArgumentCaptor.forClass(ExtractionOptions.class);
        verify(extractionService).extract(eq(Paths.get("book.epub")), captor.capture(), eq(llmClient));
        ExtractionOptions options = captor.getValue();
        assertThat(options.getStartPage()).isEqualTo(12);
        assertThat(options.getEndPage()).isEqualTo(40);
        assertThat(options.getChunkSize()).isEqualTo(3);
        assertThat(options.isUseHierarchy()).isFalse();
        assertThat(options.isStream()).isTrue();
        assertThat(options.isSimpleSchema()).isTrue();
        assertThat(options.isSkipCombinedOutput()).isTrue();
        assertThat(options.isByChapter()).isFalse();
        assertThat(options.getOutputDir()).isEqualTo(Paths.get("out"));
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("--model 使用新的客户端")
    void shouldCreateClientForModelOverride() {
        when(extractionService.extract(any(Path.class), any(ExtractionOptions.class), any(LLMClient.class)))
                .thenReturn(emptyReport());

        runner.run(args("--epub=book.epub", "--start=1", "--end=2", "--model=gemini-3-flash-preview"));

        ArgumentCaptor<LLMClient> captor = ArgumentCaptor.forClass(LLMClient.class);
        verify(extractionService).extract(any(Path.class), any(ExtractionOptions.class), captor.capture());
        assertThat(captor.getValue()).isNotSameAs(llmClient).isInstanceOf(MockLLMClient.class);
    }

    @Test
    @DisplayName("导出模式调用CSV导出")
    void shouldRunExport() {
        runner.run(args("--export=results", "--csv=codes.csv"));

        verify(csvExportService).export(Paths.get("results"), Paths.get("codes.csv"));
        verifyNoInteractions(extractionService);
    }

    @Test
    @DisplayName("致命错误时退出码非零")
    void shouldReportFailureExitCode() {
        when(extractionService.extract(any(Path.class), any(ExtractionOptions.class), any(LLMClient.class)))
                .thenThrow(new EpubProcessException("EPUB文件不存在: missing.epub"));

        runner.run(args("--epub=missing.epub", "--start=1", "--end=2"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("缺少必需参数时退出码非零")
    void shouldFailWithoutRequiredArguments() {
        runner.run(args("--epub=book.epub", "--start=1"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(extractionService);
    }

    @Test
    @DisplayName("默认CSV路径与输入同名")
    void shouldDeriveDefaultCsvPath() {
        assertThat(ExtractionCommandRunner.defaultCsvPath(Paths.get("/data/cpt_output_1_10.jsonl")))
                .isEqualTo(Paths.get("/data/cpt_output_1_10.csv"));
    }
}
