package com.example.cpt.service.export;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvExportService")
class CsvExportServiceTest {

    private static final String HEADER = "code,code_description,code_type,section,section_text,subsection,"
            + "subsection_text,subheading,subheading_text,topic,topic_text,code_version";

    @TempDir
    Path tempDir;

    private final CsvExportService service = new CsvExportService();

    private List<Map<String, String>> readCsv(Path csv) throws IOException {
        CsvMapper mapper = new CsvMapper();
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv.toFile())) {
            return it.readAll();
        }
    }

    @Test
    @DisplayName("JSONL 每行一条记录, 跳过无效行, 缺失列为空")
    void shouldExportJsonLines() throws IOException {
        Path input = Files.writeString(tempDir.resolve("cpt_1_5_chapter.jsonl"),
                "{\"code\": \"29800\", \"code_description\": \"Arthroscopy\", \"section\": \"Surgery\"}\n"
                        + "not json\n"
                        + "\n"
                        + "{\"code\": \"29804\", \"code_desc\": \"Arthroscopy, surgical\", \"code_version\": \"CPT 2024 AMA\"}\n");
        Path output = tempDir.resolve("codes.csv");

        int rows = service.export(input, output);

        assertThat(rows).isEqualTo(2);
        assertThat(Files.readAllLines(output).get(0)).isEqualTo(HEADER);
        assertThat(Files.readAllLines(output).get(1)).isEqualTo("29800,Arthroscopy,,Surgery,,,,,,,,");

        List<Map<String, String>> parsed = readCsv(output);
        assertThat(parsed).hasSize(2);
        assertThat(parsed.get(1))
                .containsEntry("code", "29804")
                .containsEntry("code_description", "Arthroscopy, surgical")
                .containsEntry("code_version", "CPT 2024 AMA")
                .containsEntry("section", "");
    }

    @Test
    @DisplayName("目录输入按文件名顺序合并 .jsonl 与 .json")
    void shouldExportDirectory() throws IOException {
        Files.writeString(tempDir.resolve("b.json"),
                "[{\"code\": \"00102\"}, {\"code\": \"00103\"}]");
        Files.writeString(tempDir.resolve("a.jsonl"), "{\"code\": \"00100\"}\n");
        Files.writeString(tempDir.resolve("c.json"), "{\"code\": \"00104\"}");
        Files.writeString(tempDir.resolve("notes.txt"), "{\"code\": \"ignored\"}");
        Path output = tempDir.resolve("export").resolve("all.csv");

        int rows = service.export(tempDir, output);

        assertThat(rows).isEqualTo(4);
        assertThat(Files.readAllLines(output)).extracting(line -> line.split(",", -1)[0])
                .containsExactly("code", "00100", "00102", "00103", "00104");
    }

    @Test
    @DisplayName("没有输入文件时只写表头")
    void shouldWriteHeaderOnlyForEmptyInput() throws IOException {
        Path output = tempDir.resolve("empty.csv");

        int rows = service.export(tempDir.resolve("missing.jsonl"), output);

        assertThat(rows).isZero();
        assertThat(Files.readAllLines(output)).containsExactly(HEADER);
    }
}
