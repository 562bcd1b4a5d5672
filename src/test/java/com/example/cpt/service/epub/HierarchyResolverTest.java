package com.example.cpt.service.epub;

import com.example.cpt.config.AppProperties.HierarchyStrictness;
import com.example.cpt.dto.HierarchyContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import static com.example.cpt.service.epub.EpubFixture.marker;
import static com.example.cpt.service.epub.EpubFixture.xhtml;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HierarchyResolver")
class HierarchyResolverTest {

    private static final List<String> TAGS = List.of("h1", "h2", "h3", "h4");

    @TempDir
    Path tempDir;

    private HierarchyContext resolve(Path epub, int page, HierarchyStrictness strictness) {
        try (EpubArchive archive = new EpubArchive(epub)) {
            XhtmlTextExtractor textExtractor = new XhtmlTextExtractor();
            PageIndex index = new PageIndexer(Pattern.compile("^page_(\\d+)$"), textExtractor).build(archive);
            return new HierarchyResolver(archive, index, textExtractor, TAGS, strictness).resolve(page);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    @DisplayName("同一文件中取最后一个标题")
    void shouldUseLastHeadingInFile() throws IOException {
        Path epub = new EpubFixture()
                .add("fileA", "a.xhtml", xhtml(marker(1) + "<h1>Surgery</h1><p>x</p><h1>Medicine</h1><p>y</p>"))
                .write(tempDir.resolve("book.epub"));

        HierarchyContext context = resolve(epub, 1, HierarchyStrictness.FILE);

        assertThat(context.getSection()).isEqualTo("Medicine");
    }

    @Test
    @DisplayName("沿spine向前回溯补齐缺失层级")
    void shouldWalkBackwardForMissingLevels() throws IOException {
        Path epub = new EpubFixture()
                .add("part", "part.xhtml", xhtml("<h1>Surgery</h1><h2>Musculoskeletal System</h2>"))
                .add("chapter", "chapter.xhtml", xhtml("<h3>Arthroscopy</h3>" + marker(5) + "<h4>Temporomandibular</h4>"))
                .add("later", "later.xhtml", xhtml("<h1>Radiology</h1>" + marker(9)))
                .write(tempDir.resolve("book.epub"));

        HierarchyContext context = resolve(epub, 5, HierarchyStrictness.FILE);

        assertThat(context).isEqualTo(new HierarchyContext(
                "Surgery", "Musculoskeletal System", "Arthroscopy", "Temporomandibular"));
        assertThat(context.isComplete()).isTrue();
    }

    @Test
    @DisplayName("较近文件中的标题优先于更早文件")
    void nearerFileShouldWin() throws IOException {
        Path epub = new EpubFixture()
                .add("old", "old.xhtml", xhtml("<h1>Evaluation and Management</h1><h2>Office Visits</h2>"))
                .add("current", "current.xhtml", xhtml("<h1>Anesthesia</h1>" + marker(3) + "<p>text</p>"))
                .write(tempDir.resolve("book.epub"));

        HierarchyContext context = resolve(epub, 3, HierarchyStrictness.FILE);

        assertThat(context.getSection()).isEqualTo("Anesthesia");
        assertThat(context.getSubsection()).isEqualTo("Office Visits");
        assertThat(context.getSubheading()).isNull();
        assertThat(context.getTopic()).isNull();
    }

    @Test
    @DisplayName("ANCHOR 模式忽略页码标记之后的标题")
    void anchorModeShouldIgnoreHeadingsAfterMarker() throws IOException {
        Path epub = new EpubFixture()
                .add("fileA", "a.xhtml", xhtml("<h1>Surgery</h1>" + marker(1) + "<h1>Medicine</h1>"))
                .write(tempDir.resolve("book.epub"));

        assertThat(resolve(epub, 1, HierarchyStrictness.FILE).getSection()).isEqualTo("Medicine");
        assertThat(resolve(epub, 1, HierarchyStrictness.ANCHOR).getSection()).isEqualTo("Surgery");
    }

    @Test
    @DisplayName("未知页码返回全部未解析的上下文")
    void unknownPageShouldBeUnresolved() throws IOException {
        Path epub = new EpubFixture()
                .add("fileA", "a.xhtml", xhtml("<h1>Surgery</h1>" + marker(1)))
                .write(tempDir.resolve("book.epub"));

        assertThat(resolve(epub, 42, HierarchyStrictness.FILE)).isEqualTo(HierarchyContext.unresolved());
    }

    @Test
    @DisplayName("回溯中读取失败的文件被跳过, 继续向前查找")
    void shouldSkipUnreadableFileWhileWalkingBackward() throws IOException {
        Path epub = new EpubFixture()
                .add("part", "part.xhtml", xhtml("<h1>Surgery</h1><h2>Integumentary System</h2>"))
                .addMissingFile("gone", "gone.xhtml")
                .add("chapter", "chapter.xhtml", xhtml(marker(12) + "<h3>Repair</h3>"))
                .write(tempDir.resolve("book.epub"));

        HierarchyContext context = resolve(epub, 12, HierarchyStrictness.FILE);

        assertThat(context.getSection()).isEqualTo("Surgery");
        assertThat(context.getSubsection()).isEqualTo("Integumentary System");
        assertThat(context.getSubheading()).isEqualTo("Repair");
    }
}
