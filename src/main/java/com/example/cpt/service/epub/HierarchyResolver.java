package com.example.cpt.service.epub;

import com.example.cpt.config.AppProperties.HierarchyStrictness;
import com.example.cpt.dto.HierarchyContext;
import com.example.cpt.dto.PageLocation;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * 标题层级解析：从页码所在文件开始沿spine向前回溯，
 * 每一级取遇到的第一个文件中该级标签的最后一个标题，四级都找到即停止。
 * <p>
 * FILE 模式下起始文件也取文件内最后一个标题，页码锚点之后的标题会被误认为已生效；
 * ANCHOR 模式下起始文件只看锚点之前的标题。
 */
@Slf4j
public class HierarchyResolver {

    private static final int SECTION = 0;
    private static final int SUBSECTION = 1;
    private static final int SUBHEADING = 2;
    private static final int TOPIC = 3;

    private final EpubArchive archive;
    private final PageIndex pageIndex;
    private final XhtmlTextExtractor textExtractor;
    private final String[] levelTags;
    private final HierarchyStrictness strictness;

    public HierarchyResolver(EpubArchive archive, PageIndex pageIndex, XhtmlTextExtractor textExtractor,
                             List<String> levelTags, HierarchyStrictness strictness) {
        if (levelTags.size() != 4) {
            throw new IllegalArgumentException("需要4个层级标签, 实际: " + levelTags);
        }
        this.archive = archive;
        this.pageIndex = pageIndex;
        this.textExtractor = textExtractor;
        this.levelTags = levelTags.stream().map(String::toLowerCase).toArray(String[]::new);
        this.strictness = strictness;
    }

    public HierarchyContext resolve(int pageNumber) {
        PageLocation location = pageIndex.get(pageNumber);
        if (location == null) {
            return HierarchyContext.unresolved();
        }
        List<String> spine = archive.getSpine();
        int startIndex = spine.indexOf(location.getFileId());
        if (startIndex < 0) {
            return HierarchyContext.unresolved();
        }

        String[] found = new String[4];
        for (int i = startIndex; i >= 0; i--) {
            String fullPath = archive.resolvePath(spine.get(i));
            if (fullPath == null) {
                continue;
            }
            try {
                Document document = textExtractor.parse(archive.read(fullPath));
                String stopAnchor = strictness == HierarchyStrictness.ANCHOR && i == startIndex
                        ? location.getAnchorId()
                        : null;
                collectLastHeadings(document, stopAnchor, found);
            } catch (Exception e) {
                log.debug("层级回溯读取失败, 继续: {} - {}", fullPath, e.getMessage());
                continue;
            }
            if (found[SECTION] != null && found[SUBSECTION] != null
                    && found[SUBHEADING] != null && found[TOPIC] != null) {
                break;
            }
        }

        return HierarchyContext.builder()
                .section(found[SECTION])
                .subsection(found[SUBSECTION])
                .subheading(found[SUBHEADING])
                .topic(found[TOPIC])
                .build();
    }

    /**
     * 为尚未解析的层级记录本文件中的最后一个标题；stopAnchor 不为空时只看该锚点之前的元素
     */
    private void collectLastHeadings(Document document, String stopAnchor, String[] found) {
        String[] lastInFile = new String[4];
        for (Element element : document.getAllElements()) {
            if (stopAnchor != null && stopAnchor.equals(element.id())) {
                break;
            }
            String tag = element.normalName();
            for (int level = 0; level < levelTags.length; level++) {
                if (levelTags[level].equals(tag)) {
                    String text = element.text().trim();
                    if (!text.isEmpty()) {
                        lastInFile[level] = text;
                    }
                }
            }
        }
        for (int level = 0; level < found.length; level++) {
            if (found[level] == null) {
                found[level] = lastInFile[level];
            }
        }
    }
}
