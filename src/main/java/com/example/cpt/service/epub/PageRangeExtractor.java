package com.example.cpt.service.epub;

import com.example.cpt.dto.PageLocation;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * 按页码区间提取文本，粒度为整个文件
 * <p>
 * 从起始页所在文件开始，按spine顺序拼接到 {@code endPage + 1} 所在文件为止。
 * 首尾文件整体返回，包括起始页之前和结束页之后的内容，交给提示词容忍。
 * {@code endPage + 1} 不在索引中时没有终止文件，一直读到spine末尾。
 * 终止文件以下一页的标记开头、标记前没有任何正文时，该文件不含结束页内容，不计入。
 */
@Slf4j
public class PageRangeExtractor {

    private final EpubArchive archive;
    private final PageIndex pageIndex;
    private final XhtmlTextExtractor textExtractor;

    public PageRangeExtractor(EpubArchive archive, PageIndex pageIndex, XhtmlTextExtractor textExtractor) {
        this.archive = archive;
        this.pageIndex = pageIndex;
        this.textExtractor = textExtractor;
    }

    public PageRangeText getText(int startPage, int endPage) {
        PageLocation start = pageIndex.get(startPage);
        if (start == null) {
            log.warn("起始页 {} 不在页码索引中", startPage);
            return PageRangeText.missing(startPage, endPage);
        }
        PageLocation stop = pageIndex.get(endPage + 1);

        List<String> parts = new ArrayList<>();
        List<String> fileIds = new ArrayList<>();
        boolean collecting = false;

        for (String fileId : archive.getSpine()) {
            if (!collecting && !fileId.equals(start.getFileId())) {
                continue;
            }
            boolean startFile = !collecting;
            collecting = true;
            boolean stopFile = stop != null && fileId.equals(stop.getFileId());

            String fullPath = archive.resolvePath(fileId);
            if (fullPath == null) {
                log.warn("spine条目在manifest中不存在, 跳过: {}", fileId);
            } else {
                try {
                    Document document = textExtractor.parse(archive.read(fullPath));
                    if (!stopFile || startFile || textExtractor.hasTextBefore(document, stop.getAnchorId())) {
                        parts.add(textExtractor.extractText(document));
                        fileIds.add(fileId);
                    }
                } catch (Exception e) {
                    log.warn("读取文件失败, 跳过: {} - {}", fullPath, e.getMessage());
                }
            }

            if (stopFile) {
                break;
            }
        }

        log.debug("页 {}-{} 覆盖文件: {}", startPage, endPage, fileIds);
        return new PageRangeText(startPage, endPage, String.join("\n", parts), fileIds, false);
    }
}
