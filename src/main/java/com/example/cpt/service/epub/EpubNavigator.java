package com.example.cpt.service.epub;

import com.example.cpt.dto.ChapterBoundary;
import com.example.cpt.dto.HierarchyContext;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * 分页文档导航器：在打开的EPUB及其页码索引上提供区间文本、层级上下文和章节范围查询
 */
public class EpubNavigator implements Closeable {

    private final EpubArchive archive;
    private final PageIndex pageIndex;
    private final PageRangeExtractor rangeExtractor;
    private final HierarchyResolver hierarchyResolver;
    private final ChapterBoundaryDetector boundaryDetector;

    public EpubNavigator(EpubArchive archive, PageIndex pageIndex, PageRangeExtractor rangeExtractor,
                         HierarchyResolver hierarchyResolver, ChapterBoundaryDetector boundaryDetector) {
        this.archive = archive;
        this.pageIndex = pageIndex;
        this.rangeExtractor = rangeExtractor;
        this.hierarchyResolver = hierarchyResolver;
        this.boundaryDetector = boundaryDetector;
    }

    public EpubArchive getArchive() {
        return archive;
    }

    public PageIndex getPageIndex() {
        return pageIndex;
    }

    public PageRangeText getContentByPageRange(int startPage, int endPage) {
        return rangeExtractor.getText(startPage, endPage);
    }

    public HierarchyContext getHierarchyContext(int pageNumber) {
        return hierarchyResolver.resolve(pageNumber);
    }

    public List<ChapterBoundary> getChapterBoundaries() {
        return boundaryDetector.boundaries();
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }
}
