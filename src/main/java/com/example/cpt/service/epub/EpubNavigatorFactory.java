package com.example.cpt.service.epub;

import com.example.cpt.config.AppProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 打开EPUB并装配导航器：优先加载页码缓存，缓存不可用时全量扫描并写回缓存
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EpubNavigatorFactory {

    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public EpubNavigator open(Path epubPath) {
        AppProperties.EpubConfig config = appProperties.getEpub();
        XhtmlTextExtractor textExtractor = new XhtmlTextExtractor();

        EpubArchive archive = new EpubArchive(epubPath);
        PageIndex pageIndex = loadOrBuildIndex(archive, textExtractor);

        List<String> levelTags = List.of(config.getSectionTag(), config.getSubsectionTag(),
                config.getSubheadingTag(), config.getTopicTag());

        return new EpubNavigator(
                archive,
                pageIndex,
                new PageRangeExtractor(archive, pageIndex, textExtractor),
                new HierarchyResolver(archive, pageIndex, textExtractor, levelTags, config.getHierarchyStrictness()),
                new ChapterBoundaryDetector(archive.getSpine(), pageIndex));
    }

    private PageIndex loadOrBuildIndex(EpubArchive archive, XhtmlTextExtractor textExtractor) {
        AppProperties.EpubConfig config = appProperties.getEpub();
        PageIndexCache cache = new PageIndexCache(objectMapper, config.getCacheSuffix(), config.getCacheValidation());

        Optional<PageIndex> cached = cache.load(archive.getEpubPath());
        if (cached.isPresent()) {
            log.info("页码索引来自缓存: {} 页", cached.get().size());
            return cached.get();
        }

        PageIndexer indexer = new PageIndexer(Pattern.compile(config.getPageMarkerPattern()), textExtractor);
        PageIndex built = indexer.build(archive);
        cache.save(archive.getEpubPath(), built);
        return built;
    }
}
