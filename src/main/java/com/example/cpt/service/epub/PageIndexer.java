package com.example.cpt.service.epub;

import com.example.cpt.dto.PageLocation;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 页码索引构建器
 * <p>
 * 按spine顺序逐个扫描内容文件，查找 id 匹配页码模式的元素（默认 {@code page_N}），
 * 记录页码首次出现的位置。同一页码重复出现时保留spine顺序中最先出现的一个。
 * 单个文件读取或解析失败只记录日志并跳过，得到的是不完整但可用的索引。
 */
@Slf4j
public class PageIndexer {

    private final Pattern markerPattern;
    private final XhtmlTextExtractor textExtractor;

    public PageIndexer(Pattern markerPattern, XhtmlTextExtractor textExtractor) {
        if (markerPattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("页码标记模式必须包含一个捕获页码的分组: " + markerPattern.pattern());
        }
        this.markerPattern = markerPattern;
        this.textExtractor = textExtractor;
    }

    public PageIndex build(EpubArchive archive) {
        List<String> spine = archive.getSpine();
        log.info("开始构建页码索引: 扫描 {} 个文件", spine.size());

        Map<Integer, PageLocation> pages = new HashMap<>();
        int duplicates = 0;
        int skippedFiles = 0;

        for (int index = 0; index < spine.size(); index++) {
            String fileId = spine.get(index);
            if (index % 10 == 0) {
                log.debug("扫描文件 {}/{}...", index + 1, spine.size());
            }

            String fullPath = archive.resolvePath(fileId);
            if (fullPath == null) {
                log.warn("spine条目在manifest中不存在, 跳过: {}", fileId);
                skippedFiles++;
                continue;
            }

            try {
                Document document = textExtractor.parse(archive.read(fullPath));
                for (Element element : document.getElementsByAttribute("id")) {
                    Matcher matcher = markerPattern.matcher(element.id());
                    if (!matcher.find()) {
                        continue;
                    }
                    int pageNumber;
                    try {
                        pageNumber = Integer.parseInt(matcher.group(1));
                    } catch (NumberFormatException e) {
                        log.warn("页码标记无法解析, 忽略: {} in {}", element.id(), fullPath);
                        continue;
                    }
                    if (pages.containsKey(pageNumber)) {
                        duplicates++;
                        continue;
                    }
                    pages.put(pageNumber, new PageLocation(fileId, fullPath, element.id()));
                }
            } catch (Exception e) {
                log.warn("扫描文件失败, 跳过: {} - {}", fullPath, e.getMessage());
                skippedFiles++;
            }
        }

        if (duplicates > 0) {
            log.info("忽略 {} 个重复页码标记（保留首次出现）", duplicates);
        }
        log.info("页码索引构建完成: {} 页, 跳过文件 {} 个", pages.size(), skippedFiles);
        return new PageIndex(pages);
    }
}
