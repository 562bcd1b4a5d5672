package com.example.cpt.service.epub;

import com.example.cpt.config.AppProperties.CacheValidation;
import com.example.cpt.dto.PageLocation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 页码索引的旁路缓存，与EPUB放在同一目录（{@code <epub>.pagemap.json}）。
 * <p>
 * 格式为 JSON 对象：字符串页码 → {@code {file_id, full_path, anchor_id}}。
 * PRESENCE 模式下缓存存在即加载，不做任何过期检查；
 * FINGERPRINT 模式额外写入 {@code <cache>.meta.json}，记录EPUB的大小与修改时间，不一致时重建。
 * 多个进程同时构建同一缓存不做互斥。
 */
@Slf4j
public class PageIndexCache {

    private static final TypeReference<LinkedHashMap<String, PageLocation>> CACHE_TYPE =
            new TypeReference<LinkedHashMap<String, PageLocation>>() {
            };

    private final ObjectMapper objectMapper;
    private final String suffix;
    private final CacheValidation validation;

    public PageIndexCache(ObjectMapper objectMapper, String suffix, CacheValidation validation) {
        this.objectMapper = objectMapper;
        this.suffix = suffix;
        this.validation = validation;
    }

    public Path cachePath(Path epubPath) {
        return epubPath.resolveSibling(epubPath.getFileName() + suffix);
    }

    Path fingerprintPath(Path epubPath) {
        Path cache = cachePath(epubPath);
        return cache.resolveSibling(cache.getFileName() + ".meta.json");
    }

    /**
     * 加载缓存；缓存不存在、校验不通过或读取失败时返回 empty，由调用方重建
     */
    public Optional<PageIndex> load(Path epubPath) {
        Path cache = cachePath(epubPath);
        if (!Files.exists(cache)) {
            return Optional.empty();
        }
        if (validation == CacheValidation.FINGERPRINT && !fingerprintMatches(epubPath)) {
            log.info("页码缓存指纹不一致, 将重建: {}", cache);
            return Optional.empty();
        }

        log.info("从缓存加载页码索引: {}", cache);
        try {
            Map<String, PageLocation> raw = objectMapper.readValue(cache.toFile(), CACHE_TYPE);
            Map<Integer, PageLocation> pages = new HashMap<>();
            for (Map.Entry<String, PageLocation> entry : raw.entrySet()) {
                pages.put(Integer.parseInt(entry.getKey().trim()), entry.getValue());
            }
            return Optional.of(new PageIndex(pages));
        } catch (IOException | NumberFormatException e) {
            log.warn("加载页码缓存失败: {}, 将重建", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 写入缓存；失败只记录日志
     */
    public void save(Path epubPath, PageIndex index) {
        Path cache = cachePath(epubPath);
        Map<String, PageLocation> raw = new LinkedHashMap<>();
        index.asMap().forEach((page, location) -> raw.put(String.valueOf(page), location));
        try {
            objectMapper.writeValue(cache.toFile(), raw);
            if (validation == CacheValidation.FINGERPRINT) {
                objectMapper.writeValue(fingerprintPath(epubPath).toFile(), fingerprint(epubPath));
            }
            log.info("页码缓存已保存: {}", cache);
        } catch (IOException e) {
            log.warn("无法保存页码缓存 {}: {}", cache, e.getMessage());
        }
    }

    private boolean fingerprintMatches(Path epubPath) {
        Path meta = fingerprintPath(epubPath);
        if (!Files.exists(meta)) {
            return false;
        }
        try {
            Map<String, Long> stored = objectMapper.readValue(meta.toFile(),
                    new TypeReference<Map<String, Long>>() {
                    });
            return fingerprint(epubPath).equals(stored);
        } catch (IOException e) {
            log.warn("读取缓存指纹失败: {}", e.getMessage());
            return false;
        }
    }

    private Map<String, Long> fingerprint(Path epubPath) throws IOException {
        Map<String, Long> fingerprint = new LinkedHashMap<>();
        fingerprint.put("size", Files.size(epubPath));
        fingerprint.put("last_modified", Files.getLastModifiedTime(epubPath).toMillis());
        return fingerprint;
    }
}
