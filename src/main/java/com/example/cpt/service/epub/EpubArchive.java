package com.example.cpt.service.epub;

import com.example.cpt.exception.EpubProcessException;
import lombok.extern.slf4j.Slf4j;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.FileHeader;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EPUB归档读取器
 * <p>
 * 打开时读取 META-INF/container.xml 定位OPF，解析 manifest（id → href）
 * 与 spine（阅读顺序）。两者在打开后不再变化，spine 顺序从不重排。
 */
@Slf4j
public class EpubArchive implements Closeable {

    static final String CONTAINER_PATH = "META-INF/container.xml";

    private final Path epubPath;
    private final ZipFile zipFile;
    private final String opfPath;
    private final String opfDir;
    private final Map<String, String> manifest;
    private final List<String> spine;

    public EpubArchive(Path epubPath) {
        if (!Files.isRegularFile(epubPath)) {
            throw new EpubProcessException("EPUB文件不存在: " + epubPath);
        }
        this.epubPath = epubPath;
        this.zipFile = new ZipFile(epubPath.toFile());
        try {
            this.opfPath = findOpfPath();
            int slash = opfPath.lastIndexOf('/');
            this.opfDir = slash >= 0 ? opfPath.substring(0, slash) : "";

            Document opf = parseXml(readRequired(opfPath, "OPF"));
            this.manifest = Collections.unmodifiableMap(parseManifest(opf));
            this.spine = Collections.unmodifiableList(parseSpine(opf));
        } catch (RuntimeException e) {
            closeQuietly();
            throw e;
        }
        log.info("EPUB已打开: {}, OPF={}, spine文件数={}, manifest条目数={}",
                epubPath.getFileName(), opfPath, spine.size(), manifest.size());
    }

    public Path getEpubPath() {
        return epubPath;
    }

    public String getOpfPath() {
        return opfPath;
    }

    public List<String> getSpine() {
        return spine;
    }

    public Map<String, String> getManifest() {
        return manifest;
    }

    /**
     * spine id 对应的归档内完整路径；manifest 中没有该 id 时返回 null
     */
    public String resolvePath(String fileId) {
        String href = manifest.get(fileId);
        if (href == null) {
            return null;
        }
        return opfDir.isEmpty() ? href : opfDir + "/" + href;
    }

    /**
     * 读取归档内文件内容（UTF-8）
     */
    public String read(String fullPath) throws IOException {
        FileHeader header = zipFile.getFileHeader(fullPath);
        if (header == null) {
            throw new IOException("归档中不存在: " + fullPath);
        }
        try (InputStream is = zipFile.getInputStream(header)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String findOpfPath() {
        Document container = parseXml(readRequired(CONTAINER_PATH, "container"));
        Element rootfile = container.selectFirst("rootfile");
        if (rootfile == null || rootfile.attr("full-path").isEmpty()) {
            throw new EpubProcessException("container.xml 中没有 rootfile: " + epubPath);
        }
        return rootfile.attr("full-path");
    }

    private Map<String, String> parseManifest(Document opf) {
        Map<String, String> items = new LinkedHashMap<>();
        for (Element item : opf.select("item")) {
            String id = item.attr("id");
            if (!id.isEmpty()) {
                items.put(id, item.attr("href"));
            }
        }
        return items;
    }

    private List<String> parseSpine(Document opf) {
        Element spineElement = opf.selectFirst("spine");
        if (spineElement == null) {
            throw new EpubProcessException("OPF 中没有 spine: " + opfPath);
        }
        List<String> ids = new ArrayList<>();
        for (Element itemref : spineElement.select("itemref")) {
            ids.add(itemref.attr("idref"));
        }
        return ids;
    }

    private String readRequired(String fullPath, String what) {
        try {
            return read(fullPath);
        } catch (IOException e) {
            throw new EpubProcessException("无法读取" + what + " (" + fullPath + "): " + e.getMessage(), e);
        }
    }

    private static Document parseXml(String xml) {
        return Jsoup.parse(xml, "", Parser.xmlParser());
    }

    private void closeQuietly() {
        try {
            zipFile.close();
        } catch (IOException e) {
            log.warn("关闭EPUB失败: {}", epubPath, e);
        }
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }
}
