package com.example.cpt.service.epub;

import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.ZipParameters;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用的最小EPUB构建器：OPF 位于 OEBPS/content.opf，内容文件位于 OEBPS/ 下
 */
public class EpubFixture {

    private final Map<String, String> manifest = new LinkedHashMap<>();
    private final List<String> spine = new ArrayList<>();
    private final Map<String, String> files = new LinkedHashMap<>();
    private boolean withSpine = true;

    /**
     * 添加一个内容文件，同时加入 manifest 与 spine
     */
    public EpubFixture add(String id, String href, String xhtml) {
        manifest.put(id, href);
        spine.add(id);
        files.put("OEBPS/" + href, xhtml);
        return this;
    }

    /**
     * 只在spine中引用、manifest中不存在的条目
     */
    public EpubFixture addDanglingSpineRef(String id) {
        spine.add(id);
        return this;
    }

    /**
     * manifest 与 spine 中都有、但归档中缺失文件的条目
     */
    public EpubFixture addMissingFile(String id, String href) {
        manifest.put(id, href);
        spine.add(id);
        return this;
    }

    public EpubFixture withoutSpine() {
        this.withSpine = false;
        return this;
    }

    public Path write(Path target) throws IOException {
        try (ZipFile zip = new ZipFile(target.toFile())) {
            put(zip, "mimetype", "application/epub+zip");
            put(zip, EpubArchive.CONTAINER_PATH, "<?xml version=\"1.0\"?>\n"
                    + "<container version=\"1.0\" xmlns=\"urn:oasis:names:tc:opendocument:xmlns:container\">\n"
                    + "  <rootfiles>\n"
                    + "    <rootfile full-path=\"OEBPS/content.opf\" media-type=\"application/oebps-package+xml\"/>\n"
                    + "  </rootfiles>\n"
                    + "</container>");
            put(zip, "OEBPS/content.opf", opf());
            for (Map.Entry<String, String> file : files.entrySet()) {
                put(zip, file.getKey(), file.getValue());
            }
        }
        return target;
    }

    public static String xhtml(String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title>Chapter</title></head>\n"
                + "<body>" + body + "</body></html>";
    }

    public static String marker(int page) {
        return "<span id=\"page_" + page + "\"></span>";
    }

    private String opf() {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\"?>\n<package xmlns=\"http://www.idpf.org/2007/opf\" version=\"3.0\">\n");
        sb.append("  <manifest>\n");
        manifest.forEach((id, href) -> sb.append("    <item id=\"").append(id).append("\" href=\"").append(href)
                .append("\" media-type=\"application/xhtml+xml\"/>\n"));
        sb.append("  </manifest>\n");
        if (withSpine) {
            sb.append("  <spine>\n");
            spine.forEach(id -> sb.append("    <itemref idref=\"").append(id).append("\"/>\n"));
            sb.append("  </spine>\n");
        }
        sb.append("</package>");
        return sb.toString();
    }

    private static void put(ZipFile zip, String name, String content) throws IOException {
        ZipParameters parameters = new ZipParameters();
        parameters.setFileNameInZip(name);
        zip.addStream(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), parameters);
    }
}
