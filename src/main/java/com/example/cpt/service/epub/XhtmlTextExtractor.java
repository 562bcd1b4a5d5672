package com.example.cpt.service.epub;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * XHTML内容文件的纯文本提取
 */
public class XhtmlTextExtractor {

    /**
     * 解析XHTML内容文件
     */
    public Document parse(String html) {
        return Jsoup.parse(html);
    }

    /**
     * 提取纯文本：按文档顺序收集非空文本节点，以换行分隔
     */
    public String extractText(Document document) {
        List<String> parts = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode && !isInsideIgnored(node)) {
                    String text = ((TextNode) node).getWholeText().trim();
                    if (!text.isEmpty()) {
                        parts.add(text);
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
            }
        }, document);
        return String.join("\n", parts);
    }

    public String extractText(String html) {
        return extractText(parse(html));
    }

    /**
     * 判断锚点之前（文档顺序）是否已有正文文本。
     * 锚点不存在时返回 true，调用方应保守地保留整个文件。
     */
    public boolean hasTextBefore(Document document, String anchorId) {
        Element anchor = document.getElementById(anchorId);
        if (anchor == null) {
            return true;
        }
        for (Node node : document.body().childNodes()) {
            Boolean found = scanUntil(node, anchor);
            if (found != null) {
                return found;
            }
        }
        return false;
    }

    /**
     * 深度优先扫描：遇到正文返回 true，遇到锚点返回 false，都未遇到返回 null
     */
    private Boolean scanUntil(Node node, Element anchor) {
        if (node == anchor) {
            return Boolean.FALSE;
        }
        if (node instanceof TextNode) {
            return ((TextNode) node).isBlank() || isInsideIgnored(node) ? null : Boolean.TRUE;
        }
        for (Node child : node.childNodes()) {
            Boolean found = scanUntil(child, anchor);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static boolean isInsideIgnored(Node node) {
        Node parent = node.parent();
        if (parent instanceof Element) {
            String tag = ((Element) parent).normalName();
            return "script".equals(tag) || "style".equals(tag) || "title".equals(tag);
        }
        return false;
    }
}
