package com.example.cpt.service.epub;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 页码区间的原始文本
 * <p>
 * 起始页不在索引中时不抛异常，而是返回 {@link #isMissing()} 为 true 的结果，
 * 其文本为描述性的错误信息，调用方需要自行检查。
 */
@Data
@AllArgsConstructor
public class PageRangeText {

    private final int startPage;
    private final int endPage;
    private final String text;
    private final List<String> fileIds;
    private final boolean missing;

    public static PageRangeText missing(int startPage, int endPage) {
        return new PageRangeText(startPage, endPage,
                "Error: Start page " + startPage + " not found.", List.of(), true);
    }
}
