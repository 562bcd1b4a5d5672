package com.example.cpt.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个spine文件覆盖的页码范围
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChapterBoundary {
    private String fileId;
    private int startPage;
    private int endPage;

    public boolean overlaps(int start, int end) {
        return Math.max(startPage, start) <= Math.min(endPage, end);
    }
}
