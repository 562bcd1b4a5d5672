package com.example.cpt.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次抽取的页码区间（闭区间）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionChunk {
    private int startPage;
    private int endPage;

    /**
     * 产物文件名使用的区间标签，如 {@code 12_16}
     */
    public String label() {
        return startPage + "_" + endPage;
    }
}
