package com.example.cpt.service.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 构建好的提示词，附带原文是否被截断
 */
@Data
@AllArgsConstructor
public class Prompt {
    private final String text;
    private final boolean truncated;
    private final int inputChars;
}
