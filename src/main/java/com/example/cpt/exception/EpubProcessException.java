package com.example.cpt.exception;

/**
 * EPUB处理异常 - 归档无法打开或缺少 container / OPF 时抛出
 */
public class EpubProcessException extends RuntimeException {

    public EpubProcessException(String message) {
        super(message);
    }

    public EpubProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
