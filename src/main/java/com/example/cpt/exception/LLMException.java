package com.example.cpt.exception;

/**
 * 生成服务调用异常
 */
public class LLMException extends RuntimeException {

    private final LLMErrorType errorType;

    public LLMException(LLMErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public LLMException(LLMErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public LLMErrorType getErrorType() {
        return errorType;
    }

    /**
     * 根据HTTP状态码映射错误类型
     */
    public static LLMErrorType fromStatus(int code) {
        switch (code) {
            case 400:
            case 404:
            case 422:
                return LLMErrorType.INVALID_REQUEST;
            case 401:
            case 403:
                return LLMErrorType.AUTH_ERROR;
            case 408:
            case 504:
                return LLMErrorType.TIMEOUT;
            case 429:
                return LLMErrorType.RATE_LIMIT;
            default:
                return LLMErrorType.SERVICE_ERROR;
        }
    }

    public enum LLMErrorType {
        RATE_LIMIT,      // 限流
        TIMEOUT,         // 超时
        AUTH_ERROR,      // 认证失败
        NETWORK_ERROR,   // 网络异常
        INVALID_REQUEST, // 请求无效
        SERVICE_ERROR    // 服务异常
    }
}
