package com.aigw.gateway.exception;

/**
 * 协议转换异常
 * <p>
 * 不支持的内容类型、非法的 tool_choice、工具参数不是合法 JSON、
 * 重复的结构化输出声明等，都会导致本次请求转换失败
 */
public class TranslationException extends GatewayException {

    public TranslationException(String message) {
        super(message, 400);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
