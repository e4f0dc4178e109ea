package com.aigw.gateway.exception;

/**
 * 请求体解码异常（字段形状与 OpenAI 协议不符）
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(message, 400);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
