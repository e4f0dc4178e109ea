package com.aigw.gateway.exception;

/**
 * 上游响应体读取失败
 */
public class ResponseReadException extends GatewayException {

    public ResponseReadException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
