package com.aigw.gateway.translator;

import java.util.List;

/**
 * 请求转换结果
 *
 * @param headers 需要替换的请求头（:path、content-length）
 * @param body    转换后的上游请求体
 */
public record RequestMutation(List<Header> headers, byte[] body) {}
