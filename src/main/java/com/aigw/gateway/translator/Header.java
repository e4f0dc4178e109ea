package com.aigw.gateway.translator;

/**
 * 需要设置到请求或响应上的单个头部
 */
public record Header(String key, String value) {}
