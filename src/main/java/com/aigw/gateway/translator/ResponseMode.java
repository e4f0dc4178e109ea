package com.aigw.gateway.translator;

/**
 * 结构化输出模式，决定响应文本的后处理方式
 */
public enum ResponseMode {
    NONE,
    TEXT,
    JSON,
    ENUM,
    // 用 STRING + pattern 的 schema 模拟，返回文本会被包上一层双引号
    REGEX
}
