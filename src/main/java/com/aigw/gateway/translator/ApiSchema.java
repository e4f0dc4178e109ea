package com.aigw.gateway.translator;

/**
 * 上游后端的 API 协议
 */
public enum ApiSchema {
    GCP_VERTEX_AI
}
