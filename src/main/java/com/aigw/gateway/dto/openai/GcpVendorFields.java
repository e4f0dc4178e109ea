package com.aigw.gateway.dto.openai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

/**
 * 随 OpenAI 请求一起传入的 GCP Vertex AI 专有字段
 *
 * @param thinkingConfig generationConfig.thinkingConfig
 * @param safetySettings safetySettings
 */
public record GcpVendorFields(JSONObject thinkingConfig, JSONArray safetySettings) {}
