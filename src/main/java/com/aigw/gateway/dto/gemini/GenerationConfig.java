package com.aigw.gateway.dto.gemini;

import com.alibaba.fastjson2.JSONObject;
import lombok.Data;

import java.util.List;

/**
 * Gemini 生成参数
 * <p>
 * 所有字段可选，null 不参与序列化。responseSchema 与 responseJsonSchema 至多其一
 */
@Data
public class GenerationConfig {

    // responseMimeType 取值
    public static final String MIME_TEXT_PLAIN = "text/plain";
    public static final String MIME_APPLICATION_JSON = "application/json";
    public static final String MIME_TEXT_ENUM = "text/x.enum";

    private Float temperature;
    private Float topP;
    private Integer seed;
    private Integer candidateCount;
    private Integer maxOutputTokens;
    private Float presencePenalty;
    private Float frequencyPenalty;
    private List<String> stopSequences;
    private Integer logprobs;
    private Boolean responseLogprobs;

    private String responseMimeType;
    private JSONObject responseSchema;
    private Object responseJsonSchema;

    private JSONObject thinkingConfig;

    public boolean hasSchema() {
        return responseSchema != null || responseJsonSchema != null;
    }
}
