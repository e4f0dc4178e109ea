package com.aigw.gateway.dto.gemini;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.annotation.JSONField;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Vertex AI generateContent / streamGenerateContent 请求体
 */
@Data
public class GenerateContentRequest {

    private List<Content> contents = new ArrayList<>();
    private List<Tool> tools;

    @JSONField(name = "tool_config")
    private ToolConfig toolConfig;

    @JSONField(name = "generation_config")
    private GenerationConfig generationConfig;

    @JSONField(name = "system_instruction")
    private Content systemInstruction;

    private JSONArray safetySettings;
}
