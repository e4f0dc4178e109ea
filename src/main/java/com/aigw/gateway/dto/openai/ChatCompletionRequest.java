package com.aigw.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI Chat Completions 请求（已解码）
 * <p>
 * 仅保留转换需要的字段，标量字段为 null 表示客户端未设置
 */
@Data
public class ChatCompletionRequest {

    private String model;
    private List<ChatMessage> messages = new ArrayList<>();
    private boolean stream;

    private Double temperature;
    private Double topP;
    private Long seed;
    private Long n;
    private Long maxTokens;
    private Float presencePenalty;
    private Float frequencyPenalty;
    private Boolean logprobs;
    private Long topLogprobs;
    // 字符串形式的 stop 会被归一化为单元素列表
    private List<String> stop;

    private List<Tool> tools;
    private ToolChoice toolChoice;

    // 结构化输出，四者互斥
    private ResponseFormat responseFormat;
    private List<String> guidedChoice;
    private String guidedRegex;
    private JSONObject guidedJson;

    private GcpVendorFields gcpVendorFields;
}
