package com.aigw.gateway.dto.openai;

import com.aigw.gateway.dto.openai.ChatMessage.AssistantMessage;
import com.aigw.gateway.dto.openai.ChatMessage.DeveloperMessage;
import com.aigw.gateway.dto.openai.ChatMessage.SystemMessage;
import com.aigw.gateway.dto.openai.ChatMessage.ToolCall;
import com.aigw.gateway.dto.openai.ChatMessage.ToolMessage;
import com.aigw.gateway.dto.openai.ChatMessage.UserMessage;
import com.aigw.gateway.dto.openai.ContentPart.AudioPart;
import com.aigw.gateway.dto.openai.ContentPart.FilePart;
import com.aigw.gateway.dto.openai.ContentPart.ImagePart;
import com.aigw.gateway.dto.openai.ContentPart.RefusalPart;
import com.aigw.gateway.dto.openai.ContentPart.TextPart;
import com.aigw.gateway.exception.InvalidRequestException;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * OpenAI Chat Completions 请求解码器
 * <p>
 * 把原始 JSON 解码为 {@link ChatCompletionRequest}。content、stop、tool_choice
 * 等联合类型字段在这里被收窄为明确的变体，形状不符直接报错
 */
public final class ChatCompletionRequestDecoder {

    private static final Set<String> TEXT_ONLY = Set.of("text");
    private static final Set<String> USER_PART_TYPES = Set.of("text", "image_url", "input_audio", "file");
    private static final Set<String> ASSISTANT_PART_TYPES = Set.of("text", "refusal");

    private ChatCompletionRequestDecoder() {}

    public static ChatCompletionRequest decode(byte[] raw) {
        JSONObject json;
        try {
            json = JSON.parseObject(new String(raw, StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new InvalidRequestException("request body is not valid JSON: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new InvalidRequestException("request body is empty");
        }
        return decode(json);
    }

    public static ChatCompletionRequest decode(JSONObject json) {
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(json.getString("model"));
        request.setStream(json.getBooleanValue("stream", false));

        JSONArray messages = json.getJSONArray("messages");
        if (messages != null) {
            List<ChatMessage> decoded = new ArrayList<>(messages.size());
            for (int i = 0; i < messages.size(); i++) {
                decoded.add(decodeMessage(messages.getJSONObject(i)));
            }
            request.setMessages(decoded);
        }

        request.setTemperature(json.getDouble("temperature"));
        request.setTopP(json.getDouble("top_p"));
        request.setSeed(json.getLong("seed"));
        request.setN(json.getLong("n"));
        Long maxTokens = json.getLong("max_tokens");
        request.setMaxTokens(maxTokens != null ? maxTokens : json.getLong("max_completion_tokens"));
        request.setPresencePenalty(json.getFloat("presence_penalty"));
        request.setFrequencyPenalty(json.getFloat("frequency_penalty"));
        request.setLogprobs(json.getBoolean("logprobs"));
        request.setTopLogprobs(json.getLong("top_logprobs"));
        request.setStop(decodeStop(json.get("stop")));

        request.setTools(decodeTools(json.getJSONArray("tools")));
        request.setToolChoice(decodeToolChoice(json.get("tool_choice")));

        request.setResponseFormat(decodeResponseFormat(json.getJSONObject("response_format")));
        JSONArray guidedChoice = json.getJSONArray("guided_choice");
        if (guidedChoice != null) {
            request.setGuidedChoice(guidedChoice.toJavaList(String.class));
        }
        String guidedRegex = json.getString("guided_regex");
        if (guidedRegex != null && !guidedRegex.isEmpty()) {
            request.setGuidedRegex(guidedRegex);
        }
        request.setGuidedJson(json.getJSONObject("guided_json"));

        JSONObject generationConfig = json.getJSONObject("generationConfig");
        JSONArray safetySettings = json.getJSONArray("safetySettings");
        if (generationConfig != null || safetySettings != null) {
            JSONObject thinkingConfig = generationConfig != null ? generationConfig.getJSONObject("thinkingConfig") : null;
            request.setGcpVendorFields(new GcpVendorFields(thinkingConfig, safetySettings));
        }
        return request;
    }

    // ==================== 消息 ====================

    private static ChatMessage decodeMessage(JSONObject msg) {
        if (msg == null) {
            throw new InvalidRequestException("message must be a JSON object");
        }
        String role = msg.getString("role");
        if (role == null) {
            throw new InvalidRequestException("message is missing role");
        }
        Object content = msg.get("content");
        return switch (role) {
            case "developer" -> new DeveloperMessage(
                    decodeTextContent(role, content), msg.getString("name"));
            case "system" -> new SystemMessage(
                    decodeTextContent(role, content), msg.getString("name"));
            case "user" -> new UserMessage(
                    decodeContent(role, content, USER_PART_TYPES), msg.getString("name"));
            case "assistant" -> new AssistantMessage(
                    content == null ? null : decodeContent(role, content, ASSISTANT_PART_TYPES),
                    decodeToolCalls(msg.getJSONArray("tool_calls")));
            case "tool" -> new ToolMessage(
                    msg.getString("tool_call_id"), decodeTextContent(role, content));
            default -> throw new InvalidRequestException("unsupported message role: " + role
                    + " (content type " + typeName(content) + ")");
        };
    }

    private static MessageContent<TextPart> decodeTextContent(String role, Object content) {
        MessageContent<ContentPart> decoded = decodeContent(role, content, TEXT_ONLY);
        if (decoded.isText()) {
            return MessageContent.ofText(decoded.text());
        }
        List<TextPart> parts = new ArrayList<>(decoded.parts().size());
        for (ContentPart part : decoded.parts()) {
            parts.add((TextPart) part);
        }
        return MessageContent.ofParts(parts);
    }

    private static MessageContent<ContentPart> decodeContent(String role, Object content, Set<String> allowedTypes) {
        if (content instanceof String s) {
            return MessageContent.ofText(s);
        }
        if (content instanceof JSONArray arr) {
            List<ContentPart> parts = new ArrayList<>(arr.size());
            for (int i = 0; i < arr.size(); i++) {
                Object element = arr.get(i);
                if (!(element instanceof JSONObject block)) {
                    throw new InvalidRequestException("unsupported content part in " + role
                            + " message: " + typeName(element));
                }
                String type = block.getString("type");
                if (type == null || !allowedTypes.contains(type)) {
                    throw new InvalidRequestException("unsupported content part type in " + role
                            + " message: " + type);
                }
                parts.add(decodePart(type, block));
            }
            return MessageContent.ofParts(parts);
        }
        throw new InvalidRequestException("unsupported content type in " + role + " message: " + typeName(content));
    }

    private static ContentPart decodePart(String type, JSONObject block) {
        return switch (type) {
            case "text" -> new TextPart(block.getString("text"));
            case "refusal" -> new RefusalPart(block.getString("refusal"));
            case "image_url" -> {
                JSONObject imageUrl = block.getJSONObject("image_url");
                if (imageUrl == null) {
                    throw new InvalidRequestException("image_url part is missing image_url object");
                }
                yield new ImagePart(imageUrl.getString("url"), imageUrl.getString("detail"));
            }
            case "input_audio" -> {
                JSONObject audio = block.getJSONObject("input_audio");
                yield audio == null ? new AudioPart(null, null)
                        : new AudioPart(audio.getString("data"), audio.getString("format"));
            }
            case "file" -> {
                JSONObject file = block.getJSONObject("file");
                yield file == null ? new FilePart(null, null, null)
                        : new FilePart(file.getString("file_id"), file.getString("filename"), file.getString("file_data"));
            }
            default -> throw new InvalidRequestException("unsupported content part type: " + type);
        };
    }

    private static List<ToolCall> decodeToolCalls(JSONArray toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        List<ToolCall> result = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < toolCalls.size(); i++) {
            JSONObject tc = toolCalls.getJSONObject(i);
            JSONObject function = tc.getJSONObject("function");
            if (function == null) {
                throw new InvalidRequestException("tool call " + tc.getString("id") + " is missing function");
            }
            result.add(new ToolCall(tc.getString("id"), function.getString("name"), function.getString("arguments")));
        }
        return result;
    }

    // ==================== 其它联合类型字段 ====================

    private static List<String> decodeStop(Object stop) {
        if (stop == null) {
            return null;
        }
        if (stop instanceof String s) {
            return List.of(s);
        }
        if (stop instanceof JSONArray arr) {
            return arr.toJavaList(String.class);
        }
        throw new InvalidRequestException("invalid type for stop parameter: " + typeName(stop));
    }

    private static List<Tool> decodeTools(JSONArray tools) {
        if (tools == null) {
            return null;
        }
        List<Tool> result = new ArrayList<>(tools.size());
        for (int i = 0; i < tools.size(); i++) {
            JSONObject tool = tools.getJSONObject(i);
            JSONObject function = tool.getJSONObject("function");
            Tool.Function fn = function == null ? null : new Tool.Function(
                    function.getString("name"),
                    function.getString("description"),
                    function.getJSONObject("parameters"));
            result.add(new Tool(tool.getString("type"), fn));
        }
        return result;
    }

    private static ToolChoice decodeToolChoice(Object toolChoice) {
        if (toolChoice == null) {
            return null;
        }
        if (toolChoice instanceof String s) {
            return ToolChoice.ofMode(s);
        }
        if (toolChoice instanceof JSONObject obj) {
            JSONObject function = obj.getJSONObject("function");
            if (function != null && function.getString("name") != null) {
                return ToolChoice.ofFunction(function.getString("name"));
            }
        }
        throw new InvalidRequestException("unsupported tool choice type: " + typeName(toolChoice));
    }

    private static ResponseFormat decodeResponseFormat(JSONObject format) {
        if (format == null) {
            return null;
        }
        String type = format.getString("type");
        if (ResponseFormat.TYPE_JSON_SCHEMA.equals(type)) {
            JSONObject jsonSchema = format.getJSONObject("json_schema");
            if (jsonSchema == null) {
                throw new InvalidRequestException("response_format json_schema is missing json_schema object");
            }
            Object schema = jsonSchema.get("schema");
            if (schema != null && !(schema instanceof JSONObject)) {
                throw new InvalidRequestException("invalid JSON schema: expected object, got " + typeName(schema));
            }
            return new ResponseFormat(type, jsonSchema.getString("name"), (JSONObject) schema);
        }
        if (ResponseFormat.TYPE_TEXT.equals(type) || ResponseFormat.TYPE_JSON_OBJECT.equals(type)) {
            return new ResponseFormat(type, null, null);
        }
        throw new InvalidRequestException("unsupported response_format type: " + type);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
