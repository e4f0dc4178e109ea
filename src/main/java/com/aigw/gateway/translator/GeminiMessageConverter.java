package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.Content;
import com.aigw.gateway.dto.gemini.Part;
import com.aigw.gateway.dto.openai.ChatMessage;
import com.aigw.gateway.dto.openai.ChatMessage.AssistantMessage;
import com.aigw.gateway.dto.openai.ChatMessage.DeveloperMessage;
import com.aigw.gateway.dto.openai.ChatMessage.SystemMessage;
import com.aigw.gateway.dto.openai.ChatMessage.ToolCall;
import com.aigw.gateway.dto.openai.ChatMessage.ToolMessage;
import com.aigw.gateway.dto.openai.ChatMessage.UserMessage;
import com.aigw.gateway.dto.openai.ContentPart;
import com.aigw.gateway.dto.openai.ContentPart.AudioPart;
import com.aigw.gateway.dto.openai.ContentPart.FilePart;
import com.aigw.gateway.dto.openai.ContentPart.ImagePart;
import com.aigw.gateway.dto.openai.ContentPart.RefusalPart;
import com.aigw.gateway.dto.openai.ContentPart.TextPart;
import com.aigw.gateway.dto.openai.MessageContent;
import com.aigw.gateway.exception.TranslationException;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * OpenAI messages → Gemini contents + system instruction
 * <p>
 * Gemini 只有 user / model 两种角色：
 * - developer/system 消息全部合并进 system instruction
 * - user、tool 消息的 Part 先累积，遇到 assistant 消息或结束时作为一条 user 内容输出
 * - assistant 消息输出为 model 内容，先函数调用后文本
 * <p>
 * tool 消息只带 tool_call_id，函数名通过此前 assistant 消息中的 id → name 映射找回
 */
public final class GeminiMessageConverter {

    private GeminiMessageConverter() {}

    /**
     * @param contents          按原始顺序排列的对话内容
     * @param systemInstruction 没有系统提示时为 null
     */
    public record ConvertedMessages(List<Content> contents, Content systemInstruction) {}

    public static ConvertedMessages convert(List<ChatMessage> messages) {
        List<Content> contents = new ArrayList<>();
        Content systemInstruction = null;
        Map<String, String> knownToolCalls = new HashMap<>();
        List<Part> pending = new ArrayList<>();

        for (ChatMessage message : messages) {
            if (message instanceof DeveloperMessage || message instanceof SystemMessage) {
                DeveloperMessage developer = message instanceof SystemMessage system
                        ? system.toDeveloperMessage() : (DeveloperMessage) message;
                List<Part> parts = developerParts(developer);
                if (!parts.isEmpty()) {
                    if (systemInstruction == null) {
                        systemInstruction = new Content();
                    }
                    systemInstruction.getParts().addAll(parts);
                }
            } else if (message instanceof UserMessage user) {
                pending.addAll(wrap("user", () -> userParts(user)));
            } else if (message instanceof ToolMessage tool) {
                pending.add(toolPart(tool, knownToolCalls));
            } else if (message instanceof AssistantMessage assistant) {
                if (!pending.isEmpty()) {
                    contents.add(Content.user(pending));
                    pending.clear();
                }
                contents.add(Content.model(wrap("assistant", () -> assistantParts(assistant, knownToolCalls))));
            } else {
                throw new TranslationException("invalid role in message: " + message.role());
            }
        }

        if (!pending.isEmpty()) {
            contents.add(Content.user(pending));
        }
        return new ConvertedMessages(contents, systemInstruction);
    }

    // ==================== 各角色 ====================

    private static List<Part> developerParts(DeveloperMessage message) {
        List<Part> parts = new ArrayList<>();
        MessageContent<TextPart> content = message.content();
        if (content.isText()) {
            if (content.text() != null && !content.text().isEmpty()) {
                parts.add(Part.fromText(content.text()));
            }
            return parts;
        }
        for (TextPart part : content.parts()) {
            if (part.text() != null && !part.text().isEmpty()) {
                parts.add(Part.fromText(part.text()));
            }
        }
        return parts;
    }

    private static List<Part> userParts(UserMessage message) {
        List<Part> parts = new ArrayList<>();
        MessageContent<ContentPart> content = message.content();
        if (content.isText()) {
            if (content.text() != null && !content.text().isEmpty()) {
                parts.add(Part.fromText(content.text()));
            }
            return parts;
        }
        for (ContentPart part : content.parts()) {
            if (part instanceof TextPart text) {
                if (text.text() != null && !text.text().isEmpty()) {
                    parts.add(Part.fromText(text.text()));
                }
            } else if (part instanceof ImagePart image) {
                String url = image.url();
                if (url == null || url.isEmpty()) {
                    continue;
                }
                if (DataUris.isDataUri(url)) {
                    DataUris.DataUri dataUri = parseImageDataUri(url);
                    parts.add(Part.fromBytes(dataUri.data(), dataUri.mimeType()));
                } else {
                    parts.add(Part.fromUri(url, DataUris.mimeTypeByExtension(url)));
                }
            } else if (part instanceof AudioPart) {
                throw new TranslationException("audio content not supported yet");
            } else if (part instanceof FilePart) {
                throw new TranslationException("file content not supported yet");
            } else {
                throw new TranslationException("unsupported content type in user message: " + part.type());
            }
        }
        return parts;
    }

    private static DataUris.DataUri parseImageDataUri(String url) {
        try {
            return DataUris.parse(url);
        } catch (TranslationException e) {
            throw new TranslationException("failed to parse data URI: " + e.getMessage(), e);
        }
    }

    private static Part toolPart(ToolMessage message, Map<String, String> knownToolCalls) {
        String name = knownToolCalls.getOrDefault(message.toolCallId(), "");
        MessageContent<TextPart> content = message.content();
        StringBuilder output = new StringBuilder();
        if (content.isText()) {
            if (content.text() != null) {
                output.append(content.text());
            }
        } else {
            for (TextPart part : content.parts()) {
                if (part.text() != null) {
                    output.append(part.text());
                }
            }
        }
        return Part.fromFunctionResponse(name, Map.of("output", output.toString()));
    }

    private static List<Part> assistantParts(AssistantMessage message, Map<String, String> knownToolCalls) {
        List<Part> parts = new ArrayList<>();
        if (message.toolCalls() != null) {
            for (ToolCall toolCall : message.toolCalls()) {
                knownToolCalls.put(toolCall.id(), toolCall.name());
                parts.add(Part.fromFunctionCall(toolCall.name(), parseArguments(toolCall.arguments())));
            }
        }

        MessageContent<ContentPart> content = message.content();
        if (content == null) {
            return parts;
        }
        if (content.isText()) {
            if (content.text() != null && !content.text().isEmpty()) {
                parts.add(Part.fromText(content.text()));
            }
            return parts;
        }
        for (ContentPart part : content.parts()) {
            if (part instanceof TextPart text) {
                if (text.text() != null && !text.text().isEmpty()) {
                    parts.add(Part.fromText(text.text()));
                }
            } else if (!(part instanceof RefusalPart)) {
                throw new TranslationException("unsupported content type in assistant message: " + part.type());
            }
        }
        return parts;
    }

    private static JSONObject parseArguments(String arguments) {
        if (arguments == null || !JSON.isValidObject(arguments)) {
            throw new TranslationException("function arguments should be valid json string. "
                    + "failed to parse function arguments: " + arguments);
        }
        return JSON.parseObject(arguments);
    }

    // ==================== 工具方法 ====================

    private static List<Part> wrap(String role, Supplier<List<Part>> conversion) {
        try {
            return conversion.get();
        } catch (TranslationException e) {
            throw new TranslationException("error converting " + role + " message: " + e.getMessage(), e);
        }
    }
}
