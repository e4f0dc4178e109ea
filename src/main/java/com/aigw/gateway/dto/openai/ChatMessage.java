package com.aigw.gateway.dto.openai;

import com.aigw.gateway.dto.openai.ContentPart.TextPart;

import java.util.List;

/**
 * OpenAI 对话消息，按 role 区分为五种
 */
public interface ChatMessage {

    String role();

    record DeveloperMessage(MessageContent<TextPart> content, String name) implements ChatMessage {
        @Override
        public String role() { return "developer"; }
    }

    /**
     * system 消息已被 OpenAI 标记为过时，转换时按 developer 消息处理
     */
    record SystemMessage(MessageContent<TextPart> content, String name) implements ChatMessage {
        @Override
        public String role() { return "system"; }

        public DeveloperMessage toDeveloperMessage() {
            return new DeveloperMessage(content, name);
        }
    }

    record UserMessage(MessageContent<ContentPart> content, String name) implements ChatMessage {
        @Override
        public String role() { return "user"; }
    }

    /**
     * @param content   可为 null（仅包含工具调用时）
     * @param toolCalls 工具调用列表，可为空
     */
    record AssistantMessage(MessageContent<ContentPart> content, List<ToolCall> toolCalls) implements ChatMessage {
        @Override
        public String role() { return "assistant"; }
    }

    record ToolMessage(String toolCallId, MessageContent<TextPart> content) implements ChatMessage {
        @Override
        public String role() { return "tool"; }
    }

    /**
     * @param arguments JSON 编码的参数字符串
     */
    record ToolCall(String id, String name, String arguments) {}
}
