package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerateContentResponse.UsageMetadata;

/**
 * 上报给网关计量的 token 用量
 * <p>
 * outputTokens 只统计候选输出，不含思考 token
 */
public record LlmTokenUsage(int inputTokens, int outputTokens, int totalTokens, int cachedInputTokens) {

    public static final LlmTokenUsage EMPTY = new LlmTokenUsage(0, 0, 0, 0);

    public static LlmTokenUsage from(UsageMetadata metadata) {
        if (metadata == null) {
            return EMPTY;
        }
        return new LlmTokenUsage(
                metadata.getPromptTokenCount(),
                metadata.getCandidatesTokenCount(),
                metadata.getTotalTokenCount(),
                metadata.getCachedContentTokenCount());
    }
}
