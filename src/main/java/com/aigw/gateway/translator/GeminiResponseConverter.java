package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerateContentResponse;
import com.aigw.gateway.dto.gemini.GenerateContentResponse.Candidate;
import com.aigw.gateway.dto.gemini.GenerateContentResponse.LogprobsCandidate;
import com.aigw.gateway.dto.gemini.GenerateContentResponse.LogprobsResult;
import com.aigw.gateway.dto.gemini.GenerateContentResponse.TopCandidates;
import com.aigw.gateway.dto.gemini.GenerateContentResponse.UsageMetadata;
import com.aigw.gateway.dto.gemini.Part;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;
import java.util.UUID;
import java.util.function.IntSupplier;

/**
 * Gemini GenerateContentResponse → OpenAI chat.completion / chat.completion.chunk
 */
public final class GeminiResponseConverter {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_TOOL_CALLS = "tool_calls";
    public static final String FINISH_LENGTH = "length";
    public static final String FINISH_CONTENT_FILTER = "content_filter";

    private GeminiResponseConverter() {}

    /**
     * 非流式响应。没有候选时不输出 choices，没有用量时不输出 usage
     */
    public static JSONObject toChatCompletion(GenerateContentResponse response, ResponseMode mode) {
        JSONObject result = new JSONObject();
        if (response.getModelVersion() != null && !response.getModelVersion().isEmpty()) {
            result.put("model", response.getModelVersion());
        }
        List<Candidate> candidates = response.getCandidates();
        if (candidates != null && !candidates.isEmpty()) {
            JSONArray choices = new JSONArray(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                Candidate candidate = candidates.get(i);
                if (candidate != null) {
                    choices.add(toChoice(i, candidate, mode));
                }
            }
            result.put("choices", choices);
        }
        result.put("object", "chat.completion");
        if (response.getUsageMetadata() != null) {
            result.put("usage", toUsage(response.getUsageMetadata()));
        }
        return result;
    }

    /**
     * 流式响应的一帧
     *
     * @param nextToolIndex 整个交换内连续递增的工具调用序号
     */
    public static JSONObject toChatCompletionChunk(GenerateContentResponse response, ResponseMode mode,
                                                   IntSupplier nextToolIndex) {
        JSONArray choices = new JSONArray();
        List<Candidate> candidates = response.getCandidates();
        if (candidates != null) {
            for (int i = 0; i < candidates.size(); i++) {
                Candidate candidate = candidates.get(i);
                if (candidate == null) {
                    continue;
                }
                JSONObject delta = new JSONObject();
                JSONArray toolCalls = new JSONArray();
                if (candidate.getContent() != null) {
                    String text = extractText(candidate.getContent().getParts(), mode);
                    if (!text.isEmpty()) {
                        delta.put("content", text);
                    }
                    for (Part part : nullSafe(candidate.getContent().getParts())) {
                        if (part != null && part.getFunctionCall() != null) {
                            JSONObject toolCall = toToolCall(part);
                            toolCall.put("index", nextToolIndex.getAsInt());
                            toolCalls.add(toolCall);
                        }
                    }
                }
                delta.put("role", "assistant");
                if (!toolCalls.isEmpty()) {
                    delta.put("tool_calls", toolCalls);
                }

                JSONObject choice = JSONObject.of("index", i, "delta", delta);
                String finishReason = toFinishReason(candidate.getFinishReason(), toolCalls.size());
                if (!finishReason.isEmpty()) {
                    choice.put("finish_reason", finishReason);
                }
                choices.add(choice);
            }
        }

        JSONObject chunk = JSONObject.of(
                "choices", choices, //
                "object", "chat.completion.chunk" //
        );
        if (response.getUsageMetadata() != null) {
            chunk.put("usage", toUsage(response.getUsageMetadata()));
        }
        return chunk;
    }

    // ==================== choice ====================

    private static JSONObject toChoice(int index, Candidate candidate, ResponseMode mode) {
        JSONObject message = JSONObject.of("role", "assistant");
        JSONArray toolCalls = new JSONArray();
        if (candidate.getContent() != null) {
            List<Part> parts = candidate.getContent().getParts();
            String text = extractText(parts, mode);
            for (Part part : nullSafe(parts)) {
                if (part != null && part.getFunctionCall() != null) {
                    toolCalls.add(toToolCall(part));
                }
            }
            // 没有文本但有工具调用时 content 置空，而不是空串
            if (!text.isEmpty() || toolCalls.isEmpty()) {
                message.put("content", text);
            }
            if (!toolCalls.isEmpty()) {
                message.put("tool_calls", toolCalls);
            }
        }
        if (candidate.getSafetyRatings() != null && !candidate.getSafetyRatings().isEmpty()) {
            message.put("safety_ratings", candidate.getSafetyRatings());
        }

        JSONObject choice = JSONObject.of("index", index, "message", message);
        if (candidate.getLogprobsResult() != null) {
            choice.put("logprobs", toLogprobs(candidate.getLogprobsResult()));
        }
        String finishReason = toFinishReason(candidate.getFinishReason(), toolCalls.size());
        if (!finishReason.isEmpty()) {
            choice.put("finish_reason", finishReason);
        }
        return choice;
    }

    /**
     * STOP 且有工具调用 → tool_calls，STOP → stop，MAX_TOKENS → length，
     * 空串（流式中间帧）→ 空串，其余一律 content_filter
     */
    static String toFinishReason(String reason, int toolCallCount) {
        if (reason == null || reason.isEmpty()) {
            return "";
        }
        if (GenerateContentResponse.FINISH_STOP.equals(reason)) {
            return toolCallCount > 0 ? FINISH_TOOL_CALLS : FINISH_STOP;
        }
        if (GenerateContentResponse.FINISH_MAX_TOKENS.equals(reason)) {
            return FINISH_LENGTH;
        }
        return FINISH_CONTENT_FILTER;
    }

    static String extractText(List<Part> parts, ResponseMode mode) {
        StringBuilder text = new StringBuilder();
        for (Part part : nullSafe(parts)) {
            if (part == null || part.getText() == null || part.getText().isEmpty()) {
                continue;
            }
            String value = part.getText();
            if (mode == ResponseMode.REGEX) {
                value = unquote(value);
            }
            text.append(value);
        }
        return text.toString();
    }

    /**
     * 去掉首尾各一个双引号
     */
    private static String unquote(String text) {
        String result = text.startsWith("\"") ? text.substring(1) : text;
        return result.endsWith("\"") ? result.substring(0, result.length() - 1) : result;
    }

    private static JSONObject toToolCall(Part part) {
        Part.FunctionCall call = part.getFunctionCall();
        return JSONObject.of(
                "id", UUID.randomUUID().toString(), //
                "type", "function", //
                "function", JSONObject.of( //
                        "name", call.getName(), //
                        "arguments", JSON.toJSONString(call.getArgs()) //
                ) //
        );
    }

    // ==================== usage / logprobs ====================

    /**
     * completion_tokens 包含思考 token
     */
    static JSONObject toUsage(UsageMetadata metadata) {
        JSONObject usage = JSONObject.of(
                "prompt_tokens", metadata.getPromptTokenCount(), //
                "completion_tokens", metadata.getCandidatesTokenCount() + metadata.getThoughtsTokenCount(), //
                "total_tokens", metadata.getTotalTokenCount() //
        );
        JSONObject completionDetails = new JSONObject();
        if (metadata.getThoughtsTokenCount() > 0) {
            completionDetails.put("reasoning_tokens", metadata.getThoughtsTokenCount());
        }
        JSONObject promptDetails = new JSONObject();
        if (metadata.getCachedContentTokenCount() > 0) {
            promptDetails.put("cached_tokens", metadata.getCachedContentTokenCount());
        }
        usage.put("completion_tokens_details", completionDetails);
        usage.put("prompt_tokens_details", promptDetails);
        return usage;
    }

    private static JSONObject toLogprobs(LogprobsResult result) {
        List<LogprobsCandidate> chosen = result.getChosenCandidates();
        if (chosen == null || chosen.isEmpty()) {
            return new JSONObject();
        }
        List<TopCandidates> top = result.getTopCandidates();
        JSONArray content = new JSONArray(chosen.size());
        for (int i = 0; i < chosen.size(); i++) {
            JSONArray topLogprobs = new JSONArray();
            if (top != null && i < top.size() && top.get(i) != null) {
                for (LogprobsCandidate candidate : nullSafe(top.get(i).getCandidates())) {
                    topLogprobs.add(JSONObject.of(
                            "token", candidate.getToken(), //
                            "logprob", (double) candidate.getLogProbability() //
                    ));
                }
            }
            content.add(JSONObject.of(
                    "token", chosen.get(i).getToken(), //
                    "logprob", (double) chosen.get(i).getLogProbability(), //
                    "top_logprobs", topLogprobs //
            ));
        }
        return JSONObject.of("content", content);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
