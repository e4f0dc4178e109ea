package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerateContentResponse;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeminiResponseConverterTest {

    @Test
    void shouldConvertTextCandidateWithUsage() {
        GenerateContentResponse response = parse("""
                {
                  "candidates": [{
                    "content": {"parts": [{"text": "AI Gateways "}, {"text": "route traffic."}], "role": "model"},
                    "finishReason": "STOP",
                    "safetyRatings": []
                  }],
                  "usageMetadata": {"promptTokenCount": 10, "candidatesTokenCount": 15, "totalTokenCount": 25,
                                    "cachedContentTokenCount": 10, "thoughtsTokenCount": 10}
                }
                """);

        JSONObject result = GeminiResponseConverter.toChatCompletion(response, ResponseMode.NONE);

        assertEquals("chat.completion", result.getString("object"));
        assertFalse(result.containsKey("model"));
        JSONObject choice = result.getJSONArray("choices").getJSONObject(0);
        assertEquals(0, choice.getIntValue("index"));
        assertEquals("stop", choice.getString("finish_reason"));
        JSONObject message = choice.getJSONObject("message");
        assertEquals("assistant", message.getString("role"));
        assertEquals("AI Gateways route traffic.", message.getString("content"));
        assertFalse(message.containsKey("safety_ratings"));
        assertFalse(message.containsKey("tool_calls"));

        JSONObject usage = result.getJSONObject("usage");
        assertEquals(10, usage.getIntValue("prompt_tokens"));
        assertEquals(25, usage.getIntValue("completion_tokens"));
        assertEquals(25, usage.getIntValue("total_tokens"));
        assertEquals(10, usage.getJSONObject("completion_tokens_details").getIntValue("reasoning_tokens"));
        assertEquals(10, usage.getJSONObject("prompt_tokens_details").getIntValue("cached_tokens"));
    }

    @Test
    void shouldCountThoughtsAsCompletionTokens() {
        GenerateContentResponse response = parse("""
                {"usageMetadata": {"promptTokenCount": 10, "candidatesTokenCount": 5,
                                   "thoughtsTokenCount": 2, "totalTokenCount": 17}}
                """);

        JSONObject usage = GeminiResponseConverter.toChatCompletion(response, ResponseMode.NONE).getJSONObject("usage");

        assertEquals(10, usage.getIntValue("prompt_tokens"));
        assertEquals(7, usage.getIntValue("completion_tokens"));
        assertEquals(17, usage.getIntValue("total_tokens"));
        assertEquals(2, usage.getJSONObject("completion_tokens_details").getIntValue("reasoning_tokens"));
        assertTrue(usage.getJSONObject("prompt_tokens_details").isEmpty());
    }

    @Test
    void shouldConvertEmptyResponse() {
        JSONObject result = GeminiResponseConverter.toChatCompletion(parse("{}"), ResponseMode.NONE);

        assertEquals("{\"object\":\"chat.completion\"}", result.toJSONString());
    }

    @Test
    void shouldEchoModelVersionAndSafetyRatings() {
        GenerateContentResponse response = parse("""
                {
                  "modelVersion": "gemini-1.5-pro-002",
                  "candidates": [{
                    "content": {"parts": [{"text": "safe"}]},
                    "finishReason": "STOP",
                    "safetyRatings": [{"category": "HARM_CATEGORY_HARASSMENT", "probability": "LOW"}]
                  }]
                }
                """);

        JSONObject result = GeminiResponseConverter.toChatCompletion(response, ResponseMode.NONE);

        assertEquals("gemini-1.5-pro-002", result.getString("model"));
        JSONArray ratings = result.getJSONArray("choices").getJSONObject(0)
                .getJSONObject("message").getJSONArray("safety_ratings");
        assertEquals(1, ratings.size());
        assertEquals("LOW", ratings.getJSONObject(0).getString("probability"));
    }

    @Test
    void shouldConvertFunctionCallsWithFreshIds() {
        GenerateContentResponse response = parse("""
                {"candidates": [{
                  "content": {"role": "model", "parts": [
                    {"functionCall": {"name": "get_weather", "args": {"location": "Paris"}}},
                    {"functionCall": {"name": "get_time", "args": {"zone": "CET"}}}
                  ]},
                  "finishReason": "STOP"
                }]}
                """);

        JSONObject choice = GeminiResponseConverter.toChatCompletion(response, ResponseMode.NONE)
                .getJSONArray("choices").getJSONObject(0);

        assertEquals("tool_calls", choice.getString("finish_reason"));
        JSONObject message = choice.getJSONObject("message");
        assertFalse(message.containsKey("content"));
        JSONArray toolCalls = message.getJSONArray("tool_calls");
        assertEquals(2, toolCalls.size());
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            JSONObject call = toolCalls.getJSONObject(i);
            assertEquals("function", call.getString("type"));
            UUID.fromString(call.getString("id"));
            ids.add(call.getString("id"));
        }
        assertEquals(2, ids.size());
        JSONObject function = toolCalls.getJSONObject(0).getJSONObject("function");
        assertEquals("get_weather", function.getString("name"));
        assertEquals(JSONObject.of("location", "Paris"), JSON.parseObject(function.getString("arguments")));
    }

    @Test
    void shouldKeepTextNextToFunctionCalls() {
        GenerateContentResponse response = parse("""
                {"candidates": [{"content": {"parts": [
                  {"text": "Let me check."},
                  {"functionCall": {"name": "lookup", "args": {}}}
                ]}, "finishReason": "STOP"}]}
                """);

        JSONObject message = GeminiResponseConverter.toChatCompletion(response, ResponseMode.NONE)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message");

        assertEquals("Let me check.", message.getString("content"));
        assertEquals(1, message.getJSONArray("tool_calls").size());
    }

    @Test
    void shouldMapFinishReasons() {
        assertEquals("stop", GeminiResponseConverter.toFinishReason("STOP", 0));
        assertEquals("tool_calls", GeminiResponseConverter.toFinishReason("STOP", 1));
        assertEquals("length", GeminiResponseConverter.toFinishReason("MAX_TOKENS", 0));
        assertEquals("", GeminiResponseConverter.toFinishReason("", 0));
        assertEquals("", GeminiResponseConverter.toFinishReason(null, 0));
        assertEquals("content_filter", GeminiResponseConverter.toFinishReason("SAFETY", 0));
        assertEquals("content_filter", GeminiResponseConverter.toFinishReason("SOME_FUTURE_REASON", 0));
    }

    @Test
    void shouldUnquoteRegexResponses() {
        GenerateContentResponse response = parse("""
                {"candidates": [{"content": {"parts": [{"text": "\\"positive\\""}]}, "finishReason": "STOP"}]}
                """);

        String regex = GeminiResponseConverter.toChatCompletion(response, ResponseMode.REGEX)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content");
        String plain = GeminiResponseConverter.toChatCompletion(response, ResponseMode.JSON)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content");

        assertEquals("positive", regex);
        assertEquals("\"positive\"", plain);
    }

    @Test
    void shouldConvertLogprobs() {
        GenerateContentResponse response = parse("""
                {"candidates": [{
                  "content": {"parts": [{"text": "Hi"}]},
                  "finishReason": "STOP",
                  "logprobsResult": {
                    "chosenCandidates": [{"token": "Hi", "logProbability": -0.5}],
                    "topCandidates": [{"candidates": [{"token": "Hi", "logProbability": -0.5},
                                                      {"token": "Hello", "logProbability": -1.25}]}]
                  }
                }]}
                """);

        JSONObject logprobs = GeminiResponseConverter.toChatCompletion(response, ResponseMode.NONE)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("logprobs");

        JSONObject token = logprobs.getJSONArray("content").getJSONObject(0);
        assertEquals("Hi", token.getString("token"));
        assertEquals(-0.5, token.getDoubleValue("logprob"));
        JSONArray top = token.getJSONArray("top_logprobs");
        assertEquals(2, top.size());
        assertEquals("Hello", top.getJSONObject(1).getString("token"));
        assertEquals(-1.25, top.getJSONObject(1).getDoubleValue("logprob"));
    }

    @Test
    void shouldBuildStreamingChunk() {
        GenerateContentResponse response = parse("""
                {"candidates":[{"content":{"parts":[{"text":"Hello"}]}}],
                 "usageMetadata":{"promptTokenCount":5,"candidatesTokenCount":3,"totalTokenCount":8}}
                """);

        JSONObject chunk = GeminiResponseConverter.toChatCompletionChunk(response, ResponseMode.NONE, () -> 0);

        assertEquals("chat.completion.chunk", chunk.getString("object"));
        JSONObject choice = chunk.getJSONArray("choices").getJSONObject(0);
        assertEquals(0, choice.getIntValue("index"));
        assertFalse(choice.containsKey("finish_reason"));
        assertEquals(JSONObject.of("content", "Hello", "role", "assistant"), choice.getJSONObject("delta"));
        assertEquals(3, chunk.getJSONObject("usage").getIntValue("completion_tokens"));
    }

    @Test
    void shouldIndexStreamingToolCallsFromSupplier() {
        GenerateContentResponse response = parse("""
                {"candidates":[{"content":{"parts":[
                  {"functionCall":{"name":"a","args":{"x":1}}},
                  {"functionCall":{"name":"b","args":{"x":2}}}
                ]},"finishReason":"STOP"}]}
                """);
        AtomicInteger counter = new AtomicInteger(4);

        JSONObject choice = GeminiResponseConverter
                .toChatCompletionChunk(response, ResponseMode.NONE, counter::getAndIncrement)
                .getJSONArray("choices").getJSONObject(0);

        JSONArray toolCalls = choice.getJSONObject("delta").getJSONArray("tool_calls");
        assertEquals(4, toolCalls.getJSONObject(0).getIntValue("index"));
        assertEquals(5, toolCalls.getJSONObject(1).getIntValue("index"));
        assertEquals("tool_calls", choice.getString("finish_reason"));
        assertNull(choice.getJSONObject("delta").get("content"));
        assertEquals(6, counter.get());
    }

    private static GenerateContentResponse parse(String json) {
        return JSON.parseObject(json, GenerateContentResponse.class);
    }
}
