package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerationConfig;
import com.aigw.gateway.dto.openai.ChatCompletionRequest;
import com.aigw.gateway.dto.openai.ChatCompletionRequestDecoder;
import com.aigw.gateway.exception.TranslationException;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationConfigConverterTest {

    @Test
    void shouldNarrowScalarParameters() {
        ChatCompletionRequest request = decode("""
                {"model":"gemini-pro","messages":[],"temperature":0.7,"top_p":0.9,"seed":42,
                 "n":2,"max_tokens":256,"presence_penalty":0.5,"frequency_penalty":-0.5,
                 "logprobs":true,"top_logprobs":3,"stop":"END"}
                """);

        GenerationConfigConverter.Result result = GenerationConfigConverter.convert(request, "gemini-pro");
        GenerationConfig gc = result.config();

        assertEquals(ResponseMode.NONE, result.responseMode());
        assertEquals(0.7f, gc.getTemperature());
        assertEquals(0.9f, gc.getTopP());
        assertEquals(42, gc.getSeed());
        assertEquals(2, gc.getCandidateCount());
        assertEquals(256, gc.getMaxOutputTokens());
        assertEquals(0.5f, gc.getPresencePenalty());
        assertEquals(-0.5f, gc.getFrequencyPenalty());
        assertTrue(gc.getResponseLogprobs());
        assertEquals(3, gc.getLogprobs());
        assertEquals(List.of("END"), gc.getStopSequences());
        assertNull(gc.getResponseMimeType());
    }

    @Test
    void shouldLeaveUnsetFieldsNull() {
        GenerationConfig gc = GenerationConfigConverter.convert(decode("{\"model\":\"m\",\"messages\":[]}"), "m").config();

        assertNull(gc.getTemperature());
        assertNull(gc.getMaxOutputTokens());
        assertNull(gc.getStopSequences());
        assertEquals("{}", JSON.toJSONString(gc));
    }

    @Test
    void shouldMapTextAndJsonObjectFormats() {
        GenerationConfigConverter.Result text = GenerationConfigConverter.convert(
                decode("{\"messages\":[],\"response_format\":{\"type\":\"text\"}}"), "gemini-pro");
        GenerationConfigConverter.Result json = GenerationConfigConverter.convert(
                decode("{\"messages\":[],\"response_format\":{\"type\":\"json_object\"}}"), "gemini-pro");

        assertEquals(ResponseMode.TEXT, text.responseMode());
        assertEquals("text/plain", text.config().getResponseMimeType());
        assertEquals(ResponseMode.JSON, json.responseMode());
        assertEquals("application/json", json.config().getResponseMimeType());
        assertFalse(json.config().hasSchema());
    }

    @Test
    void shouldPassJsonSchemaThroughForGemini25() {
        ChatCompletionRequest request = decode("""
                {"messages":[],"response_format":{"type":"json_schema","json_schema":{"name":"r",
                 "schema":{"type":"object","properties":{"a":{"type":"string"}},"additionalProperties":false}}}}
                """);

        GenerationConfigConverter.Result native25 = GenerationConfigConverter.convert(request, "gemini-2.5-flash");
        GenerationConfigConverter.Result legacy = GenerationConfigConverter.convert(request, "gemini-1.5-pro");

        assertEquals(ResponseMode.JSON, native25.responseMode());
        assertEquals("application/json", native25.config().getResponseMimeType());
        JSONObject passed = (JSONObject) native25.config().getResponseJsonSchema();
        assertFalse(passed.getBooleanValue("additionalProperties", true));
        assertNull(native25.config().getResponseSchema());

        assertNull(legacy.config().getResponseJsonSchema());
        assertEquals("object", legacy.config().getResponseSchema().getString("type"));
        assertFalse(legacy.config().getResponseSchema().containsKey("additionalProperties"));
    }

    @Test
    void shouldDetectJsonSchemaCapableModels() {
        assertTrue(GenerationConfigConverter.jsonSchemaAvailable("gemini-2.5-pro"));
        assertTrue(GenerationConfigConverter.jsonSchemaAvailable("publishers/gemini-2.5-flash-lite"));
        assertFalse(GenerationConfigConverter.jsonSchemaAvailable("gemini-2.0-flash-001"));
        assertFalse(GenerationConfigConverter.jsonSchemaAvailable("claude-2.5"));
        assertFalse(GenerationConfigConverter.jsonSchemaAvailable(null));
    }

    @Test
    void shouldMapGuidedChoiceToEnum() {
        GenerationConfigConverter.Result result = GenerationConfigConverter.convert(
                decode("{\"messages\":[],\"guided_choice\":[\"positive\",\"negative\"]}"), "gemini-pro");

        assertEquals(ResponseMode.ENUM, result.responseMode());
        assertEquals("text/x.enum", result.config().getResponseMimeType());
        JSONObject schema = result.config().getResponseSchema();
        assertEquals("STRING", schema.getString("type"));
        assertEquals(List.of("positive", "negative"), schema.get("enum"));
    }

    @Test
    void shouldMapGuidedRegexToStringPattern() {
        GenerationConfigConverter.Result result = GenerationConfigConverter.convert(
                decode("{\"messages\":[],\"guided_regex\":\"\\\\w+@\\\\w+\\\\.com\"}"), "gemini-pro");

        assertEquals(ResponseMode.REGEX, result.responseMode());
        assertEquals("application/json", result.config().getResponseMimeType());
        assertEquals("STRING", result.config().getResponseSchema().getString("type"));
        assertEquals("\\w+@\\w+\\.com", result.config().getResponseSchema().getString("pattern"));
    }

    @Test
    void shouldMapGuidedJsonToNativeSchema() {
        GenerationConfigConverter.Result result = GenerationConfigConverter.convert(
                decode("{\"messages\":[],\"guided_json\":{\"type\":\"object\"}}"), "gemini-pro");

        assertEquals(ResponseMode.JSON, result.responseMode());
        assertEquals(JSONObject.of("type", "object"), result.config().getResponseJsonSchema());
    }

    @Test
    void shouldRejectDuplicateSchemaSpecifications() {
        ChatCompletionRequest request = decode(
                "{\"messages\":[],\"guided_json\":{\"type\":\"object\"},\"guided_choice\":[\"a\",\"b\"]}");

        TranslationException e = assertThrows(TranslationException.class,
                () -> GenerationConfigConverter.convert(request, "gemini-pro"));
        assertEquals("duplicate json schema specifications", e.getMessage());
    }

    @Test
    void shouldRejectMultipleFormatSpecifiers() {
        ChatCompletionRequest request = decode(
                "{\"messages\":[],\"response_format\":{\"type\":\"text\"},\"guided_choice\":[\"a\"]}");

        TranslationException e = assertThrows(TranslationException.class,
                () -> GenerationConfigConverter.convert(request, "gemini-pro"));
        assertTrue(e.getMessage().startsWith("multiple format specifiers specified"), e.getMessage());
    }

    private static ChatCompletionRequest decode(String json) {
        return ChatCompletionRequestDecoder.decode(JSON.parseObject(json));
    }
}
