package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerateContentRequest;
import com.aigw.gateway.dto.gemini.GenerateContentResponse;
import com.aigw.gateway.dto.gemini.GenerationConfig;
import com.aigw.gateway.dto.openai.ChatCompletionRequest;
import com.aigw.gateway.dto.openai.GcpVendorFields;
import com.aigw.gateway.exception.ResponseReadException;
import com.aigw.gateway.exception.TranslationException;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions ↔ GCP Vertex AI (Gemini) 转换
 * <p>
 * 一个实例对应一次交换：requestBody 记录流式标志、实际模型与结构化输出模式，
 * 之后的 responseBody 依赖这些状态。流式响应的残帧缓存在 {@link GeminiStreamAssembler} 中
 */
public class OpenAiToGcpVertexAiTranslator implements ChatCompletionTranslator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiToGcpVertexAiTranslator.class);

    static final String METHOD_GENERATE_CONTENT = "generateContent";
    static final String METHOD_STREAM_GENERATE_CONTENT = "streamGenerateContent";
    static final String BACKEND_ERROR_TYPE = "GCPVertexAIBackendError";

    private static final String EVENT_STREAM = "text/event-stream";
    private static final String APPLICATION_JSON = "application/json";

    private final String modelNameOverride;
    private final String publisher;

    private boolean stream;
    private String requestModel;
    private ResponseMode responseMode = ResponseMode.NONE;
    private GeminiStreamAssembler assembler;

    public OpenAiToGcpVertexAiTranslator(String modelNameOverride, String publisher) {
        this.modelNameOverride = modelNameOverride == null ? "" : modelNameOverride;
        this.publisher = publisher;
        this.requestModel = this.modelNameOverride;
    }

    // ==================== 请求 ====================

    @Override
    public RequestMutation requestBody(byte[] rawBody, ChatCompletionRequest request, boolean forceBodyMutation) {
        requestModel = modelNameOverride.isEmpty() ? request.getModel() : modelNameOverride;

        String path;
        if (request.isStream()) {
            stream = true;
            path = modelPath(requestModel, METHOD_STREAM_GENERATE_CONTENT, "alt=sse");
        } else {
            path = modelPath(requestModel, METHOD_GENERATE_CONTENT);
        }

        GenerateContentRequest gcpRequest = toGenerateContentRequest(request);
        assembler = stream ? new GeminiStreamAssembler(responseMode) : null;

        byte[] body = JSON.toJSONBytes(gcpRequest);
        log.debug("OpenAI → Vertex AI: model={}, stream={}, contents={}, mode={}",
                requestModel, stream, gcpRequest.getContents().size(), responseMode);
        return new RequestMutation(HeaderMutations.requestMutations(path, body), body);
    }

    private GenerateContentRequest toGenerateContentRequest(ChatCompletionRequest request) {
        GenerateContentRequest gcpRequest = new GenerateContentRequest();

        GeminiMessageConverter.ConvertedMessages converted;
        try {
            converted = GeminiMessageConverter.convert(request.getMessages());
        } catch (TranslationException e) {
            throw new TranslationException("error converting messages: " + e.getMessage(), e);
        }
        gcpRequest.setContents(converted.contents());
        gcpRequest.setSystemInstruction(converted.systemInstruction());

        boolean jsonSchemaAvailable = GenerationConfigConverter.jsonSchemaAvailable(requestModel);
        try {
            gcpRequest.setTools(GeminiToolConverter.toTools(request.getTools(), jsonSchemaAvailable));
            gcpRequest.setToolConfig(GeminiToolConverter.toToolConfig(request.getToolChoice()));
        } catch (TranslationException e) {
            throw new TranslationException("error converting tools: " + e.getMessage(), e);
        }

        GenerationConfigConverter.Result generation;
        try {
            generation = GenerationConfigConverter.convert(request, requestModel);
        } catch (TranslationException e) {
            throw new TranslationException("error converting generation config: " + e.getMessage(), e);
        }
        responseMode = generation.responseMode();
        gcpRequest.setGenerationConfig(generation.config());

        applyVendorFields(gcpRequest, request.getGcpVendorFields());
        return gcpRequest;
    }

    private static void applyVendorFields(GenerateContentRequest gcpRequest, GcpVendorFields vendorFields) {
        if (vendorFields == null) {
            return;
        }
        if (vendorFields.thinkingConfig() != null) {
            GenerationConfig gc = gcpRequest.getGenerationConfig();
            if (gc.getThinkingConfig() == null) {
                gc.setThinkingConfig(new JSONObject());
            }
            gc.getThinkingConfig().putAll(vendorFields.thinkingConfig());
        }
        if (vendorFields.safetySettings() != null) {
            gcpRequest.setSafetySettings(vendorFields.safetySettings());
        }
    }

    String modelPath(String model, String method, String... queryParams) {
        String path = "publishers/" + publisher + "/models/" + model + ":" + method;
        if (queryParams.length > 0) {
            path += "?" + String.join("&", queryParams);
        }
        return path;
    }

    // ==================== 响应 ====================

    @Override
    public List<Header> responseHeaders(Map<String, String> headers) {
        if (stream) {
            return List.of(new Header(HeaderMutations.CONTENT_TYPE, EVENT_STREAM));
        }
        return null;
    }

    @Override
    public ResponseMutation responseBody(Map<String, String> headers, InputStream body, boolean endOfStream) {
        byte[] raw = readAll(body);
        if (stream) {
            return streamingResponseBody(raw, endOfStream);
        }

        GenerateContentResponse response;
        try {
            String text = new String(raw, StandardCharsets.UTF_8);
            response = text.isBlank() ? new GenerateContentResponse()
                    : JSON.parseObject(text, GenerateContentResponse.class);
        } catch (JSONException e) {
            throw new ResponseReadException("error decoding GCP response body: " + e.getMessage(), e);
        }

        byte[] converted = GeminiResponseConverter.toChatCompletion(response, responseMode)
                .toJSONString().getBytes(StandardCharsets.UTF_8);
        return new ResponseMutation(
                List.of(HeaderMutations.contentLength(converted)),
                converted,
                LlmTokenUsage.from(response.getUsageMetadata()),
                responseModel(response.getModelVersion()));
    }

    private ResponseMutation streamingResponseBody(byte[] raw, boolean endOfStream) {
        if (assembler == null) {
            assembler = new GeminiStreamAssembler(responseMode);
        }
        GeminiStreamAssembler.Output output = assembler.feed(raw, endOfStream);
        return new ResponseMutation(null, output.body(), LlmTokenUsage.from(output.usage()), requestModel);
    }

    private String responseModel(String modelVersion) {
        return modelVersion != null && !modelVersion.isEmpty() ? modelVersion : requestModel;
    }

    // ==================== 错误响应 ====================

    /**
     * GCP 的 JSON 错误转为 OpenAI 错误格式，message 带上 details；
     * 其它内容（纯文本、非法 JSON、空串）整体作为 message，type 为 GCPVertexAIBackendError
     */
    @Override
    public ResponseMutation responseError(Map<String, String> headers, InputStream body) {
        String statusCode = headers == null ? null : headers.get(HeaderMutations.STATUS);
        String raw = new String(readAll(body), StandardCharsets.UTF_8);

        JSONObject error;
        JSONObject gcpError = parseGcpError(raw);
        if (gcpError != null) {
            String details = JSON.toJSONString(gcpError.get("details"));
            error = JSONObject.of(
                    "type", gcpError.getString("status"), //
                    "message", "Error: " + gcpError.getString("message") + "\nDetails: " + details, //
                    "code", statusCode //
            );
        } else {
            error = JSONObject.of(
                    "type", BACKEND_ERROR_TYPE, //
                    "message", raw, //
                    "code", statusCode //
            );
        }
        log.warn("Vertex AI 返回错误: status={}, type={}", statusCode, error.getString("type"));

        byte[] converted = JSONObject.of("type", "error", "error", error)
                .toJSONString().getBytes(StandardCharsets.UTF_8);
        return new ResponseMutation(
                List.of(new Header(HeaderMutations.CONTENT_TYPE, APPLICATION_JSON), HeaderMutations.contentLength(converted)),
                converted,
                LlmTokenUsage.EMPTY,
                requestModel);
    }

    private static JSONObject parseGcpError(String raw) {
        if (!JSON.isValidObject(raw)) {
            return null;
        }
        try {
            return JSON.parseObject(raw).getJSONObject("error");
        } catch (JSONException e) {
            log.debug("错误响应不是 GCP 错误结构: {}", e.getMessage());
            return null;
        }
    }

    private static byte[] readAll(InputStream body) {
        if (body == null) {
            return new byte[0];
        }
        try {
            return body.readAllBytes();
        } catch (IOException e) {
            throw new ResponseReadException("failed to read response body", e);
        }
    }

    // 测试用
    boolean isStream() {
        return stream;
    }

    ResponseMode responseMode() {
        return responseMode;
    }

    void setStream(boolean stream) {
        this.stream = stream;
    }
}
