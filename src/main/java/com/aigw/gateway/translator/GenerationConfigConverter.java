package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerationConfig;
import com.aigw.gateway.dto.openai.ChatCompletionRequest;
import com.aigw.gateway.dto.openai.ResponseFormat;
import com.aigw.gateway.exception.TranslationException;
import com.alibaba.fastjson2.JSONObject;

/**
 * OpenAI 采样参数与结构化输出 → Gemini GenerationConfig
 * <p>
 * 数值按 double→float、long→int 直接收窄，不做溢出检查。
 * response_format、guided_choice、guided_regex、guided_json 四者互斥
 */
public final class GenerationConfigConverter {

    private GenerationConfigConverter() {}

    /**
     * @param config       转换后的生成参数，总是非 null
     * @param responseMode 响应文本的后处理模式
     */
    public record Result(GenerationConfig config, ResponseMode responseMode) {}

    /**
     * 仅 gemini 2.5 系列支持直接传入 JSON Schema（responseJsonSchema / parametersJsonSchema）
     */
    public static boolean jsonSchemaAvailable(String requestModel) {
        return requestModel != null && requestModel.contains("gemini") && requestModel.contains("2.5");
    }

    public static Result convert(ChatCompletionRequest request, String requestModel) {
        ResponseMode mode = ResponseMode.NONE;
        GenerationConfig gc = new GenerationConfig();

        if (request.getTemperature() != null) {
            gc.setTemperature(request.getTemperature().floatValue());
        }
        if (request.getTopP() != null) {
            gc.setTopP(request.getTopP().floatValue());
        }
        if (request.getSeed() != null) {
            gc.setSeed(request.getSeed().intValue());
        }
        if (request.getTopLogprobs() != null) {
            gc.setLogprobs(request.getTopLogprobs().intValue());
        }
        if (request.getLogprobs() != null) {
            gc.setResponseLogprobs(request.getLogprobs());
        }

        int formatCount = 0;

        ResponseFormat format = request.getResponseFormat();
        if (format != null) {
            formatCount++;
            switch (format.type()) {
                case ResponseFormat.TYPE_TEXT -> {
                    mode = ResponseMode.TEXT;
                    gc.setResponseMimeType(GenerationConfig.MIME_TEXT_PLAIN);
                }
                case ResponseFormat.TYPE_JSON_OBJECT -> {
                    mode = ResponseMode.JSON;
                    gc.setResponseMimeType(GenerationConfig.MIME_APPLICATION_JSON);
                }
                case ResponseFormat.TYPE_JSON_SCHEMA -> {
                    gc.setResponseMimeType(GenerationConfig.MIME_APPLICATION_JSON);
                    JSONObject schema = format.schema();
                    if (schema == null) {
                        throw new TranslationException("invalid JSON schema: json_schema.schema is missing");
                    }
                    mode = ResponseMode.JSON;
                    if (jsonSchemaAvailable(requestModel)) {
                        gc.setResponseJsonSchema(schema);
                    } else {
                        gc.setResponseSchema(JsonSchemaConverter.toGeminiSchema(schema));
                    }
                }
                default -> throw new TranslationException("unsupported response_format type: " + format.type());
            }
        }

        if (request.getGuidedChoice() != null) {
            formatCount++;
            checkNoSchema(gc);
            mode = ResponseMode.ENUM;
            gc.setResponseMimeType(GenerationConfig.MIME_TEXT_ENUM);
            gc.setResponseSchema(JSONObject.of("type", "STRING", "enum", request.getGuidedChoice()));
        }
        if (request.getGuidedRegex() != null && !request.getGuidedRegex().isEmpty()) {
            formatCount++;
            checkNoSchema(gc);
            mode = ResponseMode.REGEX;
            gc.setResponseMimeType(GenerationConfig.MIME_APPLICATION_JSON);
            gc.setResponseSchema(JSONObject.of("type", "STRING", "pattern", request.getGuidedRegex()));
        }
        if (request.getGuidedJson() != null) {
            formatCount++;
            checkNoSchema(gc);
            mode = ResponseMode.JSON;
            gc.setResponseMimeType(GenerationConfig.MIME_APPLICATION_JSON);
            gc.setResponseJsonSchema(request.getGuidedJson());
        }

        if (formatCount > 1) {
            throw new TranslationException("multiple format specifiers specified. only one of responseFormat, "
                    + "guidedChoice, guidedRegex, guidedJSON can be specified");
        }

        if (request.getN() != null) {
            gc.setCandidateCount(request.getN().intValue());
        }
        if (request.getMaxTokens() != null) {
            gc.setMaxOutputTokens(request.getMaxTokens().intValue());
        }
        gc.setPresencePenalty(request.getPresencePenalty());
        gc.setFrequencyPenalty(request.getFrequencyPenalty());
        if (request.getStop() != null) {
            gc.setStopSequences(request.getStop());
        }
        return new Result(gc, mode);
    }

    private static void checkNoSchema(GenerationConfig gc) {
        if (gc.hasSchema()) {
            throw new TranslationException("duplicate json schema specifications");
        }
    }
}
