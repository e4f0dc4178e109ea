package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.Tool;
import com.aigw.gateway.dto.gemini.Tool.FunctionDeclaration;
import com.aigw.gateway.dto.gemini.ToolConfig;
import com.aigw.gateway.dto.openai.ToolChoice;
import com.aigw.gateway.exception.TranslationException;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI tools / tool_choice → Gemini Tool / ToolConfig
 */
public final class GeminiToolConverter {

    private GeminiToolConverter() {}

    /**
     * 所有函数工具合并进同一个 Tool，部分 Gemini 模型不接受多个 Tool
     *
     * @param tools                         OpenAI 工具列表
     * @param parametersJsonSchemaAvailable 模型是否支持直接传入 JSON Schema
     * @return 没有函数声明时返回 null
     */
    public static List<Tool> toTools(List<com.aigw.gateway.dto.openai.Tool> tools, boolean parametersJsonSchemaAvailable) {
        if (tools == null || tools.isEmpty()) {
            return null;
        }
        List<FunctionDeclaration> declarations = new ArrayList<>();
        for (com.aigw.gateway.dto.openai.Tool tool : tools) {
            String type = tool.type();
            if (com.aigw.gateway.dto.openai.Tool.TYPE_FUNCTION.equals(type)) {
                if (tool.function() != null) {
                    declarations.add(toDeclaration(tool.function(), parametersJsonSchemaAvailable));
                }
            } else if (com.aigw.gateway.dto.openai.Tool.TYPE_IMAGE_GENERATION.equals(type)) {
                throw new TranslationException("tool-type image generation not supported yet when translating OpenAI req to Gemini");
            } else {
                throw new TranslationException("unsupported tool type: " + type);
            }
        }
        if (declarations.isEmpty()) {
            return null;
        }
        return List.of(new Tool(declarations));
    }

    private static FunctionDeclaration toDeclaration(com.aigw.gateway.dto.openai.Tool.Function function,
                                                     boolean parametersJsonSchemaAvailable) {
        FunctionDeclaration declaration = new FunctionDeclaration(function.name(), function.description());
        JSONObject parameters = function.parameters();
        if (parametersJsonSchemaAvailable) {
            declaration.setParametersJsonSchema(parameters);
        } else if (parameters != null && !parameters.isEmpty()) {
            try {
                declaration.setParameters(JsonSchemaConverter.toGeminiSchema(parameters));
            } catch (TranslationException e) {
                throw new TranslationException("invalid JSON schema for parameters in tool "
                        + function.name() + ": " + e.getMessage(), e);
            }
        }
        return declaration;
    }

    /**
     * auto → AUTO，none → NONE，required → ANY，指定函数 → ANY + allowedFunctionNames
     */
    public static ToolConfig toToolConfig(ToolChoice toolChoice) {
        if (toolChoice == null) {
            return null;
        }
        if (toolChoice.isNamedFunction()) {
            return ToolConfig.of(ToolConfig.MODE_ANY, List.of(toolChoice.functionName()));
        }
        String mode = toolChoice.mode();
        if ("auto".equals(mode)) {
            return ToolConfig.of(ToolConfig.MODE_AUTO);
        }
        if ("none".equals(mode)) {
            return ToolConfig.of(ToolConfig.MODE_NONE);
        }
        if ("required".equals(mode)) {
            return ToolConfig.of(ToolConfig.MODE_ANY);
        }
        throw new TranslationException("unsupported tool choice: '" + mode + "'");
    }
}
