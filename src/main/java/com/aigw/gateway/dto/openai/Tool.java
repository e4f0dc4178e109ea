package com.aigw.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;

/**
 * OpenAI 工具声明
 *
 * @param type     function / image_generation
 * @param function type 为 function 时的函数定义
 */
public record Tool(String type, Function function) {

    public static final String TYPE_FUNCTION = "function";
    public static final String TYPE_IMAGE_GENERATION = "image_generation";

    /**
     * @param parameters JSON Schema，可为 null
     */
    public record Function(String name, String description, JSONObject parameters) {}
}
