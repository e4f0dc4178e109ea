package com.aigw.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;

/**
 * response_format
 *
 * @param type   text / json_object / json_schema
 * @param name   json_schema.name
 * @param schema json_schema.schema
 */
public record ResponseFormat(String type, String name, JSONObject schema) {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_JSON_OBJECT = "json_object";
    public static final String TYPE_JSON_SCHEMA = "json_schema";
}
