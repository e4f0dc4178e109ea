package com.aigw.gateway.dto.gemini;

import com.alibaba.fastjson2.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Gemini 工具：一组函数声明
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Tool {

    private List<FunctionDeclaration> functionDeclarations;

    /**
     * parameters 为转换后的 Gemini Schema；parametersJsonSchema 为原样透传的 JSON Schema，二者至多其一
     */
    @Data
    @NoArgsConstructor
    public static class FunctionDeclaration {
        private String name;
        private String description;
        private JSONObject parameters;
        private Object parametersJsonSchema;

        public FunctionDeclaration(String name, String description) {
            this.name = name;
            this.description = description;
        }
    }
}
