package com.aigw.gateway.dto.gemini;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Gemini 工具调用配置
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolConfig {

    public static final String MODE_AUTO = "AUTO";
    public static final String MODE_NONE = "NONE";
    public static final String MODE_ANY = "ANY";

    private FunctionCallingConfig functionCallingConfig;

    public static ToolConfig of(String mode) {
        return new ToolConfig(new FunctionCallingConfig(mode, null));
    }

    public static ToolConfig of(String mode, List<String> allowedFunctionNames) {
        return new ToolConfig(new FunctionCallingConfig(mode, allowedFunctionNames));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionCallingConfig {
        private String mode;
        private List<String> allowedFunctionNames;
    }
}
