package com.aigw.gateway.dto.openai;

/**
 * tool_choice：字符串模式（auto/none/required）或指定函数
 */
public record ToolChoice(String mode, String functionName) {

    public static ToolChoice ofMode(String mode) {
        return new ToolChoice(mode, null);
    }

    public static ToolChoice ofFunction(String functionName) {
        return new ToolChoice(null, functionName);
    }

    public boolean isNamedFunction() {
        return functionName != null;
    }
}
