package com.aigw.gateway.dto.gemini;

import com.alibaba.fastjson2.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Base64;
import java.util.Map;

/**
 * Gemini Part
 * <p>
 * 同一时刻只有一个字段非空：text / inlineData / fileData / functionCall / functionResponse
 */
@Data
@NoArgsConstructor
public class Part {

    private String text;
    private Blob inlineData;
    private FileData fileData;
    private FunctionCall functionCall;
    private FunctionResponse functionResponse;
    // 思考内容标记，仅出现在响应中
    private Boolean thought;

    public static Part fromText(String text) {
        Part part = new Part();
        part.setText(text);
        return part;
    }

    public static Part fromBytes(byte[] data, String mimeType) {
        Part part = new Part();
        part.setInlineData(new Blob(mimeType, Base64.getEncoder().encodeToString(data)));
        return part;
    }

    public static Part fromUri(String fileUri, String mimeType) {
        Part part = new Part();
        part.setFileData(new FileData(mimeType, fileUri));
        return part;
    }

    public static Part fromFunctionCall(String name, Map<String, Object> args) {
        Part part = new Part();
        part.setFunctionCall(new FunctionCall(name, args == null ? null : new JSONObject(args)));
        return part;
    }

    public static Part fromFunctionResponse(String name, Map<String, Object> response) {
        Part part = new Part();
        part.setFunctionResponse(new FunctionResponse(name, new JSONObject(response)));
        return part;
    }

    /**
     * 内联二进制数据，data 为 base64 编码
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Blob {
        private String mimeType;
        private String data;

        public byte[] decodedData() {
            return data == null ? new byte[0] : Base64.getDecoder().decode(data);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileData {
        private String mimeType;
        private String fileUri;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionCall {
        private String name;
        private JSONObject args;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionResponse {
        private String name;
        private JSONObject response;
    }
}
