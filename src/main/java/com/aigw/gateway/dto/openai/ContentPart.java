package com.aigw.gateway.dto.openai;

/**
 * 消息内容片段
 * <p>
 * 对应 OpenAI content 数组中带 type 字段的元素
 */
public interface ContentPart {

    String type();

    record TextPart(String text) implements ContentPart {
        @Override
        public String type() { return "text"; }
    }

    record ImagePart(String url, String detail) implements ContentPart {
        @Override
        public String type() { return "image_url"; }
    }

    record AudioPart(String data, String format) implements ContentPart {
        @Override
        public String type() { return "input_audio"; }
    }

    record FilePart(String fileId, String filename, String fileData) implements ContentPart {
        @Override
        public String type() { return "file"; }
    }

    record RefusalPart(String refusal) implements ContentPart {
        @Override
        public String type() { return "refusal"; }
    }
}
