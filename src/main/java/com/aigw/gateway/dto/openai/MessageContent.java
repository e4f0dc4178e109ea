package com.aigw.gateway.dto.openai;

import java.util.List;

/**
 * 消息内容：字符串或内容片段数组，二者必居其一
 *
 * @param text  字符串形式的内容
 * @param parts 数组形式的内容片段
 * @param <P>   该角色允许的片段类型
 */
public record MessageContent<P extends ContentPart>(String text, List<P> parts) {

    public static <P extends ContentPart> MessageContent<P> ofText(String text) {
        return new MessageContent<>(text, null);
    }

    public static <P extends ContentPart> MessageContent<P> ofParts(List<P> parts) {
        return new MessageContent<>(null, List.copyOf(parts));
    }

    public boolean isText() {
        return parts == null;
    }
}
