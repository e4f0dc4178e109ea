package com.aigw.gateway.translator;

import java.util.ArrayList;
import java.util.List;

/**
 * 头部变更构建工具
 */
public final class HeaderMutations {

    public static final String PATH = ":path";
    public static final String STATUS = ":status";
    public static final String CONTENT_LENGTH = "content-length";
    public static final String CONTENT_TYPE = "content-type";

    private HeaderMutations() {}

    /**
     * 请求侧变更：path 非空时设置 :path，body 非空时设置 content-length
     */
    public static List<Header> requestMutations(String path, byte[] body) {
        List<Header> headers = new ArrayList<>(2);
        if (path != null && !path.isEmpty()) {
            headers.add(new Header(PATH, path));
        }
        if (body != null && body.length > 0) {
            headers.add(contentLength(body));
        }
        return headers;
    }

    public static Header contentLength(byte[] body) {
        return new Header(CONTENT_LENGTH, String.valueOf(body.length));
    }
}
