package com.aigw.gateway.translator;

import com.aigw.gateway.exception.TranslationException;

import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * data URI 解析与按扩展名推断 MIME 类型
 */
public final class DataUris {

    public static final String MIME_IMAGE_JPEG = "image/jpeg";
    public static final String MIME_IMAGE_PNG = "image/png";
    public static final String MIME_IMAGE_GIF = "image/gif";
    public static final String MIME_IMAGE_WEBP = "image/webp";

    private static final Pattern DATA_URI = Pattern.compile("\\Adata:(.+?)?(;base64)?,");

    private static final Map<String, String> MIME_BY_EXTENSION = Map.ofEntries(
            Map.entry("jpg", MIME_IMAGE_JPEG),
            Map.entry("jpeg", MIME_IMAGE_JPEG),
            Map.entry("jpe", MIME_IMAGE_JPEG),
            Map.entry("png", MIME_IMAGE_PNG),
            Map.entry("gif", MIME_IMAGE_GIF),
            Map.entry("webp", MIME_IMAGE_WEBP),
            Map.entry("bmp", "image/bmp"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("avif", "image/avif"),
            Map.entry("heic", "image/heic"),
            Map.entry("heif", "image/heif"),
            Map.entry("tif", "image/tiff"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("txt", "text/plain"),
            Map.entry("json", "application/json"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("mp4", "video/mp4")
    );

    private DataUris() {}

    /**
     * 解析后的 data URI
     *
     * @param mimeType 声明的 MIME 类型，未声明时为空串
     * @param data     解码后的字节
     */
    public record DataUri(String mimeType, byte[] data) {}

    /**
     * 解析 data URI，例如 data:image/jpeg;base64,/9j/4AAQSkZJRg...
     * <p>
     * payload 一律按标准 base64 解码
     */
    public static DataUri parse(String uri) {
        Matcher matcher = DATA_URI.matcher(uri == null ? "" : uri);
        if (!matcher.find()) {
            throw new TranslationException("data uri does not have a valid format");
        }
        String mimeType = matcher.group(1) != null ? matcher.group(1) : "";
        String payload = uri.substring(matcher.end());
        try {
            return new DataUri(mimeType, Base64.getDecoder().decode(payload));
        } catch (IllegalArgumentException e) {
            throw new TranslationException("data uri payload is not valid base64: " + e.getMessage(), e);
        }
    }

    public static boolean isDataUri(String url) {
        return url != null && url.regionMatches(true, 0, "data:", 0, 5);
    }

    /**
     * 按 URL 路径的扩展名推断 MIME 类型，query 和 fragment 不参与，无法识别时返回 image/jpeg
     */
    public static String mimeTypeByExtension(String url) {
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < slash || dot == path.length() - 1) {
            return MIME_IMAGE_JPEG;
        }
        String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return MIME_BY_EXTENSION.getOrDefault(ext, MIME_IMAGE_JPEG);
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }
}
