package com.aigw.gateway.translator;

import com.aigw.gateway.dto.gemini.GenerateContentResponse;
import com.aigw.gateway.dto.gemini.GenerateContentResponse.UsageMetadata;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Gemini SSE 流重组器
 * <p>
 * 上游按任意字节边界分段推送 SSE，每段调用一次 {@link #feed}：
 * - 把上次留下的残帧与本段拼接，按空行切分为帧，去掉 data: 前缀
 * - 中间帧解析失败直接丢弃，最后一帧解析失败视为不完整，留到下一段
 * - 每个成功解析的帧转换为一条 chat.completion.chunk，以 data: ...\n\n 输出
 * - 流结束时追加 data: [DONE]
 * <p>
 * 每个交换独占一个实例
 */
public class GeminiStreamAssembler {

    private static final Logger log = LoggerFactory.getLogger(GeminiStreamAssembler.class);

    private static final String FRAME_DELIMITER = "\n\n";
    private static final String DATA_PREFIX = "data:";
    private static final byte[] DATA_PREFIX_BYTES = DATA_PREFIX.getBytes(StandardCharsets.US_ASCII);
    private static final byte[] DONE = "data: [DONE]\n".getBytes(StandardCharsets.UTF_8);

    private final ResponseMode responseMode;

    // 上一段末尾未能解析的残帧字节（已去掉 data: 前缀）
    private byte[] buffered = new byte[0];
    private int toolCallIndex;

    public GeminiStreamAssembler(ResponseMode responseMode) {
        this.responseMode = responseMode;
    }

    /**
     * 本次调用的输出
     *
     * @param body  SSE 字节，可能为空
     * @param usage 本次调用中最后一个带用量的帧，没有则为 null
     */
    public record Output(byte[] body, UsageMetadata usage) {}

    public Output feed(byte[] chunk, boolean endOfStream) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        UsageMetadata usage = null;

        for (GenerateContentResponse frame : parseFrames(chunk)) {
            String json = GeminiResponseConverter
                    .toChatCompletionChunk(frame, responseMode, () -> toolCallIndex++)
                    .toJSONString();
            out.writeBytes(("data: " + json + FRAME_DELIMITER).getBytes(StandardCharsets.UTF_8));
            if (frame.getUsageMetadata() != null) {
                usage = frame.getUsageMetadata();
            }
        }

        if (endOfStream) {
            if (buffered.length > 0) {
                log.warn("流已结束，丢弃不完整的残帧: {} 字节", buffered.length);
                buffered = new byte[0];
            }
            out.writeBytes(DONE);
        }
        return new Output(out.toByteArray(), usage);
    }

    /**
     * 拼接残帧并切分、解析本段中的完整帧
     * <p>
     * 只解码到最后一个空行为止的字节，之后的字节原样留存，避免把跨段的多字节字符拆坏
     */
    List<GenerateContentResponse> parseFrames(byte[] chunk) {
        byte[] data = new byte[buffered.length + chunk.length];
        System.arraycopy(buffered, 0, data, 0, buffered.length);
        System.arraycopy(chunk, 0, data, buffered.length, chunk.length);
        buffered = new byte[0];

        List<GenerateContentResponse> responses = new ArrayList<>();
        int completeEnd = completeFramesEnd(data);
        if (completeEnd > 0) {
            String complete = new String(data, 0, completeEnd, StandardCharsets.UTF_8).replace("\r\n", "\n");
            for (String frame : complete.split(FRAME_DELIMITER)) {
                String payload = stripDataPrefix(frame);
                if (payload.isBlank()) {
                    continue;
                }
                String json = payload.trim();
                if (JSON.isValidObject(json)) {
                    addDecoded(responses, json);
                } else {
                    log.debug("丢弃无法解析的帧: {}", json);
                }
            }
        }

        // 尾部没有空行结束，本身是完整 JSON 时直接解析（JSONL 形式），否则留到下一段
        byte[] tail = stripDataPrefix(Arrays.copyOfRange(data, completeEnd, data.length));
        String payload = new String(tail, StandardCharsets.UTF_8);
        if (!payload.isBlank()) {
            String json = payload.trim();
            if (JSON.isValidObject(json)) {
                addDecoded(responses, json);
            } else {
                buffered = tail;
                log.debug("缓存不完整的尾帧: {} 字节", tail.length);
            }
        }
        return responses;
    }

    String bufferedTail() {
        return new String(buffered, StandardCharsets.UTF_8);
    }

    /**
     * 最后一个空行（\n\n 或 \r\n\r\n）之后的下标，没有则为 0
     */
    private static int completeFramesEnd(byte[] data) {
        for (int i = data.length - 1; i > 0; i--) {
            if (data[i] != '\n') {
                continue;
            }
            if (data[i - 1] == '\n' || (data[i - 1] == '\r' && i > 1 && data[i - 2] == '\n')) {
                return i + 1;
            }
        }
        return 0;
    }

    private static String stripDataPrefix(String frame) {
        String stripped = frame.stripLeading();
        if (!stripped.startsWith(DATA_PREFIX)) {
            return stripped;
        }
        stripped = stripped.substring(DATA_PREFIX.length());
        return stripped.startsWith(" ") ? stripped.substring(1) : stripped;
    }

    private static byte[] stripDataPrefix(byte[] frame) {
        int start = 0;
        while (start < frame.length && (frame[start] & 0xFF) <= ' ') {
            start++;
        }
        if (startsWith(frame, start, DATA_PREFIX_BYTES)) {
            start += DATA_PREFIX_BYTES.length;
            if (start < frame.length && frame[start] == ' ') {
                start++;
            }
        }
        return Arrays.copyOfRange(frame, start, frame.length);
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (data.length - offset < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static void addDecoded(List<GenerateContentResponse> responses, String json) {
        GenerateContentResponse response = decode(json);
        if (response != null) {
            responses.add(response);
        }
    }

    private static GenerateContentResponse decode(String json) {
        try {
            return JSON.parseObject(json, GenerateContentResponse.class);
        } catch (JSONException e) {
            log.debug("帧结构与 GenerateContentResponse 不符: {}", e.getMessage());
            return null;
        }
    }
}
