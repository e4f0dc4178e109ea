package com.aigw.gateway.translator;

import com.aigw.gateway.dto.openai.ChatCompletionRequest;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions 转换接口
 * <p>
 * 每个实例只服务一次请求/响应交换，按顺序调用，不支持并发
 */
public interface ChatCompletionTranslator {

    /**
     * 转换请求体
     *
     * @param rawBody           原始请求体
     * @param request           解码后的请求
     * @param forceBodyMutation 重试时为 true，要求必须返回请求体
     * @return 头部与请求体变更
     */
    RequestMutation requestBody(byte[] rawBody, ChatCompletionRequest request, boolean forceBodyMutation);

    /**
     * 转换响应头，无需变更时返回 null
     */
    List<Header> responseHeaders(Map<String, String> headers);

    /**
     * 转换响应体。流式响应会被多次调用，每次带来上游字节流的下一段
     *
     * @param headers     上游响应头
     * @param body        本次的响应体数据
     * @param endOfStream 是否为最后一段
     */
    ResponseMutation responseBody(Map<String, String> headers, InputStream body, boolean endOfStream);

    /**
     * 把上游非 2xx 响应体规整为 OpenAI 错误格式
     */
    ResponseMutation responseError(Map<String, String> headers, InputStream body);
}
