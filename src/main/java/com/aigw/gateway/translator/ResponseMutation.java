package com.aigw.gateway.translator;

import java.util.List;

/**
 * 响应转换结果
 *
 * @param headers       需要替换的响应头，可为 null
 * @param body          转换后的响应体，可为 null
 * @param tokenUsage    本次调用解析出的 token 用量
 * @param responseModel 实际提供服务的模型名
 */
public record ResponseMutation(List<Header> headers, byte[] body, LlmTokenUsage tokenUsage, String responseModel) {}
