package com.aigw.gateway.translator;

import com.aigw.gateway.config.TranslatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 按后端协议为每次交换创建新的转换器实例
 * <p>
 * 转换器带有交换级状态，不能复用
 */
@Component
public class TranslatorFactory {

    private static final Logger log = LoggerFactory.getLogger(TranslatorFactory.class);

    private final TranslatorProperties properties;

    public TranslatorFactory(TranslatorProperties properties) {
        this.properties = properties;
    }

    public ChatCompletionTranslator create(ApiSchema schema) {
        return create(schema, properties.getModelNameOverride());
    }

    /**
     * @param modelNameOverride 非空时替换请求中的 model
     */
    public ChatCompletionTranslator create(ApiSchema schema, String modelNameOverride) {
        log.debug("创建转换器: schema={}, modelNameOverride={}", schema, modelNameOverride);
        return switch (schema) {
            case GCP_VERTEX_AI -> new OpenAiToGcpVertexAiTranslator(modelNameOverride, properties.getGcp().getPublisher());
        };
    }
}
