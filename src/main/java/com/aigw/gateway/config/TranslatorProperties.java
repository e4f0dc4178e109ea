package com.aigw.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 转换器配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "aigw")
public class TranslatorProperties {

    // 非空时替换所有请求中的 model
    private String modelNameOverride = "";
    private GcpConfig gcp = new GcpConfig();

    @Data
    public static class GcpConfig {
        private String publisher = "google";
    }
}
