package com.aigw.gateway;

import com.aigw.gateway.config.TranslatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class AiGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(AiGatewayApplication.class);

    private final TranslatorProperties properties;

    public AiGatewayApplication(TranslatorProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(AiGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("AI Gateway translator v1.0.0 已就绪");
        log.info("  OpenAI Chat Completions → GCP Vertex AI (publisher={})", properties.getGcp().getPublisher());
        if (!properties.getModelNameOverride().isEmpty()) {
            log.info("  模型覆盖: {}", properties.getModelNameOverride());
        }
    }
}
