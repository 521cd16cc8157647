package com.upgradegate.gate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.upgradegate.config.UpgradeGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

@Configuration
public class GateConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GateConfiguration.class);

    @Bean
    public GateSettings gateSettings(UpgradeGateProperties properties) {
        UpgradeGateProperties.Gate gate = properties.getGate();
        return new GateSettings(gate.isEnabled(), gate.getTimeout(), gate.getModel());
    }

    @Bean
    @ConditionalOnMissingBean(SemanticReviewClient.class)
    public HttpSemanticReviewClient semanticReviewClient(RestTemplateBuilder builder,
                                                        ObjectMapper objectMapper,
                                                        UpgradeGateProperties properties) {
        UpgradeGateProperties.Gate gate = properties.getGate();
        return new HttpSemanticReviewClient(
            builder.setConnectTimeout(gate.getTimeout()).setReadTimeout(gate.getTimeout()).build(),
            objectMapper,
            gate.getUrl());
    }

    @Bean
    public SafetyGate safetyGate(GateSettings gateSettings,
                                 SemanticReviewClient semanticReviewClient,
                                 ExecutorService collaboratorExecutor) {
        log.info("Safety gate {}", gateSettings.enabled() ? "enabled (fail-closed)" : "disabled");
        return new SafetyGate(gateSettings, semanticReviewClient, collaboratorExecutor);
    }
}
