package com.upgradegate.health;

import com.upgradegate.config.UpgradeGateProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

@Configuration
public class HealthConfiguration {

    @Bean
    @ConditionalOnMissingBean(TelemetryClient.class)
    public InMemoryTelemetry telemetryClient(Clock clock) {
        return new InMemoryTelemetry(clock);
    }

    @Bean
    public HealthAggregator healthAggregator(TelemetryClient telemetryClient,
                                             ExecutorService collaboratorExecutor,
                                             UpgradeGateProperties properties) {
        return new HealthAggregator(telemetryClient, collaboratorExecutor,
            properties.getTelemetry().getTimeout());
    }
}
