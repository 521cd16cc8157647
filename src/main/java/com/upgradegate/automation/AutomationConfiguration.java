package com.upgradegate.automation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.upgradegate.config.UpgradeGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

@Configuration
public class AutomationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AutomationConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(AutomationBackend.class)
    public AnsiblePlaybookBackend automationBackend(UpgradeGateProperties properties,
                                                   ExecutorService collaboratorExecutor,
                                                   ObjectMapper objectMapper) {
        UpgradeGateProperties.Automation automation = properties.getAutomation();
        AnsibleSettings settings = new AnsibleSettings(
            Path.of(automation.getAnsibleDir()).toAbsolutePath(),
            automation.getInventoryFile(),
            automation.getUpgradePlaybook(),
            automation.getRollbackPlaybook(),
            automation.getTimeout());
        log.info("Ansible backend using {} (timeout {})", settings.ansibleDir(), settings.timeout());
        return new AnsiblePlaybookBackend(settings, collaboratorExecutor, objectMapper);
    }
}
