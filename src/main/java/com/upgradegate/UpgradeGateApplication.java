package com.upgradegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UpgradeGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(UpgradeGateApplication.class, args);
    }
}
