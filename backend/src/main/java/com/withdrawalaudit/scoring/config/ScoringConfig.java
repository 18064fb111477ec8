package com.withdrawalaudit.scoring.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Scoring module configuration: binds the deployment thresholds and exposes the active config.
 */
@Configuration
@EnableConfigurationProperties(ClassificationProperties.class)
@Slf4j
public class ScoringConfig {

    @Bean
    public ClassificationConfig activeClassificationConfig(ClassificationProperties classificationProperties) {
        ClassificationConfig config = classificationProperties.toConfig();
        log.info("Active classification thresholds: {}", config);
        return config;
    }
}
