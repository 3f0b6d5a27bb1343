package com.bank.bakeoff.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {
    private double defaultReviewRate = 0.005;
    private int defaultPreviewLimit = 200;
    private int maxPreviewLimit = 1000;
    private int maxReasonCodes = 3;
}
