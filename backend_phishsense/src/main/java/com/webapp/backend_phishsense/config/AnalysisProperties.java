package com.webapp.backend_phishsense.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "phishsense.analysis")
public class AnalysisProperties {
    private int maxTextLength = 10_000;
    private int maxUrlLength = 2048;
    private boolean persistJobs = true;
    private Duration simulatedDelay = Duration.ofMillis(1500);
}
