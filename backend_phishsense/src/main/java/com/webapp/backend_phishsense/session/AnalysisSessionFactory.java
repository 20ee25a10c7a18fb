package com.webapp.backend_phishsense.session;

import com.webapp.backend_phishsense.config.AnalysisProperties;
import com.webapp.backend_phishsense.engine.RiskScoringEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class AnalysisSessionFactory {
    private final RiskScoringEngine engine;
    private final ScheduledExecutorService scheduler;
    private final AnalysisProperties properties;

    public AnalysisSessionFactory(RiskScoringEngine engine,
                                  @Qualifier("analysisScheduler") ScheduledExecutorService scheduler,
                                  AnalysisProperties properties) {
        this.engine = engine;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    public AnalysisSession create() {
        return create(properties.getSimulatedDelay());
    }

    public AnalysisSession create(Duration delay) {
        return new AnalysisSession(engine, scheduler, delay);
    }
}
