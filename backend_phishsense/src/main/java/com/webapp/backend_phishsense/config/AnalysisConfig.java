package com.webapp.backend_phishsense.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "analysisScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService analysisScheduler() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "analysis-delay-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
