package com.webapp.backend_phishsense.service;

import com.webapp.backend_phishsense.config.AnalysisProperties;
import com.webapp.backend_phishsense.dtos.AnalysisRequest;
import com.webapp.backend_phishsense.dtos.AnalysisResponse;
import com.webapp.backend_phishsense.engine.AnalysisResult;
import com.webapp.backend_phishsense.engine.RiskScoringEngine;
import com.webapp.backend_phishsense.entity.AnalysisJob;
import com.webapp.backend_phishsense.repository.AnalysisJobRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {
    private final InputValidationService inputValidationService;
    private final RiskScoringEngine engine;
    private final AggregatorService aggregatorService;
    private final AnalysisJobRepo jobRepo;
    private final AnalysisProperties properties;
    private final Clock clock;

    @Transactional
    public AnalysisResponse analyze(AnalysisRequest request) {
        ExplanationMode mode = ExplanationMode.from(request.getMode());
        try {
            inputValidationService.validate(request.getText(), request.getUrl());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected analysis request: {}", e.getMessage());
            throw e;
        }

        String jobId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        AnalysisResult result = engine.analyze(request.getText(), request.getUrl());

        if (properties.isPersistJobs()) {
            jobRepo.save(AnalysisJob.builder()
                    .jobId(jobId)
                    .text(request.getText())
                    .url(request.getUrl())
                    .status(result.getStatus())
                    .riskScore(result.getRiskScore())
                    .rawScore(result.getRawScore())
                    .indicators(new ArrayList<>(result.getIndicators()))
                    .createdAt(now)
                    .build());
        }

        log.info("Analysis {} finished: status={}, riskScore={}, indicators={}",
                jobId, result.getStatus(), result.getRiskScore(), result.getIndicators().size());
        return aggregatorService.aggregate(jobId, result, mode, now);
    }

    @Transactional(readOnly = true)
    public AnalysisResponse findByJobId(String jobId, String modeParam) {
        ExplanationMode mode = ExplanationMode.from(modeParam);
        AnalysisJob job = jobRepo.findByJobId(jobId)
                .orElseThrow(() -> new AnalysisJobNotFoundException(jobId));
        AnalysisResult result = AnalysisResult.builder()
                .status(job.getStatus())
                .riskScore(job.getRiskScore())
                .rawScore(job.getRawScore())
                .indicators(job.getIndicators())
                .build();
        return aggregatorService.aggregate(job.getJobId(), result, mode, job.getCreatedAt());
    }
}
