package com.webapp.backend_phishsense.service;

import com.webapp.backend_phishsense.dtos.AnalysisResponse;
import com.webapp.backend_phishsense.engine.AnalysisResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@RequiredArgsConstructor
public class AggregatorService {
    private final ExplanationService explanationService;

    public AnalysisResponse aggregate(String jobId, AnalysisResult result, ExplanationMode mode, Instant analyzedAt) {
        return AnalysisResponse.builder()
                .jobId(jobId)
                .status(result.getStatus())
                .riskScore(result.getRiskScore())
                .indicators(result.getIndicators())
                .indicatorHeadline(explanationService.indicatorHeadline(result.getIndicators()))
                .mode(mode.param())
                .explanation(explanationService.explain(result, mode))
                .nextSteps(explanationService.nextSteps(result.getStatus()))
                .analyzedAt(analyzedAt)
                .build();
    }
}
