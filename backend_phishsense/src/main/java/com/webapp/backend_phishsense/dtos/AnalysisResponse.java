package com.webapp.backend_phishsense.dtos;

import com.webapp.backend_phishsense.engine.RiskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisResponse {
    private String jobId;
    private RiskStatus status;
    private int riskScore;
    private List<String> indicators;
    private String indicatorHeadline;
    private String mode;
    private List<String> explanation;
    private List<NextStepDto> nextSteps;
    private Instant analyzedAt;
}
