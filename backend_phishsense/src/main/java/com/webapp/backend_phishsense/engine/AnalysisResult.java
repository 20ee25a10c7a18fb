package com.webapp.backend_phishsense.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnalysisResult {
    RiskStatus status;
    int riskScore;
    // keyword score before the indicator boost; status is derived from it
    int rawScore;
    @Singular
    List<String> indicators;
}
