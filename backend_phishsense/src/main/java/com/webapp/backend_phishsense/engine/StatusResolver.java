package com.webapp.backend_phishsense.engine;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StatusResolver {
    static final int INDICATOR_BONUS = 10;
    static final int MAX_SCORE = 100;
    static final int DANGEROUS_RAW_SCORE = 60;
    static final int DANGEROUS_INDICATORS = 3;
    static final int SUSPICIOUS_RAW_SCORE = 20;
    static final int SUSPICIOUS_INDICATORS = 1;

    public AnalysisResult resolve(int rawScore, List<String> indicators) {
        return AnalysisResult.builder()
                .status(statusFor(rawScore, indicators.size()))
                .riskScore(finalScore(rawScore, indicators.size()))
                .rawScore(rawScore)
                .indicators(indicators)
                .build();
    }

    static int finalScore(int rawScore, int indicatorCount) {
        return Math.min(rawScore + INDICATOR_BONUS * indicatorCount, MAX_SCORE);
    }

    // thresholds apply to the raw score, not the boosted one
    static RiskStatus statusFor(int rawScore, int indicatorCount) {
        if (rawScore > DANGEROUS_RAW_SCORE || indicatorCount >= DANGEROUS_INDICATORS) {
            return RiskStatus.DANGEROUS;
        }
        if (rawScore > SUSPICIOUS_RAW_SCORE || indicatorCount >= SUSPICIOUS_INDICATORS) {
            return RiskStatus.SUSPICIOUS;
        }
        return RiskStatus.SAFE;
    }
}
