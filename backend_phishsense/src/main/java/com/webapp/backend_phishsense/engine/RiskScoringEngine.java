package com.webapp.backend_phishsense.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class RiskScoringEngine {
    private final KeywordMatcher keywordMatcher;
    private final IndicatorClassifier indicatorClassifier;
    private final StatusResolver statusResolver;

    public AnalysisResult analyze(String text, String url) {
        String corpus = Normalizer.normalize(text, url);
        int rawScore = keywordMatcher.rawScore(corpus);
        List<String> indicators = indicatorClassifier.classify(corpus, Normalizer.nullToEmpty(url));
        AnalysisResult result = statusResolver.resolve(rawScore, indicators);
        log.debug("Scored corpus of {} chars: rawScore={}, indicators={}, status={}",
                corpus.length(), rawScore, indicators, result.getStatus());
        return result;
    }
}
