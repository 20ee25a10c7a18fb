package com.webapp.backend_phishsense.engine;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class KeywordMatcher {
    private final List<String> phrases;
    private final int weight;

    public KeywordMatcher() {
        this(KeywordCorpus.PHRASES, KeywordCorpus.KEYWORD_WEIGHT);
    }

    KeywordMatcher(List<String> phrases, int weight) {
        this.phrases = List.copyOf(phrases);
        this.weight = weight;
    }

    public int rawScore(String corpus) {
        int score = 0;
        for (String phrase : phrases) {
            if (corpus.contains(phrase)) {
                score += weight;
            }
        }
        return score;
    }
}
