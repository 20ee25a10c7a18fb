package com.webapp.backend_phishsense.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class IndicatorClassifier {
    private final List<IndicatorRule> rules;

    public IndicatorClassifier() {
        this(IndicatorRules.DEFAULT);
    }

    public IndicatorClassifier(List<IndicatorRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<String> classify(String corpus, String url) {
        Set<String> labels = new LinkedHashSet<>();
        for (IndicatorRule rule : rules) {
            if (rule.matches(corpus, url)) {
                labels.add(rule.getLabel());
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public List<IndicatorRule> getRules() {
        return rules;
    }
}
