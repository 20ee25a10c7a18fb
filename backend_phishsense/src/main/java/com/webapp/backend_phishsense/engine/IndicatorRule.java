package com.webapp.backend_phishsense.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.function.BiPredicate;

@Getter
@RequiredArgsConstructor
public class IndicatorRule {
    private final String label;
    private final BiPredicate<String, String> predicate;

    public boolean matches(String corpus, String url) {
        return predicate.test(corpus, url);
    }

    public static IndicatorRule corpusContainsAny(String label, String... fragments) {
        return new IndicatorRule(label, (corpus, url) -> containsAny(corpus, fragments));
    }

    static boolean containsAny(String s, String... fragments) {
        return Arrays.stream(fragments).anyMatch(s::contains);
    }

    @Override
    public String toString() {
        return "IndicatorRule[" + label + "]";
    }
}
