package com.webapp.backend_phishsense.engine;

import java.util.List;

public final class IndicatorRules {
    public static final String SENSE_OF_URGENCY = "Sense of Urgency";
    public static final String IMPERSONATION_OF_BRANDS = "Impersonation of Brands";
    public static final String SUSPICIOUS_LINKS = "Suspicious Links";
    public static final String GENERIC_GREETINGS = "Generic Greetings";
    public static final String REQUEST_FOR_PERSONAL_INFO = "Request for Personal Info";

    static final String SECURE_SCHEME = "https";
    static final List<String> SHORTENER_FRAGMENTS = List.of("bit.ly", "tinyurl");

    // declaration order is the order labels appear in a result
    public static final List<IndicatorRule> DEFAULT = List.of(
            IndicatorRule.corpusContainsAny(SENSE_OF_URGENCY, "urgent", "immediate"),
            IndicatorRule.corpusContainsAny(IMPERSONATION_OF_BRANDS, "verify", "account"),
            new IndicatorRule(SUSPICIOUS_LINKS, (corpus, url) -> isSuspiciousLink(url)),
            IndicatorRule.corpusContainsAny(GENERIC_GREETINGS, "dear customer", "valued user"),
            IndicatorRule.corpusContainsAny(REQUEST_FOR_PERSONAL_INFO, "password", "credit card", "ssn")
    );

    private IndicatorRules() {
    }

    /** Raw url, not the corpus: a non-empty url that uses a shortener or lacks the https prefix. */
    static boolean isSuspiciousLink(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        return SHORTENER_FRAGMENTS.stream().anyMatch(url::contains) || !url.startsWith(SECURE_SCHEME);
    }
}
