package com.webapp.backend_phishsense.engine;

import java.util.List;

public final class KeywordCorpus {
    public static final int KEYWORD_WEIGHT = 15;

    public static final List<String> PHRASES = List.of(
            "urgent", "action required", "verify your account", "unusual activity",
            "password reset", "limited time", "immediate attention", "suspend",
            "unauthorized access", "click here", "gift card", "lottery", "prize",
            "bank", "paypal", "microsoft", "amazon", "google", "apple", "netflix"
    );

    private KeywordCorpus() {
    }
}
