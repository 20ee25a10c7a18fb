package com.webapp.backend_phishsense.service;

import java.util.Locale;

public enum ExplanationMode {
    NORMAL,
    SIMPLIFIED;

    /** Parses a request parameter; blank means NORMAL, "eli12" is accepted as SIMPLIFIED. */
    public static ExplanationMode from(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "normal":
                return NORMAL;
            case "simplified":
            case "eli12":
                return SIMPLIFIED;
            default:
                throw new IllegalArgumentException("Unknown explanation mode: " + value);
        }
    }

    public String param() {
        return name().toLowerCase(Locale.ROOT);
    }
}
