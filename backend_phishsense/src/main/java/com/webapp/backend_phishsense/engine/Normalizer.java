package com.webapp.backend_phishsense.engine;

import java.util.Locale;

public final class Normalizer {
    static final String SEPARATOR = " ";

    private Normalizer() {
    }

    public static String normalize(String text, String url) {
        return (nullToEmpty(text) + SEPARATOR + nullToEmpty(url)).toLowerCase(Locale.ROOT);
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
