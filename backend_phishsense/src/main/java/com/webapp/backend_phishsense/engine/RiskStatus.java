package com.webapp.backend_phishsense.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskStatus {
    SAFE("Safe"),
    SUSPICIOUS("Suspicious"),
    DANGEROUS("Dangerous");

    private final String label;

    RiskStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
