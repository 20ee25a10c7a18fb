package com.webapp.backend_phishsense.session;

public enum SessionState {
    IDLE,
    ANALYZING,
    RESULT
}
