package com.webapp.backend_phishsense.service;

public class AnalysisJobNotFoundException extends RuntimeException {
    public AnalysisJobNotFoundException(String jobId) {
        super("No analysis found for job " + jobId);
    }
}
