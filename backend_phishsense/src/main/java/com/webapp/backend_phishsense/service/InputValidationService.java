package com.webapp.backend_phishsense.service;

import com.webapp.backend_phishsense.config.AnalysisProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InputValidationService {
    private final AnalysisProperties properties;

    public void validate(String text, String url) {
        if (isEmpty(text) && isEmpty(url)) {
            throw new IllegalArgumentException("Neither text nor URL provided");
        }
        if (text != null && text.length() > properties.getMaxTextLength()) {
            throw new IllegalArgumentException("Text exceeds " + properties.getMaxTextLength() + " characters");
        }
        if (url != null && url.length() > properties.getMaxUrlLength()) {
            throw new IllegalArgumentException("URL exceeds " + properties.getMaxUrlLength() + " characters");
        }
    }

    static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
