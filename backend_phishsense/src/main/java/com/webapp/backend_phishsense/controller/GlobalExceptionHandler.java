package com.webapp.backend_phishsense.controller;

import com.webapp.backend_phishsense.dtos.ErrorResponse;
import com.webapp.backend_phishsense.service.AnalysisJobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return new ResponseEntity<>(ErrorResponse.of("invalid_request", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(AnalysisJobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AnalysisJobNotFoundException ex) {
        return new ResponseEntity<>(ErrorResponse.of("not_found", ex.getMessage()), HttpStatus.NOT_FOUND);
    }
}
