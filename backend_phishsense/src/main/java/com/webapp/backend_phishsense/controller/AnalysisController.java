package com.webapp.backend_phishsense.controller;

import com.webapp.backend_phishsense.dtos.AnalysisRequest;
import com.webapp.backend_phishsense.dtos.AnalysisResponse;
import com.webapp.backend_phishsense.dtos.ExampleMessageDto;
import com.webapp.backend_phishsense.service.AnalysisService;
import com.webapp.backend_phishsense.service.ExampleCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {
    private final AnalysisService analysisService;
    private final ExampleCatalog exampleCatalog;

    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(
            @RequestParam(required = false) String text,
            @RequestParam(required = false) String url,
            @RequestParam(required = false) String mode) {

        AnalysisRequest request = AnalysisRequest.builder()
                .text(text)
                .url(url)
                .mode(mode)
                .build();

        return ResponseEntity.ok(analysisService.analyze(request));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<AnalysisResponse> get(
            @PathVariable String jobId,
            @RequestParam(required = false) String mode) {
        return ResponseEntity.ok(analysisService.findByJobId(jobId, mode));
    }

    @GetMapping("/examples")
    public ResponseEntity<List<ExampleMessageDto>> examples() {
        return ResponseEntity.ok(exampleCatalog.examples());
    }
}
