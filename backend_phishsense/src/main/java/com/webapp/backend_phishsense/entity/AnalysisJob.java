package com.webapp.backend_phishsense.entity;

import com.webapp.backend_phishsense.engine.RiskStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "analysis_jobs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String jobId;

    @Lob
    private String text;

    @Lob
    private String url;

    @Enumerated(EnumType.STRING)
    private RiskStatus status;

    private int riskScore;
    private int rawScore;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "analysis_job_indicators", joinColumns = @JoinColumn(name = "analysis_job_id"))
    @OrderColumn(name = "indicator_order")
    @Column(name = "label")
    private List<String> indicators = new ArrayList<>();

    private Instant createdAt;
}
