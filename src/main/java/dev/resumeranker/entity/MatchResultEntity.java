package dev.resumeranker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Entity for one revision of a match result.
 * Rows are only ever inserted; the latest revision per (fingerprint, job) is the current result.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "match_results",
        uniqueConstraints = @UniqueConstraint(name = "uk_result_revision",
                columnNames = {"resumeFingerprint", "jobId", "revision"}),
        indexes = @Index(name = "idx_result_key", columnList = "resumeFingerprint, jobId"))
public class MatchResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String resumeFingerprint;

    @Column(nullable = false, length = 64)
    private String jobId;

    @Column(nullable = false)
    private int revision;

    @Column(nullable = false)
    private double lexicalScore;

    private Double semanticScore;

    private Double aiScore;

    @Column(columnDefinition = "TEXT")
    private String aiRationale;

    @Column(nullable = false)
    private double compositeScore;

    @Column(columnDefinition = "TEXT")
    private String rationale;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> strengths;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> concerns;

    // epoch millis, exact round trip
    @Column(nullable = false)
    private long computedAt;

    @Column(nullable = false)
    private boolean locked;

    @Column(nullable = false)
    private boolean degraded;

    @Column(nullable = false)
    private int algorithmVersion;
}
