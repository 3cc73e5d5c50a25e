package dev.resumeranker.entity;

import dev.resumeranker.model.PairSimilarity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Entity for a duplicate cluster of the latest ranking session of a job description.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "duplicate_clusters", indexes = @Index(name = "idx_cluster_job", columnList = "jobId"))
public class DuplicateClusterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String jobId;

    @Column(nullable = false)
    private String survivorId;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> memberIds;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> memberFingerprints;

    @Convert(converter = PairSimilarityListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<PairSimilarity> pairs;

    @Column(columnDefinition = "TEXT")
    private String survivorRationale;
}
