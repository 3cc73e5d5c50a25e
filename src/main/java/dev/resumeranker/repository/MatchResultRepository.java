package dev.resumeranker.repository;

import dev.resumeranker.entity.MatchResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for match result revisions.
 */
@Repository
public interface MatchResultRepository extends JpaRepository<MatchResultEntity, Long> {

    /**
     * Latest revision for a result key.
     */
    Optional<MatchResultEntity> findTopByResumeFingerprintAndJobIdOrderByRevisionDesc(
            String resumeFingerprint, String jobId);

    /**
     * All revisions for a result key, oldest first.
     */
    List<MatchResultEntity> findByResumeFingerprintAndJobIdOrderByRevisionAsc(String resumeFingerprint, String jobId);
}
