package dev.resumeranker.store;

import dev.resumeranker.entity.DuplicateClusterEntity;
import dev.resumeranker.entity.MatchResultEntity;
import dev.resumeranker.model.DuplicateCluster;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import dev.resumeranker.repository.DuplicateClusterRepository;
import dev.resumeranker.repository.MatchResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result store backed by SQLite through Spring Data JPA.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaResultStore implements ResultStore {

    private final MatchResultRepository matchResultRepository;
    private final DuplicateClusterRepository clusterRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<MatchResult> findLatest(ResultKey key) {
        return matchResultRepository
                .findTopByResumeFingerprintAndJobIdOrderByRevisionDesc(key.resumeFingerprint(), key.jobId())
                .map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MatchResult> history(ResultKey key) {
        return matchResultRepository
                .findByResumeFingerprintAndJobIdOrderByRevisionAsc(key.resumeFingerprint(), key.jobId())
                .stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    @Transactional
    public MatchResult append(MatchResult result) {
        ResultKey key = result.getKey();
        int next = matchResultRepository
                .findTopByResumeFingerprintAndJobIdOrderByRevisionDesc(key.resumeFingerprint(), key.jobId())
                .map(MatchResultEntity::getRevision)
                .orElse(0) + 1;

        MatchResult stored = result.toBuilder().revision(next).build();
        matchResultRepository.save(toEntity(stored));
        log.debug("Stored result {} revision {} (locked={})", key, next, stored.isLocked());
        return stored;
    }

    @Override
    @Transactional
    public void saveClusters(String jobId, List<DuplicateCluster> clusters) {
        clusterRepository.deleteByJobId(jobId);
        clusterRepository.saveAll(clusters.stream().map(this::toEntity).toList());
        log.debug("Stored {} duplicate clusters for job {}", clusters.size(), jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DuplicateCluster> findClusters(String jobId) {
        return clusterRepository.findByJobIdOrderByIdAsc(jobId).stream()
                .map(this::toModel)
                .toList();
    }

    private MatchResultEntity toEntity(MatchResult result) {
        return MatchResultEntity.builder()
                .resumeFingerprint(result.getKey().resumeFingerprint())
                .jobId(result.getKey().jobId())
                .revision(result.getRevision())
                .lexicalScore(result.getLexicalScore())
                .semanticScore(result.getSemanticScore())
                .aiScore(result.getAiScore())
                .aiRationale(result.getAiRationale())
                .compositeScore(result.getCompositeScore())
                .rationale(result.getRationale())
                .strengths(result.getStrengths())
                .concerns(result.getConcerns())
                .computedAt(result.getComputedAt().toEpochMilli())
                .locked(result.isLocked())
                .degraded(result.isDegraded())
                .algorithmVersion(result.getAlgorithmVersion())
                .build();
    }

    private MatchResult toModel(MatchResultEntity entity) {
        return MatchResult.builder()
                .key(new ResultKey(entity.getResumeFingerprint(), entity.getJobId()))
                .lexicalScore(entity.getLexicalScore())
                .semanticScore(entity.getSemanticScore())
                .aiScore(entity.getAiScore())
                .aiRationale(entity.getAiRationale())
                .compositeScore(entity.getCompositeScore())
                .rationale(entity.getRationale())
                .strengths(entity.getStrengths() == null ? List.of() : List.copyOf(entity.getStrengths()))
                .concerns(entity.getConcerns() == null ? List.of() : List.copyOf(entity.getConcerns()))
                .computedAt(Instant.ofEpochMilli(entity.getComputedAt()))
                .locked(entity.isLocked())
                .degraded(entity.isDegraded())
                .algorithmVersion(entity.getAlgorithmVersion())
                .revision(entity.getRevision())
                .build();
    }

    private DuplicateClusterEntity toEntity(DuplicateCluster cluster) {
        return DuplicateClusterEntity.builder()
                .jobId(cluster.jobId())
                .survivorId(cluster.survivorId())
                .memberIds(cluster.memberIds())
                .memberFingerprints(cluster.memberFingerprints())
                .pairs(cluster.pairs())
                .survivorRationale(cluster.survivorRationale())
                .build();
    }

    private DuplicateCluster toModel(DuplicateClusterEntity entity) {
        return new DuplicateCluster(
                entity.getJobId(),
                List.copyOf(entity.getMemberIds()),
                List.copyOf(entity.getMemberFingerprints()),
                entity.getSurvivorId(),
                entity.getPairs() == null ? List.of() : List.copyOf(entity.getPairs()),
                entity.getSurvivorRationale());
    }
}
