package dev.resumeranker.service;

import dev.resumeranker.config.DuplicateConfig;
import dev.resumeranker.model.DuplicateCluster;
import dev.resumeranker.model.FileMetadata;
import dev.resumeranker.model.PairSimilarity;
import dev.resumeranker.model.ResultStatus;
import dev.resumeranker.model.ResumeRecord;
import dev.resumeranker.model.ScoredCandidate;
import dev.resumeranker.model.SurvivorCriterion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service for clustering near-duplicate resumes of a batch and picking one survivor per cluster.
 * Non-survivors are only marked suppressed; their records stay intact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateDetectionService {

    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    private final ResumeSimilarityCalculator calculator;
    private final DuplicateConfig duplicateConfig;

    /**
     * Partition the batch into duplicate clusters, singletons included.
     * Must run after every candidate of the batch has been scored.
     *
     * @param candidates scored candidates of one batch
     * @param jobId      job description the batch was scored against
     * @return clusters ordered by survivor preference
     */
    public List<DuplicateCluster> detect(List<ScoredCandidate> candidates, String jobId) {
        int n = candidates.size();
        if (n == 0) {
            return List.of();
        }

        DisjointSet sets = new DisjointSet(n);
        PairSimilarity[][] matrix = new PairSimilarity[n][n];
        double threshold = duplicateConfig.getThreshold();

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                ScoredCandidate a = candidates.get(i);
                ScoredCandidate b = candidates.get(j);
                PairSimilarity pair = calculator.compare(a.resume(), b.resume(), a.compositeScore(), b.compositeScore());
                matrix[i][j] = pair;
                if (pair.exceedsThreshold(threshold)) {
                    sets.union(i, j);
                    log.debug("Duplicate pair {} ~ {}: {} via {}", pair.firstId(), pair.secondId(),
                            String.format(Locale.ROOT, "%.3f", pair.overall()), pair.trigger());
                }
            }
        }

        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(sets.find(i), root -> new ArrayList<>()).add(i);
        }

        Comparator<ScoredCandidate> preference = survivorComparator();
        List<RankedCluster> ranked = new ArrayList<>();
        int suppressed = 0;

        for (List<Integer> group : groups.values()) {
            List<ScoredCandidate> members = group.stream()
                    .map(candidates::get)
                    .sorted(preference)
                    .toList();
            ScoredCandidate survivor = members.get(0);

            List<PairSimilarity> pairs = new ArrayList<>();
            for (int x = 0; x < group.size(); x++) {
                for (int y = x + 1; y < group.size(); y++) {
                    int i = Math.min(group.get(x), group.get(y));
                    int j = Math.max(group.get(x), group.get(y));
                    pairs.add(matrix[i][j]);
                }
            }
            pairs.sort(Comparator.comparing(PairSimilarity::firstId).thenComparing(PairSimilarity::secondId));

            for (ScoredCandidate member : members) {
                ResumeRecord resume = member.resume();
                boolean duplicate = member != survivor;
                resume.setSuppressed(duplicate);
                resume.setDuplicateOf(duplicate ? survivor.resume().getSubmissionId() : null);
                if (duplicate) {
                    suppressed++;
                }
            }

            ranked.add(new RankedCluster(survivor, new DuplicateCluster(
                    jobId,
                    members.stream().map(m -> m.resume().getSubmissionId()).toList(),
                    members.stream().map(m -> m.resume().getFingerprint()).toList(),
                    survivor.resume().getSubmissionId(),
                    List.copyOf(pairs),
                    rationale(members))));
        }

        List<DuplicateCluster> clusters = ranked.stream()
                .sorted(Comparator.comparing(RankedCluster::survivor, preference))
                .map(RankedCluster::cluster)
                .toList();

        log.info("Duplicate detection: {} resumes, {} clusters with duplicates, {} suppressed (threshold {})",
                n, clusters.stream().filter(c -> !c.isSingleton()).count(), suppressed, threshold);
        return clusters;
    }

    private record RankedCluster(ScoredCandidate survivor, DuplicateCluster cluster) {
    }

    /**
     * Survivor preference: failed candidates last, then the configured criteria,
     * then stable identity tie-breaks.
     */
    Comparator<ScoredCandidate> survivorComparator() {
        Comparator<ScoredCandidate> comparator = Comparator.comparing(DuplicateDetectionService::isFailed);
        for (SurvivorCriterion criterion : duplicateConfig.getSurvivorOrder()) {
            comparator = comparator.thenComparing(criterionComparator(criterion));
        }
        return comparator
                .thenComparing(c -> c.resume().getFingerprint(), NULLS_LAST)
                .thenComparing(c -> fileName(c.resume()), NULLS_LAST)
                .thenComparing(c -> c.resume().getSubmissionId(), NULLS_LAST);
    }

    private Comparator<ScoredCandidate> criterionComparator(SurvivorCriterion criterion) {
        return switch (criterion) {
            case SCORE -> Comparator.comparingDouble(ScoredCandidate::compositeScore).reversed();
            case CONTACT_COMPLETENESS -> Comparator.comparingInt(
                    (ScoredCandidate c) -> c.resume().getContact() == null ? 0 : c.resume().getContact().completeness())
                    .reversed();
            case UPLOAD_TIME -> Comparator.comparing((ScoredCandidate c) -> uploadedAt(c.resume()),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder()));
        };
    }

    private String rationale(List<ScoredCandidate> members) {
        ScoredCandidate survivor = members.get(0);
        if (members.size() == 1) {
            return "Unique submission";
        }
        ScoredCandidate runnerUp = members.get(1);
        String decidedBy = "identity tie-break";
        if (isFailed(runnerUp) && !isFailed(survivor)) {
            decidedBy = "failed scoring of the others";
        } else {
            for (SurvivorCriterion criterion : duplicateConfig.getSurvivorOrder()) {
                if (criterionComparator(criterion).compare(survivor, runnerUp) != 0) {
                    decidedBy = criterion.name().toLowerCase(Locale.ROOT).replace('_', ' ');
                    break;
                }
            }
        }
        return String.format(Locale.ROOT, "Kept '%s' (score %.2f) over %d duplicate(s), decided by %s",
                survivor.resume().getDisplayName(), Math.max(0.0, survivor.compositeScore()),
                members.size() - 1, decidedBy);
    }

    private static boolean isFailed(ScoredCandidate candidate) {
        return candidate.status() == ResultStatus.FAILED;
    }

    private static String fileName(ResumeRecord resume) {
        FileMetadata metadata = resume.getMetadata();
        return metadata != null ? metadata.fileName() : null;
    }

    private static Instant uploadedAt(ResumeRecord resume) {
        FileMetadata metadata = resume.getMetadata();
        return metadata != null ? metadata.uploadedAt() : null;
    }
}
