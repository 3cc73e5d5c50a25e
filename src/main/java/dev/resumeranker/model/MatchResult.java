package dev.resumeranker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Score of one resume against one job description.
 * Instances are immutable; a locked result is copied forward verbatim on every rerun.
 */
@Value
@Builder(toBuilder = true)
public class MatchResult {
    ResultKey key;

    double lexicalScore;
    Double semanticScore; // null when the embedding backend was unavailable
    Double aiScore;       // null when AI is disabled or failed
    String aiRationale;

    double compositeScore;
    String rationale;
    List<String> strengths;
    List<String> concerns;

    Instant computedAt;
    boolean locked;
    boolean degraded;
    int algorithmVersion;
    int revision;

    public int compositePercent() {
        return (int) Math.round(compositeScore * 100);
    }

    public boolean hasSemanticScore() {
        return semanticScore != null;
    }

    public boolean hasAiScore() {
        return aiScore != null;
    }
}
