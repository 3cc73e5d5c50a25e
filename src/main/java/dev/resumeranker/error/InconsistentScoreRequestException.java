package dev.resumeranker.error;

import dev.resumeranker.model.ResultKey;
import lombok.Getter;

/**
 * Raised when a locked result is asked to be recomputed without an explicit override.
 */
@Getter
public class InconsistentScoreRequestException extends RuntimeException {

    private final transient ResultKey key;

    public InconsistentScoreRequestException(ResultKey key) {
        super("Result " + key + " is locked; recomputation requires an explicit override");
        this.key = key;
    }
}
