package dev.resumeranker.error;

/**
 * Duplicate similarity threshold outside [0,1]. Fatal at configuration load.
 */
public class DuplicateThresholdInvalidException extends RuntimeException {

    public DuplicateThresholdInvalidException(double threshold) {
        super("duplicates.threshold must be within [0,1] but was " + threshold);
    }
}
