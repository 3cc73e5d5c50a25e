package dev.resumeranker.error;

/**
 * The embedding backend could not produce a vector. Non-fatal: the semantic sub-score is omitted.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
