package dev.resumeranker.error;

/**
 * The AI provider returned something unusable (empty, malformed or out-of-range).
 */
public class AiProviderException extends RuntimeException {

    public AiProviderException(String message) {
        super(message);
    }

    public AiProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
