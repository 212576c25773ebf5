package io.provtrack;

/**
 * Base of every error raised by the store and the graphs. All of them are
 * surfaced to the caller synchronously and never retried internally.
 */
public class ProvTrackException extends RuntimeException {
    public ProvTrackException(String message) {
        super(message);
    }

    public ProvTrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
