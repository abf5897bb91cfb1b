package com.example.series_backend.exception;

/**
 * Raised by generation, upload and synthesis collaborators. The production worker treats it as
 * transient and retries the job with backoff until its attempts run out.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
