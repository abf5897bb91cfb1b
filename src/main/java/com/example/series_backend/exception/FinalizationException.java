package com.example.series_backend.exception;

public class FinalizationException extends RuntimeException {
    public FinalizationException(String message) {
        super(message);
    }

    public FinalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
