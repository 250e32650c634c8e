package com.herzen.irt.error;

/**
 * Base type of every error the analysis core surfaces to its callers.
 * Callers only rely on {@link #kind()} and the message.
 */
public abstract class AnalysisException extends RuntimeException {
    private final ErrorKind kind;

    protected AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
