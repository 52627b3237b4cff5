package com.agilab.file_retrieval.exception;

/**
 * Failure expected to clear on its own (timeouts, network loss, expired credentials).
 * Propagated so the command is redelivered.
 */
public final class TransientFileCheckException extends RuntimeException implements FileCheckException {
    private final String errorCategory;

    public TransientFileCheckException(String errorCategory, String message, Throwable cause) {
        super(message, cause);
        this.errorCategory = errorCategory;
    }

    public TransientFileCheckException(String errorCategory, String message) {
        super(message);
        this.errorCategory = errorCategory;
    }

    @Override
    public String getErrorCategory() {
        return errorCategory;
    }
}
