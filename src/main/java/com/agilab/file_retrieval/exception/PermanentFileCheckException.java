package com.agilab.file_retrieval.exception;

/**
 * Failure that redelivery cannot fix (bad credentials, malformed settings, unsupported pattern).
 */
public final class PermanentFileCheckException extends RuntimeException implements FileCheckException {
    private final String errorCategory;

    public PermanentFileCheckException(String errorCategory, String message, Throwable cause) {
        super(message, cause);
        this.errorCategory = errorCategory;
    }

    public PermanentFileCheckException(String errorCategory, String message) {
        super(message);
        this.errorCategory = errorCategory;
    }

    @Override
    public String getErrorCategory() {
        return errorCategory;
    }
}
