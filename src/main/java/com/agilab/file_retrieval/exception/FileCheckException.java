package com.agilab.file_retrieval.exception;

/**
 * Sealed hierarchy for failures raised while checking a remote file source.
 * The subtype decides whether the command is redelivered or the execution is failed.
 */
public sealed interface FileCheckException
        permits TransientFileCheckException, PermanentFileCheckException {

    String getErrorCategory();
    String getMessage();
    Throwable getCause();

    default RuntimeException asRuntimeException() {
        return (RuntimeException) this;
    }
}
