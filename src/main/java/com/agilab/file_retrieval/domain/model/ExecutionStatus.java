package com.agilab.file_retrieval.domain.model;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
