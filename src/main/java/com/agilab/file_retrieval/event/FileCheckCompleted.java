package com.agilab.file_retrieval.event;

import com.agilab.file_retrieval.domain.model.ExecutionStatus;

import java.time.Instant;
import java.util.UUID;

public record FileCheckCompleted(UUID executionId,
                                 String clientId,
                                 UUID configurationId,
                                 ExecutionStatus status,
                                 int discoveredCount,
                                 int dispatchedCount,
                                 Long durationMs,
                                 Instant occurredAt) implements FileCheckEvent {

    @Override
    public String idempotencyKey() {
        return FileCheckEvent.idempotencyKey(clientId, configurationId, "Completed", executionId);
    }
}
