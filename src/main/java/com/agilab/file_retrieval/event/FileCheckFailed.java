package com.agilab.file_retrieval.event;

import java.time.Instant;
import java.util.UUID;

public record FileCheckFailed(UUID executionId,
                              String clientId,
                              UUID configurationId,
                              String failureReason,
                              String errorCategory,
                              Instant occurredAt) implements FileCheckEvent {

    @Override
    public String idempotencyKey() {
        return FileCheckEvent.idempotencyKey(clientId, configurationId, "Failed", executionId);
    }
}
