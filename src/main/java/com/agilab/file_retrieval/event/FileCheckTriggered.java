package com.agilab.file_retrieval.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record FileCheckTriggered(UUID executionId,
                                 String clientId,
                                 UUID configurationId,
                                 @JsonProperty("isManualTrigger") boolean manualTrigger,
                                 String triggeredBy,
                                 Instant scheduledExecutionTime,
                                 Instant occurredAt) implements FileCheckEvent {

    @Override
    public String idempotencyKey() {
        return FileCheckEvent.idempotencyKey(clientId, configurationId, "Triggered", executionId);
    }
}
