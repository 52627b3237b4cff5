package com.agilab.file_retrieval.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit events describing the life cycle of one execution.
 */
public sealed interface FileCheckEvent permits FileCheckTriggered, FileCheckCompleted, FileCheckFailed {

    UUID executionId();
    String clientId();
    UUID configurationId();
    Instant occurredAt();

    /**
     * Stable per execution and event kind, so consumers can drop redeliveries.
     */
    String idempotencyKey();

    static String idempotencyKey(String clientId, UUID configurationId, String kind, UUID executionId) {
        return clientId + ":" + configurationId + ":" + kind + ":" + executionId;
    }
}
