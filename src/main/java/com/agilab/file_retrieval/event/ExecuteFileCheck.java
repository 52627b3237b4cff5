package com.agilab.file_retrieval.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Request to run one file check. Sent by the scheduler, or by the manual-trigger API
 * once it has checked tenant ownership.
 */
public record ExecuteFileCheck(String clientId,
                               UUID configurationId,
                               Instant scheduledTime,
                               @JsonProperty("isManualTrigger") boolean manualTrigger,
                               String triggeredBy,
                               String idempotencyKey) {

    public static final String SCHEDULER = "Scheduler";
    public static final String MANUAL_API = "manual-api";

    public ExecuteFileCheck {
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = manualTrigger ? MANUAL_API : SCHEDULER;
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            idempotencyKey = clientId + ":" + configurationId + ":" + scheduledTime;
        }
    }

    public static ExecuteFileCheck scheduled(String clientId, UUID configurationId, Instant scheduledTime) {
        return new ExecuteFileCheck(clientId, configurationId, scheduledTime, false, SCHEDULER, null);
    }

    public static ExecuteFileCheck manual(String clientId, UUID configurationId, Instant requestedAt, String triggeredBy) {
        return new ExecuteFileCheck(clientId, configurationId, requestedAt, true, triggeredBy, null);
    }
}
