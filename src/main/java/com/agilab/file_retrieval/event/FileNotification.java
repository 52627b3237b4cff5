package com.agilab.file_retrieval.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Payload of the per-file events and commands described by a configuration.
 * {@code metadata} holds the definition's static data overlaid with the file fields.
 */
public record FileNotification(String messageType,
                               String clientId,
                               UUID configurationId,
                               String configurationName,
                               UUID executionId,
                               String dedupKey,
                               String fileUri,
                               String fileName,
                               Long fileSize,
                               Instant lastModified,
                               Instant discoveredAt,
                               Map<String, Object> metadata) {
}
