package com.agilab.file_retrieval.notification;

import com.agilab.file_retrieval.config.FileRetrievalProperties;
import com.agilab.file_retrieval.domain.entity.DiscoveredFile;
import com.agilab.file_retrieval.domain.entity.FileRetrievalConfiguration;
import com.agilab.file_retrieval.event.FileNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Sends the events and commands a configuration defines for one newly discovered file.
 * Only files that were just inserted into the ledger reach this class, so a redelivered
 * command never announces a file again. The idempotency key header lets consumers drop
 * duplicates the broker itself may produce.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationEmitter {

    private final StreamBridge streamBridge;
    private final FileRetrievalProperties properties;

    /**
     * @return true when every definition was accepted by the binder
     */
    public boolean emit(FileRetrievalConfiguration configuration, UUID executionId, DiscoveredFile file) {
        var delivered = true;
        var events = configuration.getEventDefinitions();
        for (int i = 0; i < events.size(); i++) {
            var definition = events.get(i);
            delivered &= send(properties.getMessaging().getEventBinding(),
                    idempotencyKey(executionId, file.getDedupKey(), 'E', i),
                    notification(configuration, executionId, file, definition.eventType(), definition.eventData()));
        }
        var commands = configuration.getCommandDefinitions();
        for (int i = 0; i < commands.size(); i++) {
            var definition = commands.get(i);
            delivered &= send(definition.targetEndpoint(),
                    idempotencyKey(executionId, file.getDedupKey(), 'C', i),
                    notification(configuration, executionId, file, definition.commandType(), definition.commandData()));
        }
        return delivered;
    }

    static String idempotencyKey(UUID executionId, String dedupKey, char kind, int index) {
        return executionId + ":" + dedupKey + ":" + kind + index;
    }

    private boolean send(String destination, String idempotencyKey, FileNotification notification) {
        var message = MessageBuilder.withPayload(notification)
                .setHeader(NotificationHeaders.MESSAGE_TYPE, notification.messageType())
                .setHeader(NotificationHeaders.IDEMPOTENCY_KEY, idempotencyKey)
                .setHeader(NotificationHeaders.CORRELATION_ID, notification.executionId().toString())
                .build();
        try {
            var sent = streamBridge.send(destination, message);
            if (!sent) {
                log.warn("Failed to send {} to {} for file {}", notification.messageType(), destination, notification.fileUri());
                return false;
            }
            log.debug("{} sent to {} for file {}", notification.messageType(), destination, notification.fileUri());
            return true;
        } catch (Exception e) {
            log.warn("Error sending {} to {} for file {}", notification.messageType(), destination, notification.fileUri(), e);
            return false;
        }
    }

    private FileNotification notification(FileRetrievalConfiguration configuration,
                                          UUID executionId,
                                          DiscoveredFile file,
                                          String messageType,
                                          Map<String, Object> staticData) {
        var metadata = new LinkedHashMap<String, Object>(staticData);
        metadata.put("fileUri", file.getFileUri());
        metadata.put("fileName", file.getFileName());
        metadata.put("fileSize", file.getFileSize());
        metadata.put("lastModified", file.getLastModified());
        metadata.put("discoveredAt", file.getDiscoveredAt());
        return new FileNotification(messageType,
                configuration.getClientId(),
                configuration.getId(),
                configuration.getName(),
                executionId,
                file.getDedupKey(),
                file.getFileUri(),
                file.getFileName(),
                file.getFileSize(),
                file.getLastModified(),
                file.getDiscoveredAt(),
                metadata);
    }
}
