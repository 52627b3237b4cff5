package com.agilab.file_retrieval.notification;

import com.agilab.file_retrieval.config.FileRetrievalProperties;
import com.agilab.file_retrieval.event.FileCheckEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Service;

/**
 * Publishes execution life-cycle events. A failed publish is logged and never fails the execution.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventPublisher {

    private final StreamBridge streamBridge;
    private final FileRetrievalProperties properties;

    public boolean publish(FileCheckEvent event) {
        var binding = properties.getMessaging().getAuditBinding();
        var messageType = event.getClass().getSimpleName();
        var message = MessageBuilder.withPayload(event)
                .setHeader(NotificationHeaders.MESSAGE_TYPE, messageType)
                .setHeader(NotificationHeaders.IDEMPOTENCY_KEY, event.idempotencyKey())
                .setHeader(NotificationHeaders.CORRELATION_ID, event.executionId().toString())
                .build();
        try {
            var sent = streamBridge.send(binding, message);
            if (sent) {
                log.info("{} sent to {} for execution {}", messageType, binding, event.executionId());
            } else {
                log.error("Failed to send {} to {} for execution {}", messageType, binding, event.executionId());
            }
            return sent;
        } catch (Exception e) {
            log.error("Exception sending {} to {} for execution {}", messageType, binding, event.executionId(), e);
            return false;
        }
    }
}
