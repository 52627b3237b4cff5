package com.agilab.file_retrieval.notification;

public final class NotificationHeaders {
    public static final String MESSAGE_TYPE = "messageType";
    public static final String IDEMPOTENCY_KEY = "idempotencyKey";
    public static final String CORRELATION_ID = "correlationId";

    private NotificationHeaders() {
        throw new UnsupportedOperationException("Utility class");
    }
}
