package com.agilab.file_retrieval.exception;

public final class ErrorCategory {
    public static final String AUTHENTICATION_FAILURE = "AuthenticationFailure";
    public static final String CONNECTION_TIMEOUT = "ConnectionTimeout";
    public static final String PROTOCOL_ERROR = "ProtocolError";
    public static final String CONFIGURATION_ERROR = "ConfigurationError";
    public static final String CAPACITY_EXCEEDED = "CapacityExceeded";
    public static final String UNKNOWN_ERROR = "UnknownError";
    public static final String ABANDONED = "Abandoned";

    private ErrorCategory() {
        throw new UnsupportedOperationException("Utility class");
    }
}
