package com.agilab.file_retrieval.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Puts the identifiers of the running execution into the MDC and restores the previous values on close.
 */
public final class ExecutionMdc implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String CONFIGURATION_ID = "configurationId";
    public static final String CLIENT_ID = "clientId";

    private final String previousExecutionId;
    private final String previousConfigurationId;
    private final String previousClientId;

    private ExecutionMdc(UUID configurationId, String clientId) {
        this.previousExecutionId = MDC.get(EXECUTION_ID);
        this.previousConfigurationId = MDC.get(CONFIGURATION_ID);
        this.previousClientId = MDC.get(CLIENT_ID);
        put(CONFIGURATION_ID, configurationId == null ? null : configurationId.toString());
        put(CLIENT_ID, clientId);
        MDC.remove(EXECUTION_ID);
    }

    public static ExecutionMdc open(UUID configurationId, String clientId) {
        return new ExecutionMdc(configurationId, clientId);
    }

    public ExecutionMdc withExecution(UUID executionId) {
        put(EXECUTION_ID, executionId.toString());
        return this;
    }

    @Override
    public void close() {
        put(EXECUTION_ID, previousExecutionId);
        put(CONFIGURATION_ID, previousConfigurationId);
        put(CLIENT_ID, previousClientId);
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
