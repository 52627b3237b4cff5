package com.agilab.file_retrieval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "file-retrieval")
@Data
@Component
public class FileRetrievalProperties {
    private Duration tickInterval = Duration.ofSeconds(60);
    private Duration executionWindow = Duration.ofMinutes(2); // must exceed tickInterval or due minutes get skipped
    private int maxConcurrentExecutions = 100;
    private Duration listingTimeout = Duration.ofMinutes(2);
    private Duration inFlightTtl = Duration.ofMinutes(15);
    private int retryAttempts = 3;
    private Duration retryDelay = Duration.ofSeconds(2);
    private Duration ledgerRetention = Duration.ofDays(90);
    private Duration retentionInterval = Duration.ofHours(6);
    private Messaging messaging = new Messaging();
    private Map<String, String> secrets = new HashMap<>();

    @Data
    public static class Messaging {
        private String auditBinding = "fileCheckAudit-out-0";
        private String eventBinding = "fileDiscovered-out-0";
    }
}
