package com.agilab.file_retrieval.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Locale;

public record AzureBlobSettings(String storageAccountName,
                                String containerName,
                                AzureAuthType authenticationType,
                                String connectionStringSecret,
                                String sasTokenSecret,
                                String blobPrefix,
                                String endpoint,
                                Duration connectionTimeout) implements ProtocolSettings {

    public AzureBlobSettings {
        if (StringUtils.isBlank(storageAccountName)) {
            throw new IllegalArgumentException("Storage account name cannot be empty");
        }
        if (storageAccountName.length() > 24) {
            throw new IllegalArgumentException("Storage account name cannot exceed 24 characters");
        }
        if (StringUtils.isBlank(containerName)) {
            throw new IllegalArgumentException("Container name cannot be empty");
        }
        if (containerName.length() > 63) {
            throw new IllegalArgumentException("Container name cannot exceed 63 characters");
        }
        if (!containerName.equals(containerName.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Container name must be lowercase");
        }
        if (blobPrefix != null && blobPrefix.length() > 1024) {
            throw new IllegalArgumentException("Blob prefix cannot exceed 1024 characters");
        }
        authenticationType = authenticationType == null ? AzureAuthType.MANAGED_IDENTITY : authenticationType;
        if (authenticationType == AzureAuthType.CONNECTION_STRING && StringUtils.isBlank(connectionStringSecret)) {
            throw new IllegalArgumentException("Connection string secret is required for CONNECTION_STRING authentication");
        }
        if (authenticationType == AzureAuthType.SAS_TOKEN && StringUtils.isBlank(sasTokenSecret)) {
            throw new IllegalArgumentException("SAS token secret is required for SAS_TOKEN authentication");
        }
        connectionTimeout = connectionTimeout == null ? DEFAULT_CONNECTION_TIMEOUT : connectionTimeout;
    }

    @Override
    public ProtocolType protocolType() {
        return ProtocolType.AZURE_BLOB;
    }

    @Override
    public String serverAddress() {
        return StringUtils.isNotBlank(endpoint) ? endpoint : "https://" + storageAccountName + ".blob.core.windows.net";
    }
}
