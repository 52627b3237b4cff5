package com.agilab.file_retrieval.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;

/**
 * Protocol-specific connection settings. The set of protocols is closed:
 * adding one means adding a permitted subtype and an adapter for it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "protocol")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FtpSettings.class, name = "Ftp"),
        @JsonSubTypes.Type(value = HttpsSettings.class, name = "Https"),
        @JsonSubTypes.Type(value = AzureBlobSettings.class, name = "AzureBlob")
})
public sealed interface ProtocolSettings permits FtpSettings, HttpsSettings, AzureBlobSettings {

    Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);

    @JsonIgnore
    ProtocolType protocolType();

    /**
     * Host part of the remote source, used in logs and never subject to date tokens.
     */
    @JsonIgnore
    String serverAddress();

    Duration connectionTimeout();
}
