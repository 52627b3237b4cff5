package com.agilab.file_retrieval.protocol;

import java.time.Instant;
import java.util.Map;

public record RemoteFile(String name,
                         String uri,
                         Long size,
                         Instant lastModified,
                         String contentHash,
                         Map<String, Object> protocolMetadata) {

    public RemoteFile {
        protocolMetadata = protocolMetadata == null ? Map.of() : Map.copyOf(protocolMetadata);
    }
}
