package com.agilab.file_retrieval.protocol.https;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One element of a JSON directory listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpFileEntry(String name,
                            String url,
                            Long size,
                            Instant lastModified,
                            String contentType,
                            String etag) {
}
