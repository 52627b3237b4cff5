package com.agilab.file_retrieval.protocol;

/**
 * What to list, with date tokens already resolved.
 */
public record ListingRequest(String filePathPattern, String filenamePattern, String fileExtension) {
}
