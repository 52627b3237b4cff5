package com.agilab.file_retrieval.domain.model;

/**
 * Delivery state of a ledger entry. An entry stays {@code DISCOVERED} when any of its
 * notifications was not accepted and needs a manual follow-up.
 */
public enum DiscoveryStatus {
    DISCOVERED,
    NOTIFIED
}
