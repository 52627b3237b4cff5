package com.agilab.file_retrieval.domain.model;

public enum HttpAuthType {
    NONE,
    BASIC,
    BEARER_TOKEN,
    API_KEY
}
