package com.agilab.file_retrieval.domain.model;

public enum ProtocolType {
    FTP,
    HTTPS,
    AZURE_BLOB
}
