package com.agilab.file_retrieval.domain.model;

public enum AzureAuthType {
    CONNECTION_STRING,
    SAS_TOKEN,
    MANAGED_IDENTITY
}
