package com.agilab.file_retrieval.protocol.azure;

import com.agilab.file_retrieval.domain.model.AzureBlobSettings;
import com.azure.storage.blob.BlobContainerClient;

@FunctionalInterface
public interface BlobContainerClientProvider {

    /**
     * @param secret resolved connection string or SAS token, {@code null} for managed identity
     */
    BlobContainerClient create(AzureBlobSettings settings, String secret);
}
