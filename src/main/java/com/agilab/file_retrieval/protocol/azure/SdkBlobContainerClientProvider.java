package com.agilab.file_retrieval.protocol.azure;

import com.agilab.file_retrieval.domain.model.AzureBlobSettings;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
import org.springframework.stereotype.Component;

@Component
public class SdkBlobContainerClientProvider implements BlobContainerClientProvider {

    @Override
    public BlobContainerClient create(AzureBlobSettings settings, String secret) {
        // single attempt, retries come from command redelivery
        var builder = new BlobContainerClientBuilder()
                .containerName(settings.containerName())
                .retryOptions(new RequestRetryOptions(RetryPolicyType.FIXED, 1,
                        (int) Math.max(1, settings.connectionTimeout().toSeconds()), null, null, null));
        switch (settings.authenticationType()) {
            case CONNECTION_STRING -> builder.connectionString(secret);
            case SAS_TOKEN -> builder.endpoint(settings.serverAddress()).sasToken(secret);
            case MANAGED_IDENTITY -> builder.endpoint(settings.serverAddress())
                    .credential(new DefaultAzureCredentialBuilder().build());
        }
        return builder.buildClient();
    }
}
