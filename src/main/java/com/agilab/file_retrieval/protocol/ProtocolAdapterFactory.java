package com.agilab.file_retrieval.protocol;

import com.agilab.file_retrieval.domain.model.AzureBlobSettings;
import com.agilab.file_retrieval.domain.model.FtpSettings;
import com.agilab.file_retrieval.domain.model.HttpsSettings;
import com.agilab.file_retrieval.domain.model.ProtocolSettings;
import com.agilab.file_retrieval.protocol.azure.AzureBlobProtocolAdapter;
import com.agilab.file_retrieval.protocol.azure.BlobContainerClientProvider;
import com.agilab.file_retrieval.protocol.ftp.FtpClientProvider;
import com.agilab.file_retrieval.protocol.ftp.FtpProtocolAdapter;
import com.agilab.file_retrieval.protocol.https.HttpsProtocolAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds a fresh adapter for every execution so no connection outlives the run that opened it.
 */
@Component
@RequiredArgsConstructor
public class ProtocolAdapterFactory {

    private final SecretResolver secretResolver;
    private final FtpClientProvider ftpClientProvider;
    private final BlobContainerClientProvider blobContainerClientProvider;
    private final ObjectMapper objectMapper;

    public ProtocolAdapter create(ProtocolSettings settings) {
        return switch (settings.protocolType()) {
            case FTP -> new FtpProtocolAdapter((FtpSettings) settings, secretResolver, ftpClientProvider);
            case HTTPS -> new HttpsProtocolAdapter((HttpsSettings) settings, secretResolver, objectMapper);
            case AZURE_BLOB -> new AzureBlobProtocolAdapter((AzureBlobSettings) settings, secretResolver, blobContainerClientProvider);
        };
    }
}
