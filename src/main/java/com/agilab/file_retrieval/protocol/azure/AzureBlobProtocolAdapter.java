package com.agilab.file_retrieval.protocol.azure;

import com.agilab.file_retrieval.domain.model.AzureAuthType;
import com.agilab.file_retrieval.domain.model.AzureBlobSettings;
import com.agilab.file_retrieval.domain.model.ProtocolType;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.exception.FileCheckException;
import com.agilab.file_retrieval.exception.PermanentFileCheckException;
import com.agilab.file_retrieval.exception.TransientFileCheckException;
import com.agilab.file_retrieval.protocol.ListingRequest;
import com.agilab.file_retrieval.protocol.ProtocolAdapter;
import com.agilab.file_retrieval.protocol.RemoteFile;
import com.agilab.file_retrieval.protocol.RemoteFileFilter;
import com.agilab.file_retrieval.protocol.SecretResolver;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.ListBlobsOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Lists blobs under the configured prefix combined with the path pattern. Listing is flat,
 * the filename pattern is matched against the last path segment of each blob name.
 */
@Slf4j
public class AzureBlobProtocolAdapter implements ProtocolAdapter {

    private final AzureBlobSettings settings;
    private final SecretResolver secretResolver;
    private final BlobContainerClientProvider clientProvider;

    public AzureBlobProtocolAdapter(AzureBlobSettings settings,
                                    SecretResolver secretResolver,
                                    BlobContainerClientProvider clientProvider) {
        this.settings = settings;
        this.secretResolver = secretResolver;
        this.clientProvider = clientProvider;
    }

    @Override
    public ProtocolType protocolType() {
        return ProtocolType.AZURE_BLOB;
    }

    @Override
    public List<RemoteFile> listFiles(ListingRequest request) {
        var prefix = searchPrefix(settings.blobPrefix(), request.filePathPattern());
        log.debug("Listing container {} on {} with prefix '{}'", settings.containerName(), settings.serverAddress(), prefix);
        var container = clientProvider.create(settings, resolveSecret());
        var options = new ListBlobsOptions().setPrefix(StringUtils.defaultIfEmpty(prefix, null));
        try {
            var files = new ArrayList<RemoteFile>();
            for (var blob : container.listBlobs(options, settings.connectionTimeout())) {
                if (Boolean.TRUE.equals(blob.isPrefix()) || Boolean.TRUE.equals(blob.isDeleted())) {
                    continue;
                }
                var fileName = FilenameUtils.getName(blob.getName());
                if (!RemoteFileFilter.matches(fileName, request)) {
                    continue;
                }
                files.add(toRemoteFile(container, blob, fileName));
            }
            log.info("Blob listing of {}/{} returned {} matching files", settings.containerName(), prefix, files.size());
            return files;
        } catch (BlobStorageException e) {
            throw classify(e).asRuntimeException();
        } catch (IllegalStateException e) {
            // the SDK reports a blocking-read timeout this way
            if (ExceptionUtils.indexOfThrowable(e, TimeoutException.class) >= 0 || StringUtils.containsIgnoreCase(e.getMessage(), "timeout")) {
                throw new TransientFileCheckException(ErrorCategory.CONNECTION_TIMEOUT,
                        "Listing container " + settings.containerName() + " timed out", e);
            }
            throw e;
        }
    }

    private String resolveSecret() {
        if (settings.authenticationType() == AzureAuthType.CONNECTION_STRING) {
            return secretResolver.resolve(settings.connectionStringSecret());
        }
        if (settings.authenticationType() == AzureAuthType.SAS_TOKEN) {
            return secretResolver.resolve(settings.sasTokenSecret());
        }
        return null;
    }

    private RemoteFile toRemoteFile(BlobContainerClient container, BlobItem blob, String fileName) {
        var properties = blob.getProperties();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("blobName", blob.getName());
        metadata.put("container", settings.containerName());
        String contentHash = null;
        Long size = null;
        Instant lastModified = null;
        if (properties != null) {
            size = properties.getContentLength();
            lastModified = properties.getLastModified() == null ? null : properties.getLastModified().toInstant();
            if (properties.getContentMd5() != null) {
                contentHash = Base64.getEncoder().encodeToString(properties.getContentMd5());
                metadata.put("contentMd5", contentHash);
            }
            if (properties.getContentType() != null) {
                metadata.put("contentType", properties.getContentType());
            }
            if (properties.getETag() != null) {
                metadata.put("etag", properties.getETag());
            }
        }
        var uri = RemoteFileFilter.join(container.getBlobContainerUrl(), blob.getName());
        return new RemoteFile(fileName, uri, size, lastModified, contentHash, metadata);
    }

    /**
     * 401/403 and 404 will not fix themselves; throttling and server errors may.
     */
    static FileCheckException classify(BlobStorageException e) {
        var status = e.getStatusCode();
        var message = "Blob storage returned " + status + ": " + e.getMessage();
        if (status == 401 || status == 403) {
            return new PermanentFileCheckException(ErrorCategory.AUTHENTICATION_FAILURE, message, e);
        }
        if (status == 404) {
            return new PermanentFileCheckException(ErrorCategory.CONFIGURATION_ERROR, message, e);
        }
        if (status == 408) {
            return new TransientFileCheckException(ErrorCategory.CONNECTION_TIMEOUT, message, e);
        }
        if (status == 429 || status >= 500) {
            return new TransientFileCheckException(ErrorCategory.PROTOCOL_ERROR, message, e);
        }
        return new PermanentFileCheckException(ErrorCategory.PROTOCOL_ERROR, message, e);
    }

    static String searchPrefix(String blobPrefix, String filePathPattern) {
        var parts = new ArrayList<String>();
        for (var part : new String[]{blobPrefix, filePathPattern}) {
            var trimmed = StringUtils.strip(part, "/");
            if (StringUtils.isNotBlank(trimmed)) {
                parts.add(trimmed);
            }
        }
        return parts.isEmpty() ? "" : String.join("/", parts) + "/";
    }
}
