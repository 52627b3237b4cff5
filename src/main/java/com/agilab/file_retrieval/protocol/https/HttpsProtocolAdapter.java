package com.agilab.file_retrieval.protocol.https;

import com.agilab.file_retrieval.domain.model.HttpsSettings;
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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Lists files behind an HTTP(S) endpoint. A JSON response is read as a listing; anything else
 * is a single file at the requested URL.
 */
@Slf4j
public class HttpsProtocolAdapter implements ProtocolAdapter {

    static final String API_KEY_HEADER = "X-API-Key";
    private static final TypeReference<List<HttpFileEntry>> LISTING = new TypeReference<>() {
    };

    private final HttpsSettings settings;
    private final SecretResolver secretResolver;
    private final ObjectMapper objectMapper;

    public HttpsProtocolAdapter(HttpsSettings settings, SecretResolver secretResolver, ObjectMapper objectMapper) {
        this.settings = settings;
        this.secretResolver = secretResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProtocolType protocolType() {
        return ProtocolType.HTTPS;
    }

    @Override
    public List<RemoteFile> listFiles(ListingRequest request) {
        var url = RemoteFileFilter.join(settings.baseUrl(), request.filePathPattern());
        log.debug("Listing HTTPS {} pattern {}", url, request.filenamePattern());
        var files = createClient().get()
                .uri(URI.create(url))
                .exchange((clientRequest, response) -> {
                    var status = response.getStatusCode();
                    if (status.isError()) {
                        throw statusFailure(status, url);
                    }
                    var headers = response.getHeaders();
                    if (isJson(headers.getContentType())) {
                        return fromListing(objectMapper.readValue(response.getBody(), LISTING), url, request);
                    }
                    return fromSingleFile(headers, url, request);
                });
        log.info("HTTPS listing of {} returned {} matching files", url, files.size());
        return files;
    }

    private RestClient createClient() {
        var timeout = settings.connectionTimeout();
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(settings.followRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeaders(this::authenticate)
                .build();
    }

    private void authenticate(HttpHeaders headers) {
        switch (settings.authenticationType()) {
            case BASIC -> headers.setBasicAuth(settings.usernameOrApiKey(),
                    secretResolver.resolve(settings.passwordOrTokenSecret()));
            case BEARER_TOKEN -> headers.setBearerAuth(secretResolver.resolve(settings.passwordOrTokenSecret()));
            case API_KEY -> headers.set(StringUtils.defaultIfBlank(settings.usernameOrApiKey(), API_KEY_HEADER),
                    secretResolver.resolve(settings.passwordOrTokenSecret()));
            case NONE -> {
            }
        }
    }

    private List<RemoteFile> fromListing(List<HttpFileEntry> entries, String url, ListingRequest request) {
        List<RemoteFile> files = new ArrayList<>();
        if (entries == null) {
            return files;
        }
        for (var entry : entries) {
            var name = StringUtils.isNotBlank(entry.name()) ? entry.name() : FilenameUtils.getName(entry.url());
            if (StringUtils.isBlank(name) || !RemoteFileFilter.matches(name, request)) {
                continue;
            }
            var fileUrl = StringUtils.isNotBlank(entry.url()) ? entry.url() : RemoteFileFilter.join(url, name);
            files.add(new RemoteFile(name, fileUrl,
                    entry.size() != null && entry.size() > 0 ? entry.size() : null,
                    entry.lastModified(),
                    null,
                    metadata(entry.contentType(), entry.etag())));
        }
        return files;
    }

    private List<RemoteFile> fromSingleFile(HttpHeaders headers, String url, ListingRequest request) {
        var name = FilenameUtils.getName(URI.create(url).getPath());
        if (StringUtils.isBlank(name) || !RemoteFileFilter.matches(name, request)) {
            return List.of();
        }
        var contentType = headers.getContentType();
        var size = headers.getContentLength();
        var lastModified = headers.getLastModified();
        return List.of(new RemoteFile(name, url,
                size >= 0 ? size : null,
                lastModified >= 0 ? Instant.ofEpochMilli(lastModified) : null,
                null,
                metadata(contentType == null ? null : contentType.toString(), headers.getETag())));
    }

    private static LinkedHashMap<String, Object> metadata(String contentType, String etag) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("contentType", StringUtils.defaultIfBlank(contentType, "unknown"));
        metadata.put("etag", StringUtils.defaultString(etag));
        return metadata;
    }

    private static boolean isJson(MediaType contentType) {
        return contentType != null && StringUtils.containsIgnoreCase(contentType.getSubtype(), "json");
    }

    /**
     * 401, 408, 429 and 5xx can clear on a later attempt; any other 4xx will not.
     */
    static RuntimeException statusFailure(HttpStatusCode status, String url) {
        var code = status.value();
        var message = "HTTP " + code + " from " + url;
        FileCheckException failure;
        if (code == 401) {
            failure = new TransientFileCheckException(ErrorCategory.AUTHENTICATION_FAILURE, message);
        } else if (code == 408) {
            failure = new TransientFileCheckException(ErrorCategory.CONNECTION_TIMEOUT, message);
        } else if (code == 429 || status.is5xxServerError()) {
            failure = new TransientFileCheckException(ErrorCategory.PROTOCOL_ERROR, message);
        } else if (code == 403) {
            failure = new PermanentFileCheckException(ErrorCategory.AUTHENTICATION_FAILURE, message);
        } else if (code == 404) {
            failure = new PermanentFileCheckException(ErrorCategory.CONFIGURATION_ERROR, message);
        } else {
            failure = new PermanentFileCheckException(ErrorCategory.PROTOCOL_ERROR, message);
        }
        return failure.asRuntimeException();
    }
}
