package com.agilab.file_retrieval.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.time.Duration;

public record HttpsSettings(String baseUrl,
                            HttpAuthType authenticationType,
                            String usernameOrApiKey,
                            String passwordOrTokenSecret,
                            Duration connectionTimeout,
                            Boolean followRedirects) implements ProtocolSettings {

    public HttpsSettings {
        if (StringUtils.isBlank(baseUrl)) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        if (baseUrl.length() > 500) {
            throw new IllegalArgumentException("Base URL cannot exceed 500 characters");
        }
        var scheme = URI.create(baseUrl).getScheme();
        if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Base URL must be an absolute http(s) URL: " + baseUrl);
        }
        authenticationType = authenticationType == null ? HttpAuthType.NONE : authenticationType;
        if (authenticationType != HttpAuthType.NONE && StringUtils.isBlank(passwordOrTokenSecret)) {
            throw new IllegalArgumentException("A secret is required for " + authenticationType + " authentication");
        }
        if ((authenticationType == HttpAuthType.BASIC || authenticationType == HttpAuthType.API_KEY)
                && StringUtils.isBlank(usernameOrApiKey)) {
            throw new IllegalArgumentException("A username or api key header is required for " + authenticationType + " authentication");
        }
        connectionTimeout = connectionTimeout == null ? DEFAULT_CONNECTION_TIMEOUT : connectionTimeout;
        followRedirects = followRedirects == null || followRedirects;
    }

    @Override
    public ProtocolType protocolType() {
        return ProtocolType.HTTPS;
    }

    @Override
    public String serverAddress() {
        return URI.create(baseUrl).getHost();
    }
}
