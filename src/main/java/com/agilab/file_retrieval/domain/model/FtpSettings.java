package com.agilab.file_retrieval.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;

public record FtpSettings(String server,
                          Integer port,
                          String username,
                          String passwordSecret,
                          Boolean useTls,
                          Boolean passiveMode,
                          Duration connectionTimeout) implements ProtocolSettings {

    public FtpSettings {
        if (StringUtils.isBlank(server)) {
            throw new IllegalArgumentException("FTP server cannot be empty");
        }
        if (server.length() > 255) {
            throw new IllegalArgumentException("FTP server cannot exceed 255 characters");
        }
        if (StringUtils.containsAny(server, '{', '}')) {
            throw new IllegalArgumentException("Date tokens cannot be used in the server name");
        }
        port = port == null ? 21 : port;
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("FTP port must be between 1 and 65535");
        }
        if (StringUtils.isBlank(username)) {
            throw new IllegalArgumentException("FTP username cannot be empty");
        }
        if (StringUtils.isBlank(passwordSecret)) {
            throw new IllegalArgumentException("FTP password secret cannot be empty");
        }
        useTls = useTls == null || useTls;
        passiveMode = passiveMode == null || passiveMode;
        connectionTimeout = connectionTimeout == null ? DEFAULT_CONNECTION_TIMEOUT : connectionTimeout;
        if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            throw new IllegalArgumentException("FTP connection timeout must be positive");
        }
    }

    @Override
    public ProtocolType protocolType() {
        return ProtocolType.FTP;
    }

    @Override
    public String serverAddress() {
        return server + ":" + port;
    }
}
