package com.agilab.file_retrieval.protocol.ftp;

import com.agilab.file_retrieval.domain.model.FtpSettings;
import com.agilab.file_retrieval.domain.model.ProtocolType;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.exception.PermanentFileCheckException;
import com.agilab.file_retrieval.exception.TransientFileCheckException;
import com.agilab.file_retrieval.protocol.ListingRequest;
import com.agilab.file_retrieval.protocol.ProtocolAdapter;
import com.agilab.file_retrieval.protocol.RemoteFile;
import com.agilab.file_retrieval.protocol.RemoteFileFilter;
import com.agilab.file_retrieval.protocol.SecretResolver;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * FTP and explicit FTPS listing over Apache Commons Net.
 */
@Slf4j
public class FtpProtocolAdapter implements ProtocolAdapter {

    private final FtpSettings settings;
    private final SecretResolver secretResolver;
    private final FtpClientProvider clientProvider;

    public FtpProtocolAdapter(FtpSettings settings, SecretResolver secretResolver, FtpClientProvider clientProvider) {
        this.settings = settings;
        this.secretResolver = secretResolver;
        this.clientProvider = clientProvider;
    }

    @Override
    public ProtocolType protocolType() {
        return ProtocolType.FTP;
    }

    @Override
    public List<RemoteFile> listFiles(ListingRequest request) {
        var password = secretResolver.resolve(settings.passwordSecret());
        var path = StringUtils.defaultIfBlank(request.filePathPattern(), "/");
        log.debug("Listing FTP {} path {} pattern {}", settings.serverAddress(), path, request.filenamePattern());

        var client = clientProvider.create(settings);
        try {
            connectAndLogin(client, password);
            var entries = client.listFiles(path);
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw new PermanentFileCheckException(ErrorCategory.PROTOCOL_ERROR,
                        "FTP listing of " + path + " failed: " + StringUtils.trim(client.getReplyString()));
            }
            var files = new ArrayList<RemoteFile>();
            for (var entry : entries) {
                if (entry == null || !entry.isFile() || !RemoteFileFilter.matches(entry.getName(), request)) {
                    continue;
                }
                files.add(toRemoteFile(path, entry));
            }
            log.info("FTP listing of {}{} returned {} matching files", settings.serverAddress(), path, files.size());
            return files;
        } catch (IOException e) {
            throw new UncheckedIOException("FTP listing failed on " + settings.serverAddress(), e);
        } finally {
            disconnect(client);
        }
    }

    private void connectAndLogin(FTPClient client, String password) throws IOException {
        client.connect(settings.server(), settings.port());
        if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
            throw new TransientFileCheckException(ErrorCategory.PROTOCOL_ERROR,
                    "FTP server " + settings.serverAddress() + " refused connection: " + StringUtils.trim(client.getReplyString()));
        }
        client.setSoTimeout((int) settings.connectionTimeout().toMillis());
        if (!client.login(settings.username(), password)) {
            throw new PermanentFileCheckException(ErrorCategory.AUTHENTICATION_FAILURE,
                    "FTP login rejected for user " + settings.username() + " on " + settings.serverAddress());
        }
        if (client instanceof FTPSClient ftpsClient) {
            ftpsClient.execPBSZ(0);
            ftpsClient.execPROT("P");
        }
        if (settings.passiveMode()) {
            client.enterLocalPassiveMode();
        }
    }

    private RemoteFile toRemoteFile(String path, FTPFile entry) {
        var fullPath = RemoteFileFilter.join(path, entry.getName());
        var uri = RemoteFileFilter.join("ftp://" + settings.serverAddress(), fullPath);
        var timestamp = entry.getTimestamp();
        return new RemoteFile(
                entry.getName(),
                uri,
                entry.getSize() >= 0 ? entry.getSize() : null,
                timestamp == null ? null : timestamp.toInstant(),
                null,
                Map.of("ftpType", "File", "rawListing", StringUtils.defaultString(entry.getRawListing())));
    }

    private void disconnect(FTPClient client) {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.logout();
        } catch (IOException e) {
            log.debug("FTP logout from {} failed: {}", settings.serverAddress(), e.getMessage());
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            log.warn("FTP disconnect from {} failed: {}", settings.serverAddress(), e.getMessage());
        }
    }
}
