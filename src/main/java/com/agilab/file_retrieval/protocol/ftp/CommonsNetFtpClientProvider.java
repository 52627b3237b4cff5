package com.agilab.file_retrieval.protocol.ftp;

import com.agilab.file_retrieval.domain.model.FtpSettings;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPSClient;
import org.springframework.stereotype.Component;

@Component
public class CommonsNetFtpClientProvider implements FtpClientProvider {

    @Override
    public FTPClient create(FtpSettings settings) {
        // explicit FTPS: plain connect followed by AUTH TLS
        var client = settings.useTls() ? new FTPSClient("TLS", false) : new FTPClient();
        var timeout = settings.connectionTimeout();
        client.setConnectTimeout((int) timeout.toMillis());
        client.setDefaultTimeout((int) timeout.toMillis());
        client.setDataTimeout(timeout);
        return client;
    }
}
