package com.agilab.file_retrieval.protocol.ftp;

import com.agilab.file_retrieval.domain.model.FtpSettings;
import org.apache.commons.net.ftp.FTPClient;

/**
 * Creates an unconnected client for one listing.
 */
@FunctionalInterface
public interface FtpClientProvider {

    FTPClient create(FtpSettings settings);
}
