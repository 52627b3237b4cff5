package com.agilab.file_retrieval.ledger;

import com.agilab.file_retrieval.protocol.RemoteFile;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identity of a remote file for ledger lookups: the content hash when the source reports one,
 * otherwise uri, size and last-modified time. A file rewritten in place gets a new key.
 */
public final class DedupKeys {

    private DedupKeys() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String of(RemoteFile file) {
        var identity = StringUtils.isNotBlank(file.contentHash())
                ? file.uri() + "|hash:" + file.contentHash()
                : file.uri() + "|" + file.size() + "|" + (file.lastModified() == null ? "" : file.lastModified().toEpochMilli());
        return sha256(identity);
    }

    private static String sha256(String value) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
