package com.agilab.file_retrieval.protocol;

import com.agilab.file_retrieval.domain.model.ProtocolType;

import java.util.List;

/**
 * Lists the files of one remote source. Implementations open their own connection per call,
 * release it before returning, and never share it with another configuration.
 */
public interface ProtocolAdapter {

    ProtocolType protocolType();

    /**
     * @throws com.agilab.file_retrieval.exception.TransientFileCheckException when a later retry may succeed
     * @throws com.agilab.file_retrieval.exception.PermanentFileCheckException when it will not
     */
    List<RemoteFile> listFiles(ListingRequest request);
}
