package com.agilab.file_retrieval.protocol;

/**
 * Looks up protocol credentials by secret name.
 */
public interface SecretResolver {

    /**
     * @throws com.agilab.file_retrieval.exception.PermanentFileCheckException if the secret is unknown
     */
    String resolve(String secretName);
}
