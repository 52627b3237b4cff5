package com.agilab.file_retrieval.protocol;

import com.agilab.file_retrieval.config.FileRetrievalProperties;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.exception.PermanentFileCheckException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Resolves secrets from {@code file-retrieval.secrets.*}, which can be fed from environment variables.
 */
@Component
@RequiredArgsConstructor
public class PropertiesSecretResolver implements SecretResolver {

    private final FileRetrievalProperties properties;

    @Override
    public String resolve(String secretName) {
        var value = properties.getSecrets().get(secretName);
        if (StringUtils.isEmpty(value)) {
            throw new PermanentFileCheckException(ErrorCategory.CONFIGURATION_ERROR,
                    "Secret not found: " + secretName);
        }
        return value;
    }
}
