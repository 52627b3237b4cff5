package com.agilab.file_retrieval.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw exceptions escaping a protocol adapter onto the {@link FileCheckException} hierarchy.
 */
@Slf4j
@Component
public class FileCheckExceptionHandler {

    /**
     * Looks through the whole cause chain, since client SDKs wrap socket failures in their own runtime exceptions.
     */
    public FileCheckException classify(Throwable throwable) {
        var chain = ExceptionUtils.getThrowableList(throwable);
        for (var cause : chain) {
            if (cause instanceof FileCheckException fileCheckException) {
                return fileCheckException;
            }
        }
        var timeout = firstOf(chain, SocketTimeoutException.class, HttpTimeoutException.class, TimeoutException.class);
        if (timeout != null) {
            return new TransientFileCheckException(ErrorCategory.CONNECTION_TIMEOUT, describe(timeout), throwable);
        }
        var unknownHost = firstOf(chain, UnknownHostException.class);
        if (unknownHost != null) {
            return new PermanentFileCheckException(ErrorCategory.CONFIGURATION_ERROR, describe(unknownHost), throwable);
        }
        var malformed = firstOf(chain, JsonProcessingException.class);
        if (malformed != null) {
            return new PermanentFileCheckException(ErrorCategory.PROTOCOL_ERROR, describe(malformed), throwable);
        }
        var io = firstOf(chain, IOException.class);
        if (io != null) {
            return new TransientFileCheckException(ErrorCategory.PROTOCOL_ERROR, describe(io), throwable);
        }
        if (throwable instanceof IllegalArgumentException) {
            return new PermanentFileCheckException(ErrorCategory.CONFIGURATION_ERROR, describe(throwable), throwable);
        }
        return new PermanentFileCheckException(ErrorCategory.UNKNOWN_ERROR, describe(throwable), throwable);
    }

    @SafeVarargs
    private static Throwable firstOf(List<Throwable> chain, Class<? extends Throwable>... types) {
        for (var cause : chain) {
            for (var type : types) {
                if (type.isInstance(cause)) {
                    return cause;
                }
            }
        }
        return null;
    }

    public boolean isTransient(FileCheckException exception) {
        return exception instanceof TransientFileCheckException;
    }

    public void logException(FileCheckException exception, Object configurationId) {
        if (exception instanceof TransientFileCheckException) {
            log.warn("[{}] Transient failure checking configuration {}, command will be redelivered: {}",
                    exception.getErrorCategory(), configurationId, exception.getMessage());
        } else {
            log.error("[{}] Permanent failure checking configuration {}: {}",
                    exception.getErrorCategory(), configurationId, exception.getMessage());
        }
    }

    private static String describe(Throwable throwable) {
        var message = throwable.getMessage();
        return message == null ? throwable.getClass().getSimpleName() : message;
    }
}
