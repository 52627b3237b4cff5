package com.agilab.file_retrieval;

import com.agilab.file_retrieval.concurrency.ConcurrencyGate;
import com.agilab.file_retrieval.event.ExecuteFileCheck;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.exception.TransientFileCheckException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Holds a gate slot around each dispatch and releases it on every exit path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FileCheckCommandHandler {

    private final ConcurrencyGate gate;
    private final ExecutionDispatcher dispatcher;
    private final RetryTemplate retryTemplate;

    /**
     * Commands from the message bus. Without a free slot the command is rejected as transient
     * so the binder redelivers it; transient dispatch failures propagate the same way.
     */
    public void handle(ExecuteFileCheck command) {
        var permit = gate.tryAcquire().orElseThrow(() -> new TransientFileCheckException(ErrorCategory.CAPACITY_EXCEEDED,
                "All " + gate.capacity() + " execution slots are busy, configuration " + command.configurationId() + " deferred"));
        try (permit) {
            dispatcher.dispatch(command);
        }
    }

    /**
     * Commands from the scheduler, which already holds {@code permit}. Transient failures are
     * retried in process; when retries run out the next due tick tries again.
     */
    public void handle(ExecuteFileCheck command, ConcurrencyGate.Permit permit) {
        try (permit) {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying file check of configuration {} (attempt {})",
                            command.configurationId(), context.getRetryCount() + 1);
                }
                return dispatcher.dispatch(command);
            });
        } catch (TransientFileCheckException e) {
            log.error("[{}] File check of configuration {} still failing after retries: {}",
                    e.getErrorCategory(), command.configurationId(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error checking configuration {}", command.configurationId(), e);
        }
    }
}
