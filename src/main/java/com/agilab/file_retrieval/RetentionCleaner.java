package com.agilab.file_retrieval;

import com.agilab.file_retrieval.concurrency.InFlightRegistry;
import com.agilab.file_retrieval.config.FileRetrievalProperties;
import com.agilab.file_retrieval.domain.model.ExecutionStatus;
import com.agilab.file_retrieval.domain.repository.FileRetrievalExecutionRepository;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.ledger.DiscoveryLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Housekeeping for the ledger and the execution history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionCleaner {

    private final DiscoveryLedger ledger;
    private final FileRetrievalExecutionRepository executionRepository;
    private final InFlightRegistry inFlightRegistry;
    private final FileRetrievalProperties properties;
    private final Clock clock;

    @Scheduled(fixedRateString = "#{@fileRetrievalProperties.retentionInterval.toMillis()}",
            initialDelayString = "#{@fileRetrievalProperties.retentionInterval.toMillis()}")
    public void pruneExpiredEntries() {
        try {
            var cutoff = clock.instant().minus(properties.getLedgerRetention());
            var pruned = ledger.pruneOlderThan(cutoff);
            log.info("Pruned {} ledger entries discovered before {}", pruned, cutoff);
            var awaiting = ledger.countAwaitingNotification();
            if (awaiting > 0) {
                log.warn("{} ledger entries are still waiting for their notifications to be delivered", awaiting);
            }
        } catch (Exception e) {
            log.error("Error pruning ledger", e);
        }
    }

    /**
     * A transient failure leaves its execution {@code RUNNING} while the command is retried
     * under a new execution. Once such a row is older than the in-flight lease and its
     * configuration is idle, it is closed as abandoned.
     */
    @Scheduled(fixedRateString = "#{@fileRetrievalProperties.inFlightTtl.toMillis()}",
            initialDelayString = "#{@fileRetrievalProperties.inFlightTtl.toMillis()}")
    public void abandonStaleExecutions() {
        try {
            var now = clock.instant();
            var stale = executionRepository.findByStatusAndStartedAtBefore(ExecutionStatus.RUNNING,
                    now.minus(properties.getInFlightTtl()));
            int abandoned = 0;
            for (var execution : stale) {
                if (inFlightRegistry.isInFlight(execution.getConfigurationId())) {
                    continue;
                }
                execution.fail("No outcome recorded within " + properties.getInFlightTtl() + ", attempt abandoned",
                        ErrorCategory.ABANDONED, now);
                executionRepository.save(execution);
                abandoned++;
            }
            if (abandoned > 0) {
                log.info("Marked {} stale executions as abandoned", abandoned);
            }
        } catch (Exception e) {
            log.error("Error closing stale executions", e);
        }
    }
}
