package com.agilab.file_retrieval;

import com.agilab.file_retrieval.concurrency.InFlightRegistry;
import com.agilab.file_retrieval.config.FileRetrievalProperties;
import com.agilab.file_retrieval.domain.entity.FileRetrievalConfiguration;
import com.agilab.file_retrieval.domain.entity.FileRetrievalExecution;
import com.agilab.file_retrieval.domain.repository.FileRetrievalConfigurationRepository;
import com.agilab.file_retrieval.domain.repository.FileRetrievalExecutionRepository;
import com.agilab.file_retrieval.event.ExecuteFileCheck;
import com.agilab.file_retrieval.event.FileCheckCompleted;
import com.agilab.file_retrieval.event.FileCheckFailed;
import com.agilab.file_retrieval.event.FileCheckTriggered;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.exception.FileCheckExceptionHandler;
import com.agilab.file_retrieval.exception.TransientFileCheckException;
import com.agilab.file_retrieval.ledger.DedupKeys;
import com.agilab.file_retrieval.ledger.DiscoveryLedger;
import com.agilab.file_retrieval.metrics.FileRetrievalMetrics;
import com.agilab.file_retrieval.notification.AuditEventPublisher;
import com.agilab.file_retrieval.notification.NotificationEmitter;
import com.agilab.file_retrieval.protocol.ListingRequest;
import com.agilab.file_retrieval.protocol.ProtocolAdapter;
import com.agilab.file_retrieval.protocol.ProtocolAdapterFactory;
import com.agilab.file_retrieval.protocol.RemoteFile;
import com.agilab.file_retrieval.util.ExecutionMdc;
import com.agilab.file_retrieval.util.ScheduleEvaluator;
import com.agilab.file_retrieval.util.TokenReplacer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one file check: reload the configuration, list the remote source, record new files in
 * the ledger and notify on them, then persist the outcome.
 * <p>
 * Transient listing failures are rethrown and leave the execution {@code RUNNING}; the command is
 * redelivered and a new execution is started. Permanent failures fail the execution.
 */
@Service
@Slf4j
public class ExecutionDispatcher {

    private final FileRetrievalConfigurationRepository configurationRepository;
    private final FileRetrievalExecutionRepository executionRepository;
    private final InFlightRegistry inFlightRegistry;
    private final ProtocolAdapterFactory adapterFactory;
    private final DiscoveryLedger ledger;
    private final NotificationEmitter notificationEmitter;
    private final AuditEventPublisher auditEventPublisher;
    private final FileCheckExceptionHandler exceptionHandler;
    private final AsyncTaskExecutor listingExecutor;
    private final FileRetrievalMetrics metrics;
    private final FileRetrievalProperties properties;
    private final Clock clock;

    public ExecutionDispatcher(FileRetrievalConfigurationRepository configurationRepository,
                               FileRetrievalExecutionRepository executionRepository,
                               InFlightRegistry inFlightRegistry,
                               ProtocolAdapterFactory adapterFactory,
                               DiscoveryLedger ledger,
                               NotificationEmitter notificationEmitter,
                               AuditEventPublisher auditEventPublisher,
                               FileCheckExceptionHandler exceptionHandler,
                               @Qualifier("listingExecutor") AsyncTaskExecutor listingExecutor,
                               FileRetrievalMetrics metrics,
                               FileRetrievalProperties properties,
                               Clock clock) {
        this.configurationRepository = configurationRepository;
        this.executionRepository = executionRepository;
        this.inFlightRegistry = inFlightRegistry;
        this.adapterFactory = adapterFactory;
        this.ledger = ledger;
        this.notificationEmitter = notificationEmitter;
        this.auditEventPublisher = auditEventPublisher;
        this.exceptionHandler = exceptionHandler;
        this.listingExecutor = listingExecutor;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return the execution, or empty when the configuration is gone, inactive or already being checked
     */
    public Optional<FileRetrievalExecution> dispatch(ExecuteFileCheck command) {
        var found = configurationRepository.findByClientIdAndId(command.clientId(), command.configurationId());
        if (found.isEmpty()) {
            log.info("Configuration {} of client {} not found, file check skipped", command.configurationId(), command.clientId());
            return Optional.empty();
        }
        var configuration = found.get();
        if (!configuration.isActive()) {
            log.info("Configuration {} is inactive, file check skipped", configuration.getId());
            return Optional.empty();
        }
        var lease = inFlightRegistry.tryAcquire(configuration.getId());
        if (lease.isEmpty()) {
            log.warn("Configuration {} already has a file check in flight, skipped", configuration.getId());
            return Optional.empty();
        }
        try (var inFlight = lease.get();
             var mdc = ExecutionMdc.open(configuration.getId(), configuration.getClientId())) {
            return Optional.of(execute(configuration, command, mdc));
        }
    }

    private FileRetrievalExecution execute(FileRetrievalConfiguration configuration, ExecuteFileCheck command, ExecutionMdc mdc) {
        var scheduledTime = command.scheduledTime() != null ? command.scheduledTime() : clock.instant();
        var execution = FileRetrievalExecution.start(configuration.getId(), configuration.getClientId(), scheduledTime,
                command.manualTrigger(), command.triggeredBy(), clock.instant());
        mdc.withExecution(execution.getId());
        executionRepository.save(execution);
        auditEventPublisher.publish(new FileCheckTriggered(execution.getId(), configuration.getClientId(), configuration.getId(),
                command.manualTrigger(), command.triggeredBy(), scheduledTime, clock.instant()));
        log.info("File check of '{}' over {} triggered by {} (manual: {})", configuration.getName(),
                configuration.getProtocolType(), command.triggeredBy(), command.manualTrigger());

        List<RemoteFile> files;
        try {
            var zone = ScheduleEvaluator.zone(configuration.getTimezone());
            var request = new ListingRequest(
                    TokenReplacer.replace(configuration.getFilePathPattern(), scheduledTime, zone),
                    TokenReplacer.replace(configuration.getFilenamePattern(), scheduledTime, zone),
                    configuration.getFileExtension());
            execution.resolvePatterns(request.filePathPattern(), request.filenamePattern());
            var unknownTokens = TokenReplacer.invalidTokens(request.filePathPattern() + request.filenamePattern());
            if (!unknownTokens.isEmpty()) {
                log.warn("Unsupported tokens {} left unresolved in the patterns", unknownTokens);
            }
            files = listFiles(adapterFactory.create(configuration.getProtocolSettings()), request);
        } catch (RuntimeException e) {
            var failure = exceptionHandler.classify(e);
            exceptionHandler.logException(failure, configuration.getId());
            var retried = exceptionHandler.isTransient(failure);
            metrics.recordFailure(configuration.getProtocolType(), failure.getErrorCategory(), retried);
            if (retried) {
                throw failure.asRuntimeException();
            }
            execution.fail(failure.getMessage(), failure.getErrorCategory(), clock.instant());
            executionRepository.save(execution);
            auditEventPublisher.publish(new FileCheckFailed(execution.getId(), configuration.getClientId(), configuration.getId(),
                    execution.getFailureReason(), execution.getErrorCategory(), clock.instant()));
            return execution;
        }

        int discovered = 0;
        int dispatched = 0;
        int failedDispatches = 0;
        for (var file : files) {
            var dedupKey = DedupKeys.of(file);
            if (ledger.exists(configuration.getId(), dedupKey)) {
                log.debug("File {} already announced, skipping", file.uri());
                continue;
            }
            var entry = ledger.insert(configuration.getId(), dedupKey, file, execution.getId());
            if (entry.isEmpty()) {
                continue;
            }
            discovered++;
            boolean delivered;
            try {
                delivered = notificationEmitter.emit(configuration, execution.getId(), entry.get());
                if (!delivered) {
                    log.warn("Notifications for {} were not all delivered, the file stays recorded as discovered", file.uri());
                }
            } catch (Exception e) {
                delivered = false;
                log.warn("Error dispatching notifications for {}, the file stays recorded as discovered", file.uri(), e);
            }
            if (delivered) {
                dispatched++;
                ledger.markNotified(entry.get());
            } else {
                failedDispatches++;
            }
        }

        execution.complete(discovered, dispatched, failedDispatches, clock.instant());
        executionRepository.save(execution);
        metrics.recordCompleted(configuration.getProtocolType(), execution.getStatus(),
                Duration.ofMillis(execution.getDurationMs()), discovered, failedDispatches);
        auditEventPublisher.publish(new FileCheckCompleted(execution.getId(), configuration.getClientId(), configuration.getId(),
                execution.getStatus(), discovered, dispatched, execution.getDurationMs(), clock.instant()));
        log.info("File check finished with {}: {} listed, {} new, {} dispatched", execution.getStatus(),
                files.size(), discovered, dispatched);
        return execution;
    }

    private List<RemoteFile> listFiles(ProtocolAdapter adapter, ListingRequest request) {
        var timeout = properties.getListingTimeout();
        Future<List<RemoteFile>> listing = listingExecutor.submit(() -> adapter.listFiles(request));
        try {
            return listing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            listing.cancel(true);
            throw new TransientFileCheckException(ErrorCategory.CONNECTION_TIMEOUT,
                    "Listing did not complete within " + timeout, e);
        } catch (InterruptedException e) {
            listing.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientFileCheckException(ErrorCategory.UNKNOWN_ERROR, "Listing interrupted", e);
        } catch (ExecutionException e) {
            throw exceptionHandler.classify(e.getCause()).asRuntimeException();
        }
    }
}
