package com.agilab.file_retrieval.metrics;

import com.agilab.file_retrieval.concurrency.ConcurrencyGate;
import com.agilab.file_retrieval.domain.model.ExecutionStatus;
import com.agilab.file_retrieval.domain.model.ProtocolType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Meters for file checks. Every meter carries a {@code protocol} tag so dashboards can split
 * Azure Blob, FTP and HTTPS sources.
 */
@Component
public class FileRetrievalMetrics {

    static final String CHECKS = "file_retrieval_checks";
    static final String CHECK_DURATION = "file_retrieval_check_duration";
    static final String FILES_DISCOVERED = "file_retrieval_files_discovered";
    static final String NOTIFICATION_FAILURES = "file_retrieval_notification_failures";
    static final String CHECK_FAILURES = "file_retrieval_check_failures";
    static final String GATE_IN_USE = "file_retrieval_gate_in_use";
    static final String GATE_CAPACITY = "file_retrieval_gate_capacity";

    private final MeterRegistry registry;

    public FileRetrievalMetrics(MeterRegistry registry, ConcurrencyGate gate) {
        this.registry = registry;
        Gauge.builder(GATE_IN_USE, gate, ConcurrencyGate::inUse)
                .description("Executions currently holding a concurrency gate permit")
                .register(registry);
        Gauge.builder(GATE_CAPACITY, gate, ConcurrencyGate::capacity)
                .description("Maximum number of simultaneous executions")
                .register(registry);
    }

    public void recordCompleted(ProtocolType protocol, ExecutionStatus status, Duration duration,
                                int discovered, int failedNotifications) {
        Counter.builder(CHECKS)
                .description("Finished file checks")
                .tag("protocol", protocol.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
        Timer.builder(CHECK_DURATION)
                .description("Wall time of a file check")
                .tag("protocol", protocol.name())
                .register(registry)
                .record(duration);
        if (discovered > 0) {
            Counter.builder(FILES_DISCOVERED)
                    .description("Files recorded in the discovery ledger")
                    .tag("protocol", protocol.name())
                    .register(registry)
                    .increment(discovered);
        }
        if (failedNotifications > 0) {
            Counter.builder(NOTIFICATION_FAILURES)
                    .description("Discovered files whose notifications were not all accepted")
                    .tag("protocol", protocol.name())
                    .register(registry)
                    .increment(failedNotifications);
        }
    }

    /**
     * @param errorCategory one of the {@link com.agilab.file_retrieval.exception.ErrorCategory} values
     * @param retried true when the failure is transient and the command goes back for redelivery
     */
    public void recordFailure(ProtocolType protocol, String errorCategory, boolean retried) {
        Counter.builder(CHECK_FAILURES)
                .description("File checks that ended in a listing failure")
                .tag("protocol", protocol.name())
                .tag("category", errorCategory)
                .tag("retried", Boolean.toString(retried))
                .register(registry)
                .increment();
    }
}
