package com.agilab.file_retrieval.domain.entity;

import com.agilab.file_retrieval.domain.model.ExecutionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One dispatch attempt against a configuration. Mutable while {@link ExecutionStatus#RUNNING},
 * frozen once it reaches a terminal status.
 */
@Entity
@Table(name = "file_retrieval_executions", indexes = {
        @Index(name = "idx_executions_configuration", columnList = "configuration_id, started_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FileRetrievalExecution {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "configuration_id", nullable = false)
    private UUID configurationId;

    @Column(name = "client_id", nullable = false, length = 100)
    private String clientId;

    @Column(name = "scheduled_time", nullable = false)
    private Instant scheduledTime;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ExecutionStatus status;

    @Column(name = "discovered_count", nullable = false)
    private int discoveredCount;

    @Column(name = "dispatched_count", nullable = false)
    private int dispatchedCount;

    @Column(name = "failure_reason", length = 2000)
    private String failureReason;

    @Column(name = "error_category", length = 64)
    private String errorCategory;

    @Column(name = "manual_trigger", nullable = false)
    private boolean manualTrigger;

    @Column(name = "triggered_by", nullable = false, length = 100)
    private String triggeredBy;

    @Column(name = "resolved_file_path_pattern", length = 1024)
    private String resolvedFilePathPattern;

    @Column(name = "resolved_filename_pattern", length = 255)
    private String resolvedFilenamePattern;

    @Column(name = "duration_ms")
    private Long durationMs;

    public static FileRetrievalExecution start(UUID configurationId,
                                               String clientId,
                                               Instant scheduledTime,
                                               boolean manualTrigger,
                                               String triggeredBy,
                                               Instant startedAt) {
        var execution = new FileRetrievalExecution();
        execution.id = UUID.randomUUID();
        execution.configurationId = configurationId;
        execution.clientId = clientId;
        execution.scheduledTime = scheduledTime;
        execution.manualTrigger = manualTrigger;
        execution.triggeredBy = triggeredBy;
        execution.startedAt = startedAt;
        execution.status = ExecutionStatus.RUNNING;
        return execution;
    }

    public void resolvePatterns(String filePathPattern, String filenamePattern) {
        ensureRunning();
        this.resolvedFilePathPattern = filePathPattern;
        this.resolvedFilenamePattern = filenamePattern;
    }

    /**
     * Records the outcome of a listing that completed. Any failed per-file dispatch
     * makes the run {@link ExecutionStatus#COMPLETED_WITH_ERRORS}.
     */
    public void complete(int discovered, int dispatched, int failedDispatches, Instant completedAt) {
        ensureRunning();
        this.discoveredCount = discovered;
        this.dispatchedCount = dispatched;
        this.status = failedDispatches > 0 ? ExecutionStatus.COMPLETED_WITH_ERRORS : ExecutionStatus.COMPLETED;
        finish(completedAt);
    }

    public void fail(String reason, String errorCategory, Instant completedAt) {
        ensureRunning();
        this.failureReason = reason;
        this.errorCategory = errorCategory;
        this.status = ExecutionStatus.FAILED;
        finish(completedAt);
    }

    private void finish(Instant completedAt) {
        this.completedAt = completedAt;
        this.durationMs = Duration.between(startedAt, completedAt).toMillis();
    }

    private void ensureRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " is already " + status);
        }
    }
}
