package com.agilab.file_retrieval.domain.entity;

import jakarta.persistence.Column;
import com.agilab.file_retrieval.domain.model.DiscoveryStatus;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry for a remote file that has been discovered. Only the delivery state changes after insert.
 * The unique (configuration_id, dedup_key) constraint is what stops a file being announced twice.
 */
@Entity
@Table(name = "discovered_files",
        uniqueConstraints = @UniqueConstraint(name = "uk_discovered_files_configuration_dedup_key",
                columnNames = {"configuration_id", "dedup_key"}),
        indexes = {
                @Index(name = "idx_discovered_files_execution", columnList = "execution_id"),
                @Index(name = "idx_discovered_files_discovered_at", columnList = "discovered_at"),
                @Index(name = "idx_discovered_files_status", columnList = "status")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredFile {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "configuration_id", nullable = false)
    private UUID configurationId;

    @Column(name = "dedup_key", nullable = false, length = 64)
    private String dedupKey;

    @Column(name = "file_uri", nullable = false, length = 2048)
    private String fileUri;

    @Column(name = "file_name", length = 512)
    private String fileName;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "last_modified")
    private Instant lastModified;

    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DiscoveryStatus status = DiscoveryStatus.DISCOVERED;

    @Column(name = "notified_at")
    private Instant notifiedAt;

    public void markNotified(Instant notifiedAt) {
        this.status = DiscoveryStatus.NOTIFIED;
        this.notifiedAt = notifiedAt;
    }
}
