package com.agilab.file_retrieval.ledger;

import com.agilab.file_retrieval.domain.entity.DiscoveredFile;
import com.agilab.file_retrieval.domain.model.DiscoveryStatus;
import com.agilab.file_retrieval.domain.repository.DiscoveredFileRepository;
import com.agilab.file_retrieval.protocol.RemoteFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Record of files already announced per configuration. The insert is the commit point:
 * once it succeeds the file is never announced again, whatever happens to its notifications.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscoveryLedger {

    private final DiscoveredFileRepository repository;
    private final Clock clock;

    public boolean exists(UUID configurationId, String dedupKey) {
        return repository.existsByConfigurationIdAndDedupKey(configurationId, dedupKey);
    }

    /**
     * @return the new entry, or empty when the key was already recorded for this configuration
     */
    public Optional<DiscoveredFile> insert(UUID configurationId, String dedupKey, RemoteFile file, UUID executionId) {
        var entry = DiscoveredFile.builder()
                .id(UUID.randomUUID())
                .configurationId(configurationId)
                .dedupKey(dedupKey)
                .fileUri(file.uri())
                .fileName(file.name())
                .fileSize(file.size())
                .lastModified(file.lastModified())
                .discoveredAt(clock.instant())
                .executionId(executionId)
                .build();
        try {
            return Optional.of(repository.saveAndFlush(entry));
        } catch (DataIntegrityViolationException e) {
            log.debug("Ledger already holds {} for configuration {}", file.uri(), configurationId);
            return Optional.empty();
        }
    }

    /**
     * Records that every notification of {@code entry} was delivered. A failed update only
     * leaves the entry looking undelivered, so it is logged rather than propagated.
     *
     * @return false when the update could not be stored
     */
    public boolean markNotified(DiscoveredFile entry) {
        entry.markNotified(clock.instant());
        try {
            repository.save(entry);
            return true;
        } catch (DataAccessException e) {
            log.warn("Could not mark {} as notified, it stays listed as awaiting notification", entry.getFileUri(), e);
            return false;
        }
    }

    public List<DiscoveredFile> awaitingNotification(UUID configurationId) {
        return repository.findByConfigurationIdAndStatusOrderByDiscoveredAtAsc(configurationId, DiscoveryStatus.DISCOVERED);
    }

    public long countAwaitingNotification() {
        return repository.countByStatus(DiscoveryStatus.DISCOVERED);
    }

    public int pruneOlderThan(Instant cutoff) {
        return repository.deleteDiscoveredBefore(cutoff);
    }
}
