package com.agilab.file_retrieval.domain.repository;

import com.agilab.file_retrieval.domain.entity.DiscoveredFile;
import com.agilab.file_retrieval.domain.model.DiscoveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface DiscoveredFileRepository extends JpaRepository<DiscoveredFile, UUID> {

    boolean existsByConfigurationIdAndDedupKey(UUID configurationId, String dedupKey);

    long countByConfigurationId(UUID configurationId);

    long countByStatus(DiscoveryStatus status);

    List<DiscoveredFile> findByConfigurationIdAndStatusOrderByDiscoveredAtAsc(UUID configurationId, DiscoveryStatus status);

    @Modifying
    @Transactional
    @Query("delete from DiscoveredFile d where d.discoveredAt < :cutoff")
    int deleteDiscoveredBefore(Instant cutoff);
}
