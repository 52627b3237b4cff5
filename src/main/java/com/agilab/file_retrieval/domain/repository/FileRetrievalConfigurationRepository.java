package com.agilab.file_retrieval.domain.repository;

import com.agilab.file_retrieval.domain.entity.FileRetrievalConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the configurations owned by configuration management.
 */
@Repository
public interface FileRetrievalConfigurationRepository extends JpaRepository<FileRetrievalConfiguration, UUID> {

    /**
     * Ids only, so that one row whose settings no longer parse cannot fail the whole listing.
     */
    @Query("select c.id from FileRetrievalConfiguration c where c.active = true")
    List<UUID> findActiveIds();

    Optional<FileRetrievalConfiguration> findByClientIdAndId(String clientId, UUID id);
}
