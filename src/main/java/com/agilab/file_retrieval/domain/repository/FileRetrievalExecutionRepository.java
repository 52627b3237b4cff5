package com.agilab.file_retrieval.domain.repository;

import com.agilab.file_retrieval.domain.entity.FileRetrievalExecution;
import com.agilab.file_retrieval.domain.model.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface FileRetrievalExecutionRepository extends JpaRepository<FileRetrievalExecution, UUID> {

    List<FileRetrievalExecution> findByConfigurationIdOrderByStartedAtAsc(UUID configurationId);

    List<FileRetrievalExecution> findByStatusAndStartedAtBefore(ExecutionStatus status, Instant cutoff);
}
