package com.agilab.file_retrieval.domain.entity;

import com.agilab.file_retrieval.domain.model.CommandDefinition;
import com.agilab.file_retrieval.domain.model.EventDefinition;
import com.agilab.file_retrieval.domain.model.ProtocolSettings;
import com.agilab.file_retrieval.domain.model.ProtocolType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Tenant-owned definition of what to poll, how, when, and whom to notify.
 * Maintained by the configuration management service; this service only reads it.
 */
@Entity
@Table(name = "file_retrieval_configurations", indexes = {
        @Index(name = "idx_configurations_active", columnList = "active")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRetrievalConfiguration {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "client_id", nullable = false, length = 100)
    private String clientId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Convert(converter = JsonColumnConverters.ProtocolSettingsConverter.class)
    @Column(name = "protocol_settings", nullable = false, length = 4000)
    private ProtocolSettings protocolSettings;

    @Column(name = "file_path_pattern", nullable = false, length = 1024)
    private String filePathPattern;

    @Column(name = "filename_pattern", length = 255)
    private String filenamePattern;

    @Column(name = "file_extension", length = 20)
    private String fileExtension;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Builder.Default
    @Convert(converter = JsonColumnConverters.EventDefinitionsConverter.class)
    @Column(name = "event_definitions", length = 20000)
    private List<EventDefinition> eventDefinitions = new ArrayList<>();

    @Builder.Default
    @Convert(converter = JsonColumnConverters.CommandDefinitionsConverter.class)
    @Column(name = "command_definitions", length = 20000)
    private List<CommandDefinition> commandDefinitions = new ArrayList<>();

    @Column(name = "last_modified_by", length = 100)
    private String lastModifiedBy;

    @Version
    @Column(name = "version")
    private Long version;

    public ProtocolType getProtocolType() {
        return protocolSettings.protocolType();
    }
}
