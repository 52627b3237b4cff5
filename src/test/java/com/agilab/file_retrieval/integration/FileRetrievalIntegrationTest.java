package com.agilab.file_retrieval.integration;

import com.agilab.file_retrieval.CronScheduler;
import com.agilab.file_retrieval.ExecutionDispatcher;
import com.agilab.file_retrieval.domain.entity.FileRetrievalConfiguration;
import com.agilab.file_retrieval.domain.entity.DiscoveredFile;
import com.agilab.file_retrieval.domain.model.DiscoveryStatus;
import com.agilab.file_retrieval.domain.model.ExecutionStatus;
import com.agilab.file_retrieval.domain.repository.DiscoveredFileRepository;
import com.agilab.file_retrieval.domain.repository.FileRetrievalConfigurationRepository;
import com.agilab.file_retrieval.domain.repository.FileRetrievalExecutionRepository;
import com.agilab.file_retrieval.event.ExecuteFileCheck;
import com.agilab.file_retrieval.notification.NotificationHeaders;
import com.agilab.file_retrieval.protocol.ListingRequest;
import com.agilab.file_retrieval.protocol.ProtocolAdapter;
import com.agilab.file_retrieval.protocol.ProtocolAdapterFactory;
import com.agilab.file_retrieval.support.TestConfigurations;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.OutputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.agilab.file_retrieval.support.TestConfigurations.remoteFile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end file checks against an in-memory database and the test binder.
 * The remote source is a mocked adapter; everything downstream of the listing is real.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestChannelBinderConfiguration.class)
class FileRetrievalIntegrationTest {

    private static final String DISCOVERED_DESTINATION = "file-discovered";
    private static final String AUDIT_DESTINATION = "file-check-audit";
    private static final String COMMAND_DESTINATION = "file-check-commands";

    @Autowired
    private OutputDestination outputDestination;

    @Autowired
    private InputDestination inputDestination;

    @Autowired
    private ExecutionDispatcher dispatcher;

    @Autowired
    private FileRetrievalConfigurationRepository configurationRepository;

    @Autowired
    private FileRetrievalExecutionRepository executionRepository;

    @Autowired
    private DiscoveredFileRepository discoveredFileRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CronScheduler scheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockitoBean
    private ProtocolAdapterFactory adapterFactory;

    private ProtocolAdapter adapter;
    private FileRetrievalConfiguration configuration;

    @BeforeEach
    void setUp() {
        outputDestination.clear();
        adapter = mock(ProtocolAdapter.class);
        when(adapterFactory.create(any())).thenReturn(adapter);
        configuration = configurationRepository.save(TestConfigurations.azureBlob("client-1").build());
    }

    @Test
    void shouldAnnounceEachBlobOnlyOnceAcrossChecks() throws IOException {
        // Given - first check sees A and B, the second sees A, B and C
        when(adapter.listFiles(any(ListingRequest.class)))
                .thenReturn(List.of(remoteFile("A.csv"), remoteFile("B.csv")))
                .thenReturn(List.of(remoteFile("A.csv"), remoteFile("B.csv"), remoteFile("C.csv")));

        // When
        var first = dispatcher.dispatch(
                ExecuteFileCheck.scheduled("client-1", configuration.getId(), Instant.parse("2026-03-01T10:00:00Z")));
        var firstMessages = drain(DISCOVERED_DESTINATION);
        var second = dispatcher.dispatch(
                ExecuteFileCheck.scheduled("client-1", configuration.getId(), Instant.parse("2026-03-01T10:05:00Z")));
        var secondMessages = drain(DISCOVERED_DESTINATION);

        // Then
        assertThat(first).get().satisfies(execution -> {
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(execution.getDiscoveredCount()).isEqualTo(2);
            assertThat(execution.getDispatchedCount()).isEqualTo(2);
        });
        assertThat(second).get().satisfies(execution -> {
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(execution.getDiscoveredCount()).isEqualTo(1);
        });
        assertThat(discoveredFileRepository.countByConfigurationId(configuration.getId())).isEqualTo(3);
        assertThat(discoveredFileRepository.findByConfigurationIdAndStatusOrderByDiscoveredAtAsc(
                configuration.getId(), DiscoveryStatus.DISCOVERED)).isEmpty();
        assertThat(discoveredFileRepository.findByConfigurationIdAndStatusOrderByDiscoveredAtAsc(
                configuration.getId(), DiscoveryStatus.NOTIFIED))
                .extracting(DiscoveredFile::getFileName)
                .containsExactlyInAnyOrder("A.csv", "B.csv", "C.csv");

        assertThat(firstMessages).hasSize(2);
        assertThat(secondMessages).hasSize(1);
        JsonNode announced = objectMapper.readTree(secondMessages.get(0).getPayload());
        assertThat(announced.get("fileName").asText()).isEqualTo("C.csv");
        assertThat(announced.get("messageType").asText()).isEqualTo("PolicyFileDiscovered");
        assertThat(announced.get("metadata").get("source").asText()).isEqualTo("partner-a");
        assertThat(secondMessages.get(0).getHeaders().get(NotificationHeaders.IDEMPOTENCY_KEY)).isNotNull();

        var stored = executionRepository.findByConfigurationIdOrderByStartedAtAsc(configuration.getId());
        assertThat(stored).hasSize(2).allSatisfy(execution ->
                assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED));
    }

    @Test
    void shouldNotAnnounceAgainWhenCommandIsRedelivered() {
        // Given
        when(adapter.listFiles(any(ListingRequest.class))).thenReturn(List.of(remoteFile("A.csv"), remoteFile("B.csv")));
        var command = ExecuteFileCheck.scheduled("client-1", configuration.getId(), Instant.parse("2026-03-01T10:00:00Z"));

        // When
        var first = dispatcher.dispatch(command);
        var firstMessages = drain(DISCOVERED_DESTINATION);
        var redelivered = dispatcher.dispatch(command);
        var redeliveredMessages = drain(DISCOVERED_DESTINATION);

        // Then
        assertThat(first).get().extracting(execution -> execution.getDispatchedCount()).isEqualTo(2);
        assertThat(firstMessages).hasSize(2);
        assertThat(redelivered).get().satisfies(execution -> {
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(execution.getDiscoveredCount()).isZero();
        });
        assertThat(redeliveredMessages).isEmpty();
        assertThat(discoveredFileRepository.countByConfigurationId(configuration.getId())).isEqualTo(2);
    }

    @Test
    void shouldRunManualTriggerReceivedFromCommandTopic() throws IOException {
        // Given
        when(adapter.listFiles(any(ListingRequest.class))).thenReturn(List.of(remoteFile("manual.csv")));
        var command = ExecuteFileCheck.manual("client-1", configuration.getId(), Instant.parse("2026-03-01T11:00:00Z"), "user-42");

        // When
        inputDestination.send(MessageBuilder.withPayload(objectMapper.writeValueAsBytes(command))
                .setHeader("contentType", "application/json")
                .build(), COMMAND_DESTINATION);

        // Then
        var auditMessages = drain(AUDIT_DESTINATION);
        assertThat(auditMessages).hasSize(2);
        JsonNode triggered = objectMapper.readTree(auditMessages.get(0).getPayload());
        assertThat(triggered.get("isManualTrigger").asBoolean()).isTrue();
        assertThat(triggered.get("triggeredBy").asText()).isEqualTo("user-42");
        JsonNode completed = objectMapper.readTree(auditMessages.get(1).getPayload());
        assertThat(completed.get("status").asText()).isEqualTo(ExecutionStatus.COMPLETED.name());
        assertThat(completed.get("discoveredCount").asInt()).isEqualTo(1);

        var executions = executionRepository.findByConfigurationIdOrderByStartedAtAsc(configuration.getId());
        assertThat(executions).singleElement().satisfies(execution -> {
            assertThat(execution.isManualTrigger()).isTrue();
            assertThat(execution.getTriggeredBy()).isEqualTo("user-42");
        });
    }

    @Test
    void shouldRecordFailedExecutionForPermanentListingError() throws IOException {
        // Given
        when(adapter.listFiles(any(ListingRequest.class)))
                .thenThrow(new IllegalArgumentException("Container name is invalid"));

        // When
        var execution = dispatcher.dispatch(
                ExecuteFileCheck.scheduled("client-1", configuration.getId(), Instant.parse("2026-03-01T10:00:00Z")));

        // Then
        assertThat(execution).get().satisfies(failed -> {
            assertThat(failed.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(failed.getFailureReason()).isEqualTo("Container name is invalid");
        });
        var auditMessages = drain(AUDIT_DESTINATION);
        assertThat(auditMessages).hasSize(2);
        JsonNode failedEvent = objectMapper.readTree(auditMessages.get(1).getPayload());
        assertThat(failedEvent.get("errorCategory").asText()).isEqualTo("ConfigurationError");
        assertThat(drain(DISCOVERED_DESTINATION)).isEmpty();
    }

    @Test
    void shouldKeepSchedulingWhenOneConfigurationRowCannotBeRead() {
        // Given - only an every-minute configuration and a row whose settings are not JSON are active
        jdbcTemplate.update("update file_retrieval_configurations set active = false");
        var due = configurationRepository.save(TestConfigurations.azureBlob("client-1").cronExpression("* * * * *").build());
        var corrupt = configurationRepository.save(TestConfigurations.azureBlob("client-2").build());
        jdbcTemplate.update("update file_retrieval_configurations set protocol_settings = ? where id = ?",
                "{\"protocolType\": \"AZURE_BLOB\", \"containerName\":", corrupt.getId());
        when(adapter.listFiles(any(ListingRequest.class))).thenReturn(List.of());

        try {
            // When
            var fired = scheduler.evaluateSchedules();

            // Then
            assertThat(fired).isEqualTo(1);
            await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                    assertThat(executionRepository.findByConfigurationIdOrderByStartedAtAsc(due.getId()))
                            .singleElement()
                            .extracting(execution -> execution.getStatus())
                            .isEqualTo(ExecutionStatus.COMPLETED));
            assertThat(executionRepository.findByConfigurationIdOrderByStartedAtAsc(corrupt.getId())).isEmpty();
            assertThat(drain(AUDIT_DESTINATION)).hasSize(2);
        } finally {
            jdbcTemplate.update("delete from file_retrieval_configurations where id = ?", corrupt.getId());
        }
    }

    private List<Message<byte[]>> drain(String destination) {
        var messages = new ArrayList<Message<byte[]>>();
        Message<byte[]> message;
        while ((message = outputDestination.receive(200, destination)) != null) {
            messages.add(message);
        }
        return messages;
    }
}
