package com.agilab.file_retrieval;

import com.agilab.file_retrieval.concurrency.ConcurrencyGate;
import com.agilab.file_retrieval.config.FileRetrievalProperties;
import com.agilab.file_retrieval.domain.entity.FileRetrievalConfiguration;
import com.agilab.file_retrieval.domain.repository.FileRetrievalConfigurationRepository;
import com.agilab.file_retrieval.event.ExecuteFileCheck;
import com.agilab.file_retrieval.util.ScheduleEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fires due configurations on every tick. A configuration that finds the gate full is not
 * marked as fired and is picked up again on the next tick while its occurrence is still
 * inside the execution window.
 */
@Component
@Slf4j
public class CronScheduler {

    private final FileRetrievalConfigurationRepository configurationRepository;
    private final ConcurrencyGate gate;
    private final FileCheckCommandHandler commandHandler;
    private final TaskExecutor fileCheckExecutor;
    private final FileRetrievalProperties properties;
    private final Clock clock;
    private final Map<UUID, Instant> lastFired = new ConcurrentHashMap<>();

    public CronScheduler(FileRetrievalConfigurationRepository configurationRepository,
                         ConcurrencyGate gate,
                         FileCheckCommandHandler commandHandler,
                         @Qualifier("fileCheckExecutor") TaskExecutor fileCheckExecutor,
                         FileRetrievalProperties properties,
                         Clock clock) {
        this.configurationRepository = configurationRepository;
        this.gate = gate;
        this.commandHandler = commandHandler;
        this.fileCheckExecutor = fileCheckExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "#{@fileRetrievalProperties.tickInterval.toMillis()}")
    public void tick() {
        try {
            log.debug("Evaluating file check schedules...");
            var dispatched = evaluateSchedules();
            if (dispatched > 0) {
                log.info("Dispatched {} scheduled file checks", dispatched);
            }
        } catch (Exception e) {
            log.error("Error during schedule evaluation", e);
        }
    }

    /**
     * @return number of configurations dispatched on this tick
     */
    public int evaluateSchedules() {
        var now = clock.instant();
        var activeIds = configurationRepository.findActiveIds().stream()
                .sorted()
                .toList();
        int dispatched = 0;
        for (var id : activeIds) {
            var found = load(id);
            if (found.isEmpty()) {
                continue;
            }
            var configuration = found.get();
            try {
                if (fireIfDue(configuration, now)) {
                    dispatched++;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Invalid schedule for configuration {} ('{}' in {}): {}", configuration.getId(),
                        configuration.getCronExpression(), configuration.getTimezone(), e.getMessage());
            } catch (Exception e) {
                log.error("Error evaluating schedule of configuration {}", configuration.getId(), e);
            }
        }
        lastFired.keySet().retainAll(new HashSet<>(activeIds));
        return dispatched;
    }

    private Optional<FileRetrievalConfiguration> load(UUID id) {
        try {
            return configurationRepository.findById(id).filter(FileRetrievalConfiguration::isActive);
        } catch (Exception e) {
            log.error("Configuration {} could not be loaded, skipped on this tick", id, e);
            return Optional.empty();
        }
    }

    private boolean fireIfDue(FileRetrievalConfiguration configuration, Instant now) {
        var occurrence = ScheduleEvaluator.latestOccurrence(configuration.getCronExpression(),
                configuration.getTimezone(), now, properties.getExecutionWindow());
        if (occurrence.isEmpty()) {
            return false;
        }
        var id = configuration.getId();
        var dueMinute = ScheduleEvaluator.truncateToMinute(occurrence.get());
        var previous = lastFired.get(id);
        if (previous != null && !dueMinute.isAfter(previous)) {
            return false;
        }
        var permit = gate.tryAcquire();
        if (permit.isEmpty()) {
            log.warn("Capacity exceeded: {} of {} execution slots busy, configuration {} deferred to next tick",
                    gate.inUse(), gate.capacity(), id);
            return false;
        }
        lastFired.put(id, dueMinute);
        var command = ExecuteFileCheck.scheduled(configuration.getClientId(), id, occurrence.get());
        try {
            fileCheckExecutor.execute(() -> commandHandler.handle(command, permit.get()));
        } catch (RejectedExecutionException e) {
            permit.get().close();
            restore(id, dueMinute, previous);
            log.warn("File check executor rejected configuration {}, deferred to next tick", id);
            return false;
        }
        if (log.isDebugEnabled()) {
            log.debug("Configuration {} due at {} dispatched, next due at {}", id, occurrence.get(),
                    ScheduleEvaluator.next(configuration.getCronExpression(), configuration.getTimezone(), now).orElse(null));
        }
        return true;
    }

    private void restore(UUID id, Instant dueMinute, Instant previous) {
        if (previous == null) {
            lastFired.remove(id, dueMinute);
        } else {
            lastFired.replace(id, dueMinute, previous);
        }
    }

    Instant lastFiredMinute(UUID configurationId) {
        return lastFired.get(configurationId);
    }
}
