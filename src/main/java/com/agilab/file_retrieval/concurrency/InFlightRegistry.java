package com.agilab.file_retrieval.concurrency;

import com.agilab.file_retrieval.config.FileRetrievalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-configuration soft lock. A configuration holds at most one live lease; a lease that
 * is never closed expires after the TTL so a crashed run cannot block its configuration forever.
 */
@Slf4j
@Component
public class InFlightRegistry {

    private final ConcurrentMap<UUID, Marker> markers = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public InFlightRegistry(FileRetrievalProperties properties, Clock clock) {
        this(properties.getInFlightTtl(), clock);
    }

    public InFlightRegistry(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<Lease> tryAcquire(UUID configurationId) {
        var now = clock.instant();
        var candidate = new Marker(UUID.randomUUID(), now.plus(ttl));
        var winner = markers.compute(configurationId, (id, current) -> {
            if (current == null) {
                return candidate;
            }
            if (!current.expiresAt().isAfter(now)) {
                log.warn("In-flight marker for configuration {} expired at {}, taking over", id, current.expiresAt());
                return candidate;
            }
            return current;
        });
        if (winner != candidate) {
            return Optional.empty();
        }
        return Optional.of(new Lease(configurationId, candidate));
    }

    public boolean isInFlight(UUID configurationId) {
        var marker = markers.get(configurationId);
        return marker != null && marker.expiresAt().isAfter(clock.instant());
    }

    private record Marker(UUID token, Instant expiresAt) {
    }

    public final class Lease implements AutoCloseable {
        private final UUID configurationId;
        private final Marker marker;

        private Lease(UUID configurationId, Marker marker) {
            this.configurationId = configurationId;
            this.marker = marker;
        }

        public UUID configurationId() {
            return configurationId;
        }

        // removes only our own marker, never one that replaced it after expiry
        @Override
        public void close() {
            markers.remove(configurationId, marker);
        }
    }
}
