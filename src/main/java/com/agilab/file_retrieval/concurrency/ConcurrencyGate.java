package com.agilab.file_retrieval.concurrency;

import com.agilab.file_retrieval.config.FileRetrievalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global bound on simultaneous executions, shared by scheduled and manual triggers.
 * Acquisition never blocks: a caller that gets nothing retries on its next cycle.
 */
@Slf4j
@Component
public class ConcurrencyGate {

    private final Semaphore semaphore;
    private final int capacity;

    @Autowired
    public ConcurrencyGate(FileRetrievalProperties properties) {
        this(properties.getMaxConcurrentExecutions());
    }

    public ConcurrencyGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Gate capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity);
    }

    public Optional<Permit> tryAcquire() {
        if (!semaphore.tryAcquire()) {
            return Optional.empty();
        }
        return Optional.of(new Permit());
    }

    public int capacity() {
        return capacity;
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int inUse() {
        return capacity - semaphore.availablePermits();
    }

    /**
     * One gate slot. Closing it more than once releases the slot only once.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            } else {
                log.debug("Gate permit already released");
            }
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
