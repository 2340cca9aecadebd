package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import com.purchasingpower.orchestrator.exception.AgentTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting semaphore per agent type that never parks a thread.
 *
 * <p>{@link #acquire} returns a future that completes with a {@link Permit} once one is free, or
 * fails with a retryable {@link AgentTimeoutException} after the bounded wait. Idle semaphores are
 * dropped by {@link #cleanupIdle}; the check and removal happen inside the map's per-key lock,
 * the same lock acquisitions take, so a semaphore in use is never dropped.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class AgentConcurrencyLimiter {

    private final Map<String, AsyncSemaphore> semaphores = new ConcurrentHashMap<>();
    private final int maxPermits;
    private final Duration waitTimeout;

    @Autowired
    public AgentConcurrencyLimiter(OrchestrationProperties properties) {
        this(properties.getMaxConcurrentPerAgentType(), properties.getSemaphoreWaitTimeout());
    }

    public AgentConcurrencyLimiter(int maxPermits, Duration waitTimeout) {
        this.maxPermits = maxPermits;
        this.waitTimeout = waitTimeout;
    }

    public CompletableFuture<Permit> acquire(String agentType) {
        CompletableFuture<?>[] pending = new CompletableFuture<?>[1];
        AsyncSemaphore semaphore = semaphores.compute(agentType, (key, existing) -> {
            AsyncSemaphore s = existing != null ? existing : new AsyncSemaphore(maxPermits);
            pending[0] = s.acquire();
            return s;
        });

        @SuppressWarnings("unchecked")
        CompletableFuture<Void> granted = (CompletableFuture<Void>) pending[0];
        if (granted.isDone()) {
            return CompletableFuture.completedFuture(new Permit(semaphore));
        }

        log.debug("Waiting for a permit on agent type {} ({} in flight)", agentType, maxPermits);
        granted.orTimeout(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return granted.handle((ignored, error) -> {
            if (error == null) {
                return new Permit(semaphore);
            }
            semaphore.abandon(granted);
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                throw new AgentTimeoutException(
                        "No capacity for agent type " + agentType + " within " + waitTimeout.toSeconds() + "s",
                        agentType, waitTimeout);
            }
            throw new CompletionException(cause);
        });
    }

    /**
     * Drop semaphores that have no holders, no waiters and were last released before the cutoff.
     *
     * @return number of semaphores removed
     */
    public int cleanupIdle(Duration idleFor) {
        Instant cutoff = Instant.now().minus(idleFor);
        AtomicInteger removed = new AtomicInteger();
        for (String key : semaphores.keySet()) {
            semaphores.computeIfPresent(key, (k, s) -> {
                if (s.isIdleSince(cutoff)) {
                    removed.incrementAndGet();
                    return null;
                }
                return s;
            });
        }
        if (removed.get() > 0) {
            log.debug("🧹 Removed {} idle agent semaphores", removed.get());
        }
        return removed.get();
    }

    public int trackedAgentTypes() {
        return semaphores.size();
    }

    public int availablePermits(String agentType) {
        AsyncSemaphore s = semaphores.get(agentType);
        return s != null ? s.available() : maxPermits;
    }

    /**
     * A granted slot. Release exactly once; extra calls are ignored.
     */
    public static final class Permit implements AutoCloseable {
        private final AsyncSemaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(AsyncSemaphore semaphore) {
            this.semaphore = semaphore;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }

        @Override
        public void close() {
            release();
        }
    }

    static final class AsyncSemaphore {
        private final int maxPermits;
        private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
        private int available;
        private Instant lastReleased = Instant.now();

        AsyncSemaphore(int maxPermits) {
            this.maxPermits = maxPermits;
            this.available = maxPermits;
        }

        synchronized CompletableFuture<Void> acquire() {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }

        /**
         * Hands the permit to the oldest live waiter, or returns it to the pool.
         * Waiters are completed outside the lock.
         */
        void release() {
            while (true) {
                CompletableFuture<Void> next;
                synchronized (this) {
                    next = waiters.pollFirst();
                    if (next == null) {
                        available++;
                        lastReleased = Instant.now();
                        return;
                    }
                }
                if (next.complete(null)) {
                    return;
                }
            }
        }

        synchronized void abandon(CompletableFuture<Void> waiter) {
            waiters.remove(waiter);
        }

        synchronized int available() {
            return available;
        }

        synchronized boolean isIdleSince(Instant cutoff) {
            return available == maxPermits && waiters.isEmpty() && lastReleased.isBefore(cutoff);
        }
    }
}
