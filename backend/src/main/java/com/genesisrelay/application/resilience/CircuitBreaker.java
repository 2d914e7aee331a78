/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import com.genesisrelay.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Failure tracker and state machine for one named dependency.
 * <p>
 * The breaker only decides whether an operation may run; it never retries. All counters and the
 * state are guarded by a single lock per instance, while the operation itself runs outside it.
 * Every admitted call carries the generation it was admitted in, so a completion that arrives
 * after the breaker has moved on cannot undo a newer transition.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners;
    private final Object lock = new Object();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int trialsInFlight;
    private long generation;
    private Instant nextAttemptTime;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, List<CircuitBreakerListener> listeners) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = config == null ? CircuitBreakerConfig.defaults() : config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this(name, config, clock, List.of());
    }

    public <T> T execute(Supplier<T> operation) {
        Objects.requireNonNull(operation, "operation");
        Permit permit = acquirePermit();

        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            onFailure(permit, e);
            throw e;
        }
        onSuccess(permit);
        return result;
    }

    public void reset() {
        Transition transition;
        synchronized (lock) {
            transition = moveTo(CircuitState.CLOSED);
            failureCount = 0;
            successCount = 0;
            trialsInFlight = 0;
            nextAttemptTime = null;
            lastFailureTime = null;
        }
        log.info("Circuit breaker {} has been manually reset", name);
        publish(transition);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    public Optional<Instant> getNextAttemptTime() {
        synchronized (lock) {
            return state == CircuitState.OPEN ? Optional.ofNullable(nextAttemptTime) : Optional.empty();
        }
    }

    public Optional<Instant> getLastFailureTime() {
        synchronized (lock) {
            return Optional.ofNullable(lastFailureTime);
        }
    }

    public BreakerStatus status() {
        synchronized (lock) {
            return new BreakerStatus(state, failureCount);
        }
    }

    private Permit acquirePermit() {
        Transition transition = null;
        Permit permit = null;
        Instant retryAt = null;

        synchronized (lock) {
            if (state == CircuitState.OPEN) {
                Instant now = clock.instant();
                if (now.isBefore(nextAttemptTime)) {
                    retryAt = nextAttemptTime;
                } else {
                    transition = moveTo(CircuitState.HALF_OPEN);
                    successCount = 0;
                    trialsInFlight = 0;
                }
            }
            if (retryAt == null) {
                if (state == CircuitState.HALF_OPEN) {
                    if (trialsInFlight >= config.halfOpenMaxCalls()) {
                        retryAt = clock.instant();
                    } else {
                        trialsInFlight++;
                        permit = new Permit(true, generation);
                    }
                } else {
                    permit = new Permit(false, generation);
                }
            }
        }

        publish(transition);
        if (permit == null) {
            throw new CircuitOpenException(name, retryAt);
        }
        return permit;
    }

    private void onSuccess(Permit permit) {
        Transition transition = null;
        synchronized (lock) {
            boolean current = permit.generation() == generation;
            if (permit.trial() && current) {
                trialsInFlight--;
            }

            if (state == CircuitState.CLOSED) {
                failureCount = Math.max(0, failureCount - 1);
            } else if (state == CircuitState.HALF_OPEN && permit.trial() && current) {
                successCount++;
                if (successCount >= config.halfOpenMaxCalls()) {
                    transition = moveTo(CircuitState.CLOSED);
                    failureCount = 0;
                    successCount = 0;
                    trialsInFlight = 0;
                }
            }
            // a success reported against an OPEN breaker is stale and must not close it
        }
        if (transition != null) {
            log.info("Circuit breaker {} is now CLOSED after successful recovery", name);
        }
        publish(transition);
    }

    /**
     * Only calls admitted since the last transition are counted, as in {@link #onSuccess}.
     */
    private void onFailure(Permit permit, Throwable error) {
        Transition transition = null;
        int failures;
        boolean stale;
        synchronized (lock) {
            lastFailureTime = clock.instant();
            stale = permit.generation() != generation;
            if (!stale) {
                if (permit.trial()) {
                    trialsInFlight--;
                }
                failureCount++;

                if (state == CircuitState.HALF_OPEN
                        || (state == CircuitState.CLOSED && failureCount >= config.failureThreshold())) {
                    transition = moveTo(CircuitState.OPEN);
                    nextAttemptTime = lastFailureTime.plus(config.resetTimeout());
                    successCount = 0;
                    trialsInFlight = 0;
                }
            }
            failures = failureCount;
        }

        if (stale) {
            log.debug("Circuit breaker {} ignored late failure: {}", name, error.toString());
            return;
        }
        log.debug("Circuit breaker {} failure: {}", name, error.toString());
        if (transition != null) {
            log.warn("Circuit breaker {} opened due to {} failures", name, failures);
        }
        publish(transition);
    }

    /**
     * Must be called with {@code lock} held.
     */
    private Transition moveTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        generation++;
        if (next == CircuitState.HALF_OPEN) {
            log.info("Circuit breaker {} is now HALF_OPEN", name);
        }
        return previous == next ? null : new Transition(previous, next, failureCount);
    }

    private void publish(Transition transition) {
        if (transition == null) return;
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateChange(name, transition.from(), transition.to(), transition.failureCount());
            } catch (RuntimeException e) {
                log.warn("Circuit breaker listener failed breaker={} listener={}", name, listener.getClass().getSimpleName(), e);
            }
        }
    }

    private record Permit(boolean trial, long generation) {}

    private record Transition(CircuitState from, CircuitState to, int failureCount) {}
}
