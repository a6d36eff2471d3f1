package io.github.eventfold.projection.capability;

/*-
 * #%L
 * eventfold
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.eventfold.core.AsyncResult;
import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.projection.ProjectionCapability;
import io.github.eventfold.projection.ProjectionContext;
import io.github.eventfold.projection.ProjectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Rejects events while the projection keeps failing. Should be the first capability of an engine, so that it gates
 * before other capabilities cause side effects.
 * <pre>
 * CLOSED    --failureThreshold consecutive failures--&gt; OPEN
 * OPEN      --recoveryTimeout since last failure-----&gt; HALF_OPEN
 * HALF_OPEN --halfOpenMaxAttempts successes----------&gt; CLOSED
 * HALF_OPEN --any failure----------------------------&gt; OPEN
 * </pre>
 * Rejections of the breaker itself are not counted as failures.
 */
public class CircuitBreakerCapability<S> implements ProjectionCapability<S> {
    public static final String NAME = "circuit-breaker";

    private final Logger logger;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private ProjectionContext<S> context;
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int halfOpenAttempts;
    private Instant lastFailureTime;

    public CircuitBreakerCapability(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), LoggerFactory.getLogger(CircuitBreakerCapability.class));
    }

    public CircuitBreakerCapability(CircuitBreakerConfig config, Clock clock, Logger logger) {
        this.config = Objects.requireNonNull(config, "Circuit breaker config must be specified");
        this.clock = Objects.requireNonNull(clock);
        this.logger = Objects.requireNonNull(logger);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public synchronized void attach(ProjectionContext<S> context) {
        this.context = context;
    }

    @Override
    public synchronized void detach() {
        this.context = null;
    }

    @Override
    public synchronized CompletionStage<Void> onBeforeApply(EventEnvelope event, S state) {
        if (this.state == CircuitState.OPEN) {
            Duration elapsed = Duration.between(lastFailureTime, clock.instant());
            if (elapsed.toMillis() < config.getRecoveryTimeoutMs()) {
                return AsyncResult.throwing(ProjectionException.circuitBreakerOpen(projectionName(),
                        event.getEventType()));
            }
            halfOpenAttempts = 0;
            transition(CircuitState.HALF_OPEN);
        }
        return AsyncResult.done();
    }

    @Override
    public synchronized CompletionStage<Void> onAfterApply(EventEnvelope event, S newState) {
        if (state == CircuitState.HALF_OPEN) {
            halfOpenAttempts++;
            if (halfOpenAttempts >= config.getHalfOpenMaxAttempts()) {
                failureCount = 0;
                transition(CircuitState.CLOSED);
            }
        } else if (state == CircuitState.CLOSED) {
            failureCount = 0;
        }
        return AsyncResult.done();
    }

    @Override
    public synchronized CompletionStage<Void> onError(ProjectionException error, EventEnvelope event) {
        if (error.getFault() == ProjectionException.Fault.CIRCUIT_BREAKER_OPEN) {
            return AsyncResult.done();
        }
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN
                || (state == CircuitState.CLOSED && failureCount >= config.getFailureThreshold())) {
            transition(CircuitState.OPEN);
        }
        return AsyncResult.done();
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Close the circuit and forget past failures.
     */
    public synchronized void reset() {
        failureCount = 0;
        halfOpenAttempts = 0;
        lastFailureTime = null;
        transition(CircuitState.CLOSED);
    }

    private void transition(CircuitState next) {
        if (state != next) {
            logger.info("Circuit breaker of projection {} changed from {} to {}", projectionName(), state, next);
            state = next;
        }
    }

    private String projectionName() {
        return context == null ? "<detached>" : context.getProjectionName();
    }
}
