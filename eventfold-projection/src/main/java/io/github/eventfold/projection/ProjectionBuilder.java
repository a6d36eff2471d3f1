package io.github.eventfold.projection;

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

import io.github.eventfold.projection.capability.CheckpointCapability;
import io.github.eventfold.projection.capability.CircuitBreakerCapability;
import io.github.eventfold.projection.capability.CircuitBreakerConfig;
import io.github.eventfold.projection.capability.DeadLetterCapability;
import io.github.eventfold.projection.capability.DeadLetterPolicy;
import io.github.eventfold.projection.capability.ProjectionSnapshotCapability;
import io.github.eventfold.projection.retry.ExponentialBackoffStrategy;
import io.github.eventfold.projection.retry.RetryConfig;
import io.github.eventfold.projection.retry.RetryStrategy;
import io.github.eventfold.projection.store.CheckpointStore;
import io.github.eventfold.projection.store.DeadLetterStore;
import io.github.eventfold.projection.store.ProjectionSnapshotStore;
import io.github.eventfold.projection.store.ProjectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Assembles a projection engine with its resilience capabilities.
 * <pre>
 * ProjectionEngine&lt;Balance&gt; engine = ProjectionBuilder.of(balances, new InMemoryProjectionStore&lt;&gt;())
 *     .withRetry(RetryConfig.defaults(), scheduler)
 *     .withCircuitBreaker(CircuitBreakerConfig.defaults())
 *     .withDeadLetter(deadLetters)
 *     .withCheckpoints(checkpoints, 100)
 *     .build();
 * </pre>
 * The circuit breaker is attached first, so it gates before other capabilities act. Other capabilities follow in
 * order: custom capabilities, checkpoints, snapshots, dead letters.
 *
 * @param <S> type of the projection state
 */
public class ProjectionBuilder<S> {
    private final Projection<S> projection;
    private final ProjectionStore<S> store;
    private Logger logger = LoggerFactory.getLogger(ProjectionEngine.class);
    private Clock clock = Clock.systemUTC();
    private RetryConfig retryConfig;
    private RetryStrategy retryStrategy = new ExponentialBackoffStrategy();
    private ScheduledExecutorService scheduler;
    private CircuitBreakerConfig circuitBreakerConfig;
    private CheckpointStore<S> checkpointStore;
    private int checkpointInterval = CheckpointCapability.DEFAULT_INTERVAL;
    private ProjectionSnapshotStore<S> snapshotStore;
    private int snapshotInterval = ProjectionSnapshotCapability.DEFAULT_INTERVAL;
    private Duration snapshotRetention;
    private DeadLetterStore deadLetterStore;
    private DeadLetterPolicy deadLetterPolicy = DeadLetterPolicy.defaultPolicy();
    private final List<ProjectionCapability<S>> capabilities = new ArrayList<>();

    private ProjectionBuilder(Projection<S> projection, ProjectionStore<S> store) {
        this.projection = Objects.requireNonNull(projection, "Projection must be specified");
        this.store = Objects.requireNonNull(store, "Projection store must be specified");
    }

    public static <S> ProjectionBuilder<S> of(Projection<S> projection, ProjectionStore<S> store) {
        return new ProjectionBuilder<>(projection, store);
    }

    public ProjectionBuilder<S> withLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger);
        return this;
    }

    public ProjectionBuilder<S> withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
        return this;
    }

    public ProjectionBuilder<S> withRetry(RetryConfig config, ScheduledExecutorService scheduler) {
        this.retryConfig = Objects.requireNonNull(config, "Retry config must be specified");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must be specified");
        return this;
    }

    public ProjectionBuilder<S> withRetry(RetryConfig config, RetryStrategy strategy,
            ScheduledExecutorService scheduler) {
        this.retryStrategy = Objects.requireNonNull(strategy, "Retry strategy must be specified");
        return withRetry(config, scheduler);
    }

    public ProjectionBuilder<S> withCircuitBreaker(CircuitBreakerConfig config) {
        this.circuitBreakerConfig = Objects.requireNonNull(config, "Circuit breaker config must be specified");
        return this;
    }

    public ProjectionBuilder<S> withCheckpoints(CheckpointStore<S> store) {
        return withCheckpoints(store, CheckpointCapability.DEFAULT_INTERVAL);
    }

    public ProjectionBuilder<S> withCheckpoints(CheckpointStore<S> store, int interval) {
        this.checkpointStore = Objects.requireNonNull(store, "Checkpoint store must be specified");
        this.checkpointInterval = interval;
        return this;
    }

    public ProjectionBuilder<S> withSnapshots(ProjectionSnapshotStore<S> store) {
        return withSnapshots(store, ProjectionSnapshotCapability.DEFAULT_INTERVAL);
    }

    public ProjectionBuilder<S> withSnapshots(ProjectionSnapshotStore<S> store, int interval) {
        return withSnapshots(store, interval, null);
    }

    /**
     * Take snapshots, removing those older than retention.
     * @param store snapshot store
     * @param interval events between snapshots
     * @param retention how long to keep snapshots, null to keep all
     * @return this builder
     */
    public ProjectionBuilder<S> withSnapshots(ProjectionSnapshotStore<S> store, int interval, Duration retention) {
        this.snapshotStore = Objects.requireNonNull(store, "Snapshot store must be specified");
        this.snapshotInterval = interval;
        this.snapshotRetention = retention;
        return this;
    }

    public ProjectionBuilder<S> withDeadLetter(DeadLetterStore store) {
        return withDeadLetter(store, DeadLetterPolicy.defaultPolicy());
    }

    public ProjectionBuilder<S> withDeadLetter(DeadLetterStore store, DeadLetterPolicy policy) {
        this.deadLetterStore = Objects.requireNonNull(store, "Dead letter store must be specified");
        this.deadLetterPolicy = Objects.requireNonNull(policy, "Dead letter policy must be specified");
        return this;
    }

    public ProjectionBuilder<S> withCapability(ProjectionCapability<S> capability) {
        capabilities.add(Objects.requireNonNull(capability, "Capability must be specified"));
        return this;
    }

    public ProjectionEngine<S> build() {
        ProjectionEngine<S> engine = retryConfig == null
                ? new ProjectionEngine<>(projection, store, logger)
                : new RetryingProjectionEngine<>(projection, store, logger, retryConfig, retryStrategy, scheduler,
                        clock);
        if (circuitBreakerConfig != null) {
            engine.addCapability(new CircuitBreakerCapability<>(circuitBreakerConfig, clock, logger));
        }
        capabilities.forEach(engine::addCapability);
        if (checkpointStore != null) {
            engine.addCapability(new CheckpointCapability<>(checkpointStore, checkpointInterval, true, clock,
                    logger));
        }
        if (snapshotStore != null) {
            engine.addCapability(new ProjectionSnapshotCapability<>(snapshotStore, snapshotInterval,
                    snapshotRetention, clock, logger));
        }
        if (deadLetterStore != null) {
            engine.addCapability(new DeadLetterCapability<>(deadLetterStore, deadLetterPolicy, clock, logger));
        }
        return engine;
    }
}
