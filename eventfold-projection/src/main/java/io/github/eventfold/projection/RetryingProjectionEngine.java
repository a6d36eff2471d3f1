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

import io.github.eventfold.core.AsyncResult;
import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.projection.retry.ExponentialBackoffStrategy;
import io.github.eventfold.projection.retry.RetryConfig;
import io.github.eventfold.projection.retry.RetryStrategy;
import io.github.eventfold.projection.store.ProjectionStore;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Projection engine that repeats failed attempts according to a {@link RetryStrategy}. Each failure is tagged with
 * the attempt number and the instant of the first failure. Error hooks run only once, when the strategy gives up.
 *
 * <p>An attempt covers loading state, before hooks, the projection and persisting the state. Once the state is
 * persisted the event counts as applied, so failures of after hooks are reported without retrying.</p>
 *
 * @param <S> type of the projection state
 */
public class RetryingProjectionEngine<S> extends ProjectionEngine<S> {
    private final RetryConfig config;
    private final RetryStrategy strategy;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public RetryingProjectionEngine(Projection<S> projection, ProjectionStore<S> store, Logger logger,
            RetryConfig config, ScheduledExecutorService scheduler) {
        this(projection, store, logger, config, new ExponentialBackoffStrategy(), scheduler, Clock.systemUTC());
    }

    public RetryingProjectionEngine(Projection<S> projection, ProjectionStore<S> store, Logger logger,
            RetryConfig config, RetryStrategy strategy, ScheduledExecutorService scheduler, Clock clock) {
        super(projection, store, logger);
        this.config = Objects.requireNonNull(config, "Retry config must be specified");
        this.strategy = Objects.requireNonNull(strategy, "Retry strategy must be specified");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    public RetryConfig getRetryConfig() {
        return config;
    }

    public RetryStrategy getRetryStrategy() {
        return strategy;
    }

    @Override
    public CompletionStage<Void> processEvent(EventEnvelope event) {
        Objects.requireNonNull(event, "Event must be specified");
        if (!isInterestedIn(event)) {
            return AsyncResult.done();
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(event, capabilities(), 1, null, result);
        return result;
    }

    private void attempt(EventEnvelope event, List<ProjectionCapability<S>> hooks, int attempt,
            Instant firstFailedAt, CompletableFuture<Void> result) {
        AsyncResult.compose(() -> applyOnce(event, hooks)).whenComplete((newState, t) -> {
            if (t == null) {
                afterApply(event, newState, hooks).whenComplete((r, afterError) -> {
                    if (afterError == null) {
                        result.complete(null);
                    } else {
                        fail(toProjectionError(afterError, event).withAttempt(attempt,
                                firstFailedAt == null ? clock.instant() : firstFailedAt), event, hooks, result);
                    }
                });
                return;
            }
            Instant failedAt = firstFailedAt == null ? clock.instant() : firstFailedAt;
            ProjectionException error = toProjectionError(t, event).withAttempt(attempt, failedAt);
            if (!strategy.shouldRetry(error, attempt, config)) {
                fail(error, event, hooks, result);
                return;
            }
            long delay = strategy.getRetryDelay(attempt, config);
            logger.warn("Projection {} failed attempt {} of {} on event {} {}, retrying in {} ms",
                    getProjectionName(), attempt, config.getMaxAttempts(), event.getEventType(), event.getEventId(),
                    delay, AsyncResult.unwrap(t));
            try {
                scheduler.schedule(() -> attempt(event, hooks, attempt + 1, failedAt, result), delay,
                        TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                error.addSuppressed(e);
                fail(error, event, hooks, result);
            }
        });
    }

    private void fail(ProjectionException error, EventEnvelope event, List<ProjectionCapability<S>> hooks,
            CompletableFuture<Void> result) {
        reportError(error, event, hooks).whenComplete((r, t) -> result.completeExceptionally(error));
    }
}
