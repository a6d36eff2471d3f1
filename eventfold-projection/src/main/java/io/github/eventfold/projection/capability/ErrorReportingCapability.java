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
import io.github.eventfold.core.EventMetadata;
import io.github.eventfold.projection.ErrorProjection;
import io.github.eventfold.projection.ProjectionCapability;
import io.github.eventfold.projection.ProjectionContext;
import io.github.eventfold.projection.ProjectionEngine;
import io.github.eventfold.projection.ProjectionErrorOccurred;
import io.github.eventfold.projection.ProjectionException;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Publishes a {@link ProjectionErrorOccurred} event for every failure of the projection. The event is correlated to
 * the failed event.
 */
public class ErrorReportingCapability<S> implements ProjectionCapability<S> {
    public static final String NAME = "error-reporting";

    private final Function<EventEnvelope, CompletionStage<Void>> publisher;
    private final Clock clock;
    private volatile ProjectionContext<S> context;

    public ErrorReportingCapability(Function<EventEnvelope, CompletionStage<Void>> publisher) {
        this(publisher, Clock.systemUTC());
    }

    public ErrorReportingCapability(Function<EventEnvelope, CompletionStage<Void>> publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "Publisher must be specified");
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Publisher feeding events into an engine of {@link ErrorProjection} one at a time. Share the returned function
     * among the capabilities of all reporting projections, so that the error engine stays the single writer of its
     * state.
     * @param errorEngine engine to feed
     * @return publisher for {@link #ErrorReportingCapability(Function)}
     */
    public static Function<EventEnvelope, CompletionStage<Void>> feeding(ProjectionEngine<?> errorEngine) {
        Objects.requireNonNull(errorEngine);
        AtomicReference<CompletableFuture<Void>> tail = new AtomicReference<>(
                CompletableFuture.<Void>completedFuture(null));
        return event -> {
            CompletableFuture<Void> next = new CompletableFuture<>();
            tail.getAndSet(next).whenComplete((r, previousError) -> AsyncResult.compose(() -> errorEngine
                    .processEvent(event)).whenComplete((v, t) -> {
                        if (t == null) {
                            next.complete(null);
                        } else {
                            next.completeExceptionally(AsyncResult.unwrap(t));
                        }
                    }));
            return next;
        };
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void attach(ProjectionContext<S> context) {
        this.context = context;
    }

    @Override
    public void detach() {
        this.context = null;
    }

    @Override
    public CompletionStage<Void> onError(ProjectionException error, EventEnvelope event) {
        ProjectionContext<S> ctx = context;
        if (ctx == null) {
            return AsyncResult.throwing(ProjectionException.capabilityNotAttached(NAME));
        }
        Throwable cause = error.getCause() == null ? error : error.getCause();
        ProjectionErrorOccurred payload = new ProjectionErrorOccurred(ctx.getProjectionName(), event.getEventType(),
                event.getEventId(), cause.getClass().getName(), cause.getMessage(), error.getAttemptCount(),
                clock.instant());
        EventMetadata metadata = EventMetadata.builder()
                .timestamp(payload.getOccurredAt())
                .causationId(event.getEventId())
                .correlationId(event.getMetadata().getCorrelationId().orElse(event.getEventId()))
                .build();
        return AsyncResult.compose(() -> publisher.apply(EventEnvelope.of(ErrorProjection.EVENT_TYPE, payload,
                metadata)));
    }
}
