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
import io.github.eventfold.projection.store.DeadLetterEntry;
import io.github.eventfold.projection.store.DeadLetterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Stores events that failed for good into a {@link DeadLetterStore}, when the {@link DeadLetterPolicy} says so.
 * Storing a dead letter does not change how the failure propagates to the caller.
 */
public class DeadLetterCapability<S> implements ProjectionCapability<S> {
    public static final String NAME = "dead-letter";

    private final Logger logger;
    private final DeadLetterStore store;
    private final DeadLetterPolicy policy;
    private final Clock clock;
    private volatile ProjectionContext<S> context;

    public DeadLetterCapability(DeadLetterStore store) {
        this(store, DeadLetterPolicy.defaultPolicy());
    }

    public DeadLetterCapability(DeadLetterStore store, DeadLetterPolicy policy) {
        this(store, policy, Clock.systemUTC(), LoggerFactory.getLogger(DeadLetterCapability.class));
    }

    public DeadLetterCapability(DeadLetterStore store, DeadLetterPolicy policy, Clock clock, Logger logger) {
        this.store = Objects.requireNonNull(store, "Dead letter store must be specified");
        this.policy = Objects.requireNonNull(policy, "Dead letter policy must be specified");
        this.clock = Objects.requireNonNull(clock);
        this.logger = Objects.requireNonNull(logger);
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

    public DeadLetterStore getStore() {
        return store;
    }

    @Override
    public CompletionStage<Void> onError(ProjectionException error, EventEnvelope event) {
        ProjectionContext<S> ctx = context;
        if (ctx == null) {
            return AsyncResult.throwing(ProjectionException.capabilityNotAttached(NAME));
        }
        int attempts = error.getAttemptCount();
        if (!policy.shouldDeadLetter(error, attempts)) {
            return AsyncResult.done();
        }
        Instant now = clock.instant();
        Throwable cause = error.getCause() == null ? error : error.getCause();
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .projectionName(ctx.getProjectionName())
                .event(event)
                .error(error)
                .attemptCount(attempts)
                .firstFailedAt(error.getFirstFailedAt().orElse(now))
                .lastFailedAt(now)
                .putMetadata("fault", error.getFault().name())
                .putMetadata("errorType", cause.getClass().getName())
                .putMetadata("errorMessage", String.valueOf(cause.getMessage()))
                .build();
        return store.store(entry).thenRun(() -> logger.info("Event {} {} of projection {} dead-lettered as {} after {}"
                + " attempt(s)", event.getEventType(), event.getEventId(), ctx.getProjectionName(), entry.getId(),
                attempts));
    }
}
