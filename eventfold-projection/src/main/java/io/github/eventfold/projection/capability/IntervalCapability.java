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

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Base of capabilities that act every N applied events. The action is best effort: its failure is logged and does
 * not fail processing of the event.
 *
 * @param <S> type of the projection state
 */
public abstract class IntervalCapability<S> implements ProjectionCapability<S> {
    protected final Logger logger;
    private final String name;
    private final int interval;
    private volatile ProjectionContext<S> context;
    private int eventCounter;
    private long processedEvents;
    private long lastPosition;

    protected IntervalCapability(String name, int interval, Logger logger) {
        if (interval < 1) {
            throw ProjectionException.invalidConfiguration(name + ".interval", "must be positive, got " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.logger = Objects.requireNonNull(logger);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void attach(ProjectionContext<S> context) {
        this.context = context;
    }

    @Override
    public void detach() {
        this.context = null;
    }

    public int getInterval() {
        return interval;
    }

    /**
     * Events applied since the action last ran.
     * @return event count
     */
    public synchronized int getEventCounter() {
        return eventCounter;
    }

    public synchronized long getProcessedEvents() {
        return processedEvents;
    }

    /**
     * Position of the last applied event, taken from its metadata. Events without position keep the previous value.
     * @return last known position, 0 before any positioned event
     */
    public synchronized long getLastPosition() {
        return lastPosition;
    }

    @Override
    public CompletionStage<Void> onReset(S initialState) {
        synchronized (this) {
            eventCounter = 0;
            processedEvents = 0;
            lastPosition = 0;
        }
        return AsyncResult.done();
    }

    @Override
    public CompletionStage<Void> onAfterApply(EventEnvelope event, S newState) {
        long processed;
        long position;
        synchronized (this) {
            processedEvents++;
            lastPosition = event.getMetadata().getPosition().orElse(lastPosition);
            if (++eventCounter < interval) {
                return AsyncResult.done();
            }
            eventCounter = 0;
            processed = processedEvents;
            position = lastPosition;
        }
        return AsyncResult.compose(() -> handleInterval(newState, position, processed))
                .<Void>handle((r, t) -> {
                    if (t != null) {
                        logger.warn("{} of projection {} failed at position {}", name, projectionName(), position,
                                AsyncResult.unwrap(t));
                    }
                    return null;
                });
    }

    /**
     * The periodic action.
     * @param state state after the last applied event
     * @param position position of the last applied event
     * @param processedEvents events applied since the capability was attached
     * @return stage completing when the action is done
     */
    protected abstract CompletionStage<Void> handleInterval(S state, long position, long processedEvents);

    protected ProjectionContext<S> ensureAttached() {
        ProjectionContext<S> ctx = context;
        if (ctx == null) {
            throw ProjectionException.capabilityNotAttached(name);
        }
        return ctx;
    }

    protected String projectionName() {
        ProjectionContext<S> ctx = context;
        return ctx == null ? "<detached>" : ctx.getProjectionName();
    }
}
