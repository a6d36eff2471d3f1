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
import io.github.eventfold.projection.store.ProjectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds events into a {@link Projection} and persists the resulting state. Every event of interest goes through
 * <ol>
 *     <li>loading current state, initial state is created and persisted on first use</li>
 *     <li>before hooks of capabilities, sequentially</li>
 *     <li>the projection function</li>
 *     <li>persisting the new state</li>
 *     <li>after hooks of capabilities, concurrently</li>
 * </ol>
 * Any failure is wrapped into {@link ProjectionException}, passed to error hooks of the capabilities and then
 * propagated to the caller.
 *
 * <p>The engine is the only writer of its projection's state. Callers must not submit next event before the stage of
 * previous one completed.</p>
 *
 * @param <S> type of the projection state
 */
public class ProjectionEngine<S> {
    protected final Logger logger;
    private final Projection<S> projection;
    private final ProjectionStore<S> store;
    private final Map<String, ProjectionCapability<S>> capabilities = new LinkedHashMap<>();
    private final ProjectionContext<S> context = new Context();

    public ProjectionEngine(Projection<S> projection, ProjectionStore<S> store) {
        this(projection, store, LoggerFactory.getLogger(ProjectionEngine.class));
    }

    public ProjectionEngine(Projection<S> projection, ProjectionStore<S> store, Logger logger) {
        this.projection = Objects.requireNonNull(projection, "Projection must be specified");
        this.store = Objects.requireNonNull(store, "Projection store must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
    }

    public String getProjectionName() {
        return projection.getName();
    }

    public Projection<S> getProjection() {
        return projection;
    }

    public ProjectionStore<S> getStore() {
        return store;
    }

    public boolean isInterestedIn(EventEnvelope event) {
        return projection.handles(event.getEventType());
    }

    /**
     * Process single event. Events the projection is not interested in are ignored.
     * @param event event to process
     * @return stage completing after state is persisted and all after hooks completed, or failing with
     * {@link ProjectionException} after error hooks ran
     */
    public CompletionStage<Void> processEvent(EventEnvelope event) {
        Objects.requireNonNull(event, "Event must be specified");
        if (!isInterestedIn(event)) {
            return AsyncResult.done();
        }
        List<ProjectionCapability<S>> hooks = capabilities();
        return AsyncResult.compose(() -> applyOnce(event, hooks))
                .thenCompose(newState -> afterApply(event, newState, hooks))
                .handle((r, t) -> t)
                .thenCompose(t -> {
                    if (t == null) {
                        return AsyncResult.done();
                    }
                    ProjectionException error = toProjectionError(t, event);
                    return reportError(error, event, hooks).thenCompose(v -> AsyncResult.<Void>throwing(error));
                });
    }

    /**
     * Current state of the projection. Initial state is created and persisted if the store has none.
     * @return current state
     */
    public CompletionStage<S> getState() {
        return AsyncResult.compose(() -> store.load(getProjectionName())).thenCompose(existing -> {
            if (existing.isPresent()) {
                return AsyncResult.returning(existing.get());
            }
            S initial = initialState();
            return store.save(getProjectionName(), initial).thenApply(v -> initial);
        });
    }

    /**
     * Replace the stored state with initial state, then let capabilities reset, one after another.
     * @return stage completing when the initial state is persisted and {@link ProjectionCapability#onReset(Object)}
     * hooks completed
     */
    public CompletionStage<Void> reset() {
        return AsyncResult.invoke(this::initialState).thenCompose(initial -> store.save(getProjectionName(), initial)
                .thenCompose(v -> {
                    CompletionStage<Void> chain = AsyncResult.done();
                    for (ProjectionCapability<S> hook : capabilities()) {
                        chain = chain.thenCompose(x -> hook.onReset(initial));
                    }
                    return chain;
                }));
    }

    /**
     * Materialize the projection from scratch. The state is reset, then events are processed one by one in order of
     * the iterable. Processing stops at first event that fails.
     * @param events complete, ordered event history
     * @return the final state
     */
    public CompletionStage<S> rebuild(Iterable<EventEnvelope> events) {
        Objects.requireNonNull(events, "Events must be specified");
        return rebuild(EventSource.of(events));
    }

    /**
     * Materialize the projection from scratch, pulling events from a source until it is exhausted.
     * @param source ordered source positioned at the start of event history
     * @return the final state, after {@link ProjectionCapability#onRebuildComplete(Object)} hooks completed
     */
    public CompletionStage<S> rebuild(EventSource source) {
        Objects.requireNonNull(source, "Event source must be specified");
        logger.info("Rebuilding projection {}", getProjectionName());
        return reset()
                .thenCompose(v -> drain(source))
                .thenCompose(processed -> getState().thenCompose(state -> {
                    logger.info("Rebuilt projection {} from {} events", getProjectionName(), processed);
                    CompletionStage<Void> chain = AsyncResult.done();
                    for (ProjectionCapability<S> hook : capabilities()) {
                        chain = chain.thenCompose(x -> hook.onRebuildComplete(state));
                    }
                    return chain.thenApply(x -> state);
                }));
    }

    private CompletionStage<Long> drain(EventSource source) {
        CompletableFuture<Long> done = new CompletableFuture<>();
        pump(source, new AtomicLong(), done);
        return done;
    }

    // continues in a loop while the source and processing complete synchronously, so long histories do not grow
    // the stack
    private void pump(EventSource source, AtomicLong processed, CompletableFuture<Long> done) {
        while (true) {
            CompletableFuture<Boolean> step = AsyncResult.compose(source::next)
                    .<Boolean>thenCompose(next -> {
                        if (!next.isPresent()) {
                            return AsyncResult.returning(false);
                        }
                        EventEnvelope event = next.get();
                        if (!isInterestedIn(event)) {
                            return AsyncResult.returning(true);
                        }
                        processed.incrementAndGet();
                        return processEvent(event).thenApply(v -> true);
                    }).toCompletableFuture();
            if (!step.isDone() || step.isCompletedExceptionally()) {
                step.whenComplete((more, t) -> {
                    if (t != null) {
                        done.completeExceptionally(AsyncResult.unwrap(t));
                    } else if (more) {
                        pump(source, processed, done);
                    } else {
                        done.complete(processed.get());
                    }
                });
                return;
            }
            if (!step.join()) {
                done.complete(processed.get());
                return;
            }
        }
    }

    /**
     * Load state, run before hooks, apply the projection and persist the result.
     * @param event event to apply
     * @param hooks capabilities at the time processing started
     * @return the persisted state
     */
    protected CompletionStage<S> applyOnce(EventEnvelope event, List<ProjectionCapability<S>> hooks) {
        return getState().thenCompose(state -> {
            CompletionStage<Void> before = AsyncResult.done();
            for (ProjectionCapability<S> hook : hooks) {
                before = before.thenCompose(v -> hook.onBeforeApply(event, state));
            }
            return before
                    .thenCompose(v -> AsyncResult.compose(() -> projection.apply(state, event)))
                    .thenCompose(newState -> {
                        if (newState == null) {
                            throw new IllegalStateException("Projection " + getProjectionName()
                                    + " produced no state for " + event.getEventType());
                        }
                        return store.save(getProjectionName(), newState).thenApply(v -> newState);
                    });
        }).thenApply(newState -> {
            logger.debug("Projection {} applied {} {}", getProjectionName(), event.getEventType(),
                    event.getEventId());
            return newState;
        });
    }

    protected CompletionStage<Void> afterApply(EventEnvelope event, S newState,
            List<ProjectionCapability<S>> hooks) {
        CompletableFuture<?>[] stages = new CompletableFuture<?>[hooks.size()];
        for (int i = 0; i < stages.length; i++) {
            ProjectionCapability<S> hook = hooks.get(i);
            stages[i] = AsyncResult.compose(() -> hook.onAfterApply(event, newState)).toCompletableFuture();
        }
        return CompletableFuture.allOf(stages);
    }

    /**
     * Run error hooks one after another. Failure of a hook does not prevent the others from running, it is logged and
     * added to the error as suppressed.
     * @param error the failure of processing
     * @param event the event that failed
     * @param hooks capabilities at the time processing started
     * @return stage completing normally after all hooks ran
     */
    protected CompletionStage<Void> reportError(ProjectionException error, EventEnvelope event,
            List<ProjectionCapability<S>> hooks) {
        logger.warn("Projection {} failed to process event {} {} after {} attempt(s)", getProjectionName(),
                event.getEventType(), event.getEventId(), error.getAttemptCount(), error);
        CompletionStage<Void> chain = AsyncResult.done();
        for (ProjectionCapability<S> hook : hooks) {
            chain = chain.thenCompose(v -> AsyncResult.compose(() -> hook.onError(error, event))
                    .<Void>handle((r, t) -> {
                        if (t != null) {
                            Throwable cause = AsyncResult.unwrap(t);
                            logger.warn("Error hook of capability {} failed on projection {}", hook.getName(),
                                    getProjectionName(), cause);
                            error.addSuppressed(cause);
                        }
                        return null;
                    }));
        }
        return chain;
    }

    protected ProjectionException toProjectionError(Throwable t, EventEnvelope event) {
        Throwable cause = AsyncResult.unwrap(t);
        if (cause instanceof ProjectionException) {
            return (ProjectionException) cause;
        }
        return ProjectionException.processingFailed(getProjectionName(), event.getEventType(), cause);
    }

    private S initialState() {
        S initial = projection.createInitialState();
        if (initial == null) {
            throw ProjectionException.stateNotFound(getProjectionName());
        }
        return initial;
    }

    public ProjectionEngine<S> addCapability(ProjectionCapability<S> capability) {
        return addCapability(capability.getName(), capability);
    }

    /**
     * Attach capability under a name. A capability previously registered under the same name is detached.
     * @param name registration name
     * @param capability capability to attach
     * @return this engine
     */
    public synchronized ProjectionEngine<S> addCapability(String name, ProjectionCapability<S> capability) {
        Objects.requireNonNull(name, "Capability name must be specified");
        Objects.requireNonNull(capability, "Capability must be specified");
        ProjectionCapability<S> previous = capabilities.get(name);
        if (previous == capability) {
            return this;
        }
        capability.attach(context);
        capabilities.put(name, capability);
        if (previous != null) {
            previous.detach();
        }
        logger.debug("Capability {} attached to projection {}", name, getProjectionName());
        return this;
    }

    public synchronized boolean removeCapability(String name) {
        ProjectionCapability<S> removed = capabilities.remove(name);
        if (removed == null) {
            return false;
        }
        removed.detach();
        return true;
    }

    public synchronized boolean hasCapability(String name) {
        return capabilities.containsKey(name);
    }

    public synchronized <T> Optional<T> getCapability(String name, Class<T> type) {
        ProjectionCapability<S> capability = capabilities.get(name);
        return type.isInstance(capability) ? Optional.of(type.cast(capability)) : Optional.empty();
    }

    public synchronized Set<String> getCapabilityNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(capabilities.keySet()));
    }

    protected synchronized List<ProjectionCapability<S>> capabilities() {
        return new ArrayList<>(capabilities.values());
    }

    private class Context implements ProjectionContext<S> {
        @Override
        public String getProjectionName() {
            return ProjectionEngine.this.getProjectionName();
        }

        @Override
        public ProjectionStore<S> getStore() {
            return store;
        }
    }
}
