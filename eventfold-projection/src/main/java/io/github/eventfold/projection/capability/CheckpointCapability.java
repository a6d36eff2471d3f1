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
import io.github.eventfold.projection.ProjectionContext;
import io.github.eventfold.projection.store.CheckpointStore;
import io.github.eventfold.projection.store.ProjectionCheckpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletionStage;

/**
 * Saves a checkpoint every {@code interval} applied events, and optionally when a rebuild completes.
 */
public class CheckpointCapability<S> extends IntervalCapability<S> {
    public static final String NAME = "checkpoint";
    public static final int DEFAULT_INTERVAL = 100;

    private final CheckpointStore<S> store;
    private final boolean saveOnRebuildComplete;
    private final Clock clock;

    public CheckpointCapability(CheckpointStore<S> store) {
        this(store, DEFAULT_INTERVAL, true);
    }

    public CheckpointCapability(CheckpointStore<S> store, int interval, boolean saveOnRebuildComplete) {
        this(store, interval, saveOnRebuildComplete, Clock.systemUTC(),
                LoggerFactory.getLogger(CheckpointCapability.class));
    }

    public CheckpointCapability(CheckpointStore<S> store, int interval, boolean saveOnRebuildComplete, Clock clock,
            Logger logger) {
        super(NAME, interval, logger);
        this.store = Objects.requireNonNull(store, "Checkpoint store must be specified");
        this.saveOnRebuildComplete = saveOnRebuildComplete;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    protected CompletionStage<Void> handleInterval(S state, long position, long processedEvents) {
        return save(state, position, processedEvents);
    }

    @Override
    public CompletionStage<Void> onRebuildComplete(S state) {
        if (!saveOnRebuildComplete) {
            return AsyncResult.done();
        }
        return AsyncResult.compose(() -> save(state, getLastPosition(), getProcessedEvents()));
    }

    private CompletionStage<Void> save(S state, long position, long processedEvents) {
        ProjectionContext<S> ctx = ensureAttached();
        ProjectionCheckpoint<S> checkpoint = new ProjectionCheckpoint<>(ctx.getProjectionName(), state, position,
                clock.instant(), processedEvents);
        return store.save(checkpoint).thenRun(() -> logger.debug("Saved {}", checkpoint));
    }

    public CompletionStage<Optional<ProjectionCheckpoint<S>>> loadCheckpoint() {
        return AsyncResult.compose(() -> store.load(ensureAttached().getProjectionName()));
    }

    /**
     * Write the checkpointed state back to the projection store.
     * @return position to resume processing after, empty when there is no checkpoint
     */
    public CompletionStage<OptionalLong> restore() {
        return AsyncResult.compose(() -> {
            ProjectionContext<S> ctx = ensureAttached();
            return store.load(ctx.getProjectionName()).thenCompose(checkpoint -> {
                if (!checkpoint.isPresent()) {
                    return AsyncResult.returning(OptionalLong.empty());
                }
                ProjectionCheckpoint<S> cp = checkpoint.get();
                return ctx.getStore().save(ctx.getProjectionName(), cp.getState()).thenApply(v -> {
                    logger.info("Projection {} restored from checkpoint at position {}", ctx.getProjectionName(),
                            cp.getPosition());
                    return OptionalLong.of(cp.getPosition());
                });
            });
        });
    }
}
