package io.github.eventfold.projection.store.inmemory;

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
import io.github.eventfold.projection.store.CheckpointStore;
import io.github.eventfold.projection.store.ProjectionCheckpoint;

import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the last checkpoint of each projection in memory.
 */
public class InMemoryCheckpointStore<S> implements CheckpointStore<S> {
    private final ConcurrentMap<String, ProjectionCheckpoint<S>> storage = new ConcurrentHashMap<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public CompletionStage<Void> save(ProjectionCheckpoint<S> checkpoint) {
        storage.put(checkpoint.getProjectionName(), checkpoint);
        saves.incrementAndGet();
        return AsyncResult.done();
    }

    @Override
    public CompletionStage<Optional<ProjectionCheckpoint<S>>> load(String projectionName) {
        return AsyncResult.returning(Optional.ofNullable(storage.get(projectionName)));
    }

    @Override
    public CompletionStage<Void> delete(String projectionName) {
        storage.remove(projectionName);
        return AsyncResult.done();
    }

    /**
     * Number of checkpoints saved since creation of the store.
     * @return save count
     */
    public int getSaveCount() {
        return saves.get();
    }
}
