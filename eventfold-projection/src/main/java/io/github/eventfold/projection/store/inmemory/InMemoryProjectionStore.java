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
import io.github.eventfold.projection.store.ProjectionStore;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps projection state in memory.
 */
public class InMemoryProjectionStore<S> implements ProjectionStore<S> {
    private final ConcurrentMap<String, S> storage = new ConcurrentHashMap<>();

    @Override
    public CompletionStage<Optional<S>> load(String projectionName) {
        return AsyncResult.returning(Optional.ofNullable(storage.get(projectionName)));
    }

    @Override
    public CompletionStage<Void> save(String projectionName, S state) {
        Objects.requireNonNull(state, "Projection state must not be null");
        storage.put(projectionName, state);
        return AsyncResult.done();
    }

    @Override
    public CompletionStage<Void> delete(String projectionName) {
        storage.remove(projectionName);
        return AsyncResult.done();
    }

    public int size() {
        return storage.size();
    }
}
