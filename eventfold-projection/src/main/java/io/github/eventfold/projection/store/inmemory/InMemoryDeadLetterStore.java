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
import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.projection.ProjectionException;
import io.github.eventfold.projection.store.DeadLetterEntry;
import io.github.eventfold.projection.store.DeadLetterStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

import static java.util.stream.Collectors.toList;

/**
 * Keeps dead letters in memory, in the order they were stored.
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {
    private final Map<String, DeadLetterEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized CompletionStage<Void> store(DeadLetterEntry entry) {
        entries.put(entry.getId(), entry);
        return AsyncResult.done();
    }

    @Override
    public synchronized CompletionStage<List<DeadLetterEntry>> getByProjection(String projectionName) {
        return AsyncResult.returning(entries.values().stream()
                .filter(e -> e.getProjectionName().equals(projectionName))
                .collect(toList()));
    }

    @Override
    public synchronized CompletionStage<Optional<DeadLetterEntry>> get(String id) {
        return AsyncResult.returning(Optional.ofNullable(entries.get(id)));
    }

    @Override
    public synchronized CompletionStage<EventEnvelope> retry(String id) {
        DeadLetterEntry entry = entries.get(id);
        if (entry == null) {
            return AsyncResult.throwing(ProjectionException.deadLetterNotFound(id));
        }
        return AsyncResult.returning(entry.getEvent());
    }

    @Override
    public synchronized CompletionStage<Void> delete(String id) {
        entries.remove(id);
        return AsyncResult.done();
    }

    public synchronized List<DeadLetterEntry> getAll() {
        return new ArrayList<>(entries.values());
    }

    public synchronized int size() {
        return entries.size();
    }
}
