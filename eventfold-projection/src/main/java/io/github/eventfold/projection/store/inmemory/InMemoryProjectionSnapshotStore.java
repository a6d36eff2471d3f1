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
import io.github.eventfold.projection.store.ProjectionSnapshot;
import io.github.eventfold.projection.store.ProjectionSnapshotStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps all snapshots of each projection in memory, in order of saving.
 */
public class InMemoryProjectionSnapshotStore<S> implements ProjectionSnapshotStore<S> {
    private final ConcurrentMap<String, List<ProjectionSnapshot<S>>> storage = new ConcurrentHashMap<>();

    private List<ProjectionSnapshot<S>> snapshots(String projectionName) {
        return storage.computeIfAbsent(projectionName, (n) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public CompletionStage<Void> save(ProjectionSnapshot<S> snapshot) {
        snapshots(snapshot.getProjectionName()).add(snapshot);
        return AsyncResult.done();
    }

    @Override
    public CompletionStage<Optional<ProjectionSnapshot<S>>> load(String projectionName) {
        List<ProjectionSnapshot<S>> list = snapshots(projectionName);
        synchronized (list) {
            return AsyncResult.returning(list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1)));
        }
    }

    @Override
    public CompletionStage<Optional<ProjectionSnapshot<S>>> loadLatest(String projectionName) {
        List<ProjectionSnapshot<S>> list = snapshots(projectionName);
        synchronized (list) {
            return AsyncResult.returning(list.stream().max(Comparator.comparingLong(ProjectionSnapshot::getVersion)));
        }
    }

    @Override
    public CompletionStage<Void> delete(String projectionName) {
        storage.remove(projectionName);
        return AsyncResult.done();
    }

    @Override
    public CompletionStage<Integer> deleteOlderThan(String projectionName, Instant cutoff) {
        List<ProjectionSnapshot<S>> list = snapshots(projectionName);
        synchronized (list) {
            int before = list.size();
            list.removeIf(s -> s.getTimestamp().isBefore(cutoff));
            return AsyncResult.returning(before - list.size());
        }
    }

    public int count(String projectionName) {
        return snapshots(projectionName).size();
    }
}
