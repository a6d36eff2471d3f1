package io.github.eventfold.core.store.inmemory;

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
import io.github.eventfold.core.store.EventStore;
import io.github.eventfold.core.store.EventStoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps events in memory. Suitable for tests, and for aggregates that do not need to survive restart.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, List<EventEnvelope>> storage = new ConcurrentHashMap<>();

    private List<EventEnvelope> aggregateLog(String aggregateId) {
        return storage.computeIfAbsent(aggregateId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public CompletionStage<List<EventEnvelope>> getEvents(String aggregateId) {
        return getEventsAfterVersion(aggregateId, 0);
    }

    @Override
    public CompletionStage<List<EventEnvelope>> getEventsAfterVersion(String aggregateId, long version) {
        List<EventEnvelope> events = aggregateLog(aggregateId);
        //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
        synchronized (events) {
            int from = (int) Math.min(Math.max(version, 0), events.size());
            return AsyncResult.returning(new ArrayList<>(events.subList(from, events.size())));
        }
    }

    @Override
    public CompletionStage<Void> saveEvents(String aggregateId, List<EventEnvelope> events, long expectedVersion) {
        for (EventEnvelope event : events) {
            if (event.getMetadata().getAggregateId().map(id -> !id.equals(aggregateId)).orElse(false)) {
                return AsyncResult.throwing(EventStoreException.multipleAggregates(aggregateId, event));
            }
        }
        List<EventEnvelope> log = aggregateLog(aggregateId);
        synchronized (log) {
            if (log.size() != expectedVersion) {
                return AsyncResult.throwing(EventStoreException.optimisticLock(aggregateId, expectedVersion,
                        log.size()));
            }
            log.addAll(events);
        }
        return AsyncResult.done();
    }

    /**
     * Number of events stored for an aggregate.
     * @param aggregateId identity of the aggregate
     * @return stored version of the aggregate
     */
    public long getStoredVersion(String aggregateId) {
        List<EventEnvelope> log = storage.get(aggregateId);
        return log == null ? 0 : log.size();
    }
}
