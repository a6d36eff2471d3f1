package io.github.eventfold.core;

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

import io.github.eventfold.core.store.AggregateSnapshotStore;
import io.github.eventfold.core.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Loads an aggregate from an {@link EventStore} and saves its uncommitted events there. Saving checks the version of
 * the aggregate before it writes, and commits the aggregate only after the store confirmed the write.
 */
public class EventSourcingCapability implements AggregateCapability {
    public static final String NAME = "eventSourcing";

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final AggregateRoot aggregate;
    private EventStore eventStore;
    private AggregateContext context;

    EventSourcingCapability(AggregateRoot aggregate, EventStore eventStore) {
        this.aggregate = aggregate;
        this.eventStore = eventStore;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void attach(AggregateContext context) {
        this.context = context;
    }

    @Override
    public void detach() {
        this.context = null;
    }

    public void setEventStore(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public Optional<EventStore> getEventStore() {
        return Optional.ofNullable(eventStore);
    }

    public boolean hasEventStore() {
        return eventStore != null;
    }

    /**
     * Replay all stored events of the aggregate. Aggregate without stored events is left untouched.
     * @return stage completing when the aggregate is loaded
     */
    public CompletionStage<Void> load() {
        return AsyncResult.compose(() -> requireStore().getEvents(aggregate.getId()).thenAccept(events -> {
            if (!events.isEmpty()) {
                aggregate.loadFromHistory(events);
                logger.debug("Loaded aggregate {} {} at version {}", aggregate.getAggregateType(),
                        aggregate.getId(), aggregate.getVersion());
            }
        }));
    }

    /**
     * Restore the aggregate from its latest snapshot, and replay the events stored after it. Enables snapshots on the
     * aggregate when a snapshot is found. Falls back to full replay when there is no snapshot.
     * @param snapshotStore store to read snapshot from
     * @return stage completing when the aggregate is loaded
     */
    public CompletionStage<Void> load(AggregateSnapshotStore snapshotStore) {
        Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        return AsyncResult.compose(() -> {
            EventStore store = requireStore();
            return snapshotStore.load(aggregate.getAggregateType(), aggregate.getId()).thenCompose(snapshot -> {
                if (!snapshot.isPresent()) {
                    return load();
                }
                aggregate.enableSnapshots().restoreFromSnapshot(snapshot.get());
                return store.getEventsAfterVersion(aggregate.getId(), snapshot.get().getVersion())
                        .thenAccept(aggregate::replayHistory);
            });
        });
    }

    /**
     * Save uncommitted events, expecting the store to be at aggregate's initial version.
     * @return stage completing after events are stored and aggregate committed
     */
    public CompletionStage<Void> save() {
        return save(aggregate.getInitialVersion());
    }

    /**
     * Save uncommitted events.
     * @param expectedVersion the version the caller loaded the aggregate at
     * @return stage completing after events are stored and aggregate committed. Fails with {@link AggregateException}
     * {@code VERSION_CONFLICT} if the aggregate is not at expected version, or with store exception if the store
     * rejects the events.
     */
    public CompletionStage<Void> save(long expectedVersion) {
        return AsyncResult.compose(() -> {
            EventStore store = requireStore();
            aggregate.checkVersion(expectedVersion);
            List<EventEnvelope> events = aggregate.getDomainEvents();
            if (events.isEmpty()) {
                return AsyncResult.done();
            }
            return store.saveEvents(aggregate.getId(), events, expectedVersion).thenRun(() -> {
                aggregate.commit();
                logger.debug("Saved {} events of aggregate {} {}, now at version {}", events.size(),
                        aggregate.getAggregateType(), aggregate.getId(), aggregate.getVersion());
            });
        });
    }

    /**
     * Read events of the aggregate stored after a version.
     * @param version version to read after
     * @return stored events
     */
    public CompletionStage<List<EventEnvelope>> eventsAfter(long version) {
        return AsyncResult.compose(() -> requireStore().getEventsAfterVersion(aggregate.getId(), version));
    }

    private EventStore requireStore() {
        if (context == null) {
            throw AggregateException.capabilityNotAttached(NAME);
        }
        if (eventStore == null) {
            throw AggregateException.eventStoreNotConfigured(aggregate.getAggregateType());
        }
        return eventStore;
    }
}
