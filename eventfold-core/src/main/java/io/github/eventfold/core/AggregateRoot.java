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

import io.github.eventfold.core.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An event sourced aggregate. The aggregate changes its state <strong>only</strong> by applying events, that are
 * dispatched to handlers the subclass declares in {@link #eventHandlers()}. Mutator methods of the subclass validate
 * the command and call one of the {@code apply} methods.
 *
 * <p>Every applied event increments {@linkplain #getVersion() version} by one and is kept as uncommitted until
 * {@link #commit()} is called by whoever persisted it. {@linkplain #getInitialVersion() Initial version} is the
 * version of last commit or load, and serves as baseline for optimistic concurrency.</p>
 *
 * <p>Optional behavior is added through {@linkplain AggregateCapability capabilities}. The built-in ones are enabled
 * with {@link #enableSnapshots()}, {@link #enableVersioning()}, {@link #enableAudit()} and
 * {@link #enableEventSourcing(EventStore)}, and reached through the accessors of the same kind.</p>
 *
 * <p>An aggregate instance is not thread safe. Only single thread may apply events to it at a time.</p>
 */
public abstract class AggregateRoot {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String id;
    private long version;
    private long initialVersion;
    private String lastEventId;
    private final List<EventEnvelope> uncommittedEvents = new ArrayList<>();
    private final Map<String, AggregateCapability> capabilities = new LinkedHashMap<>();
    private final AggregateContext context = new Context();

    /**
     * Constructor of new aggregate.
     * @param id the identity of the aggregate
     */
    protected AggregateRoot(String id) {
        this(id, 0);
    }

    /**
     * Constructor of aggregate, that is known to be at given version.
     * @param id the identity of the aggregate
     * @param version the version the aggregate is in
     */
    protected AggregateRoot(String id, long version) {
        if (id == null || id.trim().isEmpty()) {
            throw AggregateException.invalidArguments("aggregate id must be specified");
        }
        if (version < 0) {
            throw AggregateException.invalidArguments("aggregate version cannot be negative, was " + version);
        }
        this.id = id;
        this.version = version;
        this.initialVersion = version;
    }

    public final String getId() {
        return id;
    }

    /**
     * Type of the aggregate, as recorded into event metadata and snapshots.
     * @return simple name of the aggregate class
     */
    public String getAggregateType() {
        return getClass().getSimpleName();
    }

    public final long getVersion() {
        return version;
    }

    public final long getInitialVersion() {
        return initialVersion;
    }

    public final boolean hasChanges() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Events applied since last commit.
     * @return copy of uncommitted events in order of application
     */
    public final List<EventEnvelope> getDomainEvents() {
        return new ArrayList<>(uncommittedEvents);
    }

    /**
     * Mark all uncommitted events as persisted. Must only be called after the events were durably stored.
     */
    public final void commit() {
        this.initialVersion = this.version;
        this.uncommittedEvents.clear();
    }

    /**
     * Optimistic concurrency check to perform before persisting the uncommitted events.
     * @param expectedVersion the version the caller expects the aggregate was loaded at
     * @throws AggregateException with fault {@code VERSION_CONFLICT} if initial version differs
     */
    public final void checkVersion(long expectedVersion) {
        if (initialVersion != expectedVersion) {
            throw AggregateException.versionConflict(getAggregateType(), id, initialVersion, expectedVersion);
        }
    }

    /**
     * Handlers of events of this aggregate. It is called on every dispatch, so implementations should build the table
     * once, preferably in a field initializer.
     * @return the handler table
     */
    protected abstract EventHandlers eventHandlers();

    protected final EventEnvelope apply(String eventType) {
        return apply(eventType, null);
    }

    protected final EventEnvelope apply(String eventType, Object payload) {
        return apply(eventType, payload, EventMetadata.create());
    }

    /**
     * Apply new event to the aggregate.
     * @param eventType type of the event
     * @param payload the payload, may be null
     * @param metadata metadata to enrich
     * @return applied event, with enriched metadata
     * @throws AggregateException with fault {@code INVALID_ARGUMENTS} when type or metadata is missing
     */
    protected final EventEnvelope apply(String eventType, Object payload, EventMetadata metadata) {
        if (eventType == null || eventType.trim().isEmpty()) {
            throw AggregateException.invalidArguments("event type must be a non-empty string");
        }
        if (metadata == null) {
            throw AggregateException.invalidArguments("metadata of " + eventType + " must be specified");
        }
        return doApply(EventEnvelope.of(eventType, payload, metadata));
    }

    protected final EventEnvelope apply(EventEnvelope event) {
        if (event == null) {
            throw AggregateException.invalidArguments("event must be specified");
        }
        if (event.getEventType().trim().isEmpty()) {
            throw AggregateException.invalidArguments("event type must be a non-empty string");
        }
        return doApply(event);
    }

    /**
     * Apply payload as an event, with type derived from its class name.
     * @param payload the payload
     * @return applied event
     * @see EventType#defaultTypeName(Class)
     */
    protected final EventEnvelope applyEvent(Object payload) {
        if (payload == null) {
            throw AggregateException.invalidArguments("payload must be specified");
        }
        if (payload instanceof EventEnvelope) {
            return apply((EventEnvelope) payload);
        }
        return doApply(EventEnvelope.wrap(payload));
    }

    private EventEnvelope doApply(EventEnvelope raw) {
        long nextVersion = version + 1;
        EventEnvelope event = raw.withMetadata(raw.getMetadata().enrichedFor(id, getAggregateType(), nextVersion));
        List<AggregateCapability> hooks = new ArrayList<>(capabilities.values());
        for (AggregateCapability hook : hooks) {
            hook.onBeforeApply(event);
        }
        String previousEventId = lastEventId;
        version = nextVersion;
        uncommittedEvents.add(event);
        lastEventId = event.getEventId();
        try {
            dispatch(event);
        } catch (RuntimeException e) {
            // the event did not happen
            uncommittedEvents.remove(uncommittedEvents.size() - 1);
            version = nextVersion - 1;
            lastEventId = previousEventId;
            for (AggregateCapability hook : hooks) {
                try {
                    hook.onError(event, e);
                } catch (RuntimeException hookFailure) {
                    logger.warn("Capability {} of aggregate {} failed handling error of event {}", hook.getName(), id,
                            event.getEventType(), hookFailure);
                    e.addSuppressed(hookFailure);
                }
            }
            throw e;
        }
        for (AggregateCapability hook : hooks) {
            hook.onAfterApply(event);
        }
        return event;
    }

    private void dispatch(EventEnvelope event) {
        handle(upcast(event));
    }

    private EventEnvelope upcast(EventEnvelope event) {
        return versioning().map(v -> v.upcast(event)).orElse(event);
    }

    private void handle(EventEnvelope current) {
        Optional<Consumer<EventEnvelope>> handler = eventHandlers().resolve(current.getEventType(),
                current.getEventVersion());
        if (handler.isPresent()) {
            handler.get().accept(current);
        } else {
            logger.debug("Aggregate {} has no handler for event {} version {}", getAggregateType(),
                    current.getEventType(), current.getEventVersion());
        }
    }

    /**
     * Rehydrate the aggregate from its event log. Events pass the handlers again, but are not recorded as
     * uncommitted, and capability hooks are not invoked. When an event cannot be upcasted or handled, the aggregate
     * stays as it was before the call.
     * @param events all events of the aggregate, in order
     * @throws AggregateException when an event belongs to different aggregate, or cannot be upcasted
     */
    public final void loadFromHistory(List<EventEnvelope> events) {
        Objects.requireNonNull(events, "Events must be specified");
        replay(events, true);
    }

    /**
     * Replay events that follow the current version, e. g. after restoring a snapshot.
     * @param events events past current version, in order
     */
    final void replayHistory(List<EventEnvelope> events) {
        if (hasChanges()) {
            throw AggregateException.invalidArguments("cannot replay history into aggregate " + id
                    + " with uncommitted events");
        }
        replay(events, false);
    }

    private void replay(List<EventEnvelope> events, boolean fromScratch) {
        verifyOwnership(events);
        // upcasting all events first, so that missing upcaster fails before anything changed
        List<EventEnvelope> upcasted = new ArrayList<>(events.size());
        for (EventEnvelope event : events) {
            upcasted.add(upcast(event));
        }
        long previousVersion = version;
        long previousInitialVersion = initialVersion;
        String previousLastEventId = lastEventId;
        List<EventEnvelope> previousUncommitted = new ArrayList<>(uncommittedEvents);
        Object previousState = serializeState();
        if (fromScratch) {
            version = 0;
            uncommittedEvents.clear();
            lastEventId = null;
        }
        try {
            for (int i = 0; i < events.size(); i++) {
                EventEnvelope event = events.get(i);
                handle(upcasted.get(i));
                version++;
                lastEventId = event.getEventId();
                if (event.getMetadata().getAggregateVersion().isPresent()
                        && event.getMetadata().getAggregateVersion().getAsLong() != version) {
                    logger.warn("Event {} of aggregate {} replayed as version {}, but was recorded as {}",
                            event.getEventId(), id, version, event.getMetadata().getAggregateVersion().getAsLong());
                }
            }
        } catch (RuntimeException e) {
            version = previousVersion;
            initialVersion = previousInitialVersion;
            lastEventId = previousLastEventId;
            uncommittedEvents.clear();
            uncommittedEvents.addAll(previousUncommitted);
            if (previousState == null) {
                logger.warn("Aggregate {} {} does not provide its state, state after failed replay is incomplete",
                        getAggregateType(), id);
            } else {
                try {
                    deserializeState(previousState);
                } catch (RuntimeException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
            }
            throw e;
        }
        initialVersion = version;
    }

    private void verifyOwnership(List<EventEnvelope> events) {
        for (EventEnvelope event : events) {
            Objects.requireNonNull(event, "History cannot contain null events");
            EventMetadata metadata = event.getMetadata();
            boolean foreignType = metadata.getAggregateType().map(t -> !t.equals(getAggregateType())).orElse(false);
            boolean foreignId = metadata.getAggregateId().map(i -> !i.equals(id)).orElse(false);
            if (foreignType || foreignId) {
                throw AggregateException.foreignEvent(getAggregateType(), id, event);
            }
        }
    }

    /**
     * Return serializable representation of the state, that will be stored in a snapshot. The returned object should
     * not share mutable structures with the aggregate.
     * @return state of the aggregate, null if snapshots are not supported
     */
    protected Object serializeState() {
        return null;
    }

    /**
     * Initialize the state from snapshot.
     * @param state the state as returned by {@link #serializeState()}, possibly after it passed a store
     */
    protected void deserializeState(Object state) {
        throw AggregateException.methodNotImplemented("deserializeState", getAggregateType());
    }

    /**
     * Additional metadata to store along snapshot of the aggregate.
     * @return metadata, empty by default
     */
    protected Map<String, Object> snapshotMetadata() {
        return Collections.emptyMap();
    }

    final Object captureState() {
        return serializeState();
    }

    final void restoreState(Object state, long restoredVersion) {
        deserializeState(state);
        this.version = restoredVersion;
        this.initialVersion = restoredVersion;
        this.uncommittedEvents.clear();
    }

    final Optional<String> getLastEventId() {
        return Optional.ofNullable(lastEventId);
    }

    final void setLastEventId(String eventId) {
        this.lastEventId = eventId;
    }

    /**
     * Create snapshot of current state.
     * @return the snapshot
     * @throws AggregateException {@code FEATURE_NOT_ENABLED} if snapshots were not enabled,
     * {@code METHOD_NOT_IMPLEMENTED} if the aggregate does not provide its state
     */
    public AggregateSnapshot createSnapshot() {
        return snapshots().orElseThrow(() -> AggregateException.featureNotEnabled(SnapshotCapability.NAME,
                getAggregateType())).createSnapshot();
    }

    /**
     * Restore state from a snapshot of this aggregate.
     * @param snapshot the snapshot
     * @throws AggregateException {@code FEATURE_NOT_ENABLED} if snapshots were not enabled, {@code ID_MISMATCH} or
     * {@code TYPE_MISMATCH} if snapshot was taken of different aggregate
     */
    public void restoreFromSnapshot(AggregateSnapshot snapshot) {
        snapshots().orElseThrow(() -> AggregateException.featureNotEnabled(SnapshotCapability.NAME,
                getAggregateType())).restoreFromSnapshot(snapshot);
    }

    /**
     * Add capability under its own name.
     * @param capability capability to add
     * @see #addCapability(String, AggregateCapability)
     */
    public final void addCapability(AggregateCapability capability) {
        Objects.requireNonNull(capability, "Capability must be specified");
        addCapability(capability.getName(), capability);
    }

    /**
     * Attach the capability and register it under given name. Adding the same instance again has no effect, other
     * capability registered under the name is detached and replaced.
     * @param name the name of capability
     * @param capability capability to add
     */
    public final void addCapability(String name, AggregateCapability capability) {
        Objects.requireNonNull(name, "Capability name must be specified");
        Objects.requireNonNull(capability, "Capability must be specified");
        AggregateCapability existing = capabilities.get(name);
        if (existing == capability) {
            return;
        }
        capability.attach(context);
        capabilities.put(name, capability);
        if (existing != null) {
            existing.detach();
        }
    }

    public final boolean removeCapability(String name) {
        AggregateCapability removed = capabilities.remove(name);
        if (removed != null) {
            removed.detach();
            return true;
        }
        return false;
    }

    public final boolean hasCapability(String name) {
        return capabilities.containsKey(name);
    }

    public final <T extends AggregateCapability> Optional<T> getCapability(String name, Class<T> type) {
        return Optional.ofNullable(capabilities.get(name)).filter(type::isInstance).map(type::cast);
    }

    public final Optional<SnapshotCapability> snapshots() {
        return getCapability(SnapshotCapability.NAME, SnapshotCapability.class);
    }

    public final Optional<VersioningCapability> versioning() {
        return getCapability(VersioningCapability.NAME, VersioningCapability.class);
    }

    public final Optional<AuditCapability> audit() {
        return getCapability(AuditCapability.NAME, AuditCapability.class);
    }

    public final Optional<EventSourcingCapability> eventSourcing() {
        return getCapability(EventSourcingCapability.NAME, EventSourcingCapability.class);
    }

    public final SnapshotCapability enableSnapshots() {
        Optional<SnapshotCapability> existing = snapshots();
        if (existing.isPresent()) {
            return existing.get();
        }
        SnapshotCapability capability = new SnapshotCapability(this);
        addCapability(capability);
        return capability;
    }

    public final VersioningCapability enableVersioning() {
        Optional<VersioningCapability> existing = versioning();
        if (existing.isPresent()) {
            return existing.get();
        }
        VersioningCapability capability = new VersioningCapability();
        addCapability(capability);
        return capability;
    }

    public final AuditCapability enableAudit() {
        Optional<AuditCapability> existing = audit();
        if (existing.isPresent()) {
            return existing.get();
        }
        AuditCapability capability = new AuditCapability();
        addCapability(capability);
        return capability;
    }

    /**
     * Enable persistence of the aggregate in an event store. When already enabled, the store is replaced.
     * @param eventStore the store to use
     * @return the event sourcing capability
     */
    public final EventSourcingCapability enableEventSourcing(EventStore eventStore) {
        Optional<EventSourcingCapability> existing = eventSourcing();
        if (existing.isPresent()) {
            existing.get().setEventStore(eventStore);
            return existing.get();
        }
        EventSourcingCapability capability = new EventSourcingCapability(this, eventStore);
        addCapability(capability);
        return capability;
    }

    @Override
    public String toString() {
        return getAggregateType() + "{" + "id='" + id + '\'' + ", version=" + version + ", initialVersion="
                + initialVersion + ", uncommittedEvents=" + uncommittedEvents.size() + ", capabilities="
                + capabilities.keySet() + '}';
    }

    private class Context implements AggregateContext {

        @Override
        public String getAggregateId() {
            return id;
        }

        @Override
        public String getAggregateType() {
            return AggregateRoot.this.getAggregateType();
        }

        @Override
        public long getVersion() {
            return version;
        }

        @Override
        public long getInitialVersion() {
            return initialVersion;
        }

        @Override
        public List<EventEnvelope> getDomainEvents() {
            return AggregateRoot.this.getDomainEvents();
        }

        @Override
        public <T extends AggregateCapability> Optional<T> capability(String name, Class<T> type) {
            return getCapability(name, type);
        }
    }
}
