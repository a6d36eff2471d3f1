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

import java.time.Clock;
import java.util.Optional;

/**
 * Creates and restores snapshots of an aggregate. Enabled by {@link AggregateRoot#enableSnapshots()}, the aggregate
 * provides the state through {@link AggregateRoot#serializeState()} and {@link AggregateRoot#deserializeState(Object)}.
 */
public class SnapshotCapability implements AggregateCapability {
    public static final String NAME = "snapshot";

    private final AggregateRoot aggregate;
    private final Clock clock;
    private AggregateContext context;
    private Object previousState;

    SnapshotCapability(AggregateRoot aggregate) {
        this(aggregate, Clock.systemUTC());
    }

    SnapshotCapability(AggregateRoot aggregate, Clock clock) {
        this.aggregate = aggregate;
        this.clock = clock;
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
        this.previousState = null;
    }

    public AggregateSnapshot createSnapshot() {
        ensureAttached();
        Object state = aggregate.captureState();
        if (state == null) {
            throw AggregateException.methodNotImplemented("serializeState", context.getAggregateType());
        }
        return new AggregateSnapshot(context.getAggregateId(), context.getVersion(), context.getAggregateType(),
                state, clock.instant(), aggregate.snapshotMetadata(), aggregate.getLastEventId().orElse(null));
    }

    public void restoreFromSnapshot(AggregateSnapshot snapshot) {
        ensureAttached();
        String type = context.getAggregateType();
        if (snapshot == null) {
            throw AggregateException.invalidSnapshot(type, "snapshot is missing");
        }
        if (snapshot.getState() == null) {
            throw AggregateException.invalidSnapshot(type, "snapshot state is missing");
        }
        if (snapshot.getVersion() < 0) {
            throw AggregateException.invalidSnapshot(type, "snapshot version " + snapshot.getVersion()
                    + " is negative");
        }
        if (!snapshot.getAggregateId().equals(context.getAggregateId())) {
            throw AggregateException.idMismatch(snapshot.getAggregateId(), context.getAggregateId());
        }
        if (!snapshot.getAggregateType().equals(type)) {
            throw AggregateException.typeMismatch(snapshot.getAggregateType(), type);
        }
        aggregate.restoreState(snapshot.getState(), snapshot.getVersion());
        aggregate.setLastEventId(snapshot.getLastEventId().orElse(null));
    }

    /**
     * Remember current state of the aggregate, to be later picked up by {@link #takePreviousState()}.
     */
    public void saveState() {
        ensureAttached();
        this.previousState = aggregate.captureState();
    }

    /**
     * Return the state remembered by {@link #saveState()} and forget it.
     * @return the state, if any was saved and aggregate supports snapshots
     */
    public Optional<Object> takePreviousState() {
        Object state = previousState;
        previousState = null;
        return Optional.ofNullable(state);
    }

    private void ensureAttached() {
        if (context == null) {
            throw AggregateException.capabilityNotAttached(NAME);
        }
    }
}
