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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of an aggregate state at certain version.
 */
public final class AggregateSnapshot {
    private final String aggregateId;
    private final long version;
    private final String aggregateType;
    private final Object state;
    private final Instant timestamp;
    private final Map<String, Object> metadata;
    private final String lastEventId;

    public AggregateSnapshot(String aggregateId, long version, String aggregateType, Object state, Instant timestamp,
            Map<String, Object> metadata, String lastEventId) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.version = version;
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.state = state;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.lastEventId = lastEventId;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * The state, as produced by the aggregate, or as deserialized by a store.
     * @return the state
     */
    public Object getState() {
        return state;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Identity of the last event the snapshot reflects.
     * @return event id, if known
     */
    public Optional<String> getLastEventId() {
        return Optional.ofNullable(lastEventId);
    }

    public AggregateSnapshot withState(Object state) {
        return new AggregateSnapshot(aggregateId, version, aggregateType, state, timestamp, metadata, lastEventId);
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" + "aggregateId='" + aggregateId + '\'' + ", version=" + version
                + ", aggregateType='" + aggregateType + '\'' + ", timestamp=" + timestamp + ", lastEventId="
                + lastEventId + '}';
    }
}
