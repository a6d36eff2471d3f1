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

import io.github.eventfold.core.AggregateException;
import io.github.eventfold.core.AggregateSnapshot;
import io.github.eventfold.core.AsyncResult;
import io.github.eventfold.core.store.AggregateSnapshotStore;
import io.github.eventfold.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Stores snapshots in memory, with state converted to its serialized form. Snapshots therefore do not share state
 * with the aggregate they were taken from, the same way as with a durable store.
 *
 * @param <S> type of aggregate state
 */
public class InMemoryAggregateSnapshotStore<S> implements AggregateSnapshotStore {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ConcurrentMap<String, SnapshotRecord> snapshotRecords = new ConcurrentHashMap<>();
    private final Serialization<S> serialization;

    public InMemoryAggregateSnapshotStore(Serialization<S> serialization) {
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
    }

    @Override
    public CompletionStage<Void> save(AggregateSnapshot snapshot) {
        return AsyncResult.invoke(() -> {
            S state = serialization.toSerializable(snapshot.getState());
            if (state == null) {
                throw AggregateException.invalidSnapshot(snapshot.getAggregateType(), "state " + snapshot.getState()
                        + " is not supported for serialization");
            }
            SnapshotRecord record = new SnapshotRecord(snapshot.withState(null), serialization.payloadVersion(state),
                    serialization.serialize(state));
            snapshotRecords.put(key(snapshot.getAggregateType(), snapshot.getAggregateId()), record);
            return null;
        });
    }

    @Override
    public CompletionStage<Optional<AggregateSnapshot>> load(String aggregateType, String aggregateId) {
        SnapshotRecord record = snapshotRecords.get(key(aggregateType, aggregateId));
        if (record == null) {
            return AsyncResult.returning(Optional.empty());
        }
        try {
            S state = serialization.deserialize(record.payloadVersion, record.payload);
            return AsyncResult.returning(Optional.of(record.header.withState(state)));
        } catch (RuntimeException e) {
            logger.error("Failure during deserialization of snapshot of {} {}", aggregateType, aggregateId, e);
            return AsyncResult.returning(Optional.empty());
        }
    }

    @Override
    public CompletionStage<Void> delete(String aggregateType, String aggregateId) {
        snapshotRecords.remove(key(aggregateType, aggregateId));
        return AsyncResult.done();
    }

    public long getSnapshottedVersion(String aggregateType, String aggregateId) {
        SnapshotRecord record = snapshotRecords.get(key(aggregateType, aggregateId));
        return record == null ? 0 : record.header.getVersion();
    }

    private static String key(String aggregateType, String aggregateId) {
        return aggregateType + "/" + aggregateId;
    }

    private static class SnapshotRecord {
        final AggregateSnapshot header;
        final int payloadVersion;
        final String payload;

        SnapshotRecord(AggregateSnapshot header, int payloadVersion, String payload) {
            this.header = header;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }
    }
}
