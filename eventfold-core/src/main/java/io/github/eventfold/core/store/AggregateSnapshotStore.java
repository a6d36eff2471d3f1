package io.github.eventfold.core.store;

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

import io.github.eventfold.core.AggregateSnapshot;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Storage of aggregate snapshots. Only the most recent snapshot of an aggregate needs to be kept.
 */
public interface AggregateSnapshotStore {
    CompletionStage<Void> save(AggregateSnapshot snapshot);

    /**
     * Most recent snapshot of an aggregate.
     * @param aggregateType type of the aggregate
     * @param aggregateId identity of the aggregate
     * @return the snapshot, empty when there is none or it cannot be read
     */
    CompletionStage<Optional<AggregateSnapshot>> load(String aggregateType, String aggregateId);

    CompletionStage<Void> delete(String aggregateType, String aggregateId);
}
