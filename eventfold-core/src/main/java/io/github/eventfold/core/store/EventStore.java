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

import io.github.eventfold.core.EventEnvelope;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Durable log of aggregate events. Operations complete asynchronously, failures are signalled by exceptional
 * completion, usually with {@link EventStoreException}.
 */
public interface EventStore {
    /**
     * All events of an aggregate.
     * @param aggregateId identity of the aggregate
     * @return events in order of their versions, empty list for unknown aggregate
     */
    CompletionStage<List<EventEnvelope>> getEvents(String aggregateId);

    /**
     * Events of an aggregate past given version.
     * @param aggregateId identity of the aggregate
     * @param version version after which to read
     * @return events in order of their versions
     */
    CompletionStage<List<EventEnvelope>> getEventsAfterVersion(String aggregateId, long version);

    /**
     * Append events to the log of an aggregate.
     * @param aggregateId identity of the aggregate
     * @param events events to append
     * @param expectedVersion version of the aggregate the events follow
     * @return stage completing when the events are stored, or failing with {@link EventStoreException} with
     * fault {@link EventStoreException.Fault#OPTIMISTIC_LOCK} when the log is past expected version
     */
    CompletionStage<Void> saveEvents(String aggregateId, List<EventEnvelope> events, long expectedVersion);
}
