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

import io.github.eventfold.core.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Metadata of an event. Event id and timestamp are always present, the aggregate related values are filled in when
 * an aggregate applies the event, position is assigned by the event source feeding projections.
 *
 * <p>Application specific values (actor, tenant, ...) are kept in {@link #getAttributes()}.</p>
 */
@Value.Immutable
@ImmutablesSupport
public abstract class EventMetadata {
    /**
     * Version assumed for events that do not declare their schema version.
     */
    public static final int INITIAL_EVENT_VERSION = 1;

    @Value.Default
    public String getEventId() {
        return UUID.randomUUID().toString();
    }

    @Value.Default
    public Instant getTimestamp() {
        return Instant.now();
    }

    public abstract Optional<String> getAggregateId();

    public abstract Optional<String> getAggregateType();

    public abstract OptionalLong getAggregateVersion();

    /**
     * Schema version of the payload.
     * @return version of the payload, empty when not declared
     */
    public abstract OptionalInt getEventVersion();

    public abstract Optional<String> getCorrelationId();

    public abstract Optional<String> getCausationId();

    /**
     * Position of the event in the stream it was read from.
     * @return position, empty for events that were not read from a stream yet
     */
    public abstract OptionalLong getPosition();

    public abstract Map<String, Object> getAttributes();

    /**
     * Schema version of the payload, {@link #INITIAL_EVENT_VERSION} when not declared.
     * @return effective schema version
     */
    public int effectiveEventVersion() {
        return getEventVersion().orElse(INITIAL_EVENT_VERSION);
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(getAttributes().get(name));
    }

    /**
     * Copy of this metadata describing an event applied to an aggregate.
     * @param aggregateId identity of the aggregate
     * @param aggregateType type of the aggregate
     * @param aggregateVersion version the aggregate reaches by applying the event
     * @return enriched metadata
     */
    public EventMetadata enrichedFor(String aggregateId, String aggregateType, long aggregateVersion) {
        return ImmutableEventMetadata.copyOf(this)
                .withAggregateId(aggregateId)
                .withAggregateType(aggregateType)
                .withAggregateVersion(aggregateVersion);
    }

    public EventMetadata upgradedTo(int eventVersion) {
        return ImmutableEventMetadata.copyOf(this).withEventVersion(eventVersion);
    }

    public EventMetadata atPosition(long position) {
        return ImmutableEventMetadata.copyOf(this).withPosition(position);
    }

    public static ImmutableEventMetadata.Builder builder() {
        return ImmutableEventMetadata.builder();
    }

    /**
     * Fresh metadata with generated event id and current timestamp.
     * @return new metadata
     */
    public static EventMetadata create() {
        return builder().build();
    }
}
