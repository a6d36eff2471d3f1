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

import java.util.Objects;

/**
 * An event as it flows through aggregates, stores and projections. Envelope is immutable, enriching it produces a new
 * envelope. The payload is opaque to the library and may be {@code null} for events that carry no data.
 */
public final class EventEnvelope {
    private final String eventType;
    private final Object payload;
    private final EventMetadata metadata;

    private EventEnvelope(String eventType, Object payload, EventMetadata metadata) {
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
        this.payload = payload;
        this.metadata = Objects.requireNonNull(metadata, "Metadata must be specified");
    }

    public static EventEnvelope of(String eventType, Object payload) {
        return new EventEnvelope(eventType, payload, EventMetadata.create());
    }

    public static EventEnvelope of(String eventType, Object payload, EventMetadata metadata) {
        return new EventEnvelope(eventType, payload, metadata);
    }

    /**
     * Wrap a payload object, the event type is derived from its class name.
     * @param payload the payload
     * @return new envelope
     * @see EventType#defaultTypeName(Class)
     */
    public static EventEnvelope wrap(Object payload) {
        Objects.requireNonNull(payload, "Payload must be specified");
        return of(EventType.defaultTypeName(payload.getClass()), payload);
    }

    public String getEventType() {
        return eventType;
    }

    public Object getPayload() {
        return payload;
    }

    /**
     * Payload cast to expected type.
     * @param type expected payload type
     * @param <P> payload type
     * @return the payload
     * @throws ClassCastException when payload is of different type
     */
    public <P> P getPayload(Class<P> type) {
        return type.cast(payload);
    }

    public EventMetadata getMetadata() {
        return metadata;
    }

    public String getEventId() {
        return metadata.getEventId();
    }

    public int getEventVersion() {
        return metadata.effectiveEventVersion();
    }

    public EventEnvelope withMetadata(EventMetadata metadata) {
        return new EventEnvelope(eventType, payload, metadata);
    }

    public EventEnvelope withPayload(Object payload) {
        return new EventEnvelope(eventType, payload, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventEnvelope)) {
            return false;
        }
        EventEnvelope that = (EventEnvelope) o;
        return eventType.equals(that.eventType) && Objects.equals(payload, that.payload)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, payload, metadata);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" + "eventType='" + eventType + '\'' + ", payload=" + payload + ", metadata=" + metadata
                + '}';
    }
}
