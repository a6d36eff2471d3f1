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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Table of event handlers of an aggregate, keyed by event type and optionally by the schema version of the event.
 * Built once per aggregate instance:
 * <pre>{@code
 * private final EventHandlers handlers = EventHandlers.builder()
 *         .on(MoneyDeposited.class, this::onDeposited)
 *         .on("AccountOpened", 2, this::onOpenedV2)
 *         .build();
 * }</pre>
 */
public final class EventHandlers {
    private static final EventHandlers NONE = new EventHandlers(new Builder());

    private final Map<String, Consumer<EventEnvelope>> handlers;
    private final Set<String> eventTypes;

    private EventHandlers(Builder b) {
        this.handlers = new HashMap<>(b.handlers);
        this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.eventTypes));
    }

    /**
     * Find handler for an event. Handler registered for the exact schema version takes precedence over unversioned
     * handler of the type.
     * @param eventType type of the event
     * @param eventVersion schema version of the event
     * @return matching handler
     */
    public Optional<Consumer<EventEnvelope>> resolve(String eventType, int eventVersion) {
        Consumer<EventEnvelope> handler = handlers.get(EventType.versionedTypeName(eventType, eventVersion));
        if (handler == null) {
            handler = handlers.get(eventType);
        }
        return Optional.ofNullable(handler);
    }

    public boolean handles(String eventType) {
        return eventTypes.contains(eventType);
    }

    public Set<String> getEventTypes() {
        return eventTypes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EventHandlers none() {
        return NONE;
    }

    public static class Builder {
        private final Map<String, Consumer<EventEnvelope>> handlers = new HashMap<>();
        private final Set<String> eventTypes = new LinkedHashSet<>();

        public Builder on(String eventType, Consumer<EventEnvelope> handler) {
            return register(eventType, eventType, handler);
        }

        public Builder on(String eventType, int eventVersion, Consumer<EventEnvelope> handler) {
            return register(eventType, EventType.versionedTypeName(eventType, eventVersion), handler);
        }

        public <P> Builder on(String eventType, Class<P> payloadType, Consumer<P> handler) {
            Objects.requireNonNull(handler, "Handler cannot be null");
            return on(eventType, e -> handler.accept(e.getPayload(payloadType)));
        }

        public <P> Builder on(String eventType, int eventVersion, Class<P> payloadType, Consumer<P> handler) {
            Objects.requireNonNull(handler, "Handler cannot be null");
            return on(eventType, eventVersion, e -> handler.accept(e.getPayload(payloadType)));
        }

        /**
         * Register handler for payloads of given class, with event type derived from the class name.
         * @param payloadType payload class
         * @param handler handler of the payload
         * @param <P> payload type
         * @return this builder
         * @see EventType#defaultTypeName(Class)
         */
        public <P> Builder on(Class<P> payloadType, Consumer<P> handler) {
            return on(EventType.defaultTypeName(payloadType), payloadType, handler);
        }

        private Builder register(String eventType, String key, Consumer<EventEnvelope> handler) {
            Objects.requireNonNull(eventType, "Event type cannot be null");
            Objects.requireNonNull(handler, "Handler cannot be null");
            if (handlers.putIfAbsent(key, handler) != null) {
                throw new IllegalArgumentException("Handler for " + key + " is already registered");
            }
            eventTypes.add(eventType);
            return this;
        }

        public EventHandlers build() {
            return new EventHandlers(this);
        }
    }
}
