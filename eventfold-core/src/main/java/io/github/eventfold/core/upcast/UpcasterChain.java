package io.github.eventfold.core.upcast;

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
import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.core.EventMetadata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Registry of upcasters by event type and source version. Latest version of an event type is one above the highest
 * registered source version, or {@link EventMetadata#INITIAL_EVENT_VERSION} when there is none.
 */
public class UpcasterChain {
    private final Map<String, NavigableMap<Integer, EventUpcaster<Object, ?>>> upcasters = new ConcurrentHashMap<>();

    /**
     * Register upcaster accepting payload of any type.
     * @param eventType type of the event
     * @param sourceVersion version the upcaster accepts
     * @param upcaster the upcaster
     * @throws AggregateException {@code DUPLICATE_UPCASTER} if one is already registered for the version
     */
    public void register(String eventType, int sourceVersion, EventUpcaster<Object, ?> upcaster) {
        if (eventType == null || eventType.trim().isEmpty()) {
            throw AggregateException.invalidArguments("event type of upcaster must be specified");
        }
        if (sourceVersion < EventMetadata.INITIAL_EVENT_VERSION) {
            throw AggregateException.invalidArguments("source version of upcaster for " + eventType
                    + " must be positive, was " + sourceVersion);
        }
        if (upcaster == null) {
            throw AggregateException.invalidArguments("upcaster for " + eventType + " must be specified");
        }
        NavigableMap<Integer, EventUpcaster<Object, ?>> byVersion = upcasters.computeIfAbsent(eventType,
                t -> new ConcurrentSkipListMap<>());
        if (byVersion.putIfAbsent(sourceVersion, upcaster) != null) {
            throw AggregateException.duplicateUpcaster(eventType, sourceVersion);
        }
    }

    /**
     * Register upcaster of payloads of specific type. Payload of other type fails the upcast with
     * {@link ClassCastException}.
     * @param eventType type of the event
     * @param sourceVersion version the upcaster accepts
     * @param payloadType payload type of the source version
     * @param upcaster the upcaster
     * @param <F> payload type of the source version
     */
    public <F> void register(String eventType, int sourceVersion, Class<F> payloadType, EventUpcaster<F, ?> upcaster) {
        if (payloadType == null || upcaster == null) {
            throw AggregateException.invalidArguments("upcaster for " + eventType
                    + " must be specified with its payload type");
        }
        register(eventType, sourceVersion, (payload, metadata) -> upcaster.upcast(payloadType.cast(payload), metadata));
    }

    public int getLatestVersion(String eventType) {
        NavigableMap<Integer, EventUpcaster<Object, ?>> byVersion = upcasters.get(eventType);
        if (byVersion == null || byVersion.isEmpty()) {
            return EventMetadata.INITIAL_EVENT_VERSION;
        }
        return byVersion.lastKey() + 1;
    }

    public boolean hasUpcaster(String eventType, int sourceVersion) {
        NavigableMap<Integer, EventUpcaster<Object, ?>> byVersion = upcasters.get(eventType);
        return byVersion != null && byVersion.containsKey(sourceVersion);
    }

    public Set<String> getRegisteredEventTypes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(upcasters.keySet()));
    }

    /**
     * Bring event to the latest version of its type. Every step produces new payload and metadata, the passed
     * envelope is returned unchanged when it already is at latest version.
     * @param event event to upcast
     * @return event at latest version
     * @throws AggregateException {@code MISSING_UPCASTER} when any step of the chain is not registered
     */
    public EventEnvelope upcast(EventEnvelope event) {
        String eventType = event.getEventType();
        int latestVersion = getLatestVersion(eventType);
        int currentVersion = event.getEventVersion();
        if (currentVersion >= latestVersion) {
            return event;
        }
        NavigableMap<Integer, EventUpcaster<Object, ?>> byVersion = upcasters.get(eventType);
        Object payload = event.getPayload();
        EventMetadata metadata = event.getMetadata();
        while (currentVersion < latestVersion) {
            EventUpcaster<Object, ?> step = byVersion.get(currentVersion);
            if (step == null) {
                throw AggregateException.missingUpcaster(eventType, currentVersion, currentVersion + 1);
            }
            payload = step.upcast(payload, metadata);
            currentVersion++;
            metadata = metadata.upgradedTo(currentVersion);
        }
        return EventEnvelope.of(eventType, payload, metadata);
    }
}
