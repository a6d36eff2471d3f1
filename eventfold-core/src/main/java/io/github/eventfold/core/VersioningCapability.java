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

import io.github.eventfold.core.upcast.EventUpcaster;
import io.github.eventfold.core.upcast.UpcasterChain;

import java.util.Objects;
import java.util.Set;

/**
 * Lets an aggregate handle events stored in older schema versions. Events are upcasted by registered
 * {@linkplain EventUpcaster upcasters} before they reach the handlers, the recorded events stay untouched.
 */
public class VersioningCapability implements AggregateCapability {
    public static final String NAME = "versioning";

    private final UpcasterChain upcasters;

    public VersioningCapability() {
        this(new UpcasterChain());
    }

    public VersioningCapability(UpcasterChain upcasters) {
        this.upcasters = Objects.requireNonNull(upcasters, "Upcaster chain must be specified");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void attach(AggregateContext context) {
        // upcasting doesn't depend on the aggregate
    }

    /**
     * Register upcaster of event payload from source version to the next one.
     * @param eventType type of the event
     * @param sourceVersion version the upcaster accepts
     * @param payloadType payload type of the source version
     * @param upcaster the upcaster
     * @param <F> type of older payload
     * @return this capability
     * @throws AggregateException {@code DUPLICATE_UPCASTER} if one is already registered for the version
     */
    public <F> VersioningCapability registerUpcaster(String eventType, int sourceVersion, Class<F> payloadType,
            EventUpcaster<F, ?> upcaster) {
        upcasters.register(eventType, sourceVersion, payloadType, upcaster);
        return this;
    }

    public VersioningCapability registerUpcaster(String eventType, int sourceVersion,
            EventUpcaster<Object, ?> upcaster) {
        upcasters.register(eventType, sourceVersion, upcaster);
        return this;
    }

    public EventEnvelope upcast(EventEnvelope event) {
        return upcasters.upcast(event);
    }

    public Set<String> getRegisteredEventTypes() {
        return upcasters.getRegisteredEventTypes();
    }

    public int getLatestVersion(String eventType) {
        return upcasters.getLatestVersion(eventType);
    }

    public boolean hasUpcaster(String eventType, int sourceVersion) {
        return upcasters.hasUpcaster(eventType, sourceVersion);
    }
}
