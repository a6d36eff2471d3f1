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
import java.util.Optional;

/**
 * Summary of an audit log.
 */
public final class AuditStatistics {
    private final int totalEntries;
    private final Map<String, Long> eventTypes;
    private final Map<String, Long> actors;
    private final Instant firstEntry;
    private final Instant lastEntry;

    AuditStatistics(int totalEntries, Map<String, Long> eventTypes, Map<String, Long> actors, Instant firstEntry,
            Instant lastEntry) {
        this.totalEntries = totalEntries;
        this.eventTypes = Collections.unmodifiableMap(new LinkedHashMap<>(eventTypes));
        this.actors = Collections.unmodifiableMap(new LinkedHashMap<>(actors));
        this.firstEntry = firstEntry;
        this.lastEntry = lastEntry;
    }

    public int getTotalEntries() {
        return totalEntries;
    }

    /**
     * Number of entries per event type.
     * @return counts by event type
     */
    public Map<String, Long> getEventTypes() {
        return eventTypes;
    }

    public Map<String, Long> getActors() {
        return actors;
    }

    public Optional<Instant> getFirstEntry() {
        return Optional.ofNullable(firstEntry);
    }

    public Optional<Instant> getLastEntry() {
        return Optional.ofNullable(lastEntry);
    }
}
