package io.github.eventfold.projection;

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.util.stream.Collectors.toList;

/**
 * Engines of an application, keyed by projection name, in order of registration.
 */
public class ProjectionEngineRegistry {
    private final Map<String, ProjectionEngine<?>> engines = new LinkedHashMap<>();

    /**
     * Register an engine.
     * @param engine engine to register
     * @throws ProjectionException {@code INVALID_CONFIGURATION} when an engine of the same projection is registered
     */
    public synchronized void register(ProjectionEngine<?> engine) {
        Objects.requireNonNull(engine, "Engine must be specified");
        String name = engine.getProjectionName();
        if (engines.containsKey(name)) {
            throw ProjectionException.invalidConfiguration("projectionName", "engine for projection " + name
                    + " is already registered");
        }
        engines.put(name, engine);
    }

    public synchronized boolean unregister(String projectionName) {
        return engines.remove(projectionName) != null;
    }

    public synchronized Optional<ProjectionEngine<?>> get(String projectionName) {
        return Optional.ofNullable(engines.get(projectionName));
    }

    public synchronized List<ProjectionEngine<?>> getAll() {
        return new ArrayList<>(engines.values());
    }

    public synchronized List<ProjectionEngine<?>> getInterestedEngines(EventEnvelope event) {
        return engines.values().stream().filter(e -> e.isInterestedIn(event)).collect(toList());
    }

    public synchronized boolean has(String projectionName) {
        return engines.containsKey(projectionName);
    }

    public synchronized Set<String> getProjectionNames() {
        return new LinkedHashSet<>(engines.keySet());
    }

    public synchronized int size() {
        return engines.size();
    }

    public synchronized void clear() {
        engines.clear();
    }
}
