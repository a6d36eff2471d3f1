package io.github.eventfold.projection.store;

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
import java.util.Objects;

/**
 * Versioned capture of projection state.
 *
 * @param <S> type of the projection state
 */
public final class ProjectionSnapshot<S> {
    private final String projectionName;
    private final S state;
    private final long position;
    private final Instant timestamp;
    private final long version;
    private final Map<String, Object> metadata;

    public ProjectionSnapshot(String projectionName, S state, long position, Instant timestamp, long version,
            Map<String, Object> metadata) {
        this.projectionName = Objects.requireNonNull(projectionName);
        this.state = state;
        this.position = position;
        this.timestamp = Objects.requireNonNull(timestamp);
        this.version = version;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getProjectionName() {
        return projectionName;
    }

    public S getState() {
        return state;
    }

    public long getPosition() {
        return position;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getVersion() {
        return version;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ProjectionSnapshot{" + "projectionName=" + projectionName + ", version=" + version + ", position="
                + position + ", timestamp=" + timestamp + '}';
    }
}
