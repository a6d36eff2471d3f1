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
import java.util.Objects;

/**
 * Progress marker of a projection: its state after the event at {@code position}.
 *
 * @param <S> type of the projection state
 */
public final class ProjectionCheckpoint<S> {
    private final String projectionName;
    private final S state;
    private final long position;
    private final Instant timestamp;
    private final long eventCount;

    public ProjectionCheckpoint(String projectionName, S state, long position, Instant timestamp, long eventCount) {
        this.projectionName = Objects.requireNonNull(projectionName);
        this.state = state;
        this.position = position;
        this.timestamp = Objects.requireNonNull(timestamp);
        this.eventCount = eventCount;
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

    /**
     * Events processed by the engine since the checkpoint capability was attached.
     * @return event count
     */
    public long getEventCount() {
        return eventCount;
    }

    @Override
    public String toString() {
        return "ProjectionCheckpoint{" + "projectionName=" + projectionName + ", position=" + position
                + ", timestamp=" + timestamp + ", eventCount=" + eventCount + '}';
    }
}
