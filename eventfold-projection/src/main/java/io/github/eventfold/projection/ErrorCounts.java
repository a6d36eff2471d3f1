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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State of {@link ErrorProjection}.
 */
public final class ErrorCounts {
    private static final ErrorCounts EMPTY = new ErrorCounts(0, Collections.emptyMap(), Collections.emptyMap(),
            null);

    private final long total;
    private final Map<String, Long> byProjection;
    private final Map<String, Long> byEventType;
    private final ProjectionErrorOccurred lastError;

    private ErrorCounts(long total, Map<String, Long> byProjection, Map<String, Long> byEventType,
            ProjectionErrorOccurred lastError) {
        this.total = total;
        this.byProjection = Collections.unmodifiableMap(byProjection);
        this.byEventType = Collections.unmodifiableMap(byEventType);
        this.lastError = lastError;
    }

    public static ErrorCounts empty() {
        return EMPTY;
    }

    public ErrorCounts record(ProjectionErrorOccurred error) {
        Map<String, Long> projections = new LinkedHashMap<>(byProjection);
        projections.merge(error.getProjectionName(), 1L, Long::sum);
        Map<String, Long> eventTypes = new LinkedHashMap<>(byEventType);
        eventTypes.merge(error.getFailedEventType(), 1L, Long::sum);
        return new ErrorCounts(total + 1, projections, eventTypes, error);
    }

    public long getTotal() {
        return total;
    }

    public Map<String, Long> getByProjection() {
        return byProjection;
    }

    public Map<String, Long> getByEventType() {
        return byEventType;
    }

    public long countFor(String projectionName) {
        return byProjection.getOrDefault(projectionName, 0L);
    }

    public Optional<ProjectionErrorOccurred> getLastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public String toString() {
        return "ErrorCounts{" + "total=" + total + ", byProjection=" + byProjection + ", byEventType=" + byEventType
                + '}';
    }
}
