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

import java.time.Instant;
import java.util.Objects;

/**
 * Payload of the event published when a projection gives up on an event.
 */
public final class ProjectionErrorOccurred {
    private final String projectionName;
    private final String failedEventType;
    private final String failedEventId;
    private final String errorType;
    private final String errorMessage;
    private final int attemptCount;
    private final Instant occurredAt;

    public ProjectionErrorOccurred(String projectionName, String failedEventType, String failedEventId,
            String errorType, String errorMessage, int attemptCount, Instant occurredAt) {
        this.projectionName = Objects.requireNonNull(projectionName);
        this.failedEventType = Objects.requireNonNull(failedEventType);
        this.failedEventId = failedEventId;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.attemptCount = attemptCount;
        this.occurredAt = Objects.requireNonNull(occurredAt);
    }

    public String getProjectionName() {
        return projectionName;
    }

    public String getFailedEventType() {
        return failedEventType;
    }

    public String getFailedEventId() {
        return failedEventId;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "ProjectionErrorOccurred{" + "projectionName=" + projectionName + ", failedEventType="
                + failedEventType + ", errorType=" + errorType + ", attemptCount=" + attemptCount + '}';
    }
}
