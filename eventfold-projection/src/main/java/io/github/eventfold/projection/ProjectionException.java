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
import java.util.Optional;

/**
 * Failure of a projection operation. Errors thrown by projection functions, stores or capabilities are wrapped into
 * {@link Fault#PROCESSING_FAILED}, the remaining faults are raised by the framework itself.
 */
public class ProjectionException extends RuntimeException {
    private final Fault fault;
    private final String projectionName;
    private final String eventType;
    private final int attemptCount;
    private final Instant firstFailedAt;

    public enum Fault {
        PROCESSING_FAILED,
        STATE_NOT_FOUND,
        CAPABILITY_NOT_ATTACHED,
        CIRCUIT_BREAKER_OPEN,
        INVALID_CONFIGURATION,
        DEAD_LETTER_NOT_FOUND
    }

    protected ProjectionException(Fault fault, String message, Throwable cause, String projectionName,
            String eventType, int attemptCount, Instant firstFailedAt) {
        super(message, cause);
        this.fault = fault;
        this.projectionName = projectionName;
        this.eventType = eventType;
        this.attemptCount = attemptCount;
        this.firstFailedAt = firstFailedAt;
    }

    public Fault getFault() {
        return fault;
    }

    public Optional<String> getProjectionName() {
        return Optional.ofNullable(projectionName);
    }

    public Optional<String> getEventType() {
        return Optional.ofNullable(eventType);
    }

    /**
     * Number of processing attempts made before this error was raised. Is 1 unless a retrying engine tagged the
     * error.
     * @return attempt count
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    public Optional<Instant> getFirstFailedAt() {
        return Optional.ofNullable(firstFailedAt);
    }

    /**
     * Copy of this error tagged with retry bookkeeping.
     * @param attemptCount attempts made so far
     * @param firstFailedAt when the first attempt failed
     * @return new exception with same fault, message and cause
     */
    public ProjectionException withAttempt(int attemptCount, Instant firstFailedAt) {
        ProjectionException copy = new ProjectionException(fault, getMessage(), getCause(), projectionName, eventType,
                attemptCount, firstFailedAt);
        copy.setStackTrace(getStackTrace());
        for (Throwable suppressed : getSuppressed()) {
            copy.addSuppressed(suppressed);
        }
        return copy;
    }

    public static ProjectionException processingFailed(String projectionName, String eventType, Throwable cause) {
        return new ProjectionException(Fault.PROCESSING_FAILED, "Projection " + projectionName
                + " failed to process event " + eventType + ": " + cause, cause, projectionName, eventType, 1, null);
    }

    public static ProjectionException stateNotFound(String projectionName) {
        return new ProjectionException(Fault.STATE_NOT_FOUND, "No state available for projection " + projectionName,
                null, projectionName, null, 1, null);
    }

    public static ProjectionException capabilityNotAttached(String capabilityName) {
        return new ProjectionException(Fault.CAPABILITY_NOT_ATTACHED, "Capability " + capabilityName
                + " is not attached to a projection engine", null, null, null, 1, null);
    }

    public static ProjectionException circuitBreakerOpen(String projectionName, String eventType) {
        return new ProjectionException(Fault.CIRCUIT_BREAKER_OPEN, "Circuit breaker is OPEN for projection "
                + projectionName, null, projectionName, eventType, 1, null);
    }

    public static ProjectionException invalidConfiguration(String parameter, String reason) {
        return new ProjectionException(Fault.INVALID_CONFIGURATION, "Invalid configuration of " + parameter + ": "
                + reason, null, null, null, 1, null);
    }

    public static ProjectionException deadLetterNotFound(String id) {
        return new ProjectionException(Fault.DEAD_LETTER_NOT_FOUND, "Dead letter entry " + id + " does not exist",
                null, null, null, 1, null);
    }
}
