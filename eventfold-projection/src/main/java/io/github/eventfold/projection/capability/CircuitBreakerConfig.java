package io.github.eventfold.projection.capability;

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

import io.github.eventfold.projection.ProjectionException;

/**
 * Thresholds of a {@link CircuitBreakerCapability}.
 */
public final class CircuitBreakerConfig {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_RECOVERY_TIMEOUT_MS = 60_000;
    public static final int DEFAULT_HALF_OPEN_MAX_ATTEMPTS = 3;

    private final int failureThreshold;
    private final long recoveryTimeoutMs;
    private final int halfOpenMaxAttempts;

    /**
     * @param failureThreshold consecutive failures that open the circuit
     * @param recoveryTimeoutMs time since last failure after which an open circuit lets a probe through
     * @param halfOpenMaxAttempts successful probes that close the circuit again
     */
    public CircuitBreakerConfig(int failureThreshold, long recoveryTimeoutMs, int halfOpenMaxAttempts) {
        if (failureThreshold < 1) {
            throw ProjectionException.invalidConfiguration("failureThreshold", "must be positive, got "
                    + failureThreshold);
        }
        if (recoveryTimeoutMs < 0) {
            throw ProjectionException.invalidConfiguration("recoveryTimeoutMs", "must not be negative, got "
                    + recoveryTimeoutMs);
        }
        if (halfOpenMaxAttempts < 1) {
            throw ProjectionException.invalidConfiguration("halfOpenMaxAttempts", "must be positive, got "
                    + halfOpenMaxAttempts);
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeoutMs = recoveryTimeoutMs;
        this.halfOpenMaxAttempts = halfOpenMaxAttempts;
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT_MS,
                DEFAULT_HALF_OPEN_MAX_ATTEMPTS);
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public long getRecoveryTimeoutMs() {
        return recoveryTimeoutMs;
    }

    public int getHalfOpenMaxAttempts() {
        return halfOpenMaxAttempts;
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{" + "failureThreshold=" + failureThreshold + ", recoveryTimeoutMs="
                + recoveryTimeoutMs + ", halfOpenMaxAttempts=" + halfOpenMaxAttempts + '}';
    }
}
