package io.github.eventfold.projection.retry;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Retry limits and backoff parameters of a retrying engine. Instances are created through {@link #builder()}, values
 * not set keep their defaults.
 */
public final class RetryConfig {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 100;
    public static final long DEFAULT_MAX_DELAY_MS = 30_000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double backoffMultiplier;
    private final Set<Class<? extends Throwable>> retryableErrors;
    private final Set<Class<? extends Throwable>> nonRetryableErrors;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelayMs = builder.baseDelayMs;
        this.maxDelayMs = builder.maxDelayMs;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.retryableErrors = Collections.unmodifiableSet(new LinkedHashSet<>(builder.retryableErrors));
        this.nonRetryableErrors = Collections.unmodifiableSet(new LinkedHashSet<>(builder.nonRetryableErrors));
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Total number of attempts, the first one included.
     * @return max attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    /**
     * When not empty, only errors of these types are retried.
     * @return retryable error types
     */
    public Set<Class<? extends Throwable>> getRetryableErrors() {
        return retryableErrors;
    }

    /**
     * Errors of these types are never retried, regardless of {@link #getRetryableErrors()}.
     * @return non retryable error types
     */
    public Set<Class<? extends Throwable>> getNonRetryableErrors() {
        return nonRetryableErrors;
    }

    @Override
    public String toString() {
        return "RetryConfig{" + "maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs + ", maxDelayMs="
                + maxDelayMs + ", backoffMultiplier=" + backoffMultiplier + ", retryableErrors=" + retryableErrors
                + ", nonRetryableErrors=" + nonRetryableErrors + '}';
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private final Set<Class<? extends Throwable>> retryableErrors = new LinkedHashSet<>();
        private final Set<Class<? extends Throwable>> nonRetryableErrors = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelayMs(long baseDelayMs) {
            if (baseDelayMs < 0) {
                throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
            }
            this.baseDelayMs = baseDelayMs;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            if (maxDelayMs < 0) {
                throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
            }
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            if (!(backoffMultiplier >= 1.0) || Double.isInfinite(backoffMultiplier)) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1, got: " + backoffMultiplier);
            }
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... errorTypes) {
            retryableErrors.addAll(Arrays.asList(errorTypes));
            return this;
        }

        @SafeVarargs
        public final Builder neverRetryOn(Class<? extends Throwable>... errorTypes) {
            nonRetryableErrors.addAll(Arrays.asList(errorTypes));
            return this;
        }

        public RetryConfig build() {
            if (maxDelayMs < baseDelayMs) {
                throw new IllegalArgumentException("maxDelayMs (" + maxDelayMs + ") must not be less than baseDelayMs ("
                        + baseDelayMs + ")");
            }
            return new RetryConfig(this);
        }
    }
}
