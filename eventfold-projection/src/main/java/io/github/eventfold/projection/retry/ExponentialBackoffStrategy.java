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

import io.github.eventfold.core.AggregateException;
import io.github.eventfold.projection.ProjectionException;

import java.io.IOException;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Retries transient errors with exponentially growing delay.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
 *
 * <p>An error is classified by the cause of a {@code PROCESSING_FAILED} {@link ProjectionException}, or by itself
 * for other errors. An error matches a type when it, or any of its causes, is an instance of the type. Types the
 * config lists as non retryable are never retried. When the config lists retryable types, nothing else is retried.
 * Otherwise I/O errors, timeouts and database errors are retried, and validation or framework errors are not.
 */
public class ExponentialBackoffStrategy implements RetryStrategy {
    static final List<Class<? extends Throwable>> DEFAULT_RETRYABLE = Collections.unmodifiableList(Arrays.asList(
            IOException.class, TimeoutException.class, SQLException.class));

    static final List<Class<? extends Throwable>> DEFAULT_NON_RETRYABLE = Collections.unmodifiableList(Arrays.asList(
            IllegalArgumentException.class, AggregateException.class, ProjectionException.class));

    @Override
    public boolean shouldRetry(Throwable error, int attempt, RetryConfig config) {
        return attempt < config.getMaxAttempts() && isRetryableError(error, config);
    }

    @Override
    public long getRetryDelay(int attempt, RetryConfig config) {
        int exponent = Math.max(attempt, 1) - 1;
        double delay = config.getBaseDelayMs() * Math.pow(config.getBackoffMultiplier(), exponent);
        if (Double.isInfinite(delay) || delay >= config.getMaxDelayMs()) {
            return config.getMaxDelayMs();
        }
        return (long) delay;
    }

    @Override
    public boolean isRetryableError(Throwable error, RetryConfig config) {
        Throwable classified = classified(error);
        if (matches(config.getNonRetryableErrors(), classified)) {
            return false;
        }
        if (!config.getRetryableErrors().isEmpty()) {
            return matches(config.getRetryableErrors(), classified);
        }
        if (matches(DEFAULT_NON_RETRYABLE, classified)) {
            return false;
        }
        return matches(DEFAULT_RETRYABLE, classified);
    }

    private static Throwable classified(Throwable error) {
        if (error instanceof ProjectionException
                && ((ProjectionException) error).getFault() == ProjectionException.Fault.PROCESSING_FAILED
                && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static boolean matches(Collection<Class<? extends Throwable>> types, Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(t)) {
                    return true;
                }
            }
        }
        return false;
    }
}
