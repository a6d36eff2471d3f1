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

/**
 * Decides whether a failed processing attempt is repeated and when.
 */
public interface RetryStrategy {
    /**
     * @param error the failure of the attempt
     * @param attempt number of the failed attempt, starting at 1
     * @param config retry configuration of the engine
     * @return true if another attempt should be made
     */
    boolean shouldRetry(Throwable error, int attempt, RetryConfig config);

    /**
     * @param attempt number of the failed attempt, starting at 1
     * @param config retry configuration of the engine
     * @return milliseconds to wait before next attempt
     */
    long getRetryDelay(int attempt, RetryConfig config);

    boolean isRetryableError(Throwable error, RetryConfig config);
}
