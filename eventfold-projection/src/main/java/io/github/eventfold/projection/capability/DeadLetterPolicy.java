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
 * Decides whether a failed event is stored as dead letter.
 */
@FunctionalInterface
public interface DeadLetterPolicy {
    boolean shouldDeadLetter(ProjectionException error, int attemptCount);

    static DeadLetterPolicy afterAttempts(int attempts) {
        if (attempts < 1) {
            throw ProjectionException.invalidConfiguration("attempts", "must be positive, got " + attempts);
        }
        return (error, attemptCount) -> attemptCount >= attempts;
    }

    static DeadLetterPolicy defaultPolicy() {
        return afterAttempts(3);
    }
}
