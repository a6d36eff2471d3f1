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

import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.core.immutables.ImmutablesSupport;
import io.github.eventfold.projection.ProjectionException;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * An event a projection could not process, with the context of the failure.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class DeadLetterEntry {
    @Value.Default
    public String getId() {
        return UUID.randomUUID().toString();
    }

    public abstract String getProjectionName();

    public abstract EventEnvelope getEvent();

    public abstract ProjectionException getError();

    public abstract int getAttemptCount();

    public abstract Instant getFirstFailedAt();

    public abstract Instant getLastFailedAt();

    public abstract Map<String, String> getMetadata();

    public static ImmutableDeadLetterEntry.Builder builder() {
        return ImmutableDeadLetterEntry.builder();
    }
}
