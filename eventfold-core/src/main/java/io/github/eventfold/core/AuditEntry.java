package io.github.eventfold.core;

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

import io.github.eventfold.core.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Record of single event applied to an audited aggregate.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class AuditEntry {
    @Value.Default
    public String getEntryId() {
        return UUID.randomUUID().toString();
    }

    public abstract Instant getTimestamp();

    public abstract String getAggregateId();

    public abstract String getAggregateType();

    public abstract long getAggregateVersion();

    public abstract String getEventType();

    public abstract EventEnvelope getEvent();

    /**
     * Who caused the event, taken from event metadata attribute {@value AuditCapability#ACTOR_ATTRIBUTE}.
     * @return the actor, if known
     */
    public abstract Optional<String> getActor();

    /**
     * State of the aggregate before the event was applied. Only recorded when the aggregate supports snapshots.
     * @return previous state
     */
    public abstract Optional<Object> getPreviousState();

    public static ImmutableAuditEntry.Builder builder() {
        return ImmutableAuditEntry.builder();
    }
}
