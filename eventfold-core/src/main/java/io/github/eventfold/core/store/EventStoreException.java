package io.github.eventfold.core.store;

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

/**
 * Exception generated when storing or reading events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, STORE_FAILED, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(String aggregateId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId
                + " expected at version " + expectedVersion + " while last stored version is " + actualVersion, null);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.STORE_FAILED,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException multipleAggregates(String expected, EventEnvelope violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stored events span multiple aggregates: " + expected
                + " and " + violating.getMetadata().getAggregateId().orElse("?"), null);
    }
}
