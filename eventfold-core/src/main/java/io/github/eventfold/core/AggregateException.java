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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure of an aggregate operation. The {@link Fault} tells whether the failure is a programming error, that needs to
 * surface immediately, or a consistency error that higher level may recover from by reloading the aggregate.
 */
public class AggregateException extends RuntimeException {
    private final Fault fault;
    private final Map<String, Object> context;

    public enum Fault {
        INVALID_ARGUMENTS(false),
        VERSION_CONFLICT(true),
        FEATURE_NOT_ENABLED(false),
        METHOD_NOT_IMPLEMENTED(false),
        INVALID_SNAPSHOT(true),
        ID_MISMATCH(true),
        TYPE_MISMATCH(true),
        DUPLICATE_UPCASTER(false),
        MISSING_UPCASTER(true),
        CAPABILITY_NOT_ATTACHED(false),
        EVENT_STORE_NOT_CONFIGURED(false);

        private final boolean recoverable;

        Fault(boolean recoverable) {
            this.recoverable = recoverable;
        }

        /**
         * Whether the operation may succeed after reloading the aggregate. Non-recoverable faults indicate
         * misconfiguration.
         * @return true for data or consistency faults
         */
        public boolean isRecoverable() {
            return recoverable;
        }
    }

    protected AggregateException(Fault fault, String message, Map<String, Object> context) {
        super(message);
        this.fault = fault;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * Structured details of the failure, such as aggregate type, id, versions or event type.
     * @return read only context
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public static AggregateException invalidArguments(String message) {
        return new AggregateException(Fault.INVALID_ARGUMENTS, "Invalid arguments: " + message,
                Collections.emptyMap());
    }

    public static AggregateException versionConflict(String aggregateType, String aggregateId, long currentVersion,
            long expectedVersion) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("aggregateType", aggregateType);
        ctx.put("aggregateId", aggregateId);
        ctx.put("currentVersion", currentVersion);
        ctx.put("expectedVersion", expectedVersion);
        return new AggregateException(Fault.VERSION_CONFLICT, "Version conflict: Aggregate " + aggregateType
                + " with ID " + aggregateId + " has version " + currentVersion + ", but expected " + expectedVersion,
                ctx);
    }

    public static AggregateException featureNotEnabled(String feature, String aggregateType) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("feature", feature);
        ctx.put("aggregateType", aggregateType);
        return new AggregateException(Fault.FEATURE_NOT_ENABLED, "Feature '" + feature
                + "' is not enabled on aggregate " + aggregateType, ctx);
    }

    public static AggregateException methodNotImplemented(String method, String aggregateType) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("method", method);
        ctx.put("aggregateType", aggregateType);
        return new AggregateException(Fault.METHOD_NOT_IMPLEMENTED, "Method '" + method
                + "' must be implemented by aggregate " + aggregateType, ctx);
    }

    public static AggregateException invalidSnapshot(String aggregateType, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("aggregateType", aggregateType);
        ctx.put("reason", reason);
        return new AggregateException(Fault.INVALID_SNAPSHOT, "Invalid snapshot for aggregate " + aggregateType
                + ": " + reason, ctx);
    }

    public static AggregateException idMismatch(String snapshotId, String aggregateId) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("snapshotId", snapshotId);
        ctx.put("aggregateId", aggregateId);
        return new AggregateException(Fault.ID_MISMATCH, "Snapshot ID " + snapshotId
                + " does not match aggregate ID " + aggregateId, ctx);
    }

    public static AggregateException typeMismatch(String snapshotType, String aggregateType) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("snapshotType", snapshotType);
        ctx.put("aggregateType", aggregateType);
        return new AggregateException(Fault.TYPE_MISMATCH, "Snapshot type " + snapshotType
                + " does not match aggregate type " + aggregateType, ctx);
    }

    public static AggregateException foreignEvent(String aggregateType, String aggregateId, EventEnvelope event) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("aggregateType", aggregateType);
        ctx.put("aggregateId", aggregateId);
        ctx.put("eventType", event.getEventType());
        ctx.put("eventId", event.getEventId());
        ctx.put("eventAggregateType", event.getMetadata().getAggregateType().orElse(null));
        ctx.put("eventAggregateId", event.getMetadata().getAggregateId().orElse(null));
        boolean typeDiffers = event.getMetadata().getAggregateType().map(t -> !t.equals(aggregateType))
                .orElse(false);
        return new AggregateException(typeDiffers ? Fault.TYPE_MISMATCH : Fault.ID_MISMATCH, "Event "
                + event.getEventId() + " of type " + event.getEventType() + " belongs to aggregate "
                + event.getMetadata().getAggregateType().orElse("?") + " with ID "
                + event.getMetadata().getAggregateId().orElse("?") + ", cannot replay it into " + aggregateType
                + " with ID " + aggregateId, ctx);
    }

    public static AggregateException duplicateUpcaster(String eventType, int sourceVersion) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("eventType", eventType);
        ctx.put("sourceVersion", sourceVersion);
        return new AggregateException(Fault.DUPLICATE_UPCASTER, "Upcaster for event " + eventType + " version "
                + sourceVersion + " already exists", ctx);
    }

    public static AggregateException missingUpcaster(String eventType, int fromVersion, int toVersion) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("eventType", eventType);
        ctx.put("fromVersion", fromVersion);
        ctx.put("toVersion", toVersion);
        return new AggregateException(Fault.MISSING_UPCASTER, "Missing upcaster for event " + eventType
                + " from version " + fromVersion + " to " + toVersion, ctx);
    }

    public static AggregateException capabilityNotAttached(String capability) {
        return new AggregateException(Fault.CAPABILITY_NOT_ATTACHED, "Capability '" + capability
                + "' is not attached to an aggregate", Collections.singletonMap("capability", capability));
    }

    public static AggregateException eventStoreNotConfigured(String aggregateType) {
        return new AggregateException(Fault.EVENT_STORE_NOT_CONFIGURED, "Event store is not configured for aggregate "
                + aggregateType, Collections.singletonMap("aggregateType", aggregateType));
    }
}
