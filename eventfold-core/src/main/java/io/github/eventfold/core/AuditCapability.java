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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps a log of events applied to an aggregate. When the aggregate also has {@linkplain SnapshotCapability snapshots}
 * enabled, every entry records the state the aggregate was in before the event.
 *
 * <p>Events that fail to apply are not recorded. Events replayed from history are not recorded either.</p>
 */
public class AuditCapability implements AggregateCapability {
    public static final String NAME = "audit";
    public static final String ACTOR_ATTRIBUTE = "actor";

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final Clock clock;
    private final List<AuditEntry> auditLog = new ArrayList<>();
    private AggregateContext context;

    public AuditCapability() {
        this(Clock.systemUTC());
    }

    public AuditCapability(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void attach(AggregateContext context) {
        this.context = context;
    }

    @Override
    public void detach() {
        this.context = null;
        clearAuditLog();
    }

    @Override
    public void onBeforeApply(EventEnvelope event) {
        snapshots().ifPresent(SnapshotCapability::saveState);
    }

    @Override
    public void onAfterApply(EventEnvelope event) {
        if (context == null) {
            return;
        }
        Optional<Object> previousState = snapshots().flatMap(SnapshotCapability::takePreviousState);
        AuditEntry entry = AuditEntry.builder()
                .timestamp(clock.instant())
                .aggregateId(context.getAggregateId())
                .aggregateType(context.getAggregateType())
                .aggregateVersion(context.getVersion())
                .eventType(event.getEventType())
                .event(event)
                .actor(event.getMetadata().attribute(ACTOR_ATTRIBUTE).map(Object::toString))
                .previousState(previousState)
                .build();
        synchronized (auditLog) {
            auditLog.add(entry);
        }
        logger.debug("Audited event {} of aggregate {} at version {}", event.getEventType(),
                context.getAggregateId(), context.getVersion());
    }

    @Override
    public void onError(EventEnvelope event, RuntimeException error) {
        snapshots().ifPresent(SnapshotCapability::takePreviousState);
    }

    private Optional<SnapshotCapability> snapshots() {
        return context == null ? Optional.empty()
                : context.capability(SnapshotCapability.NAME, SnapshotCapability.class);
    }

    public List<AuditEntry> getAuditLog() {
        synchronized (auditLog) {
            return Collections.unmodifiableList(new ArrayList<>(auditLog));
        }
    }

    public void clearAuditLog() {
        synchronized (auditLog) {
            auditLog.clear();
        }
    }

    public List<AuditEntry> getByEventType(String eventType) {
        return getAuditLog().stream().filter(e -> e.getEventType().equals(eventType)).collect(Collectors.toList());
    }

    public List<AuditEntry> getByActor(String actor) {
        return getAuditLog().stream().filter(e -> e.getActor().map(actor::equals).orElse(false))
                .collect(Collectors.toList());
    }

    /**
     * Entries recorded within time range.
     * @param from start of range, inclusive
     * @param to end of range, inclusive
     * @return entries in the range
     */
    public List<AuditEntry> getBetween(Instant from, Instant to) {
        return getAuditLog().stream()
                .filter(e -> !e.getTimestamp().isBefore(from) && !e.getTimestamp().isAfter(to))
                .collect(Collectors.toList());
    }

    public Optional<AuditEntry> getLastEntry() {
        List<AuditEntry> entries = getAuditLog();
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public AuditStatistics getStatistics() {
        List<AuditEntry> entries = getAuditLog();
        Map<String, Long> eventTypes = entries.stream()
                .collect(Collectors.groupingBy(AuditEntry::getEventType, LinkedHashMap::new, Collectors.counting()));
        Map<String, Long> actors = entries.stream().filter(e -> e.getActor().isPresent())
                .collect(Collectors.groupingBy(e -> e.getActor().get(), LinkedHashMap::new, Collectors.counting()));
        return new AuditStatistics(entries.size(), eventTypes, actors,
                entries.isEmpty() ? null : entries.get(0).getTimestamp(),
                entries.isEmpty() ? null : entries.get(entries.size() - 1).getTimestamp());
    }
}
