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

import io.github.eventfold.core.AsyncResult;
import io.github.eventfold.projection.ProjectionContext;
import io.github.eventfold.projection.store.ProjectionSnapshot;
import io.github.eventfold.projection.store.ProjectionSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Takes a versioned snapshot every {@code interval} applied events. With a retention set, snapshots older than the
 * retention are removed after each new one.
 */
public class ProjectionSnapshotCapability<S> extends IntervalCapability<S> {
    public static final String NAME = "snapshot";
    public static final int DEFAULT_INTERVAL = 1000;

    private final ProjectionSnapshotStore<S> store;
    private final Duration retention;
    private final Clock clock;
    private final AtomicLong version = new AtomicLong();

    public ProjectionSnapshotCapability(ProjectionSnapshotStore<S> store) {
        this(store, DEFAULT_INTERVAL);
    }

    public ProjectionSnapshotCapability(ProjectionSnapshotStore<S> store, int interval) {
        this(store, interval, null, Clock.systemUTC(), LoggerFactory.getLogger(ProjectionSnapshotCapability.class));
    }

    /**
     * @param store where to put snapshots
     * @param interval events between snapshots
     * @param retention how long to keep snapshots, null to keep all
     * @param clock source of snapshot timestamps
     * @param logger logger
     */
    public ProjectionSnapshotCapability(ProjectionSnapshotStore<S> store, int interval, Duration retention,
            Clock clock, Logger logger) {
        super(NAME, interval, logger);
        this.store = Objects.requireNonNull(store, "Snapshot store must be specified");
        this.retention = retention;
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Version of the last snapshot taken or loaded. Versions keep growing across resets of the projection, snapshots
     * taken by a rebuild never reuse versions of earlier ones.
     * @return snapshot version, 0 before any
     */
    public long getVersion() {
        return version.get();
    }

    @Override
    protected CompletionStage<Void> handleInterval(S state, long position, long processedEvents) {
        ProjectionContext<S> ctx = ensureAttached();
        Instant now = clock.instant();
        ProjectionSnapshot<S> snapshot = new ProjectionSnapshot<>(ctx.getProjectionName(), state, position, now,
                version.incrementAndGet(), Collections.<String, Object>singletonMap("eventCount", processedEvents));
        return store.save(snapshot).thenCompose(v -> {
            logger.debug("Saved {}", snapshot);
            if (retention == null) {
                return AsyncResult.done();
            }
            return store.deleteOlderThan(ctx.getProjectionName(), now.minus(retention)).thenAccept(removed -> {
                if (removed > 0) {
                    logger.debug("Removed {} snapshots of projection {} older than {}", removed,
                            ctx.getProjectionName(), retention);
                }
            });
        });
    }

    /**
     * Load the snapshot with highest version. Subsequent snapshots continue its version numbering.
     * @return latest snapshot, if any
     */
    public CompletionStage<Optional<ProjectionSnapshot<S>>> loadLatestSnapshot() {
        return AsyncResult.compose(() -> store.loadLatest(ensureAttached().getProjectionName()))
                .thenApply(snapshot -> {
                    snapshot.ifPresent(s -> version.set(s.getVersion()));
                    return snapshot;
                });
    }
}
