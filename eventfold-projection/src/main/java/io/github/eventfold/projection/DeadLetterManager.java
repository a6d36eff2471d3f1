package io.github.eventfold.projection;

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
import io.github.eventfold.projection.store.DeadLetterEntry;
import io.github.eventfold.projection.store.DeadLetterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lists and replays dead letters through the engines of a registry.
 *
 * <p>A replayed entry is deleted once its engine processed the event. When processing fails again the entry is kept,
 * unless the engine dead-lettered the event anew, in which case the new entry replaces it.</p>
 */
public class DeadLetterManager {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final DeadLetterStore store;
    private final ProjectionEngineRegistry registry;

    public DeadLetterManager(DeadLetterStore store, ProjectionEngineRegistry registry) {
        this.store = Objects.requireNonNull(store, "Dead letter store must be specified");
        this.registry = Objects.requireNonNull(registry, "Registry must be specified");
    }

    public CompletionStage<List<DeadLetterEntry>> list(String projectionName) {
        return store.getByProjection(projectionName);
    }

    public CompletionStage<Integer> count(String projectionName) {
        return store.getByProjection(projectionName).thenApply(List::size);
    }

    /**
     * Process the event of an entry again.
     * @param id entry id
     * @return stage completing when the event was processed and the entry deleted. Fails with
     * {@link ProjectionException} {@code DEAD_LETTER_NOT_FOUND} for unknown entries, {@code INVALID_CONFIGURATION}
     * when no engine of the entry's projection is registered, or with the processing failure.
     */
    public CompletionStage<Void> replay(String id) {
        return AsyncResult.compose(() -> store.get(id)).thenCompose(found -> {
            DeadLetterEntry entry = found.orElseThrow(() -> ProjectionException.deadLetterNotFound(id));
            ProjectionEngine<?> engine = registry.get(entry.getProjectionName())
                    .orElseThrow(() -> ProjectionException.invalidConfiguration("projectionName",
                            "no engine registered for projection " + entry.getProjectionName()));
            return store.retry(id)
                    .thenCompose(engine::processEvent)
                    .handle((r, t) -> t)
                    .thenCompose(t -> {
                        if (t == null) {
                            logger.info("Dead letter {} of projection {} replayed", id, entry.getProjectionName());
                            return store.delete(id);
                        }
                        return dropIfSuperseded(entry).thenCompose(v -> AsyncResult.<Void>throwing(
                                AsyncResult.unwrap(t)));
                    });
        });
    }

    private CompletionStage<Void> dropIfSuperseded(DeadLetterEntry entry) {
        return store.getByProjection(entry.getProjectionName()).thenCompose(entries -> {
            boolean superseded = entries.stream().anyMatch(e -> !e.getId().equals(entry.getId())
                    && e.getEvent().getEventId().equals(entry.getEvent().getEventId()));
            return superseded ? store.delete(entry.getId()) : AsyncResult.done();
        });
    }

    /**
     * Replay all entries of a projection, one after another. Failed replays are logged and do not stop the others.
     * @param projectionName projection
     * @return number of successfully replayed entries
     */
    public CompletionStage<Integer> replayAll(String projectionName) {
        return store.getByProjection(projectionName).thenCompose(entries -> {
            AtomicInteger replayed = new AtomicInteger();
            CompletionStage<Void> chain = AsyncResult.done();
            for (DeadLetterEntry entry : entries) {
                chain = chain.thenCompose(v -> replay(entry.getId()).<Void>handle((r, t) -> {
                    if (t == null) {
                        replayed.incrementAndGet();
                    } else {
                        logger.warn("Replay of dead letter {} of projection {} failed", entry.getId(), projectionName,
                                AsyncResult.unwrap(t));
                    }
                    return null;
                }));
            }
            return chain.thenApply(v -> replayed.get());
        });
    }
}
