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
import io.github.eventfold.core.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Delivers events to all interested engines of a registry. Engines process an event concurrently, failure of one
 * engine does not affect the others and is reported in the {@link ProcessingReport}.
 *
 * <p>Events must be submitted one after another: next event only after the report of the previous completed.</p>
 */
public class ProjectionProcessor {
    private final Logger logger;
    private final ProjectionEngineRegistry registry;

    public ProjectionProcessor(ProjectionEngineRegistry registry) {
        this(registry, LoggerFactory.getLogger(ProjectionProcessor.class));
    }

    public ProjectionProcessor(ProjectionEngineRegistry registry, Logger logger) {
        this.registry = Objects.requireNonNull(registry, "Registry must be specified");
        this.logger = Objects.requireNonNull(logger);
    }

    public CompletionStage<ProcessingReport> process(EventEnvelope event) {
        Objects.requireNonNull(event, "Event must be specified");
        List<ProjectionEngine<?>> engines = registry.getInterestedEngines(event);
        List<String> processed = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        CompletableFuture<?>[] stages = new CompletableFuture<?>[engines.size()];
        for (int i = 0; i < stages.length; i++) {
            ProjectionEngine<?> engine = engines.get(i);
            stages[i] = AsyncResult.compose(() -> engine.processEvent(event)).whenComplete((r, t) -> {
                synchronized (failures) {
                    if (t == null) {
                        processed.add(engine.getProjectionName());
                    } else {
                        Throwable cause = AsyncResult.unwrap(t);
                        logger.error("Projection {} failed to process event {} {}", engine.getProjectionName(),
                                event.getEventType(), event.getEventId(), cause);
                        failures.put(engine.getProjectionName(), cause);
                    }
                }
            }).toCompletableFuture();
        }
        return CompletableFuture.allOf(stages).handle((r, t) -> {
            synchronized (failures) {
                return new ProcessingReport(event, new ArrayList<>(processed), failures);
            }
        });
    }

    /**
     * Process events in order, each after the previous one was delivered to all engines.
     * @param events events to process
     * @return reports, one per event
     */
    public CompletionStage<List<ProcessingReport>> processAll(Iterable<EventEnvelope> events) {
        List<ProcessingReport> reports = new ArrayList<>();
        CompletionStage<Void> chain = AsyncResult.done();
        for (EventEnvelope event : events) {
            chain = chain.thenCompose(v -> process(event)).thenAccept(reports::add);
        }
        return chain.thenApply(v -> reports);
    }
}
