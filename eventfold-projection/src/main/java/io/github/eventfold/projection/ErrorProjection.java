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
import io.github.eventfold.core.EventType;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * Counts failures of other projections, from the events published by
 * {@link io.github.eventfold.projection.capability.ErrorReportingCapability}.
 */
public class ErrorProjection implements Projection<ErrorCounts> {
    public static final String NAME = "system-errors";
    public static final String EVENT_TYPE = EventType.defaultTypeName(ProjectionErrorOccurred.class);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<String> getEventTypes() {
        return Collections.singleton(EVENT_TYPE);
    }

    @Override
    public ErrorCounts createInitialState() {
        return ErrorCounts.empty();
    }

    @Override
    public CompletionStage<ErrorCounts> apply(ErrorCounts state, EventEnvelope event) {
        return AsyncResult.invoke(() -> state.record(event.getPayload(ProjectionErrorOccurred.class)));
    }
}
