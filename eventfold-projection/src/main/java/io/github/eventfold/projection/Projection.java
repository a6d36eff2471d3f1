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

import io.github.eventfold.core.EventEnvelope;

import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * A fold of events into a read model. The function must not mutate the state it receives, it returns the state that
 * replaces it.
 *
 * @param <S> type of the projection state
 */
public interface Projection<S> {
    /**
     * Unique name, used as key in the projection stores.
     * @return projection name
     */
    String getName();

    /**
     * Event types this projection is interested in. Other events are never passed to {@link #apply}.
     * @return event types
     */
    Set<String> getEventTypes();

    S createInitialState();

    CompletionStage<S> apply(S state, EventEnvelope event);

    default boolean handles(String eventType) {
        return getEventTypes().contains(eventType);
    }
}
