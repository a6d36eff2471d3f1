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

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Ordered, possibly asynchronous sequence of events, pulled one at a time.
 */
@FunctionalInterface
public interface EventSource {
    /**
     * Next event of the sequence.
     * @return stage with the next event, or empty when the sequence is exhausted
     */
    CompletionStage<Optional<EventEnvelope>> next();

    static EventSource of(Iterable<EventEnvelope> events) {
        Iterator<EventEnvelope> it = events.iterator();
        return () -> AsyncResult.returning(it.hasNext() ? Optional.of(it.next()) : Optional.empty());
    }
}
