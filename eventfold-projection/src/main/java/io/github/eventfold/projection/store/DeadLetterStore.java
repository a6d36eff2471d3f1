package io.github.eventfold.projection.store;

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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Durable storage of events that projections could not process.
 */
public interface DeadLetterStore {
    CompletionStage<Void> store(DeadLetterEntry entry);

    /**
     * Entries of a projection, in the order they were stored.
     * @param projectionName projection
     * @return entries
     */
    CompletionStage<List<DeadLetterEntry>> getByProjection(String projectionName);

    CompletionStage<Optional<DeadLetterEntry>> get(String id);

    /**
     * Hand out the event of an entry for another processing attempt. The entry stays stored until deleted.
     * @param id entry id
     * @return the event, or stage failed with {@link io.github.eventfold.projection.ProjectionException}
     * {@code DEAD_LETTER_NOT_FOUND}
     */
    CompletionStage<EventEnvelope> retry(String id);

    CompletionStage<Void> delete(String id);
}
