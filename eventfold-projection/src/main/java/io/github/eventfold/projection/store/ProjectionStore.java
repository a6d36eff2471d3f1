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

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Current state of projections, keyed by projection name. The engine of a projection is the only writer of its key.
 *
 * @param <S> type of the projection state
 */
public interface ProjectionStore<S> {
    CompletionStage<Optional<S>> load(String projectionName);

    CompletionStage<Void> save(String projectionName, S state);

    CompletionStage<Void> delete(String projectionName);

    default CompletionStage<Boolean> exists(String projectionName) {
        return load(projectionName).thenApply(Optional::isPresent);
    }
}
