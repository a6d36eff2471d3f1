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
 * Keeps the latest checkpoint of every projection. Saving replaces the previous checkpoint.
 *
 * @param <S> type of the projection state
 */
public interface CheckpointStore<S> {
    CompletionStage<Void> save(ProjectionCheckpoint<S> checkpoint);

    CompletionStage<Optional<ProjectionCheckpoint<S>>> load(String projectionName);

    CompletionStage<Void> delete(String projectionName);
}
