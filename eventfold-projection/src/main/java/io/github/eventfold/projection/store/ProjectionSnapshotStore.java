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

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Keeps versioned snapshots of projections.
 *
 * @param <S> type of the projection state
 */
public interface ProjectionSnapshotStore<S> {
    CompletionStage<Void> save(ProjectionSnapshot<S> snapshot);

    /**
     * The most recently saved snapshot.
     * @param projectionName projection
     * @return last saved snapshot, if any
     */
    CompletionStage<Optional<ProjectionSnapshot<S>>> load(String projectionName);

    /**
     * The snapshot with the highest version, regardless of its position.
     * @param projectionName projection
     * @return latest snapshot, if any
     */
    CompletionStage<Optional<ProjectionSnapshot<S>>> loadLatest(String projectionName);

    CompletionStage<Void> delete(String projectionName);

    /**
     * Remove snapshots of a projection taken before given instant.
     * @param projectionName projection
     * @param cutoff snapshots with timestamp before this instant are removed
     * @return number of removed snapshots
     */
    CompletionStage<Integer> deleteOlderThan(String projectionName, Instant cutoff);
}
