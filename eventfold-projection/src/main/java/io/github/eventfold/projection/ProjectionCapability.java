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
import io.github.eventfold.core.Capability;
import io.github.eventfold.core.EventEnvelope;

import java.util.concurrent.CompletionStage;

/**
 * Behavior attached to a {@link ProjectionEngine}. Before and error hooks are invoked one after another in the order
 * capabilities were added, after hooks of all capabilities run concurrently and the engine waits for all of them.
 * Failure of a before hook aborts processing of the event.
 *
 * @param <S> type of the projection state
 */
public interface ProjectionCapability<S> extends Capability<ProjectionContext<S>> {

    default CompletionStage<Void> onBeforeApply(EventEnvelope event, S state) {
        return AsyncResult.done();
    }

    default CompletionStage<Void> onAfterApply(EventEnvelope event, S newState) {
        return AsyncResult.done();
    }

    /**
     * Called once processing of an event failed for good, after retries, if any.
     * @param error the failure, tagged with projection, event type and attempt count
     * @param event the event that failed
     * @return stage completing when the capability handled the failure
     */
    default CompletionStage<Void> onError(ProjectionException error, EventEnvelope event) {
        return AsyncResult.done();
    }

    /**
     * Called after the engine replaced the stored state with initial state, at start of a rebuild too. Capabilities
     * forget progress they counted since attachment or previous reset.
     * @param initialState the state stored by the reset
     * @return stage completing when the capability reset itself
     */
    default CompletionStage<Void> onReset(S initialState) {
        return AsyncResult.done();
    }

    default CompletionStage<Void> onRebuildComplete(S state) {
        return AsyncResult.done();
    }
}
