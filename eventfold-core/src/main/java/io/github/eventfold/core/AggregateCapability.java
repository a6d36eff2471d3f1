package io.github.eventfold.core;

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

/**
 * Capability of an aggregate. The aggregate invokes the hooks of its capabilities, in order of their registration,
 * around every event it applies.
 */
public interface AggregateCapability extends Capability<AggregateContext> {

    /**
     * Invoked before the event is added to the aggregate. Throwing an exception aborts the application.
     * @param event the event about to be applied, already enriched with aggregate metadata
     */
    default void onBeforeApply(EventEnvelope event) {
    }

    /**
     * Invoked after the event handler completed.
     * @param event the applied event
     */
    default void onAfterApply(EventEnvelope event) {
    }

    /**
     * Invoked when the event handler fails. The failure is rethrown to the caller after all capabilities were notified.
     * @param event the event that failed to apply
     * @param error the failure of the handler
     */
    default void onError(EventEnvelope event, RuntimeException error) {
    }
}
