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

import java.util.List;
import java.util.Optional;

/**
 * The view of an aggregate its capabilities get on attachment.
 */
public interface AggregateContext {
    String getAggregateId();

    String getAggregateType();

    long getVersion();

    long getInitialVersion();

    /**
     * Copy of the events applied since last commit.
     * @return uncommitted events
     */
    List<EventEnvelope> getDomainEvents();

    /**
     * Lookup another capability attached to the same aggregate.
     * @param name the name the capability is registered under
     * @param type expected type of the capability
     * @param <T> capability type
     * @return the capability, if attached under the name with given type
     */
    <T extends AggregateCapability> Optional<T> capability(String name, Class<T> type);
}
