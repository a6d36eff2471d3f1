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
 * A pluggable unit of behavior attached to a host, an aggregate or a projection engine. Host calls
 * {@link #attach(Object)} when the capability is added and {@link #detach()} when it is removed or replaced.
 *
 * @param <C> the context the host exposes to its capabilities
 */
public interface Capability<C> {
    /**
     * Name under which the capability registers by default.
     * @return capability name
     */
    String getName();

    void attach(C context);

    default void detach() {
    }
}
