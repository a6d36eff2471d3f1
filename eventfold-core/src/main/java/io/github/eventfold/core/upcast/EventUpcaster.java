package io.github.eventfold.core.upcast;

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

import io.github.eventfold.core.EventMetadata;

/**
 * Migrates event payload from one schema version to the next one. Upcasters must not modify the payload passed in.
 *
 * @param <F> payload type of the source version
 * @param <T> payload type of the next version
 */
@FunctionalInterface
public interface EventUpcaster<F, T> {
    T upcast(F payload, EventMetadata metadata);
}
