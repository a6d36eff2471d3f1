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

import io.github.eventfold.core.EventEnvelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of fanning one event out to projections.
 */
public final class ProcessingReport {
    private final EventEnvelope event;
    private final List<String> processed;
    private final Map<String, Throwable> failures;

    ProcessingReport(EventEnvelope event, List<String> processed, Map<String, Throwable> failures) {
        this.event = event;
        this.processed = Collections.unmodifiableList(processed);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public EventEnvelope getEvent() {
        return event;
    }

    /**
     * Projections that processed the event successfully.
     * @return projection names
     */
    public List<String> getProcessed() {
        return processed;
    }

    /**
     * Failures by projection name.
     * @return failures
     */
    public Map<String, Throwable> getFailures() {
        return failures;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "ProcessingReport{" + "event=" + event.getEventType() + ", processed=" + processed + ", failures="
                + failures.keySet() + '}';
    }
}
