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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class VersioningCapabilityTest {

    @Test
    public void old_events_reach_handler_upcasted() {
        Thermometer thermometer = new Thermometer("t-1");
        thermometer.enableVersioning()
                .registerUpcaster("TemperatureMeasured", 1, Integer.class, (fahrenheit, m) ->
                        (fahrenheit - 32) * 5 / 9);
        thermometer.loadFromHistory(Arrays.asList(
                EventEnvelope.of("TemperatureMeasured", 212),
                EventEnvelope.of("TemperatureMeasured", 20, EventMetadata.create().upgradedTo(2))));
        assertThat(thermometer.readings, contains("v2:100", "v2:20"));
        assertEquals(2, thermometer.getVersion());
    }

    @Test
    public void versioned_handler_takes_precedence() {
        Thermometer thermometer = new Thermometer("t-1");
        thermometer.measure(30, 3);
        thermometer.measure(31, 1);
        assertThat(thermometer.readings, contains("v3:30", "any:31"));
    }

    @Test
    public void recorded_event_keeps_its_version() {
        Thermometer thermometer = new Thermometer("t-1");
        thermometer.enableVersioning()
                .registerUpcaster("TemperatureMeasured", 1, Integer.class, (fahrenheit, m) ->
                        (fahrenheit - 32) * 5 / 9);
        thermometer.measure(212, 1);
        assertThat(thermometer.readings, contains("v2:100"));
        assertEquals(1, thermometer.getDomainEvents().get(0).getEventVersion());
        assertEquals(212, thermometer.getDomainEvents().get(0).getPayload());
    }

    @Test
    public void missing_upcaster_stops_replay() {
        Thermometer thermometer = new Thermometer("t-1");
        thermometer.enableVersioning()
                .registerUpcaster("TemperatureMeasured", 2, Integer.class, (celsius, m) -> celsius);
        try {
            thermometer.loadFromHistory(Arrays.asList(EventEnvelope.of("TemperatureMeasured", 212)));
            fail("No upcaster from version 1");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.MISSING_UPCASTER, e.getFault());
        }
        assertEquals(3, thermometer.versioning().get().getLatestVersion("TemperatureMeasured"));
    }

    static class Thermometer extends AggregateRoot {
        final List<String> readings = new ArrayList<>();
        private final EventHandlers handlers = EventHandlers.builder()
                .on("TemperatureMeasured", 2, Integer.class, c -> readings.add("v2:" + c))
                .on("TemperatureMeasured", 3, Integer.class, c -> readings.add("v3:" + c))
                .on("TemperatureMeasured", Integer.class, c -> readings.add("any:" + c))
                .build();

        Thermometer(String id) {
            super(id);
        }

        void measure(int value, int eventVersion) {
            apply("TemperatureMeasured", value, EventMetadata.create().upgradedTo(eventVersion));
        }

        @Override
        protected EventHandlers eventHandlers() {
            return handlers;
        }
    }
}
