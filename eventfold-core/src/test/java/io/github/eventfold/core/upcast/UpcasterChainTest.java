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

import io.github.eventfold.core.AggregateException;
import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.core.EventMetadata;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UpcasterChainTest {
    private UpcasterChain chain;

    @Before
    public void setUp() {
        chain = new UpcasterChain();
    }

    @Test
    public void latest_version_is_one_above_highest_source() {
        assertEquals(1, chain.getLatestVersion("AddressChanged"));
        chain.register("AddressChanged", 1, (Object p, EventMetadata m) -> p);
        chain.register("AddressChanged", 2, (Object p, EventMetadata m) -> p);
        assertEquals(3, chain.getLatestVersion("AddressChanged"));
        assertTrue(chain.hasUpcaster("AddressChanged", 2));
        assertFalse(chain.hasUpcaster("AddressChanged", 3));
        assertThat(chain.getRegisteredEventTypes(), containsInAnyOrder("AddressChanged"));
    }

    @Test
    public void duplicate_upcaster_is_rejected() {
        chain.register("AddressChanged", 1, (Object p, EventMetadata m) -> p);
        try {
            chain.register("AddressChanged", 1, (Object p, EventMetadata m) -> p);
            fail("Duplicate should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.DUPLICATE_UPCASTER, e.getFault());
            assertEquals("Upcaster for event AddressChanged version 1 already exists", e.getMessage());
        }
    }

    @Test
    public void chain_applies_all_steps_in_order() {
        // v1 has single line address, v2 splits street and city, v3 adds country
        chain.register("AddressChanged", 1, String.class, (p, m) -> {
            String[] parts = p.split(",");
            Map<String, String> v2 = new HashMap<>();
            v2.put("street", parts[0].trim());
            v2.put("city", parts[1].trim());
            return v2;
        });
        chain.register("AddressChanged", 2, (Object p, EventMetadata m) -> {
            Map<Object, Object> v3 = new HashMap<>((Map<?, ?>) p);
            v3.put("country", "CZ");
            return v3;
        });
        EventEnvelope v1 = EventEnvelope.of("AddressChanged", "Vodickova 1, Praha");

        EventEnvelope upcasted = chain.upcast(v1);
        assertEquals(3, upcasted.getEventVersion());
        Map<String, String> expected = new HashMap<>();
        expected.put("street", "Vodickova 1");
        expected.put("city", "Praha");
        expected.put("country", "CZ");
        assertEquals(expected, upcasted.getPayload());
        assertEquals(v1.getEventId(), upcasted.getEventId());
        // original untouched
        assertEquals(1, v1.getEventVersion());
        assertEquals("Vodickova 1, Praha", v1.getPayload());
    }

    @Test
    public void chain_starts_at_declared_version() {
        chain.register("AddressChanged", 1, (Object p, EventMetadata m) -> {
            throw new AssertionError("v1 upcaster should not run");
        });
        chain.register("AddressChanged", 2, String.class, (p, m) -> p + "!");
        EventEnvelope v2 = EventEnvelope.of("AddressChanged", "addr", EventMetadata.create().upgradedTo(2));
        EventEnvelope upcasted = chain.upcast(v2);
        assertEquals("addr!", upcasted.getPayload());
        assertEquals(3, upcasted.getEventVersion());
    }

    @Test
    public void current_event_is_returned_unchanged() {
        chain.register("AddressChanged", 1, (Object p, EventMetadata m) -> p);
        EventEnvelope current = EventEnvelope.of("AddressChanged", "x", EventMetadata.create().upgradedTo(2));
        assertSame(current, chain.upcast(current));
        EventEnvelope other = EventEnvelope.of("NameChanged", "y");
        assertSame(other, chain.upcast(other));
    }

    @Test
    public void missing_step_fails_without_partial_result() {
        Map<String, Object> original = new HashMap<>();
        original.put("line", "Vodickova 1");
        chain.register("AddressChanged", 1, (Object p, EventMetadata m) -> {
            Map<Object, Object> copy = new HashMap<>((Map<?, ?>) p);
            copy.put("v2", true);
            return copy;
        });
        chain.register("AddressChanged", 3, (Object p, EventMetadata m) -> p);
        EventEnvelope v1 = EventEnvelope.of("AddressChanged", original);
        try {
            chain.upcast(v1);
            fail("Missing upcaster 2 -> 3 should fail");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.MISSING_UPCASTER, e.getFault());
            assertEquals(2, e.getContext().get("fromVersion"));
            assertEquals(3, e.getContext().get("toVersion"));
        }
        assertEquals(Collections.singletonMap("line", "Vodickova 1"), v1.getPayload());
        assertEquals(1, v1.getEventVersion());
    }

    @Test(expected = ClassCastException.class)
    public void typed_upcaster_rejects_payload_of_other_type() {
        chain.register("AddressChanged", 1, String.class, (p, m) -> p.trim());
        chain.upcast(EventEnvelope.of("AddressChanged", 42));
    }

    @Test
    public void invalid_registration_is_rejected() {
        try {
            chain.register("AddressChanged", 0, (Object p, EventMetadata m) -> p);
            fail("Version 0 should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.INVALID_ARGUMENTS, e.getFault());
        }
    }
}
