package io.github.eventfold.projection.capability;

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
import io.github.eventfold.projection.Fixtures.MutableClock;
import io.github.eventfold.projection.HandlerProjection;
import io.github.eventfold.projection.ProjectionEngine;
import io.github.eventfold.projection.ProjectionException;
import io.github.eventfold.projection.store.DeadLetterEntry;
import io.github.eventfold.projection.store.inmemory.InMemoryDeadLetterStore;
import io.github.eventfold.projection.store.inmemory.InMemoryProjectionStore;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static io.github.eventfold.projection.Fixtures.event;
import static io.github.eventfold.projection.Fixtures.failure;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class DeadLetterCapabilityTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryDeadLetterStore deadLetters;
    private ProjectionEngine<Integer> engine;

    @Before
    public void setUp() {
        deadLetters = new InMemoryDeadLetterStore();
        engine = new ProjectionEngine<>(HandlerProjection.<Integer>builder("broken", () -> 0)
                .on("Incremented", (count, e) -> {
                    throw new IllegalStateException("boom");
                })
                .build(), new InMemoryProjectionStore<>());
    }

    private void deadLetterWith(DeadLetterPolicy policy) {
        engine.addCapability(new DeadLetterCapability<>(deadLetters, policy, new MutableClock(NOW),
                LoggerFactory.getLogger(getClass())));
    }

    @Test
    public void failed_event_is_stored_with_failure_context() throws Exception {
        deadLetterWith(DeadLetterPolicy.afterAttempts(1));
        EventEnvelope event = event("Incremented");
        Throwable error = failure(engine.processEvent(event));

        assertEquals(1, deadLetters.size());
        DeadLetterEntry entry = deadLetters.getAll().get(0);
        assertEquals("broken", entry.getProjectionName());
        assertSame(event, entry.getEvent());
        assertSame(error, entry.getError());
        assertEquals(1, entry.getAttemptCount());
        assertEquals(NOW, entry.getFirstFailedAt());
        assertEquals(NOW, entry.getLastFailedAt());
        assertEquals("PROCESSING_FAILED", entry.getMetadata().get("fault"));
        assertEquals(IllegalStateException.class.getName(), entry.getMetadata().get("errorType"));
        assertEquals("boom", entry.getMetadata().get("errorMessage"));
    }

    @Test
    public void default_policy_waits_for_three_attempts() throws Exception {
        deadLetterWith(DeadLetterPolicy.defaultPolicy());
        failure(engine.processEvent(event("Incremented")));
        assertEquals(0, deadLetters.size());
    }

    @Test
    public void custom_policy_decides_on_the_error() throws Exception {
        deadLetterWith((error, attempts) -> error.getCause() instanceof IllegalStateException);
        failure(engine.processEvent(event("Incremented")));
        assertEquals(1, deadLetters.size());
    }

    @Test
    public void detached_capability_fails_its_hook() throws Exception {
        DeadLetterCapability<Integer> capability = new DeadLetterCapability<>(deadLetters);
        Throwable error = failure(capability.onError(ProjectionException.stateNotFound("broken"),
                event("Incremented")));
        assertThat(error, instanceOf(ProjectionException.class));
        assertEquals(ProjectionException.Fault.CAPABILITY_NOT_ATTACHED, ((ProjectionException) error).getFault());
    }

    @Test(expected = ProjectionException.class)
    public void attempts_must_be_positive() {
        DeadLetterPolicy.afterAttempts(0);
    }
}
