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

import io.github.eventfold.projection.ProjectionEngineTest.RecordingCapability;
import io.github.eventfold.projection.capability.CheckpointCapability;
import io.github.eventfold.projection.capability.CircuitBreakerCapability;
import io.github.eventfold.projection.capability.CircuitBreakerConfig;
import io.github.eventfold.projection.capability.DeadLetterCapability;
import io.github.eventfold.projection.capability.ProjectionSnapshotCapability;
import io.github.eventfold.projection.retry.RetryConfig;
import io.github.eventfold.projection.store.ProjectionCheckpoint;
import io.github.eventfold.projection.store.inmemory.InMemoryCheckpointStore;
import io.github.eventfold.projection.store.inmemory.InMemoryDeadLetterStore;
import io.github.eventfold.projection.store.inmemory.InMemoryProjectionSnapshotStore;
import io.github.eventfold.projection.store.inmemory.InMemoryProjectionStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static io.github.eventfold.projection.Fixtures.COUNTER;
import static io.github.eventfold.projection.Fixtures.counter;
import static io.github.eventfold.projection.Fixtures.increments;
import static io.github.eventfold.projection.Fixtures.sync;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ProjectionBuilderTest {
    private ScheduledExecutorService scheduler;

    @Before
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @After
    public void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    public void plain_engine_without_retry() {
        ProjectionEngine<Integer> engine = ProjectionBuilder.of(counter(), new InMemoryProjectionStore<>()).build();
        assertSame(ProjectionEngine.class, engine.getClass());
        assertTrue(engine.getCapabilityNames().isEmpty());
    }

    @Test
    public void retry_config_selects_retrying_engine() {
        RetryConfig config = RetryConfig.builder().maxAttempts(5).build();
        ProjectionEngine<Integer> engine = ProjectionBuilder.of(counter(), new InMemoryProjectionStore<>())
                .withRetry(config, scheduler)
                .build();
        assertThat(engine, instanceOf(RetryingProjectionEngine.class));
        assertSame(config, ((RetryingProjectionEngine<Integer>) engine).getRetryConfig());
    }

    @Test
    public void circuit_breaker_is_attached_first() {
        ProjectionEngine<Integer> engine = ProjectionBuilder.of(counter(), new InMemoryProjectionStore<>())
                .withDeadLetter(new InMemoryDeadLetterStore())
                .withSnapshots(new InMemoryProjectionSnapshotStore<>(), 10)
                .withCheckpoints(new InMemoryCheckpointStore<>(), 10)
                .withCapability(new RecordingCapability("audit", new ArrayList<>()))
                .withCircuitBreaker(CircuitBreakerConfig.defaults())
                .build();
        assertThat(engine.getCapabilityNames(), contains(CircuitBreakerCapability.NAME, "audit",
                CheckpointCapability.NAME, ProjectionSnapshotCapability.NAME, DeadLetterCapability.NAME));
    }

    @Test
    public void built_checkpoints_are_saved_when_rebuild_completes() throws Exception {
        InMemoryCheckpointStore<Integer> checkpoints = new InMemoryCheckpointStore<>();
        ProjectionEngine<Integer> engine = ProjectionBuilder.of(counter(), new InMemoryProjectionStore<>())
                .withCheckpoints(checkpoints)
                .build();

        sync(engine.rebuild(increments(5)));

        ProjectionCheckpoint<Integer> checkpoint = sync(checkpoints.load(COUNTER)).get();
        assertEquals(Integer.valueOf(5), checkpoint.getState());
        assertEquals(5, checkpoint.getPosition());
        assertEquals(1, checkpoints.getSaveCount());
    }
}
