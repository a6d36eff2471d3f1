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
import io.github.eventfold.core.EventEnvelope;
import io.github.eventfold.projection.store.inmemory.InMemoryProjectionStore;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.github.eventfold.projection.Fixtures.COUNTER;
import static io.github.eventfold.projection.Fixtures.counter;
import static io.github.eventfold.projection.Fixtures.event;
import static io.github.eventfold.projection.Fixtures.failure;
import static io.github.eventfold.projection.Fixtures.increments;
import static io.github.eventfold.projection.Fixtures.sync;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.arrayWithSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ProjectionEngineTest {
    private InMemoryProjectionStore<Integer> store;
    private ProjectionEngine<Integer> engine;

    @Before
    public void setUp() {
        store = new InMemoryProjectionStore<>();
        engine = new ProjectionEngine<>(counter(), store);
    }

    @Test
    public void interest_is_decided_by_event_type() {
        assertTrue(engine.isInterestedIn(event("Incremented")));
        assertFalse(engine.isInterestedIn(event("Renamed")));
    }

    @Test
    public void initial_state_is_created_and_persisted_on_first_use() throws Exception {
        assertEquals(Optional.empty(), sync(store.load(COUNTER)));
        assertEquals(Integer.valueOf(0), sync(engine.getState()));
        assertEquals(Optional.of(0), sync(store.load(COUNTER)));
    }

    @Test
    public void processed_events_update_persisted_state() throws Exception {
        sync(engine.processEvent(event("Incremented")));
        sync(engine.processEvent(event("Incremented")));
        sync(engine.processEvent(event("Added", 10, 3)));
        sync(engine.processEvent(event("Decremented")));
        assertEquals(Optional.of(11), sync(store.load(COUNTER)));
    }

    @Test
    public void uninteresting_events_are_ignored() throws Exception {
        RecordingCapability recorder = new RecordingCapability("recorder", new ArrayList<>());
        engine.addCapability(recorder);
        sync(engine.processEvent(event("Renamed")));
        assertEquals(Optional.empty(), sync(store.load(COUNTER)));
        assertTrue(recorder.calls.isEmpty());
    }

    @Test
    public void failure_of_projection_is_wrapped_reported_and_rethrown() throws Exception {
        IllegalStateException boom = new IllegalStateException("boom");
        ProjectionEngine<Integer> failing = new ProjectionEngine<>(HandlerProjection.builder("failing", () -> 0)
                .on("Incremented", (count, e) -> {
                    throw boom;
                }).build(), store);
        List<String> calls = new ArrayList<>();
        RecordingCapability recorder = new RecordingCapability("recorder", calls);
        failing.addCapability(recorder);

        Throwable t = failure(failing.processEvent(event("Incremented")));
        assertThat(t, instanceOf(ProjectionException.class));
        ProjectionException error = (ProjectionException) t;
        assertEquals(ProjectionException.Fault.PROCESSING_FAILED, error.getFault());
        assertEquals(Optional.of("failing"), error.getProjectionName());
        assertEquals(Optional.of("Incremented"), error.getEventType());
        assertSame(boom, error.getCause());
        assertThat(calls, contains("recorder.before:Incremented", "recorder.error:PROCESSING_FAILED"));
        assertSame(error, recorder.lastError);
        assertEquals(Optional.of(0), sync(store.load("failing")));
    }

    @Test
    public void before_and_error_hooks_run_in_registration_order() throws Exception {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        engine.addCapability(new RecordingCapability("first", calls));
        engine.addCapability(new RecordingCapability("second", calls));
        engine.addCapability(new RecordingCapability("gate", calls) {
            @Override
            public CompletionStage<Void> onBeforeApply(EventEnvelope event, Integer state) {
                super.onBeforeApply(event, state);
                return AsyncResult.throwing(new IllegalStateException("closed"));
            }
        });
        engine.addCapability(new RecordingCapability("last", calls));

        failure(engine.processEvent(event("Incremented")));
        assertThat(calls, contains("first.before:Incremented", "second.before:Incremented",
                "gate.before:Incremented", "first.error:PROCESSING_FAILED", "second.error:PROCESSING_FAILED",
                "gate.error:PROCESSING_FAILED", "last.error:PROCESSING_FAILED"));
        assertEquals(Optional.of(0), sync(store.load(COUNTER)));
    }

    @Test
    public void engine_awaits_all_after_hooks() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<String> calls = Collections.synchronizedList(new ArrayList<>());
            for (String name : Arrays.asList("slow", "fast")) {
                long delay = name.equals("slow") ? 50 : 0;
                engine.addCapability(new RecordingCapability(name, calls) {
                    @Override
                    public CompletionStage<Void> onAfterApply(EventEnvelope event, Integer newState) {
                        return CompletableFuture.runAsync(() -> {
                            sleep(delay);
                            super.onAfterApply(event, newState);
                        }, executor);
                    }
                });
            }
            sync(engine.processEvent(event("Incremented")));
            assertEquals(4, calls.size());
            assertTrue(calls.contains("slow.after:1"));
            assertTrue(calls.contains("fast.after:1"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void failing_error_hook_does_not_stop_other_hooks() throws Exception {
        List<String> calls = new ArrayList<>();
        IllegalStateException hookFailure = new IllegalStateException("hook failed");
        engine.addCapability(new RecordingCapability("broken", calls) {
            @Override
            public CompletionStage<Void> onError(ProjectionException error, EventEnvelope event) {
                throw hookFailure;
            }
        });
        engine.addCapability(new RecordingCapability("gate", calls) {
            @Override
            public CompletionStage<Void> onBeforeApply(EventEnvelope event, Integer state) {
                throw new IllegalArgumentException("rejected");
            }
        });
        ProjectionException error = (ProjectionException) failure(engine.processEvent(event("Incremented")));
        assertThat(error.getCause(), instanceOf(IllegalArgumentException.class));
        assertThat(error.getSuppressed(), arrayWithSize(1));
        assertSame(hookFailure, error.getSuppressed()[0]);
        assertTrue(calls.contains("gate.error:PROCESSING_FAILED"));
    }

    @Test
    public void failing_after_hook_fails_processing_but_keeps_state() throws Exception {
        engine.addCapability(new RecordingCapability("broken", new ArrayList<>()) {
            @Override
            public CompletionStage<Void> onAfterApply(EventEnvelope event, Integer newState) {
                return AsyncResult.throwing(new IllegalStateException("side effect failed"));
            }
        });
        assertThat(failure(engine.processEvent(event("Incremented"))), instanceOf(ProjectionException.class));
        assertEquals(Optional.of(1), sync(store.load(COUNTER)));
    }

    @Test
    public void reset_restores_initial_state() throws Exception {
        sync(engine.processEvent(event("Incremented")));
        sync(engine.reset());
        assertEquals(Integer.valueOf(0), sync(engine.getState()));
    }

    @Test
    public void rebuild_is_idempotent() throws Exception {
        List<EventEnvelope> history = Arrays.asList(event("Incremented"), event("Renamed"), event("Added", 5, 3),
                event("Decremented"), event("Incremented"));
        assertEquals(Integer.valueOf(6), sync(engine.rebuild(history)));
        assertEquals(Integer.valueOf(6), sync(engine.rebuild(history)));
        assertEquals(Optional.of(6), sync(store.load(COUNTER)));
    }

    @Test
    public void rebuild_discards_previous_state() throws Exception {
        sync(engine.processEvent(event("Added", 100, 1)));
        assertEquals(Integer.valueOf(2), sync(engine.rebuild(increments(2))));
    }

    @Test
    public void rebuild_handles_long_synchronous_history() throws Exception {
        assertEquals(Integer.valueOf(20_000), sync(engine.rebuild(increments(20_000))));
    }

    @Test
    public void rebuild_pulls_from_asynchronous_source_in_order() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            List<Integer> applied = Collections.synchronizedList(new ArrayList<>());
            ProjectionEngine<List<Integer>> ordered = new ProjectionEngine<>(
                    HandlerProjection.<List<Integer>>builder("ordered", Collections::emptyList)
                            .on("Added", Integer.class, (list, n) -> {
                                applied.add(n);
                                List<Integer> next = new ArrayList<>(list);
                                next.add(n);
                                return next;
                            }).build(), new InMemoryProjectionStore<>());
            Iterator<EventEnvelope> it = Arrays.asList(event("Added", 1, 1), event("Added", 2, 2),
                    event("Added", 3, 3)).iterator();
            EventSource source = () -> CompletableFuture.supplyAsync(
                    () -> it.hasNext() ? Optional.of(it.next()) : Optional.<EventEnvelope>empty(), executor);
            assertEquals(Arrays.asList(1, 2, 3), sync(ordered.rebuild(source)));
            assertEquals(Arrays.asList(1, 2, 3), applied);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void rebuild_stops_at_failing_event() throws Exception {
        ProjectionEngine<Integer> failing = new ProjectionEngine<>(HandlerProjection.builder("failing", () -> 0)
                .on("Incremented", (count, e) -> count + 1)
                .on("Poison", (count, e) -> {
                    throw new IllegalStateException("poison");
                }).build(), store);
        Throwable t = failure(failing.rebuild(Arrays.asList(event("Incremented"), event("Poison"),
                event("Incremented"))));
        assertThat(t, instanceOf(ProjectionException.class));
        assertEquals(Optional.of(1), sync(store.load("failing")));
    }

    @Test
    public void rebuild_complete_hook_receives_final_state() throws Exception {
        List<String> calls = new ArrayList<>();
        engine.addCapability(new RecordingCapability("recorder", calls));
        sync(engine.rebuild(increments(3)));
        assertEquals("recorder.rebuilt:3", calls.get(calls.size() - 1));
    }

    @Test
    public void rebuild_resets_capabilities_before_first_event() throws Exception {
        List<String> calls = new ArrayList<>();
        engine.addCapability(new RecordingCapability("recorder", calls));
        sync(engine.processEvent(event("Incremented")));
        calls.clear();

        sync(engine.rebuild(increments(1)));

        assertThat(calls, contains("recorder.reset:0", "recorder.before:Incremented", "recorder.after:1",
                "recorder.rebuilt:1"));
    }

    @Test
    public void replaced_capability_is_detached() {
        RecordingCapability first = new RecordingCapability("recorder", new ArrayList<>());
        RecordingCapability second = new RecordingCapability("recorder", new ArrayList<>());
        engine.addCapability(first);
        engine.addCapability(second);
        assertFalse(first.attached);
        assertTrue(second.attached);
        assertSame(second, engine.getCapability("recorder", RecordingCapability.class).get());
        assertTrue(engine.removeCapability("recorder"));
        assertFalse(second.attached);
        assertFalse(engine.hasCapability("recorder"));
        assertFalse(engine.removeCapability("recorder"));
    }

    @Test
    public void capability_lookup_checks_type() {
        engine.addCapability(new RecordingCapability("recorder", new ArrayList<>()));
        assertFalse(engine.getCapability("recorder", String.class).isPresent());
        assertFalse(engine.getCapability("missing", RecordingCapability.class).isPresent());
        assertThat(engine.getCapabilityNames(), contains("recorder"));
    }

    @Test
    public void projection_without_initial_state_fails() throws Exception {
        ProjectionEngine<Integer> broken = new ProjectionEngine<>(HandlerProjection.<Integer>builder("broken",
                () -> null).on("Incremented", (count, e) -> count + 1).build(), store);
        ProjectionException error = (ProjectionException) failure(broken.processEvent(event("Incremented")));
        assertEquals(ProjectionException.Fault.STATE_NOT_FOUND, error.getFault());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static class RecordingCapability implements ProjectionCapability<Integer> {
        private final String name;
        final List<String> calls;
        boolean attached;
        ProjectionException lastError;

        RecordingCapability(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void attach(ProjectionContext<Integer> context) {
            attached = true;
        }

        @Override
        public void detach() {
            attached = false;
        }

        @Override
        public CompletionStage<Void> onBeforeApply(EventEnvelope event, Integer state) {
            calls.add(name + ".before:" + event.getEventType());
            return AsyncResult.done();
        }

        @Override
        public CompletionStage<Void> onAfterApply(EventEnvelope event, Integer newState) {
            calls.add(name + ".after:" + newState);
            return AsyncResult.done();
        }

        @Override
        public CompletionStage<Void> onError(ProjectionException error, EventEnvelope event) {
            calls.add(name + ".error:" + error.getFault());
            lastError = error;
            return AsyncResult.done();
        }

        @Override
        public CompletionStage<Void> onReset(Integer initialState) {
            calls.add(name + ".reset:" + initialState);
            return AsyncResult.done();
        }

        @Override
        public CompletionStage<Void> onRebuildComplete(Integer state) {
            calls.add(name + ".rebuilt:" + state);
            return AsyncResult.done();
        }
    }
}
