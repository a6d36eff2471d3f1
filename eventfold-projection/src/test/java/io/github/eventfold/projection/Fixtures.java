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
import io.github.eventfold.core.EventMetadata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Projections, events and helpers shared by projection tests.
 */
public final class Fixtures {
    private Fixtures() {
    }

    public static final String COUNTER = "counter";

    public static HandlerProjection<Integer> counter() {
        return HandlerProjection.builder(COUNTER, () -> 0)
                .on("Incremented", (count, e) -> count + 1)
                .on("Decremented", (count, e) -> count - 1)
                .on("Added", Integer.class, (count, amount) -> count + amount)
                .build();
    }

    public static EventEnvelope event(String type) {
        return EventEnvelope.of(type, null);
    }

    public static EventEnvelope event(String type, Object payload, long position) {
        return EventEnvelope.of(type, payload, EventMetadata.builder().position(position).build());
    }

    public static List<EventEnvelope> increments(int count) {
        List<EventEnvelope> events = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            events.add(event("Incremented", null, i));
        }
        return events;
    }

    public static <T> T sync(CompletionStage<T> stage) throws Exception {
        return stage.toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    public static Throwable failure(CompletionStage<?> stage) throws Exception {
        try {
            stage.toCompletableFuture().get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        throw new AssertionError("Stage completed successfully");
    }

    public static class MutableClock extends Clock {
        private Instant now;

        public MutableClock(Instant now) {
            this.now = now;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
