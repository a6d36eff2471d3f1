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
import io.github.eventfold.core.EventType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Projection assembled from a table of per event type handlers.
 * <pre>
 * Projection&lt;Balance&gt; p = HandlerProjection.builder("balances", Balance::empty)
 *     .on(MoneyDeposited.class, (state, e) -&gt; state.plus(e.getAmount()))
 *     .on("AccountClosed", (state, e) -&gt; state.closed())
 *     .build();
 * </pre>
 *
 * @param <S> type of the projection state
 */
public final class HandlerProjection<S> implements Projection<S> {
    private final String name;
    private final Supplier<S> initialState;
    private final Map<String, BiFunction<S, EventEnvelope, CompletionStage<S>>> handlers;

    private HandlerProjection(Builder<S> builder) {
        this.name = builder.name;
        this.initialState = builder.initialState;
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Set<String> getEventTypes() {
        return handlers.keySet();
    }

    @Override
    public S createInitialState() {
        return initialState.get();
    }

    @Override
    public CompletionStage<S> apply(S state, EventEnvelope event) {
        BiFunction<S, EventEnvelope, CompletionStage<S>> handler = handlers.get(event.getEventType());
        if (handler == null) {
            return AsyncResult.returning(state);
        }
        return AsyncResult.compose(() -> handler.apply(state, event));
    }

    public static <S> Builder<S> builder(String name, Supplier<S> initialState) {
        return new Builder<>(name, initialState);
    }

    public static final class Builder<S> {
        private final String name;
        private final Supplier<S> initialState;
        private final Map<String, BiFunction<S, EventEnvelope, CompletionStage<S>>> handlers = new LinkedHashMap<>();

        private Builder(String name, Supplier<S> initialState) {
            if (name == null || name.isEmpty()) {
                throw ProjectionException.invalidConfiguration("name", "projection name must not be empty");
            }
            this.name = name;
            this.initialState = Objects.requireNonNull(initialState, "Initial state supplier must be specified");
        }

        public Builder<S> on(String eventType, BiFunction<S, EventEnvelope, S> handler) {
            Objects.requireNonNull(handler);
            return onAsync(eventType, (state, event) -> AsyncResult.returning(handler.apply(state, event)));
        }

        public <P> Builder<S> on(String eventType, Class<P> payloadType, BiFunction<S, P, S> handler) {
            Objects.requireNonNull(payloadType);
            Objects.requireNonNull(handler);
            return on(eventType, (state, event) -> handler.apply(state, event.getPayload(payloadType)));
        }

        /**
         * Register handler for payloads of a class, under event type derived from the class name.
         * @see EventType#defaultTypeName(Class)
         */
        public <P> Builder<S> on(Class<P> payloadType, BiFunction<S, P, S> handler) {
            return on(EventType.defaultTypeName(payloadType), payloadType, handler);
        }

        public Builder<S> onAsync(String eventType, BiFunction<S, EventEnvelope, CompletionStage<S>> handler) {
            Objects.requireNonNull(eventType, "Event type must be specified");
            Objects.requireNonNull(handler);
            if (handlers.putIfAbsent(eventType, handler) != null) {
                throw new IllegalArgumentException("Handler for " + eventType + " is already registered");
            }
            return this;
        }

        public HandlerProjection<S> build() {
            if (handlers.isEmpty()) {
                throw ProjectionException.invalidConfiguration("handlers", "projection " + name
                        + " handles no events");
            }
            return new HandlerProjection<>(this);
        }
    }
}
