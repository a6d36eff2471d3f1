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

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helper class for constructing asynchronous responses of stores, capabilities and engines.
 *
 * @param <T> the type of result
 */
public class AsyncResult<T> extends CompletableFuture<T> {
    private AsyncResult() {
        super();
    }

    /**
     * Wrap a result of callable. The callable is invoked immediately.
     * @param action The action to perform
     * @param <V> type of result
     * @return Async result wrapping the return value or exception thrown from a callable
     */
    public static <V> AsyncResult<V> invoke(Callable<V> action) {
        AsyncResult<V> result = new AsyncResult<>();
        try {
            result.complete(action.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Invoke an asynchronous action, turning exception thrown before the action returns its stage into exceptional
     * completion.
     * @param action the action to perform
     * @param <V> type of result
     * @return stage of the action, or failed stage if the action threw
     */
    public static <V> CompletionStage<V> compose(Supplier<? extends CompletionStage<V>> action) {
        try {
            CompletionStage<V> stage = action.get();
            if (stage == null) {
                return throwing(new IllegalStateException("Asynchronous action returned no stage"));
            }
            return stage;
        } catch (RuntimeException e) {
            return throwing(e);
        }
    }

    /**
     * Wrap a value.
     * @param result value to wrap
     * @param <V> type of result
     * @return an AsyncResult that completed successfully with the result.
     */
    public static <V> AsyncResult<V> returning(V result) {
        AsyncResult<V> r = new AsyncResult<>();
        r.complete(result);
        return r;
    }

    public static AsyncResult<Void> done() {
        return returning(null);
    }

    /**
     * Wrap an exception
     * @param t Throwable to wrap.
     * @param <V> The original return type of the throwable.
     * @return an AsyncResult that completed exceptionally with given throwable.
     */
    public static <V> AsyncResult<V> throwing(Throwable t) {
        AsyncResult<V> r = new AsyncResult<>();
        r.completeExceptionally(t);
        return r;
    }

    /**
     * Strip the wrappers dependent stages put around the original failure.
     * @param ex exception a stage completed with
     * @return the original cause
     */
    public static Throwable unwrap(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }
}
