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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AsyncResultTest {

    @Test
    public void synchronous_failure_becomes_failed_stage() {
        IllegalStateException failure = new IllegalStateException("bam!");
        CompletionStage<Integer> stage = AsyncResult.compose(() -> {
            throw failure;
        });
        CompletableFuture<Integer> future = stage.toCompletableFuture();
        assertTrue(future.isCompletedExceptionally());
        future.whenComplete((r, t) -> assertSame(failure, AsyncResult.unwrap(t)));
    }

    @Test
    public void unwrap_strips_completion_wrappers() {
        IllegalStateException cause = new IllegalStateException("bam!");
        assertSame(cause, AsyncResult.unwrap(new CompletionException(new CompletionException(cause))));
        assertSame(cause, AsyncResult.unwrap(cause));
    }

    @Test
    public void invoke_captures_value() throws Exception {
        assertEquals(Integer.valueOf(42), AsyncResult.invoke(() -> 42).get());
    }
}
