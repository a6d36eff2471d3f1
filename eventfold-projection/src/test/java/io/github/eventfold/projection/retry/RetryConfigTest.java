package io.github.eventfold.projection.retry;

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

import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RetryConfigTest {

    @Test
    public void defaults_are_applied() {
        RetryConfig config = RetryConfig.defaults();
        assertEquals(3, config.getMaxAttempts());
        assertEquals(100, config.getBaseDelayMs());
        assertEquals(30_000, config.getMaxDelayMs());
        assertEquals(2.0, config.getBackoffMultiplier(), 0.0);
        assertThat(config.getRetryableErrors(), empty());
        assertThat(config.getNonRetryableErrors(), empty());
    }

    @Test
    public void error_lists_are_kept() {
        RetryConfig config = RetryConfig.builder().retryOn(IOException.class).build();
        assertEquals(1, config.getRetryableErrors().size());
        assertTrue(config.getRetryableErrors().contains(IOException.class));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zero_attempts_are_rejected() {
        RetryConfig.builder().maxAttempts(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shrinking_backoff_is_rejected() {
        RetryConfig.builder().backoffMultiplier(0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void max_delay_below_base_delay_is_rejected() {
        RetryConfig.builder().baseDelayMs(500).maxDelayMs(100).build();
    }
}
