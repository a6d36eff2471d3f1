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

import io.github.eventfold.core.example.account.AccountOpened;
import io.github.eventfold.core.example.account.BankAccount;
import io.github.eventfold.core.example.account.MoneyDeposited;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateRootTest {

    @Test
    public void version_grows_by_one_per_applied_event() {
        BankAccount account = new BankAccount("acc-1");
        assertEquals(0, account.getVersion());
        account.open("alice");
        for (int i = 1; i <= 10; i++) {
            account.deposit(i);
            assertEquals(i + 1, account.getVersion());
        }
        assertEquals(55, account.getBalance());
        assertEquals(0, account.getInitialVersion());
        assertEquals(11, account.getDomainEvents().size());
    }

    @Test
    public void applied_events_carry_aggregate_metadata() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.deposit(10);
        List<EventEnvelope> events = account.getDomainEvents();
        EventEnvelope deposit = events.get(1);
        assertEquals("MoneyDeposited", deposit.getEventType());
        assertEquals("acc-1", deposit.getMetadata().getAggregateId().get());
        assertEquals("BankAccount", deposit.getMetadata().getAggregateType().get());
        assertEquals(2L, deposit.getMetadata().getAggregateVersion().getAsLong());
        assertNotEquals(events.get(0).getEventId(), deposit.getEventId());
    }

    @Test
    public void event_type_strips_event_suffix_of_payload_class() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.deposit(10);
        account.withdraw(4);
        assertEquals("MoneyWithdrawn", account.getDomainEvents().get(2).getEventType());
        assertEquals(6, account.getBalance());
    }

    @Test
    public void domain_events_cannot_be_modified_by_caller() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.getDomainEvents().clear();
        assertEquals(1, account.getDomainEvents().size());
        assertTrue(account.hasChanges());
    }

    @Test
    public void commit_moves_baseline_to_current_version() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.deposit(5);
        account.commit();
        assertEquals(2, account.getInitialVersion());
        assertEquals(account.getVersion(), account.getInitialVersion());
        assertFalse(account.hasChanges());
        account.deposit(1);
        assertEquals(account.getVersion() - account.getInitialVersion(), account.getDomainEvents().size());
    }

    @Test
    public void check_version_fails_only_on_mismatch() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.commit();
        account.deposit(5);
        account.checkVersion(1);
        for (long v : new long[] {0, 2, 3, -1}) {
            try {
                account.checkVersion(v);
                fail("Version " + v + " should conflict");
            } catch (AggregateException e) {
                assertEquals(AggregateException.Fault.VERSION_CONFLICT, e.getFault());
                assertEquals(1L, e.getContext().get("currentVersion"));
                assertEquals(v, e.getContext().get("expectedVersion"));
                assertEquals("acc-1", e.getContext().get("aggregateId"));
                assertThat(e.getMessage(), containsString("BankAccount"));
            }
        }
    }

    @Test
    public void apply_without_event_type_is_rejected() {
        TestAggregate aggregate = new TestAggregate("t-1");
        try {
            aggregate.applyRaw(" ", "payload");
            fail("Blank type should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.INVALID_ARGUMENTS, e.getFault());
        }
        try {
            aggregate.applyPayload(null);
            fail("Missing payload should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.INVALID_ARGUMENTS, e.getFault());
        }
        assertEquals(0, aggregate.getVersion());
    }

    @Test
    public void missing_id_is_rejected() {
        try {
            new BankAccount("");
            fail("Empty id should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.INVALID_ARGUMENTS, e.getFault());
        }
    }

    @Test
    public void event_without_handler_still_advances_version() {
        TestAggregate aggregate = new TestAggregate("t-1");
        aggregate.applyRaw("Unknown", null);
        assertEquals(1, aggregate.getVersion());
        assertTrue(aggregate.handled.isEmpty());
    }

    @Test
    public void failing_handler_leaves_aggregate_unchanged() {
        TestAggregate aggregate = new TestAggregate("t-1");
        aggregate.applyRaw("Noted", "first");
        try {
            aggregate.applyRaw("Failing", "second");
            fail("Handler failure should propagate");
        } catch (IllegalStateException e) {
            assertEquals("handler failed", e.getMessage());
        }
        assertEquals(1, aggregate.getVersion());
        assertEquals(1, aggregate.getDomainEvents().size());
    }

    @Test
    public void load_from_history_rehydrates_without_uncommitted_events() {
        BankAccount original = new BankAccount("acc-1");
        original.open("alice");
        original.deposit(100);
        original.withdraw(30);

        BankAccount loaded = new BankAccount("acc-1");
        loaded.loadFromHistory(original.getDomainEvents());
        assertEquals(3, loaded.getVersion());
        assertEquals(3, loaded.getInitialVersion());
        assertFalse(loaded.hasChanges());
        assertEquals(70, loaded.getBalance());
        assertEquals("alice", loaded.getOwner());
    }

    @Test
    public void failed_upcast_leaves_loaded_aggregate_unchanged() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.deposit(10);
        account.deposit(20);
        account.commit();
        account.enableVersioning().registerUpcaster("MoneyDeposited", 2, (Object p, EventMetadata m) -> p);

        try {
            account.loadFromHistory(Arrays.asList(EventEnvelope.wrap(new AccountOpened("bob")),
                    EventEnvelope.wrap(new MoneyDeposited(5))));
            fail("Deposit of version 1 has no upcaster");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.MISSING_UPCASTER, e.getFault());
        }
        assertEquals(3, account.getVersion());
        assertEquals(3, account.getInitialVersion());
        assertFalse(account.hasChanges());
        assertEquals("alice", account.getOwner());
        assertEquals(30, account.getBalance());
        account.checkVersion(3);
    }

    @Test
    public void failed_handler_during_load_restores_state_and_uncommitted_events() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.deposit(10);
        account.commit();
        account.deposit(5);

        try {
            account.loadFromHistory(Arrays.asList(EventEnvelope.wrap(new AccountOpened("bob")),
                    EventEnvelope.of("MoneyDeposited", "not an amount")));
            fail("Handler should reject payload of wrong type");
        } catch (ClassCastException e) {
            assertEquals(3, account.getVersion());
        }
        assertEquals(2, account.getInitialVersion());
        assertEquals(account.getVersion() - account.getInitialVersion(), account.getDomainEvents().size());
        assertEquals("alice", account.getOwner());
        assertEquals(15, account.getBalance());
    }

    @Test
    public void load_from_history_resets_previous_state() {
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        account.deposit(1);
        account.deposit(1);
        account.loadFromHistory(Arrays.asList(EventEnvelope.wrap(new MoneyDeposited(5))));
        assertEquals(1, account.getVersion());
        assertFalse(account.hasChanges());
    }

    @Test
    public void history_of_other_aggregate_type_is_rejected() {
        EventEnvelope foreign = EventEnvelope.of("MoneyDeposited", new MoneyDeposited(5),
                EventMetadata.create().enrichedFor("acc-1", "Portfolio", 1));
        BankAccount account = new BankAccount("acc-1");
        account.open("alice");
        try {
            account.loadFromHistory(Arrays.asList(EventEnvelope.wrap(new MoneyDeposited(1)), foreign));
            fail("Foreign event should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.TYPE_MISMATCH, e.getFault());
        }
        // nothing was replayed
        assertEquals(1, account.getVersion());
        assertEquals(0, account.getBalance());
    }

    @Test
    public void history_of_other_aggregate_id_is_rejected() {
        EventEnvelope foreign = EventEnvelope.of("MoneyDeposited", new MoneyDeposited(5),
                EventMetadata.create().enrichedFor("acc-2", "BankAccount", 1));
        try {
            new BankAccount("acc-1").loadFromHistory(Arrays.asList(foreign));
            fail("Foreign event should be rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.ID_MISMATCH, e.getFault());
        }
    }

    @Test
    public void capability_hooks_run_in_registration_order() {
        List<String> calls = new ArrayList<>();
        TestAggregate aggregate = new TestAggregate("t-1");
        aggregate.addCapability(new RecordingCapability("first", calls));
        aggregate.addCapability(new RecordingCapability("second", calls));
        aggregate.applyRaw("Noted", "x");
        assertThat(calls, contains("first:attach", "second:attach", "first:before:1", "second:before:1",
                "first:after:1", "second:after:1"));
    }

    @Test
    public void error_hooks_see_the_failure_and_it_propagates_unchanged() {
        List<String> calls = new ArrayList<>();
        TestAggregate aggregate = new TestAggregate("t-1");
        aggregate.addCapability(new RecordingCapability("rec", calls));
        try {
            aggregate.applyRaw("Failing", "x");
            fail("Handler failure should propagate");
        } catch (IllegalStateException e) {
            assertEquals("handler failed", e.getMessage());
        }
        assertThat(calls, contains("rec:attach", "rec:before:1", "rec:error:handler failed"));
    }

    @Test
    public void replacing_capability_detaches_previous_one() {
        List<String> calls = new ArrayList<>();
        TestAggregate aggregate = new TestAggregate("t-1");
        RecordingCapability first = new RecordingCapability("rec", calls);
        aggregate.addCapability(first);
        aggregate.addCapability(first);
        aggregate.addCapability("rec", new RecordingCapability("other", calls));
        assertTrue(aggregate.removeCapability("rec"));
        assertFalse(aggregate.removeCapability("rec"));
        assertThat(calls, contains("rec:attach", "other:attach", "rec:detach", "other:detach"));
    }

    @Test
    public void built_in_capabilities_are_reachable_by_kind() {
        BankAccount account = new BankAccount("acc-1");
        assertFalse(account.snapshots().isPresent());
        assertFalse(account.audit().isPresent());
        SnapshotCapability snapshots = account.enableSnapshots();
        assertSame(snapshots, account.enableSnapshots());
        assertSame(snapshots, account.snapshots().get());
        assertTrue(account.hasCapability(SnapshotCapability.NAME));
        assertFalse(account.getCapability(SnapshotCapability.NAME, AuditCapability.class).isPresent());
    }

    static class TestAggregate extends AggregateRoot {
        final List<Object> handled = new ArrayList<>();
        private final EventHandlers handlers = EventHandlers.builder()
                .on("Noted", e -> handled.add(e.getPayload()))
                .on("Failing", e -> {
                    throw new IllegalStateException("handler failed");
                })
                .build();

        TestAggregate(String id) {
            super(id);
        }

        void applyRaw(String type, Object payload) {
            apply(type, payload);
        }

        void applyPayload(Object payload) {
            applyEvent(payload);
        }

        @Override
        protected EventHandlers eventHandlers() {
            return handlers;
        }
    }

    static class RecordingCapability implements AggregateCapability {
        private final String name;
        private final List<String> calls;

        RecordingCapability(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void attach(AggregateContext context) {
            calls.add(name + ":attach");
        }

        @Override
        public void detach() {
            calls.add(name + ":detach");
        }

        @Override
        public void onBeforeApply(EventEnvelope event) {
            calls.add(name + ":before:" + event.getMetadata().getAggregateVersion().getAsLong());
        }

        @Override
        public void onAfterApply(EventEnvelope event) {
            calls.add(name + ":after:" + event.getMetadata().getAggregateVersion().getAsLong());
        }

        @Override
        public void onError(EventEnvelope event, RuntimeException error) {
            calls.add(name + ":error:" + error.getMessage());
        }
    }
}
