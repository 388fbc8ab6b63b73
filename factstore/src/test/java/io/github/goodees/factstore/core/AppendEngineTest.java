package io.github.goodees.factstore.core;

/*-
 * #%L
 * factstore
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

import io.github.goodees.factstore.core.store.AppendOutcome;
import io.github.goodees.factstore.core.store.ConsistencyGuard;
import io.github.goodees.factstore.core.store.EventStoreException;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AppendEngineTest {
    private MockEventStore store;
    private AppendEngine engine;
    private MockEventStore.StringCodec codec;

    private static final List<Fact<Object, String>> FACTS = Collections.singletonList(
        Fact.<Object, String> of("SELECT * FROM events WHERE payload LIKE $1", (c, e) -> c, "%x%"));

    @Before
    public void setUp() {
        store = new MockEventStore();
        engine = new AppendEngine(store);
        codec = new MockEventStore.StringCodec();
    }

    @Test
    public void empty_batch_does_not_reach_store() throws EventStoreException {
        AppendOutcome outcome = engine.append(Collections.<String> emptyList(), codec,
            Collections.<String, Object> emptyMap(), FACTS, 10);
        assertEquals(AppendOutcome.success(0), outcome);
        assertThat(store.guards, empty());
        assertEquals(0, store.unconditionalAppends);
    }

    @Test
    public void guard_carries_both_compositions() throws EventStoreException {
        AppendOutcome outcome = engine.append(Arrays.asList("a", "b"), codec, Collections.<String, Object> emptyMap(),
            FACTS, 10);
        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.getAppendedCount());

        ConsistencyGuard guard = store.guards.get(0);
        assertEquals(10, guard.getLastSeenSequence());
        assertThat(guard.getCheck().getParams(), contains((Object) "%x%"));
        assertThat(guard.getConflictCount().getParams(), contains((Object) "%x%", 10L));
        assertThat(store.batches.get(0), contains(EncodedEvent.of("Text", "a"), EncodedEvent.of("Text", "b")));
    }

    @Test
    public void no_consistency_facts_appends_unconditionally() throws EventStoreException {
        AppendOutcome outcome = engine.append(Collections.singletonList("a"), codec,
            Collections.<String, Object> emptyMap(), Collections.<Fact<?, ?>> emptyList(), 0);
        assertTrue(outcome.isSuccess());
        assertEquals(1, store.unconditionalAppends);
        assertThat(store.guards, empty());
    }

    @Test
    public void conflict_is_passed_through() throws EventStoreException {
        store.willAppend(AppendOutcome.conflict(2));
        AppendOutcome outcome = engine.append(Collections.singletonList("a"), codec,
            Collections.<String, Object> emptyMap(), FACTS, 3);
        assertTrue(outcome.isConflict());
        assertEquals(2, outcome.getMatchedCount());
        assertThat(store.batches, empty());
    }

    @Test
    public void unencodable_event_is_programmatic_error() {
        EventEncoder<String> failing = event -> {
            throw new IllegalArgumentException("cannot encode " + event);
        };
        try {
            engine.append(Collections.singletonList("a"), failing, Collections.<String, Object> emptyMap(), FACTS, 0);
            fail("Encoding should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertThat(store.guards, empty());
        }
    }

    @Test
    public void outcome_values() {
        assertEquals("Success(0)", AppendOutcome.success(0).toString());
        assertEquals("Conflict(3)", AppendOutcome.conflict(3).toString());
        assertEquals(0, AppendOutcome.conflict(3).getAppendedCount());
        assertFalse(AppendOutcome.success(2).isConflict());
    }

    @Test(expected = IllegalArgumentException.class)
    public void conflict_without_matches_is_invalid() {
        AppendOutcome.conflict(0);
    }
}
