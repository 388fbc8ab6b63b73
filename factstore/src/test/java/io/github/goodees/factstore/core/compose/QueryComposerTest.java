package io.github.goodees.factstore.core.compose;

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

import io.github.goodees.factstore.core.Fact;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class QueryComposerTest {
    private static final String COLUMNS = "' AS fact_id, user_query.sequence_number, user_query.event_type, "
            + "user_query.payload FROM (";

    private final QueryComposer composer = new QueryComposer();

    private static Fact<Object, Object> fact(String id, String sql, Object... params) {
        return Fact.withId(id, sql, Arrays.asList(params), (context, events) -> context);
    }

    @Test
    public void single_fact_without_parameters() {
        ComposedQuery query = composer.compose(
            Collections.singletonList(fact("f", "SELECT sequence_number, event_type, payload FROM events")),
            QueryComposer.Mode.READ);
        assertEquals("WITH fact_1 AS (SELECT 'f" + COLUMNS + "SELECT sequence_number, event_type, payload FROM events"
                + ") AS user_query),\n"
                + "all_events AS (SELECT * FROM fact_1)\n"
                + "SELECT all_events.*, MAX(sequence_number) OVER () AS max_sequence_number FROM all_events "
                + "ORDER BY sequence_number ASC", query.getSql());
        assertThat(query.getParams(), empty());
        assertEquals(1, query.getFactCount());
    }

    @Test
    public void parameters_of_later_facts_are_shifted() {
        List<Fact<Object, Object>> facts = Arrays.asList(
            fact("a", "SELECT * FROM events WHERE event_type = $1", "Opened"),
            fact("b", "SELECT * FROM events"),
            fact("c", "SELECT * FROM events WHERE event_type = $1 AND payload LIKE $2 AND sequence_number > $3",
                "Assigned", "%x%", 5L));
        ComposedQuery query = composer.compose(facts, QueryComposer.Mode.CONSISTENCY_CHECK);
        assertEquals("WITH fact_1 AS (SELECT 'a" + COLUMNS + "SELECT * FROM events WHERE event_type = $1"
                + ") AS user_query),\n"
                + "fact_2 AS (SELECT 'b" + COLUMNS + "SELECT * FROM events) AS user_query),\n"
                + "fact_3 AS (SELECT 'c" + COLUMNS
                + "SELECT * FROM events WHERE event_type = $2 AND payload LIKE $3 AND sequence_number > $4"
                + ") AS user_query),\n"
                + "all_events AS (SELECT * FROM fact_1 UNION ALL SELECT * FROM fact_2 UNION ALL SELECT * FROM fact_3)\n"
                + "SELECT COALESCE(MAX(sequence_number), 0) AS max_sequence_number FROM all_events", query.getSql());
        assertThat(query.getParams(), contains((Object) "Opened", "Assigned", "%x%", 5L));
    }

    @Test
    public void nested_subqueries_are_kept_intact() {
        String nested = "SELECT e.sequence_number, e.event_type, e.payload FROM events e "
                + "WHERE e.sequence_number IN (SELECT MAX(sequence_number) FROM events WHERE payload LIKE $1)";
        ComposedQuery query = composer.compose(Arrays.asList(fact("x", "SELECT * FROM events WHERE payload = $1", 1),
            fact("y", nested, "%y%")), QueryComposer.Mode.READ);
        assertThat(query.getSql(), containsString("FROM (SELECT e.sequence_number, e.event_type, e.payload FROM events e "
                + "WHERE e.sequence_number IN (SELECT MAX(sequence_number) FROM events WHERE payload LIKE $2)) "
                + "AS user_query)"));
        assertThat(query.getParams(), contains((Object) 1, "%y%"));
    }

    @Test
    public void same_query_twice_gets_own_parameters() {
        String sql = "SELECT * FROM events WHERE payload LIKE $1";
        ComposedQuery query = composer.compose(Arrays.asList(fact("one", sql, "%1%"), fact("two", sql, "%2%")),
            QueryComposer.Mode.READ);
        assertThat(query.getSql(), containsString("payload LIKE $1"));
        assertThat(query.getSql(), containsString("payload LIKE $2"));
        assertThat(query.getParams(), contains((Object) "%1%", "%2%"));
    }

    @Test
    public void quotes_in_fact_id_are_escaped() {
        ComposedQuery query = composer.compose(Collections.singletonList(fact("it's", "SELECT * FROM events")),
            QueryComposer.Mode.READ);
        assertThat(query.getSql(), containsString("SELECT 'it''s' AS fact_id"));
    }

    @Test
    public void null_parameters_are_kept() {
        ComposedQuery query = composer.compose(
            Collections.singletonList(fact("n", "SELECT * FROM events WHERE payload = $1", (Object) null)),
            QueryComposer.Mode.READ);
        assertEquals(1, query.getParams().size());
        assertEquals(null, query.getParams().get(0));
    }

    @Test
    public void duplicate_fact_ids_are_rejected() {
        try {
            composer.compose(Arrays.asList(fact("dup", "SELECT * FROM events"), fact("dup", "SELECT * FROM events")),
                QueryComposer.Mode.READ);
            fail("Duplicate ids should be rejected");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("dup"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void placeholder_without_parameter_is_rejected() {
        composer.compose(Collections.singletonList(fact("f", "SELECT * FROM events WHERE a = $1 AND b = $2", "a")),
            QueryComposer.Mode.READ);
    }

    @Test
    public void zero_placeholder_is_rejected() {
        try {
            composer.compose(Arrays.asList(fact("a", "SELECT * FROM events WHERE event_type = $1", "A"),
                fact("b", "SELECT * FROM events WHERE payload = $0", "B")), QueryComposer.Mode.READ);
            fail("$0 would bind to parameter of preceding fact");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("$0"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void zero_placeholder_is_rejected_in_conflict_count() {
        composer.composeConflictCount(Collections.singletonList(fact("z", "SELECT * FROM events WHERE payload = $0",
            "B")), 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void overlong_placeholder_is_rejected() {
        composer.compose(Collections.singletonList(fact("f", "SELECT * FROM events WHERE a = $99999999999", "a")),
            QueryComposer.Mode.CONSISTENCY_CHECK);
    }

    @Test
    public void generated_ids_are_unique() {
        Fact<Object, Object> first = Fact.of("SELECT * FROM events", (c, e) -> c);
        Fact<Object, Object> second = Fact.of("SELECT * FROM events", (c, e) -> c);
        assertThat(first.getId(), not(second.getId()));
        composer.compose(Arrays.asList(first, second), QueryComposer.Mode.READ);
    }

    @Test
    public void empty_composition_is_valid_statement() {
        ComposedQuery read = composer.compose(Collections.<Fact<Object, Object>> emptyList(), QueryComposer.Mode.READ);
        assertTrue(read.isEmpty());
        assertEquals(QueryComposer.EMPTY_READ, read.getSql());
        assertThat(read.getParams(), empty());

        ComposedQuery check = composer.compose(Collections.<Fact<Object, Object>> emptyList(),
            QueryComposer.Mode.CONSISTENCY_CHECK);
        assertEquals("SELECT 0 AS max_sequence_number", check.getSql());
    }

    @Test
    public void conflict_count_appends_boundary_parameter() {
        ComposedQuery query = composer.composeConflictCount(Arrays.asList(
            fact("a", "SELECT * FROM events WHERE payload LIKE $1", "%a%"),
            fact("b", "SELECT * FROM events WHERE payload LIKE $1", "%b%")), 42L);
        assertThat(query.getSql(),
            containsString("\nSELECT COUNT(*) AS matched_count FROM all_events WHERE sequence_number > $3"));
        assertThat(query.getParams(), contains((Object) "%a%", "%b%", 42L));
    }

    @Test
    public void composition_is_deterministic() {
        List<Fact<Object, Object>> facts = Arrays.asList(fact("a", "SELECT * FROM events WHERE x = $1", 1),
            fact("b", "SELECT * FROM events WHERE y = $1", 2));
        assertEquals(composer.compose(facts, QueryComposer.Mode.READ), composer.compose(facts, QueryComposer.Mode.READ));
    }
}
