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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges independently authored facts into one statement, so that all of them are evaluated in single round trip.
 *
 * <p>Every fact's query becomes a common table expression {@code fact_<n>}, that tags each matched row with the id
 * of the fact. Placeholders of the fact are shifted by the number of parameters of all preceding facts, and the
 * parameter lists are concatenated in the same order. The expressions are then unioned into {@code all_events}:
 * <pre>
 * WITH fact_1 AS (SELECT 'fact-1' AS fact_id, user_query.sequence_number, user_query.event_type, user_query.payload
 *                 FROM (&lt;query of fact 1&gt;) AS user_query),
 * fact_2 AS (...),
 * all_events AS (SELECT * FROM fact_1 UNION ALL SELECT * FROM fact_2)
 * SELECT ...
 * </pre>
 * The final select depends on the {@link Mode}. An event matching several facts is returned once per fact.
 */
public class QueryComposer {
    private static final Logger logger = LoggerFactory.getLogger(QueryComposer.class);

    public static final String FACT_ID = "fact_id";
    public static final String SEQUENCE_NUMBER = "sequence_number";
    public static final String EVENT_TYPE = "event_type";
    public static final String PAYLOAD = "payload";
    public static final String MAX_SEQUENCE_NUMBER = "max_sequence_number";
    public static final String MATCHED_COUNT = "matched_count";

    static final String EMPTY_READ = "SELECT CAST(NULL AS VARCHAR(255)) AS fact_id, CAST(NULL AS BIGINT) AS sequence_number, "
            + "CAST(NULL AS VARCHAR(255)) AS event_type, CAST(NULL AS VARCHAR(255)) AS payload, "
            + "CAST(NULL AS BIGINT) AS max_sequence_number FROM (SELECT 1 AS n) AS no_facts WHERE 1 = 0";
    static final String EMPTY_CONSISTENCY_CHECK = "SELECT 0 AS max_sequence_number";
    static final String EMPTY_CONFLICT_COUNT = "SELECT 0 AS matched_count";

    public enum Mode {
        /**
         * Return all tagged rows in ascending sequence order, each carrying the maximum sequence number of all rows.
         */
        READ,
        /**
         * Return single row with maximum sequence number of all matched events, 0 when nothing matched. No payloads
         * are fetched.
         */
        CONSISTENCY_CHECK
    }

    /**
     * Compose the facts into a single statement.
     * @param facts facts to compose, ids must be unique within the list
     * @param mode what the statement should return
     * @return the composed statement
     * @throws IllegalArgumentException when fact ids collide or a fact references a placeholder it has no parameter for
     */
    public ComposedQuery compose(List<? extends Fact<?, ?>> facts, Mode mode) {
        if (facts.isEmpty()) {
            return new ComposedQuery(mode == Mode.READ ? EMPTY_READ : EMPTY_CONSISTENCY_CHECK, new ArrayList<>(), 0);
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = renderEvents(facts, params);
        switch (mode) {
            case READ:
                sql.append("SELECT all_events.*, MAX(sequence_number) OVER () AS max_sequence_number FROM all_events ")
                    .append("ORDER BY sequence_number ASC");
                break;
            case CONSISTENCY_CHECK:
                sql.append("SELECT COALESCE(MAX(sequence_number), 0) AS max_sequence_number FROM all_events");
                break;
            default:
                throw new IllegalArgumentException("Unsupported mode " + mode);
        }
        return composed(sql, params, facts.size(), mode.name());
    }

    /**
     * Compose statement counting events matching any of the facts, that appeared after given sequence number. This is
     * the same expression as {@link Mode#CONSISTENCY_CHECK} uses, with single extra parameter appended.
     * @param facts facts to compose
     * @param afterSequence only events with higher sequence number are counted
     * @return the composed statement returning single column {@code matched_count}
     */
    public ComposedQuery composeConflictCount(List<? extends Fact<?, ?>> facts, long afterSequence) {
        if (facts.isEmpty()) {
            return new ComposedQuery(EMPTY_CONFLICT_COUNT, new ArrayList<>(), 0);
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = renderEvents(facts, params);
        params.add(afterSequence);
        sql.append("SELECT COUNT(*) AS matched_count FROM all_events WHERE sequence_number > $").append(params.size());
        return composed(sql, params, facts.size(), "CONFLICT_COUNT");
    }

    private ComposedQuery composed(StringBuilder sql, List<Object> params, int factCount, String purpose) {
        ComposedQuery query = new ComposedQuery(sql.toString(), params, factCount);
        if (logger.isDebugEnabled()) {
            logger.debug("Composed {} facts for {}: {}", factCount, purpose, query);
        }
        return query;
    }

    private StringBuilder renderEvents(List<? extends Fact<?, ?>> facts, List<Object> params) {
        Set<String> ids = new HashSet<>();
        StringBuilder sql = new StringBuilder("WITH ");
        for (int i = 0; i < facts.size(); i++) {
            Fact<?, ?> fact = facts.get(i);
            if (!ids.add(fact.getId())) {
                throw new IllegalArgumentException("Duplicate fact id " + fact.getId() + " in composition");
            }
            checkPlaceholders(fact);
            String renumbered = Placeholders.renumber(fact.getSql(), params.size());
            params.addAll(fact.getParams());
            sql.append("fact_").append(i + 1).append(" AS (SELECT '").append(quote(fact.getId()))
                .append("' AS fact_id, user_query.sequence_number, user_query.event_type, user_query.payload FROM (")
                .append(renumbered).append(") AS user_query),\n");
        }
        sql.append("all_events AS (");
        for (int i = 0; i < facts.size(); i++) {
            if (i > 0) {
                sql.append(" UNION ALL ");
            }
            sql.append("SELECT * FROM fact_").append(i + 1);
        }
        sql.append(")\n");
        return sql;
    }

    /**
     * Every placeholder must refer to one of the fact's own parameters, otherwise renumbering would bind it to a
     * parameter of a neighbouring fact.
     */
    private static void checkPlaceholders(Fact<?, ?> fact) {
        int paramCount = fact.getParams().size();
        Placeholders.rewrite(fact.getSql(), index -> {
            if (index < 1 || index > paramCount) {
                throw new IllegalArgumentException("Fact " + fact.getId() + " references placeholder $" + index
                        + " but has " + paramCount + " parameters");
            }
            return "";
        });
    }

    private static String quote(String literal) {
        return literal.replace("'", "''");
    }
}
