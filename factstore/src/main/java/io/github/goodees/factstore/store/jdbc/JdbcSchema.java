package io.github.goodees.factstore.store.jdbc;

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

import io.github.goodees.factstore.core.EncodedEvent;
import io.github.goodees.factstore.core.compose.ComposedQuery;
import io.github.goodees.factstore.core.compose.Placeholders;
import io.github.goodees.factstore.core.compose.QueryComposer;
import io.github.goodees.factstore.core.store.EventStoreException;
import io.github.goodees.factstore.core.store.StoredEvent;
import io.github.goodees.factstore.core.store.TaggedEventRow;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Statements {@link JdbcEventStore} needs, so that table layout and database dialect can vary.
 *
 * <p>Composed queries use placeholders {@code $1 .. $n}, which are turned into JDBC {@code ?} parameters, binding
 * the parameter once per occurrence. Fact queries therefore must not contain literal question marks outside of quoted
 * strings, e. g. PostgreSQL's {@code ?} json operators, use equivalent functions instead.
 */
public abstract class JdbcSchema {

    /**
     * Serialize appends. Called as first statement of the append transaction, the lock must be held until the
     * transaction ends. While the lock is held, no other append may allocate sequence numbers, so sequence order is
     * the same as commit order.
     * @param connection connection of the append transaction
     * @throws SQLException when lock cannot be obtained
     * @throws EventStoreException when schema is not set up for locking
     */
    protected abstract void lockForAppend(Connection connection) throws SQLException, EventStoreException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, EncodedEvent event, String metadata)
            throws SQLException;

    /**
     * Select stored events.
     * @param connection connection
     * @param types types to include, {@code null} for all
     * @param afterSequence lower bound of sequence numbers, exclusive
     * @return statement ready for execution
     * @throws SQLException when statement cannot be prepared
     */
    protected abstract PreparedStatement selectEvents(Connection connection, Collection<String> types,
            long afterSequence) throws SQLException;

    protected abstract StoredEvent readStoredEvent(ResultSet rs) throws SQLException;

    /**
     * Prepare a composed query for execution.
     * @param connection connection
     * @param query composed query
     * @return statement with all parameters bound
     * @throws SQLException when statement cannot be prepared
     */
    protected PreparedStatement prepare(Connection connection, ComposedQuery query) throws SQLException {
        List<Object> bound = new ArrayList<>();
        String sql = Placeholders.rewrite(query.getSql(), index -> {
            if (index < 1 || index > query.getParams().size()) {
                throw new IllegalArgumentException("Placeholder $" + index + " has no parameter in " + query);
            }
            bound.add(query.getParams().get(index - 1));
            return "?";
        });
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < bound.size(); i++) {
                bindParameter(statement, i + 1, bound.get(i));
            }
        } catch (SQLException | RuntimeException e) {
            statement.close();
            throw e;
        }
        return statement;
    }

    protected void bindParameter(PreparedStatement statement, int index, Object value) throws SQLException {
        statement.setObject(index, value);
    }

    protected TaggedEventRow readTaggedRow(ResultSet rs) throws SQLException {
        return TaggedEventRow.builder()
            .factId(rs.getString(QueryComposer.FACT_ID))
            .sequenceNumber(rs.getLong(QueryComposer.SEQUENCE_NUMBER))
            .eventType(rs.getString(QueryComposer.EVENT_TYPE))
            .payload(rs.getString(QueryComposer.PAYLOAD))
            .maxSequenceNumber(rs.getLong(QueryComposer.MAX_SEQUENCE_NUMBER))
            .build();
    }

    protected long readMaxSequence(ResultSet rs) throws SQLException {
        return rs.getLong(QueryComposer.MAX_SEQUENCE_NUMBER);
    }

    protected int readMatchedCount(ResultSet rs) throws SQLException {
        return rs.getInt(QueryComposer.MATCHED_COUNT);
    }
}
