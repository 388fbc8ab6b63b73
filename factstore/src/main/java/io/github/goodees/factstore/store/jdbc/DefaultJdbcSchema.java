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
import io.github.goodees.factstore.core.store.EventStoreException;
import io.github.goodees.factstore.core.store.StoredEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.Collections;

/**
 * JDBC schema with single event table. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(SEQUENCE_NUMBER, OCCURRED_AT, EVENT_TYPE, PAYLOAD, METADATA) where SEQUENCE_NUMBER is
 * generated identity and primary key, and OCCURRED_AT defaults to current time</li>
 * <li><em>lockTable</em>(ID) primary key (ID), containing single row with ID = 1</li>
 * </ul>
 * Appends are serialized by locking the row of lock table.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    static final int LOCK_ROW = 1;

    private final String eventTable;
    private final String lockTable;

    public DefaultJdbcSchema(String eventTable, String lockTable) {
        this.eventTable = eventTable;
        this.lockTable = lockTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getLockTable() {
        return lockTable;
    }

    @Override
    protected void lockForAppend(Connection connection) throws SQLException, EventStoreException {
        try (PreparedStatement st = connection.prepareStatement("SELECT ID FROM " + getLockTable()
                + " WHERE ID=? FOR UPDATE")) {
            st.setInt(1, LOCK_ROW);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    throw EventStoreException.missingAppendLock(getLockTable());
                }
            }
        }
    }

    protected String insertEventSql() {
        return "INSERT INTO " + getEventTable() + " (EVENT_TYPE, PAYLOAD, METADATA) VALUES (?, ?, ?)";
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement(insertEventSql());
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, EncodedEvent event, String metadata)
            throws SQLException {
        insertEvent.setString(1, event.getType());
        insertEvent.setString(2, event.getPayload());
        insertEvent.setString(3, metadata);
    }

    protected String selectEventsSql(int typeCount) {
        StringBuilder sql = new StringBuilder("SELECT SEQUENCE_NUMBER, OCCURRED_AT, EVENT_TYPE, PAYLOAD, METADATA FROM ")
            .append(getEventTable()).append(" WHERE SEQUENCE_NUMBER > ?");
        if (typeCount > 0) {
            sql.append(" AND EVENT_TYPE IN (").append(String.join(", ", Collections.nCopies(typeCount, "?")))
                .append(")");
        }
        return sql.append(" ORDER BY SEQUENCE_NUMBER").toString();
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, Collection<String> types, long afterSequence)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement(selectEventsSql(types == null ? 0 : types.size()));
        st.setLong(1, afterSequence);
        if (types != null) {
            int index = 2;
            for (String type : types) {
                st.setString(index++, type);
            }
        }
        return st;
    }

    @Override
    protected StoredEvent readStoredEvent(ResultSet rs) throws SQLException {
        return StoredEvent.builder()
            .sequenceNumber(rs.getLong(1))
            .occurredAt(rs.getTimestamp(2).toInstant())
            .type(rs.getString(3))
            .payload(rs.getString(4))
            .metadata(rs.getString(5))
            .build();
    }
}
