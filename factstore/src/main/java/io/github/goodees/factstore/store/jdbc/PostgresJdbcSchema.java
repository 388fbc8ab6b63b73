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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Schema for PostgreSQL, where payload and metadata are {@code jsonb} columns:
 * <pre>
 * CREATE TABLE events (
 *   sequence_number BIGSERIAL PRIMARY KEY,
 *   occurred_at     TIMESTAMPTZ NOT NULL DEFAULT now(),
 *   event_type      TEXT        NOT NULL,
 *   payload         JSONB       NOT NULL,
 *   metadata        JSONB       NOT NULL DEFAULT '{}'
 * );
 * </pre>
 * Appends are serialized by transaction scoped advisory lock, so no lock table is needed.
 */
public class PostgresJdbcSchema extends DefaultJdbcSchema {
    public static final long DEFAULT_LOCK_KEY = 0x6661637473L;

    private final long lockKey;

    public PostgresJdbcSchema(String eventTable) {
        this(eventTable, DEFAULT_LOCK_KEY);
    }

    /**
     * @param eventTable name of event table
     * @param lockKey advisory lock key, must be shared by all processes appending to the table
     */
    public PostgresJdbcSchema(String eventTable, long lockKey) {
        super(eventTable, null);
        this.lockKey = lockKey;
    }

    public long getLockKey() {
        return lockKey;
    }

    protected String lockSql() {
        return "SELECT pg_advisory_xact_lock(?)";
    }

    @Override
    protected void lockForAppend(Connection connection) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement(lockSql())) {
            st.setLong(1, lockKey);
            st.execute();
        }
    }

    @Override
    protected String insertEventSql() {
        return "INSERT INTO " + getEventTable()
                + " (event_type, payload, metadata) VALUES (?, CAST(? AS jsonb), CAST(? AS jsonb))";
    }
}
