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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.factstore.core.EncodedEvent;
import io.github.goodees.factstore.core.compose.ComposedQuery;
import io.github.goodees.factstore.core.store.AppendOutcome;
import io.github.goodees.factstore.core.store.ConsistencyGuard;
import io.github.goodees.factstore.core.store.EventLog;
import io.github.goodees.factstore.core.store.EventStore;
import io.github.goodees.factstore.core.store.EventStoreException;
import io.github.goodees.factstore.core.store.StoredEvent;
import io.github.goodees.factstore.core.store.TaggedEventRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Event store backed by a JDBC data source and a schema.
 *
 * <p>Append runs in single transaction: it takes the schema's append lock, evaluates the consistency check, and
 * inserts the batch only if the check passes. Any failure rolls the transaction back, so a batch is either stored
 * completely, or not at all.
 */
public class JdbcEventStore implements EventStore, EventLog {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final ObjectMapper mapper;
    private final TxHandler txHandler;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, new ObjectMapper(), LOCAL_TRANSACTION);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, ObjectMapper mapper) {
        this(dataSource, schema, mapper, LOCAL_TRANSACTION);
    }

    /**
     * @param dataSource source of connections
     * @param schema statements for the event table
     * @param mapper serializer of metadata
     * @param handler transaction handling, {@link #LOCAL_TRANSACTION} or {@link #CONTAINER_MANAGED}
     */
    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, ObjectMapper mapper, TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.mapper = mapper;
        this.txHandler = handler;
    }

    @Override
    public List<TaggedEventRow> read(ComposedQuery query) throws EventStoreException {
        if (query.isEmpty()) {
            return Collections.emptyList();
        }
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = schema.prepare(connection, query);
                ResultSet rs = statement.executeQuery()) {
            List<TaggedEventRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(schema.readTaggedRow(rs));
            }
            return rows;
        } catch (SQLException e) {
            logger.error("Could not execute composed read of {} facts", query.getFactCount(), e);
            throw EventStoreException.readFailed(e);
        }
    }

    @Override
    public AppendOutcome append(ConsistencyGuard guard, List<EncodedEvent> events, Map<String, ?> metadata)
            throws EventStoreException {
        return createTemplate(guard, events, metadata).persist();
    }

    @Override
    public AppendOutcome appendUnconditionally(List<EncodedEvent> events, Map<String, ?> metadata)
            throws EventStoreException {
        return createTemplate(null, events, metadata).persist();
    }

    @Override
    public List<StoredEvent> readAll(long afterSequence) throws EventStoreException {
        return readEvents(null, afterSequence);
    }

    @Override
    public List<StoredEvent> readByTypes(Collection<String> types, long afterSequence) throws EventStoreException {
        if (types.isEmpty()) {
            return Collections.emptyList();
        }
        return readEvents(types, afterSequence);
    }

    private List<StoredEvent> readEvents(Collection<String> types, long afterSequence) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = schema.selectEvents(connection, types, afterSequence);
                ResultSet rs = statement.executeQuery()) {
            List<StoredEvent> events = new ArrayList<>();
            while (rs.next()) {
                events.add(schema.readStoredEvent(rs));
            }
            return events;
        } catch (SQLException e) {
            throw EventStoreException.readFailed(e);
        }
    }

    protected PersistTemplate createTemplate(ConsistencyGuard guard, List<EncodedEvent> events,
            Map<String, ?> metadata) throws EventStoreException {
        return new PersistTemplate(guard, events, serializeMetadata(metadata));
    }

    protected String serializeMetadata(Map<String, ?> metadata) throws EventStoreException {
        try {
            return mapper.writeValueAsString(metadata == null ? Collections.emptyMap() : metadata);
        } catch (JsonProcessingException e) {
            throw EventStoreException.unsupported(metadata, e);
        }
    }

    protected class PersistTemplate {
        private final ConsistencyGuard guard;
        private final List<EncodedEvent> events;
        private final String metadata;

        PersistTemplate(ConsistencyGuard guard, List<EncodedEvent> events, String metadata) {
            this.guard = guard;
            this.events = events;
            this.metadata = metadata;
        }

        public AppendOutcome persist() throws EventStoreException {
            if (events.isEmpty()) {
                return AppendOutcome.success(0);
            }
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    schema.lockForAppend(connection);
                    int conflicting = countConflicts(connection);
                    if (conflicting > 0) {
                        txHandler.rollback(connection);
                        return AppendOutcome.conflict(conflicting);
                    }
                    storeEvents(connection);
                    txHandler.commit(connection);
                    return AppendOutcome.success(events.size());
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    try {
                        txHandler.rollback(connection);
                    } catch (SQLException | RuntimeException rollbackFailure) {
                        e.addSuppressed(rollbackFailure);
                    }
                    throw e;
                }
            } catch (SQLException ex) {
                logger.error("Append of {} events failed", events.size(), ex);
                throw EventStoreException.storeFailed(events.size(), ex);
            }
        }

        private int countConflicts(Connection connection) throws SQLException {
            if (guard == null || guard.getCheck().isEmpty()) {
                return 0;
            }
            long currentMax;
            try (PreparedStatement check = schema.prepare(connection, guard.getCheck());
                    ResultSet rs = check.executeQuery()) {
                currentMax = rs.next() ? schema.readMaxSequence(rs) : 0;
            }
            if (guard.permits(currentMax)) {
                return 0;
            }
            try (PreparedStatement count = schema.prepare(connection, guard.getConflictCount());
                    ResultSet rs = count.executeQuery()) {
                int matched = rs.next() ? schema.readMatchedCount(rs) : 0;
                logger.debug("Consistency check failed, sequence {} is newer than {}, {} conflicting events",
                    currentMax, guard.getLastSeenSequence(), matched);
                // both queries run under the append lock, so the count cannot drop to zero
                return Math.max(matched, 1);
            }
        }

        private void storeEvents(Connection connection) throws SQLException {
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                for (EncodedEvent event : events) {
                    schema.prepareInsert(insertEvent, event, metadata);
                    insertEvent.addBatch();
                }
                insertEvent.executeBatch();
            }
        }
    }

    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Transaction is demarcated by the store on the connection itself.
     */
    public static final TxHandler LOCAL_TRANSACTION = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };

    /**
     * Transaction is managed by the container, the connection is already enlisted in it. The append lock is then held
     * until the container's transaction ends.
     */
    public static final TxHandler CONTAINER_MANAGED = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };
}
