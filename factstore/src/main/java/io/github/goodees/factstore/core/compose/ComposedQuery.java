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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single statement produced by composing a list of facts. Uses positional placeholders {@code $1 .. $n} that map
 * one to one onto {@link #getParams()}.
 */
public final class ComposedQuery {
    private final String sql;
    private final List<Object> params;
    private final int factCount;

    ComposedQuery(String sql, List<Object> params, int factCount) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.factCount = factCount;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParams() {
        return params;
    }

    /**
     * Number of facts the query was composed of.
     * @return number of facts
     */
    public int getFactCount() {
        return factCount;
    }

    /**
     * Query composed of no facts. Executing it is legal, but callers may skip the round trip, since it will not
     * match any event.
     * @return true if there were no facts to compose
     */
    public boolean isEmpty() {
        return factCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        ComposedQuery that = (ComposedQuery) o;
        return factCount == that.factCount && sql.equals(that.sql) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        int result = sql.hashCode();
        result = 31 * result + params.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return sql + " " + params;
    }
}
