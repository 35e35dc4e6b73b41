/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.pathtrace.impl.tracer;

import io.pathtrace.agent.TracerField;
import io.pathtrace.api.DatabaseInfo;
import io.pathtrace.api.DatabaseRequestTracer;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.util.Arguments;

import javax.annotation.Nullable;
import java.util.Map;

public class DatabaseRequestTracerImpl extends AbstractTracer implements DatabaseRequestTracer {

    private final DatabaseInfo database;
    private final String statement;
    @Nullable
    private Integer returnedRowCount;
    @Nullable
    private Integer roundTripCount;

    public DatabaseRequestTracerImpl(PathTracer pathTracer, TracerId id, DatabaseInfo database, String statement) {
        super(pathTracer, id, TracerKind.DATABASE_REQUEST);
        this.database = database;
        this.statement = statement;
    }

    @Override
    public void setReturnedRowCount(int rowCount) {
        checkExitField("returned row count");
        Arguments.requireNonNegative(rowCount, "returned row count");
        this.returnedRowCount = rowCount;
        setField(TracerField.RETURNED_ROW_COUNT, rowCount);
    }

    @Override
    public void setRoundTripCount(int roundTripCount) {
        checkExitField("round trip count");
        Arguments.requireNonNegative(roundTripCount, "round trip count");
        this.roundTripCount = roundTripCount;
        setField(TracerField.ROUND_TRIP_COUNT, roundTripCount);
    }

    public DatabaseInfo getDatabase() {
        return database;
    }

    public String getStatement() {
        return statement;
    }

    @Nullable
    public Integer getReturnedRowCount() {
        return returnedRowCount;
    }

    @Nullable
    public Integer getRoundTripCount() {
        return roundTripCount;
    }

    @Override
    protected void collectValues(Map<String, Object> values) {
        values.put("database_name", database.getName());
        values.put("database_vendor", database.getVendor());
        values.put("statement", statement);
        if (returnedRowCount != null) {
            values.put("returned_row_count", returnedRowCount);
        }
        if (roundTripCount != null) {
            values.put("round_trip_count", roundTripCount);
        }
    }
}
