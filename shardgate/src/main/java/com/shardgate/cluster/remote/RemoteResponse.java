/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shardgate.cluster.remote;

import com.shardgate.document.Row;

import java.util.List;

/**
 * The reply to a {@link RemoteRequest}.
 *
 * @param rows the rows returned by a {@link RemoteRequestKind#GET_SOME} request
 * @param done true if the remote side has no more rows
 */
public record RemoteResponse(List<Row> rows, boolean done, int errorCode, String errorMessage) {
    public static final int NO_ERROR = 0;
    public static final int QUERY_NOT_FOUND = 1;
    public static final int LEASE_CONFLICT = 2;
    public static final int QUERY_KILLED = 3;
    public static final int INTERNAL_ERROR = 4;

    public RemoteResponse {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static RemoteResponse ok() {
        return new RemoteResponse(List.of(), false, NO_ERROR, null);
    }

    public static RemoteResponse ok(List<Row> rows, boolean done) {
        return new RemoteResponse(rows, done, NO_ERROR, null);
    }

    public static RemoteResponse error(int errorCode, String errorMessage) {
        return new RemoteResponse(List.of(), true, errorCode, errorMessage);
    }

    public boolean isError() {
        return errorCode != NO_ERROR;
    }
}
