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

import com.shardgate.cluster.plan.RemoteTarget;

/**
 * A request sent to the remote side of a sub-plan.
 *
 * @param atMost    maximum number of rows to return, only used by {@link RemoteRequestKind#GET_SOME}
 * @param errorCode the query's error code, used by {@link RemoteRequestKind#SHUTDOWN} and
 *                  {@link RemoteRequestKind#CANCEL}
 */
public record RemoteRequest(
        RemoteRequestKind kind,
        String database,
        String queryId,
        String ownName,
        int atMost,
        int errorCode
) {

    public static RemoteRequest initializeCursor(String database, RemoteTarget target) {
        return new RemoteRequest(RemoteRequestKind.INITIALIZE_CURSOR, database, target.queryId(), target.ownName(), 0, RemoteResponse.NO_ERROR);
    }

    public static RemoteRequest getSome(String database, RemoteTarget target, int atMost) {
        return new RemoteRequest(RemoteRequestKind.GET_SOME, database, target.queryId(), target.ownName(), atMost, RemoteResponse.NO_ERROR);
    }

    public static RemoteRequest shutdown(String database, RemoteTarget target, int errorCode) {
        return new RemoteRequest(RemoteRequestKind.SHUTDOWN, database, target.queryId(), target.ownName(), 0, errorCode);
    }

    public static RemoteRequest cancel(String database, RemoteTarget target) {
        return new RemoteRequest(RemoteRequestKind.CANCEL, database, target.queryId(), target.ownName(), 0, RemoteResponse.QUERY_KILLED);
    }
}
