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

import com.shardgate.common.ShardgateException;

/**
 * Thrown when a remote call fails: transport error, deadline, cancellation or an error reply.
 */
public class RemoteCommunicationException extends ShardgateException {
    private final int remoteErrorCode;

    public RemoteCommunicationException(String message) {
        super("REMOTE", message);
        this.remoteErrorCode = RemoteResponse.NO_ERROR;
    }

    public RemoteCommunicationException(String message, Throwable cause) {
        super("REMOTE", message, cause);
        this.remoteErrorCode = RemoteResponse.NO_ERROR;
    }

    public RemoteCommunicationException(String message, int remoteErrorCode) {
        super("REMOTE", message);
        this.remoteErrorCode = remoteErrorCode;
    }

    /**
     * @return the error code sent by the remote side, {@link RemoteResponse#NO_ERROR} if the
     * failure happened locally
     */
    public int getRemoteErrorCode() {
        return remoteErrorCode;
    }
}
