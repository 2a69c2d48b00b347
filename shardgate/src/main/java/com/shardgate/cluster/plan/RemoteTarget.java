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

package com.shardgate.cluster.plan;

/**
 * Identifies a remote execution context.
 *
 * @param server  the server process hosting the sub-plan
 * @param ownName the name under which the caller is known to the remote side
 * @param queryId the remote query the sub-plan runs in
 */
public record RemoteTarget(String server, String ownName, String queryId) {
}
