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

package com.shardgate;

/**
 * ShardgateService is an interface that represents a long-running component of a Shardgate process.
 * It provides methods to get the service name, the owning context, and to shut the service down.
 */
public interface ShardgateService {
    /**
     * Retrieves the name of the service.
     *
     * @return the name of the service
     */
    String getName();

    /**
     * Retrieves the context associated with the service.
     *
     * @return the context associated with the service
     */
    Context getContext();

    /**
     * Shuts down the service and releases the resources it owns.
     */
    void shutdown();
}
