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

import com.typesafe.config.Config;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Process-wide context shared by the services of a Shardgate server. It exposes the loaded
 * configuration and a registry of running services, in registration order.
 */
public interface Context {

    String getClusterName();

    Config getConfig();

    void registerService(@Nonnull String id, @Nonnull ShardgateService service);

    <T> T getService(@Nonnull String id);

    List<ShardgateService> getServices();
}
