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

import com.shardgate.common.MissingConfigException;
import com.typesafe.config.Config;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * The ContextImpl class represents the implementation of the Context interface.
 */
public class ContextImpl implements Context {
    private final Config config;
    private final String clusterName;
    private final LinkedHashMap<String, ShardgateService> services = new LinkedHashMap<>();

    public ContextImpl(Config config) {
        if (config.hasPath("cluster.name")) {
            clusterName = config.getString("cluster.name");
            if (clusterName.isBlank()) {
                throw new IllegalArgumentException("cluster.name is empty or blank");
            }
        } else {
            throw new MissingConfigException("cluster.name is missing in configuration");
        }
        this.config = config;
    }

    @Override
    public String getClusterName() {
        return clusterName;
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public synchronized void registerService(@Nonnull String id, @Nonnull ShardgateService service) {
        // Registration order is also the shutdown order, this is why we use LinkedHashMap to store services.
        services.putIfAbsent(id, service);
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized <T> T getService(@Nonnull String id) {
        return (T) services.get(id);
    }

    @Override
    public synchronized List<ShardgateService> getServices() {
        return new ArrayList<>(services.values());
    }
}
