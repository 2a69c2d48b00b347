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

package com.shardgate.instance;

import com.shardgate.CachedTimeService;
import com.shardgate.Context;
import com.shardgate.ContextImpl;
import com.shardgate.ShardgateService;
import com.shardgate.cluster.remote.RemoteQueryHandler;
import com.shardgate.transaction.TransactionLeaseService;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A Shardgate process: the context, its services and the endpoint remote coordinators talk to.
 */
public class ShardgateInstance {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShardgateInstance.class);
    protected final Config config;
    protected Context context;
    private RemoteQueryHandler remoteQueryHandler;
    private volatile ShardgateInstanceStatus status = ShardgateInstanceStatus.INITIALIZING;

    public ShardgateInstance() {
        this(ConfigFactory.load());
    }

    public ShardgateInstance(Config config) {
        this.config = config;
    }

    /**
     * Registers the services of the instance. The registration order is also the reverse of
     * the shutdown order.
     */
    private void registerShardgateServices() {
        CachedTimeService cachedTimeService = new CachedTimeService(context);
        context.registerService(CachedTimeService.NAME, cachedTimeService);
        cachedTimeService.start();

        TransactionLeaseService transactionLeaseService = new TransactionLeaseService(context);
        context.registerService(TransactionLeaseService.NAME, transactionLeaseService);
        transactionLeaseService.start();

        remoteQueryHandler = new RemoteQueryHandler(transactionLeaseService.getRegistry());
    }

    public synchronized void start() {
        LOGGER.info("Initializing a new Shardgate instance");
        try {
            context = new ContextImpl(config);
            registerShardgateServices();
            setStatus(ShardgateInstanceStatus.RUNNING);
        } catch (Exception e) {
            LOGGER.error("Failed to initialize the instance", e);
            shutdown();
            throw e;
        }
        LOGGER.info("Ready to accept remote queries, cluster: {}", context.getClusterName());
    }

    /**
     * Shuts the services down in reverse registration order. Idempotent.
     */
    public synchronized void shutdown() {
        if (context == null) {
            // Context creation failed, nothing has been started.
            return;
        }
        if (status == ShardgateInstanceStatus.STOPPED) {
            return;
        }
        LOGGER.info("Shutting down Shardgate");
        setStatus(ShardgateInstanceStatus.STOPPED);

        List<ShardgateService> services = new ArrayList<>(context.getServices());
        Collections.reverse(services);
        for (ShardgateService service : services) {
            try {
                LOGGER.debug("{} service has been shutting down", service.getName());
                service.shutdown();
            } catch (Exception e) {
                LOGGER.error("{} service cannot be closed due to errors", service.getName(), e);
            }
        }
    }

    public ShardgateInstanceStatus getStatus() {
        return status;
    }

    private void setStatus(ShardgateInstanceStatus status) {
        this.status = status;
        LOGGER.info("Setting instance status to {}", status);
    }

    public Context getContext() {
        return context;
    }

    public RemoteQueryHandler getRemoteQueryHandler() {
        return remoteQueryHandler;
    }

    public Duration getRemoteRequestTimeout() {
        return config.getDuration("remote.request_timeout");
    }

    public int getRemoteBatchSize() {
        return config.getInt("remote.batch_size");
    }
}
