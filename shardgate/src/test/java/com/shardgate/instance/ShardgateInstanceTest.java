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

import com.shardgate.BaseTest;
import com.shardgate.CachedTimeService;
import com.shardgate.transaction.RecordingTransactionHandle;
import com.shardgate.transaction.TransactionLeaseService;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ShardgateInstanceTest extends BaseTest {

    @Test
    public void test_start_then_shutdown() {
        ShardgateInstance instance = new ShardgateInstance(loadConfig("test.conf"));
        instance.start();
        try {
            assertThat(instance.getStatus()).isEqualTo(ShardgateInstanceStatus.RUNNING);
            assertThat(instance.getContext().<CachedTimeService>getService(CachedTimeService.NAME)).isNotNull();
            assertThat(instance.getContext().<TransactionLeaseService>getService(TransactionLeaseService.NAME)).isNotNull();
            assertThat(instance.getRemoteQueryHandler()).isNotNull();
            assertThat(instance.getRemoteRequestTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(instance.getRemoteBatchSize()).isEqualTo(2);
        } finally {
            instance.shutdown();
        }
        assertThat(instance.getStatus()).isEqualTo(ShardgateInstanceStatus.STOPPED);
    }

    @Test
    public void test_shutdown_destroys_leases() {
        ShardgateInstance instance = new ShardgateInstance(loadConfig("test.conf"));
        instance.start();
        TransactionLeaseService service = instance.getContext().getService(TransactionLeaseService.NAME);
        RecordingTransactionHandle handle = new RecordingTransactionHandle();
        service.getRegistry().insert("db", 1, handle);

        instance.shutdown();
        instance.shutdown();

        assertThat(handle.releases()).isEqualTo(1);
    }
}
