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

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class CachedTimeServiceTest extends BaseTest {

    @Test
    public void test_time_is_available_before_start() {
        long before = System.currentTimeMillis();
        CachedTimeService service = new CachedTimeService(new ContextImpl(loadConfig("test.conf")));
        assertThat(service.getAsLong()).isGreaterThanOrEqualTo(before);
    }

    @Test
    public void test_time_moves_forward() {
        CachedTimeService service = new CachedTimeService(new ContextImpl(loadConfig("test.conf")));
        service.start();
        try {
            long first = service.getAsLong();
            await().atMost(5, TimeUnit.SECONDS).until(() -> service.getAsLong() > first);
        } finally {
            service.shutdown();
        }
    }

    @Test
    public void test_time_never_moves_backwards() {
        ManualClock systemClock = new ManualClock(10_000);
        CachedTimeService service = new CachedTimeService(new ContextImpl(loadConfig("test.conf")), systemClock);
        assertThat(service.getAsLong()).isEqualTo(10_000);

        systemClock.set(4_000);
        service.update();
        assertThat(service.getAsLong()).isEqualTo(10_000);

        systemClock.set(10_001);
        service.update();
        assertThat(service.getAsLong()).isEqualTo(10_001);
    }
}
