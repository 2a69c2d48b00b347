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

package com.shardgate.internal;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.*;

/**
 * Factory methods for the executors Shardgate runs its background work on.
 * <p>
 * Bounded executors scale from 0 to a maximum number of threads, queue excess tasks in a
 * {@link LinkedBlockingQueue} and let idle threads (core threads included) time out.
 */
public final class ShardgateExecutors {

    private ShardgateExecutors() {
    }

    /**
     * Creates a bounded executor service with customizable thread pool parameters.
     *
     * @param maxThreads    the maximum number of threads to allow in the pool. Must be greater than 0.
     * @param keepAliveTime the time limit for which idle threads may remain alive before being terminated.
     * @param timeUnit      the time unit for the {@code keepAliveTime} parameter.
     * @param factory       the factory to use when creating new threads.
     * @return a new bounded {@link ExecutorService}
     * @throws IllegalArgumentException if {@code maxThreads} is less than or equal to 0.
     */
    public static ExecutorService newBoundedExecutor(
            int maxThreads,
            long keepAliveTime,
            TimeUnit timeUnit,
            ThreadFactory factory
    ) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                maxThreads,
                maxThreads,
                keepAliveTime,
                timeUnit,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Creates a bounded executor whose threads are named after the given format, for example
     * {@code "sg-remote-%d"}. The pool is sized to the number of available processors.
     *
     * @param nameFormat a {@link String#format(String, Object...)}-compatible format for thread names
     * @return a new bounded {@link ExecutorService}
     */
    public static ExecutorService newBoundedExecutor(String nameFormat) {
        int maxThreads = Runtime.getRuntime().availableProcessors();
        ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
        return newBoundedExecutor(maxThreads, 1L, TimeUnit.MINUTES, factory);
    }

    /**
     * Creates a single-threaded scheduler running on a named daemon thread.
     *
     * @param nameFormat a {@link String#format(String, Object...)}-compatible format for the thread name
     * @return a new {@link ScheduledExecutorService}
     */
    public static ScheduledExecutorService newSingleThreadScheduler(String nameFormat) {
        ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
        return new ScheduledThreadPoolExecutor(1, factory);
    }
}
