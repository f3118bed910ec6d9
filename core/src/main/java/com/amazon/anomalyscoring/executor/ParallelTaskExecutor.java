/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyscoring.executor;

import static com.amazon.anomalyscoring.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * An executor that uses a private thread pool to run the tasks in parallel.
 * The results are collected in item order.
 */
public class ParallelTaskExecutor extends AbstractTaskExecutor {

    private ForkJoinPool forkJoinPool;

    @Getter
    private final int threadPoolSize;

    public ParallelTaskExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <T, R> List<R> execute(List<T> items, Function<? super T, ? extends R> task) {
        return submitAndJoin(() -> items.parallelStream().map(task).collect(Collectors.<R>toList()));
    }

    /**
     * Shut the pool down. A later {@link #execute} starts a new one.
     */
    @Override
    public synchronized void shutdown() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    synchronized boolean isPoolActive() {
        return forkJoinPool != null;
    }

    private <V> V submitAndJoin(Callable<V> callable) {
        ForkJoinPool pool;
        synchronized (this) {
            if (forkJoinPool == null) {
                forkJoinPool = new ForkJoinPool(threadPoolSize);
            }
            pool = forkJoinPool;
        }
        return pool.submit(callable).join();
    }
}
