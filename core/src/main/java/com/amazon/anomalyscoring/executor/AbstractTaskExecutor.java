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

import java.util.List;
import java.util.function.Function;

/**
 * Applies an independent task to each item of a list. Tasks must not share
 * mutable state; every task returns its own result and the results are
 * returned in the order of the items, whatever order the tasks ran in.
 */
public abstract class AbstractTaskExecutor {

    /**
     * Run the task on every item.
     *
     * @param items the inputs
     * @param task  the task, applied once per item
     * @param <T>   the input type
     * @param <R>   the result type
     * @return one result per item, in item order
     */
    public abstract <T, R> List<R> execute(List<T> items, Function<? super T, ? extends R> task);

    /**
     * Release the worker threads held by this executor, if any. The executor can
     * still be used afterwards.
     */
    public void shutdown() {
    }

    /**
     * @param parallelExecutionEnabled whether tasks may run on several threads
     * @param threadPoolSize           the number of worker threads when parallel
     * @return a sequential or parallel executor
     */
    public static AbstractTaskExecutor create(boolean parallelExecutionEnabled, int threadPoolSize) {
        if (parallelExecutionEnabled) {
            return new ParallelTaskExecutor(threadPoolSize);
        }
        return new SequentialTaskExecutor();
    }
}
