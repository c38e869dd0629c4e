/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tessera.transform;

import org.apache.tessera.annotation.VisibleForTesting;
import org.apache.tessera.data.columnar.ColumnVector;
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.options.Options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 按行区间执行 {@link RowKernel}。
 *
 * <h2>执行方式</h2>
 *
 * <ul>
 *   <li>行数小于 {@link TransformOptions#PARALLEL_MIN_ROWS} 或并行度为 1 时,在调用线程上顺序执行
 *   <li>否则把行区间递归二分为 {@link RecursiveAction},提交到并行度为
 *       {@link TransformOptions#PARALLELISM} 的 {@link ForkJoinPool};每个任务只写自己区间内的
 *       输出下标
 * </ul>
 *
 * <p>空行由执行器直接在输出中标记为空,kernel 只处理非空行。任一区间抛出的异常在所有任务结束后
 * 原样抛给调用方,已写入的输出随之丢弃。同一并行度的线程池在进程内共享,线程为守护线程。
 */
public class TransformExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(TransformExecutor.class);

    private static final int MIN_ROWS_PER_TASK = 1024;

    /** 每个工作线程平均分到的任务数,用于平衡各区间耗时的差异。 */
    private static final int TASKS_PER_WORKER = 4;

    private static final Map<Integer, ForkJoinPool> POOLS = new ConcurrentHashMap<>();

    private final int parallelism;
    private final int parallelMinRows;

    public TransformExecutor(Options options) {
        this(
                options.get(TransformOptions.PARALLELISM),
                options.get(TransformOptions.PARALLEL_MIN_ROWS));
    }

    @VisibleForTesting
    TransformExecutor(int parallelism, int parallelMinRows) {
        checkArgument(
                parallelism >= 1,
                "%s must be at least 1, but is %s.",
                TransformOptions.PARALLELISM.key(),
                parallelism);
        checkArgument(
                parallelMinRows >= 0,
                "%s must not be negative, but is %s.",
                TransformOptions.PARALLEL_MIN_ROWS.key(),
                parallelMinRows);
        this.parallelism = parallelism;
        this.parallelMinRows = parallelMinRows;
    }

    public void execute(
            String transformName,
            TypedColumn input,
            WritableColumnVector output,
            RowKernel kernel) {
        int size = input.size();
        if (isParallel(size)) {
            int rowsPerTask = rowsPerTask(size);
            LOG.debug(
                    "Evaluating {} on {} rows of {} with parallelism {}, {} rows per task.",
                    transformName,
                    size,
                    input.type(),
                    parallelism,
                    rowsPerTask);
            AtomicReference<RuntimeException> failure = new AtomicReference<>();
            pool(parallelism)
                    .invoke(
                            new RangeTask(
                                    input.vector(), output, kernel, 0, size, rowsPerTask, failure));
            RuntimeException e = failure.get();
            if (e != null) {
                throw e;
            }
        } else {
            evaluate(input.vector(), output, kernel, 0, size);
        }
        kernel.finish(size);
    }

    @VisibleForTesting
    boolean isParallel(int size) {
        return parallelism > 1 && size >= parallelMinRows && size > MIN_ROWS_PER_TASK;
    }

    private int rowsPerTask(int size) {
        long tasks = (long) parallelism * TASKS_PER_WORKER;
        return (int) Math.max(MIN_ROWS_PER_TASK, (size + tasks - 1) / tasks);
    }

    private static void evaluate(
            ColumnVector input, WritableColumnVector output, RowKernel kernel, int from, int to) {
        for (int row = from; row < to; row++) {
            if (input.isNullAt(row)) {
                output.setNullAt(row);
            } else {
                kernel.compute(row);
            }
        }
    }

    private static ForkJoinPool pool(int parallelism) {
        return POOLS.computeIfAbsent(
                parallelism,
                p ->
                        new ForkJoinPool(
                                p, new WorkerThreadFactory("tessera-transform-" + p), null, false));
    }

    // ------------------------------------------------------------------------------------------

    private static class RangeTask extends RecursiveAction {

        private static final long serialVersionUID = 1L;

        private final ColumnVector input;
        private final WritableColumnVector output;
        private final RowKernel kernel;
        private final int from;
        private final int to;
        private final int rowsPerTask;
        private final AtomicReference<RuntimeException> failure;

        private RangeTask(
                ColumnVector input,
                WritableColumnVector output,
                RowKernel kernel,
                int from,
                int to,
                int rowsPerTask,
                AtomicReference<RuntimeException> failure) {
            this.input = input;
            this.output = output;
            this.kernel = kernel;
            this.from = from;
            this.to = to;
            this.rowsPerTask = rowsPerTask;
            this.failure = failure;
        }

        @Override
        protected void compute() {
            if (failure.get() != null) {
                return;
            }
            if (to - from <= rowsPerTask) {
                try {
                    evaluate(input, output, kernel, from, to);
                } catch (RuntimeException e) {
                    // first failure wins
                    failure.compareAndSet(null, e);
                }
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(
                    new RangeTask(input, output, kernel, from, mid, rowsPerTask, failure),
                    new RangeTask(input, output, kernel, mid, to, rowsPerTask, failure));
        }
    }

    /** 为工作线程命名,便于在线程转储中识别。 */
    private static class WorkerThreadFactory implements ForkJoinPool.ForkJoinWorkerThreadFactory {

        private final AtomicInteger threadNumber = new AtomicInteger(1);

        private final String namePrefix;

        private WorkerThreadFactory(String poolName) {
            this.namePrefix = poolName + "-thread-";
        }

        @Override
        public ForkJoinWorkerThread newThread(ForkJoinPool pool) {
            ForkJoinWorkerThread t =
                    ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            t.setName(namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
