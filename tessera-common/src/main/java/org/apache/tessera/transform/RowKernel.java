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

/**
 * 变换的逐行计算逻辑,由 {@link TransformExecutor} 调度。
 *
 * <p>{@link #compute(int)} 只对非空行调用,可能被多个线程以互不相交的行区间并发调用,因此只能
 * 写入当前行对应的输出位置。{@link #finish(int)} 在所有行计算完成后于调用线程上执行一次。
 */
@FunctionalInterface
public interface RowKernel {

    void compute(int row);

    default void finish(int size) {}
}
