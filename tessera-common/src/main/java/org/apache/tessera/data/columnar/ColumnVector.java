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

package org.apache.tessera.data.columnar;

import org.apache.tessera.annotation.Public;

/**
 * 列向量的只读接口,所有具体向量都实现它。
 *
 * <p>向量只记录值和空值标记,逻辑类型由 {@link TypedColumn} 携带;同一种物理向量可以承载多个
 * 逻辑类型,例如 {@link IntColumnVector} 同时存放 INT、INT UNSIGNED 和 DATE。
 */
@Public
public interface ColumnVector {

    boolean isNullAt(int i);

    default int getCapacity() {
        return Integer.MAX_VALUE;
    }
}
