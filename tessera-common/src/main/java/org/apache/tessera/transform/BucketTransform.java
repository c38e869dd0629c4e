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

import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.data.columnar.writable.WritableIntVector;
import org.apache.tessera.options.Options;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypeRoot;
import org.apache.tessera.types.DataTypes;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 哈希分桶变换:把任意支持的值映射到 {@code [0, numBuckets)} 中的桶号,结果类型 INT。
 *
 * <p>桶号为 {@code (hash & Integer.MAX_VALUE) % numBuckets},哈希见 {@link BucketHash}。逻辑值
 * 相等的两个值总是落在同一个桶中。
 */
public class BucketTransform extends AbstractPartitionTransform {

    private static final long serialVersionUID = 1L;

    private final int numBuckets;

    BucketTransform(int numBuckets) {
        checkArgument(
                numBuckets >= 1, "Number of buckets must be at least 1, but is %s.", numBuckets);
        this.numBuckets = numBuckets;
    }

    public int numBuckets() {
        return numBuckets;
    }

    public static int bucket(int hash, int numBuckets) {
        return (hash & Integer.MAX_VALUE) % numBuckets;
    }

    @Override
    public boolean canTransform(DataType sourceType) {
        return !sourceType.is(DataTypeRoot.BOOLEAN);
    }

    @Override
    protected DataType resultType(DataType sourceType) {
        return DataTypes.INT();
    }

    @Override
    protected RowKernel createKernel(
            TypedColumn input, WritableColumnVector output, Options options) {
        BucketHash.RowHasher hasher = BucketHash.hasher(input.type(), input.vector());
        WritableIntVector buckets = (WritableIntVector) output;
        return row -> {
            int hash;
            try {
                hash = hasher.hash(row);
            } catch (ArithmeticException e) {
                throw overflow(input.type(), input.getValue(row), e);
            }
            buckets.setInt(row, bucket(hash, numBuckets));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return numBuckets == ((BucketTransform) o).numBuckets;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(numBuckets);
    }

    @Override
    public String toString() {
        return "bucket[" + numBuckets + "]";
    }
}
