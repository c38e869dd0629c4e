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

package org.apache.tessera.utils;

/**
 * 32 位 Murmur3(x86_32)哈希,种子为 0,与 Apache Iceberg 分桶所用的哈希逐位一致。
 *
 * <p>块按小端序读取;不足 4 字节的尾部按无符号字节合并成一个块,只做一次 k1 混合。
 */
public final class MurmurHashUtils {

    private static final int C1 = 0xcc9e2d51;

    private static final int C2 = 0x1b873593;

    public static final int DEFAULT_SEED = 0;

    private MurmurHashUtils() {
        // do not instantiate
    }

    /** 对 {@code value} 的 8 字节小端序编码求哈希。 */
    public static int hashLong(long value) {
        int h1 = DEFAULT_SEED;
        h1 = mixH1(h1, mixK1((int) value));
        h1 = mixH1(h1, mixK1((int) (value >>> 32)));
        return fmix(h1, 8);
    }

    public static int hashBytes(byte[] bytes) {
        return hashBytes(bytes, 0, bytes.length);
    }

    public static int hashBytes(byte[] bytes, int offset, int lengthInBytes) {
        int lengthAligned = lengthInBytes - lengthInBytes % 4;
        int h1 = DEFAULT_SEED;
        for (int i = 0; i < lengthAligned; i += 4) {
            h1 = mixH1(h1, mixK1(getIntLittleEndian(bytes, offset + i)));
        }

        int k1 = 0;
        int tail = offset + lengthAligned;
        switch (lengthInBytes - lengthAligned) {
            case 3:
                k1 ^= (bytes[tail + 2] & 0xff) << 16;
                // fall through
            case 2:
                k1 ^= (bytes[tail + 1] & 0xff) << 8;
                // fall through
            case 1:
                k1 ^= bytes[tail] & 0xff;
                h1 ^= mixK1(k1);
                break;
            default:
                break;
        }
        return fmix(h1, lengthInBytes);
    }

    private static int getIntLittleEndian(byte[] bytes, int offset) {
        return (bytes[offset] & 0xff)
                | (bytes[offset + 1] & 0xff) << 8
                | (bytes[offset + 2] & 0xff) << 16
                | (bytes[offset + 3] & 0xff) << 24;
    }

    private static int mixK1(int k1) {
        k1 *= C1;
        k1 = Integer.rotateLeft(k1, 15);
        k1 *= C2;
        return k1;
    }

    private static int mixH1(int h1, int k1) {
        h1 ^= k1;
        h1 = Integer.rotateLeft(h1, 13);
        h1 = h1 * 5 + 0xe6546b64;
        return h1;
    }

    // Finalization mix - force all bits of a hash block to avalanche
    private static int fmix(int h1, int length) {
        h1 ^= length;
        h1 ^= h1 >>> 16;
        h1 *= 0x85ebca6b;
        h1 ^= h1 >>> 13;
        h1 *= 0xc2b2ae35;
        h1 ^= h1 >>> 16;
        return h1;
    }
}
