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

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link MurmurHashUtils}. */
class MurmurHashUtilsTest {

    @Test
    void testReferenceVectors() {
        assertThat(MurmurHashUtils.hashBytes(new byte[0])).isEqualTo(0);
        assertThat(hash("a")).isEqualTo(1009084850);
        assertThat(hash("ab")).isEqualTo(-1681926305);
        assertThat(hash("abc")).isEqualTo(-1277324294);
        assertThat(hash("iceberg")).isEqualTo(1210000089);
        assertThat(MurmurHashUtils.hashBytes(new byte[] {0, 1, 2, 3})).isEqualTo(-188683207);
    }

    @Test
    void testTailBytesAreUnsigned() {
        assertThat(MurmurHashUtils.hashBytes(new byte[] {(byte) 0xff})).isEqualTo(-43192051);
        assertThat(MurmurHashUtils.hashBytes(new byte[] {(byte) 0x80, (byte) 0xfe, 0x7f}))
                .isEqualTo(861078569);
    }

    @Test
    void testHashLongMatchesLittleEndianBytes() {
        long[] values = {0L, 34L, -1L, 200L, 4294967295L, Long.MIN_VALUE, Long.MAX_VALUE};
        for (long value : values) {
            byte[] bytes =
                    ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
            assertThat(MurmurHashUtils.hashLong(value))
                    .as("hash of %s", value)
                    .isEqualTo(MurmurHashUtils.hashBytes(bytes));
        }
        assertThat(MurmurHashUtils.hashLong(34L)).isEqualTo(2017239379);
        assertThat(MurmurHashUtils.hashLong(-1L)).isEqualTo(1651860712);
    }

    @Test
    void testHashSlice() {
        byte[] padded = "xxicebergyy".getBytes(StandardCharsets.UTF_8);
        assertThat(MurmurHashUtils.hashBytes(padded, 2, 7)).isEqualTo(1210000089);
    }

    private static int hash(String value) {
        return MurmurHashUtils.hashBytes(value.getBytes(StandardCharsets.UTF_8));
    }
}
