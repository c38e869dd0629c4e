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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 变长字节列向量,存放 UTF-8 字符串和二进制值。
 *
 * <p>{@link #getBytes(int)} 返回指向底层缓冲区的切片,调用方不能修改其内容。
 */
public interface BytesColumnVector extends ColumnVector {
    Bytes getBytes(int i);

    /** 底层缓冲区中的一段字节。 */
    class Bytes {
        public final byte[] data;
        public final int offset;
        public final int len;

        public Bytes(byte[] data, int offset, int len) {
            this.data = data;
            this.offset = offset;
            this.len = len;
        }

        public byte[] getBytes() {
            if (offset == 0 && len == data.length) {
                return data;
            }
            return Arrays.copyOfRange(data, offset, offset + len);
        }

        public String toUtf8String() {
            return new String(data, offset, len, StandardCharsets.UTF_8);
        }
    }
}
