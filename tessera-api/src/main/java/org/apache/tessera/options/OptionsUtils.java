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

package org.apache.tessera.options;

import java.util.Arrays;
import java.util.Locale;

/** 把字符串形式的配置值转换为 {@link ConfigOption} 声明的类型。 */
final class OptionsUtils {

    private OptionsUtils() {}

    /** @throws IllegalArgumentException 无法转换,或类型不受支持 */
    static <T> T convertValue(String raw, Class<T> type) {
        if (type == Integer.class) {
            return type.cast(Integer.valueOf(raw.trim()));
        }
        if (type.isEnum()) {
            return type.cast(convertToEnum(raw, type));
        }
        throw new IllegalArgumentException("Unsupported option type: " + type.getName());
    }

    private static Object convertToEnum(String raw, Class<?> enumClass) {
        String name = raw.trim().toUpperCase(Locale.ROOT);
        Object[] constants = enumClass.getEnumConstants();
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equals(name)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                "Expected one of " + Arrays.toString(constants) + ", but was " + raw);
    }
}
