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

import org.apache.tessera.annotation.Public;

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * {@link ConfigOption} 的构建入口:先给出键,再选择值类型,最后给出默认值。
 *
 * <pre>{@code
 * ConfigOption<OffsetMode> mode = ConfigOptions.key("timestamp.offset-mode")
 *         .enumType(OffsetMode.class)
 *         .defaultValue(OffsetMode.LOCAL);
 * }</pre>
 */
@Public
public final class ConfigOptions {

    private ConfigOptions() {}

    public static OptionBuilder key(String key) {
        return new OptionBuilder(checkNotNull(key));
    }

    /** 选择值类型。 */
    public static final class OptionBuilder {

        private final String key;

        private OptionBuilder(String key) {
            this.key = key;
        }

        public TypedBuilder<Integer> intType() {
            return new TypedBuilder<>(key, Integer.class);
        }

        public <E extends Enum<E>> TypedBuilder<E> enumType(Class<E> enumClass) {
            return new TypedBuilder<>(key, enumClass);
        }
    }

    /** 给出默认值。 */
    public static final class TypedBuilder<T> {

        private final String key;
        private final Class<T> type;

        private TypedBuilder(String key, Class<T> type) {
            this.key = key;
            this.type = type;
        }

        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, type, value, "");
        }
    }
}
