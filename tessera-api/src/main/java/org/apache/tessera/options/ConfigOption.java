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
 * 一个类型化的配置项:键、值类型、默认值和说明。
 *
 * <p>由 {@link ConfigOptions#key(String)} 构建,不可变。
 *
 * @param <T> 配置值的类型
 */
@Public
public final class ConfigOption<T> {

    private final String key;
    private final Class<T> type;
    private final T defaultValue;
    private final String description;

    ConfigOption(String key, Class<T> type, T defaultValue, String description) {
        this.key = checkNotNull(key);
        this.type = checkNotNull(type);
        this.defaultValue = checkNotNull(defaultValue, "Option %s needs a default value.", key);
        this.description = description;
    }

    public ConfigOption<T> withDescription(String description) {
        return new ConfigOption<>(key, type, defaultValue, description);
    }

    public String key() {
        return key;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    Class<T> type() {
        return type;
    }

    @Override
    public String toString() {
        return key + " (default: " + defaultValue + ")";
    }
}
