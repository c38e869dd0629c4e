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

import javax.annotation.concurrent.ThreadSafe;

import java.util.HashMap;
import java.util.Map;

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 以字符串保存的配置集合,按 {@link ConfigOption} 读取时转换类型,未设置时返回默认值。
 *
 * <p>无法转换的值在读取时抛出 {@link IllegalArgumentException},消息中包含值和键名。实例可以在
 * 线程间共享。
 *
 * <pre>{@code
 * Options options = Options.fromMap(Collections.singletonMap("transform.parallelism", "8"));
 * int parallelism = options.get(TransformOptions.PARALLELISM);
 * }</pre>
 */
@Public
@ThreadSafe
public class Options {

    private final Map<String, String> values = new HashMap<>();

    public Options() {}

    public static Options fromMap(Map<String, String> map) {
        Options options = new Options();
        map.forEach(options::setString);
        return options;
    }

    public synchronized Options setString(String key, String value) {
        values.put(checkNotNull(key), checkNotNull(value, "Value of %s must not be null.", key));
        return this;
    }

    public <T> Options set(ConfigOption<T> option, T value) {
        checkNotNull(value, "Value of %s must not be null.", option.key());
        String raw = value instanceof Enum ? ((Enum<?>) value).name() : value.toString();
        return setString(option.key(), raw);
    }

    public synchronized <T> T get(ConfigOption<T> option) {
        String raw = values.get(option.key());
        if (raw == null) {
            return option.defaultValue();
        }
        try {
            return OptionsUtils.convertValue(raw, option.type());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Could not parse value '%s' for key '%s'.", raw, option.key()),
                    e);
        }
    }

    @Override
    public synchronized String toString() {
        return values.toString();
    }
}
