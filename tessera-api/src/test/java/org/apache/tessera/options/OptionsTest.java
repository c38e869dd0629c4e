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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options}. */
class OptionsTest {

    private static final ConfigOption<Integer> INT_OPTION =
            ConfigOptions.key("test.int").intType().defaultValue(7).withDescription("An int.");

    private static final ConfigOption<Mode> ENUM_OPTION =
            ConfigOptions.key("test.mode").enumType(Mode.class).defaultValue(Mode.FAST);

    private enum Mode {
        FAST,
        SAFE
    }

    @Test
    void testDefaultValues() {
        Options options = new Options();
        assertThat(options.get(INT_OPTION)).isEqualTo(7);
        assertThat(options.get(ENUM_OPTION)).isEqualTo(Mode.FAST);
        assertThat(INT_OPTION.key()).isEqualTo("test.int");
        assertThat(INT_OPTION.description()).isEqualTo("An int.");
    }

    @Test
    void testParseStringValues() {
        Map<String, String> map = new HashMap<>();
        map.put("test.int", " 42 ");
        map.put("test.mode", "safe");
        Options options = Options.fromMap(map);

        assertThat(options.get(INT_OPTION)).isEqualTo(42);
        assertThat(options.get(ENUM_OPTION)).isEqualTo(Mode.SAFE);
    }

    @Test
    void testSetTypedValue() {
        Options options = new Options().set(INT_OPTION, -3).set(ENUM_OPTION, Mode.SAFE);
        assertThat(options.get(INT_OPTION)).isEqualTo(-3);
        assertThat(options.get(ENUM_OPTION)).isEqualTo(Mode.SAFE);

        options.setString("test.int", "5");
        assertThat(options.get(INT_OPTION)).isEqualTo(5);
    }

    @Test
    void testInvalidValueNamesKey() {
        Options options = new Options().setString("test.int", "many");
        assertThatThrownBy(() -> options.get(INT_OPTION))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Could not parse value 'many' for key 'test.int'.");

        options.setString("test.int", "9000000000");
        assertThatThrownBy(() -> options.get(INT_OPTION))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test.int");

        options.setString("test.mode", "slow");
        assertThatThrownBy(() -> options.get(ENUM_OPTION))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Could not parse value 'slow' for key 'test.mode'.")
                .hasRootCauseMessage("Expected one of [FAST, SAFE], but was slow");
    }

    @Test
    void testNullValuesRejected() {
        assertThatThrownBy(() -> new Options().set(INT_OPTION, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("test.int");
    }
}
