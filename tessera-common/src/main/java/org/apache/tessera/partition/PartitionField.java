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

package org.apache.tessera.partition;

import org.apache.tessera.annotation.Public;
import org.apache.tessera.transform.PartitionTransform;
import org.apache.tessera.transform.PartitionTransforms;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 分区字段:对源列 {@code sourceName} 施加 {@code transform},产生名为 {@code name} 的分区键列。
 *
 * <p>JSON 中变换以规范字符串保存:
 *
 * <pre>{@code
 * {"source-name":"ts","name":"ts_day","transform":"day"}
 * }</pre>
 */
@Public
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartitionField implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String FIELD_SOURCE_NAME = "source-name";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_TRANSFORM = "transform";

    private final String sourceName;
    private final String name;
    private final PartitionTransform transform;

    public PartitionField(String sourceName, String name, PartitionTransform transform) {
        checkArgument(
                sourceName != null && !sourceName.isEmpty(), "Source name must not be empty.");
        checkArgument(name != null && !name.isEmpty(), "Partition field name must not be empty.");
        this.sourceName = sourceName;
        this.name = name;
        this.transform = checkNotNull(transform, "transform must not be null");
    }

    @JsonCreator
    static PartitionField fromJson(
            @JsonProperty(FIELD_SOURCE_NAME) String sourceName,
            @JsonProperty(FIELD_NAME) String name,
            @JsonProperty(FIELD_TRANSFORM) String transform) {
        checkArgument(transform != null, "Partition field %s has no transform.", name);
        return new PartitionField(sourceName, name, PartitionTransforms.fromString(transform));
    }

    @JsonGetter(FIELD_SOURCE_NAME)
    public String sourceName() {
        return sourceName;
    }

    @JsonGetter(FIELD_NAME)
    public String name() {
        return name;
    }

    public PartitionTransform transform() {
        return transform;
    }

    @JsonGetter(FIELD_TRANSFORM)
    String transformString() {
        return transform.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PartitionField that = (PartitionField) o;
        return sourceName.equals(that.sourceName)
                && name.equals(that.name)
                && transform.equals(that.transform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, name, transform);
    }

    @Override
    public String toString() {
        return name + ": " + transform + "(" + sourceName + ")";
    }
}
