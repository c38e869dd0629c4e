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
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.options.Options;
import org.apache.tessera.transform.PartitionTransform;
import org.apache.tessera.transform.PartitionTransforms;
import org.apache.tessera.utils.JsonSerdeUtil;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 分区规格:一组有序的 {@link PartitionField},描述一批数据的全部分区键如何计算。
 *
 * <h2>约束</h2>
 *
 * <ul>
 *   <li>至少包含一个字段,字段名互不相同
 *   <li>同一次 {@link #computePartitionKeys} 调用中所有源列的行数必须相同
 * </ul>
 *
 * <h2>JSON 格式</h2>
 *
 * <pre>{@code
 * {"spec-id":0,"fields":[{"source-name":"ts","name":"ts_day","transform":"day"},
 *                        {"source-name":"id","name":"id_bucket","transform":"bucket[16]"}]}
 * }</pre>
 *
 * <h2>使用示例</h2>
 *
 * <pre>{@code
 * PartitionSpec spec = PartitionSpec.builder()
 *         .withSpecId(1)
 *         .day("ts")
 *         .bucket("id", 16)
 *         .build();
 * Map<String, TypedColumn> keys = spec.computePartitionKeys(columns);
 * }</pre>
 */
@Public
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartitionSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(PartitionSpec.class);

    public static final String FIELD_SPEC_ID = "spec-id";
    public static final String FIELD_FIELDS = "fields";

    private final int specId;
    private final List<PartitionField> fields;

    @JsonCreator
    public PartitionSpec(
            @JsonProperty(FIELD_SPEC_ID) int specId,
            @JsonProperty(FIELD_FIELDS) List<PartitionField> fields) {
        checkArgument(
                fields != null && !fields.isEmpty(),
                "Partition spec %s must have at least one field.",
                specId);
        Set<String> names = new HashSet<>();
        for (PartitionField field : fields) {
            checkNotNull(field, "Partition field must not be null.");
            checkArgument(
                    names.add(field.name()),
                    "Duplicate partition field name %s in spec %s.",
                    field.name(),
                    specId);
        }
        this.specId = specId;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    @JsonGetter(FIELD_SPEC_ID)
    public int specId() {
        return specId;
    }

    @JsonGetter(FIELD_FIELDS)
    public List<PartitionField> fields() {
        return fields;
    }

    /**
     * 使用默认配置计算所有分区键列,见 {@link #computePartitionKeys(Map, Options)}。
     */
    public Map<String, TypedColumn> computePartitionKeys(Map<String, TypedColumn> columns) {
        return computePartitionKeys(columns, new Options());
    }

    /**
     * 计算所有分区键列。
     *
     * @param columns 按列名索引的源列,只需要包含各字段引用的列
     * @return 按字段顺序排列的分区键列,键为字段名
     * @throws IllegalArgumentException 缺少源列,或源列行数不一致
     */
    public Map<String, TypedColumn> computePartitionKeys(
            Map<String, TypedColumn> columns, Options options) {
        int size = -1;
        for (PartitionField field : fields) {
            TypedColumn source = columns.get(field.sourceName());
            checkArgument(
                    source != null,
                    "Source column %s of partition field %s is missing.",
                    field.sourceName(),
                    field.name());
            if (size < 0) {
                size = source.size();
            }
            checkArgument(
                    source.size() == size,
                    "Source column %s has %s rows, expected %s.",
                    field.sourceName(),
                    source.size(),
                    size);
        }

        Map<String, TypedColumn> keys = new LinkedHashMap<>();
        for (PartitionField field : fields) {
            LOG.debug("Computing partition field {} of spec {} on {} rows.", field, specId, size);
            TypedColumn source = columns.get(field.sourceName());
            keys.put(field.name(), field.transform().apply(source, options));
        }
        return keys;
    }

    public String toJson() {
        return JsonSerdeUtil.toJson(this);
    }

    /** @throws IllegalArgumentException JSON 不合法或规格不满足约束 */
    public static PartitionSpec fromJson(String json) {
        return JsonSerdeUtil.fromJson(json, PartitionSpec.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PartitionSpec that = (PartitionSpec) o;
        return specId == that.specId && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(specId, fields);
    }

    @Override
    public String toString() {
        return "PartitionSpec{specId=" + specId + ", fields=" + fields + "}";
    }

    // ------------------------------------------------------------------------------------------

    /** {@link PartitionSpec} 的构建器,未指定字段名时按 {@code <源列>_<变换>} 命名。 */
    public static class Builder {

        private int specId = 0;
        private final List<PartitionField> fields = new ArrayList<>();

        private Builder() {}

        public Builder withSpecId(int specId) {
            this.specId = specId;
            return this;
        }

        public Builder day(String sourceName) {
            return add(sourceName, sourceName + "_day", PartitionTransforms.days());
        }

        public Builder month(String sourceName) {
            return add(sourceName, sourceName + "_month", PartitionTransforms.months());
        }

        public Builder year(String sourceName) {
            return add(sourceName, sourceName + "_year", PartitionTransforms.years());
        }

        public Builder hour(String sourceName) {
            return add(sourceName, sourceName + "_hour", PartitionTransforms.hours());
        }

        public Builder bucket(String sourceName, int numBuckets) {
            return add(sourceName, sourceName + "_bucket", PartitionTransforms.bucket(numBuckets));
        }

        public Builder truncate(String sourceName, int width) {
            return add(sourceName, sourceName + "_trunc", PartitionTransforms.truncate(width));
        }

        public Builder add(String sourceName, String name, PartitionTransform transform) {
            fields.add(new PartitionField(sourceName, name, transform));
            return this;
        }

        public PartitionSpec build() {
            return new PartitionSpec(specId, fields);
        }
    }
}
