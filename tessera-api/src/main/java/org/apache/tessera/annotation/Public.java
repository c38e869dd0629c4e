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

package org.apache.tessera.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * 公共稳定接口注解。
 *
 * <p>被标记的类或接口属于 Tessera 对外承诺的 API:分区变换的计算结果必须在不同版本、不同写入方
 * 之间保持逐位一致,因此这些 API 的语义在主版本内不会改变。
 *
 * <h2>标记准则</h2>
 * <ul>
 *   <li>面向调用方的入口,如 {@code PartitionTransforms}、{@code PartitionSpec}
 *   <li>类型系统与列式容器的读取接口
 *   <li>内部实现类不应标记,必要时使用 {@link VisibleForTesting}
 * </ul>
 */
@Documented
@Target(ElementType.TYPE)
public @interface Public {}
