/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.buildutils.versions;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/** A Maven module without a version, the unit that {@code maven-metadata.xml} files describe. */
@Value.Immutable
@JsonSerialize(as = ImmutableModuleId.class)
public interface ModuleId {
    @Value.Parameter
    String group();

    @Value.Parameter
    String name();

    /** The path of the module directory inside a Maven repository, e.g. {@code com/google/guava/guava/}. */
    default String repositoryPath() {
        return group().replace('.', '/') + '/' + name() + '/';
    }

    static ModuleId of(String group, String name) {
        return ImmutableModuleId.of(group, name);
    }
}
