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

package com.palantir.buildutils.dependencies;

import java.io.File;
import org.immutables.value.Value;

/** A file produced by a resolved module, e.g. its jar. */
@Value.Immutable
public interface ArtifactInfo {
    @Value.Parameter
    String group();

    @Value.Parameter
    String name();

    @Value.Parameter
    String version();

    @Value.Parameter
    File file();

    default String id() {
        return group() + ':' + name() + ':' + version();
    }

    static ArtifactInfo of(String group, String name, String version, File file) {
        return ImmutableArtifactInfo.of(group, name, version, file);
    }
}
