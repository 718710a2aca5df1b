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

/** A dependency with a newer release available, and the versions it could move to. */
@Value.Immutable
@JsonSerialize(as = ImmutableOutdatedDependency.class)
public interface OutdatedDependency {
    @Value.Parameter
    MavenCoordinate coordinate();

    /** The rendered choices, see {@link VersionHolder#toVersionString(String)}. */
    @Value.Parameter
    String updates();

    static OutdatedDependency of(MavenCoordinate coordinate, String updates) {
        return ImmutableOutdatedDependency.of(coordinate, updates);
    }
}
