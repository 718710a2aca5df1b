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

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** The {@code <versioning>} section of a {@code maven-metadata.xml} file. */
@Value.Immutable
public interface MavenMetadata {
    Optional<String> release();

    List<String> versions();

    /** Merges this metadata into {@code holder}. */
    default void mergeInto(VersionHolder holder) {
        release().ifPresent(holder::updateReleaseVersion);
        versions().forEach(holder::addVersion);
    }

    static ImmutableMavenMetadata.Builder builder() {
        return ImmutableMavenMetadata.builder();
    }
}
