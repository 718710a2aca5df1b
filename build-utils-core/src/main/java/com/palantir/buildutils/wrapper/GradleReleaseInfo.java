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

package com.palantir.buildutils.wrapper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/** The release description served by {@code https://services.gradle.org/versions/current}. */
@Value.Immutable
@JsonDeserialize(as = ImmutableGradleReleaseInfo.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface GradleReleaseInfo {
    @Nullable
    String version();

    @Nullable
    String downloadUrl();

    @Nullable
    String checksumUrl();

    @Nullable
    String wrapperChecksumUrl();

    static ImmutableGradleReleaseInfo.Builder builder() {
        return ImmutableGradleReleaseInfo.builder();
    }
}
