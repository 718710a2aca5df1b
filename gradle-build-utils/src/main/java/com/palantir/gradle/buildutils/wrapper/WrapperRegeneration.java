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

package com.palantir.gradle.buildutils.wrapper;

import java.util.Optional;
import org.immutables.value.Value;

/** A request to regenerate the Gradle wrapper, picked up by the {@code wrapperUpdate} task. */
@Value.Immutable
public interface WrapperRegeneration {
    @Value.Parameter
    String gradleVersion();

    /** The published SHA-256 of the {@code all} distribution, empty when it could not be fetched. */
    @Value.Parameter
    Optional<String> distributionSha256();

    static WrapperRegeneration of(String gradleVersion, Optional<String> distributionSha256) {
        return ImmutableWrapperRegeneration.of(gradleVersion, distributionSha256);
    }
}
