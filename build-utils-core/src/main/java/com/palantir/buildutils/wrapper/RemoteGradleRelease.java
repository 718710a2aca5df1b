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

import com.google.common.base.Strings;
import java.util.Optional;
import org.immutables.value.Value;

/** What the Gradle services reported as the current release, together with the raw response for diagnostics. */
@Value.Immutable
public interface RemoteGradleRelease {
    @Value.Parameter
    String rawResponse();

    @Value.Parameter
    Optional<GradleReleaseInfo> info();

    /** The advertised version, empty when the response was missing, malformed or had no version. */
    default Optional<String> version() {
        return info().map(GradleReleaseInfo::version).filter(version -> !Strings.isNullOrEmpty(version));
    }

    static RemoteGradleRelease of(String rawResponse, Optional<GradleReleaseInfo> info) {
        return ImmutableRemoteGradleRelease.of(rawResponse, info);
    }
}
