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

import java.util.Optional;
import java.util.function.Supplier;

public final class WrapperVersionChecker {
    private WrapperVersionChecker() {
        // cannot instantiate
    }

    /**
     * Compares the running Gradle version and local wrapper jar against the current release.
     *
     * @param currentVersion the version of the running Gradle
     * @param remoteVersion the current release, if known
     * @param localJarSha256 hex SHA-256 of the local wrapper jar, empty string if there is none
     * @param remoteJarSha256 the published wrapper jar SHA-256 of {@code currentVersion}, only asked for when needed
     */
    public static WrapperStatus check(
            String currentVersion,
            Optional<String> remoteVersion,
            String localJarSha256,
            Supplier<String> remoteJarSha256) {
        if (remoteVersion.isEmpty()) {
            return WrapperStatus.NOT_FOUND;
        }
        if (!currentVersion.equals(remoteVersion.get())) {
            return WrapperStatus.NEW_VERSION_AVAILABLE;
        }
        if (remoteJarSha256.get().trim().equalsIgnoreCase(localJarSha256)) {
            return WrapperStatus.UP_TO_DATE;
        }
        return WrapperStatus.SHA_MISMATCH;
    }
}
