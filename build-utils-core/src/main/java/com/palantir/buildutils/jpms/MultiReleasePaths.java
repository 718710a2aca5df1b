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

package com.palantir.buildutils.jpms;

import com.google.common.base.Preconditions;

/** Paths inside a multi-release jar and the per-release source layout. */
public final class MultiReleasePaths {
    public static final String VERSIONS_PREFIX = "META-INF/versions/";
    public static final String MULTI_RELEASE_ATTRIBUTE = "Multi-Release";

    private MultiReleasePaths() {
        // cannot instantiate
    }

    /** The jar directory holding the classes compiled for {@code release}, e.g. {@code META-INF/versions/11}. */
    public static String versionedDirectory(String release) {
        Preconditions.checkArgument(!release.isBlank(), "release must not be blank");
        return VERSIONS_PREFIX + release;
    }

    /** Project relative directory of the sources compiled for {@code release}. */
    public static String sourceDirectory(String release) {
        return "src" + release;
    }

    public static String resourceDirectory(String release) {
        return "resources" + release;
    }

    public static String testDirectory(String release) {
        return "test" + release;
    }

    public static String testResourceDirectory(String release) {
        return "testResources" + release;
    }
}
