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

package com.palantir.buildutils.kotlin;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class KotlinVersions {
    /** Used for api and language version when the Kotlin plugin version cannot be determined. */
    public static final String DEFAULT_LANGUAGE_VERSION = "1.9";

    private static final Pattern MAJOR_MINOR = Pattern.compile("^(\\d+)\\.(\\d+)(?:[.\\-].*)?$");

    private KotlinVersions() {
        // cannot instantiate
    }

    /** {@code 1.9.22} becomes {@code 1.9}. */
    public static Optional<String> majorMinor(String pluginVersion) {
        if (pluginVersion == null) {
            return Optional.empty();
        }
        Matcher matcher = MAJOR_MINOR.matcher(pluginVersion.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1) + '.' + matcher.group(2));
    }

    public static String languageVersion(String pluginVersion) {
        return majorMinor(pluginVersion).orElse(DEFAULT_LANGUAGE_VERSION);
    }
}
