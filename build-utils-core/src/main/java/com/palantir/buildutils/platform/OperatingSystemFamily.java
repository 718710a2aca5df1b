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

package com.palantir.buildutils.platform;

import java.util.Locale;

public enum OperatingSystemFamily {
    WINDOWS,
    MAC,
    LINUX,
    /** Other unix like systems, e.g. FreeBSD or Solaris. */
    UNIX;

    public static OperatingSystemFamily current() {
        return fromName(System.getProperty("os.name", ""));
    }

    public static OperatingSystemFamily fromName(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.contains("windows")) {
            return WINDOWS;
        }
        if (name.contains("mac os") || name.contains("darwin") || name.contains("osx")) {
            return MAC;
        }
        if (name.contains("linux")) {
            return LINUX;
        }
        return UNIX;
    }

    public boolean isWindows() {
        return this == WINDOWS;
    }

    public boolean isMac() {
        return this == MAC;
    }

    public boolean isLinux() {
        return this == LINUX;
    }

    public boolean isUnix() {
        return this != WINDOWS;
    }
}
