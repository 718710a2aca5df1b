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

import java.util.regex.Pattern;

/**
 * The platform specific SWT artifacts published under {@code org.eclipse.platform}. SWT poms refer to them through
 * an unresolved {@code ${osgi.platform}} property, so the artifact has to be chosen for the build machine.
 */
public enum SwtPlatform {
    LINUX_32("org.eclipse.swt.gtk.linux.x86"),
    LINUX_64("org.eclipse.swt.gtk.linux.x86_64"),
    MAC_64("org.eclipse.swt.cocoa.macosx.x86_64"),
    WIN_32("org.eclipse.swt.win32.win32.x86"),
    WIN_64("org.eclipse.swt.win32.win32.x86_64");

    public static final String GROUP = "org.eclipse.platform";

    /** The dependency SWT poms declare, which Gradle cannot resolve. */
    public static final String UNRESOLVED_MODULE = GROUP + ":org.eclipse.swt.${osgi.platform}";

    private static final Pattern SIXTY_FOUR_BIT = Pattern.compile(".*64.*");

    private final String artifactId;

    SwtPlatform(String artifactId) {
        this.artifactId = artifactId;
    }

    public String artifactId() {
        return artifactId;
    }

    public String mavenId(String version) {
        return GROUP + ':' + artifactId + ':' + version;
    }

    public static SwtPlatform current() {
        return forPlatform(OperatingSystemFamily.current(), System.getProperty("os.arch", ""));
    }

    /** There is no 32 bit SWT for mac, so mac always gets the 64 bit artifact. */
    public static SwtPlatform forPlatform(OperatingSystemFamily os, String arch) {
        boolean is64Bit = SIXTY_FOUR_BIT.matcher(arch).matches();
        if (os.isWindows()) {
            return is64Bit ? WIN_64 : WIN_32;
        }
        if (os.isMac()) {
            return MAC_64;
        }
        return is64Bit ? LINUX_64 : LINUX_32;
    }
}
