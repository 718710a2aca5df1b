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

package com.palantir.gradle.buildutils.jpms;

import org.gradle.api.JavaVersion;
import org.gradle.api.Project;

/**
 * Multi-release build named after the release, e.g. for Java 11: source sets {@code main_11} and {@code test_11},
 * tasks {@code compileModuleInfo_11} and {@code test_11Test}.
 */
public final class JavaXConfiguration extends AbstractMultiReleaseConfiguration {
    public JavaXConfiguration(JavaVersion javaVersion, Project project) {
        super(
                javaVersion,
                project,
                mainSourceSetName(javaVersion),
                testSourceSetName(javaVersion),
                moduleInfoTaskName(javaVersion),
                testSourceSetName(javaVersion) + "Test");
    }

    public static String mainSourceSetName(JavaVersion javaVersion) {
        return "main_" + javaVersion.getMajorVersion();
    }

    public static String testSourceSetName(JavaVersion javaVersion) {
        return "test_" + javaVersion.getMajorVersion();
    }

    public static String moduleInfoTaskName(JavaVersion javaVersion) {
        return "compileModuleInfo_" + javaVersion.getMajorVersion();
    }
}
