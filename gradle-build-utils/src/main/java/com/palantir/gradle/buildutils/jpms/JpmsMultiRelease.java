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
 * Multi-release build with the source sets {@code jpmsMain} and {@code jpmsTest}, the module descriptor compiled by
 * {@code compileJpmsModuleInfo} and the versioned tests run by {@code jpmsTest}.
 */
public final class JpmsMultiRelease extends AbstractMultiReleaseConfiguration {
    public static final String MAIN_SOURCE_SET = "jpmsMain";
    public static final String TEST_SOURCE_SET = "jpmsTest";
    public static final String MODULE_INFO_TASK = "compileJpmsModuleInfo";
    public static final String TEST_TASK = "jpmsTest";

    public JpmsMultiRelease(JavaVersion javaVersion, Project project) {
        super(javaVersion, project, MAIN_SOURCE_SET, TEST_SOURCE_SET, MODULE_INFO_TASK, TEST_TASK);
    }
}
