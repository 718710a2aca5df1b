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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class MultiReleasePathsTest {
    @Test
    public void namesVersionedLocations() {
        assertThat(MultiReleasePaths.versionedDirectory("11")).isEqualTo("META-INF/versions/11");
        assertThat(MultiReleasePaths.sourceDirectory("11")).isEqualTo("src11");
        assertThat(MultiReleasePaths.resourceDirectory("11")).isEqualTo("resources11");
        assertThat(MultiReleasePaths.testDirectory("11")).isEqualTo("test11");
        assertThat(MultiReleasePaths.testResourceDirectory("11")).isEqualTo("testResources11");
    }

    @Test
    public void rejectsBlankReleases() {
        assertThatThrownBy(() -> MultiReleasePaths.versionedDirectory(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void patchesCompiledClassesIntoTheModule() {
        assertThat(ModuleCompilerArgs.forModule("com.example", "/libs/a.jar:/libs/b.jar", "/build/classes"))
                .containsExactly(
                        "-implicit:none",
                        "-Xpkginfo:always",
                        "--module-path",
                        "/libs/a.jar:/libs/b.jar",
                        "--patch-module",
                        "com.example=/build/classes");
    }
}
