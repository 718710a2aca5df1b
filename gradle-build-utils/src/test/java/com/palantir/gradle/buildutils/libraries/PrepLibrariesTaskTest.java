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

package com.palantir.gradle.buildutils.libraries;

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.gradle.buildutils.AbstractProjectBuilderTest;
import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class PrepLibrariesTaskTest extends AbstractProjectBuilderTest {
    @Test
    public void sharesOneCachePerBuild() {
        LibraryCacheBuildService first = PrepLibrariesTask.libraryCache(project);
        LibraryCacheBuildService second = PrepLibrariesTask.libraryCache(project);

        assertThat(first).isSameAs(second);
    }

    @Test
    public void collectsEachKeyOnce() {
        LibraryCacheBuildService cache = PrepLibrariesTask.libraryCache(project);
        AtomicInteger collected = new AtomicInteger();

        Map<File, String> libraries = cache.libraries("runtime::app", () -> {
            collected.incrementAndGet();
            return List.of(new File("/a/util.jar"), new File("/b/util.jar"));
        });
        cache.libraries("runtime::app", () -> {
            collected.incrementAndGet();
            return List.of();
        });

        assertThat(collected).hasValue(1);
        assertThat(libraries.values()).containsExactly("util.jar", "util_DUP_0.jar");
    }

    @Test
    public void skipsWorkWithoutRequestedTasks() {
        assertThat(PrepLibrariesTask.shouldRun(project)).isFalse();

        project.getGradle().getStartParameter().setTaskNames(List.of("clean"));
        assertThat(PrepLibrariesTask.shouldRun(project)).isFalse();

        project.getGradle().getStartParameter().setTaskNames(List.of("clean", "distZip"));
        assertThat(PrepLibrariesTask.shouldRun(project)).isTrue();
    }
}
