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

import com.palantir.buildutils.libraries.LibraryNames;
import java.io.File;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.gradle.api.services.BuildService;
import org.gradle.api.services.BuildServiceParameters;

/**
 * Keeps the library names of a build, so every project and every group of projects is resolved at most once and
 * the renamed duplicates stay stable between the tasks that copy libraries and the ones writing manifests.
 */
public abstract class LibraryCacheBuildService implements BuildService<BuildServiceParameters.None> {
    public static final String NAME = "libraryCacheBuildService";

    private final Map<String, Map<File, String>> librariesByKey = new ConcurrentHashMap<>();

    /**
     * Returns the libraries cached under {@code key}, collecting them from {@code files} the first time.
     *
     * @return the unique library file name of every file
     */
    public final Map<File, String> libraries(String key, Supplier<? extends Iterable<File>> files) {
        return librariesByKey.computeIfAbsent(key, _ignored -> {
            LibraryNames names = new LibraryNames();
            files.get().forEach(names::add);
            return names.byFile();
        });
    }
}
