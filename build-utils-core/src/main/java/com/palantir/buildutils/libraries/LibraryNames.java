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

package com.palantir.buildutils.libraries;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import java.io.File;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every library a file name that is unique inside a {@code lib/} directory. Different files sharing a name
 * are renamed {@code <name>_DUP_<n>.<ext>}; the same file added twice keeps its first name.
 * <p>
 * Not thread safe.
 */
public final class LibraryNames {
    private static final Logger log = LoggerFactory.getLogger(LibraryNames.class);

    private final Map<String, File> filesByName = new LinkedHashMap<>();
    private final Map<File, String> namesByFile = new LinkedHashMap<>();

    /** Returns the name assigned to {@code file}, assigning one if needed. */
    public String add(File file) {
        String existing = namesByFile.get(file);
        if (existing != null) {
            return existing;
        }

        String fileName = file.getName();
        int duplicate = 0;
        while (filesByName.containsKey(fileName) && !file.equals(filesByName.get(fileName))) {
            fileName = Files.getNameWithoutExtension(file.getName()) + "_DUP_" + duplicate++ + extensionOf(file);
        }
        if (duplicate != 0) {
            log.info("Target file exists already! Renaming to {}", fileName);
        }

        filesByName.put(fileName, file);
        namesByFile.put(file, fileName);
        return fileName;
    }

    public void addAll(Collection<File> files) {
        files.forEach(this::add);
    }

    public boolean isEmpty() {
        return namesByFile.isEmpty();
    }

    public Map<File, String> byFile() {
        return ImmutableMap.copyOf(namesByFile);
    }

    private static String extensionOf(File file) {
        String extension = Files.getFileExtension(file.getName());
        return extension.isEmpty() ? "" : "." + extension;
    }

    /**
     * A {@code Class-Path} manifest value listing {@code names} below {@code lib/}, sorted and terminated by
     * {@code \r\n}. Empty when there are no names.
     */
    public static String asClasspath(Collection<String> names) {
        if (names.isEmpty()) {
            return "";
        }
        List<String> sorted = names.stream().distinct().sorted().collect(Collectors.toList());
        return sorted.stream().map(name -> "lib/" + name).collect(Collectors.joining(" ", "", "\r\n"));
    }

    /**
     * Whether library work is worth doing for the requested tasks: not when nothing was requested, and not when
     * every requested task is a clean task.
     */
    public static boolean shouldRun(List<String> requestedTaskNames) {
        if (requestedTaskNames.isEmpty()) {
            return false;
        }
        return !requestedTaskNames.stream().allMatch(task -> task.contains("clean"));
    }
}
