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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.immutables.value.Value;

/** The {@code module-info.class} and {@code package-info.class} files produced by a compilation. */
@Value.Immutable
public interface ModuleClassFiles {
    String MODULE_INFO = "module-info.class";
    String PACKAGE_INFO = "package-info.class";

    Path directory();

    List<Path> moduleInfo();

    List<Path> packageInfo();

    default boolean isEmpty() {
        return moduleInfo().isEmpty() && packageInfo().isEmpty();
    }

    /** e.g. {@code "module-info and package-info"}. */
    default String describe() {
        if (!moduleInfo().isEmpty() && !packageInfo().isEmpty()) {
            return "module-info and package-info";
        }
        return moduleInfo().isEmpty() ? "package-info" : "module-info";
    }

    /** Copies every file to the same relative location below {@code target}, replacing existing files. */
    default void copyTo(Path target) {
        for (Path file : ImmutableList.<Path>builder().addAll(moduleInfo()).addAll(packageInfo()).build()) {
            Path destination = target.resolve(directory().relativize(file));
            try {
                Files.createDirectories(destination.getParent());
                Files.copy(file, destination, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to copy " + file + " to " + destination, e);
            }
        }
    }

    static ModuleClassFiles scan(Path directory) {
        ImmutableModuleClassFiles.Builder builder = ImmutableModuleClassFiles.builder().directory(directory);
        if (!Files.isDirectory(directory)) {
            return builder.build();
        }
        try (Stream<Path> files = Files.walk(directory)) {
            List<Path> all = files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            all.stream().filter(file -> file.getFileName().toString().equals(MODULE_INFO)).forEach(builder::addModuleInfo);
            all.stream().filter(file -> file.getFileName().toString().equals(PACKAGE_INFO)).forEach(builder::addPackageInfo);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + directory, e);
        }
        return builder.build();
    }
}
