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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.immutables.value.Value;

/** A {@code module-info.java} file and the module it declares. */
@Value.Immutable
public interface ModuleInfoFile {
    String FILE_NAME = "module-info.java";

    Set<String> SKIPPED_DIRECTORIES = Set.of("build", "out", "target", "node_modules");

    Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");
    Pattern MODULE_DECLARATION = Pattern.compile(
            "(?:^|[;\\s)])(?:open\\s+)?module\\s+([A-Za-z_$][\\w$]*(?:\\s*\\.\\s*[A-Za-z_$][\\w$]*)*)\\s*\\{");

    @Value.Parameter
    Path path();

    @Value.Parameter
    String moduleName();

    /** True when the file sits directly in a versioned source directory such as {@code src11}. */
    default boolean isInMultiReleaseDirectory() {
        Path parent = path().getParent();
        if (parent == null || parent.getFileName() == null) {
            return false;
        }
        String directory = parent.getFileName().toString();
        return directory.startsWith("src")
                && directory.length() > "src".length()
                && Character.isDigit(directory.charAt(directory.length() - 1));
    }

    /**
     * Finds the first {@code module-info.java} below {@code projectDirectory}, shallowest first. Build output and
     * hidden directories are not searched.
     */
    static Optional<Path> find(Path projectDirectory) {
        if (!Files.isDirectory(projectDirectory)) {
            return Optional.empty();
        }

        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(projectDirectory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path directory, BasicFileAttributes attributes) {
                    if (!directory.equals(projectDirectory) && isSkipped(directory.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attributes) {
                    if (attributes.isRegularFile() && file.getFileName().toString().equals(FILE_NAME)) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to search for " + FILE_NAME + " in " + projectDirectory, e);
        }
        return found.stream().min(Comparator.comparingInt(Path::getNameCount).thenComparing(Path::toString));
    }

    private static boolean isSkipped(String directoryName) {
        return directoryName.startsWith(".") || SKIPPED_DIRECTORIES.contains(directoryName);
    }

    /**
     * Finds and reads the {@code module-info.java} below {@code projectDirectory}.
     *
     * @throws InvalidModuleInfoException if there is no such file or it declares no module
     */
    static ModuleInfoFile load(Path projectDirectory) {
        Path file = find(projectDirectory)
                .orElseThrow(() ->
                        new InvalidModuleInfoException("Cannot manage JPMS build without a `module-info.java` file."));
        return read(file);
    }

    static ModuleInfoFile read(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        String moduleName = parseModuleName(content)
                .orElseThrow(() -> new InvalidModuleInfoException(
                        "The module name must be specified in the module-info file! Verify file: " + file));
        return ImmutableModuleInfoFile.of(file, moduleName);
    }

    static Optional<String> parseModuleName(String content) {
        String code = LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(content).replaceAll(" ")).replaceAll(" ");
        Matcher matcher = MODULE_DECLARATION.matcher(code);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1).replaceAll("\\s", ""));
    }
}
