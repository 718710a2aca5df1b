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

package com.palantir.gradle.buildutils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.gradle.api.Project;

/** Publishes empty jars with plain poms into a directory that a test project can resolve from offline. */
public final class LocalMavenRepository {
    private final Path root;

    public LocalMavenRepository(Path root) {
        this.root = root;
    }

    public LocalMavenRepository addTo(Project project) {
        project.getRepositories().maven(repo -> repo.setUrl(root.toUri()));
        return this;
    }

    /** Publishes {@code group:name:version}, depending on each of the {@code group:name:version} notations. */
    public LocalMavenRepository publish(String coordinate, String... dependencies) throws IOException {
        String[] parts = coordinate.split(":");
        String group = parts[0];
        String name = parts[1];
        String version = parts[2];

        StringBuilder pom = new StringBuilder()
                .append("<project>\n")
                .append("  <modelVersion>4.0.0</modelVersion>\n")
                .append("  <groupId>").append(group).append("</groupId>\n")
                .append("  <artifactId>").append(name).append("</artifactId>\n")
                .append("  <version>").append(version).append("</version>\n")
                .append("  <dependencies>\n");
        for (String dependency : dependencies) {
            String[] dep = dependency.split(":");
            pom.append("    <dependency><groupId>").append(dep[0])
                    .append("</groupId><artifactId>").append(dep[1])
                    .append("</artifactId><version>").append(dep[2])
                    .append("</version></dependency>\n");
        }
        pom.append("  </dependencies>\n</project>\n");

        Path directory = Files.createDirectories(root.resolve(group.replace('.', '/')).resolve(name).resolve(version));
        String base = name + "-" + version;
        Files.writeString(directory.resolve(base + ".pom"), pom, StandardCharsets.UTF_8);
        Files.write(directory.resolve(base + ".jar"), new byte[0]);
        return this;
    }
}
