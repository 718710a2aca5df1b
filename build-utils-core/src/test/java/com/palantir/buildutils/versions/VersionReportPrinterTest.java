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

package com.palantir.buildutils.versions;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

public class VersionReportPrinterTest {
    @Test
    public void printsTheThreeGroupsInOrder() {
        VersionReport report = VersionReport.builder()
                .scope("project 'core'")
                .addLatest(MavenCoordinate.of("com.google.guava", "guava", "33.2.1-jre"))
                .addOutdated(OutdatedDependency.of(MavenCoordinate.of("org.slf4j", "slf4j-api", "1.7.36"), "-> [2.0.13]"))
                .addUnknown(MavenCoordinate.of("com.example", "internal", "1.0"))
                .build();

        assertThat(VersionReportPrinter.print(report))
                .isEqualTo(VersionReportPrinter.SEPARATOR + "\n"
                        + "\tThe following project 'core' dependencies are using the latest release version:\n"
                        + "\t - com.google.guava:guava:33.2.1-jre\n"
                        + "\n"
                        + "\tThe following project 'core' dependencies need updates:\n"
                        + "\t - org.slf4j:slf4j-api:1.7.36 -> [2.0.13]\n"
                        + "\n"
                        + "\tThe following project 'core' dependencies have unknown updates:\n"
                        + "\t - com.example:internal:1.0\n");
    }

    @Test
    public void printsPluginMarkersByPluginId() {
        VersionReport report = VersionReport.builder()
                .scope(DependencyVersionAudit.BUILD_SCRIPT_SCOPE)
                .addLatest(MavenCoordinate.of("com.example.plugin", "com.example.plugin.gradle.plugin", "2.1"))
                .build();

        assertThat(VersionReportPrinter.print(report))
                .isEqualTo(VersionReportPrinter.SEPARATOR + "\n"
                        + "\tThe following build script dependencies are using the latest release version:\n"
                        + "\t - com.example.plugin:2.1\n");
    }

    @Test
    public void skipsEmptyReports() {
        VersionReport empty = VersionReport.builder().scope("project").build();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(VersionReportPrinter.print(List.of(empty))).isEmpty();
    }
}
