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

import java.util.List;
import java.util.function.Consumer;

/** Renders {@link VersionReport}s as the human readable text printed by the dependency audit. */
public final class VersionReportPrinter {
    public static final String SEPARATOR = "\t------------------------------------------------------------";

    private VersionReportPrinter() {
        // cannot instantiate
    }

    public static String print(List<VersionReport> reports) {
        StringBuilder output = new StringBuilder();
        reports.forEach(report -> print(report, output));
        return output.toString();
    }

    public static String print(VersionReport report) {
        StringBuilder output = new StringBuilder();
        print(report, output);
        return output.toString();
    }

    private static void print(VersionReport report, StringBuilder output) {
        if (report.isEmpty()) {
            return;
        }
        Consumer<String> line = text -> output.append(text).append('\n');

        line.accept(SEPARATOR);
        boolean needsGap = false;

        if (!report.latest().isEmpty()) {
            line.accept(heading(report, "are using the latest release version:"));
            report.latest().forEach(dep -> line.accept("\t - " + describe(dep)));
            needsGap = true;
        }

        if (!report.outdated().isEmpty()) {
            if (needsGap) {
                line.accept("");
            }
            line.accept(heading(report, "need updates:"));
            report.outdated()
                    .forEach(dep -> line.accept("\t - " + describe(dep.coordinate()) + ' ' + dep.updates()));
            needsGap = true;
        }

        if (!report.unknown().isEmpty()) {
            if (needsGap) {
                line.accept("");
            }
            line.accept(heading(report, "have unknown updates:"));
            report.unknown().forEach(dep -> line.accept("\t - " + describe(dep)));
        }
    }

    private static String heading(VersionReport report, String suffix) {
        return "\tThe following " + report.scope() + " dependencies " + suffix;
    }

    // plugin markers repeat the plugin id as their name
    private static String describe(MavenCoordinate coordinate) {
        if (coordinate.isPluginMarker()) {
            return coordinate.group() + ':' + coordinate.version();
        }
        return coordinate.mavenId();
    }
}
