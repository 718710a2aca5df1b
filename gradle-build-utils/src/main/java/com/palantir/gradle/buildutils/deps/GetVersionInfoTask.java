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

package com.palantir.gradle.buildutils.deps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.collect.ImmutableList;
import com.palantir.buildutils.http.HttpTextFetcher;
import com.palantir.buildutils.versions.DependencyVersionAudit;
import com.palantir.buildutils.versions.MavenCoordinate;
import com.palantir.buildutils.versions.VersionReport;
import com.palantir.buildutils.versions.VersionReportPrinter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.gradle.api.DefaultTask;
import org.gradle.api.Project;
import org.gradle.api.file.RegularFileProperty;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Property;
import org.gradle.api.tasks.Input;
import org.gradle.api.tasks.OutputFile;
import org.gradle.api.tasks.TaskAction;
import org.gradle.api.logging.Logger;

/**
 * Prints which dependencies of the build script and of every project have newer releases available.
 */
public abstract class GetVersionInfoTask extends DefaultTask {
    private static final Logger log = Logging.getLogger(GetVersionInfoTask.class);
    private static final ObjectMapper MAPPER =
            JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();

    public static final String TASK_NAME = "updateDependencies";
    public static final String REPORT_PATH = "build-utils/dependency-versions.json";

    /** How many {@code maven-metadata.xml} downloads run at once. */
    @Input
    public abstract Property<Integer> getThreads();

    @Input
    public abstract Property<Integer> getTimeoutSeconds();

    @OutputFile
    public abstract RegularFileProperty getReportFile();

    public GetVersionInfoTask() {
        setGroup("gradle");
        setDescription("Fetch the latest version information for project dependencies");
        getOutputs().upToDateWhen(_ignored -> false);
        notCompatibleWithConfigurationCache("Reads the dependencies and repositories of every project");
    }

    @TaskAction
    public final void printVersionInfo() {
        Project project = getProject();
        HttpTextFetcher fetcher = new HttpTextFetcher(Duration.ofSeconds(getTimeoutSeconds().get()));
        DependencyVersionAudit audit = new DependencyVersionAudit(fetcher, getThreads().get());

        ImmutableList.Builder<VersionReport> reports = ImmutableList.builder();
        reports.add(audit.auditBuildScript(
                DeclaredDependencies.buildScriptDependencies(project),
                DeclaredDependencies.repositoryUrls(project.getBuildscript().getRepositories())));

        Map<String, List<MavenCoordinate>> dependenciesByScope = new LinkedHashMap<>();
        Set<String> repositories = new LinkedHashSet<>();
        for (Project each : project.getAllprojects()) {
            dependenciesByScope.put(scopeOf(each), DeclaredDependencies.declaredBy(each));
            repositories.addAll(DeclaredDependencies.repositoryUrls(each.getRepositories()));
        }
        reports.addAll(audit.auditProjects(dependenciesByScope, repositories));

        List<VersionReport> result = reports.build();
        log.lifecycle(VersionReportPrinter.print(result));
        writeReport(getReportFile().get().getAsFile().toPath(), result);
    }

    private static String scopeOf(Project project) {
        return project.equals(project.getRootProject())
                ? DependencyVersionAudit.ROOT_PROJECT_SCOPE
                : DependencyVersionAudit.projectScope(project.getName());
    }

    private static void writeReport(Path file, List<VersionReport> reports) {
        try {
            Files.createDirectories(file.getParent());

            Files.writeString(
                    file,
                    MAPPER.writeValueAsString(reports),
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize the dependency version report", e);
        } catch (IOException e) {
            throw new RuntimeException("Error writing contents to file " + file, e);
        }
    }
}
