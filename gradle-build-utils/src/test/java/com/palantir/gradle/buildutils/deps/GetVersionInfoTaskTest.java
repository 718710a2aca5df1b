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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.collect.ImmutableList;
import com.palantir.gradle.buildutils.AbstractProjectBuilderTest;
import java.io.IOException;
import java.nio.file.Path;
import org.gradle.api.Project;
import org.junit.jupiter.api.Test;

public class GetVersionInfoTaskTest extends AbstractProjectBuilderTest {
    @Test
    public void writesOneReportPerScope() throws IOException {
        Project core = createSubproject("core");
        applyPlugin(project);
        project.getPluginManager().apply("java");
        core.getPluginManager().apply("java");
        project.getDependencies().add("implementation", "com.example:lib:1.0");
        core.getDependencies().add("implementation", "com.example:other:2.0");

        GetVersionInfoTask task = (GetVersionInfoTask) project.getTasks().getByName(GetVersionInfoTask.TASK_NAME);
        task.printVersionInfo();

        Path report = projectDir.resolve("build").resolve(GetVersionInfoTask.REPORT_PATH);
        assertThat(task.getReportFile().get().getAsFile().toPath()).isEqualTo(report);

        JsonNode json = JsonMapper.builder().build().readTree(report.toFile());
        assertThat(json).hasSize(3);
        assertThat(json.get(0).get("scope").asText()).isEqualTo("build script");
        assertThat(json.get(0).get("unknown")).isEmpty();
        assertThat(json.get(1).get("scope").asText()).isEqualTo("project");
        assertThat(json.get(2).get("scope").asText()).isEqualTo("project 'core'");

        JsonNode unknown = json.get(1).get("unknown");
        assertThat(unknown).hasSize(1);
        assertThat(ImmutableList.copyOf(unknown.get(0).fieldNames()))
                .containsExactlyInAnyOrder("group", "name", "version");
        assertThat(unknown.get(0).get("group").asText()).isEqualTo("com.example");
        assertThat(unknown.get(0).get("name").asText()).isEqualTo("lib");
        assertThat(unknown.get(0).get("version").asText()).isEqualTo("1.0");
        assertThat(json.get(2).get("unknown").get(0).get("name").asText()).isEqualTo("other");

        for (JsonNode scope : json) {
            assertThat(ImmutableList.copyOf(scope.fieldNames()))
                    .containsExactlyInAnyOrder("scope", "latest", "outdated", "unknown");
        }
    }
}
