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

package com.palantir.gradle.buildutils.wrapper;

import com.palantir.buildutils.wrapper.GradleServicesClient;
import com.palantir.buildutils.wrapper.Hashes;
import org.gradle.api.Project;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Provider;
import org.gradle.api.tasks.TaskProvider;
import org.gradle.api.tasks.wrapper.Wrapper;
import org.gradle.api.logging.Logger;

/**
 * Registers the wrapper tasks on the root project. The checking tasks only decide whether the wrapper needs to be
 * regenerated; the regeneration itself is done by Gradle's own {@link Wrapper} task, which they are finalized by.
 */
public final class WrapperTasks {
    private static final Logger log = Logging.getLogger(WrapperTasks.class);

    public static final String WRAPPER_UPDATE_TASK_NAME = "wrapperUpdate";
    public static final String SERVICES_URL_PROPERTY = "buildutils.gradle.servicesUrl";
    public static final String TIMEOUT_PROPERTY = "buildutils.versions.timeoutSeconds";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private WrapperTasks() {
        // cannot instantiate
    }

    public static void register(Project rootProject) {
        if (!rootProject.equals(rootProject.getRootProject())) {
            throw new IllegalArgumentException("The Gradle wrapper tasks can only be added to the root project");
        }

        Provider<GradleVersionsBuildService> service = rootProject
                .getGradle()
                .getSharedServices()
                .registerIfAbsent(GradleVersionsBuildService.NAME, GradleVersionsBuildService.class, spec -> {
                    spec.getParameters()
                            .getServicesUrl()
                            .set(rootProject
                                    .getProviders()
                                    .gradleProperty(SERVICES_URL_PROPERTY)
                                    .orElse(GradleServicesClient.DEFAULT_BASE_URL));
                    spec.getParameters()
                            .getTimeoutSeconds()
                            .set(rootProject
                                    .getProviders()
                                    .gradleProperty(TIMEOUT_PROPERTY)
                                    .map(Integer::parseInt)
                                    .orElse(DEFAULT_TIMEOUT_SECONDS));
                });

        TaskProvider<Wrapper> wrapperUpdate =
                rootProject.getTasks().register(WRAPPER_UPDATE_TASK_NAME, Wrapper.class, wrapper -> {
                    wrapper.setDescription("Regenerates the Gradle wrapper when a wrapper update was requested");
                    wrapper.usesService(service);
                    wrapper.getOutputs().upToDateWhen(_ignored -> false);
                    wrapper.notCompatibleWithConfigurationCache("Reads the requested wrapper version from a service");
                    wrapper.onlyIf(
                            "a wrapper update was requested",
                            _ignored -> service.get().pendingRegeneration().isPresent());

                    wrapper.doFirst(_ignored -> {
                        WrapperRegeneration regeneration =
                                service.get().pendingRegeneration().orElseThrow();
                        wrapper.setGradleVersion(regeneration.gradleVersion());
                        wrapper.setDistributionType(Wrapper.DistributionType.ALL);
                        wrapper.setDistributionSha256Sum(
                                regeneration.distributionSha256().orElse(null));
                    });
                    wrapper.doLast(_ignored -> log.lifecycle(
                            "\tUpdate {} SHA256: '{}'",
                            wrapper.getGradleVersion(),
                            Hashes.sha256Hex(wrapper.getJarFile())));
                });

        rootProject.getTasks().register(GradleUpdateTask.TASK_NAME, GradleUpdateTask.class, task -> {
            configure(rootProject, task, service);
            task.finalizedBy(wrapperUpdate);
        });
        rootProject.getTasks().register(GradleCheckTask.TASK_NAME, GradleCheckTask.class, task -> {
            configure(rootProject, task, service);
            task.finalizedBy(wrapperUpdate);
        });
    }

    private static void configure(
            Project rootProject, AbstractGradleWrapperTask task, Provider<GradleVersionsBuildService> service) {
        task.getVersionsService().set(service);
        task.usesService(service);
        task.getCurrentGradleVersion().set(rootProject.getGradle().getGradleVersion());
        task.getWrapperJar()
                .set(rootProject.getLayout().getProjectDirectory().file("gradle/wrapper/gradle-wrapper.jar"));
    }
}
