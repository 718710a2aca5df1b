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

import org.gradle.api.Action;

/**
 * Descriptive data about the project being built, kept on the {@code GradleUtils} extension so that publishing,
 * licensing and manifest configuration can share one source.
 */
public class ProjectMetadata {
    private String group = "";
    private String id = "";
    private String description = "";
    private String name = "";
    private String version = "1.0";
    private String vendor = "";
    private String vendorUrl = "";
    private String url = "";

    private final IssueManagement issueManagement = new IssueManagement();
    private final Developer developer = new Developer();

    public final String getGroup() {
        return group;
    }

    public final void setGroup(String group) {
        this.group = group;
    }

    public final String getId() {
        return id;
    }

    public final void setId(String id) {
        this.id = id;
    }

    /** {@code <group>.<id>}, the usual plugin or module id. */
    public final String getGroupAndId() {
        return group + "." + id;
    }

    public final String getDescription() {
        return description;
    }

    public final void setDescription(String description) {
        this.description = description;
    }

    public final String getName() {
        return name;
    }

    public final void setName(String name) {
        this.name = name;
    }

    public final String getVersion() {
        return version;
    }

    public final void setVersion(String version) {
        this.version = version;
    }

    public final String getVendor() {
        return vendor;
    }

    public final void setVendor(String vendor) {
        this.vendor = vendor;
    }

    public final String getVendorUrl() {
        return vendorUrl;
    }

    public final void setVendorUrl(String vendorUrl) {
        this.vendorUrl = vendorUrl;
    }

    public final String getUrl() {
        return url;
    }

    public final void setUrl(String url) {
        this.url = url;
    }

    public final IssueManagement getIssueManagement() {
        return issueManagement;
    }

    public final void issueManagement(Action<? super IssueManagement> action) {
        action.execute(issueManagement);
    }

    public final Developer getDeveloper() {
        return developer;
    }

    public final void developer(Action<? super Developer> action) {
        action.execute(developer);
    }

    public static class IssueManagement {
        private String nickname = "";
        private String url = "";

        public final String getNickname() {
            return nickname;
        }

        public final void setNickname(String nickname) {
            this.nickname = nickname;
        }

        public final String getUrl() {
            return url;
        }

        public final void setUrl(String url) {
            this.url = url;
        }
    }

    public static class Developer {
        private String id = "";
        private String name = "";
        private String email = "";

        public final String getId() {
            return id;
        }

        public final void setId(String id) {
            this.id = id;
        }

        public final String getName() {
            return name;
        }

        public final void setName(String name) {
            this.name = name;
        }

        public final String getEmail() {
            return email;
        }

        public final void setEmail(String email) {
            this.email = email;
        }
    }
}
