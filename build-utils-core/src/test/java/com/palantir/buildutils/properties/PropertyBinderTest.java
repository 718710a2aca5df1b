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

package com.palantir.buildutils.properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

public class PropertyBinderTest {
    @Test
    public void assignsFieldsAndSetters() {
        Holder holder = new Holder();
        PropertyBinder binder = PropertyBinder.of(holder);

        assertThat(binder.assign("name", "core")).isTrue();
        assertThat(binder.assign("version", "1.2")).isTrue();
        assertThat(binder.assign("missing", "x")).isFalse();
        assertThat(binder.assign("fixed", "x")).isFalse();

        assertThat(holder.name).isEqualTo("core");
        assertThat(holder.getVersion()).isEqualTo("v1.2");
    }

    @Test
    public void acceptsSettersTakingObjects() {
        Holder holder = new Holder();

        assertThat(PropertyBinder.of(holder).assign("description", "a library")).isTrue();
        assertThat(holder.description).isEqualTo("a library");
    }

    @Test
    public void readsValues() {
        Holder holder = new Holder();
        holder.name = "core";

        assertThat(PropertyBinder.of(holder).readableValues())
                .containsOnly(entry("name", "core"), entry("fixed", "constant"));
    }

    @Test
    public void readsConstantsOfInstances() {
        assertThat(PropertyBinder.of(Extras.INSTANCE).readableValues())
                .containsOnly(entry("name", "Utils"), entry("version", "2.3"), entry("group", "com.example"));
    }

    @Test
    public void usesStaticMembersOfClasses() {
        PropertyBinder binder = PropertyBinder.of(Constants.class);

        assertThat(binder.assign("group", "com.example")).isTrue();
        assertThat(binder.assign("name", "ignored")).isFalse();
        assertThat(binder.readableValues()).containsOnly(entry("group", "com.example"));
    }

    @Test
    public void namesSetters() {
        assertThat(PropertyBinder.setterName("version")).isEqualTo("setVersion");
        assertThat(PropertyBinder.setterName("")).isEqualTo("set");
    }

    public static final class Holder {
        public String name;
        public final String fixed = "constant";
        public Object description;
        private String version;

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = "v" + version;
        }

        public void setDescription(Object description) {
            this.description = description;
        }
    }

    // the shape of a Kotlin object holding const vals
    public static final class Extras {
        public static final String version = "2.3";
        public static final String group = "com.example";
        public static final Extras INSTANCE = new Extras();

        public String getName() {
            return "Utils";
        }
    }

    public static final class Constants {
        public static String group;
        public String name;
    }
}
