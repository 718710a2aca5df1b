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

package com.palantir.gradle.buildutils.jpms;

import org.gradle.api.Action;
import org.gradle.api.tasks.SourceSet;

/** Gives build scripts access to the versioned source sets, {@code jpms.sourceSets { main { ... } } }. */
public final class MultiReleaseSourceSets {
    private final SourceSet main;
    private final SourceSet test;

    MultiReleaseSourceSets(SourceSet main, SourceSet test) {
        this.main = main;
        this.test = test;
    }

    public void main(Action<? super SourceSet> action) {
        action.execute(main);
    }

    public void test(Action<? super SourceSet> action) {
        action.execute(test);
    }
}
