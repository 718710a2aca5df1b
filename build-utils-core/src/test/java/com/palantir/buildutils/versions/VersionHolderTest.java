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

public class VersionHolderTest {
    @Test
    public void offersNewerStableVersionsInOrder() {
        VersionHolder holder = new VersionHolder("2.0.0", List.of("1.1.0", "1.0.0", "2.0.0-rc1", "2.0.0"));

        assertThat(holder.getVersionOptions("1.0.0")).containsExactly("1.1.0", "2.0.0");
        assertThat(holder.toVersionString("1.0.0")).isEqualTo("-> [2.0.0, 1.1.0]");
    }

    @Test
    public void offersPreReleasesWhenNothingStableIsNewer() {
        VersionHolder holder = new VersionHolder("2.0.0-rc2", List.of("1.0.0", "2.0.0-rc1", "2.0.0-rc2"));

        assertThat(holder.getVersionOptions("1.0.0")).containsExactly("2.0.0-rc1", "2.0.0-rc2");
    }

    @Test
    public void latestStableVersionHasNoMarker() {
        VersionHolder holder = new VersionHolder("2.0.0", List.of("1.0.0", "2.0.0"));

        assertThat(holder.latestStableVersion()).contains("2.0.0");
        assertThat(holder.toVersionString("2.0.0")).isEqualTo("   ");
    }

    @Test
    public void abbreviatesLongChoices() {
        VersionHolder holder = new VersionHolder(
                "1.0.8",
                List.of("1.0.0", "1.0.1", "1.0.2", "1.0.3", "1.0.4", "1.0.5", "1.0.6", "1.0.7", "1.0.8"));

        assertThat(holder.toVersionString("1.0.0")).isEqualTo("-> [1.0.8, 1.0.7, 1.0.6 ... 1.0.3, 1.0.2, 1.0.1]");
    }

    @Test
    public void trustsRepositoryOrderForUnparseableVersions() {
        VersionHolder holder = new VersionHolder("r07", List.of("r05", "r06", "r07"));

        assertThat(holder.getVersionOptions("r05")).containsExactly("r06", "r07");
        assertThat(holder.getVersionOptions("r09")).containsExactly(VersionHolder.PARSE_ERROR, "r05", "r06", "r07");
    }

    @Test
    public void repeatedVersionsMakeTheOrderUnreliable() {
        VersionHolder holder = new VersionHolder("r07", List.of("r05", "r06"));
        holder.addVersion("r06");
        holder.addVersion("r07");

        assertThat(holder.isDirty()).isTrue();
        assertThat(holder.versions()).containsExactly("r05", "r06", "r07");
        assertThat(holder.getVersionOptions("r05")).containsExactly(VersionHolder.PARSE_ERROR, "r05", "r06", "r07");
    }

    @Test
    public void firstReleaseWinsUnlessALaterOneIsGreater() {
        VersionHolder holder = new VersionHolder();
        holder.updateReleaseVersion("1.0");
        holder.updateReleaseVersion("0.9");
        holder.updateReleaseVersion("nightly");
        assertThat(holder.release()).contains("1.0");

        holder.updateReleaseVersion("1.1");
        assertThat(holder.release()).contains("1.1");
    }

    @Test
    public void fallsBackToTheReleaseWithoutStableVersions() {
        assertThat(new VersionHolder("r05", List.of("r05")).latestStableVersion()).contains("r05");
        assertThat(new VersionHolder().latestStableVersion()).isEmpty();
    }
}
