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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Everything the Maven repositories told us about one {@code group:name}: the advertised release and every
 * published version, in the order the repositories listed them.
 * <p>
 * Not thread safe. Concurrent writers must hold an external lock, see {@link VersionInfoFetcher}.
 */
public final class VersionHolder {
    public static final String PARSE_ERROR = "Error parsing!";

    private static final int ABBREVIATE_AFTER = 3;

    @Nullable
    private String release;

    private final Set<String> versions = new LinkedHashSet<>();
    private boolean dirtyVersions = false;

    public VersionHolder() {}

    @VisibleForTesting
    VersionHolder(@Nullable String release, List<String> versions) {
        this.release = release;
        versions.forEach(this::addVersion);
    }

    public Optional<String> release() {
        return Optional.ofNullable(release);
    }

    public List<String> versions() {
        return ImmutableList.copyOf(versions);
    }

    /** Set when a repository listed a version that was already known, so the insertion order is unreliable. */
    public boolean isDirty() {
        return dirtyVersions;
    }

    /**
     * Records a {@code <release>} value. The first value always wins, later values only replace it when they are
     * strictly greater. Values that cannot be compared are ignored.
     */
    public void updateReleaseVersion(String version) {
        if (release == null) {
            release = version;
            return;
        }

        Optional<SemanticVersion> current = SemanticVersion.tryParse(release);
        Optional<SemanticVersion> candidate = SemanticVersion.tryParse(version);
        if (current.isPresent()
                && candidate.isPresent()
                && candidate.get().isGreaterThan(current.get())) {
            release = version;
        }
    }

    public void addVersion(String version) {
        if (!versions.add(version)) {
            dirtyVersions = true;
        }
    }

    /**
     * Returns the versions a dependency at {@code currentVersion} could move to, oldest first.
     * <p>
     * When every version is a semantic version, stable versions newer than {@code currentVersion} are preferred,
     * falling back to every newer version. Otherwise the repository order is trusted and everything listed after
     * {@code currentVersion} is returned; when that is not possible the whole list is returned behind a
     * {@link #PARSE_ERROR} marker.
     */
    public List<String> getVersionOptions(String currentVersion) {
        Optional<List<String>> sorted = sortedOptions(currentVersion);
        if (sorted.isPresent()) {
            return sorted.get();
        }

        if (dirtyVersions) {
            return withParseError();
        }

        List<String> ordered = new ArrayList<>(versions);
        int index = ordered.indexOf(currentVersion);
        if (index < 0) {
            return withParseError();
        }
        return ImmutableList.copyOf(ordered.subList(index + 1, ordered.size()));
    }

    private Optional<List<String>> sortedOptions(String currentVersion) {
        Optional<SemanticVersion> current = SemanticVersion.tryParse(currentVersion);
        if (current.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Optional<SemanticVersion>> parsed = versions.stream()
                .collect(Collectors.toMap(Function.identity(), SemanticVersion::tryParse, (a, b) -> a));
        if (parsed.values().stream().anyMatch(Optional::isEmpty)) {
            return Optional.empty();
        }

        List<SemanticVersion> sorted = parsed.values().stream()
                .map(Optional::get)
                .sorted(SemanticVersion.withBuilds())
                .collect(Collectors.toList());

        List<String> newerStable = sorted.stream()
                .filter(SemanticVersion::isStable)
                .filter(version -> version.isGreaterThan(current.get()))
                .map(SemanticVersion::toString)
                .collect(ImmutableList.toImmutableList());
        if (!newerStable.isEmpty()) {
            return Optional.of(newerStable);
        }

        return Optional.of(versions.stream()
                .filter(version -> parsed.get(version).get().isGreaterThan(current.get()))
                .collect(ImmutableList.toImmutableList()));
    }

    private List<String> withParseError() {
        return ImmutableList.<String>builder().add(PARSE_ERROR).addAll(versions).build();
    }

    /** The last stable version the repositories listed, or the advertised release if none is stable. */
    public Optional<String> latestStableVersion() {
        String latest = null;
        for (String version : versions) {
            if (SemanticVersion.isStable(version)) {
                latest = version;
            }
        }
        return latest != null ? Optional.of(latest) : release();
    }

    /**
     * Describes the update choices for a dependency at {@code currentVersion}, newest first, e.g.
     * {@code "-> [2.0.3, 2.0.2, 2.0.1 ... 1.1.0]"}. The marker is blank when {@code currentVersion} already is the
     * latest stable version.
     */
    public String toVersionString(String currentVersion) {
        String spacer = latestStableVersion().filter(currentVersion::equals).isPresent() ? "   " : "-> ";

        List<String> choices = Lists.reverse(getVersionOptions(currentVersion));
        if (choices.size() > ABBREVIATE_AFTER) {
            List<String> rest = choices.subList(ABBREVIATE_AFTER, choices.size());
            List<String> tail = rest.subList(Math.max(0, rest.size() - ABBREVIATE_AFTER), rest.size());

            List<String> abbreviated = new ArrayList<>(choices.subList(0, ABBREVIATE_AFTER));
            abbreviated.add("...");
            abbreviated.addAll(tail);
            return spacer + abbreviated.toString().replace(", ...,", " ...");
        }
        if (!choices.isEmpty()) {
            return spacer + choices;
        }
        return spacer;
    }

    @Override
    public String toString() {
        return "VersionHolder{release=" + release + ", versions=" + versions + '}';
    }
}
