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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.maven.artifact.versioning.ComparableVersion;

/**
 * A version string of the form {@code major[.minor[.patch[.revision]]][-preRelease][+buildMetadata]}.
 * <p>
 * Maven repositories contain plenty of versions that do not follow this shape (dates, {@code r05}, {@code
 * 1.0.b2}); those fail to {@link #parse(String) parse}, which is what callers use to decide whether a list of
 * versions can be sorted at all.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {
    private static final Pattern PATTERN = Pattern.compile(
            "^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([0-9A-Za-z][0-9A-Za-z.-]*))?(?:\\+([0-9A-Za-z.-]+))?$");

    private static final Comparator<SemanticVersion> WITH_BUILDS = Comparator.<SemanticVersion>naturalOrder()
            .thenComparing(SemanticVersion::buildMetadata, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String original;
    private final List<Long> numbers;
    private final String preRelease;
    private final String buildMetadata;

    private SemanticVersion(String original, List<Long> numbers, String preRelease, String buildMetadata) {
        this.original = original;
        this.numbers = numbers;
        this.preRelease = preRelease;
        this.buildMetadata = buildMetadata;
    }

    /**
     * Parses the given version.
     *
     * @throws IllegalArgumentException if the version is not a semantic version
     */
    public static SemanticVersion parse(String version) {
        Optional<SemanticVersion> parsed = tryParse(version);
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("Not a semantic version: '" + version + "'");
        }
        return parsed.get();
    }

    public static Optional<SemanticVersion> tryParse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(version.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        ImmutableList.Builder<Long> numbers = ImmutableList.builder();
        for (int group = 1; group <= 4; group++) {
            String part = matcher.group(group);
            try {
                numbers.add(part == null ? 0L : Long.parseLong(part));
            } catch (NumberFormatException e) {
                // longer than a long, nothing sane to compare against
                return Optional.empty();
            }
        }
        return Optional.of(new SemanticVersion(version, numbers.build(), matcher.group(5), matcher.group(6)));
    }

    public static boolean isStable(String version) {
        return tryParse(version).map(SemanticVersion::isStable).orElse(false);
    }

    /** True when the version has neither a pre-release nor build metadata. */
    public boolean isStable() {
        return preRelease == null && buildMetadata == null;
    }

    public boolean isGreaterThan(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    public Optional<String> preRelease() {
        return Optional.ofNullable(preRelease);
    }

    public Optional<String> build() {
        return Optional.ofNullable(buildMetadata);
    }

    private String buildMetadata() {
        return buildMetadata;
    }

    /** Orders by precedence, ignoring build metadata. A pre-release sorts before its release. */
    @Override
    public int compareTo(SemanticVersion other) {
        for (int i = 0; i < numbers.size(); i++) {
            int result = Long.compare(numbers.get(i), other.numbers.get(i));
            if (result != 0) {
                return result;
            }
        }

        if (preRelease == null || other.preRelease == null) {
            if (preRelease == null && other.preRelease == null) {
                return 0;
            }
            return preRelease == null ? 1 : -1;
        }
        return new ComparableVersion(preRelease).compareTo(new ComparableVersion(other.preRelease));
    }

    /** Same as {@link #compareTo} but versions that only differ in their build metadata are ordered too. */
    public static Comparator<SemanticVersion> withBuilds() {
        return WITH_BUILDS;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        SemanticVersion that = (SemanticVersion) other;
        return numbers.equals(that.numbers)
                && Objects.equals(preRelease, that.preRelease)
                && Objects.equals(buildMetadata, that.buildMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numbers, preRelease, buildMetadata);
    }

    @Override
    public String toString() {
        return original;
    }
}
