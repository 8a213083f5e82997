package com.acme.finops.pluginhost.compat;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code major.minor.patch} with optional {@code v} prefix and pre-release/build suffix.
 * Missing minor or patch components read as zero.
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease) implements Comparable<SemanticVersion> {
    private static final Pattern VERSION_PATTERN =
        Pattern.compile("v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?");

    private static final Comparator<SemanticVersion> ORDER = Comparator
        .comparingInt(SemanticVersion::major)
        .thenComparingInt(SemanticVersion::minor)
        .thenComparingInt(SemanticVersion::patch)
        .thenComparing(SemanticVersion::preRelease, SemanticVersion::comparePreRelease);

    public SemanticVersion {
        preRelease = preRelease == null ? "" : preRelease;
    }

    public static Optional<SemanticVersion> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher m = VERSION_PATTERN.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemanticVersion(parseGroup(m, 1), parseGroup(m, 2), parseGroup(m, 3), m.group(4)));
        } catch (NumberFormatException overflow) {
            return Optional.empty();
        }
    }

    private static int parseGroup(Matcher m, int group) {
        String value = m.group(group);
        if (value == null || value.isBlank()) {
            return 0;
        }
        return Integer.parseInt(value);
    }

    // A release sorts above any of its pre-releases.
    private static int comparePreRelease(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) return 0;
        if (a.isEmpty()) return 1;
        if (b.isEmpty()) return -1;
        return a.compareTo(b);
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String core = major + "." + minor + "." + patch;
        return preRelease.isEmpty() ? core : core + "-" + preRelease;
    }
}
