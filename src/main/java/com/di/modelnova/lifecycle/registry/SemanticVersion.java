package com.di.modelnova.lifecycle.registry;

import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code major.minor.patch}, compared numerically.
 */
@Value
public class SemanticVersion implements Comparable<SemanticVersion> {

    public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    int major;
    int minor;
    int patch;

    /**
     * @throws IllegalArgumentException when the text is not {@code major.minor.patch}
     */
    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version number is required");
        }
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a major.minor.patch version: " + text);
        }
        try {
            return new SemanticVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version component out of range: " + text, e);
        }
    }

    public SemanticVersion nextPatch() {
        return new SemanticVersion(major, minor, patch + 1);
    }

    @Override
    public int compareTo(SemanticVersion other) {
        if (major != other.major) return Integer.compare(major, other.major);
        if (minor != other.minor) return Integer.compare(minor, other.minor);
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
