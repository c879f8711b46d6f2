package me.christianrobert.pyibackport.transformer.model;

import java.util.List;
import java.util.Objects;

/**
 * A Python {@code major.minor} version.
 *
 * <p>Used both for the target of a backport run (one of {@link #supportedTargets()}) and for the
 * thresholds in the backport and denylist catalogs. {@link #NEVER} marks entries that apply to
 * every target.
 */
public final class PythonVersion implements Comparable<PythonVersion> {

    public static final PythonVersion PY310 = new PythonVersion(3, 10);
    public static final PythonVersion PY311 = new PythonVersion(3, 11);
    public static final PythonVersion PY312 = new PythonVersion(3, 12);
    public static final PythonVersion PY313 = new PythonVersion(3, 13);
    public static final PythonVersion PY314 = new PythonVersion(3, 14);

    /** Threshold that no target reaches. */
    public static final PythonVersion NEVER = new PythonVersion(4, 0);

    public static final PythonVersion DEFAULT_TARGET = PY310;

    private static final List<PythonVersion> SUPPORTED_TARGETS = List.of(PY310, PY311, PY312, PY313);

    private final int major;
    private final int minor;

    private PythonVersion(int major, int minor) {
        this.major = major;
        this.minor = minor;
    }

    public static PythonVersion of(int major, int minor) {
        return new PythonVersion(major, minor);
    }

    /**
     * Parses a target version such as {@code "3.11"}.
     *
     * @throws IllegalArgumentException if the text is not one of the supported targets
     */
    public static PythonVersion parseTarget(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Target version cannot be empty");
        }
        for (PythonVersion target : SUPPORTED_TARGETS) {
            if (target.toString().equals(text.trim())) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unsupported target version '" + text.trim() + "', expected one of "
                + SUPPORTED_TARGETS);
    }

    public static List<PythonVersion> supportedTargets() {
        return SUPPORTED_TARGETS;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public boolean isBefore(PythonVersion other) {
        return compareTo(other) < 0;
    }

    public boolean isAtLeast(PythonVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(PythonVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PythonVersion)) return false;
        PythonVersion that = (PythonVersion) o;
        return major == that.major && minor == that.minor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
