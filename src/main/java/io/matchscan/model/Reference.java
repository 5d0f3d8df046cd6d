package io.matchscan.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A stable access path rooted at a program value, e.g. {@code status} or {@code status.problem}.
 * <p>
 * Identity is structural: two references with the same segments are the same reference.
 *
 * @param segments Path segments from the root value outwards
 */
public record Reference(List<String> segments) implements Comparable<Reference> {

    /**
     * Compact constructor with validation.
     */
    public Reference {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Reference path cannot be null or empty");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("Reference segment cannot be null or blank: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parses a dotted path such as "status.problem".
     */
    public static Reference of(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank()) {
            throw new IllegalArgumentException("Reference path cannot be null or blank");
        }
        return new Reference(Arrays.stream(dottedPath.trim().split("\\."))
                .map(String::trim)
                .toList());
    }

    /**
     * Returns the reference this one is derived from, or empty for a root reference.
     */
    public Optional<Reference> base() {
        if (segments.size() == 1) {
            return Optional.empty();
        }
        return Optional.of(new Reference(segments.subList(0, segments.size() - 1)));
    }

    /**
     * True if this reference is a property access on another reference.
     */
    public boolean isDerived() {
        return segments.size() > 1;
    }

    /**
     * True if {@code other} is a strict prefix of this reference.
     */
    public boolean isDerivedFrom(Reference other) {
        return other.segments.size() < segments.size()
                && segments.subList(0, other.segments.size()).equals(other.segments);
    }

    /**
     * Returns the reference for a property of this one.
     */
    public Reference child(String property) {
        List<String> extended = new java.util.ArrayList<>(segments);
        extended.add(property);
        return new Reference(extended);
    }

    /**
     * Number of segments; a root reference has depth 1.
     */
    public int depth() {
        return segments.size();
    }

    public String path() {
        return String.join(".", segments);
    }

    @Override
    public int compareTo(Reference other) {
        return path().compareTo(other.path());
    }

    @Override
    public String toString() {
        return path();
    }
}
