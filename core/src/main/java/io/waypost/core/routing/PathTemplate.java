package io.waypost.core.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled route path. Segments written as {@code {name}} capture exactly one
 * non-empty path segment; every other segment must match literally and
 * case-sensitively. A template without captures matches only the identical
 * path string.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class PathTemplate {

    private final String source;
    private final List<String> segments;
    private final List<String> captureNames;

    private PathTemplate(String source, List<String> segments, List<String> captureNames) {
        this.source = source;
        this.segments = segments;
        this.captureNames = captureNames;
    }

    /**
     * Compiles a route path.
     *
     * @throws IllegalArgumentException on an empty capture name or a name
     *                                  used twice in the same template
     */
    public static PathTemplate compile(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        List<String> segments = List.of(path.split("/", -1));
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String segment : segments) {
            if (isCapture(segment)) {
                String name = segment.substring(1, segment.length() - 1);
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Empty capture name in route path '" + path + "'");
                }
                if (!seen.add(name)) {
                    throw new IllegalArgumentException(
                            "Capture '" + name + "' appears twice in route path '" + path + "'");
                }
                names.add(name);
            }
        }
        return new PathTemplate(path, segments, Collections.unmodifiableList(names));
    }

    /**
     * Matches a request path.
     *
     * @return captured values keyed by name (empty map for literal templates),
     *         or empty if the path does not match
     */
    public Optional<Map<String, String>> match(String path) {
        if (path == null) {
            return Optional.empty();
        }
        if (captureNames.isEmpty()) {
            return source.equals(path) ? Optional.of(Map.of()) : Optional.empty();
        }
        String[] actual = path.split("/", -1);
        if (actual.length != segments.size()) {
            return Optional.empty();
        }
        Map<String, String> captures = new LinkedHashMap<>();
        for (int i = 0; i < actual.length; i++) {
            String expected = segments.get(i);
            if (isCapture(expected)) {
                if (actual[i].isEmpty()) {
                    return Optional.empty();
                }
                captures.put(expected.substring(1, expected.length() - 1), actual[i]);
            } else if (!expected.equals(actual[i])) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableMap(captures));
    }

    /** The path string this template was compiled from. */
    public String source() {
        return source;
    }

    /** Capture names in declaration order. */
    public List<String> captureNames() {
        return captureNames;
    }

    public boolean isLiteral() {
        return captureNames.isEmpty();
    }

    private static boolean isCapture(String segment) {
        return segment.length() >= 2 && segment.charAt(0) == '{' && segment.charAt(segment.length() - 1) == '}';
    }

    @Override
    public String toString() {
        return source;
    }
}
