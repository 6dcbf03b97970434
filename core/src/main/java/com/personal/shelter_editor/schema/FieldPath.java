package com.personal.shelter_editor.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dot-separated address of a value inside a save document, such as
 * {@code vault.storage.resources.Nuka}.
 *
 * Every segment is an object key. Array indexes are not part of the path
 * language; callers reach list elements through the typed views instead.
 */
public final class FieldPath {

    private static final String SEPARATOR = ".";

    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * Parses a dotted path.
     *
     * @param dotted A path such as {@code experience.currentLevel}.
     * @return The parsed path.
     * @throws IllegalArgumentException If the path is empty or contains a blank segment.
     */
    public static FieldPath parse(String dotted) {
        if (dotted == null || dotted.isEmpty()) {
            throw new IllegalArgumentException("Field path cannot be empty.");
        }
        return of(dotted.split("\\.", -1));
    }

    /**
     * Builds a path from individual keys.
     *
     * @throws IllegalArgumentException If no key is given or a key is blank or contains a dot.
     */
    public static FieldPath of(String... keys) {
        if (keys == null || keys.length == 0) {
            throw new IllegalArgumentException("Field path needs at least one segment.");
        }
        List<String> checked = new ArrayList<>(keys.length);
        for (String key : keys) {
            checked.add(checkSegment(key));
        }
        return new FieldPath(checked);
    }

    /**
     * Returns a new path with {@code key} appended.
     */
    public FieldPath child(String key) {
        List<String> extended = new ArrayList<>(segments);
        extended.add(checkSegment(key));
        return new FieldPath(extended);
    }

    /**
     * Returns a new path with all segments of {@code relative} appended.
     */
    public FieldPath resolve(FieldPath relative) {
        List<String> extended = new ArrayList<>(segments);
        extended.addAll(relative.segments);
        return new FieldPath(extended);
    }

    public List<String> segments() {
        return segments;
    }

    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    public int size() {
        return segments.size();
    }

    private static String checkSegment(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Field path segments cannot be blank.");
        }
        if (key.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Field path segment cannot contain '.': " + key);
        }
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath)) return false;
        return segments.equals(((FieldPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
