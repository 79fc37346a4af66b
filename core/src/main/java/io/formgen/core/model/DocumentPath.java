package io.formgen.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of keys addressing a location inside a form document. Field segments address
 * object members, index segments address array or tuple slots.
 *
 * <p>
 * The canonical string form is {@code /} for the root and otherwise each segment prefixed with
 * {@code /}; {@code ~} and {@code /} inside field names are escaped as {@code ~0} and {@code ~1}
 * (RFC 6901). Two paths with the same canonical string are equal, so {@code Field("0")} and
 * {@code Index(0)} address the same error bucket.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class DocumentPath {

    private static final DocumentPath ROOT = new DocumentPath(List.of());

    /** One path step. */
    public sealed interface Segment {

        /** Canonical, escaped text of this segment. */
        String text();

        /** Object member access by name. */
        record Field(String name) implements Segment {
            public Field {
                Objects.requireNonNull(name, "field name must not be null");
            }

            @Override
            public String text() {
                return name.replace("~", "~0").replace("/", "~1");
            }
        }

        /** Array or tuple slot access by position. */
        record Index(int index) implements Segment {
            public Index {
                if (index < 0) {
                    throw new IllegalArgumentException("index must not be negative, got: " + index);
                }
            }

            @Override
            public String text() {
                return Integer.toString(index);
            }
        }
    }

    private final List<Segment> segments;
    private final String canonical;

    private DocumentPath(List<Segment> segments) {
        this.segments = segments;
        this.canonical = render(segments);
    }

    public static DocumentPath root() {
        return ROOT;
    }

    /**
     * Builds a path from keys: {@code String} becomes a field, any integral {@code Number} an index.
     * This is the shape issue paths take when a validator reports them as a key array.
     */
    public static DocumentPath of(Object... keys) {
        return of(List.of(keys));
    }

    public static DocumentPath of(List<?> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        List<Segment> out = new ArrayList<>(keys.size());
        for (Object key : keys) {
            out.add(toSegment(key));
        }
        return out.isEmpty() ? ROOT : new DocumentPath(Collections.unmodifiableList(out));
    }

    /**
     * Parses a slash-delimited path such as {@code /employment/0/role}. The empty string and
     * {@code /} both denote the root; the leading slash is optional. All-digit segments become
     * indexes.
     */
    public static DocumentPath parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty() || path.equals("/")) {
            return ROOT;
        }
        String body = path.startsWith("/") ? path.substring(1) : path;
        String[] parts = body.split("/", -1);
        List<Segment> out = new ArrayList<>(parts.length);
        for (String part : parts) {
            String name = part.replace("~1", "/").replace("~0", "~");
            out.add(isIndex(name) ? new Segment.Index(Integer.parseInt(name)) : new Segment.Field(name));
        }
        return new DocumentPath(Collections.unmodifiableList(out));
    }

    public DocumentPath child(String field) {
        return append(new Segment.Field(field));
    }

    public DocumentPath child(int index) {
        return append(new Segment.Index(index));
    }

    public DocumentPath append(Segment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        List<Segment> out = new ArrayList<>(segments.size() + 1);
        out.addAll(segments);
        out.add(segment);
        return new DocumentPath(Collections.unmodifiableList(out));
    }

    /** Returns the parent path; the root is its own parent. */
    public DocumentPath parent() {
        if (segments.isEmpty()) {
            return this;
        }
        if (segments.size() == 1) {
            return ROOT;
        }
        return new DocumentPath(segments.subList(0, segments.size() - 1));
    }

    /** Returns the last segment, or {@code null} for the root. */
    public Segment lastSegment() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    public Segment segment(int position) {
        return segments.get(position);
    }

    public List<Segment> segments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocumentPath other
                && segments.size() == other.segments.size()
                && canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    /** The canonical string form, usable as a map key. */
    @Override
    public String toString() {
        return canonical;
    }

    private static Segment toSegment(Object key) {
        if (key instanceof String s) {
            return new Segment.Field(s);
        }
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
            return new Segment.Index(((Number) key).intValue());
        }
        if (key instanceof Segment seg) {
            return seg;
        }
        String type = key == null ? "null" : key.getClass().getSimpleName();
        throw new IllegalArgumentException("Unsupported path key: " + key + " (" + type + ")");
    }

    private static boolean isIndex(String s) {
        if (s.isEmpty() || s.length() > 9) {
            return false;
        }
        if (s.length() > 1 && s.charAt(0) == '0') {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String render(List<Segment> segments) {
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            sb.append('/').append(segment.text());
        }
        return sb.toString();
    }
}
