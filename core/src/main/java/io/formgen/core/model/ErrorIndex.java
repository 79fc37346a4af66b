package io.formgen.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation issues grouped by canonical document path for constant-time per-field lookup. Built in
 * full on every validation pass by {@code ErrorIndexer}; never updated incrementally.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ErrorIndex {

    public static final ErrorIndex EMPTY = new ErrorIndex(Map.of());

    private final Map<String, List<ValidationIssue>> buckets;

    private ErrorIndex(Map<String, List<ValidationIssue>> buckets) {
        this.buckets = buckets;
    }

    /**
     * Creates an index from pre-grouped buckets. Bucket order and order within each bucket are kept.
     */
    public static ErrorIndex of(Map<String, List<ValidationIssue>> buckets) {
        if (buckets.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<ValidationIssue>> copy = new LinkedHashMap<>();
        buckets.forEach((key, issues) -> copy.put(key, List.copyOf(issues)));
        return new ErrorIndex(Collections.unmodifiableMap(copy));
    }

    /** Issues bucketed at {@code path}; empty if there are none. Never fails. */
    public List<ValidationIssue> lookup(DocumentPath path) {
        return path == null ? List.of() : lookup(path.toString());
    }

    /** Issues bucketed at the canonical path string; empty if there are none. Never fails. */
    public List<ValidationIssue> lookup(String canonicalPath) {
        List<ValidationIssue> bucket = canonicalPath == null ? null : buckets.get(canonicalPath);
        return bucket == null ? List.of() : bucket;
    }

    public boolean hasErrors(DocumentPath path) {
        return !lookup(path).isEmpty();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    /** Canonical paths that carry at least one issue, in first-seen order. */
    public Set<String> paths() {
        return buckets.keySet();
    }

    /** Sum of all bucket sizes. */
    public int totalCount() {
        int total = 0;
        for (List<ValidationIssue> bucket : buckets.values()) {
            total += bucket.size();
        }
        return total;
    }

    /** All indexed issues, bucket by bucket. */
    public List<ValidationIssue> all() {
        List<ValidationIssue> out = new ArrayList<>(totalCount());
        buckets.values().forEach(out::addAll);
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "ErrorIndex" + buckets.keySet();
    }
}
