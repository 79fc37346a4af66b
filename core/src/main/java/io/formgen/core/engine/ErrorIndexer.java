package io.formgen.core.engine;

import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.ErrorIndex;
import io.formgen.core.model.ValidationIssue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buckets validator issues by the document path of the field they concern, so a field editor can
 * look up its own messages. A missing-required issue reported on the parent object is filed under
 * the missing child's path.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ErrorIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorIndexer.class);

    private ErrorIndexer() {}

    /** Every issue lands in exactly one bucket; bucket and issue order follow the input. */
    public static ErrorIndex index(List<ValidationIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            return ErrorIndex.EMPTY;
        }
        Map<String, List<ValidationIssue>> buckets = new LinkedHashMap<>();
        for (ValidationIssue issue : issues) {
            buckets.computeIfAbsent(keyFor(issue).toString(), k -> new ArrayList<>()).add(issue);
        }
        LOG.debug("Indexed {} validation issue(s) under {} path(s)", issues.size(), buckets.size());
        return ErrorIndex.of(buckets);
    }

    /** The path an issue is filed under. */
    public static DocumentPath keyFor(ValidationIssue issue) {
        return issue.isMissingRequired() ? issue.path().child(issue.missingProperty()) : issue.path();
    }

    public static List<ValidationIssue> lookup(ErrorIndex index, DocumentPath path) {
        return index == null ? List.of() : index.lookup(path);
    }
}
