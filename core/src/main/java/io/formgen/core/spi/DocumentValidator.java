package io.formgen.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.formgen.core.model.ValidationIssue;
import java.util.List;

/**
 * SPI for the external validation library. Implementations adapt the library's own locator format
 * (key arrays, slash-delimited instance paths, ...) into {@link io.formgen.core.model.DocumentPath}
 * before returning; the engine never parses validator-specific paths.
 */
@FunctionalInterface
public interface DocumentValidator {

    /**
     * Validates a document.
     *
     * @param document the document to validate ({@code MissingNode} when absent)
     * @return every issue found, in the validator's order; empty when valid
     */
    List<ValidationIssue> validate(JsonNode document);
}
