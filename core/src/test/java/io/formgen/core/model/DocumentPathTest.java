package io.formgen.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formgen.core.model.DocumentPath.Segment;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("DocumentPath")
class DocumentPathTest {

    @Nested
    @DisplayName("canonical form")
    class CanonicalForm {

        @Test
        void rootIsSlash() {
            assertThat(DocumentPath.root()).hasToString("/");
            assertThat(DocumentPath.root().isRoot()).isTrue();
        }

        @Test
        void segmentsJoinWithSlashes() {
            assertThat(DocumentPath.of("employment", 0, "role")).hasToString("/employment/0/role");
        }

        @Test
        void escapesSlashAndTilde() {
            assertThat(DocumentPath.of("a/b", "c~d")).hasToString("/a~1b/c~0d");
        }

        @Test
        void fieldAndIndexWithSameTextAreEqual() {
            assertThat(DocumentPath.of("items", "0")).isEqualTo(DocumentPath.of("items", 0));
            assertThat(DocumentPath.of("items", "0").hashCode())
                    .isEqualTo(DocumentPath.of("items", 0).hashCode());
        }

        @Test
        void emptyFieldNameIsNotRoot() {
            assertThat(DocumentPath.of("")).isNotEqualTo(DocumentPath.root());
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @ParameterizedTest
        @ValueSource(strings = {"", "/"})
        void rootForms(String text) {
            assertThat(DocumentPath.parse(text)).isEqualTo(DocumentPath.root());
        }

        @Test
        void numericSegmentsBecomeIndexes() {
            DocumentPath path = DocumentPath.parse("/employment/1/role");

            assertThat(path.segments())
                    .containsExactly(new Segment.Field("employment"), new Segment.Index(1), new Segment.Field("role"));
        }

        @Test
        void leadingZeroStaysAField() {
            assertThat(DocumentPath.parse("/zip/01").lastSegment()).isEqualTo(new Segment.Field("01"));
        }

        @Test
        void leadingSlashIsOptional() {
            assertThat(DocumentPath.parse("a/b")).isEqualTo(DocumentPath.parse("/a/b"));
        }

        @Test
        void unescapesFieldNames() {
            assertThat(DocumentPath.parse("/a~1b/c~0d").segments())
                    .containsExactly(new Segment.Field("a/b"), new Segment.Field("c~d"));
        }

        @Test
        void roundTripsThroughToString() {
            DocumentPath path = DocumentPath.of("a/b", 3, "x~y");

            assertThat(DocumentPath.parse(path.toString())).isEqualTo(path);
        }
    }

    @Nested
    @DisplayName("navigation")
    class Navigation {

        @Test
        void childAndParent() {
            DocumentPath path = DocumentPath.root().child("tags").child(2);

            assertThat(path).hasToString("/tags/2");
            assertThat(path.size()).isEqualTo(2);
            assertThat(path.parent()).hasToString("/tags");
            assertThat(path.parent().parent()).isEqualTo(DocumentPath.root());
            assertThat(DocumentPath.root().parent()).isEqualTo(DocumentPath.root());
        }

        @Test
        void lastSegmentOfRootIsNull() {
            assertThat(DocumentPath.root().lastSegment()).isNull();
        }

        @Test
        void ofAcceptsKeyList() {
            assertThat(DocumentPath.of(List.of("a", 1L))).hasToString("/a/1");
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        void negativeIndex() {
            assertThatThrownBy(() -> DocumentPath.root().child(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("-1");
        }

        @Test
        void unsupportedKeyType() {
            assertThatThrownBy(() -> DocumentPath.of("a", 1.5))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Double");
        }
    }
}
