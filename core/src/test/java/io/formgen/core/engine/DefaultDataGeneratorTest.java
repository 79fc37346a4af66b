package io.formgen.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formgen.core.error.MalformedDefaultProducerException;
import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.error.UnsupportedSchemaKindException;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.Schemas;
import io.formgen.core.spi.DiagnosticListener;
import io.formgen.core.spi.DiagnosticListener.Diagnostic;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

@DisplayName("DefaultDataGenerator")
class DefaultDataGeneratorTest {

    private DiagnosticListener listener;
    private DefaultDataGenerator generator;

    @BeforeEach
    void setUp() {
        listener = mock(DiagnosticListener.class);
        generator = new DefaultDataGenerator(listener);
    }

    @Nested
    @DisplayName("resolution order")
    class ResolutionOrder {

        @Test
        void declaredDefaultWins() {
            JsonNode value = generator.generateDefault(Schemas.number().withDefault(Schemas.value(42)));

            assertThat(value.asInt()).isEqualTo(42);
        }

        @Test
        void defaultIsFoundThroughNullableAndReadonly() {
            SchemaNode node = Schemas.string()
                    .withDefault(Schemas.value("draft"))
                    .nullable()
                    .readonly();

            assertThat(generator.generateDefault(node).asText()).isEqualTo("draft");
        }

        @Test
        void optionalOutsideTheDefaultHidesIt() {
            SchemaNode node = Schemas.string().withDefault(Schemas.value("x")).optional();

            assertThat(generator.generateDefault(node).isMissingNode()).isTrue();
        }

        @Test
        void defaultOutsideOptionalStillSeeds() {
            SchemaNode node = Schemas.string().optional().withDefault(Schemas.value("x"));

            assertThat(generator.generateDefault(node).asText()).isEqualTo("x");
        }

        @Test
        void optionalFieldIsAbsent() {
            assertThat(generator.generateDefault(Schemas.object().build().optional()).isMissingNode())
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("concrete kinds")
    class ConcreteKinds {

        @Test
        void scalarsAreAbsent() {
            assertThat(generator.generateDefault(Schemas.string()).isMissingNode()).isTrue();
            assertThat(generator.generateDefault(Schemas.number()).isMissingNode()).isTrue();
            assertThat(generator.generateDefault(Schemas.bool()).isMissingNode()).isTrue();
            assertThat(generator.generateDefault(Schemas.date()).isMissingNode()).isTrue();
            assertThat(generator.generateDefault(Schemas.bigInteger()).isMissingNode()).isTrue();
        }

        @Test
        void enumTakesFirstEntry() {
            assertThat(generator.generateDefault(Schemas.enumOf("admin", "user")).asText()).isEqualTo("admin");
        }

        @Test
        void literalTakesFirstValue() {
            assertThat(generator.generateDefault(Schemas.literal("on", "off")).asText()).isEqualTo("on");
        }

        @Test
        void nullKindIsJsonNull() {
            assertThat(generator.generateDefault(Schemas.nullType()).isNull()).isTrue();
        }

        @Test
        void objectOmitsAbsentFields() {
            SchemaNode form = Schemas.object()
                    .field("name", Schemas.string())
                    .field("nickname", Schemas.string().optional())
                    .field("role", Schemas.enumOf("admin", "user"))
                    .build();

            JsonNode value = generator.generateDefault(form);

            assertThat(value.isObject()).isTrue();
            assertThat(value.has("name")).isFalse();
            assertThat(value.has("nickname")).isFalse();
            assertThat(value.get("role").asText()).isEqualTo("admin");
        }

        @Test
        void arrayWithoutMinimumIsEmpty() {
            JsonNode value = generator.generateDefault(Schemas.array(Schemas.string()));

            assertThat(value.isArray()).isTrue();
            assertThat(value.size()).isZero();
        }

        @Test
        void arrayMinimumProducesThatManyElementDefaults() {
            JsonNode value = generator.generateDefault(Schemas.array(Schemas.string(), 2));

            assertThat(value.size()).isEqualTo(2);
            assertThat(value.get(0).isMissingNode()).isTrue();
            assertThat(value.get(1).isMissingNode()).isTrue();
        }

        @Test
        void arrayElementsAreIndependentCopies() {
            SchemaNode element = Schemas.object()
                    .field("role", Schemas.enumOf("admin", "user"))
                    .build();

            JsonNode value = generator.generateDefault(Schemas.array(element, 2));
            ((ObjectNode) value.get(0)).put("role", "user");

            assertThat(value.get(1).get("role").asText()).isEqualTo("admin");
        }

        @Test
        void unionTakesFirstOption() {
            SchemaNode union = Schemas.union(Schemas.number().withDefault(Schemas.value(5)), Schemas.string());

            assertThat(generator.generateDefault(union).asInt()).isEqualTo(5);
        }

        @Test
        void tupleMapsEverySlot() {
            JsonNode value = generator.generateDefault(Schemas.tuple(Schemas.enumOf("a", "b"), Schemas.string()));

            assertThat(value.size()).isEqualTo(2);
            assertThat(value.get(0).asText()).isEqualTo("a");
            assertThat(value.get(1).isMissingNode()).isTrue();
        }

        @Test
        void fixedDefaultsAreCopiedOnEveryCall() {
            SchemaNode node = Schemas.object().build().withDefault(Schemas.value(Map.of("a", 1)));

            ObjectNode first = (ObjectNode) generator.generateDefault(node);
            first.put("a", 2);

            assertThat(generator.generateDefault(node).get("a").asInt()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("degraded fields")
    class Degraded {

        private Logger generatorLogger;
        private ListAppender<ILoggingEvent> logAppender;

        @BeforeEach
        void attachAppender() {
            generatorLogger = (Logger) LoggerFactory.getLogger(DefaultDataGenerator.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            generatorLogger.addAppender(logAppender);
        }

        @AfterEach
        void detachAppender() {
            generatorLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        void failingProducerLeavesFieldAbsentAndReports() {
            SchemaNode form = Schemas.object()
                    .field("name", Schemas.string().withDefault(Schemas.value("anon")))
                    .field("age", Schemas.number().withDefault(() -> {
                        throw new IllegalStateException("clock unavailable");
                    }))
                    .build();

            JsonNode value = generator.generateDefault(form);

            assertThat(value.get("name").asText()).isEqualTo("anon");
            assertThat(value.has("age")).isFalse();

            ArgumentCaptor<Diagnostic> captor = ArgumentCaptor.forClass(Diagnostic.class);
            verify(listener).onDiagnostic(captor.capture());
            assertThat(captor.getValue().path()).hasToString("/age");
            assertThat(captor.getValue().cause())
                    .isInstanceOf(MalformedDefaultProducerException.class)
                    .hasRootCauseMessage("clock unavailable");

            assertThat(logAppender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage()).contains("/age");
                    });
        }

        @Test
        void recursiveReferenceTerminates() {
            AtomicReference<SchemaNode> category = new AtomicReference<>();
            SchemaNode ref = Schemas.lazy("category", category::get);
            category.set(Schemas.object()
                    .field("name", Schemas.string().withDefault(Schemas.value("root")))
                    .field("children", Schemas.array(ref, 1))
                    .build());

            JsonNode value = generator.generateDefault(category.get());

            assertThat(value.get("name").asText()).isEqualTo("root");
            JsonNode child = value.get("children").get(0);
            assertThat(child.get("name").asText()).isEqualTo("root");
            assertThat(child.get("children").get(0).isMissingNode()).isTrue();

            ArgumentCaptor<Diagnostic> captor = ArgumentCaptor.forClass(Diagnostic.class);
            verify(listener).onDiagnostic(captor.capture());
            assertThat(captor.getValue().path()).hasToString("/children/0/children/0");
            assertThat(captor.getValue().cause()).isInstanceOf(UnresolvableReferenceException.class);
        }

        @Test
        void recursionWithoutMinimumNeedsNoGuard() {
            AtomicReference<SchemaNode> category = new AtomicReference<>();
            SchemaNode ref = Schemas.lazy("category", category::get);
            category.set(Schemas.object()
                    .field("children", Schemas.array(ref))
                    .build());

            JsonNode value = generator.generateDefault(ref);

            assertThat(value.get("children").size()).isZero();
            verify(listener, never()).onDiagnostic(any());
        }

        @Test
        void brokenReferenceIsAbsent() {
            SchemaNode form = Schemas.object()
                    .field("ref", Schemas.lazy("missing", () -> null))
                    .build();

            JsonNode value = generator.generateDefault(form);

            assertThat(value.has("ref")).isFalse();
            ArgumentCaptor<Diagnostic> captor = ArgumentCaptor.forClass(Diagnostic.class);
            verify(listener).onDiagnostic(captor.capture());
            assertThat(captor.getValue().cause()).isInstanceOf(UnresolvableReferenceException.class);
            assertThat(captor.getValue().cause().location()).isEqualTo("/ref");
        }

        @Test
        void opaqueKindIsAbsentAndReported() {
            JsonNode value = generator.generateDefault(
                    Schemas.object().field("blob", Schemas.opaque("allOf")).build());

            assertThat(value.has("blob")).isFalse();
            ArgumentCaptor<Diagnostic> captor = ArgumentCaptor.forClass(Diagnostic.class);
            verify(listener).onDiagnostic(captor.capture());
            assertThat(captor.getValue().cause())
                    .isInstanceOfSatisfying(UnsupportedSchemaKindException.class, e -> assertThat(e.kindName())
                            .isEqualTo("allOf"));
        }

        @Test
        void failingListenerDoesNotEscape() {
            doThrow(new IllegalStateException("listener down")).when(listener).onDiagnostic(any());

            JsonNode value = generator.generateDefault(
                    Schemas.object().field("blob", Schemas.opaque("not")).build());

            assertThat(value.isObject()).isTrue();
            assertThat(logAppender.list)
                    .anySatisfy(event -> assertThat(event.getFormattedMessage()).contains("onDiagnostic failed"));
        }
    }

    @Nested
    @DisplayName("defaultValueOf")
    class DefaultValueOf {

        @Test
        void returnsDeclaredValue() {
            assertThat(generator.defaultValueOf(Schemas.string().withDefault(Schemas.value("x"))))
                    .hasValueSatisfying(v -> assertThat(v.asText()).isEqualTo("x"));
        }

        @Test
        void emptyWithoutDefault() {
            assertThat(generator.defaultValueOf(Schemas.enumOf("a"))).isEmpty();
        }

        @Test
        void producerFailurePropagates() {
            SchemaNode node = Schemas.string().withDefault(() -> {
                throw new IllegalArgumentException("bad");
            });

            assertThatThrownBy(() -> generator.defaultValueOf(node))
                    .isInstanceOf(MalformedDefaultProducerException.class)
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }
}
