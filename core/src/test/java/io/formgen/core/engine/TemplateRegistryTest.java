package io.formgen.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.TemplateKind;
import io.formgen.core.schema.Schemas;
import io.formgen.core.spi.DiagnosticListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TemplateRegistry")
class TemplateRegistryTest {

    private static TemplateRegistry.Builder<String> describingAllKinds() {
        TemplateRegistry.Builder<String> builder = TemplateRegistry.builder();
        for (TemplateKind kind : TemplateKind.values()) {
            builder.register(kind, (schema, path, decision) -> kind + ":" + decision.variant() + "@" + path);
        }
        return builder;
    }

    @Test
    void rendersWithTheRendererForTheDispatchedKind() {
        TemplateRegistry<String> registry = describingAllKinds().build();

        assertThat(registry.render(Schemas.string("email").optional(), DocumentPath.of("contact")))
                .isEqualTo("STRING:EMAIL_INPUT@/contact");
        assertThat(registry.render(Schemas.opaque("allOf"), DocumentPath.of("x")))
                .isEqualTo("UNSUPPORTED:PLACEHOLDER@/x");
    }

    @Test
    void buildFailsNamingMissingKinds() {
        TemplateRegistry.Builder<String> builder = TemplateRegistry.builder();
        builder.register(TemplateKind.STRING, (schema, path, decision) -> "s");

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NUMBER")
                .hasMessageContaining("UNSUPPORTED")
                .hasMessageNotContaining("STRING,");
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        TemplateRegistry<String> registry = describingAllKinds()
                .register(TemplateKind.BOOLEAN, (schema, path, decision) -> "custom")
                .build();

        assertThat(registry.render(Schemas.bool(), DocumentPath.root())).isEqualTo("custom");
        assertThat(registry.rendererFor(TemplateKind.BOOLEAN)).isNotNull();
    }

    @Test
    void suppliedDispatcherReportsThroughItsListener() {
        DiagnosticListener listener = mock(DiagnosticListener.class);
        RenderDispatcher dispatcher = new RenderDispatcher(listener);
        TemplateRegistry<String> registry = describingAllKinds().dispatcher(dispatcher).build();

        assertThat(registry.dispatcher()).isSameAs(dispatcher);
        assertThat(registry.render(Schemas.opaque("allOf"), DocumentPath.of("x")))
                .isEqualTo("UNSUPPORTED:PLACEHOLDER@/x");
        verify(listener).onDiagnostic(any());
    }
}
