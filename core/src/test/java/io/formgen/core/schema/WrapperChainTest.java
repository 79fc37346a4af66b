package io.formgen.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.schema.SchemaNode.LazySchema;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WrapperChain")
class WrapperChainTest {

    @Test
    void peelReturnsInnerOfEachWrapper() {
        SchemaNode string = Schemas.string();

        assertThat(WrapperChain.peel(string.optional())).isSameAs(string);
        assertThat(WrapperChain.peel(string.nullable())).isSameAs(string);
        assertThat(WrapperChain.peel(string.readonly())).isSameAs(string);
        assertThat(WrapperChain.peel(string.nonOptional())).isSameAs(string);
        assertThat(WrapperChain.peel(string.withDefault(Schemas.value("x")))).isSameAs(string);
    }

    @Test
    void peelOfConcreteIsNull() {
        assertThat(WrapperChain.peel(Schemas.bool())).isNull();
    }

    @Test
    void peelResolvesLazy() {
        SchemaNode target = Schemas.number();

        assertThat(WrapperChain.peel(Schemas.lazy(() -> target))).isSameAs(target);
    }

    @Test
    void walkStopsAtFirstKindOutsidePassThrough() {
        SchemaNode node = Schemas.string().optional().nullable();

        SchemaNode stop = WrapperChain.walk(node, EnumSet.of(SchemaKind.NULLABLE));

        assertThat(stop.kind()).isEqualTo(SchemaKind.OPTIONAL);
    }

    @Test
    void optionalBehindNullableDefaultOrReadonlyIsDeclared() {
        SchemaNode string = Schemas.string();

        assertThat(WrapperChain.declaresOptional(string.optional().nullable().readonly())).isTrue();
        assertThat(WrapperChain.declaresOptional(string.optional().withDefault(Schemas.value("x")))).isTrue();
        assertThat(WrapperChain.declaresOptional(string.optional().nonOptional())).isFalse();
        assertThat(WrapperChain.declaresOptional(string.nullable())).isFalse();
        assertThat(WrapperChain.declaresOptional(Schemas.lazy(() -> string.optional()))).isFalse();
    }

    @Test
    void lazyResolvingToItselfIsUnresolvable() {
        AtomicReference<SchemaNode> self = new AtomicReference<>();
        LazySchema lazy = Schemas.lazy("self", self::get);
        self.set(lazy.nullable());

        assertThatThrownBy(() -> WrapperChain.walk(lazy, SchemaKind.WRAPPERS))
                .isInstanceOf(UnresolvableReferenceException.class)
                .hasMessageContaining("self");
    }

    @Test
    void failingGetterIsWrapped() {
        LazySchema lazy = Schemas.lazy("broken", () -> {
            throw new IllegalStateException("not ready");
        });

        assertThatThrownBy(() -> WrapperChain.resolve(lazy))
                .isInstanceOf(UnresolvableReferenceException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void nullGetterResultIsUnresolvable() {
        assertThatThrownBy(() -> WrapperChain.resolve(Schemas.lazy(() -> null)))
                .isInstanceOf(UnresolvableReferenceException.class)
                .hasMessageContaining("nothing");
    }

    @Test
    void lazyUsesIdentityEquality() {
        SchemaNode target = Schemas.string();
        LazySchema a = Schemas.lazy("x", () -> target);
        LazySchema b = Schemas.lazy("x", () -> target);

        assertThat(a).isNotEqualTo(b).isEqualTo(a);
    }
}
