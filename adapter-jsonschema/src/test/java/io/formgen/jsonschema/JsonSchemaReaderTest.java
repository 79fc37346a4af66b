package io.formgen.jsonschema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.engine.DefaultDataGenerator;
import io.formgen.core.engine.RenderDispatcher;
import io.formgen.core.engine.SchemaNavigator;
import io.formgen.core.engine.SchemaUnwrapper;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.EditorVariant;
import io.formgen.core.model.TemplateKind;
import io.formgen.core.schema.SchemaKind;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ObjectSchema;
import io.formgen.core.schema.SchemaNode.StringSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JsonSchemaReader")
class JsonSchemaReaderTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RenderDispatcher dispatcher = new RenderDispatcher();
    private final DefaultDataGenerator generator = new DefaultDataGenerator();

    private static SchemaNode read(String schema) throws Exception {
        return JsonSchemaReader.read(JSON.readTree(schema));
    }

    private RenderDecisionProbe at(SchemaNode root, String path) {
        SchemaNode node = SchemaNavigator.schemaAt(root, DocumentPath.parse(path)).orElseThrow();
        return new RenderDecisionProbe(dispatcher.dispatch(node), dispatcher.decide(node).variant());
    }

    private record RenderDecisionProbe(TemplateKind kind, EditorVariant variant) {}

    @Nested
    @DisplayName("objects and requiredness")
    class ObjectSchemas {

        @Test
        void nonRequiredPropertiesAreWrappedOptional() throws Exception {
            SchemaNode root = read("""
                    {"type": "object",
                     "required": ["name"],
                     "properties": {
                       "name": {"type": "string"},
                       "nickname": {"type": "string"}
                     }}
                    """);

            ObjectSchema object = (ObjectSchema) root;
            assertThat(object.requiredNames()).containsExactly("name");
            assertThat(object.properties().get("name").kind()).isEqualTo(SchemaKind.STRING);
            assertThat(object.properties().get("nickname").kind()).isEqualTo(SchemaKind.OPTIONAL);
        }

        @Test
        void requiredListedButUndeclaredIsIgnored() throws Exception {
            ObjectSchema object = (ObjectSchema) read("""
                    {"type": "object", "required": ["ghost"], "properties": {"a": {"type": "string"}}}
                    """);

            assertThat(object.requiredNames()).isEmpty();
        }

        @Test
        void propertiesWithoutTypeImplyObject() throws Exception {
            assertThat(read("{\"properties\": {}}").kind()).isEqualTo(SchemaKind.OBJECT);
        }

        @Test
        void readOnlyWrapsRequiredField() throws Exception {
            ObjectSchema object = (ObjectSchema) read("""
                    {"type": "object", "required": ["id"], "properties": {"id": {"type": "string", "readOnly": true}}}
                    """);

            assertThat(object.properties().get("id").kind()).isEqualTo(SchemaKind.READONLY);
        }
    }

    @Nested
    @DisplayName("render dispatch of compiled schemas")
    class Dispatch {

        @Test
        void scalarVariants() throws Exception {
            SchemaNode root = read("""
                    {"type": "object", "properties": {
                       "email": {"type": "string", "format": "email"},
                       "born": {"type": "string", "format": "date"},
                       "age": {"type": "integer", "minimum": 0, "maximum": 120},
                       "score": {"type": "number"},
                       "active": {"type": "boolean"},
                       "bio": {"type": "string", "uiSchema": {"component": "textarea", "props": {"rows": 4}}}
                    }}
                    """);

            assertThat(at(root, "/email").variant()).isEqualTo(EditorVariant.EMAIL_INPUT);
            assertThat(at(root, "/born").variant()).isEqualTo(EditorVariant.DATE_INPUT);
            assertThat(at(root, "/age").variant()).isEqualTo(EditorVariant.RANGE);
            assertThat(at(root, "/score").variant()).isEqualTo(EditorVariant.NUMBER_INPUT);
            assertThat(at(root, "/active").variant()).isEqualTo(EditorVariant.CHECKBOX);
            assertThat(at(root, "/bio").variant()).isEqualTo(EditorVariant.TEXTAREA);
        }

        @Test
        void uiSchemaPropsBecomeHintOptions() throws Exception {
            SchemaNode bio = read("""
                    {"type": "string", "title": "Bio", "uiSchema": {"component": "textarea", "props": {"rows": 4}}}
                    """);

            SchemaNode concrete = SchemaUnwrapper.unwrap(bio);
            assertThat(concrete.metadata().title()).isEqualTo("Bio");
            assertThat(concrete.metadata().hint().kind()).isEqualTo("textarea");
            assertThat(concrete.metadata().hint().options()).containsEntry("rows", 4);
        }

        @Test
        void nullableTypeArrayCollapsesToPartner() throws Exception {
            SchemaNode node = read("{\"type\": [\"string\", \"null\"]}");

            assertThat(node.kind()).isEqualTo(SchemaKind.UNION);
            assertThat(dispatcher.decide(node).kind()).isEqualTo(TemplateKind.STRING);
        }

        @Test
        void enumAndConst() throws Exception {
            assertThat(dispatcher.decide(read("{\"enum\": [\"a\", \"b\"]}")).variant())
                    .isEqualTo(EditorVariant.SELECT);
            assertThat(read("{\"const\": 42}").kind()).isEqualTo(SchemaKind.LITERAL);
            assertThat(dispatcher.decide(read("{\"oneOf\": [{\"const\": \"x\"}, {\"const\": \"y\"}]}")).variant())
                    .isEqualTo(EditorVariant.LITERAL_CHOICE);
        }

        @Test
        void arraysAndTuples() throws Exception {
            assertThat(dispatcher.decide(read("""
                    {"type": "array", "items": {"enum": ["red", "green"]}}
                    """)).variant()).isEqualTo(EditorVariant.CHECKBOX_GROUP);
            assertThat(dispatcher.decide(read("""
                    {"type": "array", "items": {"type": "string"}}
                    """)).variant()).isEqualTo(EditorVariant.LIST);
            assertThat(read("{\"prefixItems\": [{\"type\": \"string\"}, {\"type\": \"number\"}]}").kind())
                    .isEqualTo(SchemaKind.TUPLE);
        }

        @Test
        void unmodelledKeywordsAreUnsupported() throws Exception {
            assertThat(dispatcher.decide(read("{\"allOf\": [{\"type\": \"string\"}]}")).isSupported())
                    .isFalse();
            assertThat(dispatcher.decide(read("{}")).isSupported()).isFalse();
        }
    }

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        void defaultOnOptionalPropertyStillSeedsDocument() throws Exception {
            SchemaNode root = read("""
                    {"type": "object", "properties": {
                       "country": {"type": "string", "default": "NL"},
                       "city": {"type": "string"},
                       "tags": {"type": "array", "items": {"type": "string", "default": "x"}, "minItems": 2}
                    }, "required": ["tags"]}
                    """);

            assertThat(generator.generateDefault(root))
                    .isEqualTo(JSON.readTree("{\"country\":\"NL\",\"tags\":[\"x\",\"x\"]}"));
        }

        @Test
        void rootDefaultApplies() throws Exception {
            assertThat(generator.generateDefault(read("{\"type\": \"integer\", \"default\": 7}")).asInt())
                    .isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("references")
    class References {

        private static final String TREE = """
                {"$ref": "#/definitions/node",
                 "definitions": {
                   "node": {"type": "object", "required": ["label", "children"], "properties": {
                     "label": {"type": "string", "default": "root"},
                     "children": {"type": "array", "items": {"$ref": "#/definitions/node"}}
                   }}
                 }}
                """;

        @Test
        void recursiveReferenceNavigates() throws Exception {
            SchemaNode root = read(TREE);

            SchemaNode deep = SchemaNavigator.schemaAt(root, DocumentPath.parse("/children/0/children/3/label"))
                    .orElseThrow();
            assertThat(SchemaUnwrapper.unwrap(deep)).isInstanceOf(StringSchema.class);
        }

        @Test
        void defaultsBehindReferenceApply() throws Exception {
            assertThat(generator.generateDefault(read(TREE)))
                    .isEqualTo(JSON.readTree("{\"label\":\"root\",\"children\":[]}"));
        }

        @Test
        void danglingReferenceFailsOnUnwrap() throws Exception {
            SchemaNode node = read("{\"$ref\": \"#/definitions/missing\"}");

            assertThatThrownBy(() -> SchemaUnwrapper.unwrap(node))
                    .isInstanceOf(UnresolvableReferenceException.class)
                    .hasMessageContaining("#/definitions/missing");
        }

        @Test
        void externalReferenceIsUnresolvable() throws Exception {
            SchemaNode node = read("{\"$ref\": \"https://example.com/other.json\"}");

            assertThatThrownBy(() -> SchemaUnwrapper.unwrap(node)).isInstanceOf(UnresolvableReferenceException.class);
            assertThat(dispatcher.decide(node).isSupported()).isFalse();
        }
    }

    @Nested
    @DisplayName("loading files")
    class Loading {

        @TempDir
        Path dir;

        @Test
        void readsYamlSchema() throws Exception {
            Path file = dir.resolve("person.yaml");
            Files.writeString(file, """
                    type: object
                    required: [name]
                    properties:
                      name:
                        type: string
                    """);

            ObjectSchema object = (ObjectSchema) JsonSchemaReader.read(file);

            assertThat(object.requiredNames()).containsExactly("name");
        }

        @Test
        void readsJsonSchema() throws Exception {
            Path file = dir.resolve("flag.json");
            Files.writeString(file, "{\"type\": \"boolean\"}");

            assertThat(JsonSchemaReader.read(file).kind()).isEqualTo(SchemaKind.BOOLEAN);
        }

        @Test
        void missingFileIsReported() {
            assertThatThrownBy(() -> JsonSchemaReader.read(dir.resolve("absent.json")))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("Schema file not found");
        }

        @Test
        void malformedFileIsReported() throws Exception {
            Path file = dir.resolve("broken.json");
            Files.writeString(file, "{\"type\": ");

            assertThatThrownBy(() -> JsonSchemaReader.read(file))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("Failed to parse schema file")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void nonObjectSchemaIsRejected() throws Exception {
            JsonNode text = JSON.readTree("\"string\"");

            assertThatThrownBy(() -> JsonSchemaReader.read(text))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("must be an object or boolean");
        }
    }
}
