package com.apischema.core.generator;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.PrimitiveType;
import com.apischema.core.introspect.DefaultFieldSchemaIntrospector;
import com.apischema.core.introspect.DefaultParameterExtractor;
import com.apischema.core.model.SchemaFragment;
import com.apischema.core.model.SchemaType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResponseSchemaComposer}.
 */
class ResponseSchemaComposerTest {

    private final FieldDeriver deriver = new FieldDeriver(new DefaultFieldSchemaIntrospector());
    private final ResponseSchemaComposer composer = new ResponseSchemaComposer(deriver, new DefaultParameterExtractor());

    private final DataShapeDescriptor profile = DataShapeDescriptor.builder("Profile")
        .field(DeclaredField.primitive("bio", PrimitiveType.STRING))
        .field(DeclaredField.primitive("website", PrimitiveType.URL))
        .build();

    @Test
    void compose_nestedAndPrimitive_bothInProperties() {
        DataShapeDescriptor user = DataShapeDescriptor.builder("User")
            .field(DeclaredField.primitive("id", PrimitiveType.INTEGER).asReadOnly().asRequired())
            .field(DeclaredField.nested("profile", profile).withHelpText("Public profile"))
            .build();

        ComposedResponse response = composer.compose(user, "Returns the user.");

        SchemaFragment schema = response.responseSchema().schema();
        assertThat(response.responseSchema().description()).isEqualTo("Returns the user.");
        assertThat(schema.type()).isEqualTo(SchemaType.OBJECT);
        assertThat(schema.properties()).containsOnlyKeys("id", "profile");
        assertThat(schema.required()).containsExactly("id");

        SchemaFragment nested = schema.properties().get("profile");
        assertThat(nested.description()).isEqualTo("Public profile");
        assertThat(nested.properties()).containsOnlyKeys("bio", "website");
        assertThat(nested.properties().get("website").format()).isEqualTo("uri");
    }

    @Test
    void compose_nestedAndFlatWithSameName_nestedWins() {
        DataShapeDescriptor user = DataShapeDescriptor.builder("User")
            .field(DeclaredField.primitive("profile", PrimitiveType.STRING))
            .field(DeclaredField.nested("profile", profile).withHelpText("Public profile"))
            .build();

        SchemaFragment schema = composer.compose(user, null).responseSchema().schema();

        assertThat(schema.properties()).containsOnlyKeys("profile");
        SchemaFragment merged = schema.properties().get("profile");
        assertThat(merged.type()).isEqualTo(SchemaType.OBJECT);
        assertThat(merged.description()).isEqualTo("Public profile");
        assertThat(merged.properties()).containsOnlyKeys("bio", "website");
    }

    @Test
    void compose_onlyNested_yieldsObjectOfNested() {
        DataShapeDescriptor wrapper = DataShapeDescriptor.builder("Wrapper")
            .field(DeclaredField.nested("profile", profile))
            .build();

        SchemaFragment schema = composer.compose(wrapper, null).responseSchema().schema();

        assertThat(schema.type()).isEqualTo(SchemaType.OBJECT);
        assertThat(schema.properties()).containsOnlyKeys("profile");
    }

    @Test
    void compose_nothingDocumentable_yieldsEmptyResponseButKeepsErrors() {
        DataShapeDescriptor empty = DataShapeDescriptor.builder("Deleted")
            .field(DeclaredField.hidden("owner"))
            .errorStatus(404, "Not found")
            .errorStatus(409, "Still referenced")
            .build();

        ComposedResponse response = composer.compose(empty, "Deletes.");

        assertThat(response.responseSchema().isEmpty()).isTrue();
        assertThat(response.errorStatusCodes())
            .containsEntry(404, "Not found")
            .containsEntry(409, "Still referenced");
    }

    @Test
    void compose_emptyNestedDescriptor_fallsBackToIntrospectedObject() {
        DataShapeDescriptor emptyNested = DataShapeDescriptor.builder("Nothing").build();
        DataShapeDescriptor user = DataShapeDescriptor.builder("User")
            .field(DeclaredField.nested("profile", profile))
            .field(DeclaredField.nested("settings", emptyNested))
            .build();

        SchemaFragment schema = composer.compose(user, null).responseSchema().schema();

        assertThat(schema.properties()).containsOnlyKeys("profile", "settings");
        assertThat(schema.properties().get("profile").properties()).containsOnlyKeys("bio", "website");
        assertThat(schema.properties().get("settings").type()).isEqualTo(SchemaType.OBJECT);
    }

    @Test
    void compose_onlyOutermostSchemaCarriesResponseDescription() {
        DataShapeDescriptor user = DataShapeDescriptor.builder("User")
            .field(DeclaredField.nested("profile", profile))
            .build();

        ComposedResponse response = composer.compose(user, "Outer");

        assertThat(response.responseSchema().description()).isEqualTo("Outer");
        assertThat(response.responseSchema().schema().properties().get("profile").description()).isNull();
    }

    @Test
    void compose_listDescriptor_wrapsElementInArray() {
        ComposedResponse response = composer.compose(profile.asList(), null);

        SchemaFragment schema = response.responseSchema().schema();
        assertThat(schema.type()).isEqualTo(SchemaType.ARRAY);
        assertThat(schema.items().properties()).containsOnlyKeys("bio", "website");
    }

    @Test
    void compose_dictField_usesFallbackSchema() {
        DataShapeDescriptor event = DataShapeDescriptor.builder("Event")
            .field(DeclaredField.dict("attributes"))
            .build();

        SchemaFragment schema = composer.compose(event, null).responseSchema().schema();

        assertThat(schema.properties().get("attributes").type()).isEqualTo(SchemaType.OBJECT);
        assertThat(schema.properties().get("attributes").properties()).isEmpty();
    }
}
