package com.apischema.core.definition;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.FieldKind;
import com.apischema.core.descriptor.PrimitiveType;
import com.apischema.core.introspect.ModelFieldMetadata;
import com.apischema.core.model.SchemaType;
import com.apischema.core.route.PaginationStyle;
import com.apischema.core.route.Route;
import com.apischema.core.route.RouteHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DefinitionLoader}.
 */
class DefinitionLoaderTest {

    private static final String DEFINITION = """
        descriptors:
          - name: Profile
            fields:
              - { name: bio, kind: primitive, type: string, helpText: "Short biography" }
          - name: User
            documentation: "A registered user."
            errors: { 404: "User not found" }
            fields:
              - { name: id, kind: primitive, type: integer, readOnly: true }
              - { name: username, type: string, required: true, label: "Username" }
              - { name: role, kind: primitive, type: choice, choices: [admin, member] }
              - { name: profile, kind: nested, descriptor: Profile }
              - { name: tags, kind: list, child: { kind: primitive, type: string } }
              - { name: settings, kind: dict }
          - name: UserLegacy
            fields:
              - { name: login, kind: primitive }

        families:
          - name: UserResponse
            documentation: "The user as clients see it."
            versions:
              - { when: ">1.3, <=1.6", descriptor: UserLegacy }
              - { when: ">1.6", descriptor: User }

        models:
          - name: user
            fields:
              - { name: id, primaryKey: true, autoIncrement: true, verboseName: "ID" }

        paginations:
          - { name: pages, style: page_number }
          - { name: default, defaultStrategy: pages }

        handlers:
          - name: UserViewSet
            description: "Users of the platform."
            serializer: User
            response: UserResponse
            pagination: default
            model: user
            requiredPermissions: [users.view]
            filters:
              - { name: search, description: "Search term" }
              - { name: active, type: boolean }
          - name: Internal
            excludeFromSchema: true

        routes:
          - { path: "/api/{version}/users/", method: get, handler: UserViewSet, action: list }
          - { path: "/api/{version}/users/{pk}/", method: GET, handler: UserViewSet, action: retrieve }
          - { path: "/internal/", method: GET, handler: Internal }
        """;

    @TempDir
    Path tempDir;

    @Test
    void load_validFile_linksEverything() throws IOException {
        Path file = tempDir.resolve("api.yaml");
        Files.writeString(file, DEFINITION);

        ApiDefinition definition = DefinitionLoader.load(file);

        assertThat(definition.routes()).hasSize(3);
        assertThat(definition.shapes()).containsOnlyKeys("Profile", "User", "UserLegacy", "UserResponse");

        Route list = definition.routes().get(0);
        assertThat(list.method()).isEqualTo("GET");
        RouteHandler handler = list.handler();
        assertThat(handler.action()).isEqualTo("list");
        assertThat(handler.requiredPermissions()).containsExactly("users.view");
        assertThat(handler.response().isVersioned()).isTrue();
        assertThat(handler.pagination().defaultStrategy().style()).isEqualTo(PaginationStyle.PAGE_NUMBER);
        assertThat(handler.filterFields()).hasSize(2);
        assertThat(handler.filterFields().get(0).schema().type()).isEqualTo(SchemaType.STRING);
        assertThat(handler.filterFields().get(1).schema().type()).isEqualTo(SchemaType.BOOLEAN);
        assertThat(definition.routes().get(2).handler().excludeFromSchema()).isTrue();
    }

    @Test
    void read_descriptorFields_areTyped() {
        ApiDefinition definition = DefinitionLoader.read(DEFINITION);

        DataShapeDescriptor user = definition.shape("User").orElseThrow().resolve("1.0");
        assertThat(user.documentation()).isEqualTo("A registered user.");
        assertThat(user.errorStatusCodes()).containsEntry(404, "User not found");
        assertThat(user.fields()).extracting(field -> field.kind()).containsExactly(
            FieldKind.PRIMITIVE, FieldKind.PRIMITIVE, FieldKind.PRIMITIVE, FieldKind.NESTED, FieldKind.LIST, FieldKind.DICT);
        assertThat(user.fields().get(0).readOnly()).isTrue();
        assertThat(user.fields().get(1).required()).isTrue();
        assertThat(user.fields().get(1).label()).isEqualTo("Username");
        assertThat(user.fields().get(2).primitiveType()).isEqualTo(PrimitiveType.CHOICE);
        assertThat(user.fields().get(2).choices()).containsExactly("admin", "member");
        assertThat(user.fields().get(3).nested().name()).isEqualTo("Profile");
        assertThat(user.fields().get(4).child().primitiveType()).isEqualTo(PrimitiveType.STRING);
    }

    @Test
    void read_family_resolvesByVersion() {
        ApiDefinition definition = DefinitionLoader.read(DEFINITION);

        assertThat(definition.shape("UserResponse").orElseThrow().resolve("1.5").name()).isEqualTo("UserLegacy");
        assertThat(definition.shape("UserResponse").orElseThrow().resolve("1.7").name()).isEqualTo("User");
        assertThat(definition.shape("Missing")).isEmpty();
    }

    @Test
    void read_models_provideMetadata() {
        ApiDefinition definition = DefinitionLoader.read(DEFINITION);

        assertThat(definition.models().lookup("user", "id"))
            .contains(new ModelFieldMetadata("user", "ID", null, true, true));
        assertThat(definition.models().lookup("user", "email")).isEmpty();
        assertThat(definition.models().lookup("group", "id")).isEmpty();
    }

    @Test
    void read_cyclicNesting_throwsCyclicDescriptorException() {
        String cyclic = """
            descriptors:
              - name: Node
                fields:
                  - { name: parent, kind: nested, descriptor: Tree }
              - name: Tree
                fields:
                  - { name: root, kind: nested, descriptor: Node }
            """;

        assertThatThrownBy(() -> DefinitionLoader.read(cyclic))
            .isInstanceOf(CyclicDescriptorException.class)
            .hasMessageContaining("Node -> Tree -> Node")
            .satisfies(e -> assertThat(((CyclicDescriptorException) e).cycle()).containsExactly("Node", "Tree", "Node"));
    }

    @Test
    void read_selfNesting_throwsCyclicDescriptorException() {
        String selfNested = """
            descriptors:
              - name: Category
                fields:
                  - { name: parent, kind: nested, descriptor: Category }
            """;

        assertThatThrownBy(() -> DefinitionLoader.read(selfNested))
            .isInstanceOf(CyclicDescriptorException.class);
    }

    @Test
    void read_unknownDescriptorReference_throwsDefinitionException() {
        String definition = """
            handlers:
              - { name: Users, serializer: Missing }
            routes:
              - { path: "/users/", method: GET, handler: Users }
            """;

        assertThatThrownBy(() -> DefinitionLoader.read(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("Missing");
    }

    @Test
    void read_unknownFieldKind_throwsDefinitionException() {
        String definition = """
            descriptors:
              - name: Odd
                fields:
                  - { name: blob, kind: binary }
            """;

        assertThatThrownBy(() -> DefinitionLoader.read(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("binary");
    }

    @Test
    void read_unknownHandler_throwsDefinitionException() {
        String definition = """
            routes:
              - { path: "/users/", method: GET, handler: Nobody }
            """;

        assertThatThrownBy(() -> DefinitionLoader.read(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("Nobody");
    }

    @Test
    void read_malformedConstraint_throwsDefinitionException() {
        String definition = """
            descriptors:
              - name: A
            families:
              - name: F
                versions:
                  - { when: ">one", descriptor: A }
            """;

        assertThatThrownBy(() -> DefinitionLoader.read(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining(">one");
    }

    @Test
    void load_missingFile_throwsDefinitionException() {
        assertThatThrownBy(() -> DefinitionLoader.load(tempDir.resolve("missing.yaml")))
            .isInstanceOf(DefinitionException.class);
    }

    @Test
    void read_emptyDocument_yieldsEmptyDefinition() {
        ApiDefinition definition = DefinitionLoader.read("{}");

        assertThat(definition.routes()).isEmpty();
        assertThat(definition.shapes()).isEmpty();
    }
}
