package com.apischema.core.generator;

import com.apischema.core.config.SchemaConfig.GenerationSettings;
import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.PrimitiveType;
import com.apischema.core.introspect.ModelFieldMetadata;
import com.apischema.core.introspect.ModelMetadataProvider;
import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.model.Link;
import com.apischema.core.model.SchemaFragment;
import com.apischema.core.model.SchemaType;
import com.apischema.core.route.PaginationStrategy;
import com.apischema.core.route.PaginationStyle;
import com.apischema.core.route.Route;
import com.apischema.core.route.RouteHandler;
import com.apischema.core.version.NoMatchingVersionException;
import com.apischema.core.version.VersionMap;
import com.apischema.core.version.VersionedShape;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LinkCompiler}.
 */
class LinkCompilerTest {

    private static final DataShapeDescriptor USER = DataShapeDescriptor.builder("User")
        .field(DeclaredField.primitive("id", PrimitiveType.INTEGER).asReadOnly())
        .field(DeclaredField.primitive("username", PrimitiveType.STRING).asRequired())
        .errorStatus(404, "No such user")
        .build();

    private static final DataShapeDescriptor USER_LEGACY = DataShapeDescriptor.builder("UserLegacy")
        .documentation("  Legacy user shape.\n    Kept for old clients.  ")
        .field(DeclaredField.primitive("login", PrimitiveType.STRING))
        .build();

    private static final VersionedShape USER_RESPONSE = new VersionedShape(
        "UserResponse",
        "The user as seen by clients.",
        VersionMap.builder()
            .when(">1.3, <=1.6", USER_LEGACY)
            .when(">1.6", USER)
            .build());

    private static final ModelMetadataProvider MODELS = (model, field) -> {
        if ("user".equals(model) && "id".equals(field)) {
            return Optional.of(new ModelFieldMetadata("user", "ID", null, true, true));
        }
        if ("user".equals(model) && "uuid".equals(field)) {
            return Optional.of(new ModelFieldMetadata("user", "UUID", null, true, false));
        }
        if ("user".equals(model) && "team".equals(field)) {
            return Optional.of(new ModelFieldMetadata("user", "Team", "Team the user belongs to", false, false));
        }
        return Optional.empty();
    };

    private final LinkCompiler compiler = new LinkCompiler(GenerationSettings.defaults(), MODELS);

    @Test
    void compile_pathVariables_becomeRequiredPathFieldsExceptVersion() {
        Route route = new Route("/api/{version}/users/{id}/", "GET",
            RouteHandler.builder("UserViewSet").action("retrieve").serializer(USER).model("user").build());

        Link link = compiler.compile(route, "1.7");

        FieldDescriptor id = link.fields().get(0);
        assertThat(link.fields()).extracting(FieldDescriptor::name).containsExactly("id", "username");
        assertThat(link.fields().get(1).location()).isEqualTo(FieldLocation.QUERY);
        assertThat(id.location()).isEqualTo(FieldLocation.PATH);
        assertThat(id.required()).isTrue();
        assertThat(id.schema().type()).isEqualTo(SchemaType.INTEGER);
        assertThat(id.schema().title()).isEqualTo("ID");
        assertThat(id.schema().description()).isEqualTo("A unique integer value identifying this user.");
    }

    @Test
    void compile_nonIncrementingPrimaryKey_isStringWithGenericDescription() {
        Route route = new Route("/users/{uuid}/", "DELETE",
            RouteHandler.builder("UserViewSet").action("destroy").model("user").build());

        SchemaFragment schema = compiler.compile(route, "1.0").fields().get(0).schema();

        assertThat(schema.type()).isEqualTo(SchemaType.STRING);
        assertThat(schema.description()).isEqualTo("A unique value identifying this user.");
    }

    @Test
    void compile_modelHelpText_describesPathField() {
        Route route = new Route("/users/{team}/", "GET",
            RouteHandler.builder("TeamUsers").model("user").build());

        SchemaFragment schema = compiler.compile(route, "1.0").fields().get(0).schema();

        assertThat(schema.description()).isEqualTo("Team the user belongs to");
        assertThat(schema.title()).isEqualTo("Team");
    }

    @Test
    void compile_lookupPattern_winsOverIntegerInference() {
        Route route = new Route("/users/{id}/", "GET",
            RouteHandler.builder("UserViewSet").action("retrieve").model("user").lookup("id", "[0-9a-f]{8}").build());

        SchemaFragment schema = compiler.compile(route, "1.0").fields().get(0).schema();

        assertThat(schema.type()).isEqualTo(SchemaType.STRING);
        assertThat(schema.pattern()).isEqualTo("[0-9a-f]{8}");
    }

    @Test
    void compile_invalidLookupPattern_throwsLinkCompilationException() {
        Route route = new Route("/users/{id}/", "GET",
            RouteHandler.builder("UserViewSet").lookup("id", "[a-").build());

        assertThatThrownBy(() -> compiler.compile(route, "1.0"))
            .isInstanceOf(LinkCompilationException.class)
            .hasMessageContaining("UserViewSet");
    }

    @Test
    void compile_malformedPath_throwsLinkCompilationException() {
        Route route = new Route("/users/{id/", "GET", RouteHandler.builder("Broken").build());

        assertThatThrownBy(() -> compiler.compile(route, "1.0"))
            .isInstanceOf(LinkCompilationException.class)
            .hasMessageContaining("/users/{id/");
    }

    @Test
    void compile_versionPlaceholder_isSubstitutedInUrl() {
        Route route = new Route("/api/{version}/users/", "get", RouteHandler.builder("Users").build());

        Link link = compiler.compile(route, "1.7");

        assertThat(link.url()).isEqualTo("/api/1.7/users/");
        assertThat(link.action()).isEqualTo("get");
    }

    @Test
    void compile_createWithSerializer_formFieldsAndDefaultEncoding() {
        Route route = new Route("/users/", "POST",
            RouteHandler.builder("UserViewSet").action("create").serializer(USER).build());

        Link link = compiler.compile(route, "1.7");

        assertThat(link.fields()).extracting(FieldDescriptor::name).containsExactly("username");
        assertThat(link.fields().get(0).location()).isEqualTo(FieldLocation.FORM);
        assertThat(link.encoding()).isEqualTo("application/json");
        assertThat(link.responseSchema().isEmpty()).isTrue();
    }

    @Test
    void compile_declaredParser_setsEncoding() {
        Route route = new Route("/uploads/", "POST",
            RouteHandler.builder("Uploads").serializer(USER)
                .parserMediaType("multipart/form-data")
                .parserMediaType("application/json")
                .build());

        assertThat(compiler.compile(route, "1.7").encoding()).isEqualTo("multipart/form-data");
    }

    @Test
    void compile_queryOnlyFields_haveNoEncoding() {
        Route route = new Route("/users/", "GET",
            RouteHandler.builder("UserViewSet").action("list").serializer(USER).build());

        assertThat(compiler.compile(route, "1.7").encoding()).isNull();
    }

    @Test
    void compile_listAction_addsPaginationFieldsAndWrapsResponse() {
        Route route = new Route("/users/", "GET",
            RouteHandler.builder("UserViewSet")
                .action("list")
                .serializer(USER)
                .pagination(PaginationStrategy.of("pages", PaginationStyle.PAGE_NUMBER))
                .build());

        Link link = compiler.compile(route, "1.7");

        assertThat(link.fields()).extracting(FieldDescriptor::name).containsExactly("username", "page");
        SchemaFragment schema = link.responseSchema().schema();
        assertThat(schema.properties()).containsOnlyKeys("results", "count", "next", "previous");
        assertThat(schema.properties().get("results").type()).isEqualTo(SchemaType.ARRAY);
        assertThat(schema.properties().get("results").items().properties()).containsOnlyKeys("id", "username");
        assertThat(link.errorStatusCodes()).containsEntry(404, "No such user");
    }

    @Test
    void compile_retrieveAction_usesSerializerAsResponse() {
        Route route = new Route("/users/{id}/", "GET",
            RouteHandler.builder("UserViewSet").action("retrieve").serializer(USER).description("Fetch one user.").build());

        Link link = compiler.compile(route, "1.7");

        assertThat(link.responseSchema().schema().properties()).containsOnlyKeys("id", "username");
        assertThat(link.responseSchema().description()).isEqualTo("Fetch one user.");
    }

    @Test
    void compile_listItems_matchRetrieveSchema() {
        DataShapeDescriptor project = DataShapeDescriptor.builder("Project")
            .field(DeclaredField.primitive("name", PrimitiveType.STRING).asRequired())
            .field(DeclaredField.hidden("owner"))
            .field(DeclaredField.dict("extra"))
            .build();
        Route list = new Route("/projects/", "GET",
            RouteHandler.builder("ProjectViewSet").action("list").serializer(project).build());
        Route retrieve = new Route("/projects/{id}/", "GET",
            RouteHandler.builder("ProjectViewSet").action("retrieve").serializer(project).build());

        SchemaFragment item = compiler.compile(list, "1.0").responseSchema().schema().properties().get("results").items();
        SchemaFragment single = compiler.compile(retrieve, "1.0").responseSchema().schema();

        assertThat(item.properties()).containsOnlyKeys("name", "extra");
        assertThat(item.properties().get("extra").type()).isEqualTo(SchemaType.OBJECT);
        assertThat(item).isEqualTo(single);
    }

    @Test
    void compile_plainGetCollection_isListView() {
        PaginationStrategy cursor = PaginationStrategy.of("cursor", PaginationStyle.CURSOR);
        Route collection = new Route("/events/", "GET", RouteHandler.builder("Events").pagination(cursor).build());
        Route item = new Route("/events/{id}/", "GET", RouteHandler.builder("Event").pagination(cursor).build());

        assertThat(compiler.compile(collection, "1.0").fields()).extracting(FieldDescriptor::name).containsExactly("cursor");
        assertThat(compiler.compile(item, "1.0").fields()).extracting(FieldDescriptor::name).containsExactly("id");
    }

    @Test
    void compile_filterFields_onlyForFilterableActionsAndMethods() {
        FieldDescriptor search = new FieldDescriptor("search", FieldLocation.QUERY, false, SchemaFragment.string(), "Search term");

        Route list = new Route("/users/", "GET",
            RouteHandler.builder("UserViewSet").action("list").filterField(search).build());
        Route create = new Route("/users/", "POST",
            RouteHandler.builder("UserViewSet").action("create").filterField(search).build());
        Route plainDelete = new Route("/users/{id}/", "DELETE",
            RouteHandler.builder("UserView").filterField(search).build());
        Route plainPost = new Route("/users/", "POST",
            RouteHandler.builder("UserView").filterField(search).build());

        assertThat(compiler.compile(list, "1.0").fields()).extracting(FieldDescriptor::name).contains("search");
        assertThat(compiler.compile(create, "1.0").fields()).extracting(FieldDescriptor::name).doesNotContain("search");
        assertThat(compiler.compile(plainDelete, "1.0").fields()).extracting(FieldDescriptor::name).contains("search");
        assertThat(compiler.compile(plainPost, "1.0").fields()).extracting(FieldDescriptor::name).doesNotContain("search");
    }

    @Test
    void compile_versionedResponse_selectsDescriptorAndAugmentsDescription() {
        Route route = new Route("/me/", "GET",
            RouteHandler.builder("MeView")
                .description("\n    Returns the current user.\n    Requires login.\n")
                .response(USER_RESPONSE)
                .build());

        Link legacy = compiler.compile(route, "1.5");

        assertThat(legacy.description()).isEqualTo(
            "Returns the current user.\nRequires login."
                + "\n\n**Response Description:**\nLegacy user shape.\nKept for old clients.");
        assertThat(legacy.responseSchema().schema().properties()).containsOnlyKeys("login");
        assertThat(legacy.responseSchema().description()).isEqualTo("Returns the current user.\nRequires login.");
    }

    @Test
    void compile_undocumentedResolvedDescriptor_fallsBackToFamilyDocumentation() {
        Route route = new Route("/me/", "GET",
            RouteHandler.builder("MeView").description("Me.").response(USER_RESPONSE).build());

        Link current = compiler.compile(route, "1.7");

        assertThat(current.description())
            .isEqualTo("Me.\n\n**Response Description:**\nThe user as seen by clients.");
        assertThat(current.responseSchema().schema().properties()).containsOnlyKeys("id", "username");
    }

    @Test
    void compile_versionedRequest_addsRequestDescription() {
        VersionedShape request = new VersionedShape("UserUpdate", "Fields a user may change.",
            VersionMap.builder().when(">=1.0", USER).build());
        Route route = new Route("/me/", "PATCH",
            RouteHandler.builder("MeView").description("Update me.").request(request).build());

        Link link = compiler.compile(route, "1.7");

        assertThat(link.description()).isEqualTo("Update me.\n\n**Request Description:**\nFields a user may change.");
        assertThat(link.fields()).extracting(FieldDescriptor::required).containsOnly(false);
    }

    @Test
    void compile_plainResponseDescriptor_addsNoHeading() {
        Route route = new Route("/me/", "GET",
            RouteHandler.builder("MeView").description("Me.").response(USER).build());

        assertThat(compiler.compile(route, "1.7").description()).isEqualTo("Me.");
    }

    @Test
    void compile_versionWithoutMatch_propagates() {
        Route route = new Route("/me/", "GET", RouteHandler.builder("MeView").response(USER_RESPONSE).build());

        assertThatThrownBy(() -> compiler.compile(route, "1.0"))
            .isInstanceOf(NoMatchingVersionException.class);
    }
}
