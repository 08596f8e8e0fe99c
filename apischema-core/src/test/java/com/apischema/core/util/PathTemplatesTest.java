package com.apischema.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PathTemplates} and {@link Docs}.
 */
class PathTemplatesTest {

    @Test
    void variables_returnsNamesInOrder() {
        assertThat(PathTemplates.variables("/api/{version}/users/{id}/posts/{slug}/"))
            .containsExactly("version", "id", "slug");
    }

    @Test
    void isWellFormed_detectsUnbalancedAndNestedBraces() {
        assertThat(PathTemplates.isWellFormed("/users/{id}/")).isTrue();
        assertThat(PathTemplates.isWellFormed("/users/{id/")).isFalse();
        assertThat(PathTemplates.isWellFormed("/users/id}/")).isFalse();
        assertThat(PathTemplates.isWellFormed("/users/{{id}}/")).isFalse();
    }

    @Test
    void keySegments_dropsEmptySegmentsAndVersion() {
        assertThat(PathTemplates.keySegments("/api/{version}/users/{id}/"))
            .containsExactly("api", "users", "{id}");
    }

    @Test
    void strippablePrefix_keepsTopmostSharedResource() {
        assertThat(PathTemplates.strippablePrefix(List.of("/a/b/{id}", "/a/c"))).isEmpty();
        assertThat(PathTemplates.strippablePrefix(List.of("/api/users/", "/api/users/{id}/")))
            .containsExactly("api");
        assertThat(PathTemplates.strippablePrefix(List.of("/users/", "/groups/"))).isEmpty();
        assertThat(PathTemplates.strippablePrefix(List.of("/{tenant}/users/"))).isEmpty();
    }

    @Test
    void normalize_stripsEveryLine() {
        assertThat(Docs.normalize("\n    First line.\n      Second line.  \n")).isEqualTo("First line.\nSecond line.");
        assertThat(Docs.normalize(null)).isEmpty();
        assertThat(Docs.normalize("   ")).isEmpty();
    }
}
