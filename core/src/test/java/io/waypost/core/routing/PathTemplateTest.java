package io.waypost.core.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("PathTemplate")
class PathTemplateTest {

    @Test
    @DisplayName("literal template matches only the identical string")
    void literal() {
        PathTemplate template = PathTemplate.compile("/users");

        assertThat(template.isLiteral()).isTrue();
        assertThat(template.match("/users")).contains(Map.of());
        assertThat(template.match("/users/")).isEmpty();
        assertThat(template.match("/Users")).isEmpty();
    }

    @Test
    @DisplayName("captures are returned by name")
    void captures() {
        PathTemplate template = PathTemplate.compile("/users/{id}/orders/{orderId}");

        assertThat(template.captureNames()).containsExactly("id", "orderId");
        assertThat(template.match("/users/42/orders/o-7"))
                .contains(Map.of("id", "42", "orderId", "o-7"));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({"/users", "/users/", "/users/42/extra", "/people/42"})
    @DisplayName("non-matching paths")
    void nonMatching(String path) {
        assertThat(PathTemplate.compile("/users/{id}").match(path)).isEmpty();
    }

    @Test
    @DisplayName("empty or repeated capture names are rejected")
    void invalidTemplates() {
        assertThatThrownBy(() -> PathTemplate.compile("/users/{}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PathTemplate.compile("/a/{id}/b/{id}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id");
    }
}
