package io.waypost.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.waypost.core.error.MissingHeaderException;
import io.waypost.core.spi.TransportResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResponseBuilder")
class ResponseBuilderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("fresh builder: 200, empty text body")
    void defaults() {
        ResponseBuilder res = ResponseBuilder.create();

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.body()).isEmpty();
        assertThat(res.contentType()).isEqualTo(ResponseContentType.TEXT);
    }

    @Test
    @DisplayName("mutators return a new instance and leave the receiver unchanged")
    void valueSemantics() {
        ResponseBuilder base = ResponseBuilder.create();

        ResponseBuilder changed = base.status(201).text("made").header("X-A", "1");

        assertThat(base.statusCode()).isEqualTo(200);
        assertThat(base.bodyAsString()).isEmpty();
        assertThat(base.headers()).isEmpty();
        assertThat(changed.statusCode()).isEqualTo(201);
        assertThat(changed.bodyAsString()).isEqualTo("made");
    }

    @Test
    @DisplayName("json serializes with Jackson and sets the JSON content type")
    void jsonBody() throws Exception {
        ResponseBuilder res = ResponseBuilder.create().json(Map.of("ok", true));

        JsonNode body = MAPPER.readTree(res.body());
        assertThat(body.get("ok").asBoolean()).isTrue();
        assertThat(res.contentType().value()).isEqualTo("application/json");
    }

    @Test
    @DisplayName("the last of json/text decides body and content type")
    void lastBodyWins() {
        assertThat(ResponseBuilder.create().json(Map.of("a", 1)).text("plain").contentType())
                .isEqualTo(ResponseContentType.TEXT);
        assertThat(ResponseBuilder.create().text("plain").json(Map.of("a", 1)).contentType())
                .isEqualTo(ResponseContentType.JSON);
    }

    @Test
    @DisplayName("unserializable value → IllegalArgumentException")
    void unserializable() {
        Object selfReferencing = new Object() {
            @SuppressWarnings("unused")
            public Object getSelf() {
                return this;
            }
        };

        assertThatThrownBy(() -> ResponseBuilder.create().json(selfReferencing))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("status shortcuts")
    void statusShortcuts() {
        ResponseBuilder res = ResponseBuilder.create();

        assertThat(res.badRequest().statusCode()).isEqualTo(400);
        assertThat(res.notFound().statusCode()).isEqualTo(404);
        assertThat(res.internalServerError().statusCode()).isEqualTo(500);
        assertThat(res.notFound().ok().statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("redirect sets 302 and Location")
    void redirect() {
        ResponseBuilder res = ResponseBuilder.create().redirect("/login");

        assertThat(res.statusCode()).isEqualTo(302);
        assertThat(res.getHeader("location")).isEqualTo("/login");
    }

    @Test
    @DisplayName("getHeader on an unset name → MissingHeaderException")
    void missingHeader() {
        assertThatThrownBy(() -> ResponseBuilder.create().getHeader("X-Nope"))
                .isInstanceOfSatisfying(
                        MissingHeaderException.class, e -> assertThat(e.getMessage()).contains("X-Nope"));
    }

    @Test
    @DisplayName("clearCookie removes a pending cookie and records the clear")
    void cookies() {
        ResponseBuilder res = ResponseBuilder.create()
                .cookie("session", "abc")
                .cookie("lang", "en")
                .clearCookie("session");

        assertThat(res.cookies()).containsOnly(Map.entry("lang", "en"));
        assertThat(res.clearedCookies()).containsExactly("session");

        ResponseBuilder reset = res.cookie("session", "new");
        assertThat(reset.clearedCookies()).isEmpty();
    }

    @Test
    @DisplayName("problem sets status, problem+json type and the RFC 9457 fields")
    void problem() throws Exception {
        ResponseBuilder res =
                ResponseBuilder.create().problem(ProblemDetail.notFound("No route for GET /x", "/x"));

        assertThat(res.statusCode()).isEqualTo(404);
        assertThat(res.contentType().value()).isEqualTo("application/problem+json");
        JsonNode body = MAPPER.readTree(res.bodyAsString());
        assertThat(body.get("type").asText()).isEqualTo("urn:waypost:route:not-found");
        assertThat(body.get("title").asText()).isEqualTo("Not Found");
        assertThat(body.get("status").asInt()).isEqualTo(404);
        assertThat(body.get("instance").asText()).isEqualTo("/x");
    }

    @Test
    @DisplayName("toTransport copies every field")
    void toTransport() {
        TransportResponse out = ResponseBuilder.create()
                .status(418)
                .text("teapot")
                .header("X-Brew", "earl-grey")
                .cookie("c", "1")
                .clearCookie("old")
                .toTransport();

        assertThat(out.status()).isEqualTo(418);
        assertThat(out.contentType()).isEqualTo("text/plain");
        assertThat(new String(out.body(), StandardCharsets.UTF_8)).isEqualTo("teapot");
        assertThat(out.headers()).containsEntry("X-Brew", "earl-grey");
        assertThat(out.cookies()).containsEntry("c", "1");
        assertThat(out.clearedCookies()).containsExactly("old");
    }

    @Test
    @DisplayName("null header or cookie value → NullPointerException naming it")
    void nullValuesRejected() {
        ResponseBuilder response = ResponseBuilder.create();

        assertThatThrownBy(() -> response.header("X-Trace", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("X-Trace");
        assertThatThrownBy(() -> response.cookie("sid", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("sid");
    }

    @Test
    @DisplayName("equality compares body bytes")
    void equality() {
        assertThat(ResponseBuilder.create().text("a")).isEqualTo(ResponseBuilder.create().text("a"));
        assertThat(ResponseBuilder.create().text("a")).isNotEqualTo(ResponseBuilder.create().text("b"));
    }
}
