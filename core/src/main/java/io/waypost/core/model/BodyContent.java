package io.waypost.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Parsed request body. Exactly one variant exists per request, and its
 * {@link #type()} is always the request's content-type classification.
 */
public sealed interface BodyContent permits BodyContent.Json, BodyContent.Text, BodyContent.Form {

    /** The classification this variant represents. */
    BodyType type();

    /** Returns an empty text body, the default for requests without one. */
    static BodyContent emptyText() {
        return new Text("");
    }

    /** A parsed JSON document. */
    record Json(JsonNode value) implements BodyContent {
        public Json {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public BodyType type() {
            return BodyType.JSON;
        }
    }

    /** A UTF-8 decoded text body. */
    record Text(String value) implements BodyContent {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public BodyType type() {
            return BodyType.TEXT;
        }
    }

    /**
     * A raw {@code key=value&key=value} form body. Splitting into pairs is
     * deferred to {@link RequestContext#formData()}.
     */
    record Form(String raw) implements BodyContent {
        public Form {
            Objects.requireNonNull(raw, "raw must not be null");
        }

        @Override
        public BodyType type() {
            return BodyType.FORM;
        }
    }
}
