package io.evmtrace.statediff;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.util.AccessPattern;

import java.io.IOException;
import java.util.Objects;

/**
 * Describes how a value changed between the pre- and post-state of a transaction. Exactly one of four variants:
 * <ul>
 *     <li>{@link Same}: unchanged, encoded as {@code "="}</li>
 *     <li>{@link Born}: created, encoded as {@code {"+": value}}</li>
 *     <li>{@link Died}: removed, encoded as {@code {"-": value}}</li>
 *     <li>{@link Changed}: replaced, encoded as {@code {"*": {"from": old, "to": new}}}</li>
 * </ul>
 *
 * @param <T> type of the value that changed
 */
@JsonSerialize(using = Diff.Serializer.class)
@JsonDeserialize(using = Diff.Deserializer.class)
public abstract class Diff<T> {
    public enum Kind {
        SAME("="),
        BORN("+"),
        DIED("-"),
        CHANGED("*");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        /**
         * @return the kind for the given tag or null if the tag is not one of the four known tags
         */
        public static Kind fromTag(String tag) {
            for (var kind : values()) {
                if (kind.tag.equals(tag)) {
                    return kind;
                }
            }
            return null;
        }
    }

    private static final Same<?> SAME = new Same<>();

    private Diff() {}

    public abstract Kind getKind();

    @SuppressWarnings("unchecked")
    public static <T> Diff<T> same() {
        return (Diff<T>) SAME;
    }

    public static <T> Diff<T> born(T value) {
        return new Born<>(value);
    }

    public static <T> Diff<T> died(T value) {
        return new Died<>(value);
    }

    public static <T> Diff<T> changed(T from, T to) {
        return new Changed<>(from, to);
    }

    public static final class Same<T> extends Diff<T> {
        private Same() {}

        @Override
        public Kind getKind() {
            return Kind.SAME;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Same;
        }

        @Override
        public int hashCode() {
            return Kind.SAME.hashCode();
        }

        @Override
        public String toString() {
            return "Same";
        }
    }

    public static final class Born<T> extends Diff<T> {
        public final T value;

        private Born(T value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind getKind() {
            return Kind.BORN;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Born)) return false;
            return DiffValues.equal(value, ((Born<?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 * Kind.BORN.hashCode() + DiffValues.hash(value);
        }

        @Override
        public String toString() {
            return String.format("Born{%s}", DiffValues.toString(value));
        }
    }

    public static final class Died<T> extends Diff<T> {
        public final T value;

        private Died(T value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind getKind() {
            return Kind.DIED;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Died)) return false;
            return DiffValues.equal(value, ((Died<?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 * Kind.DIED.hashCode() + DiffValues.hash(value);
        }

        @Override
        public String toString() {
            return String.format("Died{%s}", DiffValues.toString(value));
        }
    }

    public static final class Changed<T> extends Diff<T> {
        public final T from;
        public final T to;

        private Changed(T from, T to) {
            this.from = Objects.requireNonNull(from, "from");
            this.to = Objects.requireNonNull(to, "to");
        }

        @Override
        public Kind getKind() {
            return Kind.CHANGED;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Changed)) return false;
            var other = (Changed<?>) o;
            return DiffValues.equal(from, other.from) && DiffValues.equal(to, other.to);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * Kind.CHANGED.hashCode() + DiffValues.hash(from)) + DiffValues.hash(to);
        }

        @Override
        public String toString() {
            return String.format("Changed{from=%s, to=%s}", DiffValues.toString(from), DiffValues.toString(to));
        }
    }

    public static class Serializer extends JsonSerializer<Diff<?>> {
        @Override
        public void serialize(Diff<?> diff, JsonGenerator jsonGenerator, SerializerProvider serializerProvider)
            throws IOException {
            switch (diff.getKind()) {
                case SAME:
                    jsonGenerator.writeString(Kind.SAME.tag);
                    break;
                case BORN:
                    jsonGenerator.writeStartObject();
                    serializerProvider.defaultSerializeField(Kind.BORN.tag, ((Born<?>) diff).value, jsonGenerator);
                    jsonGenerator.writeEndObject();
                    break;
                case DIED:
                    jsonGenerator.writeStartObject();
                    serializerProvider.defaultSerializeField(Kind.DIED.tag, ((Died<?>) diff).value, jsonGenerator);
                    jsonGenerator.writeEndObject();
                    break;
                case CHANGED:
                    var changed = (Changed<?>) diff;
                    jsonGenerator.writeStartObject();
                    jsonGenerator.writeFieldName(Kind.CHANGED.tag);
                    jsonGenerator.writeStartObject();
                    serializerProvider.defaultSerializeField("from", changed.from, jsonGenerator);
                    serializerProvider.defaultSerializeField("to", changed.to, jsonGenerator);
                    jsonGenerator.writeEndObject();
                    jsonGenerator.writeEndObject();
                    break;
            }
        }
    }

    /**
     * Dispatches strictly on the tag key. The payload type is resolved from the declared {@code Diff<T>} type of
     * the property or map value being deserialized.
     */
    public static class Deserializer extends JsonDeserializer<Diff<?>> implements ContextualDeserializer {
        private final JavaType valueType;
        private final JsonDeserializer<Object> valueDeserializer;

        public Deserializer() {
            this(null, null);
        }

        private Deserializer(JavaType valueType, JsonDeserializer<Object> valueDeserializer) {
            this.valueType = valueType;
            this.valueDeserializer = valueDeserializer;
        }

        @Override
        public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property)
            throws JsonMappingException {
            var diffType = ctxt.getContextualType();
            if (diffType == null && property != null) {
                diffType = property.getType();
            }
            if (diffType == null || diffType.containedType(0) == null) {
                return ctxt.reportBadDefinition(Diff.class, "cannot resolve the value type of Diff");
            }
            var contentType = diffType.containedType(0);
            return new Deserializer(contentType, ctxt.findContextualValueDeserializer(contentType, property));
        }

        @Override
        public Diff<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                var text = p.getText();
                if (Kind.SAME.tag.equals(text)) {
                    return same();
                }
                return ctxt.reportInputMismatch(this, "invalid diff tag \"%s\": only \"=\" may appear without payload", text);
            }
            if (p.currentToken() != JsonToken.START_OBJECT) {
                return (Diff<?>) ctxt.handleUnexpectedToken(Diff.class, p);
            }
            var tag = p.nextFieldName();
            if (tag == null) {
                return ctxt.reportInputMismatch(this, "diff object must contain exactly one tag");
            }
            var kind = Kind.fromTag(tag);
            if (kind == null) {
                return ctxt.reportInputMismatch(this, "unknown diff tag \"%s\"", tag);
            }
            p.nextToken();
            Diff<?> diff;
            try {
                diff = readPayload(kind, p, ctxt);
            } catch (JsonMappingException e) {
                throw JsonMappingException.wrapWithPath(e, Diff.class, tag);
            }
            if (p.nextToken() != JsonToken.END_OBJECT) {
                return ctxt.reportInputMismatch(this, "diff object must contain exactly one tag");
            }
            return diff;
        }

        private Diff<?> readPayload(Kind kind, JsonParser p, DeserializationContext ctxt) throws IOException {
            switch (kind) {
                case SAME:
                    if (p.currentToken() != JsonToken.VALUE_NULL) {
                        return ctxt.reportInputMismatch(this, "diff tag \"=\" does not take a payload");
                    }
                    return same();
                case BORN:
                    return born(readValue(p, ctxt));
                case DIED:
                    return died(readValue(p, ctxt));
                default:
                    return readChanged(p, ctxt);
            }
        }

        private Diff<?> readChanged(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.START_OBJECT) {
                return ctxt.reportInputMismatch(this, "diff tag \"*\" requires an object with \"from\" and \"to\"");
            }
            Object from = null;
            Object to = null;
            String field;
            while ((field = p.nextFieldName()) != null) {
                p.nextToken();
                try {
                    if ("from".equals(field) && from == null) {
                        from = readValue(p, ctxt);
                    } else if ("to".equals(field) && to == null) {
                        to = readValue(p, ctxt);
                    } else {
                        return ctxt.reportInputMismatch(this, "unexpected field \"%s\" in changed diff", field);
                    }
                } catch (JsonMappingException e) {
                    throw JsonMappingException.wrapWithPath(e, Changed.class, field);
                }
            }
            if (from == null) {
                return ctxt.reportInputMismatch(this, "changed diff is missing \"from\"");
            }
            if (to == null) {
                return ctxt.reportInputMismatch(this, "changed diff is missing \"to\"");
            }
            return changed(from, to);
        }

        private Object readValue(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_NULL) {
                return ctxt.reportInputMismatch(this, "diff payload must not be null");
            }
            if (valueDeserializer == null) {
                return ctxt.reportBadDefinition(Diff.class, "Diff deserializer used without a resolved value type");
            }
            return valueDeserializer.deserialize(p, ctxt);
        }

        @Override
        public Diff<?> getNullValue(DeserializationContext ctxt) throws JsonMappingException {
            return ctxt.reportInputMismatch(this, "diff must not be null");
        }

        @Override
        public AccessPattern getNullAccessPattern() {
            return AccessPattern.DYNAMIC;
        }

        @Override
        public Class<?> handledType() {
            return Diff.class;
        }

        @Override
        public String toString() {
            return String.format("Diff.Deserializer{valueType=%s}", valueType);
        }
    }
}
