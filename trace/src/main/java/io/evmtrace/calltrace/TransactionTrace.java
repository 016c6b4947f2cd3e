package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One node of a call tree. Call trees are transmitted as a flat list in traversal order; the position of a node
 * is given by its trace address, i.e. the child indices on the path from the root: {@code []} is the root,
 * {@code [0, 1]} is the second child of the first child of the root.
 * <p>
 * A trace carries a result if the action succeeded, an error if it failed, or neither while it is pending.
 */
@JsonSerialize(using = TransactionTrace.Serializer.class)
@JsonDeserialize(using = TransactionTrace.Deserializer.class)
public class TransactionTrace {
    /**
     * Deserialization attribute holding the {@link OutcomePolicy} to apply.
     */
    public static final String OUTCOME_POLICY_ATTRIBUTE = "evmtrace.outcomePolicy";

    public final List<Integer> traceAddress;
    public final int subtraces;
    public final Action action;
    public final ActionType actionType;
    public final TraceResult result;
    public final String error;

    public TransactionTrace(
        List<Integer> traceAddress, int subtraces, Action action, TraceResult result, String error
    ) {
        Objects.requireNonNull(traceAddress, "traceAddress");
        for (var index : traceAddress) {
            if (index == null || index < 0) {
                throw new IllegalArgumentException("trace address entries must be non-negative: " + traceAddress);
            }
        }
        if (subtraces < 0) {
            throw new IllegalArgumentException("subtraces must be non-negative: " + subtraces);
        }
        this.traceAddress = Collections.unmodifiableList(new ArrayList<>(traceAddress));
        this.subtraces = subtraces;
        this.action = Objects.requireNonNull(action, "action");
        this.actionType = action.getType();
        if (result != null && !Objects.equals(TraceResult.classOf(actionType), result.getClass())) {
            throw new IllegalArgumentException(String.format(
                "%s is not a valid result of a %s action", result.getClass().getSimpleName(), actionType.getTag()));
        }
        this.result = result;
        this.error = error;
    }

    public static TransactionTrace success(List<Integer> traceAddress, int subtraces, Action action, TraceResult result) {
        return new TransactionTrace(traceAddress, subtraces, action, Objects.requireNonNull(result, "result"), null);
    }

    public static TransactionTrace failure(List<Integer> traceAddress, int subtraces, Action action, String error) {
        return new TransactionTrace(traceAddress, subtraces, action, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isPending() {
        return result == null && error == null;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * @return number of ancestors of this node, 0 for the root
     */
    public int depth() {
        return traceAddress.size();
    }

    /**
     * @return true if this node is a direct child of the given node
     */
    public boolean isChildOf(TransactionTrace parent) {
        var parentAddress = parent.traceAddress;
        return traceAddress.size() == parentAddress.size() + 1 &&
            traceAddress.subList(0, parentAddress.size()).equals(parentAddress);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionTrace that = (TransactionTrace) o;
        return subtraces == that.subtraces &&
            traceAddress.equals(that.traceAddress) &&
            action.equals(that.action) &&
            Objects.equals(result, that.result) &&
            Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traceAddress, subtraces, action, result, error);
    }

    @Override
    public String toString() {
        return String.format(
            "TransactionTrace{traceAddress=%s, subtraces=%d, type=%s, action=%s, result=%s, error=%s}",
            traceAddress, subtraces, actionType.getTag(), action, result, error);
    }

    public static class Serializer extends JsonSerializer<TransactionTrace> {
        @Override
        public void serialize(TransactionTrace trace, JsonGenerator jsonGenerator, SerializerProvider provider)
            throws IOException {
            if (trace.result != null && trace.error != null) {
                throw JsonMappingException.from(provider, String.format(
                    "trace %s carries both a result and an error", trace.traceAddress));
            }
            var explicitNulls = provider.getConfig().getDefaultPropertyInclusion().getValueInclusion() ==
                JsonInclude.Include.ALWAYS;
            jsonGenerator.writeStartObject();
            provider.defaultSerializeField("action", trace.action, jsonGenerator);
            if (trace.error != null) {
                jsonGenerator.writeStringField("error", trace.error);
            } else if (explicitNulls) {
                jsonGenerator.writeNullField("error");
            }
            if (trace.result != null) {
                provider.defaultSerializeField("result", trace.result, jsonGenerator);
            } else if (explicitNulls) {
                jsonGenerator.writeNullField("result");
            }
            provider.defaultSerializeField("subtraces", trace.subtraces, jsonGenerator);
            provider.defaultSerializeField("traceAddress", trace.traceAddress, jsonGenerator);
            jsonGenerator.writeStringField("type", trace.actionType.getTag());
            jsonGenerator.writeEndObject();
        }
    }

    /**
     * Selects the action and result classes from the {@code type} field. Unknown fields are ignored.
     */
    public static class Deserializer extends JsonDeserializer<TransactionTrace> {
        private static final Logger logger = LogManager.getLogger();

        @Override
        public TransactionTrace deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.START_OBJECT) {
                return (TransactionTrace) ctxt.handleUnexpectedToken(TransactionTrace.class, p);
            }
            JsonNode node = ctxt.readTree(p);

            var typeNode = required(p, node, "type");
            if (!typeNode.isTextual()) {
                throw fieldError(p, "type", "action type must be a string");
            }
            ActionType type;
            try {
                type = ActionType.fromTag(typeNode.textValue());
            } catch (IllegalArgumentException e) {
                throw fieldError(p, "type", e.getMessage());
            }

            List<Integer> traceAddress = read(ctxt, required(p, node, "traceAddress"), "traceAddress",
                ctxt.getTypeFactory().constructCollectionType(List.class, Integer.class));
            Integer subtraces = read(ctxt, required(p, node, "subtraces"), "subtraces",
                ctxt.constructType(Integer.class));
            Action action = read(ctxt, required(p, node, "action"), "action",
                ctxt.constructType(Action.classOf(type)));

            TraceResult result = null;
            var resultNode = node.get("result");
            if (resultNode != null && !resultNode.isNull()) {
                var resultClass = TraceResult.classOf(type);
                if (resultClass == null) {
                    throw fieldError(p, "result", String.format("a %s action has no result", type.getTag()));
                }
                result = read(ctxt, resultNode, "result", ctxt.constructType(resultClass));
            }

            String error = null;
            var errorNode = node.get("error");
            if (errorNode != null && !errorNode.isNull()) {
                if (!errorNode.isTextual()) {
                    throw fieldError(p, "error", "error must be a string");
                }
                error = errorNode.textValue();
            }

            if (result != null && error != null) {
                var policy = (OutcomePolicy) ctxt.getAttribute(OUTCOME_POLICY_ATTRIBUTE);
                if (policy != OutcomePolicy.LENIENT) {
                    return ctxt.reportInputMismatch(this, "trace %s carries both a result and an error", traceAddress);
                }
                logger.warn("trace {} carries both a result and an error, dropping the result: {}", traceAddress, error);
                result = null;
            }

            try {
                return new TransactionTrace(traceAddress, subtraces, action, result, error);
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(this, e.getMessage());
            }
        }

        private JsonNode required(JsonParser p, JsonNode node, String field) throws JsonMappingException {
            var value = node.get(field);
            if (value == null || value.isNull()) {
                throw fieldError(p, field, String.format("missing required field \"%s\"", field));
            }
            return value;
        }

        private <T> T read(DeserializationContext ctxt, JsonNode node, String field, JavaType type)
            throws IOException {
            try {
                return ctxt.readTreeAsValue(node, type);
            } catch (JsonMappingException e) {
                throw JsonMappingException.wrapWithPath(e, TransactionTrace.class, field);
            }
        }

        private static JsonMappingException fieldError(JsonParser p, String field, String message) {
            return JsonMappingException.wrapWithPath(
                MismatchedInputException.from(p, TransactionTrace.class, message), TransactionTrace.class, field);
        }

        @Override
        public Class<?> handledType() {
            return TransactionTrace.class;
        }
    }
}
