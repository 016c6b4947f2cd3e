package io.evmtrace.vmtrace;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

// field access shared by the VM trace deserializers
final class VmFields {
    private VmFields() {}

    static boolean defaultsEnabled(DeserializationContext ctxt) {
        var enabled = (Boolean) ctxt.getAttribute(VMTrace.DEFAULTS_ATTRIBUTE);
        return enabled == null || enabled;
    }

    /**
     * Value for a field that was not present at all: the zero default if enabled, otherwise an error.
     */
    static <T> T absent(JsonParser p, DeserializationContext ctxt, Class<?> owner, String field, T zero)
        throws JsonMappingException {
        if (defaultsEnabled(ctxt)) {
            return zero;
        }
        throw error(p, owner, field, String.format("missing required field \"%s\"", field));
    }

    static void requireNonNull(JsonParser p, Class<?> owner, String field) throws JsonMappingException {
        if (p.currentToken() == JsonToken.VALUE_NULL) {
            throw error(p, owner, field, String.format("field \"%s\" must not be null", field));
        }
    }

    static JsonMappingException error(JsonParser p, Class<?> owner, String field, String message) {
        return JsonMappingException.wrapWithPath(MismatchedInputException.from(p, owner, message), owner, field);
    }

    static void expectObject(JsonParser p, DeserializationContext ctxt, Class<?> type) throws IOException {
        if (p.currentToken() != JsonToken.START_OBJECT) {
            ctxt.handleUnexpectedToken(type, p);
        }
    }

    static List<BigInteger> readWords(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            ctxt.handleUnexpectedToken(List.class, p);
        }
        var words = new ArrayList<BigInteger>();
        while (p.nextToken() != JsonToken.END_ARRAY) {
            try {
                if (p.currentToken() == JsonToken.VALUE_NULL) {
                    ctxt.reportInputMismatch(BigInteger.class, "stack item must not be null");
                }
                words.add(ctxt.readValue(p, BigInteger.class));
            } catch (JsonMappingException e) {
                throw JsonMappingException.wrapWithPath(e, words, words.size());
            }
        }
        return words;
    }
}
