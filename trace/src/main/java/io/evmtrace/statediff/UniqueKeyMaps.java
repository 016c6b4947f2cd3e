package io.evmtrace.statediff;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

// hex keys are case insensitive, so two distinct JSON keys can decode to the same address or slot
final class UniqueKeyMaps {
    private UniqueKeyMaps() {}

    /**
     * Reads a JSON object into a sorted map, rejecting keys that are equal once decoded and null values.
     */
    @SuppressWarnings("unchecked")
    static <K, V> Map<K, V> read(JsonParser p, DeserializationContext ctxt, JavaType keyType, JavaType valueType)
        throws IOException {
        if (p.currentToken() != JsonToken.START_OBJECT) {
            return (Map<K, V>) ctxt.handleUnexpectedToken(Map.class, p);
        }
        var keys = ctxt.findKeyDeserializer(keyType, null);
        var values = ctxt.findRootValueDeserializer(valueType);
        var map = new TreeMap<K, V>();
        String field;
        while ((field = p.nextFieldName()) != null) {
            p.nextToken();
            try {
                var key = (K) keys.deserializeKey(field, ctxt);
                if (map.containsKey(key)) {
                    ctxt.reportInputMismatch(valueType, "duplicate key %s", key);
                }
                if (p.currentToken() == JsonToken.VALUE_NULL) {
                    ctxt.reportInputMismatch(valueType, "value of %s must not be null", key);
                }
                map.put(key, (V) values.deserialize(p, ctxt));
            } catch (JsonMappingException e) {
                throw JsonMappingException.wrapWithPath(e, map, field);
            }
        }
        return map;
    }
}
