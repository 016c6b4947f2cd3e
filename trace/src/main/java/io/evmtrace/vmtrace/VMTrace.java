package io.evmtrace.vmtrace;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.evmtrace.utils.Converter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Instruction level trace of one call frame. Instructions that open a nested frame carry the trace of that frame in
 * {@link VMOperation#sub}, so the root node describes the outermost call and the tree mirrors the call stack.
 */
@JsonPropertyOrder({"code", "ops"})
@JsonDeserialize(using = VMTrace.Deserializer.class)
public class VMTrace {
    /**
     * Deserialization attribute holding the maximum nesting depth as an Integer. The root trace has depth 1.
     */
    public static final String MAX_DEPTH_ATTRIBUTE = "evmtrace.vmTrace.maxDepth";
    /**
     * Deserialization attribute holding a Boolean: if true, missing telemetry fields decode to zero values.
     */
    public static final String DEFAULTS_ATTRIBUTE = "evmtrace.vmTrace.defaults";
    public static final int DEFAULT_MAX_DEPTH = 64;
    /**
     * Upper bound for any configured maximum depth. Decoding and comparing traces recurse once per level.
     */
    public static final int MAX_SUPPORTED_DEPTH = 256;

    private static final String DEPTH_ATTRIBUTE = "evmtrace.vmTrace.depth";

    /**
     * The code executed in this frame.
     */
    private final byte[] code;
    /**
     * The instructions executed, in execution order.
     */
    public final List<VMOperation> ops;
    private final int depth;

    public VMTrace(byte[] code, List<VMOperation> ops) {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(ops, "ops");
        this.code = code.clone();
        this.ops = Collections.unmodifiableList(new ArrayList<>(ops));
        var deepest = 0;
        for (var op : this.ops) {
            Objects.requireNonNull(op, "ops must not contain null");
            if (op.sub != null) {
                deepest = Math.max(deepest, op.sub.depth);
            }
        }
        if (deepest + 1 > MAX_SUPPORTED_DEPTH) {
            throw new IllegalArgumentException(
                String.format("VM trace nesting exceeds the supported maximum of %d", MAX_SUPPORTED_DEPTH));
        }
        this.depth = deepest + 1;
    }

    /**
     * @return the number of nested frames on the longest path from this trace down, 1 for a trace without sub traces
     */
    public int depth() {
        return depth;
    }

    public byte[] getCode() {
        return code.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VMTrace that = (VMTrace) o;
        return Arrays.equals(code, that.code) && ops.equals(that.ops);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(code) + ops.hashCode();
    }

    @Override
    public String toString() {
        return String.format("VMTrace{code=%s, ops=%s}", Converter.toPrefixedHexString(code), ops);
    }

    /**
     * Recursion goes through {@link VMOperation.Deserializer}; the current depth is tracked in a per-call attribute
     * and decoding fails before descending past the configured maximum.
     */
    public static class Deserializer extends JsonDeserializer<VMTrace> {
        @Override
        public VMTrace deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            VmFields.expectObject(p, ctxt, VMTrace.class);
            var parentDepth = (Integer) ctxt.getAttribute(DEPTH_ATTRIBUTE);
            var depth = parentDepth == null ? 1 : parentDepth + 1;
            var maxDepth = (Integer) ctxt.getAttribute(MAX_DEPTH_ATTRIBUTE);
            if (maxDepth == null) {
                maxDepth = DEFAULT_MAX_DEPTH;
            }
            maxDepth = Math.min(maxDepth, MAX_SUPPORTED_DEPTH);
            if (depth > maxDepth) {
                throw new VMTraceDepthException(p, maxDepth);
            }
            ctxt.setAttribute(DEPTH_ATTRIBUTE, depth);
            try {
                return readTrace(p, ctxt);
            } finally {
                ctxt.setAttribute(DEPTH_ATTRIBUTE, parentDepth);
            }
        }

        private VMTrace readTrace(JsonParser p, DeserializationContext ctxt) throws IOException {
            byte[] code = null;
            List<VMOperation> ops = null;
            String field;
            while ((field = p.nextFieldName()) != null) {
                p.nextToken();
                try {
                    switch (field) {
                        case "code":
                            VmFields.requireNonNull(p, VMTrace.class, field);
                            code = ctxt.readValue(p, byte[].class);
                            break;
                        case "ops":
                            VmFields.requireNonNull(p, VMTrace.class, field);
                            ops = readOps(p, ctxt);
                            break;
                        default:
                            p.skipChildren();
                    }
                } catch (JsonMappingException e) {
                    throw JsonMappingException.wrapWithPath(e, VMTrace.class, field);
                }
            }
            if (code == null) {
                code = VmFields.absent(p, ctxt, VMTrace.class, "code", new byte[0]);
            }
            if (ops == null) {
                ops = VmFields.absent(p, ctxt, VMTrace.class, "ops", Collections.emptyList());
            }
            return new VMTrace(code, ops);
        }

        private List<VMOperation> readOps(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.START_ARRAY) {
                ctxt.handleUnexpectedToken(List.class, p);
            }
            var ops = new ArrayList<VMOperation>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                try {
                    if (p.currentToken() == JsonToken.VALUE_NULL) {
                        ctxt.reportInputMismatch(VMOperation.class, "operation must not be null");
                    }
                    ops.add(ctxt.readValue(p, VMOperation.class));
                } catch (JsonMappingException e) {
                    throw JsonMappingException.wrapWithPath(e, ops, ops.size());
                }
            }
            return ops;
        }

        @Override
        public Class<?> handledType() {
            return VMTrace.class;
        }
    }
}
