package io.evmtrace.vmtrace;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Effects of an instruction that was actually executed.
 */
@JsonPropertyOrder({"mem", "push", "store", "used"})
@JsonDeserialize(using = VMExecutedOperation.Deserializer.class)
public class VMExecutedOperation {
    /**
     * Gas remaining after the instruction, an unsigned 64-bit value.
     */
    public final long used;
    /**
     * Stack items pushed by the instruction, empty if none.
     */
    public final List<BigInteger> push;
    public final MemoryDiff mem;
    public final StorageDiff store;

    public VMExecutedOperation(long used, List<BigInteger> push, MemoryDiff mem, StorageDiff store) {
        Objects.requireNonNull(push, "push");
        this.used = used;
        this.push = Collections.unmodifiableList(new ArrayList<>(push));
        this.mem = mem;
        this.store = store;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VMExecutedOperation that = (VMExecutedOperation) o;
        return used == that.used &&
            push.equals(that.push) &&
            Objects.equals(mem, that.mem) &&
            Objects.equals(store, that.store);
    }

    @Override
    public int hashCode() {
        return Objects.hash(used, push, mem, store);
    }

    @Override
    public String toString() {
        return String.format(
            "VMExecutedOperation{used=%s, push=%s, mem=%s, store=%s}",
            Long.toUnsignedString(used), push, mem, store);
    }

    public static class Deserializer extends JsonDeserializer<VMExecutedOperation> {
        @Override
        public VMExecutedOperation deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            VmFields.expectObject(p, ctxt, VMExecutedOperation.class);
            Long used = null;
            List<BigInteger> push = null;
            MemoryDiff mem = null;
            StorageDiff store = null;
            String field;
            while ((field = p.nextFieldName()) != null) {
                p.nextToken();
                try {
                    switch (field) {
                        case "used":
                            used = ctxt.readValue(p, Long.class);
                            break;
                        case "push":
                            VmFields.requireNonNull(p, VMExecutedOperation.class, field);
                            push = VmFields.readWords(p, ctxt);
                            break;
                        case "mem":
                            mem = p.currentToken() == JsonToken.VALUE_NULL ? null : ctxt.readValue(p, MemoryDiff.class);
                            break;
                        case "store":
                            store = p.currentToken() == JsonToken.VALUE_NULL ? null : ctxt.readValue(p, StorageDiff.class);
                            break;
                        default:
                            p.skipChildren();
                    }
                } catch (JsonMappingException e) {
                    throw JsonMappingException.wrapWithPath(e, VMExecutedOperation.class, field);
                }
            }
            if (used == null) {
                used = VmFields.absent(p, ctxt, VMExecutedOperation.class, "used", 0L);
            }
            if (push == null) {
                push = VmFields.absent(p, ctxt, VMExecutedOperation.class, "push", Collections.emptyList());
            }
            return new VMExecutedOperation(used, push, mem, store);
        }

        @Override
        public Class<?> handledType() {
            return VMExecutedOperation.class;
        }
    }
}
