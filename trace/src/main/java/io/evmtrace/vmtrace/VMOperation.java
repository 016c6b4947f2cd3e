package io.evmtrace.vmtrace;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.io.IOException;
import java.util.Objects;

/**
 * A single instruction of a VM trace.
 */
@JsonPropertyOrder({"cost", "ex", "pc", "sub"})
@JsonDeserialize(using = VMOperation.Deserializer.class)
public class VMOperation {
    /**
     * The program counter.
     */
    public final int pc;
    /**
     * Gas cost of the instruction, an unsigned 64-bit value.
     */
    public final long cost;
    /**
     * Execution effects, null if the instruction was not executed, e.g. after running out of gas.
     */
    public final VMExecutedOperation ex;
    /**
     * Trace of the nested call frame of a CALL or CREATE, null for any other instruction.
     */
    public final VMTrace sub;

    public VMOperation(int pc, long cost, VMExecutedOperation ex, VMTrace sub) {
        if (pc < 0) {
            throw new IllegalArgumentException("program counter must be non-negative: " + pc);
        }
        this.pc = pc;
        this.cost = cost;
        this.ex = ex;
        this.sub = sub;
    }

    public boolean wasExecuted() {
        return ex != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VMOperation that = (VMOperation) o;
        return pc == that.pc && cost == that.cost && Objects.equals(ex, that.ex) && Objects.equals(sub, that.sub);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pc, cost, ex, sub);
    }

    @Override
    public String toString() {
        return String.format(
            "VMOperation{pc=%d, cost=%s, ex=%s, sub=%s}", pc, Long.toUnsignedString(cost), ex, sub);
    }

    public static class Deserializer extends JsonDeserializer<VMOperation> {
        @Override
        public VMOperation deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            VmFields.expectObject(p, ctxt, VMOperation.class);
            Integer pc = null;
            Long cost = null;
            VMExecutedOperation ex = null;
            VMTrace sub = null;
            String field;
            while ((field = p.nextFieldName()) != null) {
                p.nextToken();
                try {
                    switch (field) {
                        case "pc":
                            pc = ctxt.readValue(p, Integer.class);
                            break;
                        case "cost":
                            cost = ctxt.readValue(p, Long.class);
                            break;
                        case "ex":
                            ex = p.currentToken() == JsonToken.VALUE_NULL ? null : ctxt.readValue(p, VMExecutedOperation.class);
                            break;
                        case "sub":
                            sub = p.currentToken() == JsonToken.VALUE_NULL ? null : ctxt.readValue(p, VMTrace.class);
                            break;
                        default:
                            p.skipChildren();
                    }
                } catch (JsonMappingException e) {
                    throw JsonMappingException.wrapWithPath(e, VMOperation.class, field);
                }
            }
            if (pc == null) {
                pc = VmFields.absent(p, ctxt, VMOperation.class, "pc", 0);
            }
            if (cost == null) {
                cost = VmFields.absent(p, ctxt, VMOperation.class, "cost", 0L);
            }
            return new VMOperation(pc, cost, ex, sub);
        }

        @Override
        public Class<?> handledType() {
            return VMOperation.class;
        }
    }
}
