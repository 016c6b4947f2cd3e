package io.evmtrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.calltrace.TransactionTrace;
import io.evmtrace.statediff.StateDiff;
import io.evmtrace.utils.Converter;
import io.evmtrace.utils.Hash;
import io.evmtrace.vmtrace.VMTrace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of replaying a transaction with the ad-hoc tracing API. Each view is present only if the producer included
 * it, which normally means it was requested with the corresponding {@link TraceType}. The transaction hash is set when
 * the trace is one entry of a block replay.
 */
@JsonPropertyOrder({"output", "stateDiff", "trace", "vmTrace", "transactionHash"})
public class BlockTrace {
    private final byte[] output;
    public final List<TransactionTrace> trace;
    public final VMTrace vmTrace;
    public final StateDiff stateDiff;
    public final Hash transactionHash;

    @JsonCreator
    public BlockTrace(
        @JsonProperty(value = "output", required = true) byte[] output,
        @JsonProperty("trace") List<TransactionTrace> trace,
        @JsonProperty("vmTrace") VMTrace vmTrace,
        @JsonProperty("stateDiff") StateDiff stateDiff,
        @JsonProperty("transactionHash") Hash transactionHash
    ) {
        this.output = Objects.requireNonNull(output, "output").clone();
        if (trace != null) {
            for (var item : trace) {
                Objects.requireNonNull(item, "trace entries must not be null");
            }
            this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        } else {
            this.trace = null;
        }
        this.vmTrace = vmTrace;
        this.stateDiff = stateDiff;
        this.transactionHash = transactionHash;
    }

    public BlockTrace(byte[] output, List<TransactionTrace> trace, VMTrace vmTrace, StateDiff stateDiff) {
        this(output, trace, vmTrace, stateDiff, null);
    }

    /**
     * @return true if the view of the given type is present
     */
    public boolean has(TraceType type) {
        switch (type) {
            case TRACE:
                return trace != null;
            case VM_TRACE:
                return vmTrace != null;
            default:
                return stateDiff != null;
        }
    }

    public byte[] getOutput() {
        return output.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockTrace that = (BlockTrace) o;
        return Arrays.equals(output, that.output) &&
            Objects.equals(trace, that.trace) &&
            Objects.equals(vmTrace, that.vmTrace) &&
            Objects.equals(stateDiff, that.stateDiff) &&
            Objects.equals(transactionHash, that.transactionHash);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(trace, vmTrace, stateDiff, transactionHash) + Arrays.hashCode(output);
    }

    @Override
    public String toString() {
        return String.format(
            "BlockTrace{output=%s, trace=%s, vmTrace=%s, stateDiff=%s, transactionHash=%s}",
            Converter.toPrefixedHexString(output), trace, vmTrace, stateDiff, transactionHash);
    }
}
