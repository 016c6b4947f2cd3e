package io.evmtrace;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.evmtrace.calltrace.OutcomePolicy;
import io.evmtrace.utils.QuantityFormat;
import io.evmtrace.vmtrace.VMTrace;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Wire conventions of the trace producer, read from the {@code evm-trace.codec} section of the configuration.
 * Defaults are defined in {@code reference.conf}.
 */
public class TraceCodecSettings {
    public static final String CONFIG_PATH = "evm-trace.codec";

    private static final Logger logger = LogManager.getLogger();

    private final int maxVmTraceDepth;
    private final QuantityFormat quantityFormat;
    private final NullFieldPolicy nullFields;
    private final OutcomePolicy outcomePolicy;
    private final boolean vmTraceDefaults;

    public TraceCodecSettings(
        int maxVmTraceDepth,
        QuantityFormat quantityFormat,
        NullFieldPolicy nullFields,
        OutcomePolicy outcomePolicy,
        boolean vmTraceDefaults
    ) {
        if (maxVmTraceDepth < 1 || maxVmTraceDepth > VMTrace.MAX_SUPPORTED_DEPTH) {
            throw new IllegalArgumentException(String.format(
                "max VM trace depth must be between 1 and %d: %d", VMTrace.MAX_SUPPORTED_DEPTH, maxVmTraceDepth));
        }
        this.maxVmTraceDepth = maxVmTraceDepth;
        this.quantityFormat = Objects.requireNonNull(quantityFormat, "quantityFormat");
        this.nullFields = Objects.requireNonNull(nullFields, "nullFields");
        this.outcomePolicy = Objects.requireNonNull(outcomePolicy, "outcomePolicy");
        this.vmTraceDefaults = vmTraceDefaults;
    }

    /**
     * Settings from the application configuration, i.e. application.conf on top of reference.conf.
     */
    public static TraceCodecSettings load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Settings as defined in reference.conf.
     */
    public static TraceCodecSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public static TraceCodecSettings fromConfig(Config config) {
        var codec = config.getConfig(CONFIG_PATH);
        var settings = new TraceCodecSettings(
            getDepth(codec, "max-vm-trace-depth"),
            getEnum(codec, QuantityFormat.class, "quantity-format"),
            getEnum(codec, NullFieldPolicy.class, "null-fields"),
            getEnum(codec, OutcomePolicy.class, "outcome-policy"),
            codec.getBoolean("vm-trace-defaults")
        );
        logger.debug("trace codec settings: {}", settings);
        return settings;
    }

    private static int getDepth(Config config, String path) {
        var value = config.getInt(path);
        if (value < 1 || value > VMTrace.MAX_SUPPORTED_DEPTH) {
            throw new ConfigException.BadValue(config.origin(), path,
                String.format("must be between 1 and %d, got %d", VMTrace.MAX_SUPPORTED_DEPTH, value));
        }
        return value;
    }

    // enum values are written in lower case in the config files
    private static <E extends Enum<E>> E getEnum(Config config, Class<E> type, String path) {
        var value = config.getString(path);
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), path, String.format("unknown value \"%s\"", value));
        }
    }

    public int getMaxVmTraceDepth() {
        return maxVmTraceDepth;
    }

    public QuantityFormat getQuantityFormat() {
        return quantityFormat;
    }

    public NullFieldPolicy getNullFields() {
        return nullFields;
    }

    public OutcomePolicy getOutcomePolicy() {
        return outcomePolicy;
    }

    public boolean isVmTraceDefaults() {
        return vmTraceDefaults;
    }

    public TraceCodecSettings withMaxVmTraceDepth(int maxVmTraceDepth) {
        return new TraceCodecSettings(maxVmTraceDepth, quantityFormat, nullFields, outcomePolicy, vmTraceDefaults);
    }

    public TraceCodecSettings withQuantityFormat(QuantityFormat quantityFormat) {
        return new TraceCodecSettings(maxVmTraceDepth, quantityFormat, nullFields, outcomePolicy, vmTraceDefaults);
    }

    public TraceCodecSettings withNullFields(NullFieldPolicy nullFields) {
        return new TraceCodecSettings(maxVmTraceDepth, quantityFormat, nullFields, outcomePolicy, vmTraceDefaults);
    }

    public TraceCodecSettings withOutcomePolicy(OutcomePolicy outcomePolicy) {
        return new TraceCodecSettings(maxVmTraceDepth, quantityFormat, nullFields, outcomePolicy, vmTraceDefaults);
    }

    public TraceCodecSettings withVmTraceDefaults(boolean vmTraceDefaults) {
        return new TraceCodecSettings(maxVmTraceDepth, quantityFormat, nullFields, outcomePolicy, vmTraceDefaults);
    }

    @Override
    public String toString() {
        return String.format(
            "TraceCodecSettings{maxVmTraceDepth=%d, quantityFormat=%s, nullFields=%s, outcomePolicy=%s, vmTraceDefaults=%s}",
            maxVmTraceDepth, quantityFormat, nullFields, outcomePolicy, vmTraceDefaults);
    }
}
