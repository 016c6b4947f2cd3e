package io.evmtrace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.evmtrace.calltrace.TransactionTrace;
import io.evmtrace.statediff.StateDiff;
import io.evmtrace.utils.Address;
import io.evmtrace.utils.BigIntegerDeserializer;
import io.evmtrace.utils.BigIntegerSerializer;
import io.evmtrace.utils.BytesDeserializer;
import io.evmtrace.utils.BytesSerializer;
import io.evmtrace.utils.FixedSizeByteArray;
import io.evmtrace.utils.Hash;
import io.evmtrace.utils.QuantityDeserializer;
import io.evmtrace.utils.QuantitySerializer;
import io.evmtrace.vmtrace.VMTrace;
import io.evmtrace.vmtrace.VMTraceDepthException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decodes and encodes ad-hoc trace payloads. Instances are immutable and can be shared between threads.
 * <p>
 * Decoding failures are reported as {@link SchemaViolationException} or {@link DepthExceededException}, encoding
 * failures as {@link EncodingException}. A failed call has no effect on values decoded before.
 */
public class TraceCodec {
    private static final Logger logger = LogManager.getLogger();
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final TraceCodecSettings settings;
    private final ObjectMapper mapper;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public TraceCodec() {
        this(TraceCodecSettings.defaults());
    }

    public TraceCodec(TraceCodecSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");

        var module = new SimpleModule("evm-trace");
        module.addSerializer(BigInteger.class, new BigIntegerSerializer());
        module.addDeserializer(BigInteger.class, new BigIntegerDeserializer());
        module.addSerializer(byte[].class, new BytesSerializer());
        module.addDeserializer(byte[].class, new BytesDeserializer());
        var quantitySerializer = new QuantitySerializer(settings.getQuantityFormat());
        module.addSerializer(Long.class, quantitySerializer);
        module.addSerializer(long.class, quantitySerializer);
        module.addSerializer(Integer.class, quantitySerializer);
        module.addSerializer(int.class, quantitySerializer);
        module.addDeserializer(Long.class, new QuantityDeserializer.Unsigned64());
        module.addDeserializer(long.class, new QuantityDeserializer.Unsigned64());
        module.addDeserializer(Integer.class, new QuantityDeserializer.Word());
        module.addDeserializer(int.class, new QuantityDeserializer.Word());
        module.addKeySerializer(Address.class, new FixedSizeByteArray.KeySerializer());
        module.addKeySerializer(Hash.class, new FixedSizeByteArray.KeySerializer());
        module.addKeyDeserializer(Address.class, new Address.KeyDeserializer());
        module.addKeyDeserializer(Hash.class, new Hash.KeyDeserializer());

        // every VM trace level takes three levels of JSON nesting, keep the parser limit above the trace limit
        var maxNesting = Math.max(StreamReadConstraints.DEFAULT_MAX_DEPTH, 3 * settings.getMaxVmTraceDepth() + 16);
        var factory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(maxNesting).build())
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();

        mapper = new ObjectMapper(factory);
        mapper.registerModule(module);
        mapper.setSerializationInclusion(
            settings.getNullFields() == NullFieldPolicy.OMIT ? JsonInclude.Include.NON_NULL : JsonInclude.Include.ALWAYS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

        reader = mapper.reader()
            .withAttribute(VMTrace.MAX_DEPTH_ATTRIBUTE, settings.getMaxVmTraceDepth())
            .withAttribute(VMTrace.DEFAULTS_ATTRIBUTE, settings.isVmTraceDefaults())
            .withAttribute(TransactionTrace.OUTCOME_POLICY_ATTRIBUTE, settings.getOutcomePolicy());
        writer = mapper.writer();
    }

    public TraceCodecSettings getSettings() {
        return settings;
    }

    /**
     * Returns a copy of the underlying mapper, e.g. to embed trace types in a larger document. Decoding through the
     * copy does not apply the depth limit, VM trace defaults and outcome policy of these settings.
     */
    public ObjectMapper getMapper() {
        return mapper.copy();
    }

    public BlockTrace decodeBlockTrace(String json) {
        return decode(json, mapper.constructType(BlockTrace.class));
    }

    public BlockTrace decodeBlockTrace(byte[] json) {
        return decode(json, mapper.constructType(BlockTrace.class));
    }

    /**
     * Decode the result of a block replay. The order of the entries is kept.
     */
    public List<BlockTrace> decodeBlockTraces(String json) {
        List<BlockTrace> traces = decode(json, listOf(BlockTrace.class));
        logger.debug("decoded {} block traces", traces.size());
        return traces;
    }

    public List<BlockTrace> decodeBlockTraces(byte[] json) {
        List<BlockTrace> traces = decode(json, listOf(BlockTrace.class));
        logger.debug("decoded {} block traces", traces.size());
        return traces;
    }

    public StateDiff decodeStateDiff(String json) {
        return decode(json, mapper.constructType(StateDiff.class));
    }

    public List<TransactionTrace> decodeTransactionTraces(String json) {
        return decode(json, listOf(TransactionTrace.class));
    }

    public VMTrace decodeVmTrace(String json) {
        return decode(json, mapper.constructType(VMTrace.class));
    }

    public List<TraceType> decodeTraceTypes(String json) {
        return decode(json, listOf(TraceType.class));
    }

    public <T> T decode(String json, Class<T> type) {
        return decode(json, mapper.constructType(type));
    }

    public <T> T decode(String json, TypeReference<T> type) {
        return decode(json, mapper.constructType(type));
    }

    public String encode(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw encodeError(e);
        }
    }

    public byte[] encodeToBytes(Object value) {
        try {
            return writer.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw encodeError(e);
        }
    }

    private JavaType listOf(Class<?> elementType) {
        return mapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    private <T> T decode(String json, JavaType type) {
        Objects.requireNonNull(json, "json");
        try {
            return checkDecoded(reader.forType(type).readValue(json));
        } catch (JsonProcessingException e) {
            throw decodeError(e);
        }
    }

    private <T> T decode(byte[] json, JavaType type) {
        Objects.requireNonNull(json, "json");
        try {
            return checkDecoded(reader.forType(type).readValue(json));
        } catch (JsonProcessingException e) {
            throw decodeError(e);
        } catch (IOException e) {
            // reading from memory only fails on undecodable characters
            logger.debug("rejected trace payload: {}", e.getMessage());
            throw new SchemaViolationException("invalid character encoding: " + e.getMessage(), "$", e);
        }
    }

    // top level nulls and null list entries are not valid anywhere in the model
    private static <T> T checkDecoded(T value) {
        if (value == null) {
            throw new SchemaViolationException("payload must not be null", "$", null);
        }
        if (value instanceof List) {
            var list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) == null) {
                    throw new SchemaViolationException("list entries must not be null", "$[" + i + "]", null);
                }
            }
        }
        return value;
    }

    private TraceException decodeError(JsonProcessingException e) {
        var path = pathOf(e);
        logger.debug("rejected trace payload at {}: {}", path, e.getOriginalMessage());
        if (e instanceof VMTraceDepthException) {
            return new DepthExceededException(((VMTraceDepthException) e).getMaxDepth(), path, e);
        }
        return new SchemaViolationException(e.getOriginalMessage(), path, e);
    }

    private EncodingException encodeError(JsonProcessingException e) {
        return new EncodingException(e.getOriginalMessage(), pathOf(e), e);
    }

    /**
     * Renders the reference chain of a mapping exception as {@code $.field[index]["key"]}.
     */
    static String pathOf(JsonProcessingException e) {
        var path = new StringBuilder("$");
        if (e instanceof JsonMappingException) {
            for (var reference : ((JsonMappingException) e).getPath()) {
                var field = reference.getFieldName();
                if (field != null) {
                    if (IDENTIFIER.matcher(field).matches()) {
                        path.append('.').append(field);
                    } else {
                        path.append("[\"").append(field).append("\"]");
                    }
                } else if (reference.getIndex() >= 0) {
                    path.append('[').append(reference.getIndex()).append(']');
                }
            }
        }
        return path.toString();
    }
}
