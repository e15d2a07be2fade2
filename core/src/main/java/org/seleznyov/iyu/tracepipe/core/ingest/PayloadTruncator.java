package org.seleznyov.iyu.tracepipe.core.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.domain.model.event.ErrorPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.FunctionCallPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.FunctionReturnPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.MessagePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.MetricPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.ProcessPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.StateChangePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.StateDiff;
import org.seleznyov.iyu.tracepipe.domain.model.event.TruncatedValue;
import org.seleznyov.iyu.tracepipe.shared.utils.HashUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounds payload values by their serialized size. Values over the threshold are replaced with a
 * {@link TruncatedValue} carrying the original size and a type hint.
 */
@Slf4j
public class PayloadTruncator {

    private final int maxPayloadBytes;
    private final ObjectMapper objectMapper;
    private final AtomicLong truncatedValues = new AtomicLong(0);

    public PayloadTruncator(int maxPayloadBytes) {
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("Max payload bytes must be positive");
        }
        this.maxPayloadBytes = maxPayloadBytes;
        this.objectMapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public EventPayload truncate(EventPayload payload) {
        if (payload instanceof FunctionCallPayload call) {
            return new FunctionCallPayload(call.symbol(), truncate(call.args()), call.arity());
        }
        if (payload instanceof FunctionReturnPayload ret) {
            return new FunctionReturnPayload(ret.symbol(), truncate(ret.returnValue()), ret.durationNanos());
        }
        if (payload instanceof MessagePayload message) {
            final long contentHash = message.contentHash() != 0L || message.content() == null
                ? message.contentHash()
                : contentHash(message.content());
            return new MessagePayload(message.senderId(), message.receiverId(), truncate(message.content()), contentHash);
        }
        if (payload instanceof StateChangePayload change) {
            return new StateChangePayload(
                change.callback(), truncate(change.oldState()), truncate(change.newState()), change.diff()
            );
        }
        if (payload instanceof ProcessPayload process) {
            return new ProcessPayload(process.parentProducerId(), process.childProducerId(), truncate(process.reason()));
        }
        if (payload instanceof ErrorPayload error) {
            return new ErrorPayload(error.errorType(), truncate(error.message()), truncate(error.stacktrace()));
        }
        if (payload instanceof MetricPayload metric && metric.metadata() != null) {
            final Map<String, Object> metadata = new LinkedHashMap<>();
            metric.metadata().forEach((key, value) -> metadata.put(key, truncate(value)));
            return new MetricPayload(metric.name(), metric.value(), metadata);
        }
        return payload;
    }

    public Object truncate(Object value) {
        if (value == null || value instanceof TruncatedValue) {
            return value;
        }
        final long size = sizeOf(value);
        if (size <= maxPayloadBytes) {
            return value;
        }
        truncatedValues.incrementAndGet();
        return new TruncatedValue(size, typeHint(value));
    }

    public long sizeOf(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8).length;
        }
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        return serialize(value).length;
    }

    /**
     * Hash of the full serialized content, stable across equal values including maps.
     */
    public long contentHash(Object content) {
        return HashUtils.hash64(serialize(content));
    }

    public StateDiff diff(Object oldState, Object newState) {
        if (Objects.equals(oldState, newState)) {
            return StateDiff.NO_CHANGE;
        }
        return StateDiff.changed(sizeOf(newState) - sizeOf(oldState));
    }

    public long truncatedValues() {
        return truncatedValues.get();
    }

    public int maxPayloadBytes() {
        return maxPayloadBytes;
    }

    private byte[] serialize(Object value) {
        if (value == null) {
            return new byte[0];
        }
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            // Не сериализуется (циклы, self-reference) - меряем строковое представление
            log.debug("Payload value of type {} is not serializable: {}", value.getClass().getName(), e.getMessage());
            return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
        }
    }

    private static String typeHint(Object value) {
        if (value instanceof Map<?, ?>) {
            return "Map";
        }
        if (value instanceof Collection<?>) {
            return value instanceof java.util.List<?> ? "List" : "Collection";
        }
        final Class<?> type = value.getClass();
        if (type.isArray()) {
            return type.getComponentType().getSimpleName() + "[]";
        }
        return type.getSimpleName();
    }
}
