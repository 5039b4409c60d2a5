package io.github.hongjungwan.avl.core.canonical;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hongjungwan.avl.api.domain.RecordKind;
import io.github.hongjungwan.avl.api.exception.EncodingException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 해시 입력용 결정적 직렬화.
 *
 * <p>Envelope 필드 순서는 anchor_id, slot, kind, timestamp, prev_hash, payload로 고정.
 * Payload 맵 키는 모든 깊이에서 사전순 정렬, UTF-8, 공백 없음.
 * 정수는 long/BigInteger, 실수는 double로 정규화되어 {@code 1}과 {@code 1.0}은 서로 다른 바이트가 된다.
 * Set, BigDecimal, NaN/Infinity, 임의 객체는 해시 이전에 거부한다.</p>
 */
public class CanonicalEncoder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {};

    /** 마이크로초 6자리 고정 (durable 저장 정밀도) */
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 1024 * 1024;

    private final int maxPayloadBytes;

    public CanonicalEncoder() {
        this(DEFAULT_MAX_PAYLOAD_BYTES);
    }

    public CanonicalEncoder(int maxPayloadBytes) {
        if (maxPayloadBytes < 1) {
            throw new IllegalArgumentException("maxPayloadBytes must be >= 1, got: " + maxPayloadBytes);
        }
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /** 저장 정밀도(마이크로초)로 절삭 */
    public static Instant truncate(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.MICROS);
    }

    public static String formatTimestamp(Instant timestamp) {
        return TIMESTAMP_FORMAT.format(truncate(timestamp));
    }

    /**
     * Payload를 정규화된 불변 맵으로 변환하고 크기 제한을 검사.
     */
    public Map<String, Object> normalizePayload(Map<String, ?> payload) {
        Map<String, Object> normalized = normalizeMap(payload == null ? Map.of() : payload, "$");
        int size = encodePayload(normalized).length;
        if (size > maxPayloadBytes) {
            throw new EncodingException("$", String.format(
                    "Payload exceeds maximum allowed size: %d bytes (max: %d bytes)", size, maxPayloadBytes));
        }
        return normalized;
    }

    /** 정규화된 payload의 canonical 바이트 (서명 대상) */
    public byte[] encodePayload(Map<String, Object> normalizedPayload) {
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(normalizedPayload);
        } catch (IOException e) {
            throw new EncodingException("$", "Failed to encode payload: " + e.getMessage());
        }
    }

    /** 저장용 canonical JSON 텍스트 */
    public String payloadJson(Map<String, Object> normalizedPayload) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(normalizedPayload);
        } catch (IOException e) {
            throw new EncodingException("$", "Failed to encode payload: " + e.getMessage());
        }
    }

    /** 저장된 JSON 텍스트를 정규화된 payload로 복원 (크기 제한 미적용) */
    public Map<String, Object> parsePayload(String json) {
        try {
            return normalizeMap(CANONICAL_MAPPER.readValue(json, MAP_TYPE_REF), "$");
        } catch (IOException e) {
            throw new EncodingException("$", "Stored payload is not valid JSON: " + e.getMessage());
        }
    }

    /**
     * Record envelope의 canonical 바이트. Payload는 이미 정규화되어 있어야 한다.
     */
    public byte[] encodeRecord(String anchorId, String slot, RecordKind kind, Instant timestamp,
                               String prevHash, Map<String, Object> normalizedPayload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        try (JsonGenerator gen = CANONICAL_MAPPER.getFactory().createGenerator(out)) {
            gen.writeStartObject();
            gen.writeStringField("anchor_id", anchorId);
            gen.writeStringField("slot", slot);
            gen.writeStringField("kind", kind.code());
            gen.writeStringField("timestamp", formatTimestamp(timestamp));
            gen.writeStringField("prev_hash", prevHash);
            gen.writeFieldName("payload");
            CANONICAL_MAPPER.writeValue(gen, normalizedPayload);
            gen.writeEndObject();
        } catch (IOException e) {
            throw new EncodingException("$", "Failed to encode record: " + e.getMessage());
        }
        return out.toByteArray();
    }

    private Map<String, Object> normalizeMap(Map<?, ?> map, String path) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new EncodingException(path, "Map keys must be strings, got "
                        + (entry.getKey() == null ? "null" : entry.getKey().getClass().getSimpleName()));
            }
            sorted.put(key, normalize(entry.getValue(), path + "." + key));
        }
        return Collections.unmodifiableSortedMap(sorted);
    }

    private Object normalize(Object value, String path) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (value instanceof Double d) {
            return requireFinite(d, path);
        }
        if (value instanceof Float f) {
            requireFinite(f.doubleValue(), path);
            // float의 최단 10진 표현을 유지
            return Double.parseDouble(f.toString());
        }
        if (value instanceof BigDecimal) {
            throw new EncodingException(path, "BigDecimal has no canonical textual form, use Double or String");
        }
        if (value instanceof Map<?, ?> nested) {
            return normalizeMap(nested, path);
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(normalize(list.get(i), path + "[" + i + "]"));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Set<?>) {
            throw new EncodingException(path, "Set has no defined element order, use List");
        }
        throw new EncodingException(path, "Unsupported payload type " + value.getClass().getName());
    }

    private static Double requireFinite(double value, String path) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new EncodingException(path, "Non-finite number " + value + " cannot be encoded");
        }
        return value;
    }
}
