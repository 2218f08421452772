package com.auditchain.core.canonical;

import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.exception.SerializationException;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Deterministic byte encoding of an entry's logical fields.
 * <p>
 * Layout: a format version byte, then chain id, sequence, timestamp (epoch
 * microseconds), actor, action, resource type, resource id and payload, in that
 * order. Every value is tagged and every variable-length value is prefixed with its
 * 4-byte big-endian length, so field boundaries cannot shift between fields. Map keys
 * are sorted by their UTF-8 bytes; construction order never reaches the output.
 * <p>
 * Accepted payload values are those a JSON document can carry: null, booleans,
 * strings, integral numbers, finite decimals, lists and string-keyed maps. Anything
 * else is rejected with {@link SerializationException} rather than guessed at.
 */
public final class CanonicalEncoder {

    public static final byte FORMAT_VERSION = 1;

    private static final byte TAG_NULL = 'N';
    private static final byte TAG_TRUE = 'T';
    private static final byte TAG_FALSE = 'F';
    private static final byte TAG_STRING = 'S';
    private static final byte TAG_INTEGER = 'I';
    private static final byte TAG_DECIMAL = 'D';
    private static final byte TAG_LIST = 'L';
    private static final byte TAG_MAP = 'M';

    private static final int MAX_DEPTH = 64;

    private CanonicalEncoder() {}

    public static byte[] encode(AuditEntry entry) {
        Writer out = new Writer();
        out.raw(FORMAT_VERSION);
        out.string(entry.chainId(), "chainId");
        out.int64(entry.sequence());
        out.int64(toEpochMicros(entry.timestamp()));
        out.string(entry.actorId(), "actorId");
        out.string(entry.action(), "action");
        out.string(entry.resourceType(), "resourceType");
        out.string(entry.resourceId(), "resourceId");
        out.value(entry.payload(), "payload", 0);
        return out.toByteArray();
    }

    /**
     * Encodes a single payload value. Exposed so callers can validate payloads up front.
     */
    public static byte[] encodeValue(Object value) {
        Writer out = new Writer();
        out.value(value, "value", 0);
        return out.toByteArray();
    }

    public static long toEpochMicros(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
                    instant.getNano() / 1_000L);
        } catch (ArithmeticException e) {
            throw new SerializationException("Timestamp out of range: " + instant, e);
        }
    }

    public static Instant fromEpochMicros(long micros) {
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L),
                Math.floorMod(micros, 1_000_000L) * 1_000L);
    }

    private static final class Writer {

        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
        private final CharsetEncoder utf8 = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        void raw(byte b) {
            buffer.write(b);
        }

        void int32(int v) {
            buffer.write(v >>> 24);
            buffer.write(v >>> 16);
            buffer.write(v >>> 8);
            buffer.write(v);
        }

        void int64(long v) {
            int32((int) (v >>> 32));
            int32((int) v);
        }

        void lengthPrefixed(byte tag, byte[] bytes) {
            raw(tag);
            int32(bytes.length);
            buffer.writeBytes(bytes);
        }

        void string(String s, String path) {
            if (s == null) {
                raw(TAG_NULL);
                return;
            }
            lengthPrefixed(TAG_STRING, utf8(s, path));
        }

        byte[] utf8(String s, String path) {
            try {
                ByteBuffer bb = utf8.reset().encode(CharBuffer.wrap(s));
                byte[] bytes = new byte[bb.remaining()];
                bb.get(bytes);
                return bytes;
            } catch (CharacterCodingException e) {
                throw new SerializationException("Malformed text at " + path, e);
            }
        }

        void value(Object v, String path, int depth) {
            if (depth > MAX_DEPTH) {
                throw new SerializationException("Payload nested deeper than " + MAX_DEPTH + " at " + path);
            }
            if (v == null) {
                raw(TAG_NULL);
            } else if (v instanceof Boolean b) {
                raw(b ? TAG_TRUE : TAG_FALSE);
            } else if (v instanceof String s) {
                string(s, path);
            } else if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
                lengthPrefixed(TAG_INTEGER, BigInteger.valueOf(((Number) v).longValue()).toByteArray());
            } else if (v instanceof BigInteger bi) {
                lengthPrefixed(TAG_INTEGER, bi.toByteArray());
            } else if (v instanceof BigDecimal bd) {
                decimal(bd);
            } else if (v instanceof Double d) {
                if (d.isNaN() || d.isInfinite()) {
                    throw new SerializationException("Non-finite number at " + path);
                }
                decimal(BigDecimal.valueOf(d));
            } else if (v instanceof Float f) {
                if (f.isNaN() || f.isInfinite()) {
                    throw new SerializationException("Non-finite number at " + path);
                }
                decimal(new BigDecimal(Float.toString(f)));
            } else if (v instanceof List<?> list) {
                raw(TAG_LIST);
                int32(list.size());
                int i = 0;
                for (Object item : list) {
                    value(item, path + "[" + i++ + "]", depth + 1);
                }
            } else if (v instanceof Map<?, ?> map) {
                map(map, path, depth);
            } else {
                throw new SerializationException("Unsupported type " + v.getClass().getName() + " at " + path);
            }
        }

        void decimal(BigDecimal bd) {
            String text = bd.signum() == 0 ? "0" : bd.stripTrailingZeros().toString();
            lengthPrefixed(TAG_DECIMAL, text.getBytes(StandardCharsets.US_ASCII));
        }

        void map(Map<?, ?> map, String path, int depth) {
            List<KeyedValue> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new SerializationException("Non-string map key at " + path);
                }
                entries.add(new KeyedValue(key, utf8(key, path), e.getValue()));
            }
            entries.sort((a, b) -> Arrays.compareUnsigned(a.keyBytes(), b.keyBytes()));
            raw(TAG_MAP);
            int32(entries.size());
            for (KeyedValue e : entries) {
                lengthPrefixed(TAG_STRING, e.keyBytes());
                value(e.value(), path + "." + e.key(), depth + 1);
            }
        }

        byte[] toByteArray() {
            return buffer.toByteArray();
        }
    }

    private record KeyedValue(String key, byte[] keyBytes, Object value) {}
}
