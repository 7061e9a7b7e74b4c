/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tessera.sql.expression;

import io.airlift.slice.DynamicSliceOutput;
import io.airlift.slice.Slice;
import io.airlift.slice.SliceOutput;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Byte encoding used to build structural expression hashes. Each expression
 * kind starts its encoding with a distinct flag byte.
 */
final class HashEncoder
{
    static final byte CONSTANT_FLAG = 0;
    static final byte COLUMN_FLAG = 1;
    static final byte CORRELATED_COLUMN_FLAG = 2;
    static final byte SCALAR_FUNCTION_FLAG = 3;

    private static final byte NULL_VALUE_FLAG = 0;
    private static final byte BYTES_VALUE_FLAG = 2;
    private static final byte INT_VALUE_FLAG = 3;
    private static final byte UNSIGNED_INT_VALUE_FLAG = 4;
    private static final byte DOUBLE_VALUE_FLAG = 5;
    private static final byte DECIMAL_VALUE_FLAG = 6;
    private static final byte DURATION_VALUE_FLAG = 7;
    private static final byte TIMESTAMP_VALUE_FLAG = 11;

    private static final long SIGN_MASK = 0x8000_0000_0000_0000L;

    private final SliceOutput output;

    HashEncoder(int estimatedSize)
    {
        this.output = new DynamicSliceOutput(estimatedSize);
    }

    HashEncoder appendFlag(byte flag)
    {
        output.writeByte(flag);
        return this;
    }

    HashEncoder appendRaw(byte[] bytes)
    {
        output.writeBytes(bytes);
        return this;
    }

    /**
     * Zig-zag varint length prefix followed by the bytes.
     */
    HashEncoder appendCompactBytes(byte[] bytes)
    {
        appendVarint(bytes.length);
        output.writeBytes(bytes);
        return this;
    }

    HashEncoder appendCompactString(String value)
    {
        return appendCompactBytes(value.getBytes(UTF_8));
    }

    /**
     * Big-endian with the sign bit flipped, so the encoding sorts like the value.
     */
    HashEncoder appendComparableLong(long value)
    {
        long encoded = value ^ SIGN_MASK;
        for (int shift = 56; shift >= 0; shift -= 8) {
            output.writeByte((int) (encoded >>> shift));
        }
        return this;
    }

    HashEncoder appendValue(Object value, boolean unsigned)
    {
        if (value == null) {
            return appendFlag(NULL_VALUE_FLAG);
        }
        if (value instanceof Long) {
            long longValue = (Long) value;
            if (unsigned) {
                return appendFlag(UNSIGNED_INT_VALUE_FLAG).appendComparableLong(longValue ^ SIGN_MASK);
            }
            return appendFlag(INT_VALUE_FLAG).appendComparableLong(longValue);
        }
        if (value instanceof Double) {
            return appendFlag(DOUBLE_VALUE_FLAG).appendComparableLong(Double.doubleToLongBits((Double) value));
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            String canonical = decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
            return appendFlag(DECIMAL_VALUE_FLAG).appendCompactString(canonical);
        }
        if (value instanceof Slice) {
            return appendFlag(BYTES_VALUE_FLAG).appendCompactBytes(((Slice) value).getBytes());
        }
        if (value instanceof LocalDateTime) {
            return appendFlag(TIMESTAMP_VALUE_FLAG).appendCompactString(value.toString());
        }
        if (value instanceof Duration) {
            Duration duration = (Duration) value;
            return appendFlag(DURATION_VALUE_FLAG)
                    .appendComparableLong(duration.getSeconds())
                    .appendComparableLong(duration.getNano());
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    byte[] toByteArray()
    {
        return output.slice().getBytes();
    }

    private void appendVarint(long value)
    {
        long zigZag = (value << 1) ^ (value >> 63);
        while ((zigZag & ~0x7FL) != 0) {
            output.writeByte((int) ((zigZag & 0x7F) | 0x80));
            zigZag >>>= 7;
        }
        output.writeByte((int) zigZag);
    }
}
