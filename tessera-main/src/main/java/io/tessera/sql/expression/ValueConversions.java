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

import com.google.common.primitives.UnsignedLong;
import io.airlift.slice.Slice;
import io.tessera.spi.TesseraException;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.spi.type.TypeCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

import static io.airlift.slice.Slices.utf8Slice;
import static io.tessera.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Conversions between the native containers of the evaluation categories:
 * {@code Long} (INT), {@code Double} (REAL), {@link Slice} (STRING, JSON),
 * {@link BigDecimal} (DECIMAL), {@link LocalDateTime} (DATETIME) and
 * {@link Duration} (DURATION). {@code null} is SQL NULL and converts to {@code null}.
 */
public final class ValueConversions
{
    private static final DateTimeFormatter TIMESTAMP_PARSER = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd")
            .optionalStart()
            .appendLiteral(' ')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private ValueConversions() {}

    /**
     * Normalizes a Java value into the native container of {@code type}'s evaluation category.
     */
    public static Object toNativeValue(Object value, FieldType type)
    {
        requireNonNull(type, "type is null");
        if (value == null) {
            return null;
        }
        if (type.isUnspecified() || type.getTypeCode() == TypeCode.NULL) {
            throw tesseraException(TYPE_MISMATCH, "Value %s cannot have type %s", value, type);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            value = ((Number) value).longValue();
        }
        else if (value instanceof Float) {
            value = ((Float) value).doubleValue();
        }
        else if (value instanceof Boolean) {
            value = ((Boolean) value) ? 1L : 0L;
        }
        else if (value instanceof String) {
            value = utf8Slice((String) value);
        }
        else if (value instanceof UnsignedLong) {
            value = ((UnsignedLong) value).longValue();
        }

        switch (type.getEvalType()) {
            case INT:
                return toLong(value);
            case REAL:
                return toDouble(value, false);
            case DECIMAL:
                return toDecimal(value, false);
            case DATETIME:
                return toTimestamp(value);
            case DURATION:
                return toDuration(value);
            case STRING:
            case JSON:
                return toSlice(value, false);
        }
        throw new AssertionError("Unknown eval type: " + type.getEvalType());
    }

    public static Long toLong(Object value)
    {
        if (value == null || value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Double) {
            double doubleValue = (Double) value;
            if (Double.isNaN(doubleValue) || doubleValue >= 0x1p63 || doubleValue < -0x1p63) {
                throw tesseraException(NUMERIC_VALUE_OUT_OF_RANGE, "Value %s is out of range for bigint", value);
            }
            return Math.round(doubleValue);
        }
        if (value instanceof BigDecimal) {
            try {
                return ((BigDecimal) value).setScale(0, RoundingMode.HALF_UP).longValueExact();
            }
            catch (ArithmeticException e) {
                throw new TesseraException(NUMERIC_VALUE_OUT_OF_RANGE, format("Value %s is out of range for bigint", value), e);
            }
        }
        if (value instanceof Slice) {
            String string = ((Slice) value).toStringUtf8().trim();
            try {
                return Long.parseLong(string);
            }
            catch (NumberFormatException e) {
                throw new TesseraException(TYPE_MISMATCH, format("Cannot convert '%s' to bigint", string), e);
            }
        }
        throw cannotConvert(value, "bigint");
    }

    public static Double toDouble(Object value, boolean unsigned)
    {
        if (value == null || value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Long) {
            long longValue = (Long) value;
            return unsigned ? UnsignedLong.fromLongBits(longValue).doubleValue() : (double) longValue;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof Slice) {
            String string = ((Slice) value).toStringUtf8().trim();
            try {
                return Double.parseDouble(string);
            }
            catch (NumberFormatException e) {
                throw new TesseraException(TYPE_MISMATCH, format("Cannot convert '%s' to double", string), e);
            }
        }
        throw cannotConvert(value, "double");
    }

    public static BigDecimal toDecimal(Object value, boolean unsigned)
    {
        if (value == null || value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Long) {
            long longValue = (Long) value;
            return unsigned ? new BigDecimal(Long.toUnsignedString(longValue)) : BigDecimal.valueOf(longValue);
        }
        if (value instanceof Double) {
            double doubleValue = (Double) value;
            if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)) {
                throw tesseraException(NUMERIC_VALUE_OUT_OF_RANGE, "Value %s is out of range for decimal", value);
            }
            return BigDecimal.valueOf(doubleValue);
        }
        if (value instanceof Slice) {
            String string = ((Slice) value).toStringUtf8().trim();
            try {
                return new BigDecimal(string);
            }
            catch (NumberFormatException e) {
                throw new TesseraException(TYPE_MISMATCH, format("Cannot convert '%s' to decimal", string), e);
            }
        }
        throw cannotConvert(value, "decimal");
    }

    public static Slice toSlice(Object value, boolean unsigned)
    {
        if (value == null || value instanceof Slice) {
            return (Slice) value;
        }
        if (value instanceof Long) {
            long longValue = (Long) value;
            return utf8Slice(unsigned ? Long.toUnsignedString(longValue) : Long.toString(longValue));
        }
        if (value instanceof Double) {
            return utf8Slice(formatDouble((Double) value));
        }
        if (value instanceof BigDecimal) {
            return utf8Slice(((BigDecimal) value).toPlainString());
        }
        if (value instanceof LocalDateTime) {
            return utf8Slice(formatTimestamp((LocalDateTime) value));
        }
        if (value instanceof Duration) {
            return utf8Slice(formatDuration((Duration) value));
        }
        throw cannotConvert(value, "varchar");
    }

    public static LocalDateTime toTimestamp(Object value)
    {
        if (value == null || value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Slice) {
            String string = ((Slice) value).toStringUtf8().trim();
            try {
                return LocalDateTime.parse(string, TIMESTAMP_PARSER);
            }
            catch (DateTimeParseException e) {
                throw new TesseraException(TYPE_MISMATCH, format("Cannot convert '%s' to timestamp", string), e);
            }
        }
        throw cannotConvert(value, "timestamp");
    }

    public static Duration toDuration(Object value)
    {
        if (value == null || value instanceof Duration) {
            return (Duration) value;
        }
        throw cannotConvert(value, "duration");
    }

    /**
     * Writes {@code value}, converted to the category of {@code result}, to the first
     * {@code positionCount} positions of {@code result}.
     */
    public static void fill(ColumnVector result, int positionCount, Object value, FieldType valueType)
    {
        result.reset(positionCount);
        if (value == null) {
            for (int i = 0; i < positionCount; i++) {
                result.setNull(i);
            }
            return;
        }
        EvalType evalType = result.getEvalType();
        boolean unsigned = valueType.isUnsigned();
        switch (evalType) {
            case INT: {
                long converted = toLong(value);
                for (int i = 0; i < positionCount; i++) {
                    result.setLong(i, converted);
                }
                return;
            }
            case REAL: {
                double converted = toDouble(value, unsigned);
                for (int i = 0; i < positionCount; i++) {
                    result.setDouble(i, converted);
                }
                return;
            }
            case DECIMAL: {
                BigDecimal converted = toDecimal(value, unsigned);
                for (int i = 0; i < positionCount; i++) {
                    result.setDecimal(i, converted);
                }
                return;
            }
            case DATETIME: {
                LocalDateTime converted = toTimestamp(value);
                for (int i = 0; i < positionCount; i++) {
                    result.setTimestamp(i, converted);
                }
                return;
            }
            case DURATION: {
                Duration converted = toDuration(value);
                for (int i = 0; i < positionCount; i++) {
                    result.setDuration(i, converted);
                }
                return;
            }
            case STRING:
            case JSON: {
                Slice converted = toSlice(value, unsigned);
                for (int i = 0; i < positionCount; i++) {
                    result.setSlice(i, converted);
                }
                return;
            }
        }
        throw new AssertionError("Unknown eval type: " + evalType);
    }

    /**
     * Writes a native value, or NULL, to one position of {@code result}.
     */
    public static void writeValue(ColumnVector result, int position, Object value)
    {
        if (value == null) {
            result.setNull(position);
        }
        else if (value instanceof Long) {
            result.setLong(position, (Long) value);
        }
        else if (value instanceof Double) {
            result.setDouble(position, (Double) value);
        }
        else if (value instanceof BigDecimal) {
            result.setDecimal(position, (BigDecimal) value);
        }
        else if (value instanceof LocalDateTime) {
            result.setTimestamp(position, (LocalDateTime) value);
        }
        else if (value instanceof Duration) {
            result.setDuration(position, (Duration) value);
        }
        else if (value instanceof Slice) {
            result.setSlice(position, (Slice) value);
        }
        else {
            throw cannotConvert(value, result.getEvalType().toString());
        }
    }

    public static String formatDouble(double value)
    {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String formatTimestamp(LocalDateTime value)
    {
        String formatted = format("%04d-%02d-%02d %02d:%02d:%02d",
                value.getYear(),
                value.getMonthValue(),
                value.getDayOfMonth(),
                value.getHour(),
                value.getMinute(),
                value.getSecond());
        if (value.getNano() != 0) {
            formatted += format(".%06d", value.getNano() / 1000);
        }
        return formatted;
    }

    public static String formatDuration(Duration value)
    {
        Duration absolute = value.abs();
        String formatted = format("%s%02d:%02d:%02d",
                value.isNegative() ? "-" : "",
                absolute.toHours(),
                absolute.toMinutesPart(),
                absolute.toSecondsPart());
        if (absolute.getNano() != 0) {
            formatted += format(".%06d", absolute.getNano() / 1000);
        }
        return formatted;
    }

    private static TesseraException cannotConvert(Object value, String targetType)
    {
        return tesseraException(TYPE_MISMATCH, "Cannot convert %s value to %s", value.getClass().getSimpleName(), targetType);
    }
}
