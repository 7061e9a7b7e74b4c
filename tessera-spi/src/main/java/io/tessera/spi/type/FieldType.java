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
package io.tessera.spi.type;

import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Declared type of an expression: a {@link TypeCode} plus the flags and
 * precision attributes that change how a value of that code is interpreted.
 * <p>
 * Instances are immutable. The {@link #UNSPECIFIED} type is a sentinel meaning
 * "no type was inferred"; it is a real value and never {@code null}.
 */
public final class FieldType
{
    public static final int UNSPECIFIED_LENGTH = -1;
    public static final int MAX_DECIMAL_PRECISION = 65;
    public static final int MAX_DECIMAL_SCALE = 30;

    public static final FieldType UNSPECIFIED = new FieldType(TypeCode.UNSPECIFIED, false, false, UNSPECIFIED_LENGTH, UNSPECIFIED_LENGTH);
    public static final FieldType NULL = new FieldType(TypeCode.NULL, false, false, UNSPECIFIED_LENGTH, UNSPECIFIED_LENGTH);
    public static final FieldType BOOLEAN = new FieldType(TypeCode.TINYINT, false, false, 1, 0);
    public static final FieldType INTEGER = new FieldType(TypeCode.INTEGER, false, false, 11, 0);
    public static final FieldType BIGINT = new FieldType(TypeCode.BIGINT, false, false, 20, 0);
    public static final FieldType UNSIGNED_BIGINT = new FieldType(TypeCode.BIGINT, true, false, 20, 0);
    public static final FieldType DOUBLE = new FieldType(TypeCode.DOUBLE, false, false, UNSPECIFIED_LENGTH, UNSPECIFIED_LENGTH);
    public static final FieldType VARCHAR = new FieldType(TypeCode.VARCHAR, false, false, UNSPECIFIED_LENGTH, UNSPECIFIED_LENGTH);
    public static final FieldType DECIMAL = new FieldType(TypeCode.DECIMAL, false, false, MAX_DECIMAL_PRECISION, MAX_DECIMAL_SCALE);
    public static final FieldType TIMESTAMP = new FieldType(TypeCode.TIMESTAMP, false, false, UNSPECIFIED_LENGTH, 6);
    public static final FieldType DURATION = new FieldType(TypeCode.DURATION, false, false, UNSPECIFIED_LENGTH, 6);
    public static final FieldType JSON = new FieldType(TypeCode.JSON, false, false, UNSPECIFIED_LENGTH, UNSPECIFIED_LENGTH);

    private final TypeCode typeCode;
    private final boolean unsigned;
    private final boolean notNull;
    private final int length;
    private final int scale;

    public FieldType(TypeCode typeCode, boolean unsigned, boolean notNull, int length, int scale)
    {
        this.typeCode = requireNonNull(typeCode, "typeCode is null");
        if (unsigned && !typeCode.isInteger()) {
            throw new IllegalArgumentException(format("type %s cannot be unsigned", typeCode.getDisplayName()));
        }
        this.unsigned = unsigned;
        this.notNull = notNull;
        this.length = length;
        this.scale = scale;
    }

    public static FieldType createDecimalType(int precision, int scale)
    {
        if (precision <= 0 || precision > MAX_DECIMAL_PRECISION) {
            throw new IllegalArgumentException(format("Invalid decimal precision %s", precision));
        }
        if (scale < 0 || scale > precision || scale > MAX_DECIMAL_SCALE) {
            throw new IllegalArgumentException(format("Invalid decimal scale %s for precision %s", scale, precision));
        }
        return new FieldType(TypeCode.DECIMAL, false, false, precision, scale);
    }

    public TypeCode getTypeCode()
    {
        return typeCode;
    }

    public EvalType getEvalType()
    {
        return typeCode.getEvalType();
    }

    public boolean isUnsigned()
    {
        return unsigned;
    }

    public boolean isNotNull()
    {
        return notNull;
    }

    public boolean isUnspecified()
    {
        return typeCode == TypeCode.UNSPECIFIED;
    }

    public int getLength()
    {
        return length;
    }

    public int getScale()
    {
        return scale;
    }

    public FieldType withNotNull(boolean notNull)
    {
        if (this.notNull == notNull) {
            return this;
        }
        return new FieldType(typeCode, unsigned, notNull, length, scale);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldType other = (FieldType) o;
        return typeCode == other.typeCode &&
                unsigned == other.unsigned &&
                notNull == other.notNull &&
                length == other.length &&
                scale == other.scale;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(typeCode, unsigned, notNull, length, scale);
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder(typeCode.getDisplayName());
        if (typeCode == TypeCode.DECIMAL) {
            builder.append('(').append(length).append(',').append(scale).append(')');
        }
        if (unsigned) {
            builder.append(" unsigned");
        }
        if (notNull) {
            builder.append(" not null");
        }
        return builder.toString();
    }
}
