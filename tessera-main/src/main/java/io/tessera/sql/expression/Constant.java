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
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.StatementContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Literal value. The value is held in the native container of the type's
 * evaluation category and converted on access.
 */
public final class Constant
        extends Expression
{
    private final Object value;
    private final FieldType type;

    public Constant(Object value, FieldType type)
    {
        this.type = requireNonNull(type, "type is null");
        this.value = ValueConversions.toNativeValue(value, type);
    }

    public static Constant nullConstant(FieldType type)
    {
        return new Constant(null, type);
    }

    public Object getValue()
    {
        return value;
    }

    public boolean isNull()
    {
        return value == null;
    }

    @Override
    public FieldType getType()
    {
        return type;
    }

    @Override
    public Object evaluate(Row row)
    {
        if (type.isUnsigned() && value instanceof Long) {
            return UnsignedLong.fromLongBits((Long) value);
        }
        return value;
    }

    @Override
    public Long evalInt(Row row)
    {
        return ValueConversions.toLong(value);
    }

    @Override
    public Double evalReal(Row row)
    {
        return ValueConversions.toDouble(value, type.isUnsigned());
    }

    @Override
    public Slice evalString(Row row)
    {
        return ValueConversions.toSlice(value, type.isUnsigned());
    }

    @Override
    public BigDecimal evalDecimal(Row row)
    {
        return ValueConversions.toDecimal(value, type.isUnsigned());
    }

    @Override
    public LocalDateTime evalTime(Row row)
    {
        return ValueConversions.toTimestamp(value);
    }

    @Override
    public Duration evalDuration(Row row)
    {
        return ValueConversions.toDuration(value);
    }

    @Override
    public void vecEvalInt(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value, type);
    }

    @Override
    public void vecEvalReal(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value, type);
    }

    @Override
    public void vecEvalString(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value, type);
    }

    @Override
    public void vecEvalDecimal(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value, type);
    }

    @Override
    public void vecEvalTime(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value, type);
    }

    @Override
    public void vecEvalDuration(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value, type);
    }

    @Override
    public boolean isVectorized()
    {
        return true;
    }

    @Override
    public byte[] getHashCode(StatementContext context)
    {
        return new HashEncoder(16)
                .appendFlag(HashEncoder.CONSTANT_FLAG)
                .appendValue(value, type.isUnsigned())
                .toByteArray();
    }

    @Override
    public boolean isConstant()
    {
        return true;
    }

    @Override
    public boolean isCorrelated()
    {
        return false;
    }

    @Override
    public Expression decorrelate(Schema schema)
    {
        return this;
    }

    @Override
    public Expression resolveIndices(Schema schema)
    {
        return this;
    }

    @Override
    void resolveIndicesInPlace(Schema schema) {}

    /**
     * Constants are immutable, so the copy is this constant.
     */
    @Override
    public Constant copy()
    {
        return this;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Constant other = (Constant) obj;
        if (type.getEvalType() != other.type.getEvalType() || type.isUnsigned() != other.type.isUnsigned()) {
            return false;
        }
        if (value instanceof BigDecimal && other.value instanceof BigDecimal) {
            return ((BigDecimal) value).compareTo((BigDecimal) other.value) == 0;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode()
    {
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            return Objects.hash(type.getEvalType(), decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros());
        }
        return Objects.hash(type.getEvalType(), value);
    }

    /**
     * Renders the literal as SQL: strings are single quoted, NULL is {@code NULL}.
     */
    @Override
    public String toString()
    {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Slice) {
            return "'" + ((Slice) value).toStringUtf8().replace("'", "''") + "'";
        }
        if (value instanceof Double) {
            return ValueConversions.formatDouble((Double) value);
        }
        if (value instanceof Long && type.isUnsigned()) {
            return Long.toUnsignedString((Long) value);
        }
        if (value instanceof LocalDateTime) {
            return "'" + ValueConversions.formatTimestamp((LocalDateTime) value) + "'";
        }
        if (value instanceof Duration) {
            return "'" + ValueConversions.formatDuration((Duration) value) + "'";
        }
        return value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : value.toString();
    }
}
