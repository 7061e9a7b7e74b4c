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
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Reference to a column of an enclosing query. While the enclosing query runs,
 * the executor binds the current outer value with {@link #setValue(Object)}; the
 * reference evaluates to that value for every inner row.
 * <p>
 * Copies share the bound value, so binding the outer row once updates every copy
 * of the tree.
 */
public final class CorrelatedColumnReference
        extends Expression
{
    private final ColumnReference column;
    private final AtomicReference<Object> value;

    public CorrelatedColumnReference(ColumnReference column)
    {
        this(column, new AtomicReference<>());
    }

    private CorrelatedColumnReference(ColumnReference column, AtomicReference<Object> value)
    {
        this.column = requireNonNull(column, "column is null");
        this.value = requireNonNull(value, "value is null");
    }

    public ColumnReference getColumn()
    {
        return column;
    }

    public void setValue(Object value)
    {
        this.value.set(ValueConversions.toNativeValue(value, column.getType()));
    }

    public Object getValue()
    {
        return value.get();
    }

    @Override
    public FieldType getType()
    {
        return column.getType();
    }

    @Override
    public Object evaluate(Row row)
    {
        Object current = value.get();
        if (getType().isUnsigned() && current instanceof Long) {
            return UnsignedLong.fromLongBits((Long) current);
        }
        return current;
    }

    @Override
    public Long evalInt(Row row)
    {
        return ValueConversions.toLong(value.get());
    }

    @Override
    public Double evalReal(Row row)
    {
        return ValueConversions.toDouble(value.get(), getType().isUnsigned());
    }

    @Override
    public Slice evalString(Row row)
    {
        return ValueConversions.toSlice(value.get(), getType().isUnsigned());
    }

    @Override
    public BigDecimal evalDecimal(Row row)
    {
        return ValueConversions.toDecimal(value.get(), getType().isUnsigned());
    }

    @Override
    public LocalDateTime evalTime(Row row)
    {
        return ValueConversions.toTimestamp(value.get());
    }

    @Override
    public Duration evalDuration(Row row)
    {
        return ValueConversions.toDuration(value.get());
    }

    @Override
    public void vecEvalInt(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value.get(), getType());
    }

    @Override
    public void vecEvalReal(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value.get(), getType());
    }

    @Override
    public void vecEvalString(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value.get(), getType());
    }

    @Override
    public void vecEvalDecimal(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value.get(), getType());
    }

    @Override
    public void vecEvalTime(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value.get(), getType());
    }

    @Override
    public void vecEvalDuration(Chunk input, ColumnVector result)
    {
        ValueConversions.fill(result, input.getPositionCount(), value.get(), getType());
    }

    @Override
    public boolean isVectorized()
    {
        return true;
    }

    @Override
    public byte[] getHashCode(StatementContext context)
    {
        return new HashEncoder(9)
                .appendFlag(HashEncoder.CORRELATED_COLUMN_FLAG)
                .appendComparableLong(column.getUniqueId())
                .toByteArray();
    }

    @Override
    public boolean isConstant()
    {
        return false;
    }

    @Override
    public boolean isCorrelated()
    {
        return true;
    }

    /**
     * Returns a plain reference to the column if {@code schema} provides it, otherwise this reference.
     */
    @Override
    public Expression decorrelate(Schema schema)
    {
        if (schema.contains(column)) {
            return column.copy();
        }
        return this;
    }

    @Override
    public Expression resolveIndices(Schema schema)
    {
        return copy();
    }

    @Override
    void resolveIndicesInPlace(Schema schema)
    {
        // bound by value, not by offset
    }

    @Override
    public CorrelatedColumnReference copy()
    {
        return new CorrelatedColumnReference(column.copy(), value);
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
        CorrelatedColumnReference other = (CorrelatedColumnReference) obj;
        return column.equals(other.column);
    }

    @Override
    public int hashCode()
    {
        return ~column.hashCode();
    }

    @Override
    public String toString()
    {
        return column.toString();
    }
}
