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

import static io.tessera.spi.StandardErrorCode.COLUMN_NOT_FOUND;
import static io.tessera.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.util.Objects.requireNonNull;

/**
 * Reference to a column of the current query. The column is identified by its
 * unique id; {@link #resolveIndices(Schema)} binds it to an offset in a row.
 */
public final class ColumnReference
        extends Expression
{
    public static final int UNRESOLVED_INDEX = -1;

    private final long uniqueId;
    private final String name;
    private final FieldType type;
    private int index;

    public ColumnReference(long uniqueId, String name, FieldType type)
    {
        this(uniqueId, name, type, UNRESOLVED_INDEX);
    }

    public ColumnReference(long uniqueId, String name, FieldType type, int index)
    {
        this.uniqueId = uniqueId;
        this.name = requireNonNull(name, "name is null");
        this.type = requireNonNull(type, "type is null");
        this.index = index;
    }

    public long getUniqueId()
    {
        return uniqueId;
    }

    public String getName()
    {
        return name;
    }

    public int getIndex()
    {
        return index;
    }

    @Override
    public FieldType getType()
    {
        return type;
    }

    @Override
    public Object evaluate(Row row)
    {
        checkResolved();
        if (row.isNull(index)) {
            return null;
        }
        Object value = row.getChunk().getColumn(index).getObject(row.getPosition());
        if (type.isUnsigned() && value instanceof Long) {
            return UnsignedLong.fromLongBits((Long) value);
        }
        return value;
    }

    @Override
    public Long evalInt(Row row)
    {
        checkResolved();
        return row.isNull(index) ? null : row.getLong(index);
    }

    @Override
    public Double evalReal(Row row)
    {
        checkResolved();
        return row.isNull(index) ? null : row.getDouble(index);
    }

    @Override
    public Slice evalString(Row row)
    {
        checkResolved();
        return row.isNull(index) ? null : row.getSlice(index);
    }

    @Override
    public BigDecimal evalDecimal(Row row)
    {
        checkResolved();
        return row.isNull(index) ? null : row.getDecimal(index);
    }

    @Override
    public LocalDateTime evalTime(Row row)
    {
        checkResolved();
        return row.isNull(index) ? null : row.getTimestamp(index);
    }

    @Override
    public Duration evalDuration(Row row)
    {
        checkResolved();
        return row.isNull(index) ? null : row.getDuration(index);
    }

    @Override
    public void vecEvalInt(Chunk input, ColumnVector result)
    {
        copyColumn(input, result);
    }

    @Override
    public void vecEvalReal(Chunk input, ColumnVector result)
    {
        copyColumn(input, result);
    }

    @Override
    public void vecEvalString(Chunk input, ColumnVector result)
    {
        copyColumn(input, result);
    }

    @Override
    public void vecEvalDecimal(Chunk input, ColumnVector result)
    {
        copyColumn(input, result);
    }

    @Override
    public void vecEvalTime(Chunk input, ColumnVector result)
    {
        copyColumn(input, result);
    }

    @Override
    public void vecEvalDuration(Chunk input, ColumnVector result)
    {
        copyColumn(input, result);
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
                .appendFlag(HashEncoder.COLUMN_FLAG)
                .appendComparableLong(uniqueId)
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
        return false;
    }

    @Override
    public Expression decorrelate(Schema schema)
    {
        return this;
    }

    @Override
    public ColumnReference resolveIndices(Schema schema)
    {
        ColumnReference copy = copy();
        copy.resolveIndicesInPlace(schema);
        return copy;
    }

    @Override
    void resolveIndicesInPlace(Schema schema)
    {
        int index = schema.getColumnIndex(this);
        if (index < 0) {
            throw tesseraException(COLUMN_NOT_FOUND, "Column %s not found in %s", this, schema);
        }
        this.index = index;
    }

    @Override
    public ColumnReference copy()
    {
        return new ColumnReference(uniqueId, name, type, index);
    }

    private void copyColumn(Chunk input, ColumnVector result)
    {
        checkResolved();
        ColumnVector column = input.getColumn(index);
        if (column.getEvalType() != result.getEvalType()) {
            throw tesseraException(TYPE_MISMATCH, "Column %s holds %s values, but %s values were requested", this, column.getEvalType(), result.getEvalType());
        }
        column.copyInto(result);
    }

    private void checkResolved()
    {
        if (index == UNRESOLVED_INDEX) {
            throw tesseraException(GENERIC_INTERNAL_ERROR, "Column %s is not bound to a row layout", this);
        }
    }

    /**
     * Column references are equal when they refer to the same column, whatever offset they are bound to.
     */
    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ColumnReference other = (ColumnReference) obj;
        return uniqueId == other.uniqueId;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(uniqueId);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
