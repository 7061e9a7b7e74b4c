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
package io.tessera.spi.block;

import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A batch of rows stored column-wise: one {@link ColumnVector} per column, all
 * with {@code positionCount} values.
 */
public final class Chunk
{
    private static final ColumnVector[] EMPTY_COLUMNS = new ColumnVector[0];

    private final ColumnVector[] columns;
    private final int positionCount;

    public Chunk(ColumnVector... columns)
    {
        this(determinePositionCount(columns), columns);
    }

    public Chunk(int positionCount)
    {
        this(positionCount, EMPTY_COLUMNS);
    }

    public Chunk(int positionCount, ColumnVector... columns)
    {
        requireNonNull(columns, "columns is null");
        if (positionCount < 0) {
            throw new IllegalArgumentException("positionCount is negative");
        }
        for (ColumnVector column : columns) {
            if (column.getPositionCount() != positionCount) {
                throw new IllegalArgumentException(format("Expected %s positions, but column has %s", positionCount, column.getPositionCount()));
            }
        }
        this.positionCount = positionCount;
        this.columns = columns.length == 0 ? EMPTY_COLUMNS : columns.clone();
    }

    public int getColumnCount()
    {
        return columns.length;
    }

    public int getPositionCount()
    {
        return positionCount;
    }

    public ColumnVector getColumn(int channel)
    {
        return columns[channel];
    }

    public List<ColumnVector> getColumns()
    {
        return unmodifiableList(Arrays.asList(columns));
    }

    public Row getRow(int position)
    {
        if (position < 0 || position >= positionCount) {
            throw new IndexOutOfBoundsException(format("Invalid position %s in chunk with %s positions", position, positionCount));
        }
        return new Row(this, position);
    }

    private static int determinePositionCount(ColumnVector... columns)
    {
        requireNonNull(columns, "columns is null");
        if (columns.length == 0) {
            throw new IllegalArgumentException("columns is empty");
        }
        return columns[0].getPositionCount();
    }

    @Override
    public String toString()
    {
        return format("Chunk{positions=%s, columns=%s}", positionCount, columns.length);
    }
}
