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

import io.airlift.slice.Slice;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

import static java.util.Objects.requireNonNull;

/**
 * A single position of a {@link Chunk}, read column by column.
 */
public final class Row
{
    /**
     * A row with no columns. Evaluating an expression against it succeeds only
     * if the expression does not read any column.
     */
    public static final Row EMPTY = new Row(new Chunk(1), 0);

    private final Chunk chunk;
    private final int position;

    Row(Chunk chunk, int position)
    {
        this.chunk = requireNonNull(chunk, "chunk is null");
        this.position = position;
    }

    public Chunk getChunk()
    {
        return chunk;
    }

    public int getPosition()
    {
        return position;
    }

    public int getColumnCount()
    {
        return chunk.getColumnCount();
    }

    public boolean isNull(int channel)
    {
        return chunk.getColumn(channel).isNull(position);
    }

    public long getLong(int channel)
    {
        return chunk.getColumn(channel).getLong(position);
    }

    public double getDouble(int channel)
    {
        return chunk.getColumn(channel).getDouble(position);
    }

    public Slice getSlice(int channel)
    {
        return chunk.getColumn(channel).getSlice(position);
    }

    public BigDecimal getDecimal(int channel)
    {
        return chunk.getColumn(channel).getDecimal(position);
    }

    public LocalDateTime getTimestamp(int channel)
    {
        return chunk.getColumn(channel).getTimestamp(position);
    }

    public Duration getDuration(int channel)
    {
        return chunk.getColumn(channel).getDuration(position);
    }
}
