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

import io.tessera.spi.type.EvalType;
import org.testng.annotations.Test;

import static io.airlift.slice.Slices.utf8Slice;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class TestChunk
{
    @Test
    public void testRows()
    {
        Chunk chunk = new Chunk(
                ColumnVector.ofLongs(1L, null),
                ColumnVector.ofObjects(EvalType.STRING, utf8Slice("x"), utf8Slice("y")));
        assertEquals(chunk.getPositionCount(), 2);
        assertEquals(chunk.getColumnCount(), 2);

        Row row = chunk.getRow(1);
        assertTrue(row.isNull(0));
        assertEquals(row.getSlice(1), utf8Slice("y"));
        assertEquals(chunk.getRow(0).getLong(0), 1L);
    }

    @Test
    public void testEmptyRow()
    {
        assertEquals(Row.EMPTY.getColumnCount(), 0);
        assertEquals(Row.EMPTY.getChunk().getPositionCount(), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "Expected 2 positions, but column has 1")
    public void testMismatchedColumns()
    {
        new Chunk(ColumnVector.ofLongs(1L, 2L), ColumnVector.ofLongs(1L));
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class, expectedExceptionsMessageRegExp = "Invalid position 1 in chunk with 1 positions")
    public void testInvalidRow()
    {
        new Chunk(ColumnVector.ofLongs(1L)).getRow(1);
    }
}
