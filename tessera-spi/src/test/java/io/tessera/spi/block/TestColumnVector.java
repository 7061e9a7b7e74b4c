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

import java.math.BigDecimal;
import java.time.Duration;

import static io.airlift.slice.Slices.utf8Slice;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class TestColumnVector
{
    @Test
    public void testLongs()
    {
        ColumnVector vector = ColumnVector.ofLongs(1L, null, 3L);
        assertEquals(vector.getPositionCount(), 3);
        assertEquals(vector.getLong(0), 1L);
        assertTrue(vector.isNull(1));
        assertNull(vector.getObject(1));
        assertEquals(vector.getObject(2), 3L);
        assertTrue(vector.mayHaveNull());
    }

    @Test
    public void testSetValueClearsNull()
    {
        ColumnVector vector = new ColumnVector(EvalType.REAL, 2);
        vector.setNull(0);
        vector.setDouble(0, 1.5);
        assertFalse(vector.isNull(0));
        assertEquals(vector.getDouble(0), 1.5);
    }

    @Test
    public void testResetGrowsAndClearsNulls()
    {
        ColumnVector vector = ColumnVector.ofLongs(null, 2L);
        vector.reset(100);
        assertEquals(vector.getPositionCount(), 100);
        assertFalse(vector.mayHaveNull());

        vector.setNull(99);
        vector.reset(1);
        assertEquals(vector.getPositionCount(), 1);
        assertFalse(vector.isNull(0));
    }

    @Test
    public void testMergeNulls()
    {
        ColumnVector result = new ColumnVector(EvalType.INT, 3);
        result.mergeNulls(ColumnVector.ofLongs(null, 1L, 2L), ColumnVector.ofLongs(1L, 1L, null));
        assertTrue(result.isNull(0));
        assertFalse(result.isNull(1));
        assertTrue(result.isNull(2));
    }

    @Test
    public void testCopyInto()
    {
        ColumnVector source = ColumnVector.ofObjects(EvalType.STRING, utf8Slice("a"), null, utf8Slice("c"));
        ColumnVector target = ColumnVector.ofObjects(EvalType.STRING, null, utf8Slice("x"), null, null, null);
        source.copyInto(target);

        assertEquals(target.getPositionCount(), 3);
        assertEquals(target.getSlice(0), utf8Slice("a"));
        assertTrue(target.isNull(1));
        assertEquals(target.getSlice(2), utf8Slice("c"));
    }

    @Test(expectedExceptions = IllegalStateException.class, expectedExceptionsMessageRegExp = "Cannot copy INT vector into REAL vector")
    public void testCopyIntoDifferentCategory()
    {
        ColumnVector.ofLongs(1L).copyInto(ColumnVector.ofDoubles(1.0));
    }

    @Test
    public void testObjects()
    {
        ColumnVector strings = ColumnVector.ofObjects(EvalType.STRING, utf8Slice("a"), null);
        assertEquals(strings.getSlice(0), utf8Slice("a"));
        assertTrue(strings.isNull(1));

        ColumnVector decimals = ColumnVector.ofObjects(EvalType.DECIMAL, new BigDecimal("1.25"));
        assertEquals(decimals.getDecimal(0), new BigDecimal("1.25"));

        ColumnVector durations = ColumnVector.ofObjects(EvalType.DURATION, Duration.ofSeconds(5));
        assertEquals(durations.getObject(0), Duration.ofSeconds(5));
    }

    @Test(expectedExceptions = IllegalStateException.class, expectedExceptionsMessageRegExp = "Cannot access INT value in REAL vector")
    public void testWrongCategory()
    {
        ColumnVector.ofDoubles(1.0).getLong(0);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class, expectedExceptionsMessageRegExp = "Invalid position 2 in vector with 2 positions")
    public void testInvalidPosition()
    {
        ColumnVector.ofLongs(1L, 2L).getLong(2);
    }
}
