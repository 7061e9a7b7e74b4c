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
import io.tessera.spi.TesseraException;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.type.EvalType;
import io.tessera.sql.StatementContext;
import org.testng.annotations.Test;

import java.util.Arrays;

import static io.airlift.slice.Slices.utf8Slice;
import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.UNSIGNED_BIGINT;
import static io.tessera.spi.type.FieldType.VARCHAR;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestColumnReference
{
    private final Chunk chunk = new Chunk(
            ColumnVector.ofLongs(5L, null),
            ColumnVector.ofObjects(EvalType.STRING, utf8Slice("x"), utf8Slice("y")),
            ColumnVector.ofLongs(-1L, 0L));

    @Test
    public void testResolveAndEvaluate()
    {
        ColumnReference column = new ColumnReference(10, "name", VARCHAR);
        ColumnReference resolved = column.resolveIndices(Schema.of(new ColumnReference(1, "id", BIGINT), column));

        assertNotSame(resolved, column);
        assertEquals(column.getIndex(), ColumnReference.UNRESOLVED_INDEX);
        assertEquals(resolved.getIndex(), 1);
        assertEquals(resolved, column);
        assertEquals(resolved.evalString(chunk.getRow(1)), utf8Slice("y"));
        assertEquals(resolved.evaluate(chunk.getRow(0)), utf8Slice("x"));
    }

    @Test
    public void testNullsAndUnsigned()
    {
        ColumnReference id = new ColumnReference(1, "id", BIGINT, 0);
        assertNull(id.evalInt(chunk.getRow(1)));
        assertNull(id.evaluate(chunk.getRow(1)));

        ColumnReference flags = new ColumnReference(3, "flags", UNSIGNED_BIGINT, 2);
        assertEquals(flags.evaluate(chunk.getRow(0)), UnsignedLong.MAX_VALUE);
        assertEquals(flags.evalInt(chunk.getRow(0)), Long.valueOf(-1));
    }

    @Test
    public void testVectorizedEvaluation()
    {
        ColumnReference id = new ColumnReference(1, "id", BIGINT, 0);
        ColumnVector result = new ColumnVector(EvalType.INT, 0);
        id.vecEvalInt(chunk, result);
        assertEquals(result.getLong(0), 5L);
        assertTrue(result.isNull(1));
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "Column id holds INT values, but STRING values were requested")
    public void testVectorizedEvaluationWrongCategory()
    {
        new ColumnReference(1, "id", BIGINT, 0).vecEvalString(chunk, new ColumnVector(EvalType.STRING, 0));
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "Column id is not bound to a row layout")
    public void testUnresolved()
    {
        new ColumnReference(1, "id", BIGINT).evalInt(chunk.getRow(0));
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "Column id not found in Schema\\[other\\]")
    public void testMissingColumn()
    {
        new ColumnReference(1, "id", BIGINT).resolveIndices(Schema.of(new ColumnReference(2, "other", BIGINT)));
    }

    @Test
    public void testTreeOperations()
    {
        ColumnReference column = new ColumnReference(1, "id", BIGINT);
        StatementContext context = new StatementContext();
        assertFalse(column.isConstant());
        assertFalse(column.isCorrelated());
        assertSame(column.decorrelate(Schema.of(column)), column);
        assertEquals(column.getHashCode(context), new ColumnReference(1, "renamed", BIGINT, 3).getHashCode(context));
        assertFalse(Arrays.equals(column.getHashCode(context), new ColumnReference(2, "id", BIGINT).getHashCode(context)));
        assertEquals(column.toString(), "id");
    }
}
