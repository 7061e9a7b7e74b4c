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

import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.sql.StatementContext;
import org.testng.annotations.Test;

import java.util.Arrays;

import static io.tessera.spi.type.FieldType.BIGINT;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestCorrelatedColumnReference
{
    private final ColumnReference column = new ColumnReference(1, "outer_id", BIGINT);

    @Test
    public void testBoundValue()
    {
        CorrelatedColumnReference reference = new CorrelatedColumnReference(column);
        assertNull(reference.evalInt(Row.EMPTY));

        reference.setValue(7);
        assertEquals(reference.evalInt(Row.EMPTY), Long.valueOf(7));
        assertEquals(reference.evalReal(Row.EMPTY), 7.0);

        ColumnVector result = new ColumnVector(EvalType.INT, 0);
        reference.vecEvalInt(new Chunk(3), result);
        assertEquals(result.getPositionCount(), 3);
        assertEquals(result.getLong(2), 7L);
    }

    @Test
    public void testCopiesShareBoundValue()
    {
        CorrelatedColumnReference reference = new CorrelatedColumnReference(column);
        CorrelatedColumnReference copy = reference.copy();
        reference.setValue(3L);
        assertEquals(copy.evalInt(Row.EMPTY), Long.valueOf(3));
        assertEquals(copy, reference);
    }

    @Test
    public void testDecorrelate()
    {
        CorrelatedColumnReference reference = new CorrelatedColumnReference(column);
        assertTrue(reference.isCorrelated());
        assertFalse(reference.isConstant());

        assertSame(reference.decorrelate(Schema.of(new ColumnReference(2, "other", BIGINT))), reference);
        Expression decorrelated = reference.decorrelate(Schema.of(column));
        assertEquals(decorrelated, column);
        assertFalse(decorrelated.isCorrelated());
    }

    @Test
    public void testResolveIndicesIgnoresSchema()
    {
        CorrelatedColumnReference reference = new CorrelatedColumnReference(column);
        Expression resolved = reference.resolveIndices(Schema.of());
        assertEquals(resolved, reference);
        assertTrue(resolved.isCorrelated());
    }

    @Test
    public void testHashDiffersFromColumn()
    {
        StatementContext context = new StatementContext();
        assertFalse(Arrays.equals(new CorrelatedColumnReference(column).getHashCode(context), column.getHashCode(context)));
        assertEquals(new CorrelatedColumnReference(column).toString(), "outer_id");
    }
}
