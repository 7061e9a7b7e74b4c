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
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.StatementContext;
import org.testng.annotations.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

import static io.airlift.slice.Slices.utf8Slice;
import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.DOUBLE;
import static io.tessera.spi.type.FieldType.UNSIGNED_BIGINT;
import static io.tessera.spi.type.FieldType.VARCHAR;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestConstant
{
    @Test
    public void testNormalizesValues()
    {
        assertEquals(new Constant(1, BIGINT).getValue(), 1L);
        assertEquals(new Constant(true, FieldType.BOOLEAN).getValue(), 1L);
        assertEquals(new Constant("abc", VARCHAR).getValue(), utf8Slice("abc"));
        assertEquals(new Constant(UnsignedLong.MAX_VALUE, UNSIGNED_BIGINT).getValue(), -1L);
        assertEquals(new Constant("2024-01-01 01:02:03", FieldType.TIMESTAMP).getValue(), LocalDateTime.of(2024, 1, 1, 1, 2, 3));
        assertTrue(Constant.nullConstant(BIGINT).isNull());
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "Value 1 cannot have type unspecified")
    public void testUntypedValue()
    {
        new Constant("1", FieldType.UNSPECIFIED);
    }

    @Test
    public void testEvaluation()
    {
        Constant constant = new Constant(-1L, UNSIGNED_BIGINT);
        assertEquals(constant.evaluate(Row.EMPTY), UnsignedLong.MAX_VALUE);
        assertEquals(constant.evalReal(Row.EMPTY), 1.8446744073709552E19);
        assertEquals(constant.evalString(Row.EMPTY), utf8Slice("18446744073709551615"));
        assertEquals(new Constant("42", VARCHAR).evalInt(Row.EMPTY), Long.valueOf(42));

        ColumnVector result = new ColumnVector(EvalType.REAL, 0);
        new Constant(2L, BIGINT).vecEvalReal(new Chunk(2), result);
        assertEquals(result.getPositionCount(), 2);
        assertEquals(result.getDouble(1), 2.0);
    }

    @Test
    public void testTreeOperations()
    {
        Constant constant = new Constant(1L, BIGINT);
        assertTrue(constant.isConstant());
        assertFalse(constant.isCorrelated());
        assertTrue(constant.isVectorized());
        assertSame(constant.copy(), constant);
        assertSame(constant.resolveIndices(Schema.of()), constant);
        assertSame(constant.decorrelate(Schema.of()), constant);
    }

    @Test
    public void testEquality()
    {
        assertEquals(new Constant(new BigDecimal("1.50"), FieldType.DECIMAL), new Constant(new BigDecimal("1.5"), FieldType.DECIMAL));
        assertEquals(new Constant(new BigDecimal("1.50"), FieldType.DECIMAL).hashCode(), new Constant(new BigDecimal("1.5"), FieldType.DECIMAL).hashCode());
        assertEquals(new Constant(1, BIGINT), new Constant(1L, FieldType.INTEGER));
        assertNotEquals(new Constant(1L, BIGINT), new Constant(1L, UNSIGNED_BIGINT));
        assertNotEquals(new Constant(1L, BIGINT), new Constant(1.0, DOUBLE));
        assertEquals(Constant.nullConstant(BIGINT), Constant.nullConstant(FieldType.INTEGER));
    }

    @Test
    public void testHash()
    {
        StatementContext context = new StatementContext();
        assertEquals(new Constant(1L, BIGINT).getHashCode(context), new Constant(1L, BIGINT).getHashCode(context));
        assertFalse(Arrays.equals(new Constant(1L, BIGINT).getHashCode(context), new Constant(1L, UNSIGNED_BIGINT).getHashCode(context)));
        assertFalse(Arrays.equals(new Constant(1L, BIGINT).getHashCode(context), new Constant("1", VARCHAR).getHashCode(context)));
        assertEquals(new Constant(new BigDecimal("1.50"), FieldType.DECIMAL).getHashCode(context), new Constant(new BigDecimal("1.5"), FieldType.DECIMAL).getHashCode(context));
    }

    @Test
    public void testHashOfLongDurations()
    {
        StatementContext context = new StatementContext();
        byte[] thousandYears = new Constant(Duration.ofDays(365_000), FieldType.DURATION).getHashCode(context);
        assertEquals(new Constant(Duration.ofDays(365_000), FieldType.DURATION).getHashCode(context), thousandYears);
        assertFalse(Arrays.equals(new Constant(Duration.ofDays(365_000).plusNanos(1), FieldType.DURATION).getHashCode(context), thousandYears));
        assertFalse(Arrays.equals(new Constant(Duration.ofSeconds(Long.MIN_VALUE), FieldType.DURATION).getHashCode(context), thousandYears));
    }

    @Test
    public void testRendering()
    {
        assertEquals(new Constant(1L, BIGINT).toString(), "1");
        assertEquals(new Constant(-1L, UNSIGNED_BIGINT).toString(), "18446744073709551615");
        assertEquals(new Constant(2.5, DOUBLE).toString(), "2.5");
        assertEquals(new Constant("a'b", VARCHAR).toString(), "'a''b'");
        assertEquals(new Constant(new BigDecimal("1.50"), FieldType.DECIMAL).toString(), "1.50");
        assertEquals(new Constant("2024-01-01 00:00:00.5", FieldType.TIMESTAMP).toString(), "'2024-01-01 00:00:00.500000'");
        assertEquals(Constant.nullConstant(VARCHAR).toString(), "NULL");
        assertNull(Constant.nullConstant(VARCHAR).evaluate(Row.EMPTY));
    }
}
