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
package io.tessera.operator.scalar;

import com.google.common.primitives.UnsignedLong;
import io.tessera.spi.TesseraException;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.expression.ScalarFunction;
import org.testng.annotations.Test;

import java.math.BigDecimal;

import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.DOUBLE;
import static io.tessera.spi.type.FieldType.UNSIGNED_BIGINT;
import static io.tessera.sql.expression.Expressions.constant;
import static org.testng.Assert.assertEquals;

public class TestMathFunctions
        extends AbstractTestFunctions
{
    @Test
    public void testAbs()
    {
        assertFunction(call("abs", constant(-5L, BIGINT)), 5L);
        assertFunction(call("abs", constant(-2.5, DOUBLE)), 2.5);
        assertFunction(call("abs", constant(new BigDecimal("-1.10"), FieldType.DECIMAL)), new BigDecimal("1.1"));
        assertFunction(call("abs", constant(null, BIGINT)), null);
        assertEquals(call("abs", constant(-1L, UNSIGNED_BIGINT)).getType(), UNSIGNED_BIGINT);
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "BIGINT value is out of range in 'abs\\(-9223372036854775808\\)'")
    public void testAbsOverflow()
    {
        call("abs", constant(Long.MIN_VALUE, BIGINT)).evalInt(Row.EMPTY);
    }

    @Test
    public void testBitwiseNot()
    {
        ScalarFunction function = call("bitneg", constant(0L, BIGINT));
        assertEquals(function.getType(), UNSIGNED_BIGINT);
        assertFunction(function, -1L);
        assertEquals(function.evaluate(Row.EMPTY), UnsignedLong.MAX_VALUE);
        assertEquals(call("bitneg", constant(-1L, UNSIGNED_BIGINT)).evaluate(Row.EMPTY), UnsignedLong.ZERO);
        assertFunction(call("bitneg", constant(null, BIGINT)), null);
    }
}
