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

import io.tessera.spi.TesseraException;
import io.tessera.spi.type.FieldType;
import org.testng.annotations.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.BOOLEAN;
import static io.tessera.spi.type.FieldType.DOUBLE;
import static io.tessera.spi.type.FieldType.UNSIGNED_BIGINT;
import static io.tessera.spi.type.FieldType.VARCHAR;
import static io.tessera.sql.expression.Expressions.constant;
import static org.testng.Assert.assertEquals;

public class TestComparisonFunction
        extends AbstractTestFunctions
{
    @Test
    public void testIntegers()
    {
        assertFunction(call("eq", constant(1L, BIGINT), constant(1L, BIGINT)), 1L);
        assertFunction(call("ne", constant(1L, BIGINT), constant(1L, BIGINT)), 0L);
        assertFunction(call("lt", constant(1L, BIGINT), constant(2L, BIGINT)), 1L);
        assertFunction(call("le", constant(2L, BIGINT), constant(2L, BIGINT)), 1L);
        assertFunction(call("gt", constant(1L, BIGINT), constant(2L, BIGINT)), 0L);
        assertFunction(call("ge", constant(3L, BIGINT), constant(2L, BIGINT)), 1L);
        assertFunction(call("eq", constant(null, BIGINT), constant(1L, BIGINT)), null);
        assertEquals(call("eq", constant(1L, BIGINT), constant(1L, BIGINT)).getType(), BOOLEAN);
    }

    @Test
    public void testUnsignedIntegers()
    {
        // 18446744073709551615 unsigned is greater than any signed value
        assertFunction(call("gt", constant(-1L, UNSIGNED_BIGINT), constant(Long.MAX_VALUE, BIGINT)), 1L);
        assertFunction(call("lt", constant(1L, UNSIGNED_BIGINT), constant(-1L, UNSIGNED_BIGINT)), 1L);
    }

    @Test
    public void testMixedTypes()
    {
        assertFunction(call("eq", constant(new BigDecimal("2.00"), FieldType.DECIMAL), constant(2L, BIGINT)), 1L);
        assertFunction(call("lt", constant(1.5, DOUBLE), constant(2L, BIGINT)), 1L);
        assertFunction(call("eq", constant("10", VARCHAR), constant(10.0, DOUBLE)), 1L);
    }

    @Test
    public void testStrings()
    {
        assertFunction(call("lt", constant("abc", VARCHAR), constant("abd", VARCHAR)), 1L);
        assertFunction(call("eq", constant("abc", VARCHAR), constant("abc", VARCHAR)), 1L);
    }

    @Test
    public void testDurations()
    {
        assertFunction(call("gt", constant(Duration.ofSeconds(2), FieldType.DURATION), constant(Duration.ofSeconds(1), FieldType.DURATION)), 1L);
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "Cannot compare timestamp with bigint")
    public void testIncomparableTypes()
    {
        call("eq", constant("2024-01-01 00:00:00", FieldType.TIMESTAMP), constant(1L, BIGINT));
    }
}
