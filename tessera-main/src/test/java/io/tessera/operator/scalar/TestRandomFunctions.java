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
import io.tessera.spi.block.Row;
import io.tessera.sql.expression.ScalarFunction;
import org.testng.annotations.Test;

import static io.tessera.SessionTestUtils.nonStrictSession;
import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.DOUBLE;
import static io.tessera.spi.type.FieldType.UNSPECIFIED;
import static io.tessera.sql.expression.Expressions.constant;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;

public class TestRandomFunctions
        extends AbstractTestFunctions
{
    @Test
    public void testRand()
    {
        ScalarFunction function = call("rand");
        assertFalse(function.isConstant());
        assertFalse(function.isVectorized());
        for (int i = 0; i < 100; i++) {
            double value = function.evalReal(Row.EMPTY);
            assertTrue(value >= 0 && value < 1);
        }
    }

    @Test
    public void testSeededRandIsReproducible()
    {
        ScalarFunction first = call("rand", constant(42L, BIGINT));
        ScalarFunction second = call("rand", constant(42L, BIGINT));
        for (int i = 0; i < 10; i++) {
            assertEquals(first.evalReal(Row.EMPTY), second.evalReal(Row.EMPTY));
        }
    }

    @Test
    public void testUuid()
    {
        ScalarFunction function = call("uuid");
        assertFalse(function.isConstant());
        assertEquals(function.evalString(Row.EMPTY).length(), 36);
        assertNotEquals(function.evalString(Row.EMPTY), function.evalString(Row.EMPTY));
    }

    @Test
    public void testSleep()
    {
        ScalarFunction function = call("sleep", constant(0.01, DOUBLE));
        assertFalse(function.isConstant());
        assertEquals(function.evalInt(Row.EMPTY), Long.valueOf(0));
    }

    @Test(expectedExceptions = TesseraException.class, expectedExceptionsMessageRegExp = "Incorrect arguments to sleep: -1.0")
    public void testSleepNegativeInStrictMode()
    {
        call("sleep", constant(-1L, BIGINT)).evalInt(Row.EMPTY);
    }

    @Test
    public void testSleepNegativeWithoutStrictMode()
    {
        ScalarFunction function = factory.newFunctionBase(nonStrictSession(), "sleep", UNSPECIFIED, constant(-1L, BIGINT));
        assertEquals(function.evalInt(Row.EMPTY), Long.valueOf(0));
    }
}
