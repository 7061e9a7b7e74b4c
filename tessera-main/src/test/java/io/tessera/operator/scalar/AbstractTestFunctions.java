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

import io.tessera.metadata.FunctionRegistry;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.ExpressionConfig;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.Expressions;
import io.tessera.sql.expression.ScalarFunction;
import io.tessera.sql.expression.ScalarFunctionFactory;
import org.testng.annotations.BeforeMethod;

import java.math.BigDecimal;

import static io.tessera.SessionTestUtils.testSession;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public abstract class AbstractTestFunctions
{
    protected static final FunctionRegistry REGISTRY = BuiltinFunctions.createRegistry();

    private static final int VECTOR_POSITIONS = 3;

    protected final ScalarFunctionFactory factory = new ScalarFunctionFactory(REGISTRY, new ExpressionConfig().setConstantFoldingEnabled(false));
    protected SessionContext session;

    @BeforeMethod
    public void setUpSession()
    {
        session = createSession();
    }

    protected SessionContext createSession()
    {
        return testSession();
    }

    protected ScalarFunction call(String name, Expression... arguments)
    {
        return factory.newFunctionBase(session, name, FieldType.UNSPECIFIED, arguments);
    }

    /**
     * Checks the value of a function of constants, row by row and, when supported, vectorized.
     */
    protected void assertFunction(ScalarFunction function, Object expected)
    {
        assertValue(Expressions.evaluateNative(function, Row.EMPTY), expected);
        if (function.isVectorized()) {
            ColumnVector result = Expressions.newResultVector(function, VECTOR_POSITIONS);
            Expressions.vecEvaluateNative(function, new Chunk(VECTOR_POSITIONS), result);
            assertEquals(result.getPositionCount(), VECTOR_POSITIONS);
            for (int position = 0; position < VECTOR_POSITIONS; position++) {
                assertValue(result.getObject(position), expected);
            }
        }
    }

    private static void assertValue(Object actual, Object expected)
    {
        if (expected == null) {
            assertNull(actual);
        }
        else if (expected instanceof BigDecimal) {
            assertTrue(actual instanceof BigDecimal, "expected a decimal, but got " + actual);
            assertEquals(((BigDecimal) actual).compareTo((BigDecimal) expected), 0, actual + " != " + expected);
        }
        else {
            assertEquals(actual, expected);
        }
    }
}
