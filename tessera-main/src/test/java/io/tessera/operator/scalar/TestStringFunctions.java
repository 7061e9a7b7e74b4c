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

import org.testng.annotations.Test;

import static io.airlift.slice.Slices.utf8Slice;
import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.DOUBLE;
import static io.tessera.spi.type.FieldType.VARCHAR;
import static io.tessera.sql.expression.Expressions.constant;

public class TestStringFunctions
        extends AbstractTestFunctions
{
    @Test
    public void testConcat()
    {
        assertFunction(call("concat", constant("foo", VARCHAR), constant("bar", VARCHAR)), utf8Slice("foobar"));
        assertFunction(call("concat", constant("a", VARCHAR), constant(1L, BIGINT), constant(2.5, DOUBLE)), utf8Slice("a12.5"));
        assertFunction(call("concat", constant("a", VARCHAR), constant(null, VARCHAR)), null);
        assertFunction(call("concat", constant("solo", VARCHAR)), utf8Slice("solo"));
    }

    @Test
    public void testLength()
    {
        assertFunction(call("length", constant("hello", VARCHAR)), 5L);
        // bytes, not characters
        assertFunction(call("length", constant("é", VARCHAR)), 2L);
        assertFunction(call("length", constant(null, VARCHAR)), null);
    }

    @Test
    public void testCaseConversion()
    {
        assertFunction(call("upper", constant("Hello", VARCHAR)), utf8Slice("HELLO"));
        assertFunction(call("lower", constant("Hello", VARCHAR)), utf8Slice("hello"));
        assertFunction(call("lower", constant(null, VARCHAR)), null);
    }
}
