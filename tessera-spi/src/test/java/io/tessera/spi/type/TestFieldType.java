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
package io.tessera.spi.type;

import org.testng.annotations.Test;

import static io.tessera.spi.type.FieldType.BIGINT;
import static io.tessera.spi.type.FieldType.BOOLEAN;
import static io.tessera.spi.type.FieldType.DOUBLE;
import static io.tessera.spi.type.FieldType.UNSIGNED_BIGINT;
import static io.tessera.spi.type.FieldType.UNSPECIFIED;
import static io.tessera.spi.type.FieldType.createDecimalType;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;

public class TestFieldType
{
    @Test
    public void testEvalType()
    {
        assertEquals(BIGINT.getEvalType(), EvalType.INT);
        assertEquals(BOOLEAN.getEvalType(), EvalType.INT);
        assertEquals(DOUBLE.getEvalType(), EvalType.REAL);
        assertEquals(FieldType.VARCHAR.getEvalType(), EvalType.STRING);
        assertEquals(FieldType.DECIMAL.getEvalType(), EvalType.DECIMAL);
        assertEquals(FieldType.TIMESTAMP.getEvalType(), EvalType.DATETIME);
        assertEquals(FieldType.DURATION.getEvalType(), EvalType.DURATION);
        assertEquals(UNSPECIFIED.getEvalType(), EvalType.STRING);
    }

    @Test
    public void testUnsigned()
    {
        assertTrue(UNSIGNED_BIGINT.isUnsigned());
        assertFalse(BIGINT.isUnsigned());
        assertNotEquals(UNSIGNED_BIGINT, BIGINT);
        assertEquals(UNSIGNED_BIGINT.toString(), "bigint unsigned");
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "type double cannot be unsigned")
    public void testUnsignedRequiresInteger()
    {
        new FieldType(TypeCode.DOUBLE, true, false, FieldType.UNSPECIFIED_LENGTH, FieldType.UNSPECIFIED_LENGTH);
    }

    @Test
    public void testDecimal()
    {
        FieldType type = createDecimalType(10, 2);
        assertEquals(type.getLength(), 10);
        assertEquals(type.getScale(), 2);
        assertEquals(type.toString(), "decimal(10,2)");
        assertEquals(type, createDecimalType(10, 2));
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "Invalid decimal scale 5 for precision 3")
    public void testInvalidDecimalScale()
    {
        createDecimalType(3, 5);
    }

    @Test
    public void testUnspecifiedSentinel()
    {
        assertTrue(UNSPECIFIED.isUnspecified());
        assertFalse(BIGINT.isUnspecified());
        assertEquals(BIGINT.withNotNull(true).toString(), "bigint not null");
        assertEquals(BIGINT.withNotNull(true).withNotNull(false), BIGINT);
    }
}
