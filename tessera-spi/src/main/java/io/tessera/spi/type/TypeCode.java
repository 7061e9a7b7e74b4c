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

import static io.tessera.spi.type.EvalType.DATETIME;
import static io.tessera.spi.type.EvalType.INT;
import static io.tessera.spi.type.EvalType.REAL;
import static io.tessera.spi.type.EvalType.STRING;

public enum TypeCode
{
    UNSPECIFIED("unspecified", STRING),
    NULL("null", STRING),
    TINYINT("tinyint", INT),
    SMALLINT("smallint", INT),
    INTEGER("integer", INT),
    BIGINT("bigint", INT),
    FLOAT("float", REAL),
    DOUBLE("double", REAL),
    DECIMAL("decimal", EvalType.DECIMAL),
    VARCHAR("varchar", STRING),
    CHAR("char", STRING),
    DATE("date", DATETIME),
    TIMESTAMP("timestamp", DATETIME),
    DURATION("duration", EvalType.DURATION),
    JSON("json", EvalType.JSON);

    private final String displayName;
    private final EvalType evalType;

    TypeCode(String displayName, EvalType evalType)
    {
        this.displayName = displayName;
        this.evalType = evalType;
    }

    public String getDisplayName()
    {
        return displayName;
    }

    public EvalType getEvalType()
    {
        return evalType;
    }

    public boolean isInteger()
    {
        return evalType == INT;
    }
}
