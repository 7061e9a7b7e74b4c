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

import com.google.common.collect.ImmutableList;
import io.tessera.metadata.FunctionRegistry;
import io.tessera.metadata.SqlScalarFunction;

import java.util.List;

public final class BuiltinFunctions
{
    private static final List<SqlScalarFunction> FUNCTIONS = ImmutableList.<SqlScalarFunction>builder()
            .add(ArithmeticFunction.PLUS)
            .add(ArithmeticFunction.MINUS)
            .add(ArithmeticFunction.MULTIPLY)
            .add(ArithmeticFunction.DIVIDE)
            .add(AbsFunction.ABS)
            .add(ComparisonFunction.EQUAL)
            .add(ComparisonFunction.NOT_EQUAL)
            .add(ComparisonFunction.LESS_THAN)
            .add(ComparisonFunction.LESS_THAN_OR_EQUAL)
            .add(ComparisonFunction.GREATER_THAN)
            .add(ComparisonFunction.GREATER_THAN_OR_EQUAL)
            .add(BitwiseNotFunction.BITNEG)
            .add(ConcatFunction.CONCAT)
            .add(LengthFunction.LENGTH)
            .add(CaseConversionFunction.UPPER)
            .add(CaseConversionFunction.LOWER)
            .add(DateTimeFunctions.ADD_TIME)
            .add(DateTimeFunctions.TIME_DIFF)
            .add(DateTimeFunctions.SYSDATE)
            .add(RandomFunctions.RAND)
            .add(RandomFunctions.UUID_FUNCTION)
            .add(RandomFunctions.SLEEP)
            .add(CastFunctions.CAST_AS_REAL)
            .add(CastFunctions.CAST_AS_STRING)
            .add(CastFunctions.CAST_AS_DECIMAL)
            .add(CoalesceFunction.COALESCE)
            .build();

    private BuiltinFunctions() {}

    public static List<SqlScalarFunction> getFunctions()
    {
        return FUNCTIONS;
    }

    public static FunctionRegistry createRegistry()
    {
        return new FunctionRegistry(FUNCTIONS);
    }
}
