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

import com.google.common.collect.ImmutableList;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;

public final class Expressions
{
    private Expressions() {}

    public static Constant constant(Object value, FieldType type)
    {
        return new Constant(value, type);
    }

    public static ColumnReference column(long uniqueId, String name, FieldType type)
    {
        return new ColumnReference(uniqueId, name, type);
    }

    public static boolean isCorrelated(List<? extends Expression> expressions)
    {
        for (Expression expression : expressions) {
            if (expression.isCorrelated()) {
                return true;
            }
        }
        return false;
    }

    public static boolean isConstant(List<? extends Expression> expressions)
    {
        for (Expression expression : expressions) {
            if (!expression.isConstant()) {
                return false;
            }
        }
        return true;
    }

    public static boolean isVectorized(List<? extends Expression> expressions)
    {
        for (Expression expression : expressions) {
            if (!expression.isVectorized()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a new mutable list holding a copy of each expression.
     */
    public static List<Expression> copy(List<? extends Expression> expressions)
    {
        List<Expression> copies = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            copies.add(expression.copy());
        }
        return copies;
    }

    /**
     * Binds every expression to {@code schema}; the input expressions are left unchanged.
     */
    public static List<Expression> resolveIndices(List<? extends Expression> expressions, Schema schema)
    {
        return expressions.stream()
                .map(expression -> expression.resolveIndices(schema))
                .collect(toImmutableList());
    }

    public static List<Expression> toExpressions(List<ScalarFunction> functions)
    {
        return ImmutableList.copyOf(functions);
    }

    /**
     * Evaluates {@code expression} with the typed accessor of its own evaluation category.
     */
    public static Object evaluateNative(Expression expression, Row row)
    {
        EvalType evalType = expression.getType().getEvalType();
        switch (evalType) {
            case INT:
                return expression.evalInt(row);
            case REAL:
                return expression.evalReal(row);
            case DECIMAL:
                return expression.evalDecimal(row);
            case DATETIME:
                return expression.evalTime(row);
            case DURATION:
                return expression.evalDuration(row);
            case STRING:
            case JSON:
                return expression.evalString(row);
        }
        throw new AssertionError("Unknown eval type: " + evalType);
    }

    /**
     * Evaluates {@code expression} over {@code input} with the vectorized evaluator of its own
     * evaluation category. {@code result} must hold values of that category.
     */
    public static void vecEvaluateNative(Expression expression, Chunk input, ColumnVector result)
    {
        EvalType evalType = expression.getType().getEvalType();
        switch (evalType) {
            case INT:
                expression.vecEvalInt(input, result);
                return;
            case REAL:
                expression.vecEvalReal(input, result);
                return;
            case DECIMAL:
                expression.vecEvalDecimal(input, result);
                return;
            case DATETIME:
                expression.vecEvalTime(input, result);
                return;
            case DURATION:
                expression.vecEvalDuration(input, result);
                return;
            case STRING:
            case JSON:
                expression.vecEvalString(input, result);
                return;
        }
        throw new AssertionError("Unknown eval type: " + evalType);
    }

    public static ColumnVector newResultVector(Expression expression, int positionCount)
    {
        return new ColumnVector(expression.getType().getEvalType(), positionCount);
    }
}
