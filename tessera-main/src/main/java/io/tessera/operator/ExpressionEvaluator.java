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
package io.tessera.operator;

import com.google.common.collect.ImmutableList;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.sql.ExpressionConfig;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.Expressions;
import io.tessera.sql.expression.ValueConversions;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates a list of expressions over input chunks, producing one output column per expression.
 * <p>
 * Each expression is evaluated with the vectorized evaluators when vectorized evaluation is
 * enabled and every node of the expression supports it; otherwise it is evaluated row by row.
 * The expressions must not be rewritten while an evaluator uses them. An evaluator may be
 * used by several threads at once.
 */
public class ExpressionEvaluator
{
    private final List<Expression> expressions;
    private final boolean[] vectorized;

    public ExpressionEvaluator(List<? extends Expression> expressions, ExpressionConfig config)
    {
        this.expressions = ImmutableList.copyOf(requireNonNull(expressions, "expressions is null"));
        requireNonNull(config, "config is null");
        this.vectorized = new boolean[this.expressions.size()];
        for (int i = 0; i < vectorized.length; i++) {
            vectorized[i] = config.isVectorizedEvaluationEnabled() && this.expressions.get(i).isVectorized();
        }
    }

    public List<Expression> getExpressions()
    {
        return expressions;
    }

    public boolean isVectorized(int channel)
    {
        return vectorized[channel];
    }

    public Chunk evaluate(Chunk input)
    {
        requireNonNull(input, "input is null");
        int positionCount = input.getPositionCount();
        ColumnVector[] columns = new ColumnVector[expressions.size()];
        for (int channel = 0; channel < columns.length; channel++) {
            Expression expression = expressions.get(channel);
            ColumnVector result = Expressions.newResultVector(expression, positionCount);
            if (vectorized[channel]) {
                Expressions.vecEvaluateNative(expression, input, result);
            }
            else {
                for (int position = 0; position < positionCount; position++) {
                    Row row = input.getRow(position);
                    ValueConversions.writeValue(result, position, Expressions.evaluateNative(expression, row));
                }
            }
            columns[channel] = result;
        }
        return new Chunk(positionCount, columns);
    }
}
