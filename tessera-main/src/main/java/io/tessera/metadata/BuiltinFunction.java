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
package io.tessera.metadata;

import io.airlift.slice.Slice;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static io.tessera.spi.StandardErrorCode.NOT_SUPPORTED;
import static io.tessera.spi.TesseraException.tesseraException;

/**
 * Implementation of a builtin scalar function bound to its arguments.
 * <p>
 * An implementation evaluates the category of its return type; the evaluators of
 * every other category are left to the defaults, which fail with {@code NOT_SUPPORTED}.
 * Instances are owned by a single {@link io.tessera.sql.expression.ScalarFunction}.
 */
public interface BuiltinFunction
{
    List<Expression> getArguments();

    /**
     * Replaces the argument at {@code index}. Only the owning function node may call this.
     */
    void setArgument(int index, Expression argument);

    FieldType getReturnType();

    SessionContext getContext();

    default Long evalInt(Row row)
    {
        throw unsupported(this, "integer");
    }

    default Double evalReal(Row row)
    {
        throw unsupported(this, "real");
    }

    default Slice evalString(Row row)
    {
        throw unsupported(this, "string");
    }

    default BigDecimal evalDecimal(Row row)
    {
        throw unsupported(this, "decimal");
    }

    default LocalDateTime evalTime(Row row)
    {
        throw unsupported(this, "time");
    }

    default Duration evalDuration(Row row)
    {
        throw unsupported(this, "duration");
    }

    default void vecEvalInt(Chunk input, ColumnVector result)
    {
        throw unsupported(this, "vectorized integer");
    }

    default void vecEvalReal(Chunk input, ColumnVector result)
    {
        throw unsupported(this, "vectorized real");
    }

    default void vecEvalString(Chunk input, ColumnVector result)
    {
        throw unsupported(this, "vectorized string");
    }

    default void vecEvalDecimal(Chunk input, ColumnVector result)
    {
        throw unsupported(this, "vectorized decimal");
    }

    default void vecEvalTime(Chunk input, ColumnVector result)
    {
        throw unsupported(this, "vectorized time");
    }

    default void vecEvalDuration(Chunk input, ColumnVector result)
    {
        throw unsupported(this, "vectorized duration");
    }

    /**
     * Whether this implementation provides a vectorized evaluator for its return category.
     */
    boolean isVectorized();

    /**
     * Whether every argument can be evaluated by the vectorized evaluators.
     */
    boolean areChildrenVectorized();

    /**
     * Returns an independent copy of this implementation, including copies of its arguments.
     */
    BuiltinFunction copy();

    private static RuntimeException unsupported(BuiltinFunction function, String category)
    {
        return tesseraException(NOT_SUPPORTED, "%s does not support %s evaluation", function.getClass().getSimpleName(), category);
    }
}
