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
import io.tessera.spi.TesseraWarning;
import io.tessera.spi.WarningCodeSupplier;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.Expressions;
import io.tessera.sql.expression.ValueConversions;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static io.tessera.spi.StandardErrorCode.NOT_SUPPORTED;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.util.Objects.requireNonNull;

/**
 * Base class of builtin implementations. Holds the arguments, the session and the
 * return type, and provides a vectorized evaluator for the return category that
 * evaluates the batch row by row. Implementations with a columnar algorithm override it.
 */
public abstract class AbstractBuiltinFunction
        implements BuiltinFunction
{
    private final SessionContext context;
    private final List<Expression> arguments;
    private final FieldType returnType;

    protected AbstractBuiltinFunction(SessionContext context, List<? extends Expression> arguments, FieldType returnType)
    {
        this.context = requireNonNull(context, "context is null");
        this.arguments = new ArrayList<>(requireNonNull(arguments, "arguments is null"));
        this.returnType = requireNonNull(returnType, "returnType is null");
    }

    @Override
    public final List<Expression> getArguments()
    {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public final void setArgument(int index, Expression argument)
    {
        arguments.set(index, requireNonNull(argument, "argument is null"));
    }

    protected final Expression getArgument(int index)
    {
        return arguments.get(index);
    }

    protected final int getArgumentCount()
    {
        return arguments.size();
    }

    @Override
    public final FieldType getReturnType()
    {
        return returnType;
    }

    @Override
    public final SessionContext getContext()
    {
        return context;
    }

    @Override
    public boolean isVectorized()
    {
        return true;
    }

    @Override
    public final boolean areChildrenVectorized()
    {
        return Expressions.isVectorized(arguments);
    }

    @Override
    public final BuiltinFunction copy()
    {
        return copyWith(Expressions.copy(arguments));
    }

    /**
     * Creates an implementation of the same function bound to {@code arguments}.
     */
    protected abstract BuiltinFunction copyWith(List<Expression> arguments);

    @Override
    public void vecEvalInt(Chunk input, ColumnVector result)
    {
        evalRows(input, result, EvalType.INT);
    }

    @Override
    public void vecEvalReal(Chunk input, ColumnVector result)
    {
        evalRows(input, result, EvalType.REAL);
    }

    @Override
    public void vecEvalString(Chunk input, ColumnVector result)
    {
        evalRows(input, result, EvalType.STRING);
    }

    @Override
    public void vecEvalDecimal(Chunk input, ColumnVector result)
    {
        evalRows(input, result, EvalType.DECIMAL);
    }

    @Override
    public void vecEvalTime(Chunk input, ColumnVector result)
    {
        evalRows(input, result, EvalType.DATETIME);
    }

    @Override
    public void vecEvalDuration(Chunk input, ColumnVector result)
    {
        evalRows(input, result, EvalType.DURATION);
    }

    protected final void appendWarning(WarningCodeSupplier warningCode, String message)
    {
        context.getStatementContext().appendWarning(new TesseraWarning(warningCode, message));
    }

    protected static Long evalIntArgument(Expression argument, Row row)
    {
        return ValueConversions.toLong(Expressions.evaluateNative(argument, row));
    }

    protected static Double evalRealArgument(Expression argument, Row row)
    {
        return ValueConversions.toDouble(Expressions.evaluateNative(argument, row), argument.getType().isUnsigned());
    }

    protected static BigDecimal evalDecimalArgument(Expression argument, Row row)
    {
        return ValueConversions.toDecimal(Expressions.evaluateNative(argument, row), argument.getType().isUnsigned());
    }

    protected static Slice evalStringArgument(Expression argument, Row row)
    {
        return ValueConversions.toSlice(Expressions.evaluateNative(argument, row), argument.getType().isUnsigned());
    }

    /**
     * Evaluates {@code argument} over {@code input} into a new vector of the argument's own category.
     */
    protected static ColumnVector evalArgument(Expression argument, Chunk input)
    {
        ColumnVector vector = Expressions.newResultVector(argument, input.getPositionCount());
        Expressions.vecEvaluateNative(argument, input, vector);
        return vector;
    }

    /**
     * Whether the row evaluator of {@code category} is implemented. By default only the
     * category of the return type is.
     */
    protected boolean supportsCategory(EvalType category)
    {
        EvalType returnCategory = returnType.getEvalType() == EvalType.JSON ? EvalType.STRING : returnType.getEvalType();
        return returnCategory == category;
    }

    private void evalRows(Chunk input, ColumnVector result, EvalType category)
    {
        if (!supportsCategory(category)) {
            throw tesseraException(NOT_SUPPORTED, "%s returns %s and does not support vectorized %s evaluation", getClass().getSimpleName(), returnType, category);
        }
        int positionCount = input.getPositionCount();
        result.reset(positionCount);
        for (int position = 0; position < positionCount; position++) {
            Row row = input.getRow(position);
            switch (category) {
                case INT:
                    ValueConversions.writeValue(result, position, evalInt(row));
                    break;
                case REAL:
                    ValueConversions.writeValue(result, position, evalReal(row));
                    break;
                case DECIMAL:
                    ValueConversions.writeValue(result, position, evalDecimal(row));
                    break;
                case DATETIME:
                    ValueConversions.writeValue(result, position, evalTime(row));
                    break;
                case DURATION:
                    ValueConversions.writeValue(result, position, evalDuration(row));
                    break;
                default:
                    ValueConversions.writeValue(result, position, evalString(row));
            }
        }
    }

    /**
     * Two implementations are equal when they are of the same class and have equal arguments.
     * Implementations with additional parameters extend this.
     */
    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        AbstractBuiltinFunction other = (AbstractBuiltinFunction) obj;
        return arguments.equals(other.arguments);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(getClass(), arguments);
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + arguments;
    }
}
