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

import io.airlift.slice.Slice;
import io.tessera.metadata.AbstractBuiltinFunction;
import io.tessera.metadata.BuiltinFunction;
import io.tessera.metadata.SqlScalarFunction;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.spi.type.TypeCode;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.Expressions;
import io.tessera.sql.expression.ValueConversions;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Returns the first argument that is not NULL.
 * <p>
 * The result has the type of the first typed argument. If every argument is untyped
 * the type is left unspecified and the caller's declared type is used; the value is
 * then converted to whichever category the caller evaluates.
 */
public final class CoalesceFunction
        extends SqlScalarFunction
{
    public static final CoalesceFunction COALESCE = new CoalesceFunction();

    private CoalesceFunction()
    {
        super("coalesce", 1, VARIABLE_ARITY);
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        return new Coalesce(context, arguments, inferReturnType(arguments));
    }

    static FieldType inferReturnType(List<Expression> arguments)
    {
        for (Expression argument : arguments) {
            FieldType type = argument.getType();
            if (!type.isUnspecified() && type.getTypeCode() != TypeCode.NULL) {
                return type.withNotNull(false);
            }
        }
        return FieldType.UNSPECIFIED;
    }

    private static final class Coalesce
            extends AbstractBuiltinFunction
    {
        private Coalesce(SessionContext context, List<? extends Expression> arguments, FieldType returnType)
        {
            super(context, arguments, returnType);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Coalesce(getContext(), arguments, getReturnType());
        }

        @Override
        protected boolean supportsCategory(EvalType category)
        {
            return true;
        }

        @Override
        public Long evalInt(Row row)
        {
            return ValueConversions.toLong(firstNonNull(row));
        }

        @Override
        public Double evalReal(Row row)
        {
            return ValueConversions.toDouble(firstNonNull(row), getReturnType().isUnsigned());
        }

        @Override
        public Slice evalString(Row row)
        {
            return ValueConversions.toSlice(firstNonNull(row), getReturnType().isUnsigned());
        }

        @Override
        public BigDecimal evalDecimal(Row row)
        {
            return ValueConversions.toDecimal(firstNonNull(row), getReturnType().isUnsigned());
        }

        @Override
        public LocalDateTime evalTime(Row row)
        {
            return ValueConversions.toTimestamp(firstNonNull(row));
        }

        @Override
        public Duration evalDuration(Row row)
        {
            return ValueConversions.toDuration(firstNonNull(row));
        }

        private Object firstNonNull(Row row)
        {
            for (int i = 0; i < getArgumentCount(); i++) {
                Object value = Expressions.evaluateNative(getArgument(i), row);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
    }
}
