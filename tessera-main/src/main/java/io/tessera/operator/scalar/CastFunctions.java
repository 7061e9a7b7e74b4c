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
import io.tessera.spi.StandardWarningCode;
import io.tessera.spi.TesseraException;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;

/**
 * Casts to DOUBLE, VARCHAR and DECIMAL.
 * <p>
 * A string that is not a number fails the cast in strict mode. Otherwise the cast
 * produces zero and records a truncation warning.
 */
public final class CastFunctions
{
    public static final SqlScalarFunction CAST_AS_REAL = new SqlScalarFunction("cast_as_real", 1, 1)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            checkCastable(getName(), arguments.get(0));
            return new CastToReal(context, arguments);
        }
    };

    public static final SqlScalarFunction CAST_AS_STRING = new SqlScalarFunction("cast_as_string", 1, 1)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            return new CastToString(context, arguments);
        }
    };

    public static final SqlScalarFunction CAST_AS_DECIMAL = new SqlScalarFunction("cast_as_decimal", 1, 1)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            checkCastable(getName(), arguments.get(0));
            return new CastToDecimal(context, arguments);
        }
    };

    private CastFunctions() {}

    private static void checkCastable(String name, Expression argument)
    {
        EvalType evalType = argument.getType().getEvalType();
        if (evalType == EvalType.DATETIME || evalType == EvalType.DURATION || evalType == EvalType.JSON) {
            throw tesseraException(TYPE_MISMATCH, "Function %s does not accept an argument of type %s", name, argument.getType());
        }
    }

    private abstract static class AbstractCast
            extends AbstractBuiltinFunction
    {
        protected AbstractCast(SessionContext context, List<? extends Expression> arguments, FieldType returnType)
        {
            super(context, arguments, returnType);
        }

        protected final <T> T convert(Supplier<T> conversion, T zero)
        {
            try {
                return conversion.get();
            }
            catch (TesseraException e) {
                if (getContext().isStrictMode() || !e.getErrorCode().equals(TYPE_MISMATCH.toErrorCode())) {
                    throw e;
                }
                appendWarning(StandardWarningCode.TRUNCATED_VALUE, e.getMessage());
                return zero;
            }
        }
    }

    private static final class CastToReal
            extends AbstractCast
    {
        private CastToReal(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.DOUBLE);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new CastToReal(getContext(), arguments);
        }

        @Override
        public Double evalReal(Row row)
        {
            return convert(() -> evalRealArgument(getArgument(0), row), 0.0);
        }
    }

    private static final class CastToString
            extends AbstractCast
    {
        private CastToString(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.VARCHAR);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new CastToString(getContext(), arguments);
        }

        @Override
        public Slice evalString(Row row)
        {
            return evalStringArgument(getArgument(0), row);
        }
    }

    private static final class CastToDecimal
            extends AbstractCast
    {
        private CastToDecimal(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.DECIMAL);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new CastToDecimal(getContext(), arguments);
        }

        @Override
        public BigDecimal evalDecimal(Row row)
        {
            return convert(() -> evalDecimalArgument(getArgument(0), row), BigDecimal.ZERO);
        }
    }
}
