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

import io.tessera.metadata.AbstractBuiltinFunction;
import io.tessera.metadata.BuiltinFunction;
import io.tessera.metadata.SqlScalarFunction;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.math.BigDecimal;
import java.util.List;

import static io.tessera.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;

public final class AbsFunction
        extends SqlScalarFunction
{
    public static final AbsFunction ABS = new AbsFunction();

    private AbsFunction()
    {
        super("abs", 1, 1);
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        FieldType argumentType = arguments.get(0).getType();
        switch (argumentType.getEvalType()) {
            case INT:
                return new IntAbs(context, arguments, argumentType.isUnsigned() ? FieldType.UNSIGNED_BIGINT : FieldType.BIGINT);
            case DECIMAL:
                return new DecimalAbs(context, arguments);
            case REAL:
            case STRING:
                return new RealAbs(context, arguments);
            default:
                throw tesseraException(TYPE_MISMATCH, "Function abs does not accept an argument of type %s", argumentType);
        }
    }

    private static final class IntAbs
            extends AbstractBuiltinFunction
    {
        private IntAbs(SessionContext context, List<? extends Expression> arguments, FieldType returnType)
        {
            super(context, arguments, returnType);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new IntAbs(getContext(), arguments, getReturnType());
        }

        @Override
        public Long evalInt(Row row)
        {
            Long value = evalIntArgument(getArgument(0), row);
            if (value == null || getReturnType().isUnsigned()) {
                return value;
            }
            if (value == Long.MIN_VALUE) {
                throw tesseraException(NUMERIC_VALUE_OUT_OF_RANGE, "BIGINT value is out of range in 'abs(%s)'", value);
            }
            return Math.abs(value);
        }
    }

    private static final class RealAbs
            extends AbstractBuiltinFunction
    {
        private RealAbs(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.DOUBLE);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new RealAbs(getContext(), arguments);
        }

        @Override
        public Double evalReal(Row row)
        {
            Double value = evalRealArgument(getArgument(0), row);
            return value == null ? null : Math.abs(value);
        }
    }

    private static final class DecimalAbs
            extends AbstractBuiltinFunction
    {
        private DecimalAbs(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.DECIMAL);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new DecimalAbs(getContext(), arguments);
        }

        @Override
        public BigDecimal evalDecimal(Row row)
        {
            BigDecimal value = evalDecimalArgument(getArgument(0), row);
            return value == null ? null : value.abs();
        }
    }
}
