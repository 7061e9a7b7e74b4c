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
import io.tessera.spi.TesseraException;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.Expressions;
import io.tessera.sql.expression.ValueConversions;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static io.tessera.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.lang.String.format;

/**
 * Timestamp and duration functions: {@code addtime}, {@code timediff} and {@code sysdate}.
 * Timestamp arguments may also be given as strings.
 */
public final class DateTimeFunctions
{
    public static final SqlScalarFunction ADD_TIME = new SqlScalarFunction("addtime", 2, 2)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            checkTimestamp("addtime", arguments.get(0));
            checkType("addtime", arguments.get(1), EvalType.DURATION);
            return new AddTime(context, arguments);
        }
    };

    public static final SqlScalarFunction TIME_DIFF = new SqlScalarFunction("timediff", 2, 2)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            checkTimestamp("timediff", arguments.get(0));
            checkTimestamp("timediff", arguments.get(1));
            return new TimeDiff(context, arguments);
        }
    };

    public static final SqlScalarFunction SYSDATE = new SqlScalarFunction("sysdate", 0, 0)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            return new Sysdate(context, arguments);
        }
    };

    private DateTimeFunctions() {}

    private static void checkTimestamp(String name, Expression argument)
    {
        EvalType evalType = argument.getType().getEvalType();
        if (evalType != EvalType.DATETIME && evalType != EvalType.STRING) {
            throw tesseraException(TYPE_MISMATCH, "Function %s does not accept an argument of type %s", name, argument.getType());
        }
    }

    private static void checkType(String name, Expression argument, EvalType expected)
    {
        if (argument.getType().getEvalType() != expected) {
            throw tesseraException(TYPE_MISMATCH, "Function %s does not accept an argument of type %s", name, argument.getType());
        }
    }

    private static LocalDateTime evalTimestampArgument(Expression argument, Row row)
    {
        return ValueConversions.toTimestamp(Expressions.evaluateNative(argument, row));
    }

    private static final class AddTime
            extends AbstractBuiltinFunction
    {
        private AddTime(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.TIMESTAMP);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new AddTime(getContext(), arguments);
        }

        @Override
        public LocalDateTime evalTime(Row row)
        {
            LocalDateTime timestamp = evalTimestampArgument(getArgument(0), row);
            if (timestamp == null) {
                return null;
            }
            Duration duration = getArgument(1).evalDuration(row);
            if (duration == null) {
                return null;
            }
            try {
                return timestamp.plus(duration);
            }
            catch (DateTimeException | ArithmeticException e) {
                throw new TesseraException(NUMERIC_VALUE_OUT_OF_RANGE, format("TIMESTAMP value is out of range in 'addtime(%s, %s)'", getArgument(0), getArgument(1)), e);
            }
        }
    }

    private static final class TimeDiff
            extends AbstractBuiltinFunction
    {
        private TimeDiff(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.DURATION);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new TimeDiff(getContext(), arguments);
        }

        @Override
        public Duration evalDuration(Row row)
        {
            LocalDateTime left = evalTimestampArgument(getArgument(0), row);
            if (left == null) {
                return null;
            }
            LocalDateTime right = evalTimestampArgument(getArgument(1), row);
            return right == null ? null : Duration.between(right, left);
        }
    }

    /**
     * Current time of the session, read on every evaluation.
     */
    private static final class Sysdate
            extends AbstractBuiltinFunction
    {
        private Sysdate(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.TIMESTAMP);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Sysdate(getContext(), arguments);
        }

        @Override
        public LocalDateTime evalTime(Row row)
        {
            return getContext().getCurrentTime().truncatedTo(ChronoUnit.SECONDS);
        }
    }
}
