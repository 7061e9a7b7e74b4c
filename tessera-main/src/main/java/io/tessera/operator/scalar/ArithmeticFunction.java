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
import io.tessera.spi.StandardWarningCode;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.ValueConversions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

import static io.tessera.spi.StandardErrorCode.DIVISION_BY_ZERO;
import static io.tessera.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.util.Objects.requireNonNull;

/**
 * The binary arithmetic functions {@code plus}, {@code minus}, {@code mul} and {@code div}.
 * <p>
 * Integer operands produce a BIGINT and fail on overflow. Integer and decimal operands
 * produce a DECIMAL. Any other numeric or string operand produces a DOUBLE. Division
 * never produces an integer. Division by zero returns NULL with a warning, or fails
 * in strict mode.
 */
public final class ArithmeticFunction
        extends SqlScalarFunction
{
    public static final ArithmeticFunction PLUS = new ArithmeticFunction(Operator.PLUS);
    public static final ArithmeticFunction MINUS = new ArithmeticFunction(Operator.MINUS);
    public static final ArithmeticFunction MULTIPLY = new ArithmeticFunction(Operator.MULTIPLY);
    public static final ArithmeticFunction DIVIDE = new ArithmeticFunction(Operator.DIVIDE);

    private static final int DIVISION_SCALE_INCREMENT = 4;

    public enum Operator
    {
        PLUS("plus", "+"),
        MINUS("minus", "-"),
        MULTIPLY("mul", "*"),
        DIVIDE("div", "/");

        private final String functionName;
        private final String symbol;

        Operator(String functionName, String symbol)
        {
            this.functionName = functionName;
            this.symbol = symbol;
        }

        public String getFunctionName()
        {
            return functionName;
        }

        public String getSymbol()
        {
            return symbol;
        }
    }

    private final Operator operator;

    private ArithmeticFunction(Operator operator)
    {
        super(operator.getFunctionName(), 2, 2);
        this.operator = requireNonNull(operator, "operator is null");
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        EvalType left = checkNumeric(arguments.get(0));
        EvalType right = checkNumeric(arguments.get(1));
        boolean exact = (left == EvalType.INT || left == EvalType.DECIMAL) && (right == EvalType.INT || right == EvalType.DECIMAL);
        if (operator != Operator.DIVIDE && left == EvalType.INT && right == EvalType.INT) {
            return new IntArithmetic(context, arguments, operator);
        }
        if (exact) {
            return new DecimalArithmetic(context, arguments, operator);
        }
        return new RealArithmetic(context, arguments, operator);
    }

    private EvalType checkNumeric(Expression argument)
    {
        EvalType evalType = argument.getType().getEvalType();
        switch (evalType) {
            case INT:
            case REAL:
            case DECIMAL:
            case STRING:
                return evalType;
            default:
                throw tesseraException(TYPE_MISMATCH, "Function %s does not accept an argument of type %s", getName(), argument.getType());
        }
    }

    private abstract static class AbstractArithmetic
            extends AbstractBuiltinFunction
    {
        protected final Operator operator;

        protected AbstractArithmetic(SessionContext context, List<? extends Expression> arguments, FieldType returnType, Operator operator)
        {
            super(context, arguments, returnType);
            this.operator = requireNonNull(operator, "operator is null");
        }

        /**
         * Returns null, after recording a warning, unless the session is strict.
         */
        protected final <T> T divisionByZero()
        {
            if (getContext().isStrictMode()) {
                throw tesseraException(DIVISION_BY_ZERO, "Division by 0");
            }
            appendWarning(StandardWarningCode.DIVISION_BY_ZERO, "Division by 0");
            return null;
        }

        protected final RuntimeException outOfRange(String typeName, Object left, Object right)
        {
            return tesseraException(NUMERIC_VALUE_OUT_OF_RANGE, "%s value is out of range in '(%s %s %s)'", typeName, left, operator.getSymbol(), right);
        }

        @Override
        public boolean equals(Object obj)
        {
            return super.equals(obj) && operator == ((AbstractArithmetic) obj).operator;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(super.hashCode(), operator);
        }
    }

    private static final class IntArithmetic
            extends AbstractArithmetic
    {
        private IntArithmetic(SessionContext context, List<? extends Expression> arguments, Operator operator)
        {
            super(context, arguments, FieldType.BIGINT, operator);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new IntArithmetic(getContext(), arguments, operator);
        }

        @Override
        public Long evalInt(Row row)
        {
            Long left = evalIntArgument(getArgument(0), row);
            if (left == null) {
                return null;
            }
            Long right = evalIntArgument(getArgument(1), row);
            if (right == null) {
                return null;
            }
            return compute(left, right);
        }

        @Override
        public void vecEvalInt(Chunk input, ColumnVector result)
        {
            ColumnVector left = evalArgument(getArgument(0), input);
            ColumnVector right = evalArgument(getArgument(1), input);
            int positionCount = input.getPositionCount();
            result.reset(positionCount);
            result.mergeNulls(left, right);
            for (int position = 0; position < positionCount; position++) {
                if (!result.isNull(position)) {
                    result.setLong(position, compute(left.getLong(position), right.getLong(position)));
                }
            }
        }

        private long compute(long left, long right)
        {
            boolean leftUnsigned = getArgument(0).getType().isUnsigned();
            boolean rightUnsigned = getArgument(1).getType().isUnsigned();
            // unsigned operands above the signed range cannot be represented in the result
            if ((leftUnsigned && left < 0) || (rightUnsigned && right < 0)) {
                throw outOfRange("BIGINT", format(left, leftUnsigned), format(right, rightUnsigned));
            }
            try {
                switch (operator) {
                    case PLUS:
                        return Math.addExact(left, right);
                    case MINUS:
                        return Math.subtractExact(left, right);
                    case MULTIPLY:
                        return Math.multiplyExact(left, right);
                    default:
                        throw new IllegalStateException("Unsupported integer operator: " + operator);
                }
            }
            catch (ArithmeticException e) {
                throw outOfRange("BIGINT", left, right);
            }
        }

        private static String format(long value, boolean unsigned)
        {
            return unsigned ? Long.toUnsignedString(value) : Long.toString(value);
        }
    }

    private static final class RealArithmetic
            extends AbstractArithmetic
    {
        private RealArithmetic(SessionContext context, List<? extends Expression> arguments, Operator operator)
        {
            super(context, arguments, FieldType.DOUBLE, operator);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new RealArithmetic(getContext(), arguments, operator);
        }

        @Override
        public Double evalReal(Row row)
        {
            Double left = evalRealArgument(getArgument(0), row);
            if (left == null) {
                return null;
            }
            Double right = evalRealArgument(getArgument(1), row);
            if (right == null) {
                return null;
            }
            return compute(left, right);
        }

        @Override
        public void vecEvalReal(Chunk input, ColumnVector result)
        {
            ColumnVector left = evalArgument(getArgument(0), input);
            ColumnVector right = evalArgument(getArgument(1), input);
            boolean leftUnsigned = getArgument(0).getType().isUnsigned();
            boolean rightUnsigned = getArgument(1).getType().isUnsigned();
            int positionCount = input.getPositionCount();
            result.reset(positionCount);
            result.mergeNulls(left, right);
            for (int position = 0; position < positionCount; position++) {
                if (result.isNull(position)) {
                    continue;
                }
                Double value = compute(
                        ValueConversions.toDouble(left.getObject(position), leftUnsigned),
                        ValueConversions.toDouble(right.getObject(position), rightUnsigned));
                if (value == null) {
                    result.setNull(position);
                }
                else {
                    result.setDouble(position, value);
                }
            }
        }

        private Double compute(double left, double right)
        {
            double value;
            switch (operator) {
                case PLUS:
                    value = left + right;
                    break;
                case MINUS:
                    value = left - right;
                    break;
                case MULTIPLY:
                    value = left * right;
                    break;
                case DIVIDE:
                    if (right == 0) {
                        return divisionByZero();
                    }
                    value = left / right;
                    break;
                default:
                    throw new IllegalStateException("Unsupported operator: " + operator);
            }
            if (Double.isInfinite(value) || Double.isNaN(value)) {
                throw outOfRange("DOUBLE", ValueConversions.formatDouble(left), ValueConversions.formatDouble(right));
            }
            return value;
        }
    }

    private static final class DecimalArithmetic
            extends AbstractArithmetic
    {
        private DecimalArithmetic(SessionContext context, List<? extends Expression> arguments, Operator operator)
        {
            super(context, arguments, FieldType.DECIMAL, operator);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new DecimalArithmetic(getContext(), arguments, operator);
        }

        @Override
        public BigDecimal evalDecimal(Row row)
        {
            BigDecimal left = evalDecimalArgument(getArgument(0), row);
            if (left == null) {
                return null;
            }
            BigDecimal right = evalDecimalArgument(getArgument(1), row);
            if (right == null) {
                return null;
            }
            BigDecimal value;
            switch (operator) {
                case PLUS:
                    value = left.add(right);
                    break;
                case MINUS:
                    value = left.subtract(right);
                    break;
                case MULTIPLY:
                    value = left.multiply(right);
                    break;
                case DIVIDE:
                    if (right.signum() == 0) {
                        return divisionByZero();
                    }
                    value = left.divide(right, Math.max(left.scale(), 0) + DIVISION_SCALE_INCREMENT, RoundingMode.HALF_UP);
                    break;
                default:
                    throw new IllegalStateException("Unsupported operator: " + operator);
            }
            if (value.precision() - value.scale() > FieldType.MAX_DECIMAL_PRECISION - FieldType.MAX_DECIMAL_SCALE) {
                throw outOfRange("DECIMAL", left.toPlainString(), right.toPlainString());
            }
            return value;
        }
    }
}
