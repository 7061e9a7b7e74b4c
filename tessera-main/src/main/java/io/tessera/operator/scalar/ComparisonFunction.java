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
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;
import io.tessera.sql.expression.Expressions;
import io.tessera.sql.expression.ValueConversions;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.util.Objects.requireNonNull;

/**
 * Comparison functions. They return a BOOLEAN: 1, 0 or NULL if either operand is NULL.
 * <p>
 * Operands are compared as integers when both are integers, as strings when both are
 * strings, as temporal values when both have the same temporal type, as decimals when
 * both are exact numbers and as doubles otherwise.
 */
public final class ComparisonFunction
        extends SqlScalarFunction
{
    public static final ComparisonFunction EQUAL = new ComparisonFunction(Operator.EQUAL);
    public static final ComparisonFunction NOT_EQUAL = new ComparisonFunction(Operator.NOT_EQUAL);
    public static final ComparisonFunction LESS_THAN = new ComparisonFunction(Operator.LESS_THAN);
    public static final ComparisonFunction LESS_THAN_OR_EQUAL = new ComparisonFunction(Operator.LESS_THAN_OR_EQUAL);
    public static final ComparisonFunction GREATER_THAN = new ComparisonFunction(Operator.GREATER_THAN);
    public static final ComparisonFunction GREATER_THAN_OR_EQUAL = new ComparisonFunction(Operator.GREATER_THAN_OR_EQUAL);

    public enum Operator
    {
        EQUAL("eq"),
        NOT_EQUAL("ne"),
        LESS_THAN("lt"),
        LESS_THAN_OR_EQUAL("le"),
        GREATER_THAN("gt"),
        GREATER_THAN_OR_EQUAL("ge");

        private final String functionName;

        Operator(String functionName)
        {
            this.functionName = functionName;
        }

        public String getFunctionName()
        {
            return functionName;
        }

        boolean test(int comparison)
        {
            switch (this) {
                case EQUAL:
                    return comparison == 0;
                case NOT_EQUAL:
                    return comparison != 0;
                case LESS_THAN:
                    return comparison < 0;
                case LESS_THAN_OR_EQUAL:
                    return comparison <= 0;
                case GREATER_THAN:
                    return comparison > 0;
                case GREATER_THAN_OR_EQUAL:
                    return comparison >= 0;
            }
            throw new AssertionError("Unknown operator: " + this);
        }
    }

    private final Operator operator;

    private ComparisonFunction(Operator operator)
    {
        super(operator.getFunctionName(), 2, 2);
        this.operator = requireNonNull(operator, "operator is null");
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        EvalType left = arguments.get(0).getType().getEvalType();
        EvalType right = arguments.get(1).getType().getEvalType();
        EvalType compareType;
        if (left == right && left != EvalType.JSON) {
            compareType = left;
        }
        else if (isTemporal(left) || isTemporal(right) || left == EvalType.JSON || right == EvalType.JSON) {
            throw tesseraException(TYPE_MISMATCH, "Cannot compare %s with %s", arguments.get(0).getType(), arguments.get(1).getType());
        }
        else if ((left == EvalType.INT || left == EvalType.DECIMAL) && (right == EvalType.INT || right == EvalType.DECIMAL)) {
            compareType = EvalType.DECIMAL;
        }
        else {
            compareType = EvalType.REAL;
        }
        return new Comparison(context, arguments, operator, compareType);
    }

    private static boolean isTemporal(EvalType evalType)
    {
        return evalType == EvalType.DATETIME || evalType == EvalType.DURATION;
    }

    private static final class Comparison
            extends AbstractBuiltinFunction
    {
        private final Operator operator;
        private final EvalType compareType;

        private Comparison(SessionContext context, List<? extends Expression> arguments, Operator operator, EvalType compareType)
        {
            super(context, arguments, FieldType.BOOLEAN);
            this.operator = operator;
            this.compareType = compareType;
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Comparison(getContext(), arguments, operator, compareType);
        }

        @Override
        public Long evalInt(Row row)
        {
            Expression leftArgument = getArgument(0);
            Expression rightArgument = getArgument(1);
            Object left = Expressions.evaluateNative(leftArgument, row);
            if (left == null) {
                return null;
            }
            Object right = Expressions.evaluateNative(rightArgument, row);
            if (right == null) {
                return null;
            }
            boolean leftUnsigned = leftArgument.getType().isUnsigned();
            boolean rightUnsigned = rightArgument.getType().isUnsigned();
            int comparison;
            switch (compareType) {
                case INT:
                    comparison = compareIntegers((Long) left, leftUnsigned, (Long) right, rightUnsigned);
                    break;
                case DECIMAL:
                    comparison = ValueConversions.toDecimal(left, leftUnsigned).compareTo(ValueConversions.toDecimal(right, rightUnsigned));
                    break;
                case STRING:
                    comparison = ((Slice) left).compareTo((Slice) right);
                    break;
                case DATETIME:
                    comparison = ((LocalDateTime) left).compareTo((LocalDateTime) right);
                    break;
                case DURATION:
                    comparison = ((Duration) left).compareTo((Duration) right);
                    break;
                default:
                    comparison = Double.compare(ValueConversions.toDouble(left, leftUnsigned), ValueConversions.toDouble(right, rightUnsigned));
            }
            return operator.test(comparison) ? 1L : 0L;
        }

        private static int compareIntegers(long left, boolean leftUnsigned, long right, boolean rightUnsigned)
        {
            if (leftUnsigned && rightUnsigned) {
                return Long.compareUnsigned(left, right);
            }
            if (leftUnsigned && left < 0) {
                return 1;
            }
            if (rightUnsigned && right < 0) {
                return -1;
            }
            return Long.compare(left, right);
        }

        @Override
        public boolean equals(Object obj)
        {
            if (!super.equals(obj)) {
                return false;
            }
            Comparison other = (Comparison) obj;
            return operator == other.operator && compareType == other.compareType;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(super.hashCode(), operator, compareType);
        }
    }
}
