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
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.EvalType;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.util.List;

import static io.tessera.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;

/**
 * Bitwise inversion of a 64 bit integer. The result is always unsigned, so
 * {@code bitneg(0)} is 18446744073709551615.
 */
public final class BitwiseNotFunction
        extends SqlScalarFunction
{
    public static final BitwiseNotFunction BITNEG = new BitwiseNotFunction();

    private BitwiseNotFunction()
    {
        super("bitneg", 1, 1);
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        EvalType evalType = arguments.get(0).getType().getEvalType();
        if (evalType == EvalType.DATETIME || evalType == EvalType.DURATION || evalType == EvalType.JSON) {
            throw tesseraException(TYPE_MISMATCH, "Function bitneg does not accept an argument of type %s", arguments.get(0).getType());
        }
        return new BitwiseNot(context, arguments);
    }

    private static final class BitwiseNot
            extends AbstractBuiltinFunction
    {
        private BitwiseNot(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.UNSIGNED_BIGINT);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new BitwiseNot(getContext(), arguments);
        }

        @Override
        public Long evalInt(Row row)
        {
            Long value = evalIntArgument(getArgument(0), row);
            return value == null ? null : ~value;
        }

        @Override
        public void vecEvalInt(Chunk input, ColumnVector result)
        {
            if (getArgument(0).getType().getEvalType() != EvalType.INT) {
                super.vecEvalInt(input, result);
                return;
            }
            ColumnVector values = evalArgument(getArgument(0), input);
            int positionCount = input.getPositionCount();
            result.reset(positionCount);
            for (int position = 0; position < positionCount; position++) {
                if (values.isNull(position)) {
                    result.setNull(position);
                }
                else {
                    result.setLong(position, ~values.getLong(position));
                }
            }
        }
    }
}
