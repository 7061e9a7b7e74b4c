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

import io.airlift.slice.DynamicSliceOutput;
import io.airlift.slice.Slice;
import io.tessera.metadata.AbstractBuiltinFunction;
import io.tessera.metadata.BuiltinFunction;
import io.tessera.metadata.SqlScalarFunction;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.util.List;

/**
 * Concatenates the string form of its arguments. The result is NULL if any argument is NULL.
 */
public final class ConcatFunction
        extends SqlScalarFunction
{
    public static final ConcatFunction CONCAT = new ConcatFunction();

    private ConcatFunction()
    {
        super("concat", 1, VARIABLE_ARITY);
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        return new Concat(context, arguments);
    }

    private static final class Concat
            extends AbstractBuiltinFunction
    {
        private Concat(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.VARCHAR);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Concat(getContext(), arguments);
        }

        @Override
        public Slice evalString(Row row)
        {
            DynamicSliceOutput output = new DynamicSliceOutput(32);
            for (int i = 0; i < getArgumentCount(); i++) {
                Slice value = evalStringArgument(getArgument(i), row);
                if (value == null) {
                    return null;
                }
                output.appendBytes(value);
            }
            return output.slice();
        }
    }
}
