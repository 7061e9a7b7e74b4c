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
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.util.List;

/**
 * Length of a string in bytes.
 */
public final class LengthFunction
        extends SqlScalarFunction
{
    public static final LengthFunction LENGTH = new LengthFunction();

    private LengthFunction()
    {
        super("length", 1, 1);
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        return new Length(context, arguments);
    }

    private static final class Length
            extends AbstractBuiltinFunction
    {
        private Length(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.BIGINT);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Length(getContext(), arguments);
        }

        @Override
        public Long evalInt(Row row)
        {
            Slice value = evalStringArgument(getArgument(0), row);
            return value == null ? null : (long) value.length();
        }
    }
}
