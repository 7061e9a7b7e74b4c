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

import static io.airlift.slice.Slices.utf8Slice;
import static java.util.Locale.ENGLISH;

/**
 * {@code upper} and {@code lower}.
 */
public final class CaseConversionFunction
        extends SqlScalarFunction
{
    public static final CaseConversionFunction UPPER = new CaseConversionFunction("upper", true);
    public static final CaseConversionFunction LOWER = new CaseConversionFunction("lower", false);

    private final boolean upper;

    private CaseConversionFunction(String name, boolean upper)
    {
        super(name, 1, 1);
        this.upper = upper;
    }

    @Override
    protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
    {
        return new CaseConversion(context, arguments, upper);
    }

    private static final class CaseConversion
            extends AbstractBuiltinFunction
    {
        private final boolean upper;

        private CaseConversion(SessionContext context, List<? extends Expression> arguments, boolean upper)
        {
            super(context, arguments, FieldType.VARCHAR);
            this.upper = upper;
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new CaseConversion(getContext(), arguments, upper);
        }

        @Override
        public Slice evalString(Row row)
        {
            Slice value = evalStringArgument(getArgument(0), row);
            if (value == null) {
                return null;
            }
            String string = value.toStringUtf8();
            return utf8Slice(upper ? string.toUpperCase(ENGLISH) : string.toLowerCase(ENGLISH));
        }

        @Override
        public boolean equals(Object obj)
        {
            return super.equals(obj) && upper == ((CaseConversion) obj).upper;
        }

        @Override
        public int hashCode()
        {
            return 31 * super.hashCode() + Boolean.hashCode(upper);
        }
    }
}
