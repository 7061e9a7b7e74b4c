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
package io.tessera.metadata;

import io.tessera.sql.SessionContext;
import io.tessera.sql.expression.Expression;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.tessera.spi.StandardErrorCode.FUNCTION_ARGUMENT_COUNT_MISMATCH;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * A named builtin scalar function. Binds argument lists to {@link BuiltinFunction} implementations.
 */
public abstract class SqlScalarFunction
{
    public static final int VARIABLE_ARITY = -1;

    private final String name;
    private final int minArguments;
    private final int maxArguments;

    protected SqlScalarFunction(String name, int minArguments, int maxArguments)
    {
        this.name = requireNonNull(name, "name is null").toLowerCase(ENGLISH);
        checkArgument(minArguments >= 0, "minArguments is negative");
        checkArgument(maxArguments == VARIABLE_ARITY || maxArguments >= minArguments, "maxArguments is less than minArguments");
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
    }

    public final String getName()
    {
        return name;
    }

    public final int getMinArguments()
    {
        return minArguments;
    }

    public final int getMaxArguments()
    {
        return maxArguments;
    }

    /**
     * Validates the arguments and returns an implementation bound to them.
     * The implementation takes ownership of {@code arguments}.
     */
    public final BuiltinFunction create(SessionContext context, List<Expression> arguments)
    {
        requireNonNull(context, "context is null");
        requireNonNull(arguments, "arguments is null");
        int count = arguments.size();
        if (count < minArguments || (maxArguments != VARIABLE_ARITY && count > maxArguments)) {
            throw tesseraException(FUNCTION_ARGUMENT_COUNT_MISMATCH, "Incorrect parameter count in the call to function '%s': expected %s, but got %s", name, describeArity(), count);
        }
        return specialize(context, arguments);
    }

    protected abstract BuiltinFunction specialize(SessionContext context, List<Expression> arguments);

    private String describeArity()
    {
        if (maxArguments == VARIABLE_ARITY) {
            return "at least " + minArguments;
        }
        if (minArguments == maxArguments) {
            return String.valueOf(minArguments);
        }
        return minArguments + " to " + maxArguments;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
