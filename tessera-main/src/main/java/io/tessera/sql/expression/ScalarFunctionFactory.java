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
package io.tessera.sql.expression;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.tessera.metadata.BuiltinFunction;
import io.tessera.metadata.FunctionRegistry;
import io.tessera.metadata.SqlScalarFunction;
import io.tessera.spi.TesseraException;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.ExpressionConfig;
import io.tessera.sql.SessionContext;

import java.util.ArrayList;
import java.util.List;

import static io.tessera.spi.StandardErrorCode.FUNCTION_NOT_FOUND;
import static io.tessera.spi.StandardErrorCode.INVALID_RETURN_TYPE;
import static io.tessera.spi.TesseraException.tesseraException;
import static java.util.Objects.requireNonNull;

/**
 * Creates {@link ScalarFunction} nodes from a function name and arguments.
 * <p>
 * The node's type is the type inferred by the builtin implementation, unless the
 * implementation leaves it unspecified, in which case the declared type is used.
 */
public class ScalarFunctionFactory
{
    private static final Logger log = Logger.get(ScalarFunctionFactory.class);

    private final FunctionRegistry functionRegistry;
    private final boolean constantFoldingEnabled;
    private final boolean precomputeHashEnabled;

    public ScalarFunctionFactory(FunctionRegistry functionRegistry, ExpressionConfig config)
    {
        this.functionRegistry = requireNonNull(functionRegistry, "functionRegistry is null");
        requireNonNull(config, "config is null");
        this.constantFoldingEnabled = config.isConstantFoldingEnabled();
        this.precomputeHashEnabled = config.isPrecomputeHashEnabled();
    }

    public FunctionRegistry getFunctionRegistry()
    {
        return functionRegistry;
    }

    public Expression newFunction(SessionContext context, String name, FieldType declaredType, Expression... arguments)
    {
        return newFunction(context, name, declaredType, ImmutableList.copyOf(arguments));
    }

    /**
     * Creates a call and, if it is constant, folds it into a literal.
     */
    public Expression newFunction(SessionContext context, String name, FieldType declaredType, List<? extends Expression> arguments)
    {
        ScalarFunction function = newFunctionBase(context, name, declaredType, arguments);
        if (!constantFoldingEnabled) {
            return function;
        }
        return ConstantFolder.fold(function);
    }

    public ScalarFunction newFunctionBase(SessionContext context, String name, FieldType declaredType, Expression... arguments)
    {
        return newFunctionBase(context, name, declaredType, ImmutableList.copyOf(arguments));
    }

    /**
     * Creates a call without folding it.
     */
    public ScalarFunction newFunctionBase(SessionContext context, String name, FieldType declaredType, List<? extends Expression> arguments)
    {
        requireNonNull(context, "context is null");
        requireNonNull(name, "name is null");
        requireNonNull(arguments, "arguments is null");
        if (declaredType == null) {
            throw tesseraException(INVALID_RETURN_TYPE, "Return type of function %s is missing", name);
        }
        SqlScalarFunction sqlFunction = functionRegistry.lookup(name)
                .orElseThrow(() -> tesseraException(FUNCTION_NOT_FOUND, "Function %s does not exist", name));

        BuiltinFunction function = sqlFunction.create(context, new ArrayList<>(arguments));
        FieldType returnType = function.getReturnType();
        if (returnType.isUnspecified() && !declaredType.isUnspecified()) {
            returnType = declaredType;
        }

        ScalarFunction scalarFunction = new ScalarFunction(sqlFunction.getName(), returnType, function);
        if (precomputeHashEnabled) {
            scalarFunction.getHashCode(context.getStatementContext());
        }
        return scalarFunction;
    }

    /**
     * Same as {@link #newFunction(SessionContext, String, FieldType, Expression...)}, but
     * logs the failure and returns {@code null} instead of throwing.
     */
    public Expression newFunctionInternal(SessionContext context, String name, FieldType declaredType, Expression... arguments)
    {
        try {
            return newFunction(context, name, declaredType, arguments);
        }
        catch (TesseraException e) {
            log.error(e, "Failed to create function %s", name);
            return null;
        }
    }
}
