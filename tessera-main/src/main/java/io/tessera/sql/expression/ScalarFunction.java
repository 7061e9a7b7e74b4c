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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.UnsignedLong;
import io.airlift.slice.Slice;
import io.tessera.metadata.BuiltinFunction;
import io.tessera.spi.block.Chunk;
import io.tessera.spi.block.ColumnVector;
import io.tessera.spi.block.Row;
import io.tessera.spi.type.FieldType;
import io.tessera.sql.SessionContext;
import io.tessera.sql.StatementContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Call of a builtin scalar function. The node binds a lowercase function name to a
 * {@link BuiltinFunction} that owns the ordered argument list; every evaluation is
 * delegated to that implementation.
 * <p>
 * The structural hash is computed on first use and cached. {@link #replaceArgument}
 * and {@link #decorrelate} are the only operations that change the arguments, and
 * both clear the cache. Create instances with {@link ScalarFunctionFactory}.
 */
public final class ScalarFunction
        extends Expression
{
    /**
     * Functions whose result may differ between evaluations of the same statement,
     * so calls to them are never treated as constant.
     */
    public static final Set<String> UNFOLDABLE_FUNCTIONS = ImmutableSet.of(
            "sysdate",
            "found_rows",
            "rand",
            "uuid",
            "sleep",
            "row",
            "values",
            "setvar",
            "getvar",
            "get_param",
            "benchmark",
            "dayname",
            "nextval",
            "lastval",
            "setval");

    private static final Joiner ARGUMENT_JOINER = Joiner.on(", ");

    private final String name;
    private final FieldType returnType;
    private final BuiltinFunction function;

    private volatile CachedHash hashCache;

    ScalarFunction(String name, FieldType returnType, BuiltinFunction function)
    {
        this.name = requireNonNull(name, "name is null").toLowerCase(ENGLISH);
        this.returnType = requireNonNull(returnType, "returnType is null");
        this.function = requireNonNull(function, "function is null");
    }

    public String getName()
    {
        return name;
    }

    public BuiltinFunction getFunction()
    {
        return function;
    }

    public SessionContext getContext()
    {
        return function.getContext();
    }

    /**
     * Returns an unmodifiable view of the arguments.
     */
    public List<Expression> getArguments()
    {
        return function.getArguments();
    }

    /**
     * Replaces the argument at {@code index} and clears the cached hash.
     */
    public void replaceArgument(int index, Expression argument)
    {
        function.setArgument(index, requireNonNull(argument, "argument is null"));
        hashCache = null;
    }

    @Override
    public FieldType getType()
    {
        return returnType;
    }

    /**
     * Evaluates the call for one row. Only INT, REAL and STRING return types are
     * evaluated; for any other category this returns {@code null} without calling
     * the implementation. Unsigned integers are returned as {@link UnsignedLong}.
     */
    @Override
    public Object evaluate(Row row)
    {
        switch (returnType.getEvalType()) {
            case INT:
                Long value = function.evalInt(row);
                if (value == null) {
                    return null;
                }
                return returnType.isUnsigned() ? UnsignedLong.fromLongBits(value) : value;
            case REAL:
                return function.evalReal(row);
            case STRING:
                return function.evalString(row);
            default:
                return null;
        }
    }

    @Override
    public Long evalInt(Row row)
    {
        return function.evalInt(row);
    }

    @Override
    public Double evalReal(Row row)
    {
        return function.evalReal(row);
    }

    @Override
    public Slice evalString(Row row)
    {
        return function.evalString(row);
    }

    @Override
    public BigDecimal evalDecimal(Row row)
    {
        return function.evalDecimal(row);
    }

    @Override
    public LocalDateTime evalTime(Row row)
    {
        return function.evalTime(row);
    }

    @Override
    public Duration evalDuration(Row row)
    {
        return function.evalDuration(row);
    }

    @Override
    public void vecEvalInt(Chunk input, ColumnVector result)
    {
        function.vecEvalInt(input, result);
    }

    @Override
    public void vecEvalReal(Chunk input, ColumnVector result)
    {
        function.vecEvalReal(input, result);
    }

    @Override
    public void vecEvalString(Chunk input, ColumnVector result)
    {
        function.vecEvalString(input, result);
    }

    @Override
    public void vecEvalDecimal(Chunk input, ColumnVector result)
    {
        function.vecEvalDecimal(input, result);
    }

    @Override
    public void vecEvalTime(Chunk input, ColumnVector result)
    {
        function.vecEvalTime(input, result);
    }

    @Override
    public void vecEvalDuration(Chunk input, ColumnVector result)
    {
        function.vecEvalDuration(input, result);
    }

    @Override
    public boolean isVectorized()
    {
        return function.isVectorized() && function.areChildrenVectorized();
    }

    /**
     * Returns the flag of a function node, the length-prefixed name and the hash of
     * each argument in order. The encoding depends on argument order, so
     * {@code plus(a, b)} and {@code plus(b, a)} hash differently.
     * <p>
     * The result is cached. The cache records the cached hashes of nested calls it was
     * built from and is rebuilt when one of them has changed, so rewriting a nested call
     * through its own {@link #replaceArgument} is reflected here.
     */
    @Override
    public byte[] getHashCode(StatementContext context)
    {
        return cachedHash(context).clone();
    }

    boolean hasCachedHash()
    {
        CachedHash cache = hashCache;
        return cache != null && cache.isCurrent(getArguments());
    }

    private byte[] cachedHash(StatementContext context)
    {
        CachedHash cache = hashCache;
        List<Expression> arguments = getArguments();
        byte[][] nestedHashes = new byte[arguments.size()][];
        boolean current = cache != null && cache.nestedHashes.length == arguments.size();
        for (int i = 0; i < arguments.size(); i++) {
            Expression argument = arguments.get(i);
            if (argument instanceof ScalarFunction) {
                nestedHashes[i] = ((ScalarFunction) argument).cachedHash(context);
                current = current && nestedHashes[i] == cache.nestedHashes[i];
            }
        }
        if (current) {
            return cache.hash;
        }

        HashEncoder encoder = new HashEncoder(16 + 16 * arguments.size())
                .appendFlag(HashEncoder.SCALAR_FUNCTION_FLAG)
                .appendCompactString(name);
        for (int i = 0; i < arguments.size(); i++) {
            encoder.appendRaw(nestedHashes[i] != null ? nestedHashes[i] : arguments.get(i).getHashCode(context));
        }
        cache = new CachedHash(encoder.toByteArray(), nestedHashes);
        hashCache = cache;
        return cache.hash;
    }

    @Override
    public boolean isConstant()
    {
        if (UNFOLDABLE_FUNCTIONS.contains(name)) {
            return false;
        }
        return Expressions.isConstant(getArguments());
    }

    @Override
    public boolean isCorrelated()
    {
        return Expressions.isCorrelated(getArguments());
    }

    /**
     * Decorrelates each argument and stores the result in the argument's slot.
     * This node is modified and returned; copy it first to keep the original.
     */
    @Override
    public ScalarFunction decorrelate(Schema schema)
    {
        List<Expression> arguments = getArguments();
        for (int i = 0; i < arguments.size(); i++) {
            function.setArgument(i, arguments.get(i).decorrelate(schema));
        }
        hashCache = null;
        return this;
    }

    @Override
    public ScalarFunction resolveIndices(Schema schema)
    {
        ScalarFunction copy = copy();
        copy.resolveIndicesInPlace(schema);
        return copy;
    }

    @Override
    void resolveIndicesInPlace(Schema schema)
    {
        // offsets are not part of the hash, so the cache stays valid
        for (Expression argument : getArguments()) {
            argument.resolveIndicesInPlace(schema);
        }
    }

    /**
     * Copies this node and its implementation, including the arguments. A current
     * cached hash is carried over to the copy rather than recomputed.
     */
    @Override
    public ScalarFunction copy()
    {
        CachedHash cache = hashCache;
        boolean current = cache != null && cache.isCurrent(getArguments());
        ScalarFunction copy = new ScalarFunction(name, returnType, function.copy());
        if (current) {
            List<Expression> arguments = copy.getArguments();
            byte[][] nestedHashes = new byte[arguments.size()][];
            for (int i = 0; i < arguments.size(); i++) {
                if (arguments.get(i) instanceof ScalarFunction) {
                    nestedHashes[i] = ((ScalarFunction) arguments.get(i)).hashCache.hash;
                }
            }
            copy.hashCache = new CachedHash(cache.hash, nestedHashes);
        }
        return copy;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ScalarFunction other = (ScalarFunction) obj;
        return name.equals(other.name) &&
                function.equals(other.function);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, function);
    }

    @Override
    public String toString()
    {
        return name + "(" + ARGUMENT_JOINER.join(getArguments()) + ")";
    }

    private static final class CachedHash
    {
        private final byte[] hash;
        // cached hash of each nested call at the time this hash was built, null for other arguments
        private final byte[][] nestedHashes;

        private CachedHash(byte[] hash, byte[][] nestedHashes)
        {
            this.hash = hash;
            this.nestedHashes = nestedHashes;
        }

        private boolean isCurrent(List<Expression> arguments)
        {
            if (arguments.size() != nestedHashes.length) {
                return false;
            }
            for (int i = 0; i < arguments.size(); i++) {
                Expression argument = arguments.get(i);
                if (argument instanceof ScalarFunction) {
                    CachedHash nested = ((ScalarFunction) argument).hashCache;
                    if (nested == null || nested.hash != nestedHashes[i] || !nested.isCurrent(((ScalarFunction) argument).getArguments())) {
                        return false;
                    }
                }
            }
            return true;
        }
    }
}
