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

import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;

import javax.annotation.concurrent.ThreadSafe;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Maps function names to builtin functions. Lookups read an immutable snapshot and
 * need no locking; registration replaces the snapshot.
 */
@ThreadSafe
public class FunctionRegistry
{
    private static final Logger log = Logger.get(FunctionRegistry.class);

    private volatile FunctionMap functions = new FunctionMap();

    public FunctionRegistry() {}

    public FunctionRegistry(List<? extends SqlScalarFunction> functions)
    {
        addFunctions(functions);
    }

    public final synchronized void addFunctions(List<? extends SqlScalarFunction> functions)
    {
        for (SqlScalarFunction function : functions) {
            checkArgument(!this.functions.contains(function.getName()), "Function already registered: %s", function.getName());
        }
        this.functions = new FunctionMap(this.functions, functions);
        log.debug("Registered %s functions, %s in total", functions.size(), this.functions.size());
    }

    public Optional<SqlScalarFunction> lookup(String name)
    {
        requireNonNull(name, "name is null");
        return Optional.ofNullable(functions.get(name.toLowerCase(ENGLISH)));
    }

    public boolean isRegistered(String name)
    {
        return lookup(name).isPresent();
    }

    public Collection<SqlScalarFunction> list()
    {
        return functions.list();
    }

    private static class FunctionMap
    {
        private final Map<String, SqlScalarFunction> functions;

        public FunctionMap()
        {
            functions = ImmutableMap.of();
        }

        public FunctionMap(FunctionMap map, Iterable<? extends SqlScalarFunction> functions)
        {
            ImmutableMap.Builder<String, SqlScalarFunction> builder = ImmutableMap.<String, SqlScalarFunction>builder()
                    .putAll(map.functions);
            for (SqlScalarFunction function : functions) {
                builder.put(function.getName(), function);
            }
            // duplicates within one batch fail here
            this.functions = builder.build();
        }

        public boolean contains(String name)
        {
            return functions.containsKey(name);
        }

        public SqlScalarFunction get(String name)
        {
            return functions.get(name);
        }

        public Collection<SqlScalarFunction> list()
        {
            return functions.values();
        }

        public int size()
        {
            return functions.size();
        }
    }
}
