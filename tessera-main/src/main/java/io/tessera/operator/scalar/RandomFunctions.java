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
import java.util.Random;
import java.util.UUID;

import static io.airlift.slice.Slices.utf8Slice;
import static io.tessera.spi.StandardErrorCode.INVALID_FUNCTION_ARGUMENT;
import static io.tessera.spi.TesseraException.tesseraException;

/**
 * Functions whose result changes between evaluations: {@code rand}, {@code uuid} and
 * {@code sleep}. They are evaluated row by row only.
 */
public final class RandomFunctions
{
    public static final SqlScalarFunction RAND = new SqlScalarFunction("rand", 0, 1)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            return new Rand(context, arguments);
        }
    };

    public static final SqlScalarFunction UUID_FUNCTION = new SqlScalarFunction("uuid", 0, 0)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            return new Uuid(context, arguments);
        }
    };

    public static final SqlScalarFunction SLEEP = new SqlScalarFunction("sleep", 1, 1)
    {
        @Override
        protected BuiltinFunction specialize(SessionContext context, List<Expression> arguments)
        {
            return new Sleep(context, arguments);
        }
    };

    private RandomFunctions() {}

    /**
     * Uniform double in [0, 1). With a seed argument, the sequence is seeded on the
     * first evaluation and is reproducible.
     */
    private static final class Rand
            extends AbstractBuiltinFunction
    {
        private Random random;

        private Rand(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.DOUBLE);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Rand(getContext(), arguments);
        }

        @Override
        public synchronized Double evalReal(Row row)
        {
            if (random == null) {
                if (getArgumentCount() == 0) {
                    random = new Random();
                }
                else {
                    Long seed = evalIntArgument(getArgument(0), row);
                    random = new Random(seed == null ? 0 : seed);
                }
            }
            return random.nextDouble();
        }

        @Override
        public boolean isVectorized()
        {
            return false;
        }
    }

    private static final class Uuid
            extends AbstractBuiltinFunction
    {
        private Uuid(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.VARCHAR);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Uuid(getContext(), arguments);
        }

        @Override
        public Slice evalString(Row row)
        {
            return utf8Slice(UUID.randomUUID().toString());
        }

        @Override
        public boolean isVectorized()
        {
            return false;
        }
    }

    /**
     * Pauses for the given number of seconds and returns 0, or 1 if interrupted.
     * A NULL or negative duration fails in strict mode and returns 0 otherwise.
     */
    private static final class Sleep
            extends AbstractBuiltinFunction
    {
        private Sleep(SessionContext context, List<? extends Expression> arguments)
        {
            super(context, arguments, FieldType.BIGINT);
        }

        @Override
        protected BuiltinFunction copyWith(List<Expression> arguments)
        {
            return new Sleep(getContext(), arguments);
        }

        @Override
        public Long evalInt(Row row)
        {
            Double seconds = evalRealArgument(getArgument(0), row);
            if (seconds == null || seconds < 0) {
                if (getContext().isStrictMode()) {
                    throw tesseraException(INVALID_FUNCTION_ARGUMENT, "Incorrect arguments to sleep: %s", seconds);
                }
                return 0L;
            }
            try {
                Thread.sleep((long) (seconds * 1000));
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 1L;
            }
            return 0L;
        }

        @Override
        public boolean isVectorized()
        {
            return false;
        }
    }
}
