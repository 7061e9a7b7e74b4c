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

import io.airlift.log.Logger;
import io.tessera.spi.block.Row;

/**
 * Replaces constant function calls by literals.
 */
public final class ConstantFolder
{
    private static final Logger log = Logger.get(ConstantFolder.class);

    private ConstantFolder() {}

    /**
     * Evaluates {@code expression} once if it is a constant function call and returns
     * the resulting literal. Non-constant calls, other nodes and calls whose evaluation
     * fails are returned unchanged.
     */
    public static Expression fold(Expression expression)
    {
        if (!(expression instanceof ScalarFunction) || !expression.isConstant()) {
            return expression;
        }
        try {
            Object value = Expressions.evaluateNative(expression, Row.EMPTY);
            return new Constant(value, expression.getType());
        }
        catch (RuntimeException e) {
            log.debug(e, "Failed to fold %s", expression);
            return expression;
        }
    }
}
