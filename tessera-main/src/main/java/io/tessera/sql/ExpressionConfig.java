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
package io.tessera.sql;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

public class ExpressionConfig
{
    private boolean constantFoldingEnabled = true;
    private boolean vectorizedEvaluationEnabled = true;
    private boolean precomputeHashEnabled = true;

    public boolean isConstantFoldingEnabled()
    {
        return constantFoldingEnabled;
    }

    @Config("expression.constant-folding-enabled")
    @ConfigDescription("Replace constant function calls by their value when they are created")
    public ExpressionConfig setConstantFoldingEnabled(boolean constantFoldingEnabled)
    {
        this.constantFoldingEnabled = constantFoldingEnabled;
        return this;
    }

    public boolean isVectorizedEvaluationEnabled()
    {
        return vectorizedEvaluationEnabled;
    }

    @Config("expression.vectorized-evaluation-enabled")
    public ExpressionConfig setVectorizedEvaluationEnabled(boolean vectorizedEvaluationEnabled)
    {
        this.vectorizedEvaluationEnabled = vectorizedEvaluationEnabled;
        return this;
    }

    public boolean isPrecomputeHashEnabled()
    {
        return precomputeHashEnabled;
    }

    @Config("expression.precompute-hash-enabled")
    @ConfigDescription("Compute the structural hash of function calls when they are created")
    public ExpressionConfig setPrecomputeHashEnabled(boolean precomputeHashEnabled)
    {
        this.precomputeHashEnabled = precomputeHashEnabled;
        return this;
    }
}
