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

import com.google.common.collect.ImmutableList;
import io.tessera.spi.TesseraWarning;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Per-statement state shared by every expression evaluated for that statement.
 * Evaluation threads may report warnings concurrently.
 */
@ThreadSafe
public class StatementContext
{
    private final int maxWarnings;

    @GuardedBy("this")
    private final List<TesseraWarning> warnings = new ArrayList<>();
    @GuardedBy("this")
    private long warningCount;

    public StatementContext()
    {
        this(64);
    }

    public StatementContext(int maxWarnings)
    {
        if (maxWarnings < 0) {
            throw new IllegalArgumentException("maxWarnings is negative");
        }
        this.maxWarnings = maxWarnings;
    }

    public synchronized void appendWarning(TesseraWarning warning)
    {
        requireNonNull(warning, "warning is null");
        warningCount++;
        if (warnings.size() < maxWarnings) {
            warnings.add(warning);
        }
    }

    public synchronized List<TesseraWarning> getWarnings()
    {
        return ImmutableList.copyOf(warnings);
    }

    /**
     * Number of warnings reported, including those dropped after the first {@code maxWarnings}.
     */
    public synchronized long getWarningCount()
    {
        return warningCount;
    }
}
