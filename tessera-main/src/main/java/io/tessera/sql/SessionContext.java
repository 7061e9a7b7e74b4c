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

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Settings of the session an expression is evaluated in. Builtin functions read
 * them; the expression layer passes them through untouched.
 */
public final class SessionContext
{
    private final ZoneId timeZone;
    private final boolean strictMode;
    private final Clock clock;
    private final StatementContext statementContext;

    private SessionContext(ZoneId timeZone, boolean strictMode, Clock clock, StatementContext statementContext)
    {
        this.timeZone = requireNonNull(timeZone, "timeZone is null");
        this.strictMode = strictMode;
        this.clock = requireNonNull(clock, "clock is null");
        this.statementContext = requireNonNull(statementContext, "statementContext is null");
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    /**
     * In strict mode, data errors such as division by zero fail the statement
     * instead of producing NULL and a warning.
     */
    public boolean isStrictMode()
    {
        return strictMode;
    }

    public Clock getClock()
    {
        return clock;
    }

    public StatementContext getStatementContext()
    {
        return statementContext;
    }

    public LocalDateTime getCurrentTime()
    {
        return LocalDateTime.now(clock.withZone(timeZone));
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("timeZone", timeZone)
                .add("strictMode", strictMode)
                .toString();
    }

    public static final class Builder
    {
        private ZoneId timeZone = ZoneId.of("UTC");
        private boolean strictMode = true;
        private Clock clock = Clock.systemUTC();
        private StatementContext statementContext = new StatementContext();

        private Builder() {}

        public Builder setTimeZone(ZoneId timeZone)
        {
            this.timeZone = requireNonNull(timeZone, "timeZone is null");
            return this;
        }

        public Builder setStrictMode(boolean strictMode)
        {
            this.strictMode = strictMode;
            return this;
        }

        public Builder setClock(Clock clock)
        {
            this.clock = requireNonNull(clock, "clock is null");
            return this;
        }

        public Builder setStatementContext(StatementContext statementContext)
        {
            this.statementContext = requireNonNull(statementContext, "statementContext is null");
            return this;
        }

        public SessionContext build()
        {
            return new SessionContext(timeZone, strictMode, clock, statementContext);
        }
    }
}
