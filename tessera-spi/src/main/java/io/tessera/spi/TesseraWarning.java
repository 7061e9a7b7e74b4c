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
package io.tessera.spi;

import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A warning raised while evaluating a statement.
 */
public final class TesseraWarning
{
    private final WarningCode warningCode;
    private final String message;

    public TesseraWarning(WarningCodeSupplier warningCode, String message)
    {
        this.warningCode = requireNonNull(warningCode, "warningCode is null").toWarningCode();
        this.message = requireNonNull(message, "message is null");
    }

    public WarningCode getWarningCode()
    {
        return warningCode;
    }

    public String getMessage()
    {
        return message;
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
        TesseraWarning other = (TesseraWarning) obj;
        return warningCode.equals(other.warningCode) && message.equals(other.message);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(warningCode, message);
    }

    /**
     * Renders the warning the way a statement's warning list shows it: {@code Warning DIVISION_BY_ZERO(1): Division by 0}.
     */
    @Override
    public String toString()
    {
        return format("Warning %s: %s", warningCode, message);
    }
}
