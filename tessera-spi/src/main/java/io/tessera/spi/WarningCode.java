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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identifies a condition that does not fail the statement but is reported to the
 * client after it completes, such as a division by zero outside strict mode.
 */
public final class WarningCode
{
    private final int code;
    private final String name;

    public WarningCode(int code, String name)
    {
        if (code <= 0) {
            throw new IllegalArgumentException("code is not positive");
        }
        this.code = code;
        this.name = requireNonNull(name, "name is null");
    }

    public int getCode()
    {
        return code;
    }

    public String getName()
    {
        return name;
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
        return code == ((WarningCode) obj).code;
    }

    @Override
    public int hashCode()
    {
        return Integer.hashCode(code);
    }

    @Override
    public String toString()
    {
        return format("%s(%s)", name, code);
    }
}
