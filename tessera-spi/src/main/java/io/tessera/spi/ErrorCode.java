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

import static io.tessera.spi.ErrorType.INTERNAL_ERROR;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identifies the failure behind a {@link TesseraException}. Codes below
 * {@link #INTERNAL_ERROR_CODE_START} are user errors, the ones from there on are
 * internal errors. Two error codes are equal when their numeric codes are.
 */
public final class ErrorCode
{
    public static final int INTERNAL_ERROR_CODE_START = 0x0001_0000;

    private final int code;
    private final String name;
    private final ErrorType type;

    public ErrorCode(int code, String name, ErrorType type)
    {
        if (code < 0) {
            throw new IllegalArgumentException("code is negative");
        }
        this.name = requireNonNull(name, "name is null");
        this.type = requireNonNull(type, "type is null");
        if ((code >= INTERNAL_ERROR_CODE_START) != (type == INTERNAL_ERROR)) {
            throw new IllegalArgumentException(format("Code %s of %s is not in the %s range", code, name, type));
        }
        this.code = code;
    }

    public int getCode()
    {
        return code;
    }

    public String getName()
    {
        return name;
    }

    public ErrorType getType()
    {
        return type;
    }

    public boolean isUserError()
    {
        return type == ErrorType.USER_ERROR;
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
        return code == ((ErrorCode) obj).code;
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
