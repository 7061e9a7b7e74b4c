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
 * Failure of an expression operation. Construction, index resolution and evaluation
 * report errors by throwing this exception; the error code tells user errors such as
 * type mismatches apart from internal ones.
 */
public class TesseraException
        extends RuntimeException
{
    private final ErrorCode errorCode;

    public TesseraException(ErrorCodeSupplier errorCode, String message)
    {
        this(errorCode, message, null);
    }

    public TesseraException(ErrorCodeSupplier errorCode, String message, Throwable cause)
    {
        super(message, cause);
        this.errorCode = requireNonNull(errorCode, "errorCode is null").toErrorCode();
    }

    public ErrorCode getErrorCode()
    {
        return errorCode;
    }

    public boolean isUserError()
    {
        return errorCode.isUserError();
    }

    /**
     * Returns the message, or the name of the error code if there is none.
     */
    @Override
    public String getMessage()
    {
        String message = super.getMessage();
        return message == null ? errorCode.getName() : message;
    }

    public static TesseraException tesseraException(ErrorCodeSupplier errorCode, String format, Object... args)
    {
        return new TesseraException(errorCode, format(format, args));
    }

    public static TesseraException tesseraException(ErrorCodeSupplier errorCode, Throwable cause, String format, Object... args)
    {
        return new TesseraException(errorCode, format(format, args), cause);
    }
}
