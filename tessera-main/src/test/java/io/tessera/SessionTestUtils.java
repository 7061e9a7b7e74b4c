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
package io.tessera;

import io.tessera.sql.SessionContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

public final class SessionTestUtils
{
    public static final Clock TEST_CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123456Z"), ZoneId.of("UTC"));

    private SessionTestUtils() {}

    public static SessionContext testSession()
    {
        return SessionContext.builder()
                .setClock(TEST_CLOCK)
                .build();
    }

    public static SessionContext nonStrictSession()
    {
        return SessionContext.builder()
                .setClock(TEST_CLOCK)
                .setStrictMode(false)
                .build();
    }
}
