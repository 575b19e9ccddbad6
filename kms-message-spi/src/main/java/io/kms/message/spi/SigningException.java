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
package io.kms.message.spi;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a request cannot be built, canonicalized or signed.
 * No partial canonical string, key or signature is ever produced alongside one.
 */
public class SigningException
        extends RuntimeException
{
    public enum Reason
    {
        /**
         * Invalid method, path, header name or raw request text, reported by the call that received it
         */
        MALFORMED_INPUT,
        /**
         * A field needed by canonicalization or signing (Host header, date, region, service, keys) is not set
         */
        MISSING_PREREQUISITE,
        /**
         * The hash or HMAC primitive rejected its key or input
         */
        PRIMITIVE_FAILURE,
    }

    private final Reason reason;

    public SigningException(Reason reason, String message)
    {
        super(message);
        this.reason = requireNonNull(reason, "reason is null");
    }

    public SigningException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = requireNonNull(reason, "reason is null");
    }

    public static SigningException malformedInput(String format, Object... args)
    {
        return new SigningException(Reason.MALFORMED_INPUT, format.formatted(args));
    }

    public static SigningException missingPrerequisite(String format, Object... args)
    {
        return new SigningException(Reason.MISSING_PREREQUISITE, format.formatted(args));
    }

    public Reason reason()
    {
        return reason;
    }
}
