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
package io.kms.message.signing;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import io.airlift.log.Logger;
import io.kms.message.spi.SigningException;
import io.kms.message.spi.signing.CredentialScope;
import io.kms.message.spi.signing.RequestAuthorization;
import io.kms.message.spi.timestamps.AwsTimestamp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;

import static io.kms.message.spi.SigningException.Reason.PRIMITIVE_FAILURE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * The SigV4 string-to-sign, key derivation chain and signed request rendering.
 *
 * @see <a href="https://docs.aws.amazon.com/IAM/latest/UserGuide/reference_sigv-create-signed-request.html">Signature Version 4 signing process</a>
 */
public final class Signer
{
    private static final Logger log = Logger.get(Signer.class);

    private static final String SECRET_KEY_PREFIX = "AWS4";
    private static final String HTTP_VERSION = "HTTP/1.1";

    private Signer() {}

    public static String stringToSign(Instant date, CredentialScope scope, String canonicalRequest)
    {
        requireNonNull(date, "date is null");
        requireNonNull(scope, "scope is null");
        requireNonNull(canonicalRequest, "canonicalRequest is null");

        return String.join("\n",
                RequestAuthorization.SIGNATURE_ALGORITHM,
                AwsTimestamp.toRequestFormat(date),
                scope.keyPath(),
                Hashing.sha256().hashString(canonicalRequest, UTF_8).toString());
    }

    /**
     * Derive the 32 byte signing key for the scope. Every step of the chain succeeds or none does.
     */
    public static byte[] signingKey(String secretKey, CredentialScope scope)
    {
        requireNonNull(secretKey, "secretKey is null");
        requireNonNull(scope, "scope is null");

        byte[] key = hmac((SECRET_KEY_PREFIX + secretKey).getBytes(UTF_8), scope.dateStamp());
        key = hmac(key, scope.region());
        key = hmac(key, scope.service());
        return hmac(key, CredentialScope.TERMINATOR);
    }

    public static String signature(byte[] signingKey, String stringToSign)
    {
        requireNonNull(signingKey, "signingKey is null");
        requireNonNull(stringToSign, "stringToSign is null");

        return hmacFunction(signingKey).hashString(stringToSign, UTF_8).toString();
    }

    /**
     * Render the request as it goes on the wire: request line, the headers as added,
     * the {@code Authorization} header and, when there is one, a blank line and the payload.
     * Nothing follows the last header line when the payload is empty.
     */
    public static byte[] signedRequest(String method, String path, String query, HeaderTable headers, RequestAuthorization authorization, RequestPayload payload)
    {
        requireNonNull(method, "method is null");
        requireNonNull(path, "path is null");
        requireNonNull(query, "query is null");
        requireNonNull(headers, "headers is null");
        requireNonNull(authorization, "authorization is null");
        requireNonNull(payload, "payload is null");

        StringBuilder head = new StringBuilder();
        head.append(method).append(' ').append(path);
        if (!query.isEmpty()) {
            head.append('?').append(query);
        }
        head.append(' ').append(HTTP_VERSION).append('\n');
        headers.forEach((name, value) -> head.append(name).append(':').append(value).append('\n'));
        head.append("Authorization: ").append(authorization.authorization());

        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length() + payload.size() + 2);
        try {
            out.write(head.toString().getBytes(UTF_8));
            if (!payload.isEmpty()) {
                out.write('\n');
                out.write('\n');
                payload.writeTo(out);
            }
        }
        catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static byte[] hmac(byte[] key, String data)
    {
        return hmacFunction(key).hashString(data, UTF_8).asBytes();
    }

    private static HashFunction hmacFunction(byte[] key)
    {
        try {
            return Hashing.hmacSha256(key);
        }
        catch (IllegalArgumentException e) {
            log.debug(e, "HMAC-SHA256 rejected the signing key");
            throw new SigningException(PRIMITIVE_FAILURE, "HMAC-SHA256 rejected the signing key", e);
        }
    }
}
