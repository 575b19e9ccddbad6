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
package io.kms.message.spi.signing;

import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Value of the {@code Authorization} header of a SigV4 signed request, like
 * {@code AWS4-HMAC-SHA256 Credential=AKIDEXAMPLE/20150830/us-east-1/service/aws4_request, SignedHeaders=host;x-amz-date, Signature=5fa0...}
 */
public record RequestAuthorization(String accessKey, String keyPath, Set<String> lowercaseSignedHeaders, String signature)
{
    public static final String SIGNATURE_ALGORITHM = "AWS4-HMAC-SHA256";

    private static final String CREDENTIAL_HEADER = "%s Credential".formatted(SIGNATURE_ALGORITHM);

    public RequestAuthorization
    {
        requireNonNull(accessKey, "accessKey is null");
        requireNonNull(keyPath, "keyPath is null");
        // ImmutableSet keeps the canonical (sorted) order of the signed headers
        lowercaseSignedHeaders = ImmutableSet.copyOf(lowercaseSignedHeaders);
        requireNonNull(signature, "signature is null");
    }

    public RequestAuthorization(String accessKey, CredentialScope scope, List<String> lowercaseSignedHeaders, String signature)
    {
        this(accessKey, scope.keyPath(), ImmutableSet.copyOf(lowercaseSignedHeaders), signature);
    }

    public String signedHeaders()
    {
        return String.join(";", lowercaseSignedHeaders);
    }

    public String authorization()
    {
        return "%s=%s/%s, SignedHeaders=%s, Signature=%s".formatted(CREDENTIAL_HEADER, accessKey, keyPath, signedHeaders(), signature);
    }

    @Override
    public String toString()
    {
        return authorization();
    }
}
