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
package io.kms.message;

import com.google.inject.Inject;
import io.airlift.json.JsonCodec;
import io.kms.message.KmsOperations.DecryptRequest;
import io.kms.message.KmsOperations.EncryptRequest;
import io.kms.message.spi.credentials.Credential;
import io.kms.message.spi.timestamps.AwsTimestamp;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

public class KmsRequestFactory
{
    private final String region;
    private final String service;
    private final String host;
    private final Credential credential;
    private final JsonCodec<EncryptRequest> encryptCodec;
    private final JsonCodec<DecryptRequest> decryptCodec;

    @Inject
    public KmsRequestFactory(SigningConfig config, JsonCodec<EncryptRequest> encryptCodec, JsonCodec<DecryptRequest> decryptCodec)
    {
        requireNonNull(config, "config is null");
        this.region = requireNonNull(config.getRegion(), "region is null");
        this.service = requireNonNull(config.getService(), "service is null");
        this.host = config.getEndpoint().orElseGet(() -> "kms.%s.amazonaws.com".formatted(region));
        this.credential = config.toCredential();
        this.encryptCodec = requireNonNull(encryptCodec, "encryptCodec is null");
        this.decryptCodec = requireNonNull(decryptCodec, "decryptCodec is null");
    }

    public String host()
    {
        return host;
    }

    /**
     * A request with region, service and credentials filled in. Headers, including {@code Host}, are left to the caller.
     */
    public KmsRequest newRequest(String method, String pathAndQuery)
    {
        return withSigningParameters(KmsRequest.newRequest(method, pathAndQuery));
    }

    /**
     * Apply the configured region, service and credentials to a request built elsewhere, such as a parsed one
     */
    public KmsRequest withSigningParameters(KmsRequest request)
    {
        return requireNonNull(request, "request is null")
                .setRegion(region)
                .setService(service)
                .setCredential(credential);
    }

    public KmsRequest encrypt(String keyId, byte[] plaintext, Instant date)
    {
        return operation(EncryptRequest.TARGET, encryptCodec.toJson(new EncryptRequest(keyId, plaintext)), date);
    }

    public KmsRequest decrypt(byte[] ciphertextBlob, Instant date)
    {
        return operation(DecryptRequest.TARGET, decryptCodec.toJson(new DecryptRequest(ciphertextBlob)), date);
    }

    private KmsRequest operation(String target, String body, Instant date)
    {
        requireNonNull(date, "date is null");
        return newRequest("POST", "/")
                .setDate(date)
                .addHeader("Content-Type", KmsOperations.CONTENT_TYPE)
                .addHeader("Host", host)
                .addHeader("X-Amz-Date", AwsTimestamp.toRequestFormat(date))
                .addHeader("X-Amz-Target", target)
                .appendPayload(body);
    }
}
