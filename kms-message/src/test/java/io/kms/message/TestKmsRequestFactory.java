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

import io.airlift.json.JsonCodec;
import io.kms.message.KmsOperations.DecryptRequest;
import io.kms.message.KmsOperations.EncryptRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.airlift.json.JsonCodec.jsonCodec;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class TestKmsRequestFactory
{
    private static final JsonCodec<EncryptRequest> ENCRYPT_CODEC = jsonCodec(EncryptRequest.class);
    private static final JsonCodec<DecryptRequest> DECRYPT_CODEC = jsonCodec(DecryptRequest.class);
    private static final Instant REQUEST_DATE = Instant.parse("2015-08-30T12:36:00Z");

    private final KmsRequestFactory requestFactory = new KmsRequestFactory(
            new SigningConfig()
                    .setRegion("us-west-2")
                    .setAccessKeyId("AKIDEXAMPLE")
                    .setSecretKey("wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY"),
            ENCRYPT_CODEC,
            DECRYPT_CODEC);

    @Test
    public void testHost()
    {
        assertThat(requestFactory.host()).isEqualTo("kms.us-west-2.amazonaws.com");

        KmsRequestFactory localFactory = new KmsRequestFactory(
                new SigningConfig().setAccessKeyId("a").setSecretKey("s").setEndpoint("localhost:8000"),
                ENCRYPT_CODEC,
                DECRYPT_CODEC);
        assertThat(localFactory.host()).isEqualTo("localhost:8000");
    }

    @Test
    public void testNewRequest()
    {
        KmsRequest request = requestFactory.newRequest("GET", "/?a=b");

        assertThat(request.region()).contains("us-west-2");
        assertThat(request.service()).contains("kms");
        assertThat(request.accessKeyId()).contains("AKIDEXAMPLE");
        assertThat(request.date()).isEmpty();
        assertThat(request.headers().isEmpty()).isTrue();
    }

    @Test
    public void testEncrypt()
    {
        KmsRequest request = requestFactory.encrypt("alias/example", "hello".getBytes(UTF_8), REQUEST_DATE);

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/");
        assertThat(request.date()).contains(REQUEST_DATE);
        assertThat(request.headers().get("Host")).contains("kms.us-west-2.amazonaws.com");
        assertThat(request.headers().get("Content-Type")).contains("application/x-amz-json-1.1");
        assertThat(request.headers().get("X-Amz-Date")).contains("20150830T123600Z");
        assertThat(request.headers().get("X-Amz-Target")).contains("TrentService.Encrypt");

        String body = new String(request.payload().toByteArray(), UTF_8);
        assertThat(body).contains("\"KeyId\"").contains("\"Plaintext\"").contains("aGVsbG8=");
        EncryptRequest decoded = ENCRYPT_CODEC.fromJson(body);
        assertThat(decoded.keyId()).isEqualTo("alias/example");
        assertThat(decoded.plaintext()).isEqualTo("hello".getBytes(UTF_8));

        assertThat(request.authorization().signedHeaders()).isEqualTo("content-type;host;x-amz-date;x-amz-target");
        assertThat(request.authorization().keyPath()).isEqualTo("20150830/us-west-2/kms/aws4_request");
        assertThat(request.signature()).isEqualTo(requestFactory.encrypt("alias/example", "hello".getBytes(UTF_8), REQUEST_DATE).signature());
    }

    @Test
    public void testDecrypt()
    {
        byte[] ciphertext = {1, 2, 3, (byte) 0xFF};
        KmsRequest request = requestFactory.decrypt(ciphertext, REQUEST_DATE);

        assertThat(request.headers().get("X-Amz-Target")).contains("TrentService.Decrypt");
        DecryptRequest decoded = DECRYPT_CODEC.fromJson(new String(request.payload().toByteArray(), UTF_8));
        assertThat(decoded.ciphertextBlob()).isEqualTo(ciphertext);
        assertThat(request.signedRequest()).startsWith("POST / HTTP/1.1\n").contains("\n\n{");
    }
}
