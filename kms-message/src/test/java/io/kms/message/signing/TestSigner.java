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

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import io.kms.message.spi.signing.CredentialScope;
import io.kms.message.spi.signing.RequestAuthorization;
import io.kms.message.spi.signing.SigningServiceType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class TestSigner
{
    private static final String SECRET_KEY = "wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY";
    private static final Instant REQUEST_DATE = Instant.parse("2015-08-30T12:36:00Z");
    private static final LocalDate REQUEST_DAY = LocalDate.of(2015, 8, 30);

    private static final String GET_VANILLA_CANONICAL_REQUEST = """
            GET
            /

            host:example.amazonaws.com
            x-amz-date:20150830T123600Z

            host;x-amz-date
            e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855""";

    @Test
    public void testSigningKey()
    {
        CredentialScope scope = new CredentialScope(REQUEST_DAY, "us-east-1", SigningServiceType.IAM.serviceName());
        byte[] signingKey = Signer.signingKey(SECRET_KEY, scope);

        assertThat(signingKey).hasSize(32);
        assertThat(BaseEncoding.base16().lowerCase().encode(signingKey))
                .isEqualTo("c4afb1cc5771d871763a393e44b703571b55cc28424d1a5e86da6ed3c154a4b9");
    }

    @Test
    public void testStringToSignAndSignature()
    {
        CredentialScope scope = new CredentialScope(REQUEST_DAY, "us-east-1", SigningServiceType.TEST_SUITE.serviceName());
        String stringToSign = Signer.stringToSign(REQUEST_DATE, scope, GET_VANILLA_CANONICAL_REQUEST);

        assertThat(stringToSign).isEqualTo("""
                AWS4-HMAC-SHA256
                20150830T123600Z
                20150830/us-east-1/service/aws4_request
                bb579772317eb040ac9ed261061d46c1f17a8133879d6129b6e1c25292927e63""");
        assertThat(Signer.signature(Signer.signingKey(SECRET_KEY, scope), stringToSign))
                .isEqualTo("5fa00fa31553b73ebf1942676e86291e8372ff2a2260956d9b8aae1d763fbf31");
    }

    @Test
    public void testDeterministic()
    {
        CredentialScope scope = new CredentialScope(REQUEST_DAY, "us-east-1", SigningServiceType.KMS.serviceName());
        String first = Signer.signature(Signer.signingKey(SECRET_KEY, scope), "data");
        String second = Signer.signature(Signer.signingKey(SECRET_KEY, scope), "data");
        assertThat(first).isEqualTo(second).hasSize(64);
        assertThat(Signer.signature(Signer.signingKey(SECRET_KEY + "x", scope), "data")).isNotEqualTo(first);
    }

    @Test
    public void testSignedRequest()
    {
        CredentialScope scope = new CredentialScope(REQUEST_DAY, "us-east-1", "service");
        HeaderTable headers = new HeaderTable()
                .add("Host", "example.amazonaws.com")
                .add("X-Amz-Date", "20150830T123600Z");
        RequestAuthorization authorization = new RequestAuthorization("AKIDEXAMPLE", scope, ImmutableList.of("host", "x-amz-date"), "abc");

        byte[] withoutPayload = Signer.signedRequest("GET", "/", "a=b", headers, authorization, new RequestPayload());
        assertThat(new String(withoutPayload, UTF_8)).isEqualTo("""
                GET /?a=b HTTP/1.1
                Host:example.amazonaws.com
                X-Amz-Date:20150830T123600Z
                Authorization: AWS4-HMAC-SHA256 Credential=AKIDEXAMPLE/20150830/us-east-1/service/aws4_request, SignedHeaders=host;x-amz-date, Signature=abc""");

        byte[] withPayload = Signer.signedRequest("POST", "/", "", headers, authorization, new RequestPayload().append("Param1=value1"));
        assertThat(new String(withPayload, UTF_8)).endsWith("Signature=abc\n\nParam1=value1")
                .startsWith("POST / HTTP/1.1\n");
    }
}
