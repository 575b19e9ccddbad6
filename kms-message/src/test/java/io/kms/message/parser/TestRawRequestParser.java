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
package io.kms.message.parser;

import io.kms.message.KmsRequest;
import io.kms.message.spi.SigningException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.kms.message.spi.SigningException.Reason.MALFORMED_INPUT;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestRawRequestParser
{
    @Test
    public void testRequestLine()
    {
        KmsRequest request = RawRequestParser.parse("GET /example space/?Param1=value1 HTTP/1.1\nHost:example.amazonaws.com");

        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.path()).isEqualTo("/example space/");
        assertThat(request.query()).isEqualTo("Param1=value1");
        assertThat(request.headers().get("host")).contains("example.amazonaws.com");
        assertThat(request.payload().isEmpty()).isTrue();
    }

    @Test
    public void testContinuationLines()
    {
        KmsRequest request = RawRequestParser.parse("""
                GET / HTTP/1.1
                Host:example.amazonaws.com
                My-Header1:value1
                  value2
                     value3
                X-Amz-Date:20150830T123600Z""");

        assertThat(request.headers().get("My-Header1")).contains("value1\n  value2\n     value3");
        assertThat(request.headers().canonicalBlock()).contains("my-header1:value1,value2,value3\n");
        assertThat(request.headers().size()).isEqualTo(3);
    }

    @Test
    public void testLeadingBlanksAreStripped()
    {
        KmsRequest request = RawRequestParser.parse("GET / HTTP/1.1\nMy-Header1: \t value1 \nMy-Header2:a:b");

        assertThat(request.headers().get("My-Header1")).contains("value1 ");
        assertThat(request.headers().get("My-Header2")).contains("a:b");
    }

    @Test
    public void testBlanksBeforeColon()
    {
        KmsRequest request = RawRequestParser.parse("GET / HTTP/1.1\nHost :example.amazonaws.com\nMy-Header1 \t: value1")
                .setRegion("us-east-1")
                .setService("service")
                .setDate(Instant.parse("2015-08-30T12:36:00Z"));

        assertThat(request.headers().get("Host")).contains("example.amazonaws.com");
        assertThat(request.headers().get("My-Header1")).contains("value1");
        assertThat(request.canonicalRequest()).contains("host:example.amazonaws.com\nmy-header1:value1\n\nhost;my-header1\n");
    }

    @Test
    public void testPayload()
    {
        KmsRequest request = RawRequestParser.parse("POST / HTTP/1.1\nHost:example.amazonaws.com\n\nParam1=value1\n\nmore\n");

        assertThat(request.headers().size()).isEqualTo(1);
        assertThat(request.payload().contentEquals("Param1=value1\n\nmore\n".getBytes(UTF_8))).isTrue();
    }

    @Test
    public void testBinaryPayloadIsVerbatim()
    {
        byte[] head = "POST / HTTP/1.1\nHost:example.amazonaws.com\n\n".getBytes(UTF_8);
        byte[] body = {(byte) 0xFF, 0x00, '\n', (byte) 0x80};
        byte[] raw = new byte[head.length + body.length];
        System.arraycopy(head, 0, raw, 0, head.length);
        System.arraycopy(body, 0, raw, head.length, body.length);

        assertThat(RawRequestParser.parse(raw).payload().toByteArray()).isEqualTo(body);
    }

    @Test
    public void testCrLfLineEndings()
    {
        KmsRequest request = RawRequestParser.parse("GET / HTTP/1.1\r\nHost:example.amazonaws.com\r\n\r\nbody");

        assertThat(request.headers().get("Host")).contains("example.amazonaws.com");
        assertThat(request.payload().contentEquals("body".getBytes(UTF_8))).isTrue();
    }

    @Test
    public void testMalformed()
    {
        assertMalformed("");
        assertMalformed("GET");
        assertMalformed("GET /");
        assertMalformed(" / HTTP/1.1");
        assertMalformed("GET / HTTP/1.1\n  orphan continuation");
        assertMalformed("GET / HTTP/1.1\n:no-name");
    }

    private static void assertMalformed(String text)
    {
        assertThatThrownBy(() -> RawRequestParser.parse(text))
                .isInstanceOfSatisfying(SigningException.class, e -> assertThat(e.reason()).isEqualTo(MALFORMED_INPUT));
    }
}
