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

import com.google.common.base.CharMatcher;
import io.airlift.log.Logger;
import io.kms.message.KmsRequest;

import static io.kms.message.spi.SigningException.malformedInput;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Parses the plain text request format of the AWS SigV4 test suite ({@code .req} files):
 * a request line, header lines, an optional blank line and the body.
 * A header line that does not contain a colon continues the value of the header above it.
 */
public final class RawRequestParser
{
    private static final Logger log = Logger.get(RawRequestParser.class);

    private static final String HTTP_VERSION_MARKER = " HTTP/";
    private static final CharMatcher BLANKS = CharMatcher.anyOf(" \t");

    private enum State
    {
        NO_PENDING,
        ACCUMULATING,
    }

    private final KmsRequest request;
    private State state = State.NO_PENDING;
    private String pendingName;
    private StringBuilder pendingValue;

    private RawRequestParser(KmsRequest request)
    {
        this.request = request;
    }

    public static KmsRequest parse(String text)
    {
        requireNonNull(text, "text is null");
        return parse(text.getBytes(UTF_8));
    }

    /**
     * The returned request has headers, path, query and payload but no region, service, credentials or date
     */
    public static KmsRequest parse(byte[] text)
    {
        requireNonNull(text, "text is null");

        int lineEnd = indexOf(text, '\n', 0);
        String requestLine = line(text, 0, (lineEnd < 0) ? text.length : lineEnd);
        RawRequestParser parser = new RawRequestParser(parseRequestLine(requestLine));

        int position = (lineEnd < 0) ? text.length : lineEnd + 1;
        while (position < text.length) {
            lineEnd = indexOf(text, '\n', position);
            int end = (lineEnd < 0) ? text.length : lineEnd;
            String line = line(text, position, end);
            position = (lineEnd < 0) ? text.length : lineEnd + 1;

            if (line.isEmpty()) {
                parser.commitPending();
                parser.request.appendPayload(text, position, text.length - position);
                return parser.request;
            }
            parser.acceptHeaderLine(line);
        }
        parser.commitPending();
        return parser.request;
    }

    private void acceptHeaderLine(String line)
    {
        int colon = line.indexOf(':');
        if (colon >= 0) {
            commitPending();
            // "Host :example.com" names the Host header
            pendingName = BLANKS.trimTrailingFrom(line.substring(0, colon));
            pendingValue = new StringBuilder(BLANKS.trimLeadingFrom(line.substring(colon + 1)));
            state = State.ACCUMULATING;
            return;
        }

        switch (state) {
            case ACCUMULATING -> pendingValue.append('\n').append(line);
            case NO_PENDING -> {
                log.debug("Header continuation without a header: %s", line);
                throw malformedInput("Header continuation \"%s\" does not follow a header", line);
            }
        }
    }

    private void commitPending()
    {
        if (state == State.ACCUMULATING) {
            request.addHeader(pendingName, pendingValue.toString());
            pendingName = null;
            pendingValue = null;
            state = State.NO_PENDING;
        }
    }

    private static KmsRequest parseRequestLine(String requestLine)
    {
        int methodEnd = requestLine.indexOf(' ');
        int versionStart = requestLine.lastIndexOf(HTTP_VERSION_MARKER);
        if (methodEnd <= 0 || versionStart < methodEnd) {
            log.debug("Malformed request line: %s", requestLine);
            throw malformedInput("Malformed request line \"%s\"", requestLine);
        }
        String method = requestLine.substring(0, methodEnd);
        String pathAndQuery = (versionStart == methodEnd) ? "" : requestLine.substring(methodEnd + 1, versionStart);
        return KmsRequest.newRequest(method, pathAndQuery);
    }

    private static String line(byte[] text, int start, int end)
    {
        if (end > start && text[end - 1] == '\r') {
            end--;
        }
        return new String(text, start, end - start, UTF_8);
    }

    private static int indexOf(byte[] text, char c, int from)
    {
        for (int i = from; i < text.length; i++) {
            if (text[i] == c) {
                return i;
            }
        }
        return -1;
    }
}
