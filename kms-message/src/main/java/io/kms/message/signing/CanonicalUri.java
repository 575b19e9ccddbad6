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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;
import io.kms.message.spi.collections.ImmutableMultiMap;
import io.kms.message.spi.collections.MultiMap;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.kms.message.signing.Utf8Ordering.UTF8_ORDER;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Path and query canonicalization for SigV4.
 *
 * @see <a href="https://docs.aws.amazon.com/IAM/latest/UserGuide/create-signed-request.html">Create a signed AWS API request</a>
 */
public final class CanonicalUri
{
    private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();
    private static final Splitter QUERY_SPLITTER = Splitter.on('&').omitEmptyStrings();
    private static final BaseEncoding HEX = BaseEncoding.base16();
    private static final BaseEncoding HEX_ANY_CASE = HEX.ignoreCase();
    private static final CharMatcher HEX_DIGIT = CharMatcher.anyOf("0123456789abcdefABCDEF");

    private static final Comparator<Map.Entry<String, String>> PARAMETER_ORDER = Comparator
            .comparing((Map.Entry<String, String> entry) -> entry.getKey(), UTF8_ORDER)
            .thenComparing(Map.Entry::getValue, UTF8_ORDER);

    private CanonicalUri() {}

    /**
     * Remove dot segments and repeated separators. Relative paths stay relative and a trailing
     * separator is kept, but a path that normalizes to nothing becomes {@code /}.
     * {@code ..} never climbs above the first segment.
     */
    public static String normalizePath(String path)
    {
        requireNonNull(path, "path is null");

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : PATH_SPLITTER.split(path)) {
            switch (segment) {
                case "." -> {}
                case ".." -> segments.pollLast();
                default -> segments.addLast(segment);
            }
        }
        if (segments.isEmpty()) {
            return "/";
        }

        StringBuilder normalized = new StringBuilder(path.length());
        if (path.startsWith("/")) {
            normalized.append('/');
        }
        normalized.append(String.join("/", segments));
        if (path.endsWith("/")) {
            normalized.append('/');
        }
        return normalized.toString();
    }

    /**
     * The normalized path with every byte outside the RFC 3986 unreserved set percent-encoded, except {@code /}
     */
    public static String canonicalPath(String path)
    {
        return percentEncode(normalizePath(path).getBytes(UTF_8), true);
    }

    /**
     * Decode each parameter, re-encode it strictly and sort by encoded key then encoded value.
     * The result does not depend on how the caller originally encoded the query.
     */
    public static String canonicalizeQuery(String rawQuery)
    {
        requireNonNull(rawQuery, "rawQuery is null");

        List<Map.Entry<String, String>> parameters = QUERY_SPLITTER.splitToStream(rawQuery)
                .map(CanonicalUri::splitParameter)
                .map(parameter -> Map.entry(
                        percentEncode(percentDecode(parameter.getKey()), false),
                        percentEncode(percentDecode(parameter.getValue()), false)))
                .sorted(PARAMETER_ORDER)
                .collect(toImmutableList());

        StringBuilder canonical = new StringBuilder(rawQuery.length());
        for (Map.Entry<String, String> parameter : parameters) {
            if (canonical.length() > 0) {
                canonical.append('&');
            }
            canonical.append(parameter.getKey()).append('=').append(parameter.getValue());
        }
        return canonical.toString();
    }

    /**
     * Decoded query parameters in the order they appear
     */
    public static MultiMap parseQuery(String rawQuery)
    {
        requireNonNull(rawQuery, "rawQuery is null");

        ImmutableMultiMap.Builder builder = ImmutableMultiMap.builder(true);
        QUERY_SPLITTER.splitToStream(rawQuery)
                .map(CanonicalUri::splitParameter)
                .forEach(parameter -> builder.add(
                        new String(percentDecode(parameter.getKey()), UTF_8),
                        new String(percentDecode(parameter.getValue()), UTF_8)));
        return builder.build();
    }

    public static String percentEncode(byte[] bytes, boolean keepSlash)
    {
        requireNonNull(bytes, "bytes is null");

        StringBuilder encoded = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int c = bytes[i] & 0xFF;
            if (isUnreserved(c) || (keepSlash && c == '/')) {
                encoded.append((char) c);
            }
            else {
                encoded.append('%').append(HEX.encode(bytes, i, 1));
            }
        }
        return encoded.toString();
    }

    /**
     * Decode {@code %XX} escapes. A {@code %} that does not start a valid escape is kept as is.
     * {@code +} is not treated as a space.
     */
    public static byte[] percentDecode(String value)
    {
        requireNonNull(value, "value is null");

        byte[] bytes = value.getBytes(UTF_8);
        ByteArrayOutputStream decoded = new ByteArrayOutputStream(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            if (bytes[i] == '%' && i + 2 < bytes.length && HEX_DIGIT.matches((char) bytes[i + 1]) && HEX_DIGIT.matches((char) bytes[i + 2])) {
                decoded.write(HEX_ANY_CASE.decode(new String(bytes, i + 1, 2, US_ASCII))[0]);
                i += 3;
            }
            else {
                decoded.write(bytes[i]);
                i++;
            }
        }
        return decoded.toByteArray();
    }

    private static Map.Entry<String, String> splitParameter(String parameter)
    {
        int separator = parameter.indexOf('=');
        if (separator < 0) {
            return Map.entry(parameter, "");
        }
        return Map.entry(parameter.substring(0, separator), parameter.substring(separator + 1));
    }

    private static boolean isUnreserved(int c)
    {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~';
    }
}
