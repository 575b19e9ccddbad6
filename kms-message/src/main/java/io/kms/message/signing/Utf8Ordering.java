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

import com.google.common.primitives.UnsignedBytes;

import java.util.Comparator;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Byte-lexicographic ordering of strings as AWS sorts them: by their UTF-8 bytes, unsigned.
 * {@link String#compareTo} compares UTF-16 units and disagrees for characters above U+FFFF.
 */
final class Utf8Ordering
{
    private static final Comparator<byte[]> BYTES = UnsignedBytes.lexicographicalComparator();

    static final Comparator<String> UTF8_ORDER = (left, right) -> BYTES.compare(left.getBytes(UTF_8), right.getBytes(UTF_8));

    private Utf8Ordering() {}
}
