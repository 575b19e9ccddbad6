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
import io.airlift.log.Logger;
import io.kms.message.spi.collections.ImmutableMultiMap;
import io.kms.message.spi.collections.MultiMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.kms.message.signing.Utf8Ordering.UTF8_ORDER;
import static io.kms.message.spi.SigningException.malformedInput;
import static java.util.Objects.requireNonNull;

/**
 * Request headers in insertion order. Names are matched case-insensitively and a repeated name
 * is merged into the existing entry as {@code first,second}, the way HTTP folds multi-valued fields.
 * Canonical output sorts by lower-cased name.
 */
public final class HeaderTable
{
    private static final Logger log = Logger.get(HeaderTable.class);

    private static final Comparator<HeaderField> CANONICAL_ORDER = Comparator.comparing(HeaderField::lowercaseName, UTF8_ORDER);

    private final Map<String, HeaderField> fields = new LinkedHashMap<>();

    /**
     * Add a header, or extend the value of an existing header with the same name
     *
     * @throws io.kms.message.spi.SigningException if the name is empty or contains a colon or line break
     */
    public HeaderTable add(String name, String value)
    {
        requireNonNull(name, "name is null");
        requireNonNull(value, "value is null");
        validateName(name);

        HeaderField existing = fields.get(lowercase(name));
        if (existing != null) {
            existing.value.append(',').append(value);
        }
        else {
            HeaderField field = new HeaderField(name, value);
            fields.put(field.lowercaseName(), field);
        }
        return this;
    }

    /**
     * Append raw text, line breaks included, to the value of an existing header. Used for
     * folded header values that continue on the following lines.
     *
     * @throws io.kms.message.spi.SigningException if no header has this name
     */
    public HeaderTable appendToLast(String name, String text)
    {
        requireNonNull(name, "name is null");
        requireNonNull(text, "text is null");

        HeaderField field = fields.get(lowercase(name));
        if (field == null) {
            log.debug("Continuation for a header that was never added: %s", name);
            throw malformedInput("No header \"%s\" to continue", name);
        }
        field.value.append(text);
        return this;
    }

    public boolean contains(String name)
    {
        return fields.containsKey(lowercase(requireNonNull(name, "name is null")));
    }

    public Optional<String> get(String name)
    {
        return Optional.ofNullable(fields.get(lowercase(requireNonNull(name, "name is null"))))
                .map(field -> field.value.toString());
    }

    public int size()
    {
        return fields.size();
    }

    public boolean isEmpty()
    {
        return fields.isEmpty();
    }

    /**
     * Headers in insertion order with their names as supplied
     */
    public void forEach(BiConsumer<String, String> consumer)
    {
        fields.values().forEach(field -> consumer.accept(field.name(), field.value.toString()));
    }

    public MultiMap asMultiMap()
    {
        ImmutableMultiMap.Builder builder = ImmutableMultiMap.builder(false);
        forEach(builder::add);
        return builder.build();
    }

    /**
     * One {@code name:value} line per header, each ending with a newline
     */
    public String canonicalBlock()
    {
        StringBuilder block = new StringBuilder();
        for (HeaderField field : sortedFields()) {
            block.append(field.lowercaseName())
                    .append(':')
                    .append(canonicalValue(field.value))
                    .append('\n');
        }
        return block.toString();
    }

    public String signedHeadersList()
    {
        return String.join(";", lowercaseSignedHeaders());
    }

    public List<String> lowercaseSignedHeaders()
    {
        return sortedFields().stream()
                .map(HeaderField::lowercaseName)
                .collect(toImmutableList());
    }

    @Override
    public String toString()
    {
        // values may carry credentials of other schemes, only names are printed
        return "HeaderTable" + fields.values().stream().map(HeaderField::name).collect(toImmutableList());
    }

    /**
     * Trim the value and collapse each run of blanks to a single space. A line break inside a
     * folded value, together with the blanks around it, becomes a comma.
     */
    static String canonicalValue(CharSequence value)
    {
        StringBuilder canonical = new StringBuilder(value.length());
        int position = 0;
        while (position < value.length() && isBlankOrNewline(value.charAt(position))) {
            position++;
        }

        boolean pendingSpace = false;
        boolean pendingComma = false;
        for (; position < value.length(); position++) {
            char c = value.charAt(position);
            if (c == '\n') {
                pendingComma = true;
                pendingSpace = false;
            }
            else if (isBlank(c)) {
                pendingSpace = true;
            }
            else {
                if (pendingComma) {
                    canonical.append(',');
                }
                else if (pendingSpace) {
                    canonical.append(' ');
                }
                pendingComma = false;
                pendingSpace = false;
                canonical.append(c);
            }
        }
        return canonical.toString();
    }

    private List<HeaderField> sortedFields()
    {
        List<HeaderField> sorted = new ArrayList<>(fields.values());
        sorted.sort(CANONICAL_ORDER);
        return ImmutableList.copyOf(sorted);
    }

    private static void validateName(String name)
    {
        if (name.isEmpty()) {
            log.debug("Rejected empty header name");
            throw malformedInput("Header name is empty");
        }
        if (name.chars().anyMatch(c -> c == ':' || isBlankOrNewline((char) c))) {
            log.debug("Rejected header name: %s", name);
            throw malformedInput("Invalid header name \"%s\"", name);
        }
    }

    private static boolean isBlank(char c)
    {
        return c == ' ' || c == '\t' || c == '\r' || c == '\u000B' || c == '\f';
    }

    private static boolean isBlankOrNewline(char c)
    {
        return c == '\n' || isBlank(c);
    }

    private static String lowercase(String name)
    {
        return name.toLowerCase(Locale.ROOT);
    }

    private static final class HeaderField
    {
        private final String name;
        private final String lowercaseName;
        private final StringBuilder value;

        private HeaderField(String name, String value)
        {
            this.name = name;
            this.lowercaseName = lowercase(name);
            this.value = new StringBuilder(value);
        }

        String name()
        {
            return name;
        }

        String lowercaseName()
        {
            return lowercaseName;
        }
    }
}
