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
package io.kms.message.spi.collections;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

public final class ImmutableMultiMap
        implements MultiMap
{
    private final boolean caseSensitiveKeys;
    private final ImmutableListMultimap<String, String> data;

    private ImmutableMultiMap(ImmutableListMultimap<String, String> data, boolean caseSensitiveKeys)
    {
        this.data = requireNonNull(data, "data is null");
        this.caseSensitiveKeys = caseSensitiveKeys;
    }

    public static Builder builder(boolean caseSensitiveKeys)
    {
        return new Builder(caseSensitiveKeys);
    }

    @Override
    public boolean isCaseSensitiveKeys()
    {
        return caseSensitiveKeys;
    }

    @Override
    public Set<String> keySet()
    {
        return ImmutableSet.copyOf(data.keySet());
    }

    @Override
    public Set<Map.Entry<String, List<String>>> entrySet()
    {
        return Multimaps.asMap(data).entrySet();
    }

    @Override
    public List<String> get(String key)
    {
        return data.get(actualKey(key, caseSensitiveKeys));
    }

    @Override
    public Optional<String> getFirst(String key)
    {
        List<String> values = get(key);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public void forEachEntry(BiConsumer<String, String> consumer)
    {
        data.forEach(consumer);
    }

    @Override
    public void forEach(BiConsumer<String, List<String>> consumer)
    {
        Multimaps.asMap(data).forEach(consumer);
    }

    @Override
    public boolean containsKey(String key)
    {
        return data.containsKey(actualKey(key, caseSensitiveKeys));
    }

    @Override
    public int size()
    {
        return data.size();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImmutableMultiMap that)) {
            return false;
        }
        return caseSensitiveKeys == that.caseSensitiveKeys && data.equals(that.data);
    }

    @Override
    public int hashCode()
    {
        return data.hashCode();
    }

    @Override
    public String toString()
    {
        return data.toString();
    }

    private static String actualKey(String key, boolean caseSensitiveKeys)
    {
        requireNonNull(key, "key is null");
        return caseSensitiveKeys ? key : key.toLowerCase(Locale.ROOT);
    }

    public static final class Builder
    {
        private final ListMultimap<String, String> data = LinkedListMultimap.create();
        private final boolean caseSensitiveKeys;

        private Builder(boolean caseSensitiveKeys)
        {
            this.caseSensitiveKeys = caseSensitiveKeys;
        }

        /**
         * @throws NullPointerException if key or value is null
         */
        public Builder add(String key, String value)
        {
            data.put(actualKey(key, caseSensitiveKeys), requireNonNull(value, "value is null"));
            return this;
        }

        public ImmutableMultiMap build()
        {
            return new ImmutableMultiMap(ImmutableListMultimap.copyOf(data), caseSensitiveKeys);
        }
    }
}
