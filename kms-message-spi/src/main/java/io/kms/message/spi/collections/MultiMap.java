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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Read-only view of request fields that may repeat, such as query parameters
 * ({@code a=1&a=2}) or header names. Keys keep the order in which they were first seen.
 * A case-insensitive map lowercases its keys.
 */
public interface MultiMap
{
    boolean isCaseSensitiveKeys();

    /**
     * Keys in first-seen order
     */
    Set<String> keySet();

    Set<Map.Entry<String, List<String>>> entrySet();

    /**
     * All values for the key, in insertion order. Empty if the key is absent.
     *
     * @throws NullPointerException if key is null
     */
    List<String> get(String key);

    /**
     * @throws NullPointerException if key is null
     */
    Optional<String> getFirst(String key);

    /**
     * Called once per key/value pair, so a repeated key is seen more than once
     */
    void forEachEntry(BiConsumer<String, String> consumer);

    /**
     * Called once per key with every value of that key
     */
    void forEach(BiConsumer<String, List<String>> consumer);

    boolean containsKey(String key);

    /**
     * Number of key/value pairs
     */
    int size();

    default boolean isEmpty()
    {
        return size() == 0;
    }
}
