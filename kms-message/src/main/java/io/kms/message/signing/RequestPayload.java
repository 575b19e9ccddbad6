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

import com.google.common.hash.Hashing;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkPositionIndexes;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Growable request body. Bytes are only ever appended; the hash is computed from
 * whatever has been appended at the time of the call.
 */
public final class RequestPayload
{
    private static final int INITIAL_CAPACITY = 64;

    private byte[] buffer = new byte[0];
    private int length;

    public RequestPayload append(byte[] bytes)
    {
        requireNonNull(bytes, "bytes is null");
        return append(bytes, 0, bytes.length);
    }

    public RequestPayload append(byte[] bytes, int offset, int count)
    {
        requireNonNull(bytes, "bytes is null");
        checkPositionIndexes(offset, offset + count, bytes.length);
        ensureCapacity(length + count);
        System.arraycopy(bytes, offset, buffer, length, count);
        length += count;
        return this;
    }

    public RequestPayload append(String text)
    {
        requireNonNull(text, "text is null");
        return append(text.getBytes(UTF_8));
    }

    public int size()
    {
        return length;
    }

    public boolean isEmpty()
    {
        return length == 0;
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOf(buffer, length);
    }

    public boolean contentEquals(byte[] other)
    {
        requireNonNull(other, "other is null");
        return Arrays.equals(buffer, 0, length, other, 0, other.length);
    }

    public void writeTo(OutputStream out)
            throws IOException
    {
        out.write(buffer, 0, length);
    }

    /**
     * Lower-case hex SHA-256 of the contents. An empty payload hashes like any other
     * byte string, to {@code e3b0c442...7852b855}.
     */
    public String sha256Hex()
    {
        return Hashing.sha256().hashBytes(buffer, 0, length).toString();
    }

    @Override
    public String toString()
    {
        return "RequestPayload{size=%s}".formatted(length);
    }

    private void ensureCapacity(int required)
    {
        if (required < 0) {
            throw new IllegalStateException("Payload exceeds maximum size");
        }
        if (required <= buffer.length) {
            return;
        }
        int newCapacity = Math.max(INITIAL_CAPACITY, buffer.length);
        while (newCapacity < required) {
            newCapacity = (newCapacity > Integer.MAX_VALUE / 2) ? required : newCapacity * 2;
        }
        buffer = Arrays.copyOf(buffer, newCapacity);
    }
}
