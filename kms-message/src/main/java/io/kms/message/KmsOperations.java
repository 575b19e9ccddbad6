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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

/**
 * JSON bodies of the KMS operations. Binary fields are serialized as base64.
 */
public final class KmsOperations
{
    public static final String CONTENT_TYPE = "application/x-amz-json-1.1";
    public static final String TARGET_PREFIX = "TrentService.";

    private KmsOperations() {}

    public record EncryptRequest(@JsonProperty("KeyId") String keyId, @JsonProperty("Plaintext") byte[] plaintext)
    {
        public static final String TARGET = TARGET_PREFIX + "Encrypt";

        @JsonCreator
        public EncryptRequest
        {
            requireNonNull(keyId, "keyId is null");
            requireNonNull(plaintext, "plaintext is null");
            plaintext = plaintext.clone();
        }
    }

    public record DecryptRequest(@JsonProperty("CiphertextBlob") byte[] ciphertextBlob)
    {
        public static final String TARGET = TARGET_PREFIX + "Decrypt";

        @JsonCreator
        public DecryptRequest
        {
            requireNonNull(ciphertextBlob, "ciphertextBlob is null");
            ciphertextBlob = ciphertextBlob.clone();
        }
    }
}
