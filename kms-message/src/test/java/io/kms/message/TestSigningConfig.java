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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static org.assertj.core.api.Assertions.assertThat;

public class TestSigningConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(SigningConfig.class)
                .setRegion("us-east-1")
                .setService("kms")
                .setAccessKeyId(null)
                .setSecretKey(null)
                .setEndpoint(null));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = ImmutableMap.<String, String>builder()
                .put("kms.region", "eu-west-1")
                .put("kms.service", "service")
                .put("kms.access-key-id", "AKIDEXAMPLE")
                .put("kms.secret-key", "wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY")
                .put("kms.endpoint", "localhost:8000")
                .buildOrThrow();

        SigningConfig expected = new SigningConfig()
                .setRegion("eu-west-1")
                .setService("service")
                .setAccessKeyId("AKIDEXAMPLE")
                .setSecretKey("wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY")
                .setEndpoint("localhost:8000");
        assertFullMapping(properties, expected);
    }

    @Test
    public void testCredential()
    {
        SigningConfig config = new SigningConfig()
                .setAccessKeyId("AKIDEXAMPLE")
                .setSecretKey("wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY");

        assertThat(config.toCredential().accessKey()).isEqualTo("AKIDEXAMPLE");
        assertThat(config.toCredential().toString()).doesNotContain("wJalrXUtnFEMI");
    }
}
