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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.ConfigSecuritySensitive;
import io.kms.message.spi.credentials.Credential;
import io.kms.message.spi.signing.SigningServiceType;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

public class SigningConfig
{
    private String region = "us-east-1";
    private String service = SigningServiceType.KMS.serviceName();
    private String accessKeyId;
    private String secretKey;
    private Optional<String> endpoint = Optional.empty();

    @NotNull
    public String getRegion()
    {
        return region;
    }

    @Config("kms.region")
    @ConfigDescription("Region of the credential scope")
    public SigningConfig setRegion(String region)
    {
        this.region = region;
        return this;
    }

    @NotNull
    public String getService()
    {
        return service;
    }

    @Config("kms.service")
    @ConfigDescription("Service name of the credential scope")
    public SigningConfig setService(String service)
    {
        this.service = service;
        return this;
    }

    @NotNull
    public String getAccessKeyId()
    {
        return accessKeyId;
    }

    @Config("kms.access-key-id")
    @ConfigDescription("AWS access key id used to sign requests")
    public SigningConfig setAccessKeyId(String accessKeyId)
    {
        this.accessKeyId = accessKeyId;
        return this;
    }

    @NotNull
    public String getSecretKey()
    {
        return secretKey;
    }

    @Config("kms.secret-key")
    @ConfigDescription("AWS secret access key used to sign requests")
    @ConfigSecuritySensitive
    public SigningConfig setSecretKey(String secretKey)
    {
        this.secretKey = secretKey;
        return this;
    }

    @NotNull
    public Optional<String> getEndpoint()
    {
        return endpoint;
    }

    @Config("kms.endpoint")
    @ConfigDescription("KMS host name, defaults to the regional endpoint")
    public SigningConfig setEndpoint(String endpoint)
    {
        this.endpoint = Optional.ofNullable(endpoint);
        return this;
    }

    public Credential toCredential()
    {
        return new Credential(accessKeyId, secretKey);
    }
}
