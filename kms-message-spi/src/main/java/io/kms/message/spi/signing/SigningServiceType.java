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
package io.kms.message.spi.signing;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Service name used in the credential scope
 */
public record SigningServiceType(String serviceName)
{
    public static final SigningServiceType KMS = new SigningServiceType("kms");
    public static final SigningServiceType IAM = new SigningServiceType("iam");
    // the service name used throughout the AWS SigV4 test suite
    public static final SigningServiceType TEST_SUITE = new SigningServiceType("service");

    public SigningServiceType
    {
        requireNonNull(serviceName, "serviceName is null");
        checkArgument(!serviceName.isEmpty(), "serviceName is empty");
    }

    @Override
    public String toString()
    {
        return serviceName;
    }
}
