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

import io.kms.message.spi.timestamps.AwsTimestamp;

import java.time.LocalDate;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The {@code date/region/service/aws4_request} string that binds a derived signing key to
 * one day, one region and one service.
 */
public record CredentialScope(LocalDate date, String region, String service)
{
    public static final String TERMINATOR = "aws4_request";

    public CredentialScope
    {
        requireNonNull(date, "date is null");
        requireNonNull(region, "region is null");
        requireNonNull(service, "service is null");
        checkArgument(!region.isEmpty(), "region is empty");
        checkArgument(!service.isEmpty(), "service is empty");
    }

    public String dateStamp()
    {
        return AwsTimestamp.toDateStamp(date);
    }

    public String keyPath()
    {
        return String.join("/", dateStamp(), region, service, TERMINATOR);
    }

    @Override
    public String toString()
    {
        return keyPath();
    }
}
