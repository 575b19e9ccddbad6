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

import com.google.common.collect.ImmutableList;
import com.google.inject.Injector;
import io.airlift.bootstrap.ApplicationConfigurationException;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.json.JsonModule;
import io.airlift.log.Logger;
import io.kms.message.parser.RawRequestParser;
import io.kms.message.spi.timestamps.AwsTimestamp;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import static io.kms.message.spi.SigningException.malformedInput;
import static io.kms.message.spi.SigningException.missingPrerequisite;

/**
 * Signs a raw HTTP request file with the configured credentials and prints the signed request.
 * The request date is taken from its {@code X-Amz-Date} header.
 */
public final class KmsMessageSigner
{
    private static final Logger log = Logger.get(KmsMessageSigner.class);

    private KmsMessageSigner() {}

    public static void main(String[] args)
    {
        if (args.length != 1) {
            log.error("Usage: kms-message-signer <request-file>");
            System.exit(1);
        }

        try {
            Bootstrap app = new Bootstrap(ImmutableList.of(new SigningModule(), new JsonModule()));
            Injector injector = app.initialize();

            byte[] rawRequest = Files.readAllBytes(Path.of(args[0]));
            writeSigned(injector.getInstance(KmsRequestFactory.class), rawRequest, System.out);
        }
        catch (ApplicationConfigurationException e) {
            log.error(e.getMessage());
            System.exit(1);
        }
        catch (IOException e) {
            log.error(e, "Cannot read request file %s", args[0]);
            System.exit(1);
        }
        catch (Throwable e) {
            log.error(e);
            System.exit(1);
        }
    }

    static void writeSigned(KmsRequestFactory requestFactory, byte[] rawRequest, PrintStream out)
            throws IOException
    {
        out.write(sign(requestFactory, rawRequest));
        out.println();
        out.flush();
    }

    static byte[] sign(KmsRequestFactory requestFactory, byte[] rawRequest)
    {
        KmsRequest request = requestFactory.withSigningParameters(RawRequestParser.parse(rawRequest));
        String amzDate = request.headers().get("X-Amz-Date").orElseThrow(() -> {
            log.debug("Request has no X-Amz-Date header");
            return missingPrerequisite("X-Amz-Date header is required");
        });
        request.setDate(parseDate(amzDate));
        log.info("Signing %s %s for %s", request.method(), request.path(), request.region().orElseThrow());
        return request.signedRequestBytes();
    }

    private static Instant parseDate(String amzDate)
    {
        try {
            return AwsTimestamp.fromRequestTimestamp(amzDate.trim());
        }
        catch (DateTimeParseException e) {
            log.debug(e, "Invalid X-Amz-Date: %s", amzDate);
            throw malformedInput("Invalid X-Amz-Date \"%s\"", amzDate);
        }
    }
}
