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

import io.airlift.log.Logger;
import io.kms.message.signing.CanonicalUri;
import io.kms.message.signing.HeaderTable;
import io.kms.message.signing.RequestPayload;
import io.kms.message.signing.Signer;
import io.kms.message.spi.collections.MultiMap;
import io.kms.message.spi.credentials.Credential;
import io.kms.message.spi.signing.CredentialScope;
import io.kms.message.spi.signing.RequestAuthorization;
import io.kms.message.spi.timestamps.AwsTimestamp;

import java.time.Instant;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.kms.message.spi.SigningException.malformedInput;
import static io.kms.message.spi.SigningException.missingPrerequisite;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP request to be signed with SigV4. Build it with the setters, then ask for any stage of the
 * signing pipeline; every stage is computed from the current state of the request.
 * Instances are not thread safe.
 */
public final class KmsRequest
{
    private static final Logger log = Logger.get(KmsRequest.class);

    private final String method;
    private final String path;
    private final String query;
    private final HeaderTable headers = new HeaderTable();
    private final RequestPayload payload = new RequestPayload();

    private Optional<String> region = Optional.empty();
    private Optional<String> service = Optional.empty();
    private Optional<String> accessKeyId = Optional.empty();
    private Optional<String> secretKey = Optional.empty();
    private Optional<Instant> date = Optional.empty();

    private KmsRequest(String method, String path, String query)
    {
        this.method = method;
        this.path = path;
        this.query = query;
    }

    /**
     * @param pathAndQuery the request target, like {@code /path?a=b}; everything after the first {@code ?} is the raw query
     */
    public static KmsRequest newRequest(String method, String pathAndQuery)
    {
        requireNonNull(method, "method is null");
        requireNonNull(pathAndQuery, "pathAndQuery is null");

        if (method.isEmpty() || method.chars().anyMatch(c -> c <= ' ' || c == 0x7F)) {
            log.debug("Rejected request method: %s", method);
            throw malformedInput("Invalid request method \"%s\"", method);
        }
        if (pathAndQuery.indexOf('\r') >= 0 || pathAndQuery.indexOf('\n') >= 0) {
            log.debug("Rejected request path containing a line break");
            throw malformedInput("Request path contains a line break");
        }

        int queryStart = pathAndQuery.indexOf('?');
        if (queryStart < 0) {
            return new KmsRequest(method, pathAndQuery, "");
        }
        return new KmsRequest(method, pathAndQuery.substring(0, queryStart), pathAndQuery.substring(queryStart + 1));
    }

    public KmsRequest setRegion(String region)
    {
        this.region = Optional.of(requireNotEmpty(region, "region"));
        return this;
    }

    public KmsRequest setService(String service)
    {
        this.service = Optional.of(requireNotEmpty(service, "service"));
        return this;
    }

    public KmsRequest setAccessKeyId(String accessKeyId)
    {
        this.accessKeyId = Optional.of(requireNonNull(accessKeyId, "accessKeyId is null"));
        return this;
    }

    public KmsRequest setSecretKey(String secretKey)
    {
        this.secretKey = Optional.of(requireNonNull(secretKey, "secretKey is null"));
        return this;
    }

    public KmsRequest setCredential(Credential credential)
    {
        requireNonNull(credential, "credential is null");
        return setAccessKeyId(credential.accessKey()).setSecretKey(credential.secretKey());
    }

    /**
     * The signing date. No {@code X-Amz-Date} header is added; callers that want one add it themselves.
     */
    public KmsRequest setDate(Instant date)
    {
        this.date = Optional.of(requireNonNull(date, "date is null"));
        return this;
    }

    public KmsRequest addHeader(String name, String value)
    {
        headers.add(name, value);
        return this;
    }

    /**
     * Append text to the value of a header that was already added
     */
    public KmsRequest appendHeaderValue(String name, String value)
    {
        headers.appendToLast(name, value);
        return this;
    }

    public KmsRequest appendPayload(byte[] bytes)
    {
        payload.append(bytes);
        return this;
    }

    public KmsRequest appendPayload(byte[] bytes, int offset, int count)
    {
        payload.append(bytes, offset, count);
        return this;
    }

    public KmsRequest appendPayload(String text)
    {
        payload.append(text);
        return this;
    }

    public String method()
    {
        return method;
    }

    public String path()
    {
        return path;
    }

    public String query()
    {
        return query;
    }

    public MultiMap queryParameters()
    {
        return CanonicalUri.parseQuery(query);
    }

    public HeaderTable headers()
    {
        return headers;
    }

    public RequestPayload payload()
    {
        return payload;
    }

    public Optional<String> region()
    {
        return region;
    }

    public Optional<String> service()
    {
        return service;
    }

    public Optional<String> accessKeyId()
    {
        return accessKeyId;
    }

    public Optional<Instant> date()
    {
        return date;
    }

    public String canonicalRequest()
    {
        if (!headers.contains("host")) {
            log.debug("Cannot canonicalize %s %s without a Host header", method, path);
            throw missingPrerequisite("Host header is required");
        }

        StringBuilder canonical = new StringBuilder();
        canonical.append(method).append('\n')
                .append(CanonicalUri.canonicalPath(path)).append('\n')
                .append(CanonicalUri.canonicalizeQuery(query)).append('\n')
                .append(headers.canonicalBlock()).append('\n')
                .append(headers.signedHeadersList()).append('\n')
                .append(payload.sha256Hex());
        return canonical.toString();
    }

    public String stringToSign()
    {
        CredentialScope scope = credentialScope();
        return Signer.stringToSign(requiredDate(), scope, canonicalRequest());
    }

    /**
     * The derived key, a fresh copy on every call
     */
    public byte[] signingKey()
    {
        CredentialScope scope = credentialScope();
        String secret = secretKey.orElseThrow(() -> {
            log.debug("Cannot derive a signing key for %s %s without a secret key", method, path);
            return missingPrerequisite("Secret key is required");
        });
        return Signer.signingKey(secret, scope);
    }

    public String signature()
    {
        // checked before any key material is derived
        String stringToSign = stringToSign();
        return Signer.signature(signingKey(), stringToSign);
    }

    public RequestAuthorization authorization()
    {
        String accessKey = accessKeyId.orElseThrow(() -> {
            log.debug("Cannot authorize %s %s without an access key id", method, path);
            return missingPrerequisite("Access key id is required");
        });
        String signature = signature();
        return new RequestAuthorization(accessKey, credentialScope(), headers.lowercaseSignedHeaders(), signature);
    }

    public String authorizationHeader()
    {
        return authorization().authorization();
    }

    public byte[] signedRequestBytes()
    {
        return Signer.signedRequest(method, path, query, headers, authorization(), payload);
    }

    public String signedRequest()
    {
        return new String(signedRequestBytes(), UTF_8);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("method", method)
                .add("path", path)
                .add("query", query)
                .add("headers", headers)
                .add("payload", payload)
                .add("region", region.orElse(null))
                .add("service", service.orElse(null))
                .add("accessKeyId", accessKeyId.orElse(null))
                .add("date", date.map(AwsTimestamp::toRequestFormat).orElse(null))
                .omitNullValues()
                .toString();
    }

    private CredentialScope credentialScope()
    {
        Instant requestDate = requiredDate();
        String scopeRegion = region.orElseThrow(() -> {
            log.debug("Cannot sign %s %s without a region", method, path);
            return missingPrerequisite("Region is required");
        });
        String scopeService = service.orElseThrow(() -> {
            log.debug("Cannot sign %s %s without a service", method, path);
            return missingPrerequisite("Service is required");
        });
        return new CredentialScope(AwsTimestamp.toDate(requestDate), scopeRegion, scopeService);
    }

    private Instant requiredDate()
    {
        return date.orElseThrow(() -> {
            log.debug("Cannot sign %s %s without a date", method, path);
            return missingPrerequisite("Request date is required");
        });
    }

    private static String requireNotEmpty(String value, String name)
    {
        requireNonNull(value, name + " is null");
        if (value.isEmpty()) {
            log.debug("Rejected empty %s", name);
            throw malformedInput("%s is empty", name);
        }
        return value;
    }
}
