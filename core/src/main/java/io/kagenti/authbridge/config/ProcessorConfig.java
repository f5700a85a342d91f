/*
 * Copyright 2025 Google LLC
 *
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

package io.kagenti.authbridge.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Immutable processor configuration.
 *
 * <p>Static settings live here; the client credentials, which may appear on disk after startup,
 * are resolved by {@link ConfigStore} from the file paths and fallbacks held in this object.
 */
public final class ProcessorConfig {

  public static final String DEFAULT_CLIENT_ID_FILE = "/shared/client-id.txt";
  public static final String DEFAULT_CLIENT_SECRET_FILE = "/shared/client-secret.txt";
  public static final String DEFAULT_AGENT_NAME = "weather-assistant";
  public static final String DEFAULT_AGENT_VERSION = "1.0.0";
  public static final String DEFAULT_AGENT_PROVIDER = "langchain";
  public static final String DEFAULT_SERVICE_NAME = "weather-service";
  public static final String DEFAULT_OTLP_ENDPOINT =
      "http://otel-collector.kagenti-system.svc.cluster.local:8335";
  public static final ImmutableList<String> DEFAULT_TRACED_PATHS = ImmutableList.of("/");
  public static final int DEFAULT_MAX_ATTRIBUTE_LENGTH = 1000;
  public static final int DEFAULT_MAX_RESPONSE_BUFFER_BYTES = 4 * 1024 * 1024;
  public static final int DEFAULT_PORT = 9090;
  public static final Duration DEFAULT_CREDENTIALS_WAIT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_JWKS_CACHE_TTL = Duration.ofMinutes(5);
  public static final Duration DEFAULT_JWKS_MIN_REFRESH_INTERVAL = Duration.ofSeconds(30);

  private final String tokenUrl;
  private final String targetAudience;
  private final String targetScopes;
  private final String clientIdFile;
  private final String clientSecretFile;
  private final String clientId;
  private final String clientSecret;
  private final Optional<String> issuer;
  private final Optional<String> expectedAudience;
  private final Optional<String> jwksUrl;
  private final String agentName;
  private final String agentVersion;
  private final String agentProvider;
  private final String serviceName;
  private final boolean tracingEnabled;
  private final String otlpEndpoint;
  private final ImmutableList<String> tracedPaths;
  private final int maxAttributeLength;
  private final int maxResponseBufferBytes;
  private final int port;
  private final Duration credentialsWait;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final Duration jwksCacheTtl;
  private final Duration jwksMinRefreshInterval;
  private final TokenExchangeFailurePolicy tokenExchangeFailurePolicy;

  private ProcessorConfig(Builder builder) {
    this.tokenUrl = Strings.nullToEmpty(builder.tokenUrl);
    this.targetAudience = Strings.nullToEmpty(builder.targetAudience);
    this.targetScopes = Strings.nullToEmpty(builder.targetScopes);
    this.clientIdFile = Objects.requireNonNullElse(builder.clientIdFile, DEFAULT_CLIENT_ID_FILE);
    this.clientSecretFile =
        Objects.requireNonNullElse(builder.clientSecretFile, DEFAULT_CLIENT_SECRET_FILE);
    this.clientId = Strings.nullToEmpty(builder.clientId);
    this.clientSecret = Strings.nullToEmpty(builder.clientSecret);
    this.issuer = Optional.ofNullable(Strings.emptyToNull(builder.issuer));
    this.expectedAudience = Optional.ofNullable(Strings.emptyToNull(builder.expectedAudience));
    String explicitJwks = Strings.emptyToNull(builder.jwksUrl);
    this.jwksUrl =
        explicitJwks != null
            ? Optional.of(explicitJwks)
            : (this.tokenUrl.isEmpty() ? Optional.empty() : Optional.of(deriveJwksUrl(tokenUrl)));
    this.agentName = Objects.requireNonNullElse(builder.agentName, DEFAULT_AGENT_NAME);
    this.agentVersion = Objects.requireNonNullElse(builder.agentVersion, DEFAULT_AGENT_VERSION);
    this.agentProvider = Objects.requireNonNullElse(builder.agentProvider, DEFAULT_AGENT_PROVIDER);
    this.serviceName = Objects.requireNonNullElse(builder.serviceName, DEFAULT_SERVICE_NAME);
    this.tracingEnabled = builder.tracingEnabled;
    this.otlpEndpoint = Objects.requireNonNullElse(builder.otlpEndpoint, DEFAULT_OTLP_ENDPOINT);
    this.tracedPaths =
        builder.tracedPaths == null || builder.tracedPaths.isEmpty()
            ? DEFAULT_TRACED_PATHS
            : ImmutableList.copyOf(builder.tracedPaths);
    Preconditions.checkArgument(
        builder.maxAttributeLength > 0, "maxAttributeLength must be positive");
    Preconditions.checkArgument(
        builder.maxResponseBufferBytes > 0, "maxResponseBufferBytes must be positive");
    Preconditions.checkArgument(
        builder.port >= 0 && builder.port <= 65535, "port out of range: %s", builder.port);
    this.maxAttributeLength = builder.maxAttributeLength;
    this.maxResponseBufferBytes = builder.maxResponseBufferBytes;
    this.port = builder.port;
    this.credentialsWait =
        Objects.requireNonNullElse(builder.credentialsWait, DEFAULT_CREDENTIALS_WAIT);
    this.connectTimeout =
        Objects.requireNonNullElse(builder.connectTimeout, DEFAULT_CONNECT_TIMEOUT);
    this.readTimeout = Objects.requireNonNullElse(builder.readTimeout, DEFAULT_READ_TIMEOUT);
    this.jwksCacheTtl = Objects.requireNonNullElse(builder.jwksCacheTtl, DEFAULT_JWKS_CACHE_TTL);
    this.jwksMinRefreshInterval =
        Objects.requireNonNullElse(
            builder.jwksMinRefreshInterval, DEFAULT_JWKS_MIN_REFRESH_INTERVAL);
    this.tokenExchangeFailurePolicy =
        Objects.requireNonNullElse(
            builder.tokenExchangeFailurePolicy, TokenExchangeFailurePolicy.FORWARD_ORIGINAL);
  }

  /** Replaces a trailing {@code /token} with {@code /certs}, the Keycloak key-set location. */
  public static String deriveJwksUrl(String tokenUrl) {
    String base =
        tokenUrl.endsWith("/token")
            ? tokenUrl.substring(0, tokenUrl.length() - "/token".length())
            : tokenUrl;
    return base + "/certs";
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builds a configuration from the given property source, applying defaults for unset keys. */
  public static ProcessorConfig fromProperties(ProcessorProperties properties) {
    Builder builder =
        builder()
            .tokenUrl(properties.get("token.url", null))
            .targetAudience(properties.get("target.audience", null))
            .targetScopes(properties.get("target.scopes", null))
            .clientIdFile(properties.get("client.id.file", null))
            .clientSecretFile(properties.get("client.secret.file", null))
            .clientId(properties.get("client.id", null))
            .clientSecret(properties.get("client.secret", null))
            .issuer(properties.get("issuer", null))
            .expectedAudience(properties.get("expected.audience", null))
            .jwksUrl(properties.get("jwks.url", null))
            .agentName(properties.get("agent.name", null))
            .agentVersion(properties.get("agent.version", null))
            .agentProvider(properties.get("agent.provider", null))
            .serviceName(properties.get("otel.service.name", null))
            .tracingEnabled(properties.getBoolean("otel.tracing.enabled", true))
            .otlpEndpoint(properties.get("otel.exporter.otlp.endpoint", null))
            .maxAttributeLength(
                properties.getInt("max.attribute.length", DEFAULT_MAX_ATTRIBUTE_LENGTH))
            .maxResponseBufferBytes(
                properties.getInt("max.response.buffer.bytes", DEFAULT_MAX_RESPONSE_BUFFER_BYTES))
            .port(properties.getInt("ext.proc.port", DEFAULT_PORT))
            .credentialsWait(
                Duration.ofSeconds(
                    properties.getInt(
                        "credentials.wait.seconds", (int) DEFAULT_CREDENTIALS_WAIT.getSeconds())))
            .jwksCacheTtl(
                Duration.ofSeconds(
                    properties.getInt(
                        "jwks.cache.ttl.seconds", (int) DEFAULT_JWKS_CACHE_TTL.getSeconds())));
    properties
        .get("otel.traced.paths")
        .ifPresent(
            paths ->
                builder.tracedPaths(
                    Splitter.on(',').trimResults().omitEmptyStrings().splitToList(paths)));
    properties
        .get("token.exchange.failure.policy")
        .ifPresent(
            value ->
                builder.tokenExchangeFailurePolicy(TokenExchangeFailurePolicy.fromValue(value)));
    return builder.build();
  }

  public String tokenUrl() {
    return tokenUrl;
  }

  public String targetAudience() {
    return targetAudience;
  }

  public String targetScopes() {
    return targetScopes;
  }

  public String clientIdFile() {
    return clientIdFile;
  }

  public String clientSecretFile() {
    return clientSecretFile;
  }

  /** Client id used when the mounted file is absent or empty. */
  public String clientId() {
    return clientId;
  }

  /** Client secret used when the mounted file is absent or empty. */
  public String clientSecret() {
    return clientSecret;
  }

  public Optional<String> issuer() {
    return issuer;
  }

  public Optional<String> expectedAudience() {
    return expectedAudience;
  }

  /** The explicit key-set URL, or the one derived from the token URL. */
  public Optional<String> jwksUrl() {
    return jwksUrl;
  }

  /** Inbound validation runs only when an issuer and a key-set URL are both known. */
  public boolean inboundValidationEnabled() {
    return issuer.isPresent() && jwksUrl.isPresent();
  }

  public String agentName() {
    return agentName;
  }

  public String agentVersion() {
    return agentVersion;
  }

  public String agentProvider() {
    return agentProvider;
  }

  public String serviceName() {
    return serviceName;
  }

  public boolean tracingEnabled() {
    return tracingEnabled;
  }

  public String otlpEndpoint() {
    return otlpEndpoint;
  }

  public ImmutableList<String> tracedPaths() {
    return tracedPaths;
  }

  public int maxAttributeLength() {
    return maxAttributeLength;
  }

  public int maxResponseBufferBytes() {
    return maxResponseBufferBytes;
  }

  public int port() {
    return port;
  }

  public Duration credentialsWait() {
    return credentialsWait;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration readTimeout() {
    return readTimeout;
  }

  public Duration jwksCacheTtl() {
    return jwksCacheTtl;
  }

  public Duration jwksMinRefreshInterval() {
    return jwksMinRefreshInterval;
  }

  public TokenExchangeFailurePolicy tokenExchangeFailurePolicy() {
    return tokenExchangeFailurePolicy;
  }

  /** Builder for {@link ProcessorConfig}. */
  public static final class Builder {
    @Nullable private String tokenUrl;
    @Nullable private String targetAudience;
    @Nullable private String targetScopes;
    @Nullable private String clientIdFile;
    @Nullable private String clientSecretFile;
    @Nullable private String clientId;
    @Nullable private String clientSecret;
    @Nullable private String issuer;
    @Nullable private String expectedAudience;
    @Nullable private String jwksUrl;
    @Nullable private String agentName;
    @Nullable private String agentVersion;
    @Nullable private String agentProvider;
    @Nullable private String serviceName;
    private boolean tracingEnabled = true;
    @Nullable private String otlpEndpoint;
    @Nullable private List<String> tracedPaths;
    private int maxAttributeLength = DEFAULT_MAX_ATTRIBUTE_LENGTH;
    private int maxResponseBufferBytes = DEFAULT_MAX_RESPONSE_BUFFER_BYTES;
    private int port = DEFAULT_PORT;
    @Nullable private Duration credentialsWait;
    @Nullable private Duration connectTimeout;
    @Nullable private Duration readTimeout;
    @Nullable private Duration jwksCacheTtl;
    @Nullable private Duration jwksMinRefreshInterval;
    @Nullable private TokenExchangeFailurePolicy tokenExchangeFailurePolicy;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder tokenUrl(@Nullable String tokenUrl) {
      this.tokenUrl = tokenUrl;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder targetAudience(@Nullable String targetAudience) {
      this.targetAudience = targetAudience;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder targetScopes(@Nullable String targetScopes) {
      this.targetScopes = targetScopes;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clientIdFile(@Nullable String clientIdFile) {
      this.clientIdFile = clientIdFile;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clientSecretFile(@Nullable String clientSecretFile) {
      this.clientSecretFile = clientSecretFile;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clientId(@Nullable String clientId) {
      this.clientId = clientId;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clientSecret(@Nullable String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder issuer(@Nullable String issuer) {
      this.issuer = issuer;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder expectedAudience(@Nullable String expectedAudience) {
      this.expectedAudience = expectedAudience;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder jwksUrl(@Nullable String jwksUrl) {
      this.jwksUrl = jwksUrl;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder agentName(@Nullable String agentName) {
      this.agentName = agentName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder agentVersion(@Nullable String agentVersion) {
      this.agentVersion = agentVersion;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder agentProvider(@Nullable String agentProvider) {
      this.agentProvider = agentProvider;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder serviceName(@Nullable String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder tracingEnabled(boolean tracingEnabled) {
      this.tracingEnabled = tracingEnabled;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder otlpEndpoint(@Nullable String otlpEndpoint) {
      this.otlpEndpoint = otlpEndpoint;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder tracedPaths(@Nullable List<String> tracedPaths) {
      this.tracedPaths = tracedPaths;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxAttributeLength(int maxAttributeLength) {
      this.maxAttributeLength = maxAttributeLength;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxResponseBufferBytes(int maxResponseBufferBytes) {
      this.maxResponseBufferBytes = maxResponseBufferBytes;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder credentialsWait(@Nullable Duration credentialsWait) {
      this.credentialsWait = credentialsWait;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder connectTimeout(@Nullable Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder readTimeout(@Nullable Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder jwksCacheTtl(@Nullable Duration jwksCacheTtl) {
      this.jwksCacheTtl = jwksCacheTtl;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder jwksMinRefreshInterval(@Nullable Duration jwksMinRefreshInterval) {
      this.jwksMinRefreshInterval = jwksMinRefreshInterval;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder tokenExchangeFailurePolicy(
        @Nullable TokenExchangeFailurePolicy tokenExchangeFailurePolicy) {
      this.tokenExchangeFailurePolicy = tokenExchangeFailurePolicy;
      return this;
    }

    public ProcessorConfig build() {
      return new ProcessorConfig(this);
    }
  }
}
