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

package io.kagenti.authbridge.extproc;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.kagenti.authbridge.auth.JwksCache;
import io.kagenti.authbridge.auth.JwksValidator;
import io.kagenti.authbridge.auth.TokenExchanger;
import io.kagenti.authbridge.config.ConfigStore;
import io.kagenti.authbridge.config.ProcessorConfig;
import io.kagenti.authbridge.telemetry.SpanManager;
import io.kagenti.authbridge.telemetry.TracingBootstrap;
import javax.annotation.Nullable;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A builder wiring the processor components into a standalone ext_proc gRPC server. */
public class AuthBridgeServerBuilder {

  private static final Logger logger = LoggerFactory.getLogger(AuthBridgeServerBuilder.class);

  private final ProcessorConfig config;
  private int port;
  @Nullable private ConfigStore configStore;
  @Nullable private OkHttpClient httpClient;
  @Nullable private TracingBootstrap tracing;

  /**
   * Constructs a new builder.
   *
   * @param config the processor configuration; its port is used unless {@link #port} is called
   */
  public AuthBridgeServerBuilder(ProcessorConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null");
    }
    this.config = config;
    this.port = config.port();
  }

  /**
   * Sets the port on which the server should listen.
   *
   * @param port the port number
   * @return this builder instance for chaining
   */
  @CanIgnoreReturnValue
  public AuthBridgeServerBuilder port(int port) {
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("Port must be between 1 and 65535");
    }
    this.port = port;
    return this;
  }

  /** Uses an existing credential store, for example one that already waited for its files. */
  @CanIgnoreReturnValue
  public AuthBridgeServerBuilder configStore(ConfigStore configStore) {
    this.configStore = configStore;
    return this;
  }

  /**
   * Sets the {@link OkHttpClient} used for JWKS and token endpoint calls. If not set, a client with
   * the configured timeouts is created.
   */
  @CanIgnoreReturnValue
  public AuthBridgeServerBuilder httpClient(OkHttpClient httpClient) {
    this.httpClient = httpClient;
    return this;
  }

  /** Uses an already started tracing SDK instead of starting one from the configuration. */
  @CanIgnoreReturnValue
  public AuthBridgeServerBuilder tracing(TracingBootstrap tracing) {
    this.tracing = tracing;
    return this;
  }

  /** Builds the processor service with the settings from this builder. */
  StreamProcessor buildProcessor(TracingBootstrap tracing) {
    OkHttpClient client =
        httpClient != null
            ? httpClient
            : new OkHttpClient.Builder()
                .connectTimeout(config.connectTimeout())
                .readTimeout(config.readTimeout())
                .build();
    ConfigStore store = configStore != null ? configStore : new ConfigStore(config);

    InboundAuthenticator authenticator;
    if (config.inboundValidationEnabled()) {
      String jwksUrl = config.jwksUrl().get();
      JwksCache cache =
          new JwksCache(client, config.jwksCacheTtl(), config.jwksMinRefreshInterval());
      authenticator =
          InboundAuthenticator.enabled(
              new JwksValidator(cache, jwksUrl),
              config.issuer().get(),
              config.expectedAudience().orElse(null));
      logger.info(
          "Inbound JWT validation enabled: issuer={} jwks={}", config.issuer().get(), jwksUrl);
    } else {
      authenticator = InboundAuthenticator.disabled();
      logger.info("Inbound JWT validation disabled: issuer or JWKS URL not configured");
    }

    OutboundTokenExchange outbound =
        new OutboundTokenExchange(
            store, new TokenExchanger(store, client), config.tokenExchangeFailurePolicy());
    logger.info("Token exchange failure policy: {}", config.tokenExchangeFailurePolicy());

    SpanManager spans = SpanManager.create(config, tracing.openTelemetry());
    return new StreamProcessor(authenticator, outbound, spans);
  }

  /**
   * Builds the {@link AuthBridgeServer} instance. Tracing started here is shut down when the server
   * stops.
   */
  public AuthBridgeServer build() {
    TracingBootstrap telemetry = tracing != null ? tracing : TracingBootstrap.start(config);
    Server grpcServer =
        ServerBuilder.forPort(port).addService(buildProcessor(telemetry)).build();
    return new AuthBridgeServer(grpcServer, ImmutableList.of(telemetry));
  }
}
