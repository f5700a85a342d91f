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

import io.envoyproxy.envoy.config.core.v3.HeaderMap;
import io.envoyproxy.envoy.service.ext_proc.v3.HeaderMutation;
import io.envoyproxy.envoy.service.ext_proc.v3.ProcessingResponse;
import io.kagenti.authbridge.auth.BearerTokens;
import io.kagenti.authbridge.auth.TokenExchangeException;
import io.kagenti.authbridge.auth.TokenExchanger;
import io.kagenti.authbridge.config.ConfigStore;
import io.kagenti.authbridge.config.ExchangeConfig;
import io.kagenti.authbridge.config.TokenExchangeFailurePolicy;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Swaps the bearer token of outbound requests for one scoped to the target audience. Requests
 * without a bearer token, or made while the exchange is not configured, pass unchanged apart from
 * the direction marker.
 */
final class OutboundTokenExchange {

  private static final Logger logger = LoggerFactory.getLogger(OutboundTokenExchange.class);

  private final ConfigStore configStore;
  private final TokenExchanger exchanger;
  private final TokenExchangeFailurePolicy failurePolicy;

  OutboundTokenExchange(
      ConfigStore configStore,
      TokenExchanger exchanger,
      TokenExchangeFailurePolicy failurePolicy) {
    this.configStore = configStore;
    this.exchanger = exchanger;
    this.failurePolicy = failurePolicy;
  }

  ProcessingResponse handle(HeaderMap headers) {
    HeaderMutation.Builder mutation =
        HeaderMutation.newBuilder().addRemoveHeaders(Headers.DIRECTION);

    ExchangeConfig config = configStore.refreshIfIncomplete();
    if (!config.canExchange()) {
      logger.debug("Token exchange not configured, forwarding outbound request unchanged");
      return ProcessingResponses.requestHeaders(mutation.build());
    }
    Optional<String> subjectToken =
        BearerTokens.find(Headers.get(headers, Headers.AUTHORIZATION).orElse(null));
    if (subjectToken.isEmpty()) {
      logger.debug("Outbound request has no bearer token, forwarding unchanged");
      return ProcessingResponses.requestHeaders(mutation.build());
    }

    try {
      String exchanged =
          exchanger.exchange(
              subjectToken.get(), config.targetAudience(), config.targetScopes());
      mutation.addSetHeaders(Headers.overwrite(Headers.AUTHORIZATION, "Bearer " + exchanged));
      logger.debug("Replaced outbound token for audience {}", config.targetAudience());
    } catch (TokenExchangeException e) {
      if (failurePolicy == TokenExchangeFailurePolicy.DENY) {
        logger.warn("Token exchange failed, rejecting outbound request: {}", e.getMessage());
        return ProcessingResponses.immediate(
            ProcessingResponses.SERVICE_UNAVAILABLE, "token_exchange_failed", e.getMessage());
      }
      logger.warn("Token exchange failed, forwarding original token: {}", e.getMessage());
    }
    return ProcessingResponses.requestHeaders(mutation.build());
  }
}
