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
import io.kagenti.authbridge.auth.BearerTokens;
import io.kagenti.authbridge.auth.JwksValidator;
import io.kagenti.authbridge.auth.TokenValidationException;
import io.kagenti.authbridge.auth.TokenValidationException.Reason;
import io.kagenti.authbridge.auth.ValidatedToken;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Checks the bearer token of inbound requests when an issuer and a JWKS URL are configured. */
final class InboundAuthenticator {

  private static final Logger logger = LoggerFactory.getLogger(InboundAuthenticator.class);

  @Nullable private final JwksValidator validator;
  private final String issuer;
  @Nullable private final String audience;

  private InboundAuthenticator(
      @Nullable JwksValidator validator, String issuer, @Nullable String audience) {
    this.validator = validator;
    this.issuer = issuer;
    this.audience = audience;
  }

  static InboundAuthenticator disabled() {
    return new InboundAuthenticator(null, "", null);
  }

  static InboundAuthenticator enabled(
      JwksValidator validator, String issuer, @Nullable String audience) {
    return new InboundAuthenticator(validator, issuer, audience);
  }

  boolean isEnabled() {
    return validator != null;
  }

  /**
   * Validates the request's bearer token.
   *
   * @return the validated token, or empty when validation is disabled
   * @throws TokenValidationException when the request must be rejected
   */
  Optional<ValidatedToken> authenticate(HeaderMap headers) throws TokenValidationException {
    if (validator == null) {
      return Optional.empty();
    }
    String token = BearerTokens.extract(Headers.get(headers, Headers.AUTHORIZATION).orElse(null));
    try {
      ValidatedToken validated = validator.validate(token, issuer, audience);
      logger.debug("Token validated for subject {}", validated.subject().orElse("<none>"));
      return Optional.of(validated);
    } catch (RuntimeException e) {
      throw new TokenValidationException(
          Reason.MALFORMED_TOKEN, "token could not be validated: " + e.getMessage(), e);
    }
  }

  /** The message sent back in the 401 body. */
  static String denyMessage(TokenValidationException e) {
    switch (e.reason()) {
      case MISSING_HEADER:
      case MALFORMED_HEADER:
        return e.getMessage();
      default:
        return "token validation failed: " + e.getMessage();
    }
  }
}
