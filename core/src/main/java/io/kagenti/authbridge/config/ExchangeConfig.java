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

import static com.google.common.base.Strings.nullToEmpty;

/**
 * Snapshot of the credentials and target used for outbound token exchange. Empty strings stand for
 * unset values.
 */
public record ExchangeConfig(
    String clientId,
    String clientSecret,
    String tokenUrl,
    String targetAudience,
    String targetScopes) {

  public ExchangeConfig {
    clientId = nullToEmpty(clientId);
    clientSecret = nullToEmpty(clientSecret);
    tokenUrl = nullToEmpty(tokenUrl);
    targetAudience = nullToEmpty(targetAudience);
    targetScopes = nullToEmpty(targetScopes);
  }

  /** Whether every value needed to call the token endpoint is present. */
  public boolean canExchange() {
    return !clientId.isEmpty()
        && !clientSecret.isEmpty()
        && !tokenUrl.isEmpty()
        && !targetAudience.isEmpty();
  }

  @Override
  public String toString() {
    return "ExchangeConfig{clientId="
        + clientId
        + ", clientSecret="
        + (clientSecret.isEmpty() ? "<unset>" : "****")
        + ", tokenUrl="
        + tokenUrl
        + ", targetAudience="
        + targetAudience
        + ", targetScopes="
        + targetScopes
        + "}";
  }
}
