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

import java.util.Locale;

/** What an outbound call does when the token exchange fails. */
public enum TokenExchangeFailurePolicy {
  /** Forward the call with the caller's original credential. */
  FORWARD_ORIGINAL("forward-original"),
  /** Reject the call with HTTP 503. */
  DENY("deny");

  private final String value;

  TokenExchangeFailurePolicy(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static TokenExchangeFailurePolicy fromValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (TokenExchangeFailurePolicy policy : values()) {
      if (policy.value.equals(normalized)) {
        return policy;
      }
    }
    throw new IllegalArgumentException(
        "Unknown token exchange failure policy '" + value + "', expected forward-original or deny");
  }
}
