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

package io.kagenti.authbridge.auth;

import com.google.common.base.Strings;
import io.kagenti.authbridge.auth.TokenValidationException.Reason;
import java.util.Optional;
import javax.annotation.Nullable;

/** Parsing of {@code Authorization: Bearer <token>} header values. */
public final class BearerTokens {

  private static final String PREFIX = "Bearer ";
  private static final String LOWER_PREFIX = "bearer ";

  private BearerTokens() {}

  /**
   * Returns the token carried by an authorization header value.
   *
   * @throws TokenValidationException with {@link Reason#MISSING_HEADER} when the value is absent,
   *     or {@link Reason#MALFORMED_HEADER} when it is not a non-empty bearer credential
   */
  public static String extract(@Nullable String headerValue) throws TokenValidationException {
    if (Strings.isNullOrEmpty(headerValue)) {
      throw new TokenValidationException(Reason.MISSING_HEADER, "missing Authorization header");
    }
    return find(headerValue)
        .orElseThrow(
            () ->
                new TokenValidationException(
                    Reason.MALFORMED_HEADER, "invalid Authorization header format"));
  }

  /** Like {@link #extract} but without an error for non-bearer or absent values. */
  public static Optional<String> find(@Nullable String headerValue) {
    if (headerValue == null) {
      return Optional.empty();
    }
    String token;
    if (headerValue.startsWith(PREFIX)) {
      token = headerValue.substring(PREFIX.length());
    } else if (headerValue.startsWith(LOWER_PREFIX)) {
      token = headerValue.substring(LOWER_PREFIX.length());
    } else {
      return Optional.empty();
    }
    token = token.trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
