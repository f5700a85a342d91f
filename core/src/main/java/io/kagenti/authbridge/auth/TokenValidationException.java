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

/** Raised when an inbound credential is rejected. The message is safe to return to the caller. */
public class TokenValidationException extends Exception {

  /** Which check rejected the credential. */
  public enum Reason {
    MISSING_HEADER,
    MALFORMED_HEADER,
    MALFORMED_TOKEN,
    KEYS_UNAVAILABLE,
    SIGNATURE_INVALID,
    EXPIRED,
    NOT_YET_VALID,
    INVALID_ISSUER,
    INVALID_AUDIENCE
  }

  private final Reason reason;

  public TokenValidationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TokenValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
