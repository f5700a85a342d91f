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

/**
 * Token exchange failed. Carries the HTTP status of the token endpoint, or 0 when no response was
 * received.
 */
public class TokenExchangeException extends Exception {

  private final int statusCode;

  public TokenExchangeException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public TokenExchangeException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  public int statusCode() {
    return statusCode;
  }
}
