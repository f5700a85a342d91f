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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import io.kagenti.authbridge.config.ConfigStore;
import io.kagenti.authbridge.config.ExchangeConfig;
import java.io.IOException;
import java.util.Objects;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges a caller's access token for one scoped to a downstream audience (RFC 8693), using the
 * client credentials held by a {@link ConfigStore}.
 */
public final class TokenExchanger {

  private static final Logger logger = LoggerFactory.getLogger(TokenExchanger.class);

  static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:token-exchange";
  static final String ACCESS_TOKEN_TYPE = "urn:ietf:params:oauth:token-type:access_token";
  private static final int MAX_ERROR_BODY_CHARS = 512;

  private final ConfigStore configStore;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public TokenExchanger(ConfigStore configStore, OkHttpClient httpClient) {
    this.configStore = Objects.requireNonNull(configStore);
    this.httpClient = Objects.requireNonNull(httpClient);
    this.objectMapper = new ObjectMapper();
  }

  /**
   * Posts a token-exchange grant and returns the issued access token.
   *
   * @throws TokenExchangeException on transport failure, a non-2xx status, an unparsable body or a
   *     body without {@code access_token}
   */
  public String exchange(String subjectToken, String audience, String scopes)
      throws TokenExchangeException {
    ExchangeConfig credentials = configStore.current();
    if (credentials.tokenUrl().isEmpty()) {
      throw new TokenExchangeException("token endpoint is not configured", 0);
    }

    FormBody form =
        new FormBody.Builder()
            .add("client_id", credentials.clientId())
            .add("client_secret", credentials.clientSecret())
            .add("grant_type", GRANT_TYPE)
            .add("requested_token_type", ACCESS_TOKEN_TYPE)
            .add("subject_token", subjectToken)
            .add("subject_token_type", ACCESS_TOKEN_TYPE)
            .add("audience", audience)
            .add("scope", Strings.nullToEmpty(scopes))
            .build();
    Request request = new Request.Builder().url(credentials.tokenUrl()).post(form).build();

    logger.debug("Exchanging token for audience {} at {}", audience, credentials.tokenUrl());

    String body;
    int status;
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      body = responseBody != null ? responseBody.string() : "";
      status = response.code();
    } catch (IOException e) {
      throw new TokenExchangeException("token endpoint unreachable: " + e.getMessage(), e);
    }

    if (status < 200 || status >= 300) {
      throw new TokenExchangeException(
          "token exchange failed with status " + status + ": " + abbreviate(body), status);
    }

    TokenExchangeResponse parsed;
    try {
      parsed = objectMapper.readValue(body, TokenExchangeResponse.class);
    } catch (JsonProcessingException e) {
      throw new TokenExchangeException("unparsable token endpoint response", e);
    }
    if (parsed == null || Strings.isNullOrEmpty(parsed.accessToken())) {
      throw new TokenExchangeException("token endpoint response has no access_token", status);
    }
    return parsed.accessToken();
  }

  private static String abbreviate(String body) {
    return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS);
  }
}
