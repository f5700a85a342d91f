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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import io.kagenti.authbridge.auth.TokenValidationException.Reason;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwksValidatorTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
  private static final String ISSUER = "http://keycloak:8080/realms/demo";
  private static final String AUDIENCE = "weather-agent";

  private MockWebServer server;
  private JwksValidator validator;
  private RSAKey signingKey;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    signingKey = TestTokens.newKey("k1");
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    JwksCache cache =
        new JwksCache(new OkHttpClient(), Duration.ofMinutes(5), Duration.ofSeconds(30), clock);
    validator = new JwksValidator(cache, server.url("/certs").toString(), clock);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private void enqueueKeys(RSAKey... keys) {
    server.enqueue(new MockResponse().setBody(TestTokens.jwksJson(keys)));
  }

  private static JWTClaimsSet.Builder claims() {
    return new JWTClaimsSet.Builder()
        .issuer(ISSUER)
        .subject("alice")
        .audience(AUDIENCE)
        .issueTime(Date.from(NOW.minusSeconds(60)))
        .expirationTime(Date.from(NOW.plusSeconds(300)));
  }

  private Reason rejection(String token, String audience) {
    return assertThrows(
            TokenValidationException.class, () -> validator.validate(token, ISSUER, audience))
        .reason();
  }

  @Test
  void validate_acceptsWellFormedToken() throws Exception {
    enqueueKeys(signingKey);
    String token = TestTokens.sign(signingKey, claims().build());

    ValidatedToken validated = validator.validate(token, ISSUER, AUDIENCE);

    assertThat(validated.subject()).hasValue("alice");
    assertThat(validated.issuer()).isEqualTo(ISSUER);
    assertThat(validated.audience()).containsExactly(AUDIENCE);
    assertThat(validated.expiresAt()).hasValue(NOW.plusSeconds(300));
  }

  @Test
  void validate_skipsAudienceCheckWhenNotConfigured() throws Exception {
    enqueueKeys(signingKey);
    String token = TestTokens.sign(signingKey, claims().audience("someone-else").build());

    assertThat(validator.validate(token, ISSUER, null).subject()).hasValue("alice");
    assertThat(validator.validate(token, ISSUER, "").subject()).hasValue("alice");
  }

  @Test
  void validate_rejectsWrongAudience() throws Exception {
    enqueueKeys(signingKey);
    String token = TestTokens.sign(signingKey, claims().audience("someone-else").build());

    assertThat(rejection(token, AUDIENCE)).isEqualTo(Reason.INVALID_AUDIENCE);
  }

  @Test
  void validate_rejectsWrongIssuer() throws Exception {
    enqueueKeys(signingKey);
    String token = TestTokens.sign(signingKey, claims().issuer("http://evil").build());

    TokenValidationException e =
        assertThrows(
            TokenValidationException.class, () -> validator.validate(token, ISSUER, AUDIENCE));

    assertThat(e.reason()).isEqualTo(Reason.INVALID_ISSUER);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("invalid issuer: expected " + ISSUER + ", got http://evil");
  }

  @Test
  void validate_expiryHonoursClockSkew() throws Exception {
    enqueueKeys(signingKey);
    String withinSkew =
        TestTokens.sign(
            signingKey, claims().expirationTime(Date.from(NOW.minusSeconds(30))).build());
    String expired =
        TestTokens.sign(
            signingKey, claims().expirationTime(Date.from(NOW.minusSeconds(120))).build());

    assertThat(validator.validate(withinSkew, ISSUER, AUDIENCE).subject()).hasValue("alice");
    assertThat(rejection(expired, AUDIENCE)).isEqualTo(Reason.EXPIRED);
  }

  @Test
  void validate_rejectsTokenNotYetValid() throws Exception {
    enqueueKeys(signingKey);
    String token =
        TestTokens.sign(
            signingKey, claims().notBeforeTime(Date.from(NOW.plusSeconds(120))).build());

    assertThat(rejection(token, AUDIENCE)).isEqualTo(Reason.NOT_YET_VALID);
  }

  @Test
  void validate_rejectsSignatureFromOtherKey() throws Exception {
    enqueueKeys(signingKey);
    RSAKey impostor = TestTokens.newKey("k1");
    String token = TestTokens.sign(impostor, claims().build());

    assertThat(rejection(token, AUDIENCE)).isEqualTo(Reason.SIGNATURE_INVALID);
  }

  @Test
  void validate_unknownKidTriggersOneRefresh() throws Exception {
    RSAKey rotated = TestTokens.newKey("k2");
    enqueueKeys(signingKey);
    enqueueKeys(signingKey, rotated);
    String token = TestTokens.sign(rotated, claims().build());

    assertThat(validator.validate(token, ISSUER, AUDIENCE).subject()).hasValue("alice");
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void validate_unknownKidAfterRefreshIsRejected() throws Exception {
    enqueueKeys(signingKey);
    enqueueKeys(signingKey);
    String token = TestTokens.sign(TestTokens.newKey("k9"), claims().build());

    assertThat(rejection(token, AUDIENCE)).isEqualTo(Reason.SIGNATURE_INVALID);
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void validate_rejectsSymmetricAlgorithm() throws Exception {
    enqueueKeys(signingKey);
    SignedJWT jwt =
        new SignedJWT(
            new JWSHeader.Builder(JWSAlgorithm.HS256).keyID("k1").build(), claims().build());
    jwt.sign(new MACSigner(new byte[32]));

    assertThat(rejection(jwt.serialize(), AUDIENCE)).isEqualTo(Reason.SIGNATURE_INVALID);
  }

  @Test
  void validate_rejectsUnsignedToken() {
    String token = new PlainJWT(claims().build()).serialize();

    assertThat(rejection(token, AUDIENCE)).isEqualTo(Reason.MALFORMED_TOKEN);
  }

  @Test
  void validate_rejectsGarbage() {
    assertThat(rejection("not-a-jwt", AUDIENCE)).isEqualTo(Reason.MALFORMED_TOKEN);
  }

  @Test
  void validate_keySetUnavailable() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(502));
    String token = TestTokens.sign(signingKey, claims().build());

    assertThat(rejection(token, AUDIENCE)).isEqualTo(Reason.KEYS_UNAVAILABLE);
  }
}
