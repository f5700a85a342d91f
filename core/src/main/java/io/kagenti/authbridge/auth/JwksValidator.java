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
import com.google.common.collect.ImmutableList;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.AsymmetricJWK;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.kagenti.authbridge.auth.TokenValidationException.Reason;
import java.security.PublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies inbound JWTs against the key set published at a JWKS URL.
 *
 * <p>Checks run in a fixed order: signature, expiry and not-before (with {@link #CLOCK_SKEW}),
 * issuer, then audience when one is expected. The first failing check determines the {@link
 * Reason}.
 */
public final class JwksValidator {

  private static final Logger logger = LoggerFactory.getLogger(JwksValidator.class);

  public static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

  private final JwksCache cache;
  private final String jwksUrl;
  private final Clock clock;
  private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

  public JwksValidator(JwksCache cache, String jwksUrl) {
    this(cache, jwksUrl, Clock.systemUTC());
  }

  public JwksValidator(JwksCache cache, String jwksUrl, Clock clock) {
    this.cache = Objects.requireNonNull(cache);
    this.jwksUrl = Objects.requireNonNull(jwksUrl);
    this.clock = Objects.requireNonNull(clock);
  }

  public String jwksUrl() {
    return jwksUrl;
  }

  /**
   * Validates a compact-serialized JWT.
   *
   * @param token the raw token, without the {@code Bearer} prefix
   * @param expectedIssuer exact {@code iss} value required
   * @param expectedAudience value that must appear in {@code aud}; not checked when null or empty
   */
  public ValidatedToken validate(
      String token, String expectedIssuer, @Nullable String expectedAudience)
      throws TokenValidationException {
    SignedJWT jwt;
    try {
      jwt = SignedJWT.parse(token);
    } catch (ParseException e) {
      throw new TokenValidationException(
          Reason.MALFORMED_TOKEN, "malformed token: " + e.getMessage(), e);
    }

    verifySignature(jwt);

    JWTClaimsSet claims;
    try {
      claims = jwt.getJWTClaimsSet();
    } catch (ParseException e) {
      throw new TokenValidationException(
          Reason.MALFORMED_TOKEN, "malformed claims: " + e.getMessage(), e);
    }

    Instant now = clock.instant();
    Date exp = claims.getExpirationTime();
    if (exp != null && now.isAfter(exp.toInstant().plus(CLOCK_SKEW))) {
      throw new TokenValidationException(Reason.EXPIRED, "token expired at " + exp.toInstant());
    }
    Date nbf = claims.getNotBeforeTime();
    if (nbf != null && now.plus(CLOCK_SKEW).isBefore(nbf.toInstant())) {
      throw new TokenValidationException(
          Reason.NOT_YET_VALID, "token not valid before " + nbf.toInstant());
    }

    String issuer = Strings.nullToEmpty(claims.getIssuer());
    if (!issuer.equals(expectedIssuer)) {
      throw new TokenValidationException(
          Reason.INVALID_ISSUER,
          "invalid issuer: expected " + expectedIssuer + ", got " + issuer);
    }

    List<String> audience = claims.getAudience();
    if (!Strings.isNullOrEmpty(expectedAudience) && !audience.contains(expectedAudience)) {
      throw new TokenValidationException(
          Reason.INVALID_AUDIENCE,
          "invalid audience: expected " + expectedAudience + ", got " + audience);
    }

    return new ValidatedToken(
        Optional.ofNullable(Strings.emptyToNull(claims.getSubject())),
        issuer,
        ImmutableList.copyOf(audience),
        Optional.ofNullable(exp).map(Date::toInstant));
  }

  private void verifySignature(SignedJWT jwt) throws TokenValidationException {
    JWSHeader header = jwt.getHeader();
    String kid = header.getKeyID();

    List<PublicKey> candidates = candidateKeys(cache.get(jwksUrl), header);
    if (candidates.isEmpty() && kid != null) {
      logger.debug("No key with kid {} in cached JWKS, refreshing", kid);
      candidates = candidateKeys(cache.refresh(jwksUrl), header);
    }
    if (candidates.isEmpty()) {
      throw new TokenValidationException(
          Reason.SIGNATURE_INVALID,
          "no signing key matches kid " + kid + " and alg " + header.getAlgorithm());
    }

    for (PublicKey key : candidates) {
      try {
        JWSVerifier verifier = verifierFactory.createJWSVerifier(header, key);
        if (jwt.verify(verifier)) {
          return;
        }
      } catch (JOSEException e) {
        logger.debug("Key rejected for {}: {}", header.getAlgorithm(), e.getMessage());
      }
    }
    throw new TokenValidationException(Reason.SIGNATURE_INVALID, "signature verification failed");
  }

  private static List<PublicKey> candidateKeys(JWKSet keys, JWSHeader header) {
    String kid = header.getKeyID();
    JWSAlgorithm alg = header.getAlgorithm();
    List<PublicKey> result = new ArrayList<>();
    for (JWK jwk : keys.getKeys()) {
      if (kid != null && !kid.equals(jwk.getKeyID())) {
        continue;
      }
      if (jwk.getKeyUse() != null && !KeyUse.SIGNATURE.equals(jwk.getKeyUse())) {
        continue;
      }
      if (jwk.getAlgorithm() != null && !jwk.getAlgorithm().getName().equals(alg.getName())) {
        continue;
      }
      if (!(jwk instanceof AsymmetricJWK)) {
        continue;
      }
      try {
        result.add(((AsymmetricJWK) jwk).toPublicKey());
      } catch (JOSEException e) {
        logger.debug("Skipping unusable key {}: {}", jwk.getKeyID(), e.getMessage());
      }
    }
    return result;
  }
}
