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

import com.nimbusds.jose.jwk.JWKSet;
import io.kagenti.authbridge.auth.TokenValidationException.Reason;
import java.io.IOException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches JSON Web Key Sets per URL.
 *
 * <p>Entries expire after a TTL. At most one fetch per URL is in flight; concurrent callers wait on
 * the same result. Forced refreshes (after an unknown {@code kid}) are limited to one per minimum
 * interval. When a fetch fails and an older key set is cached, the older set is served. The cache
 * lock is never held across a network call.
 */
public final class JwksCache {

  private static final Logger logger = LoggerFactory.getLogger(JwksCache.class);

  private record Entry(JWKSet keys, Instant fetchedAt) {}

  private final OkHttpClient httpClient;
  private final Duration ttl;
  private final Duration minRefreshInterval;
  private final Clock clock;

  private final Lock lock = new ReentrantLock();
  private final Map<String, Entry> entries = new HashMap<>();
  private final Map<String, CompletableFuture<JWKSet>> inFlight = new HashMap<>();
  private final Map<String, Instant> lastForcedRefresh = new HashMap<>();

  public JwksCache(OkHttpClient httpClient, Duration ttl, Duration minRefreshInterval) {
    this(httpClient, ttl, minRefreshInterval, Clock.systemUTC());
  }

  public JwksCache(
      OkHttpClient httpClient, Duration ttl, Duration minRefreshInterval, Clock clock) {
    this.httpClient = Objects.requireNonNull(httpClient);
    this.ttl = Objects.requireNonNull(ttl);
    this.minRefreshInterval = Objects.requireNonNull(minRefreshInterval);
    this.clock = Objects.requireNonNull(clock);
  }

  /** Returns the cached key set for {@code url}, fetching it when absent or expired. */
  public JWKSet get(String url) throws TokenValidationException {
    return load(url, false);
  }

  /**
   * Fetches the key set again unless a forced refresh of {@code url} happened within the minimum
   * interval, in which case the cached set is returned.
   */
  public JWKSet refresh(String url) throws TokenValidationException {
    return load(url, true);
  }

  private JWKSet load(String url, boolean forced) throws TokenValidationException {
    CompletableFuture<JWKSet> future;
    boolean owner = false;
    lock.lock();
    try {
      Instant now = clock.instant();
      Entry entry = entries.get(url);
      if (entry != null) {
        if (!forced && now.isBefore(entry.fetchedAt().plus(ttl))) {
          return entry.keys();
        }
        Instant lastForced = lastForcedRefresh.get(url);
        if (forced && lastForced != null && now.isBefore(lastForced.plus(minRefreshInterval))) {
          return entry.keys();
        }
      }
      if (forced) {
        lastForcedRefresh.put(url, now);
      }
      future = inFlight.get(url);
      if (future == null) {
        future = new CompletableFuture<>();
        inFlight.put(url, future);
        owner = true;
      }
    } finally {
      lock.unlock();
    }

    if (owner) {
      fetchAndPublish(url, future);
    }
    return await(url, future);
  }

  private void fetchAndPublish(String url, CompletableFuture<JWKSet> future) {
    JWKSet fetched;
    try {
      fetched = fetch(url);
    } catch (IOException | ParseException | RuntimeException e) {
      Entry stale;
      lock.lock();
      try {
        inFlight.remove(url);
        stale = entries.get(url);
      } finally {
        lock.unlock();
      }
      if (stale != null) {
        logger.warn("JWKS refresh from {} failed, serving cached keys: {}", url, e.getMessage());
        future.complete(stale.keys());
      } else {
        future.completeExceptionally(e);
      }
      return;
    }

    lock.lock();
    try {
      entries.put(url, new Entry(fetched, clock.instant()));
      inFlight.remove(url);
    } finally {
      lock.unlock();
    }
    logger.debug("Fetched {} keys from {}", fetched.getKeys().size(), url);
    future.complete(fetched);
  }

  private JWKSet fetch(String url) throws IOException, ParseException {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful()) {
        throw new IOException("JWKS endpoint returned HTTP " + response.code());
      }
      if (body == null) {
        throw new IOException("JWKS endpoint returned an empty body");
      }
      return JWKSet.parse(body.string());
    }
  }

  private static JWKSet await(String url, CompletableFuture<JWKSet> future)
      throws TokenValidationException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new TokenValidationException(
          Reason.KEYS_UNAVAILABLE,
          "failed to fetch JWKS from " + url + ": " + cause.getMessage(),
          cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TokenValidationException(
          Reason.KEYS_UNAVAILABLE, "interrupted while fetching JWKS", e);
    }
  }
}
