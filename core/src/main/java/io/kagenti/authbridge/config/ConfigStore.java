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

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the outbound exchange credentials.
 *
 * <p>Client id and secret are read from mounted files that a separate registration process may
 * write after this process starts, falling back to the configured values when a file is missing or
 * empty. Readers always see a complete {@link ExchangeConfig} snapshot.
 */
public final class ConfigStore {

  private static final Logger logger = LoggerFactory.getLogger(ConfigStore.class);

  static final Duration MIN_REFRESH_INTERVAL = Duration.ofSeconds(10);

  /** Pauses the calling thread; replaced in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final ProcessorConfig config;
  private final Sleeper sleeper;
  private final Clock clock;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private ExchangeConfig current;
  private Instant lastReload = Instant.EPOCH;

  public ConfigStore(ProcessorConfig config) {
    this(config, duration -> Thread.sleep(duration.toMillis()), Clock.systemUTC());
  }

  @VisibleForTesting
  ConfigStore(ProcessorConfig config, Sleeper sleeper, Clock clock) {
    this.config = config;
    this.sleeper = sleeper;
    this.clock = clock;
    this.current =
        new ExchangeConfig(
            config.clientId(),
            config.clientSecret(),
            config.tokenUrl(),
            config.targetAudience(),
            config.targetScopes());
  }

  /** Returns the latest credential snapshot. */
  public ExchangeConfig current() {
    lock.readLock().lock();
    try {
      return current;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Re-reads the credential files and publishes a new snapshot. */
  @CanIgnoreReturnValue
  public ExchangeConfig reload() {
    String clientId = readCredential(config.clientIdFile(), config.clientId());
    String clientSecret = readCredential(config.clientSecretFile(), config.clientSecret());
    ExchangeConfig updated =
        new ExchangeConfig(
            clientId,
            clientSecret,
            config.tokenUrl(),
            config.targetAudience(),
            config.targetScopes());

    lock.writeLock().lock();
    try {
      current = updated;
      lastReload = clock.instant();
    } finally {
      lock.writeLock().unlock();
    }
    logger.info("Loaded exchange configuration: {}", updated);
    return updated;
  }

  /**
   * Reloads when the current snapshot cannot be used for an exchange and the last reload is older
   * than {@link #MIN_REFRESH_INTERVAL}. Covers credentials that land on disk after the startup
   * wait gave up.
   */
  @CanIgnoreReturnValue
  public ExchangeConfig refreshIfIncomplete() {
    Instant now = clock.instant();
    lock.readLock().lock();
    try {
      if (current.canExchange()
          || Duration.between(lastReload, now).compareTo(MIN_REFRESH_INTERVAL) < 0) {
        return current;
      }
    } finally {
      lock.readLock().unlock();
    }
    return reload();
  }

  /**
   * Waits, with bounded exponential backoff, until both credential files hold content, then loads
   * them. On timeout the configured fallbacks are loaded instead.
   *
   * @return true when the files were found before the deadline
   */
  @CanIgnoreReturnValue
  public boolean awaitCredentialFiles(Duration maxWait) {
    Instant deadline = clock.instant().plus(maxWait);
    int attempt = 0;
    while (true) {
      if (!fileContent(config.clientIdFile()).isEmpty()
          && !fileContent(config.clientSecretFile()).isEmpty()) {
        logger.info("Credential files are ready");
        reload();
        return true;
      }
      Duration remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        break;
      }
      Duration delay = Backoff.delay(attempt++);
      if (delay.compareTo(remaining) > 0) {
        delay = remaining;
      }
      logger.info("Credentials not ready yet, retrying in {}ms", delay.toMillis());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    logger.warn(
        "Credential files {} and {} not ready after {}s; using configured fallbacks",
        config.clientIdFile(),
        config.clientSecretFile(),
        maxWait.getSeconds());
    reload();
    return false;
  }

  private static String readCredential(String path, String fallback) {
    String fromFile = fileContent(path);
    return fromFile.isEmpty() ? fallback : fromFile;
  }

  private static String fileContent(String path) {
    try {
      return Files.readString(Path.of(path), StandardCharsets.UTF_8).trim();
    } catch (NoSuchFileException e) {
      return "";
    } catch (IOException e) {
      logger.debug("Could not read credential file {}: {}", path, e.getMessage());
      return "";
    }
  }
}
