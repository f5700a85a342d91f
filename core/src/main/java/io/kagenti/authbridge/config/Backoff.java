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

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** Exponential backoff with up to 20% jitter. */
final class Backoff {

  static final long BASE_DELAY_MS = 500;
  static final long MAX_DELAY_MS = 5_000;

  private Backoff() {}

  static Duration delay(int attempt) {
    int shift = Math.min(Math.max(attempt, 0), 20);
    long delay = Math.min(BASE_DELAY_MS * (1L << shift), MAX_DELAY_MS);
    long jitter = (long) (delay * 0.2 * ThreadLocalRandom.current().nextDouble());
    return Duration.ofMillis(delay + jitter);
  }
}
