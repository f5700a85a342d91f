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

package io.kagenti.authbridge.telemetry;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs work whose failure must not affect the traffic being processed. Failures are logged at WARN
 * and replaced by a fallback.
 *
 * <p>Every call site is a place where errors are deliberately not propagated.
 */
public final class BestEffort {

  private static final Logger logger = LoggerFactory.getLogger(BestEffort.class);

  private BestEffort() {}

  public static void run(String operation, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      logger.warn("{} failed, continuing: {}", operation, e.toString());
      logger.debug("{} failure detail", operation, e);
    }
  }

  public static <T> T get(String operation, Supplier<T> action, T fallback) {
    try {
      return action.get();
    } catch (RuntimeException e) {
      logger.warn("{} failed, using fallback: {}", operation, e.toString());
      logger.debug("{} failure detail", operation, e);
      return fallback;
    }
  }
}
