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

package io.kagenti.authbridge.extproc;

import io.kagenti.authbridge.telemetry.StreamState;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracing state of the open ext_proc streams, keyed by connection id. The lock covers only the map
 * operation. Whoever removes a state is responsible for closing its span.
 */
final class ConnectionTable {

  private final Lock lock = new ReentrantLock();
  private final Map<Long, StreamState> states = new HashMap<>();

  /** Stores {@code state} and returns the one it replaced, if any. */
  Optional<StreamState> put(long connectionId, StreamState state) {
    lock.lock();
    try {
      return Optional.ofNullable(states.put(connectionId, state));
    } finally {
      lock.unlock();
    }
  }

  Optional<StreamState> get(long connectionId) {
    lock.lock();
    try {
      return Optional.ofNullable(states.get(connectionId));
    } finally {
      lock.unlock();
    }
  }

  Optional<StreamState> remove(long connectionId) {
    lock.lock();
    try {
      return Optional.ofNullable(states.remove(connectionId));
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return states.size();
    } finally {
      lock.unlock();
    }
  }
}
