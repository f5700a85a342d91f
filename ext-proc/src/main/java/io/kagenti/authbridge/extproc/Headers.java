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

import com.google.protobuf.ByteString;
import io.envoyproxy.envoy.config.core.v3.HeaderMap;
import io.envoyproxy.envoy.config.core.v3.HeaderValue;
import io.envoyproxy.envoy.config.core.v3.HeaderValueOption;
import io.envoyproxy.envoy.config.core.v3.HeaderValueOption.HeaderAppendAction;
import java.util.Optional;

/** Reading and writing Envoy header maps. Names compare case-insensitively. */
final class Headers {

  static final String AUTHORIZATION = "authorization";
  static final String PATH = ":path";
  static final String STATUS = ":status";
  static final String DIRECTION = "x-authbridge-direction";

  private Headers() {}

  /** Returns the first value of header {@code name}; {@code raw_value} wins over {@code value}. */
  static Optional<String> get(HeaderMap headers, String name) {
    for (HeaderValue header : headers.getHeadersList()) {
      if (header.getKey().equalsIgnoreCase(name)) {
        return Optional.of(
            header.getRawValue().isEmpty()
                ? header.getValue()
                : header.getRawValue().toStringUtf8());
      }
    }
    return Optional.empty();
  }

  /** Parses the {@code :status} pseudo-header, or returns 0 when absent or malformed. */
  static int status(HeaderMap headers) {
    return get(headers, STATUS)
        .map(
            value -> {
              try {
                return Integer.parseInt(value.trim());
              } catch (NumberFormatException e) {
                return 0;
              }
            })
        .orElse(0);
  }

  /** A mutation that replaces header {@code name}, or adds it when absent. */
  static HeaderValueOption overwrite(String name, String value) {
    return HeaderValueOption.newBuilder()
        .setHeader(
            HeaderValue.newBuilder().setKey(name).setRawValue(ByteString.copyFromUtf8(value)))
        .setAppendAction(HeaderAppendAction.OVERWRITE_IF_EXISTS_OR_ADD)
        .build();
  }
}
