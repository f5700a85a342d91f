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

package io.kagenti.authbridge.a2a;

/** The agent's final answer and the decoding path that found it. */
public record ParsedAgentResponse(String output, Source source) {

  /** How the output was located in the response body. */
  public enum Source {
    /** The body was a single JSON-RPC response. */
    JSON_RPC,
    /** The body was an SSE stream; the last non-empty artifact text won. */
    SSE,
    /** The last balanced JSON object in the body. */
    TRAILING_OBJECT,
    NONE
  }

  public static final ParsedAgentResponse EMPTY = new ParsedAgentResponse("", Source.NONE);

  public boolean hasOutput() {
    return !output.isEmpty();
  }
}
