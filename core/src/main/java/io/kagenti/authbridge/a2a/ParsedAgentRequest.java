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

/**
 * Fields of an A2A JSON-RPC request relevant to tracing. Absent values are empty strings.
 *
 * @param method JSON-RPC method, for example {@code message/stream}
 * @param messageId {@code params.message.messageId}
 * @param userInput first text part of the message
 * @param conversationId {@code params.contextId}, else {@code params.message.contextId}
 */
public record ParsedAgentRequest(
    String method, String messageId, String userInput, String conversationId) {

  public static final ParsedAgentRequest EMPTY = new ParsedAgentRequest("", "", "", "");

  public boolean isEmpty() {
    return userInput.isEmpty() && conversationId.isEmpty();
  }
}
