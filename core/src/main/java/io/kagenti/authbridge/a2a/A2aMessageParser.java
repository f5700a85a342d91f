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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kagenti.authbridge.a2a.ParsedAgentResponse.Source;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts user input and agent output from A2A JSON-RPC traffic.
 *
 * <p>Neither method throws: malformed or unexpected input yields an empty result.
 *
 * <p>Request shape: {@code {"method":..., "params":{"contextId":..., "message":{"messageId":...,
 * "contextId":..., "parts":[{"text":...}]}}}}.
 *
 * <p>Response shapes, tried in order:
 *
 * <ol>
 *   <li>a JSON-RPC response: {@code result.artifacts[0].parts[].text};
 *   <li>an SSE stream whose {@code data:} lines carry completed tasks ({@code
 *       result.artifacts[0]...}) or artifact updates ({@code result.artifact...}); the last
 *       non-empty text wins;
 *   <li>the last balanced {@code {...}} in the body, read as a JSON-RPC response.
 * </ol>
 */
public final class A2aMessageParser {

  private static final Logger logger = LoggerFactory.getLogger(A2aMessageParser.class);

  static final String DATA_PREFIX = "data:";

  private final ObjectMapper objectMapper;

  public A2aMessageParser() {
    this.objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public ParsedAgentRequest parseRequest(byte[] body) {
    Optional<JsonNode> root = readTree(new String(body, StandardCharsets.UTF_8));
    if (root.isEmpty() || !root.get().isObject()) {
      return ParsedAgentRequest.EMPTY;
    }
    JsonNode params = root.get().path("params");
    JsonNode message = params.path("message");

    String conversationId = textOrEmpty(params.path("contextId"));
    if (conversationId.isEmpty()) {
      conversationId = textOrEmpty(message.path("contextId"));
    }
    return new ParsedAgentRequest(
        textOrEmpty(root.get().path("method")),
        textOrEmpty(message.path("messageId")),
        firstText(message.path("parts")).orElse(""),
        conversationId);
  }

  public ParsedAgentResponse parseResponse(byte[] body) {
    String text = new String(body, StandardCharsets.UTF_8);

    Optional<JsonNode> whole = readTree(text);
    if (whole.isPresent()) {
      Optional<String> output = completedTaskText(whole.get().path("result"));
      if (output.isPresent()) {
        return new ParsedAgentResponse(output.get(), Source.JSON_RPC);
      }
    }

    String last = "";
    for (String line : text.split("\n", -1)) {
      Optional<String> payload = dataPayload(line);
      if (payload.isEmpty()) {
        continue;
      }
      Optional<JsonNode> event = readTree(payload.get());
      if (event.isEmpty()) {
        continue;
      }
      JsonNode result = event.get().path("result");
      Optional<String> fromTask = completedTaskText(result);
      if (fromTask.isPresent()) {
        last = fromTask.get();
      }
      Optional<String> fromUpdate = firstText(result.path("artifact").path("parts"));
      if (fromUpdate.isPresent()) {
        last = fromUpdate.get();
      }
    }
    if (!last.isEmpty()) {
      return new ParsedAgentResponse(last, Source.SSE);
    }

    Optional<String> trailing =
        lastBalancedObject(text)
            .flatMap(this::readTree)
            .flatMap(node -> completedTaskText(node.path("result")));
    if (trailing.isPresent()) {
      return new ParsedAgentResponse(trailing.get(), Source.TRAILING_OBJECT);
    }
    return ParsedAgentResponse.EMPTY;
  }

  /** Parses one JSON document, or returns empty when the text is not exactly one JSON value. */
  public Optional<JsonNode> readTree(String json) {
    if (json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readTree(json));
    } catch (JsonProcessingException e) {
      logger.debug("Ignoring non-JSON payload: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /** Returns the trimmed payload of an SSE {@code data:} line, if non-empty. */
  static Optional<String> dataPayload(String line) {
    String trimmed = line.trim();
    if (!trimmed.startsWith(DATA_PREFIX)) {
      return Optional.empty();
    }
    String payload = trimmed.substring(DATA_PREFIX.length()).trim();
    return payload.isEmpty() ? Optional.empty() : Optional.of(payload);
  }

  /** Non-empty text of the first part in {@code parts} that carries a textual {@code text}. */
  public static Optional<String> firstText(JsonNode parts) {
    if (!parts.isArray()) {
      return Optional.empty();
    }
    for (JsonNode part : parts) {
      JsonNode text = part.path("text");
      if (text.isTextual()) {
        return text.asText().isEmpty() ? Optional.empty() : Optional.of(text.asText());
      }
    }
    return Optional.empty();
  }

  private static Optional<String> completedTaskText(JsonNode result) {
    JsonNode artifacts = result.path("artifacts");
    if (!artifacts.isArray() || artifacts.isEmpty()) {
      return Optional.empty();
    }
    return firstText(artifacts.get(0).path("parts"));
  }

  private static String textOrEmpty(JsonNode node) {
    return node.isTextual() ? node.asText() : "";
  }

  static Optional<String> lastBalancedObject(String text) {
    int end = text.lastIndexOf('}');
    if (end < 0) {
      return Optional.empty();
    }
    int depth = 0;
    for (int i = end; i >= 0; i--) {
      char c = text.charAt(i);
      if (c == '}') {
        depth++;
      } else if (c == '{') {
        depth--;
        if (depth == 0) {
          return Optional.of(text.substring(i, end + 1));
        }
      }
    }
    return Optional.empty();
  }
}
