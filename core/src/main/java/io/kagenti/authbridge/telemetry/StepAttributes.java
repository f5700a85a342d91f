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

import com.fasterxml.jackson.databind.JsonNode;
import io.kagenti.authbridge.a2a.A2aMessageParser;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * GenAI attributes recovered from the LangChain message dump embedded in a step's text, for example
 * {@code "assistant: {\"messages\":[...]}"}.
 */
record StepAttributes(Optional<String> spanName, Attributes attributes) {

  static final StepAttributes NONE = new StepAttributes(Optional.empty(), Attributes.empty());

  static StepAttributes extract(A2aMessageParser parser, EventCategory category, String text) {
    int jsonStart = text.indexOf('{');
    if (jsonStart < 0) {
      return NONE;
    }
    Optional<JsonNode> root = parser.readTree(text.substring(jsonStart));
    if (root.isEmpty()) {
      return NONE;
    }
    JsonNode messages = root.get().path("messages");
    if (!messages.isArray() || messages.isEmpty()) {
      return NONE;
    }
    switch (category) {
      case LLM:
        return fromModelStep(messages);
      case TOOL:
        return fromToolStep(messages);
      default:
        return NONE;
    }
  }

  private static StepAttributes fromModelStep(JsonNode messages) {
    for (int i = messages.size() - 1; i >= 0; i--) {
      JsonNode message = messages.get(i);
      if (!"ai".equals(message.path("type").asText())) {
        continue;
      }
      AttributesBuilder attributes = Attributes.builder();
      String spanName = null;

      JsonNode metadata = message.path("response_metadata");
      JsonNode usage = metadata.path("token_usage");
      firstNumber(usage, "input_tokens", "prompt_tokens")
          .ifPresent(v -> attributes.put(AgentSpanAttributes.GEN_AI_USAGE_INPUT_TOKENS, v));
      firstNumber(usage, "output_tokens", "completion_tokens")
          .ifPresent(v -> attributes.put(AgentSpanAttributes.GEN_AI_USAGE_OUTPUT_TOKENS, v));
      firstNumber(usage, "total_tokens")
          .ifPresent(v -> attributes.put(AgentSpanAttributes.GEN_AI_USAGE_TOTAL_TOKENS, v));

      String model = metadata.path("model_name").asText("");
      if (!model.isEmpty()) {
        attributes.put(AgentSpanAttributes.GEN_AI_REQUEST_MODEL, model);
        attributes.put(AgentSpanAttributes.GEN_AI_RESPONSE_MODEL, model);
        spanName = "chat " + model;
      }
      String finishReason = metadata.path("finish_reason").asText("");
      if (!finishReason.isEmpty()) {
        attributes.put(AgentSpanAttributes.GEN_AI_RESPONSE_FINISH_REASONS, finishReason);
      }

      JsonNode toolCalls = message.path("tool_calls");
      if (toolCalls.isArray() && !toolCalls.isEmpty()) {
        List<String> names = new ArrayList<>();
        for (JsonNode call : toolCalls) {
          String name = call.path("name").asText("");
          if (name.isEmpty()) {
            name = call.path("function").path("name").asText("");
          }
          if (!name.isEmpty()) {
            names.add(name);
          }
        }
        if (!names.isEmpty()) {
          attributes.put(AgentSpanAttributes.GEN_AI_TOOL_CALLS, String.join(",", names));
        }
      }
      return new StepAttributes(Optional.ofNullable(spanName), attributes.build());
    }
    return NONE;
  }

  private static StepAttributes fromToolStep(JsonNode messages) {
    for (JsonNode message : messages) {
      if (!"tool".equals(message.path("type").asText())) {
        continue;
      }
      AttributesBuilder attributes = Attributes.builder();
      String spanName = null;
      String name = message.path("name").asText("");
      if (!name.isEmpty()) {
        spanName = "execute_tool " + name;
        attributes.put(AgentSpanAttributes.GEN_AI_TOOL_NAME, name);
      }
      String callId = message.path("tool_call_id").asText("");
      if (!callId.isEmpty()) {
        attributes.put(AgentSpanAttributes.GEN_AI_TOOL_CALL_ID, callId);
      }
      return new StepAttributes(Optional.ofNullable(spanName), attributes.build());
    }
    return NONE;
  }

  private static Optional<Long> firstNumber(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.path(field);
      if (value.isNumber()) {
        return Optional.of(value.asLong());
      }
    }
    return Optional.empty();
  }

  static String defaultSpanName(EventCategory category) {
    return category == EventCategory.LLM ? "chat" : "execute_tool";
  }
}
