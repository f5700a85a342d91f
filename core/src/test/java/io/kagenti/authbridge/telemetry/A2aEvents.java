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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Builds A2A events shaped like the ones a LangGraph weather agent streams. */
final class A2aEvents {

  static final ObjectMapper MAPPER = new ObjectMapper();
  static final String MODEL = "llama3.2:3b-instruct-fp16";

  private A2aEvents() {}

  static String request(String text, String contextId) {
    ObjectNode message = MAPPER.createObjectNode().put("messageId", "msg-1").put("role", "user");
    if (!contextId.isEmpty()) {
      message.put("contextId", contextId);
    }
    message.putArray("parts").addObject().put("kind", "text").put("text", text);
    ObjectNode root =
        MAPPER
            .createObjectNode()
            .put("jsonrpc", "2.0")
            .put("id", "1")
            .put("method", "message/stream");
    root.putObject("params").set("message", message);
    return write(root);
  }

  /** A working status update carrying {@code text} as its message. */
  static ObjectNode statusUpdate(String contextId, String text) {
    ObjectNode event = MAPPER.createObjectNode().put("jsonrpc", "2.0").put("id", "1");
    ObjectNode result =
        event.putObject("result").put("kind", "status-update").put("contextId", contextId);
    ObjectNode status = result.putObject("status").put("state", "working");
    status
        .putObject("message")
        .put("role", "agent")
        .putArray("parts")
        .addObject()
        .put("kind", "text")
        .put("text", text);
    return event;
  }

  static ObjectNode artifactUpdate(String contextId, String text) {
    ObjectNode event = MAPPER.createObjectNode().put("jsonrpc", "2.0").put("id", "1");
    ObjectNode result =
        event.putObject("result").put("kind", "artifact-update").put("contextId", contextId);
    result
        .putObject("artifact")
        .put("artifactId", "a-1")
        .putArray("parts")
        .addObject()
        .put("kind", "text")
        .put("text", text);
    return event;
  }

  static ObjectNode completed(String contextId) {
    ObjectNode event = MAPPER.createObjectNode().put("jsonrpc", "2.0").put("id", "1");
    ObjectNode result =
        event.putObject("result").put("kind", "status-update").put("contextId", contextId);
    result.put("final", true).putObject("status").put("state", "completed");
    return event;
  }

  /** {@code assistant: {"messages":[human, ai]}} where the ai message calls {@code tool}. */
  static String assistantStep(String toolCall, String content) {
    ObjectNode dump = MAPPER.createObjectNode();
    ArrayNode messages = dump.putArray("messages");
    messages.addObject().put("type", "human").put("content", "What is the weather in NY?");
    ObjectNode ai = messages.addObject().put("type", "ai").put("content", content);
    ObjectNode metadata = ai.putObject("response_metadata").put("model_name", MODEL);
    metadata
        .putObject("token_usage")
        .put("prompt_tokens", 120)
        .put("completion_tokens", 18)
        .put("total_tokens", 138);
    if (toolCall.isEmpty()) {
      metadata.put("finish_reason", "stop");
    } else {
      metadata.put("finish_reason", "tool_calls");
      ai.putArray("tool_calls").addObject().put("name", toolCall).put("id", "call-1");
    }
    return "assistant: " + write(dump);
  }

  /** {@code tools: {"messages":[tool]}}. */
  static String toolStep(String tool, String content) {
    ObjectNode dump = MAPPER.createObjectNode();
    dump.putArray("messages")
        .addObject()
        .put("type", "tool")
        .put("name", tool)
        .put("tool_call_id", "call-1")
        .put("content", content);
    return "tools: " + write(dump);
  }

  static String sse(JsonNode... events) {
    StringBuilder stream = new StringBuilder();
    for (JsonNode event : events) {
      stream.append("data: ").append(write(event)).append("\n\n");
    }
    return stream.toString();
  }

  static String write(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }
}
