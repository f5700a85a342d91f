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

/**
 * Classifies A2A events by the step markers LangGraph agents put in status messages.
 *
 * <ul>
 *   <li>{@code artifact-update}: {@link EventCategory#ARTIFACT} with the artifact text.
 *   <li>{@code status-update} whose message contains {@code tools:}: {@link EventCategory#TOOL}.
 *   <li>{@code status-update} whose message contains {@code assistant:}: {@link
 *       EventCategory#LLM}.
 *   <li>other {@code status-update}: {@link EventCategory#STATUS}.
 * </ul>
 *
 * <p>The tool marker is checked first; a tool step echoes the assistant message that requested it.
 */
public final class StatusMarkerEventClassifier implements StreamEventClassifier {

  static final String TOOL_MARKER = "tools:";
  static final String ASSISTANT_MARKER = "assistant:";

  @Override
  public ClassifiedEvent classify(JsonNode event) {
    JsonNode result = event.path("result");
    String kind = result.path("kind").asText("");
    switch (kind) {
      case "artifact-update":
        return ClassifiedEvent.of(
            EventCategory.ARTIFACT,
            A2aMessageParser.firstText(result.path("artifact").path("parts")).orElse(""));
      case "status-update":
        String text =
            A2aMessageParser.firstText(result.path("status").path("message").path("parts"))
                .orElse("");
        if (text.contains(TOOL_MARKER)) {
          return ClassifiedEvent.of(EventCategory.TOOL, text);
        }
        if (text.contains(ASSISTANT_MARKER)) {
          return ClassifiedEvent.of(EventCategory.LLM, text);
        }
        return ClassifiedEvent.of(EventCategory.STATUS, "");
      default:
        return ClassifiedEvent.UNCLASSIFIED;
    }
  }
}
