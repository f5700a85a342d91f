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

import static com.google.common.truth.Truth.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class StatusMarkerEventClassifierTest {

  private final StatusMarkerEventClassifier classifier = new StatusMarkerEventClassifier();

  @Test
  void classify_artifactUpdate() {
    ClassifiedEvent event = classifier.classify(A2aEvents.artifactUpdate("ctx", "Sunny"));

    assertThat(event).isEqualTo(ClassifiedEvent.of(EventCategory.ARTIFACT, "Sunny"));
  }

  @Test
  void classify_assistantStep() {
    ClassifiedEvent event =
        classifier.classify(A2aEvents.statusUpdate("ctx", "assistant: thinking"));

    assertThat(event.category()).isEqualTo(EventCategory.LLM);
    assertThat(event.text()).isEqualTo("assistant: thinking");
  }

  @Test
  void classify_toolMarkerWinsOverAssistantMarker() {
    ClassifiedEvent event =
        classifier.classify(
            A2aEvents.statusUpdate("ctx", "tools: result for assistant: get_weather"));

    assertThat(event.category()).isEqualTo(EventCategory.TOOL);
  }

  @Test
  void classify_plainStatus() {
    assertThat(classifier.classify(A2aEvents.statusUpdate("ctx", "Working...")))
        .isEqualTo(ClassifiedEvent.of(EventCategory.STATUS, ""));
    assertThat(classifier.classify(A2aEvents.completed("ctx")).category())
        .isEqualTo(EventCategory.STATUS);
  }

  @Test
  void classify_unknownShapes() {
    ObjectNode task = A2aEvents.MAPPER.createObjectNode();
    task.putObject("result").put("kind", "task");

    assertThat(classifier.classify(task)).isEqualTo(ClassifiedEvent.UNCLASSIFIED);
    assertThat(classifier.classify(A2aEvents.MAPPER.createObjectNode()))
        .isEqualTo(ClassifiedEvent.UNCLASSIFIED);
  }
}
