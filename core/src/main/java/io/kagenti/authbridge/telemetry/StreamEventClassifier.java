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

/**
 * Maps one decoded SSE event of an agent stream to an {@link EventCategory}.
 *
 * <p>Implementations must not throw for unexpected shapes; return {@link
 * ClassifiedEvent#UNCLASSIFIED} instead. Swap implementations to follow a different agent
 * framework's step markers.
 */
@FunctionalInterface
public interface StreamEventClassifier {

  ClassifiedEvent classify(JsonNode event);
}
