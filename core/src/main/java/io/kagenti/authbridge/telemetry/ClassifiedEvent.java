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

/** A stream event's category and the text that goes with it; text may be empty. */
public record ClassifiedEvent(EventCategory category, String text) {

  public static final ClassifiedEvent UNCLASSIFIED =
      new ClassifiedEvent(EventCategory.UNCLASSIFIED, "");

  public static ClassifiedEvent of(EventCategory category, String text) {
    return new ClassifiedEvent(category, text);
  }
}
