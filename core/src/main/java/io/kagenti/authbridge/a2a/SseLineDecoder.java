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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental decoder for SSE {@code data:} lines carrying JSON objects.
 *
 * <p>Bytes are buffered until a line feed, so an event split across chunks is decoded exactly once
 * and the events produced do not depend on where the stream was cut. A trailing line without a line
 * feed is emitted as soon as it holds a complete JSON object; the rest of that line is then
 * ignored. Anything still buffered is decoded by {@link #flush()}.
 *
 * <p>Not thread-safe; one instance per response stream.
 */
public final class SseLineDecoder {

  private static final Logger logger = LoggerFactory.getLogger(SseLineDecoder.class);

  private final A2aMessageParser parser;
  private final int maxLineBytes;
  private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
  private boolean skipRestOfLine;

  public SseLineDecoder(A2aMessageParser parser, int maxLineBytes) {
    this.parser = Objects.requireNonNull(parser);
    this.maxLineBytes = maxLineBytes;
  }

  /** Consumes the next chunk and returns the events completed by it, in stream order. */
  public List<JsonNode> feed(byte[] chunk) {
    ImmutableList.Builder<JsonNode> events = ImmutableList.builder();
    for (byte b : chunk) {
      if (b == '\n') {
        if (!skipRestOfLine) {
          decodeLine(takePending()).ifPresent(events::add);
        }
        pending.reset();
        skipRestOfLine = false;
        continue;
      }
      if (skipRestOfLine) {
        continue;
      }
      if (pending.size() >= maxLineBytes) {
        logger.warn("Dropping SSE line longer than {} bytes", maxLineBytes);
        pending.reset();
        skipRestOfLine = true;
        continue;
      }
      pending.write(b);
    }

    if (!skipRestOfLine && pending.size() > 0) {
      String line = pendingText();
      if (line.trim().endsWith("}")) {
        Optional<JsonNode> event = decodeLine(line);
        if (event.isPresent()) {
          events.add(event.get());
          pending.reset();
          skipRestOfLine = true;
        }
      }
    }
    return events.build();
  }

  /** Decodes whatever is buffered; call once the stream has ended. */
  public List<JsonNode> flush() {
    Optional<JsonNode> event =
        skipRestOfLine || pending.size() == 0 ? Optional.empty() : decodeLine(takePending());
    pending.reset();
    skipRestOfLine = false;
    return event.map(ImmutableList::of).orElse(ImmutableList.of());
  }

  private String takePending() {
    String line = pendingText();
    pending.reset();
    return line;
  }

  private String pendingText() {
    return new String(pending.toByteArray(), StandardCharsets.UTF_8);
  }

  private Optional<JsonNode> decodeLine(String line) {
    return A2aMessageParser.dataPayload(line)
        .flatMap(parser::readTree)
        .filter(JsonNode::isObject);
  }
}
