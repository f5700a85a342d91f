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

import com.google.common.collect.ImmutableMap;
import io.kagenti.authbridge.a2a.SseLineDecoder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import java.io.ByteArrayOutputStream;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracing state of one in-flight request: the open agent span and what has been observed so far.
 *
 * <p>Created by {@link SpanManager#start} and mutated only through {@link SpanManager}, which
 * synchronizes on the instance. The span is ended exactly once, by {@link SpanManager#finish} or
 * {@link SpanManager#abort}.
 */
public final class StreamState {

  final Span span;
  final Context context;
  final SseLineDecoder decoder;
  final ByteArrayOutputStream requestBody = new ByteArrayOutputStream();
  final ByteArrayOutputStream responseBody = new ByteArrayOutputStream();
  private final ImmutableMap<String, String> propagationHeaders;
  private final AtomicInteger childSpanIndex = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();

  boolean requestParsed;
  boolean requestTruncated;
  boolean responseTruncated;
  boolean hasOutput;
  boolean hasConversationId;
  int responseStatus;

  StreamState(
      Span span,
      Context context,
      SseLineDecoder decoder,
      ImmutableMap<String, String> propagationHeaders) {
    this.span = span;
    this.context = context;
    this.decoder = decoder;
    this.propagationHeaders = propagationHeaders;
  }

  /** W3C trace-context and baggage headers to add to the forwarded request. */
  public ImmutableMap<String, String> propagationHeaders() {
    return propagationHeaders;
  }

  /** Number of child spans created so far; also the index of the last one. */
  public int childSpanCount() {
    return childSpanIndex.get();
  }

  public boolean hasOutput() {
    return hasOutput;
  }

  public boolean isClosed() {
    return closed.get();
  }

  public String traceId() {
    return span.getSpanContext().getTraceId();
  }

  int nextChildIndex() {
    return childSpanIndex.incrementAndGet();
  }

  /** Marks the state closed; returns false when it already was. */
  boolean close() {
    return closed.compareAndSet(false, true);
  }
}
