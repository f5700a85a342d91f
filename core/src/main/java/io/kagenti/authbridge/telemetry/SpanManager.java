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

import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.ENDUSER_ID;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.EVENT_INDEX;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.EVENT_TEXT;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_AGENT_NAME;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_AGENT_VERSION;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_COMPLETION;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_CONVERSATION_ID;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_OPERATION_NAME;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_PROMPT;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_PROVIDER_NAME;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.GEN_AI_SYSTEM;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.HTTP_RESPONSE_STATUS_CODE;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.INPUT_VALUE;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_RUN_NAME;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_SOURCE;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_SPAN_INPUTS;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_SPAN_OUTPUTS;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_SPAN_TYPE;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_TRACE_NAME;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_TRACE_SESSION;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_USER;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.MLFLOW_VERSION;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.OPENINFERENCE_SPAN_KIND;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.OUTPUT_VALUE;
import static io.kagenti.authbridge.telemetry.AgentSpanAttributes.SESSION_ID;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.kagenti.authbridge.a2a.A2aMessageParser;
import io.kagenti.authbridge.a2a.ParsedAgentRequest;
import io.kagenti.authbridge.a2a.ParsedAgentResponse;
import io.kagenti.authbridge.a2a.SseLineDecoder;
import io.kagenti.authbridge.config.ProcessorConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import java.io.ByteArrayOutputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the observed request and response of an agent call into an {@code invoke_agent} span with
 * one child span per model or tool step found in the response stream.
 *
 * <p>Lifecycle per request: {@link #start} on request headers, {@link #appendRequestBody} and
 * {@link #completeRequest} for the request payload, {@link #onResponseHeaders} and {@link
 * #onResponseChunk} while the response streams, then exactly one of {@link #finish} (normal end of
 * stream) or {@link #abort} (the connection ended early). Calls after the span is closed are
 * ignored. Nothing here throws into the caller; failures are logged through {@link BestEffort}.
 */
public final class SpanManager {

  private static final Logger logger = LoggerFactory.getLogger(SpanManager.class);

  public static final String INSTRUMENTATION_SCOPE = "authbridge.otel.agent";
  static final String DEFAULT_USER = "kagenti";

  private final boolean enabled;
  private final Tracer tracer;
  private final TextMapPropagator propagator;
  private final A2aMessageParser parser;
  private final StreamEventClassifier classifier;
  private final AgentIdentity agent;
  private final ImmutableList<String> tracedPaths;
  private final int maxAttributeLength;
  private final int maxBufferBytes;

  private SpanManager(Builder builder) {
    this.enabled = builder.enabled;
    this.tracer = Objects.requireNonNull(builder.tracer, "tracer");
    this.propagator =
        Objects.requireNonNullElse(
            builder.propagator,
            TextMapPropagator.composite(
                W3CTraceContextPropagator.getInstance(), W3CBaggagePropagator.getInstance()));
    this.parser = Objects.requireNonNullElseGet(builder.parser, A2aMessageParser::new);
    this.classifier =
        Objects.requireNonNullElseGet(builder.classifier, StatusMarkerEventClassifier::new);
    this.agent = Objects.requireNonNull(builder.agent, "agent");
    this.tracedPaths = ImmutableList.copyOf(builder.tracedPaths);
    Preconditions.checkArgument(builder.maxAttributeLength > 0, "maxAttributeLength");
    Preconditions.checkArgument(builder.maxBufferBytes > 0, "maxBufferBytes");
    this.maxAttributeLength = builder.maxAttributeLength;
    this.maxBufferBytes = builder.maxBufferBytes;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A manager that never opens a span; requests pass through untraced. */
  public static SpanManager disabled(AgentIdentity agent) {
    return builder()
        .enabled(false)
        .tracer(OpenTelemetry.noop().getTracer(INSTRUMENTATION_SCOPE))
        .agent(agent)
        .build();
  }

  /** Creates a manager configured from {@code config}, using {@code openTelemetry} for spans. */
  public static SpanManager create(ProcessorConfig config, OpenTelemetry openTelemetry) {
    return builder()
        .enabled(config.tracingEnabled())
        .tracer(openTelemetry.getTracer(INSTRUMENTATION_SCOPE))
        .propagator(openTelemetry.getPropagators().getTextMapPropagator())
        .agent(AgentIdentity.from(config))
        .tracedPaths(config.tracedPaths())
        .maxAttributeLength(config.maxAttributeLength())
        .maxBufferBytes(config.maxResponseBufferBytes())
        .build();
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Whether requests to {@code path} are agent calls worth tracing, with or without a query. */
  public boolean isObservable(@Nullable String path) {
    if (path == null) {
      return false;
    }
    for (String traced : tracedPaths) {
      if (path.equals(traced) || path.startsWith(traced + "?")) {
        return true;
      }
    }
    return false;
  }

  /**
   * Opens the agent span for a request to {@code path}.
   *
   * @param userId authenticated subject, recorded as the end user
   * @return the new state, or empty when tracing is disabled or the path is not observable
   */
  public Optional<StreamState> start(@Nullable String path, Optional<String> userId) {
    if (!enabled || !isObservable(path)) {
      return Optional.empty();
    }
    return BestEffort.get("start agent span", () -> Optional.of(open(userId)), Optional.empty());
  }

  private StreamState open(Optional<String> userId) {
    String spanName = "invoke_agent " + agent.name();
    String user = userId.filter(u -> !u.isEmpty()).orElse(DEFAULT_USER);
    Span span =
        tracer
            .spanBuilder(spanName)
            .setNoParent()
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(GEN_AI_OPERATION_NAME, "invoke_agent")
            .setAttribute(GEN_AI_PROVIDER_NAME, agent.provider())
            .setAttribute(GEN_AI_AGENT_NAME, agent.name())
            .setAttribute(GEN_AI_AGENT_VERSION, agent.version())
            .setAttribute(MLFLOW_SPAN_TYPE, "AGENT")
            .setAttribute(MLFLOW_TRACE_NAME, agent.name())
            .setAttribute(MLFLOW_RUN_NAME, agent.name() + "-invoke")
            .setAttribute(MLFLOW_SOURCE, agent.serviceName())
            .setAttribute(MLFLOW_VERSION, agent.version())
            .setAttribute(MLFLOW_USER, user)
            .setAttribute(ENDUSER_ID, user)
            .setAttribute(OPENINFERENCE_SPAN_KIND, "AGENT")
            .startSpan();
    Context context = Context.root().with(span);

    Map<String, String> carrier = new LinkedHashMap<>();
    propagator.inject(
        context,
        carrier,
        (map, key, value) -> {
          if (map != null) {
            map.put(key, value);
          }
        });

    logger.debug("Started span {} (trace {})", spanName, span.getSpanContext().getTraceId());
    return new StreamState(
        span, context, new SseLineDecoder(parser, maxBufferBytes), ImmutableMap.copyOf(carrier));
  }

  /**
   * Buffers a request body chunk; the request is parsed once {@code endOfStream} is seen.
   * Oversized bodies are truncated.
   */
  public void appendRequestBody(StreamState state, byte[] chunk, boolean endOfStream) {
    synchronized (state) {
      if (state.isClosed() || state.requestParsed) {
        return;
      }
      append(state.requestBody, chunk);
      if (state.requestBody.size() >= maxBufferBytes && !state.requestTruncated) {
        state.requestTruncated = true;
        logger.warn(
            "Request body exceeds {} bytes; input will be parsed from a prefix", maxBufferBytes);
      }
    }
    if (endOfStream) {
      completeRequest(state);
    }
  }

  /** Parses the buffered request body, if that has not happened yet, and enriches the span. */
  public void completeRequest(StreamState state) {
    synchronized (state) {
      if (state.isClosed() || state.requestParsed) {
        return;
      }
      state.requestParsed = true;
      if (state.requestBody.size() == 0) {
        return;
      }
      byte[] body = state.requestBody.toByteArray();
      state.requestBody.reset();
      ParsedAgentRequest request =
          BestEffort.get(
              "parse agent request", () -> parser.parseRequest(body), ParsedAgentRequest.EMPTY);
      enrichRequest(state, request);
    }
  }

  /** Records the user input and conversation id on the agent span. */
  public void enrichRequest(StreamState state, ParsedAgentRequest request) {
    synchronized (state) {
      if (state.isClosed()) {
        return;
      }
      BestEffort.run(
          "enrich agent span",
          () -> {
            if (!request.userInput().isEmpty()) {
              String input = truncate(request.userInput());
              state.span.setAttribute(GEN_AI_PROMPT, input);
              state.span.setAttribute(INPUT_VALUE, input);
              state.span.setAttribute(MLFLOW_SPAN_INPUTS, input);
            }
            if (!request.conversationId().isEmpty()) {
              setConversationId(state, request.conversationId());
            }
          });
      logger.debug(
          "Enriched span: method={}, input={} chars, conversation={}",
          request.method(),
          request.userInput().length(),
          request.conversationId());
    }
  }

  /**
   * Records the response status. A response without a body ({@code endOfStream}) finishes the
   * span.
   */
  public void onResponseHeaders(StreamState state, int status, boolean endOfStream) {
    completeRequest(state);
    synchronized (state) {
      if (state.isClosed()) {
        return;
      }
      if (status > 0) {
        state.responseStatus = status;
        state.span.setAttribute(HTTP_RESPONSE_STATUS_CODE, (long) status);
      }
    }
    if (endOfStream) {
      finish(state);
    }
  }

  /** Buffers a response chunk and traces every complete stream event it contains. */
  public void onResponseChunk(StreamState state, byte[] chunk) {
    synchronized (state) {
      if (state.isClosed() || chunk.length == 0) {
        return;
      }
      if (state.responseBody.size() < maxBufferBytes) {
        append(state.responseBody, chunk);
      } else if (!state.responseTruncated) {
        state.responseTruncated = true;
        logger.warn("Response body exceeds {} bytes; no longer buffering it", maxBufferBytes);
      }
      List<JsonNode> events =
          BestEffort.get("decode stream chunk", () -> state.decoder.feed(chunk), List.of());
      for (JsonNode event : events) {
        BestEffort.run("trace stream event", () -> onEvent(state, event));
      }
    }
  }

  /**
   * Ends the agent span after a normal end of stream. Events still buffered are traced, and when no
   * artifact set the output, the whole response body is parsed for one. The status is {@code
   * ERROR} for 5xx responses and {@code OK} otherwise.
   *
   * @return true when this call closed the span
   */
  @CanIgnoreReturnValue
  public boolean finish(StreamState state) {
    completeRequest(state);
    synchronized (state) {
      if (state.isClosed()) {
        return false;
      }
      List<JsonNode> remaining =
          BestEffort.get("flush stream decoder", state.decoder::flush, List.of());
      for (JsonNode event : remaining) {
        BestEffort.run("trace stream event", () -> onEvent(state, event));
      }
      if (!state.hasOutput && state.responseBody.size() > 0) {
        byte[] body = state.responseBody.toByteArray();
        ParsedAgentResponse response =
            BestEffort.get(
                "parse agent response",
                () -> parser.parseResponse(body),
                ParsedAgentResponse.EMPTY);
        if (response.hasOutput()) {
          setOutput(state, response.output());
          logger.debug("Output taken from full body via {}", response.source());
        }
      }
      if (!state.close()) {
        return false;
      }
      if (state.responseStatus >= 500) {
        state.span.setStatus(StatusCode.ERROR, "HTTP " + state.responseStatus);
      } else {
        state.span.setStatus(StatusCode.OK);
      }
      state.span.end();
      logger.info(
          "Agent span ended (trace {}, {} bytes, {} child spans)",
          state.traceId(),
          state.responseBody.size(),
          state.childSpanCount());
      state.responseBody.reset();
      return true;
    }
  }

  /**
   * Ends the agent span with status {@code ERROR} because the connection ended before the response
   * completed. Output already recorded is kept; nothing else is added.
   *
   * @return true when this call closed the span
   */
  @CanIgnoreReturnValue
  public boolean abort(StreamState state, String reason) {
    synchronized (state) {
      if (!state.close()) {
        return false;
      }
      BestEffort.run(
          "end aborted span",
          () -> {
            state.span.setStatus(StatusCode.ERROR, reason);
            state.span.end();
          });
      logger.info(
          "Agent span aborted (trace {}, {} child spans): {}",
          state.traceId(),
          state.childSpanCount(),
          reason);
      state.responseBody.reset();
      state.requestBody.reset();
      return true;
    }
  }

  private void onEvent(StreamState state, JsonNode event) {
    if (!state.hasConversationId) {
      String contextId = event.path("result").path("contextId").asText("");
      if (!contextId.isEmpty()) {
        setConversationId(state, contextId);
        logger.debug("Conversation id {} taken from stream", contextId);
      }
    }

    ClassifiedEvent classified = classifier.classify(event);
    switch (classified.category()) {
      case LLM:
      case TOOL:
        createChildSpan(state, classified);
        break;
      case ARTIFACT:
        if (!classified.text().isEmpty()) {
          setOutput(state, classified.text());
        }
        break;
      default:
        break;
    }
  }

  private void createChildSpan(StreamState state, ClassifiedEvent event) {
    int index = state.nextChildIndex();
    StepAttributes step = StepAttributes.extract(parser, event.category(), event.text());
    String name = step.spanName().orElse(StepAttributes.defaultSpanName(event.category()));
    boolean llm = event.category() == EventCategory.LLM;

    Span child =
        tracer
            .spanBuilder(name)
            .setParent(state.context)
            .setSpanKind(SpanKind.INTERNAL)
            .setAllAttributes(step.attributes())
            .setAttribute(GEN_AI_OPERATION_NAME, llm ? "chat" : "execute_tool")
            .setAttribute(OPENINFERENCE_SPAN_KIND, llm ? "LLM" : "TOOL")
            .setAttribute(EVENT_INDEX, (long) index)
            .setAttribute(EVENT_TEXT, truncate(event.text()))
            .startSpan();
    if (llm) {
      child.setAttribute(GEN_AI_SYSTEM, agent.provider());
    }
    child.setStatus(StatusCode.OK);
    child.end();
    logger.debug("Created child span {} (step {})", name, index);
  }

  private void setOutput(StreamState state, String output) {
    String value = truncate(output);
    state.span.setAttribute(GEN_AI_COMPLETION, value);
    state.span.setAttribute(OUTPUT_VALUE, value);
    state.span.setAttribute(MLFLOW_SPAN_OUTPUTS, value);
    state.hasOutput = true;
  }

  private static void setConversationId(StreamState state, String conversationId) {
    state.span.setAttribute(GEN_AI_CONVERSATION_ID, conversationId);
    state.span.setAttribute(MLFLOW_TRACE_SESSION, conversationId);
    state.span.setAttribute(SESSION_ID, conversationId);
    state.hasConversationId = true;
  }

  private void append(ByteArrayOutputStream buffer, byte[] chunk) {
    int room = maxBufferBytes - buffer.size();
    if (room > 0) {
      buffer.write(chunk, 0, Math.min(room, chunk.length));
    }
  }

  String truncate(String value) {
    if (value.length() <= maxAttributeLength) {
      return value;
    }
    int end = maxAttributeLength;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end);
  }

  /** Builder for {@link SpanManager}. */
  public static final class Builder {
    private boolean enabled = true;
    @Nullable private Tracer tracer;
    @Nullable private TextMapPropagator propagator;
    @Nullable private A2aMessageParser parser;
    @Nullable private StreamEventClassifier classifier;
    @Nullable private AgentIdentity agent;
    private List<String> tracedPaths = ProcessorConfig.DEFAULT_TRACED_PATHS;
    private int maxAttributeLength = ProcessorConfig.DEFAULT_MAX_ATTRIBUTE_LENGTH;
    private int maxBufferBytes = ProcessorConfig.DEFAULT_MAX_RESPONSE_BUFFER_BYTES;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder tracer(Tracer tracer) {
      this.tracer = tracer;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder propagator(TextMapPropagator propagator) {
      this.propagator = propagator;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder parser(A2aMessageParser parser) {
      this.parser = parser;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder classifier(StreamEventClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder agent(AgentIdentity agent) {
      this.agent = agent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder tracedPaths(List<String> tracedPaths) {
      this.tracedPaths = tracedPaths;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxAttributeLength(int maxAttributeLength) {
      this.maxAttributeLength = maxAttributeLength;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxBufferBytes(int maxBufferBytes) {
      this.maxBufferBytes = maxBufferBytes;
      return this;
    }

    public SpanManager build() {
      return new SpanManager(this);
    }
  }
}
