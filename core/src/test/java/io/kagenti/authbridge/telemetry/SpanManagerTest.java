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
import static io.kagenti.authbridge.telemetry.A2aEvents.artifactUpdate;
import static io.kagenti.authbridge.telemetry.A2aEvents.assistantStep;
import static io.kagenti.authbridge.telemetry.A2aEvents.completed;
import static io.kagenti.authbridge.telemetry.A2aEvents.sse;
import static io.kagenti.authbridge.telemetry.A2aEvents.statusUpdate;
import static io.kagenti.authbridge.telemetry.A2aEvents.toolStep;

import com.google.common.collect.ImmutableList;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SpanManagerTest {

  private static final AgentIdentity AGENT =
      new AgentIdentity("weather-assistant", "1.0.0", "langchain", "weather-service");
  private static final String CONTEXT_ID = "ctx-42";

  private InMemorySpanExporter exporter;
  private SdkTracerProvider tracerProvider;
  private SpanManager spans;

  @BeforeEach
  void setUp() {
    exporter = InMemorySpanExporter.create();
    tracerProvider =
        SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build();
    spans = newManager(1000);
  }

  @AfterEach
  void tearDown() {
    tracerProvider.close();
  }

  private SpanManager newManager(int maxAttributeLength) {
    return SpanManager.builder()
        .tracer(tracerProvider.get(SpanManager.INSTRUMENTATION_SCOPE))
        .agent(AGENT)
        .maxAttributeLength(maxAttributeLength)
        .build();
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static List<byte[]> split(byte[] data, int chunks) {
    int size = (data.length + chunks - 1) / chunks;
    ImmutableList.Builder<byte[]> parts = ImmutableList.builder();
    for (int start = 0; start < data.length; start += size) {
      parts.add(Arrays.copyOfRange(data, start, Math.min(data.length, start + size)));
    }
    return parts.build();
  }

  private SpanData root() {
    List<SpanData> roots =
        exporter.getFinishedSpanItems().stream()
            .filter(span -> span.getName().startsWith("invoke_agent"))
            .collect(Collectors.toList());
    assertThat(roots).hasSize(1);
    return roots.get(0);
  }

  private List<SpanData> children() {
    return exporter.getFinishedSpanItems().stream()
        .filter(span -> !span.getName().startsWith("invoke_agent"))
        .collect(Collectors.toList());
  }

  private static String weatherStream() {
    return sse(
        statusUpdate(CONTEXT_ID, assistantStep("get_weather", "")),
        statusUpdate(CONTEXT_ID, toolStep("get_weather", "{\"temperature\": 25}")),
        statusUpdate(CONTEXT_ID, assistantStep("", "It is sunny and 25C in New York.")),
        artifactUpdate(CONTEXT_ID, "It is sunny and 25C in New York."),
        completed(CONTEXT_ID));
  }

  @Test
  void isObservable_rootPathWithOrWithoutQuery() {
    assertThat(spans.isObservable("/")).isTrue();
    assertThat(spans.isObservable("/?stream=true")).isTrue();
    assertThat(spans.isObservable("/.well-known/agent.json")).isFalse();
    assertThat(spans.isObservable("/health")).isFalse();
    assertThat(spans.isObservable(null)).isFalse();
  }

  @Test
  void isObservable_configuredPaths() {
    SpanManager manager =
        SpanManager.builder()
            .tracer(tracerProvider.get("test"))
            .agent(AGENT)
            .tracedPaths(ImmutableList.of("/", "/a2a"))
            .build();

    assertThat(manager.isObservable("/a2a?x=1")).isTrue();
    assertThat(manager.isObservable("/a2a/extra")).isFalse();
  }

  @Test
  void start_skipsUnobservablePathAndDisabledManager() {
    assertThat(spans.start("/health", Optional.empty())).isEmpty();
    assertThat(SpanManager.disabled(AGENT).start("/", Optional.empty())).isEmpty();
    assertThat(exporter.getFinishedSpanItems()).isEmpty();
  }

  @Test
  void start_opensRootSpanWithAgentAttributes() {
    StreamState state = spans.start("/", Optional.empty()).get();

    assertThat(state.propagationHeaders()).containsKey("traceparent");
    assertThat(state.propagationHeaders().get("traceparent")).contains(state.traceId());
    assertThat(spans.finish(state)).isTrue();

    SpanData root = root();
    assertThat(root.getName()).isEqualTo("invoke_agent weather-assistant");
    assertThat(root.getKind()).isEqualTo(SpanKind.INTERNAL);
    assertThat(root.getParentSpanContext().isValid()).isFalse();
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_OPERATION_NAME))
        .isEqualTo("invoke_agent");
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_PROVIDER_NAME))
        .isEqualTo("langchain");
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_AGENT_VERSION))
        .isEqualTo("1.0.0");
    assertThat(root.getAttributes().get(AgentSpanAttributes.MLFLOW_SPAN_TYPE)).isEqualTo("AGENT");
    assertThat(root.getAttributes().get(AgentSpanAttributes.MLFLOW_RUN_NAME))
        .isEqualTo("weather-assistant-invoke");
    assertThat(root.getAttributes().get(AgentSpanAttributes.MLFLOW_SOURCE))
        .isEqualTo("weather-service");
    assertThat(root.getAttributes().get(AgentSpanAttributes.OPENINFERENCE_SPAN_KIND))
        .isEqualTo("AGENT");
    assertThat(root.getAttributes().get(AgentSpanAttributes.ENDUSER_ID)).isEqualTo("kagenti");
    assertThat(root.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
  }

  @Test
  void start_recordsAuthenticatedUser() {
    StreamState state = spans.start("/", Optional.of("alice")).get();
    spans.finish(state);

    assertThat(root().getAttributes().get(AgentSpanAttributes.MLFLOW_USER)).isEqualTo("alice");
    assertThat(root().getAttributes().get(AgentSpanAttributes.ENDUSER_ID)).isEqualTo("alice");
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 5, 64})
  void weatherConversation_producesChildSpanPerStep(int chunks) {
    StreamState state = spans.start("/", Optional.empty()).get();
    byte[] request = bytes(A2aEvents.request("What is the weather in NY?", CONTEXT_ID));
    List<byte[]> requestParts = split(request, 2);
    for (int i = 0; i < requestParts.size(); i++) {
      spans.appendRequestBody(state, requestParts.get(i), i == requestParts.size() - 1);
    }
    spans.onResponseHeaders(state, 200, false);
    for (byte[] chunk : split(bytes(weatherStream()), chunks)) {
      spans.onResponseChunk(state, chunk);
    }

    assertThat(spans.finish(state)).isTrue();

    SpanData root = root();
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_PROMPT))
        .isEqualTo("What is the weather in NY?");
    assertThat(root.getAttributes().get(AgentSpanAttributes.INPUT_VALUE))
        .isEqualTo("What is the weather in NY?");
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_CONVERSATION_ID))
        .isEqualTo(CONTEXT_ID);
    assertThat(root.getAttributes().get(AgentSpanAttributes.SESSION_ID)).isEqualTo(CONTEXT_ID);
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_COMPLETION))
        .isEqualTo("It is sunny and 25C in New York.");
    assertThat(root.getAttributes().get(AgentSpanAttributes.HTTP_RESPONSE_STATUS_CODE))
        .isEqualTo(200L);
    assertThat(root.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);

    List<SpanData> children = children();
    assertThat(children.stream().map(SpanData::getName).collect(Collectors.toList()))
        .containsExactly(
            "chat " + A2aEvents.MODEL, "execute_tool get_weather", "chat " + A2aEvents.MODEL)
        .inOrder();
    for (int i = 0; i < children.size(); i++) {
      SpanData child = children.get(i);
      assertThat(child.getTraceId()).isEqualTo(root.getTraceId());
      assertThat(child.getParentSpanId()).isEqualTo(root.getSpanId());
      assertThat(child.getAttributes().get(AgentSpanAttributes.EVENT_INDEX)).isEqualTo(i + 1L);
      assertThat(child.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    SpanData firstLlm = children.get(0);
    assertThat(firstLlm.getAttributes().get(AgentSpanAttributes.GEN_AI_OPERATION_NAME))
        .isEqualTo("chat");
    assertThat(firstLlm.getAttributes().get(AgentSpanAttributes.GEN_AI_SYSTEM))
        .isEqualTo("langchain");
    assertThat(firstLlm.getAttributes().get(AgentSpanAttributes.GEN_AI_USAGE_INPUT_TOKENS))
        .isEqualTo(120L);
    assertThat(firstLlm.getAttributes().get(AgentSpanAttributes.GEN_AI_USAGE_OUTPUT_TOKENS))
        .isEqualTo(18L);
    assertThat(firstLlm.getAttributes().get(AgentSpanAttributes.GEN_AI_TOOL_CALLS))
        .isEqualTo("get_weather");
    assertThat(firstLlm.getAttributes().get(AgentSpanAttributes.GEN_AI_RESPONSE_FINISH_REASONS))
        .isEqualTo("tool_calls");

    SpanData tool = children.get(1);
    assertThat(tool.getAttributes().get(AgentSpanAttributes.GEN_AI_OPERATION_NAME))
        .isEqualTo("execute_tool");
    assertThat(tool.getAttributes().get(AgentSpanAttributes.OPENINFERENCE_SPAN_KIND))
        .isEqualTo("TOOL");
    assertThat(tool.getAttributes().get(AgentSpanAttributes.GEN_AI_TOOL_NAME))
        .isEqualTo("get_weather");
    assertThat(tool.getAttributes().get(AgentSpanAttributes.GEN_AI_TOOL_CALL_ID))
        .isEqualTo("call-1");
  }

  @Test
  void finish_closesSpanExactlyOnce() {
    StreamState state = spans.start("/", Optional.empty()).get();

    assertThat(spans.finish(state)).isTrue();
    assertThat(spans.finish(state)).isFalse();
    assertThat(spans.abort(state, "late cancel")).isFalse();

    assertThat(exporter.getFinishedSpanItems()).hasSize(1);
    assertThat(state.isClosed()).isTrue();
  }

  @Test
  void abort_marksErrorAndIgnoresLaterChunks() {
    StreamState state = spans.start("/", Optional.empty()).get();
    spans.onResponseHeaders(state, 200, false);
    spans.onResponseChunk(
        state, bytes(sse(statusUpdate(CONTEXT_ID, assistantStep("get_weather", "")))));

    assertThat(spans.abort(state, "client cancelled")).isTrue();
    spans.onResponseChunk(
        state, bytes(sse(statusUpdate(CONTEXT_ID, toolStep("get_weather", "sunny")))));
    assertThat(spans.finish(state)).isFalse();

    SpanData root = root();
    assertThat(root.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(root.getStatus().getDescription()).isEqualTo("client cancelled");
    assertThat(root.getAttributes().get(AgentSpanAttributes.GEN_AI_COMPLETION)).isNull();
    assertThat(children()).hasSize(1);
    assertThat(state.childSpanCount()).isEqualTo(1);
  }

  @Test
  void responseHeadersWithEndOfStream_finishWithServerErrorStatus() {
    StreamState state = spans.start("/", Optional.empty()).get();

    spans.onResponseHeaders(state, 503, true);

    SpanData root = root();
    assertThat(state.isClosed()).isTrue();
    assertThat(root.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(root.getAttributes().get(AgentSpanAttributes.HTTP_RESPONSE_STATUS_CODE))
        .isEqualTo(503L);
  }

  @Test
  void finish_fallsBackToWholeBodyResponse() {
    StreamState state = spans.start("/", Optional.empty()).get();
    String body =
        "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"kind\":\"task\",\"artifacts\":"
            + "[{\"parts\":[{\"kind\":\"text\",\"text\":\"Cloudy\"}]}]}}";
    for (byte[] chunk : split(bytes(body), 3)) {
      spans.onResponseChunk(state, chunk);
    }

    spans.finish(state);

    assertThat(root().getAttributes().get(AgentSpanAttributes.OUTPUT_VALUE)).isEqualTo("Cloudy");
    assertThat(children()).isEmpty();
  }

  @Test
  void conversationIdTakenFromStreamWhenRequestHasNone() {
    StreamState state = spans.start("/", Optional.empty()).get();
    spans.appendRequestBody(state, bytes(A2aEvents.request("hello", "")), true);
    spans.onResponseChunk(state, bytes(sse(completed("ctx-from-stream"))));

    spans.finish(state);

    assertThat(root().getAttributes().get(AgentSpanAttributes.GEN_AI_CONVERSATION_ID))
        .isEqualTo("ctx-from-stream");
    assertThat(root().getAttributes().get(AgentSpanAttributes.MLFLOW_TRACE_SESSION))
        .isEqualTo("ctx-from-stream");
  }

  @Test
  void attributesAreTruncated() {
    SpanManager manager = newManager(10);
    StreamState state = manager.start("/", Optional.empty()).get();
    manager.appendRequestBody(
        state, bytes(A2aEvents.request("a question that is far too long", CONTEXT_ID)), true);

    manager.finish(state);

    assertThat(root().getAttributes().get(AgentSpanAttributes.GEN_AI_PROMPT))
        .isEqualTo("a question");
  }

  @Test
  void truncate_doesNotSplitSurrogatePair() {
    SpanManager manager = newManager(3);

    assertThat(manager.truncate("ab😀c")).isEqualTo("ab");
    assertThat(manager.truncate("abc")).isEqualTo("abc");
  }

  @Test
  void classifierFailureDoesNotBreakTracing() {
    SpanManager manager =
        SpanManager.builder()
            .tracer(tracerProvider.get("test"))
            .agent(AGENT)
            .classifier(
                event -> {
                  throw new IllegalStateException("boom");
                })
            .build();
    StreamState state = manager.start("/", Optional.empty()).get();

    manager.onResponseChunk(state, bytes(weatherStream()));

    assertThat(manager.finish(state)).isTrue();
    assertThat(root().getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    assertThat(children()).isEmpty();
  }
}
