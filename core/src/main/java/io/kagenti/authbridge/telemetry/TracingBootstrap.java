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

import io.kagenti.authbridge.config.ProcessorConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the OpenTelemetry SDK of the process: OTLP/HTTP export through a batch span processor, the
 * agent resource attributes and W3C trace-context plus baggage propagation.
 */
public final class TracingBootstrap implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TracingBootstrap.class);

  static final String TRACES_PATH = "/v1/traces";

  @Nullable private final OpenTelemetrySdk sdk;
  private final OpenTelemetry openTelemetry;

  private TracingBootstrap(@Nullable OpenTelemetrySdk sdk) {
    this.sdk = sdk;
    this.openTelemetry = sdk != null ? sdk : OpenTelemetry.noop();
  }

  /** Starts exporting to {@code config.otlpEndpoint()}, or returns a no-op when tracing is off. */
  public static TracingBootstrap start(ProcessorConfig config) {
    if (!config.tracingEnabled()) {
      logger.info("Tracing disabled");
      return new TracingBootstrap(null);
    }
    String endpoint = tracesEndpoint(config.otlpEndpoint());
    logger.info(
        "Initializing tracing: agent={} service={} endpoint={}",
        config.agentName(),
        config.serviceName(),
        endpoint);
    return start(config, OtlpHttpSpanExporter.builder().setEndpoint(endpoint).build());
  }

  /** Starts exporting to the given exporter. */
  public static TracingBootstrap start(ProcessorConfig config, SpanExporter exporter) {
    SdkTracerProvider tracerProvider =
        SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
            .setResource(resource(AgentIdentity.from(config)))
            .build();
    OpenTelemetrySdk sdk =
        OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(
                ContextPropagators.create(
                    TextMapPropagator.composite(
                        W3CTraceContextPropagator.getInstance(),
                        W3CBaggagePropagator.getInstance())))
            .build();
    return new TracingBootstrap(sdk);
  }

  static Resource resource(AgentIdentity agent) {
    return Resource.getDefault()
        .merge(
            Resource.create(
                Attributes.builder()
                    .put(AttributeKey.stringKey("service.name"), agent.serviceName())
                    .put(AttributeKey.stringKey("service.version"), agent.version())
                    .put(AgentSpanAttributes.GEN_AI_AGENT_NAME, agent.name())
                    .put(AgentSpanAttributes.GEN_AI_AGENT_VERSION, agent.version())
                    .put(AgentSpanAttributes.GEN_AI_SYSTEM, agent.provider())
                    .build()));
  }

  static String tracesEndpoint(String base) {
    String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    return trimmed.endsWith(TRACES_PATH) ? trimmed : trimmed + TRACES_PATH;
  }

  public OpenTelemetry openTelemetry() {
    return openTelemetry;
  }

  /** Flushes pending spans and stops the exporter. */
  @Override
  public void close() {
    if (sdk == null) {
      return;
    }
    sdk.getSdkTracerProvider().shutdown().join(10, TimeUnit.SECONDS);
    logger.info("Tracing shut down");
  }
}
