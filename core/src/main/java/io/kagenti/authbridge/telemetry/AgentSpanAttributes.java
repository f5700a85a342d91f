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

import io.opentelemetry.api.common.AttributeKey;

/**
 * Attribute keys written on agent spans: GenAI semantic conventions plus the MLflow and
 * OpenInference keys their UIs read.
 */
public final class AgentSpanAttributes {

  public static final AttributeKey<String> GEN_AI_OPERATION_NAME =
      AttributeKey.stringKey("gen_ai.operation.name");
  public static final AttributeKey<String> GEN_AI_PROVIDER_NAME =
      AttributeKey.stringKey("gen_ai.provider.name");
  public static final AttributeKey<String> GEN_AI_SYSTEM = AttributeKey.stringKey("gen_ai.system");
  public static final AttributeKey<String> GEN_AI_AGENT_NAME =
      AttributeKey.stringKey("gen_ai.agent.name");
  public static final AttributeKey<String> GEN_AI_AGENT_VERSION =
      AttributeKey.stringKey("gen_ai.agent.version");
  public static final AttributeKey<String> GEN_AI_CONVERSATION_ID =
      AttributeKey.stringKey("gen_ai.conversation.id");
  public static final AttributeKey<String> GEN_AI_PROMPT = AttributeKey.stringKey("gen_ai.prompt");
  public static final AttributeKey<String> GEN_AI_COMPLETION =
      AttributeKey.stringKey("gen_ai.completion");
  public static final AttributeKey<String> GEN_AI_REQUEST_MODEL =
      AttributeKey.stringKey("gen_ai.request.model");
  public static final AttributeKey<String> GEN_AI_RESPONSE_MODEL =
      AttributeKey.stringKey("gen_ai.response.model");
  public static final AttributeKey<String> GEN_AI_RESPONSE_FINISH_REASONS =
      AttributeKey.stringKey("gen_ai.response.finish_reasons");
  public static final AttributeKey<Long> GEN_AI_USAGE_INPUT_TOKENS =
      AttributeKey.longKey("gen_ai.usage.input_tokens");
  public static final AttributeKey<Long> GEN_AI_USAGE_OUTPUT_TOKENS =
      AttributeKey.longKey("gen_ai.usage.output_tokens");
  public static final AttributeKey<Long> GEN_AI_USAGE_TOTAL_TOKENS =
      AttributeKey.longKey("gen_ai.usage.total_tokens");
  public static final AttributeKey<String> GEN_AI_TOOL_CALLS =
      AttributeKey.stringKey("gen_ai.tool.calls");
  public static final AttributeKey<String> GEN_AI_TOOL_NAME =
      AttributeKey.stringKey("gen_ai.tool.name");
  public static final AttributeKey<String> GEN_AI_TOOL_CALL_ID =
      AttributeKey.stringKey("gen_ai.tool.call.id");

  public static final AttributeKey<String> MLFLOW_SPAN_TYPE =
      AttributeKey.stringKey("mlflow.spanType");
  public static final AttributeKey<String> MLFLOW_TRACE_NAME =
      AttributeKey.stringKey("mlflow.traceName");
  public static final AttributeKey<String> MLFLOW_RUN_NAME =
      AttributeKey.stringKey("mlflow.runName");
  public static final AttributeKey<String> MLFLOW_SOURCE = AttributeKey.stringKey("mlflow.source");
  public static final AttributeKey<String> MLFLOW_VERSION =
      AttributeKey.stringKey("mlflow.version");
  public static final AttributeKey<String> MLFLOW_USER = AttributeKey.stringKey("mlflow.user");
  public static final AttributeKey<String> MLFLOW_SPAN_INPUTS =
      AttributeKey.stringKey("mlflow.spanInputs");
  public static final AttributeKey<String> MLFLOW_SPAN_OUTPUTS =
      AttributeKey.stringKey("mlflow.spanOutputs");
  public static final AttributeKey<String> MLFLOW_TRACE_SESSION =
      AttributeKey.stringKey("mlflow.trace.session");

  public static final AttributeKey<String> OPENINFERENCE_SPAN_KIND =
      AttributeKey.stringKey("openinference.span.kind");
  public static final AttributeKey<String> INPUT_VALUE = AttributeKey.stringKey("input.value");
  public static final AttributeKey<String> OUTPUT_VALUE = AttributeKey.stringKey("output.value");
  public static final AttributeKey<String> SESSION_ID = AttributeKey.stringKey("session.id");
  public static final AttributeKey<String> ENDUSER_ID = AttributeKey.stringKey("enduser.id");

  public static final AttributeKey<Long> HTTP_RESPONSE_STATUS_CODE =
      AttributeKey.longKey("http.response.status_code");
  public static final AttributeKey<Long> EVENT_INDEX = AttributeKey.longKey("event.index");
  public static final AttributeKey<String> EVENT_TEXT = AttributeKey.stringKey("event.text");

  private AgentSpanAttributes() {}
}
