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

package io.kagenti.authbridge.extproc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.ByteString;
import io.envoyproxy.envoy.service.ext_proc.v3.BodyResponse;
import io.envoyproxy.envoy.service.ext_proc.v3.CommonResponse;
import io.envoyproxy.envoy.service.ext_proc.v3.HeaderMutation;
import io.envoyproxy.envoy.service.ext_proc.v3.HeadersResponse;
import io.envoyproxy.envoy.service.ext_proc.v3.ImmediateResponse;
import io.envoyproxy.envoy.service.ext_proc.v3.ProcessingRequest;
import io.envoyproxy.envoy.service.ext_proc.v3.ProcessingResponse;
import io.envoyproxy.envoy.service.ext_proc.v3.TrailersResponse;
import io.envoyproxy.envoy.type.v3.HttpStatus;

/** Factories for the ext_proc replies this processor sends. */
final class ProcessingResponses {

  static final int UNAUTHORIZED = 401;
  static final int SERVICE_UNAVAILABLE = 503;

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private ProcessingResponses() {}

  static ProcessingResponse requestHeaders(HeaderMutation mutation) {
    return ProcessingResponse.newBuilder()
        .setRequestHeaders(
            HeadersResponse.newBuilder()
                .setResponse(CommonResponse.newBuilder().setHeaderMutation(mutation)))
        .build();
  }

  static ProcessingResponse requestHeaders() {
    return ProcessingResponse.newBuilder()
        .setRequestHeaders(HeadersResponse.getDefaultInstance())
        .build();
  }

  static ProcessingResponse responseHeaders() {
    return ProcessingResponse.newBuilder()
        .setResponseHeaders(HeadersResponse.getDefaultInstance())
        .build();
  }

  static ProcessingResponse requestBody() {
    return ProcessingResponse.newBuilder()
        .setRequestBody(BodyResponse.getDefaultInstance())
        .build();
  }

  static ProcessingResponse responseBody() {
    return ProcessingResponse.newBuilder()
        .setResponseBody(BodyResponse.getDefaultInstance())
        .build();
  }

  static ProcessingResponse requestTrailers() {
    return ProcessingResponse.newBuilder()
        .setRequestTrailers(TrailersResponse.getDefaultInstance())
        .build();
  }

  static ProcessingResponse responseTrailers() {
    return ProcessingResponse.newBuilder()
        .setResponseTrailers(TrailersResponse.getDefaultInstance())
        .build();
  }

  /** A reply of the same kind as {@code request} that leaves the traffic unchanged. */
  static ProcessingResponse passThrough(ProcessingRequest request) {
    switch (request.getRequestCase()) {
      case REQUEST_HEADERS:
        return requestHeaders();
      case RESPONSE_HEADERS:
        return responseHeaders();
      case REQUEST_BODY:
        return requestBody();
      case RESPONSE_BODY:
        return responseBody();
      case REQUEST_TRAILERS:
        return requestTrailers();
      case RESPONSE_TRAILERS:
        return responseTrailers();
      default:
        return ProcessingResponse.getDefaultInstance();
    }
  }

  /** HTTP 401 with {@code {"error":"unauthorized","message":...}}. */
  static ProcessingResponse deny(String message) {
    return immediate(UNAUTHORIZED, "unauthorized", message);
  }

  /** An immediate local reply with a JSON error body; the request is not forwarded. */
  static ProcessingResponse immediate(int status, String error, String message) {
    ImmediateResponse.Builder response =
        ImmediateResponse.newBuilder()
            .setStatus(HttpStatus.newBuilder().setCodeValue(status))
            .setHeaders(
                HeaderMutation.newBuilder()
                    .addSetHeaders(Headers.overwrite("content-type", "application/json")))
            .setDetails(error)
            .setBody(ByteString.copyFromUtf8(errorJson(error, message)));
    return ProcessingResponse.newBuilder().setImmediateResponse(response).build();
  }

  static String errorJson(String error, String message) {
    ObjectNode body = objectMapper.createObjectNode().put("error", error).put("message", message);
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize error body", e);
    }
  }
}
