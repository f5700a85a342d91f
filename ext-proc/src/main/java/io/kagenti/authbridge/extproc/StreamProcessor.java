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

import io.envoyproxy.envoy.config.core.v3.HeaderMap;
import io.envoyproxy.envoy.service.ext_proc.v3.ExternalProcessorGrpc;
import io.envoyproxy.envoy.service.ext_proc.v3.HeaderMutation;
import io.envoyproxy.envoy.service.ext_proc.v3.HttpBody;
import io.envoyproxy.envoy.service.ext_proc.v3.HttpHeaders;
import io.envoyproxy.envoy.service.ext_proc.v3.ProcessingRequest;
import io.envoyproxy.envoy.service.ext_proc.v3.ProcessingResponse;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.kagenti.authbridge.auth.TokenValidationException;
import io.kagenti.authbridge.auth.ValidatedToken;
import io.kagenti.authbridge.telemetry.SpanManager;
import io.kagenti.authbridge.telemetry.StreamState;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Envoy external processor. Each {@code Process} call carries one HTTP exchange; every message
 * is answered with exactly one reply, in order.
 *
 * <p>Inbound request headers are authenticated and, for observable paths, open an agent span whose
 * trace context is injected into the forwarded request. Body and response messages feed that span
 * until the response ends. Requests marked {@code x-authbridge-direction: outbound} go through
 * token exchange instead.
 */
public final class StreamProcessor extends ExternalProcessorGrpc.ExternalProcessorImplBase {

  private static final Logger logger = LoggerFactory.getLogger(StreamProcessor.class);

  static final String OUTBOUND = "outbound";

  private final InboundAuthenticator authenticator;
  private final OutboundTokenExchange outbound;
  private final SpanManager spans;
  private final ConnectionTable connections = new ConnectionTable();
  private final AtomicLong nextConnectionId = new AtomicLong();

  StreamProcessor(
      InboundAuthenticator authenticator, OutboundTokenExchange outbound, SpanManager spans) {
    this.authenticator = authenticator;
    this.outbound = outbound;
    this.spans = spans;
  }

  @Override
  public StreamObserver<ProcessingRequest> process(
      StreamObserver<ProcessingResponse> responseObserver) {
    Connection connection =
        new Connection(nextConnectionId.incrementAndGet(), responseObserver);
    if (responseObserver instanceof ServerCallStreamObserver) {
      ((ServerCallStreamObserver<ProcessingResponse>) responseObserver)
          .setOnCancelHandler(() -> connection.terminate("client cancelled"));
    }
    return connection;
  }

  /** Number of connections that still hold an open agent span. */
  int openSpans() {
    return connections.size();
  }

  private final class Connection implements StreamObserver<ProcessingRequest> {

    private final long id;
    private final StreamObserver<ProcessingResponse> responses;
    private final AtomicBoolean terminated = new AtomicBoolean();

    Connection(long id, StreamObserver<ProcessingResponse> responses) {
      this.id = id;
      this.responses = responses;
    }

    @Override
    public void onNext(ProcessingRequest request) {
      if (terminated.get()) {
        logger.debug("Ignoring {} on terminated connection {}", request.getRequestCase(), id);
        return;
      }
      ProcessingResponse response;
      try {
        response = dispatch(request);
      } catch (RuntimeException e) {
        logger.error("Failed to process {} on connection {}", request.getRequestCase(), id, e);
        response = fallback(request);
      }
      try {
        responses.onNext(response);
      } catch (RuntimeException e) {
        logger.warn("Failed to send reply on connection {}: {}", id, e.getMessage());
        terminate("send failed: " + e.getMessage());
      }
    }

    @Override
    public void onError(Throwable t) {
      Status status = Status.fromThrowable(t);
      logger.debug("Connection {} ended with {}", id, status);
      terminate("stream error: " + status.getCode());
    }

    @Override
    public void onCompleted() {
      terminate("stream completed before the response ended");
      responses.onCompleted();
    }

    void terminate(String reason) {
      if (!terminated.compareAndSet(false, true)) {
        return;
      }
      connections.remove(id).ifPresent(state -> spans.abort(state, reason));
    }

    private ProcessingResponse dispatch(ProcessingRequest request) {
      switch (request.getRequestCase()) {
        case REQUEST_HEADERS:
          return onRequestHeaders(request.getRequestHeaders());
        case REQUEST_BODY:
          return onRequestBody(request.getRequestBody());
        case RESPONSE_HEADERS:
          return onResponseHeaders(request.getResponseHeaders());
        case RESPONSE_BODY:
          return onResponseBody(request.getResponseBody());
        case REQUEST_TRAILERS:
          return ProcessingResponses.requestTrailers();
        case RESPONSE_TRAILERS:
          connections.remove(id).ifPresent(spans::finish);
          return ProcessingResponses.responseTrailers();
        default:
          logger.warn("Unknown processing request kind {}", request.getRequestCase());
          return ProcessingResponse.getDefaultInstance();
      }
    }

    // A failed inbound header check must not let the request through.
    private ProcessingResponse fallback(ProcessingRequest request) {
      if (request.hasRequestHeaders()
          && authenticator.isEnabled()
          && !isOutbound(request.getRequestHeaders().getHeaders())) {
        return ProcessingResponses.deny("token validation failed: internal error");
      }
      return ProcessingResponses.passThrough(request);
    }

    private ProcessingResponse onRequestHeaders(HttpHeaders request) {
      HeaderMap headers = request.getHeaders();
      if (isOutbound(headers)) {
        return outbound.handle(headers);
      }

      Optional<ValidatedToken> token;
      try {
        token = authenticator.authenticate(headers);
      } catch (TokenValidationException e) {
        logger.warn("Rejecting inbound request ({}): {}", e.reason(), e.getMessage());
        return ProcessingResponses.deny(InboundAuthenticator.denyMessage(e));
      }

      HeaderMutation.Builder mutation =
          HeaderMutation.newBuilder().addRemoveHeaders(Headers.DIRECTION);
      Optional<StreamState> state =
          spans.start(
              Headers.get(headers, Headers.PATH).orElse(null),
              token.flatMap(ValidatedToken::subject));
      if (state.isPresent()) {
        connections
            .put(id, state.get())
            .ifPresent(previous -> spans.abort(previous, "superseded by a new request"));
        for (Map.Entry<String, String> header : state.get().propagationHeaders().entrySet()) {
          mutation.addSetHeaders(Headers.overwrite(header.getKey(), header.getValue()));
        }
        if (request.getEndOfStream()) {
          spans.completeRequest(state.get());
        }
      }
      return ProcessingResponses.requestHeaders(mutation.build());
    }

    private ProcessingResponse onRequestBody(HttpBody body) {
      connections
          .get(id)
          .ifPresent(
              state ->
                  spans.appendRequestBody(
                      state, body.getBody().toByteArray(), body.getEndOfStream()));
      return ProcessingResponses.requestBody();
    }

    private ProcessingResponse onResponseHeaders(HttpHeaders response) {
      int status = Headers.status(response.getHeaders());
      if (response.getEndOfStream()) {
        connections.remove(id).ifPresent(state -> spans.onResponseHeaders(state, status, true));
      } else {
        connections.get(id).ifPresent(state -> spans.onResponseHeaders(state, status, false));
      }
      return ProcessingResponses.responseHeaders();
    }

    private ProcessingResponse onResponseBody(HttpBody body) {
      connections
          .get(id)
          .ifPresent(state -> spans.onResponseChunk(state, body.getBody().toByteArray()));
      if (body.getEndOfStream()) {
        connections.remove(id).ifPresent(spans::finish);
      }
      return ProcessingResponses.responseBody();
    }
  }

  private static boolean isOutbound(HeaderMap headers) {
    return Headers.get(headers, Headers.DIRECTION).map(OUTBOUND::equalsIgnoreCase).orElse(false);
  }
}
