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

import com.google.common.collect.ImmutableList;
import io.grpc.Server;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Manages the lifecycle of the ext_proc gRPC server and the resources it owns. */
public class AuthBridgeServer {

  private static final Logger logger = LoggerFactory.getLogger(AuthBridgeServer.class);

  private final Server server;
  private final ImmutableList<AutoCloseable> resources;
  private final AtomicBoolean stopped = new AtomicBoolean();

  /**
   * Constructs a new server instance.
   *
   * @param server the underlying gRPC {@link Server} to manage
   * @param resources closed, in order, after the server has shut down
   */
  public AuthBridgeServer(Server server, List<? extends AutoCloseable> resources) {
    this.server = server;
    this.resources = ImmutableList.copyOf(resources);
  }

  /**
   * Starts the gRPC server and blocks the current thread until the server is terminated.
   *
   * @throws IOException if the server fails to start
   * @throws InterruptedException if the server is interrupted while waiting for termination
   */
  public void start() throws IOException, InterruptedException {
    start(true);
  }

  /**
   * Starts the gRPC server.
   *
   * @param awaitTermination if true, blocks the current thread until the server is terminated
   * @throws IOException if the server fails to start
   * @throws InterruptedException if the server is interrupted while waiting for termination
   */
  public void start(boolean awaitTermination) throws IOException, InterruptedException {
    server.start();
    logger.info("ext_proc gRPC server started, listening on port {}", server.getPort());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.info("Shutting down gRPC server since JVM is shutting down");
                  try {
                    AuthBridgeServer.this.stop();
                  } catch (InterruptedException e) {
                    logger.error("gRPC server shutdown interrupted", e);
                    Thread.currentThread().interrupt();
                  }
                  logger.info("Server shut down");
                }));

    if (awaitTermination) {
      server.awaitTermination();
    }
  }

  public int getPort() {
    return server.getPort();
  }

  /**
   * Stops the gRPC server gracefully, then releases the owned resources. Only the first call has
   * an effect.
   *
   * @throws InterruptedException if the server is interrupted while shutting down
   */
  public void stop() throws InterruptedException {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    try {
      server.shutdown().awaitTermination(30, TimeUnit.SECONDS);
    } finally {
      for (AutoCloseable resource : resources) {
        try {
          resource.close();
        } catch (Exception e) {
          logger.warn("Failed to close {}", resource.getClass().getSimpleName(), e);
        }
      }
    }
  }
}
