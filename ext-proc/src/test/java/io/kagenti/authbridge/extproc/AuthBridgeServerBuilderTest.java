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

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.kagenti.authbridge.config.ConfigStore;
import io.kagenti.authbridge.config.ProcessorConfig;
import io.kagenti.authbridge.telemetry.TracingBootstrap;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

class AuthBridgeServerBuilderTest {

  private final ProcessorConfig config =
      ProcessorConfig.builder().tracingEnabled(false).port(50051).build();

  @Test
  void testBuild_Default() throws Exception {
    AuthBridgeServer server = new AuthBridgeServerBuilder(config).build();
    assertNotNull(server);
    server.stop();
  }

  @Test
  void testPort_Valid() throws Exception {
    AuthBridgeServer server = new AuthBridgeServerBuilder(config).port(8081).build();
    assertNotNull(server);
    server.stop();
  }

  @Test
  void testPort_Invalid() {
    AuthBridgeServerBuilder builder = new AuthBridgeServerBuilder(config);
    assertThrows(IllegalArgumentException.class, () -> builder.port(0));
    assertThrows(IllegalArgumentException.class, () -> builder.port(-1));
    assertThrows(IllegalArgumentException.class, () -> builder.port(65536));
  }

  @Test
  void testBuildProcessor_withInboundValidation() {
    ProcessorConfig validating =
        ProcessorConfig.builder()
            .tracingEnabled(false)
            .issuer("http://keycloak:8080/realms/demo")
            .tokenUrl("http://keycloak:8080/realms/demo/protocol/openid-connect/token")
            .build();
    StreamProcessor processor =
        new AuthBridgeServerBuilder(validating)
            .httpClient(new OkHttpClient())
            .configStore(new ConfigStore(validating))
            .buildProcessor(TracingBootstrap.start(validating));
    assertNotNull(processor);
  }

  @Test
  void testConstructor_NullConfig() {
    assertThrows(IllegalArgumentException.class, () -> new AuthBridgeServerBuilder(null));
  }
}
