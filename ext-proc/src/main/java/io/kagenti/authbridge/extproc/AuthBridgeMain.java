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

import io.kagenti.authbridge.config.ConfigStore;
import io.kagenti.authbridge.config.ProcessorConfig;
import io.kagenti.authbridge.config.ProcessorProperties;
import io.kagenti.authbridge.config.TokenExchangeFailurePolicy;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point: loads the configuration, waits for credentials and serves ext_proc. */
public final class AuthBridgeMain {

  private static final Logger logger = LoggerFactory.getLogger(AuthBridgeMain.class);

  private AuthBridgeMain() {}

  public static void main(String[] args) throws IOException, InterruptedException {
    ProcessorConfig config = ProcessorConfig.fromProperties(ProcessorProperties.fromEnvironment());

    ConfigStore configStore = new ConfigStore(config);
    if (config.clientId().isEmpty() || config.clientSecret().isEmpty()) {
      configStore.awaitCredentialFiles(config.credentialsWait());
    } else {
      configStore.reload();
    }
    if (config.tokenExchangeFailurePolicy() == TokenExchangeFailurePolicy.FORWARD_ORIGINAL) {
      logger.warn(
          "Outbound requests keep their original token when token exchange fails;"
              + " set TOKEN_EXCHANGE_FAILURE_POLICY=deny to reject them instead");
    }

    AuthBridgeServer server =
        new AuthBridgeServerBuilder(config).configStore(configStore).build();
    server.start();
  }
}
