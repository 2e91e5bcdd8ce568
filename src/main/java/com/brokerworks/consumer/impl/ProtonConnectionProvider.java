// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.brokerworks.consumer.impl;

import com.brokerworks.consumer.BrokerConnection;
import com.brokerworks.consumer.ConnectionProvider;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.Endpoint;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.qpid.protonj2.client.Client;
import org.apache.qpid.protonj2.client.ClientOptions;
import org.apache.qpid.protonj2.client.Connection;
import org.apache.qpid.protonj2.client.ConnectionOptions;
import org.apache.qpid.protonj2.client.ReconnectOptions;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionProvider} backed by the Qpid ProtonJ2 client.
 *
 * <p>The first endpoint is the connection target, the other endpoints are failover locations.
 * Credentials come from the first endpoint. The client takes care of reconnecting when automatic
 * recovery is enabled, {@link BrokerConnection#isOpened()} reflects the outcome.
 */
public final class ProtonConnectionProvider implements ConnectionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonConnectionProvider.class);

  private final String idEndpoint;
  private final Client client;
  private final boolean automaticRecoveryEnabled;
  private final Duration initialReconnectDelay;
  private final Duration maxReconnectDelay;
  private final int maxReconnectAttempts;
  private final Duration connectTimeout;
  private final Duration idleTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ProtonConnectionProvider(Builder builder) {
    this.idEndpoint = builder.idEndpoint;
    this.automaticRecoveryEnabled = builder.automaticRecoveryEnabled;
    this.initialReconnectDelay = builder.initialReconnectDelay;
    this.maxReconnectDelay = builder.maxReconnectDelay;
    this.maxReconnectAttempts = builder.maxReconnectAttempts;
    this.connectTimeout = builder.connectTimeout;
    this.idleTimeout = builder.idleTimeout;
    String clientId =
        builder.clientIdSupplier == null
            ? defaultClientId(builder.idEndpoint)
            : builder.clientIdSupplier.get();
    this.client = Client.create(new ClientOptions().id(clientId));
  }

  public static Builder builder(String idEndpoint) {
    return new Builder(idEndpoint);
  }

  static String defaultClientId(String idEndpoint) {
    return idEndpoint + "_" + UUID.randomUUID();
  }

  @Override
  public BrokerConnection connect(List<Endpoint> endpoints) {
    if (this.closed.get()) {
      throw new ConsumerException.ResourceClosedException(
          "Connection provider of consumer '" + this.idEndpoint + "' is closed");
    }
    if (endpoints == null || endpoints.isEmpty()) {
      throw new IllegalArgumentException("At least one endpoint is required");
    }
    Endpoint target = endpoints.get(0);
    ProtonBrokerConnection.OpenState openState = new ProtonBrokerConnection.OpenState();
    ConnectionOptions options = this.connectionOptions(endpoints, openState);
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    Connection nativeConnection = null;
    try {
      LOGGER.trace("Connecting consumer '{}' to {}...", this.idEndpoint, target);
      nativeConnection = this.client.connect(target.host(), target.port(), options);
      ExceptionUtils.wrapGet(nativeConnection.openFuture());
      openState.opened();
      LOGGER.debug("Connection of consumer '{}' to {} succeeded", this.idEndpoint, target);
      return new ProtonBrokerConnection(this.idEndpoint, nativeConnection, openState);
    } catch (ClientException e) {
      Utils.maybeClose(
          nativeConnection,
          ex -> LOGGER.debug("Error while closing failed connection: {}", ex.getMessage()));
      throw ExceptionUtils.convertConnectionFailure(
          e, "Error while connecting consumer '%s' to %s", this.idEndpoint, target);
    } finally {
      LOGGER.debug(
          "Connection attempt for consumer '{}' took {}", this.idEndpoint, stopWatch.stop());
    }
  }

  ConnectionOptions connectionOptions(
      List<Endpoint> endpoints, ProtonBrokerConnection.OpenState openState) {
    Endpoint target = endpoints.get(0);
    ConnectionOptions options = new ConnectionOptions();
    if (target.user() != null) {
      options.user(target.user());
      options.password(target.password());
    }
    options.transportOptions().connectTimeout((int) this.connectTimeout.toMillis());
    options.idleTimeout(this.idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
    options.interruptedHandler(
        (connection, event) -> {
          LOGGER.info(
              "Connection of consumer '{}' interrupted: {}",
              this.idEndpoint,
              Utils.exceptionMessage(event.failureCause()));
          openState.interrupted();
        });
    options.reconnectedHandler(
        (connection, event) -> {
          LOGGER.info(
              "Connection of consumer '{}' re-established to {}:{}",
              this.idEndpoint,
              event.host(),
              event.port());
          openState.opened();
        });
    options.disconnectedHandler(
        (connection, event) -> {
          LOGGER.info(
              "Connection of consumer '{}' lost: {}",
              this.idEndpoint,
              Utils.exceptionMessage(event.failureCause()));
          openState.interrupted();
        });
    ReconnectOptions reconnectOptions = options.reconnectOptions();
    reconnectOptions.reconnectEnabled(this.automaticRecoveryEnabled);
    if (this.automaticRecoveryEnabled) {
      for (Endpoint failover : endpoints.subList(1, endpoints.size())) {
        reconnectOptions.addReconnectLocation(failover.host(), failover.port());
      }
      reconnectOptions.maxInitialConnectionAttempts(endpoints.size());
      reconnectOptions.maxReconnectAttempts(this.maxReconnectAttempts);
      reconnectOptions.reconnectDelay((int) this.initialReconnectDelay.toMillis());
      reconnectOptions.maxReconnectDelay((int) this.maxReconnectDelay.toMillis());
      reconnectOptions.useReconnectBackOff(true);
    }
    return options;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing connection provider of consumer '{}'", this.idEndpoint);
      this.client.close();
    }
  }

  public static final class Builder {

    private final String idEndpoint;
    private boolean automaticRecoveryEnabled = true;
    private Duration initialReconnectDelay = Duration.ofMillis(1);
    private Duration maxReconnectDelay = Duration.ofSeconds(30);
    private int maxReconnectAttempts = 10;
    private Duration connectTimeout = Duration.ofSeconds(15);
    private Duration idleTimeout = Duration.ofSeconds(60);
    private Supplier<String> clientIdSupplier;

    private Builder(String idEndpoint) {
      this.idEndpoint = idEndpoint;
    }

    /**
     * Let the client reconnect on its own after a connection failure.
     *
     * <p>Default is <code>true</code>. The supervising loop still rebuilds the consumer if the
     * client gives up.
     *
     * @param automaticRecoveryEnabled whether the client reconnects
     * @return this builder
     */
    public Builder automaticRecoveryEnabled(boolean automaticRecoveryEnabled) {
      this.automaticRecoveryEnabled = automaticRecoveryEnabled;
      return this;
    }

    /**
     * Delay before the first reconnection attempt, doubled on each attempt.
     *
     * <p>Default is 1 ms.
     *
     * @param initialReconnectDelay delay
     * @return this builder
     */
    public Builder initialReconnectDelay(Duration initialReconnectDelay) {
      this.initialReconnectDelay = initialReconnectDelay;
      return this;
    }

    public Builder maxReconnectDelay(Duration maxReconnectDelay) {
      this.maxReconnectDelay = maxReconnectDelay;
      return this;
    }

    public Builder maxReconnectAttempts(int maxReconnectAttempts) {
      this.maxReconnectAttempts = maxReconnectAttempts;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
     * Supplier of the AMQP container ID.
     *
     * <p>Default is <code>&lt;idEndpoint&gt;_&lt;random UUID&gt;</code>.
     *
     * @param clientIdSupplier client ID supplier
     * @return this builder
     */
    public Builder clientId(Supplier<String> clientIdSupplier) {
      this.clientIdSupplier = clientIdSupplier;
      return this;
    }

    public ProtonConnectionProvider build() {
      if (this.idEndpoint == null || this.idEndpoint.isBlank()) {
        throw new IllegalArgumentException("Endpoint identifier cannot be blank");
      }
      if (this.maxReconnectAttempts < 0) {
        throw new IllegalArgumentException("Max reconnect attempts cannot be negative");
      }
      return new ProtonConnectionProvider(this);
    }
  }
}
