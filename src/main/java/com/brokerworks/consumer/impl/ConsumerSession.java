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
import com.brokerworks.consumer.BrokerSubscription;
import com.brokerworks.consumer.ConnectionProvider;
import com.brokerworks.consumer.ConsumerConfiguration;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.CorrelationContext;
import com.brokerworks.consumer.DeliveryOutcome;
import com.brokerworks.consumer.InvalidDeliveryOutcomeException;
import com.brokerworks.consumer.Message;
import com.brokerworks.consumer.MessageHandler;
import com.brokerworks.consumer.metrics.MetricsCollector;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connection and one subscription for a consumer.
 *
 * <p>A session goes from not created to created and then to disposed. A disposed session cannot be
 * used anymore, the supervising loop creates a new session for each attempt.
 *
 * <p>Not thread-safe, except for {@link #isRunning()} and {@link #close()}.
 */
final class ConsumerSession implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerSession.class);

  private final ConsumerConfiguration configuration;
  private final ConnectionProvider connectionProvider;
  private final MessageHandler messageHandler;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile BrokerConnection connection;
  private volatile BrokerSubscription subscription;
  private volatile Message lastReceived;
  private volatile boolean handling = false;

  ConsumerSession(
      ConsumerConfiguration configuration,
      ConnectionProvider connectionProvider,
      MessageHandler messageHandler,
      MetricsCollector metricsCollector) {
    this.configuration = configuration;
    this.connectionProvider = connectionProvider;
    this.messageHandler = messageHandler;
    this.metricsCollector = metricsCollector;
  }

  void createConsumer() {
    checkNotClosed();
    if (this.isRunning()) {
      return;
    }
    // handles from a previous broken attempt
    this.releaseHandles();
    LOGGER.debug(
        "Creating consumer '{}' on {} endpoint(s)",
        this.configuration.idEndpoint(),
        this.configuration.endpoints().size());
    BrokerConnection c = this.connectionProvider.connect(this.configuration.endpoints());
    this.connection = c;
    this.subscription = c.createSubscription(this.configuration);
    this.metricsCollector.openConsumer();
    if (this.closed.get()) {
      // closed from another thread while connecting
      this.releaseHandles();
      checkNotClosed();
    }
  }

  void receiveMessage(CorrelationContext correlation) throws Exception {
    checkNotClosed();
    BrokerSubscription s = this.subscription;
    if (s == null) {
      throw new ConsumerException.ResourceInvalidStateException(
          "Consumer '%s' is not created", this.configuration.idEndpoint());
    }
    Message message = s.receive();
    this.lastReceived = message;
    this.metricsCollector.consume();
    this.handling = true;
    try {
      this.messageHandler.handle(new DeliveryContext(message, correlation), message);
    } catch (Exception | Error e) {
      this.metricsCollector.handlerFailure();
      throw e;
    } finally {
      this.handling = false;
    }
  }

  void delivery(Message message, DeliveryOutcome outcome, boolean undeliverableHere) {
    if (outcome == null) {
      throw new InvalidDeliveryOutcomeException(null);
    }
    checkNotClosed();
    BrokerSubscription s = this.subscription;
    if (s == null) {
      throw new ConsumerException.ResourceInvalidStateException(
          "Consumer '%s' is not created", this.configuration.idEndpoint());
    }
    if (message == null || message != this.lastReceived) {
      throw new ConsumerException.ResourceInvalidStateException(
          "Message does not come from the last receive of consumer '%s'",
          this.configuration.idEndpoint());
    }
    switch (outcome) {
      case ACCEPT:
        s.accept(message);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
        break;
      case REJECT:
        s.reject(message);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.REJECTED);
        break;
      case RELEASE:
        s.modify(message, false, undeliverableHere);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.RELEASED);
        break;
      case RETRY:
        s.modify(message, true, undeliverableHere);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.RETRIED);
        break;
      default:
        throw new InvalidDeliveryOutcomeException(outcome);
    }
  }

  void accept(Message message) {
    this.delivery(message, DeliveryOutcome.ACCEPT, false);
  }

  void reject(Message message) {
    this.delivery(message, DeliveryOutcome.REJECT, false);
  }

  void release(Message message) {
    this.release(message, false);
  }

  void release(Message message, boolean undeliverableHere) {
    this.delivery(message, DeliveryOutcome.RELEASE, undeliverableHere);
  }

  void retry(Message message) {
    this.retry(message, false);
  }

  void retry(Message message, boolean undeliverableHere) {
    this.delivery(message, DeliveryOutcome.RETRY, undeliverableHere);
  }

  boolean isRunning() {
    BrokerConnection c = this.connection;
    return c != null && this.subscription != null && c.isOpened();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.releaseHandles();
      this.lastReceived = null;
    }
  }

  boolean isHandling() {
    return this.handling;
  }

  boolean isClosed() {
    return this.closed.get();
  }

  Message lastReceived() {
    return this.lastReceived;
  }

  private void releaseHandles() {
    BrokerSubscription s = this.subscription;
    BrokerConnection c = this.connection;
    this.subscription = null;
    this.connection = null;
    if (s != null) {
      Utils.maybeClose(
          s,
          e ->
              LOGGER.warn(
                  "Error while closing subscription of consumer '{}': {}",
                  this.configuration.idEndpoint(),
                  Utils.exceptionMessage(e)));
      this.metricsCollector.closeConsumer();
    }
    Utils.maybeClose(
        c,
        e ->
            LOGGER.warn(
                "Error while closing connection of consumer '{}': {}",
                this.configuration.idEndpoint(),
                Utils.exceptionMessage(e)));
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new ConsumerException.ResourceClosedException(
          "Consumer session '" + this.configuration.idEndpoint() + "' is closed");
    }
  }

  private final class DeliveryContext implements MessageHandler.Context {

    private final Message message;
    private final CorrelationContext correlation;

    private DeliveryContext(Message message, CorrelationContext correlation) {
      this.message = message;
      this.correlation = correlation;
    }

    @Override
    public CorrelationContext correlation() {
      return this.correlation;
    }

    @Override
    public void accept() {
      ConsumerSession.this.accept(this.message);
    }

    @Override
    public void reject() {
      ConsumerSession.this.reject(this.message);
    }

    @Override
    public void release() {
      ConsumerSession.this.release(this.message);
    }

    @Override
    public void release(boolean undeliverableHere) {
      ConsumerSession.this.release(this.message, undeliverableHere);
    }

    @Override
    public void retry() {
      ConsumerSession.this.retry(this.message);
    }

    @Override
    public void retry(boolean undeliverableHere) {
      ConsumerSession.this.retry(this.message, undeliverableHere);
    }

    @Override
    public void delivery(DeliveryOutcome outcome, boolean undeliverableHere) {
      ConsumerSession.this.delivery(this.message, outcome, undeliverableHere);
    }
  }
}
