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

import com.brokerworks.consumer.ConnectionProvider;
import com.brokerworks.consumer.ConsumerEnvironment;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.SupervisedConsumer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConsumerEnvironment implements ConsumerEnvironment {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumerEnvironment.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final List<ConsumerBackgroundService> consumers;
  private final List<ConnectionProvider> connectionProviders;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  AmqpConsumerEnvironment(
      List<ConsumerBackgroundService> consumers, List<ConnectionProvider> connectionProviders) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.consumers = List.copyOf(consumers);
    this.connectionProviders = List.copyOf(connectionProviders);
  }

  @Override
  public void start() {
    if (this.closed.get()) {
      throw new ConsumerException.ResourceClosedException("Environment is closed");
    }
    if (this.started.compareAndSet(false, true)) {
      LOGGER.debug("Starting {} consumer(s) in environment {}", this.consumers.size(), this);
      this.consumers.forEach(ConsumerBackgroundService::start);
    }
  }

  @Override
  public List<SupervisedConsumer> consumers() {
    return Collections.unmodifiableList(new ArrayList<>(this.consumers));
  }

  @Override
  public SupervisedConsumer consumer(String idEndpoint) {
    for (ConsumerBackgroundService consumer : this.consumers) {
      if (consumer.idEndpoint().equals(idEndpoint)) {
        return consumer;
      }
    }
    throw new IllegalArgumentException("No consumer registered for endpoint " + idEndpoint);
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing environment {}", this);
      for (ConsumerBackgroundService consumer : this.consumers) {
        try {
          consumer.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing consumer '{}'", consumer.idEndpoint(), e);
        }
      }
      for (ConnectionProvider provider : this.connectionProviders) {
        Utils.maybeClose(provider, e -> LOGGER.warn("Error while closing connection provider", e));
      }
      LOGGER.debug("Environment {} has been closed", this);
    }
  }

  @Override
  public String toString() {
    return "amqp-consumer-environment-" + this.id;
  }
}
