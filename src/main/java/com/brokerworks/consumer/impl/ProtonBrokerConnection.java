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
import com.brokerworks.consumer.ConsumerConfiguration;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.RoutingType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.qpid.protonj2.client.Connection;
import org.apache.qpid.protonj2.client.DeliveryMode;
import org.apache.qpid.protonj2.client.DurabilityMode;
import org.apache.qpid.protonj2.client.ExpiryPolicy;
import org.apache.qpid.protonj2.client.Receiver;
import org.apache.qpid.protonj2.client.ReceiverOptions;
import org.apache.qpid.protonj2.client.SourceOptions;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.types.Symbol;
import org.apache.qpid.protonj2.types.UnknownDescribedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ProtonBrokerConnection implements BrokerConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonBrokerConnection.class);

  static final String QUEUE_CAPABILITY = "queue";
  static final String TOPIC_CAPABILITY = "topic";
  static final String SHARED_CAPABILITY = "shared";
  static final String GLOBAL_CAPABILITY = "global";
  static final String SELECTOR_FILTER_NAME = "jms-selector";
  static final Symbol SELECTOR_FILTER_DESCRIPTOR =
      Symbol.getSymbol("apache.org:selector-filter:string");
  static final String NO_LOCAL_FILTER_NAME = "no-local";
  static final Symbol NO_LOCAL_FILTER_DESCRIPTOR =
      Symbol.getSymbol("apache.org:no-local-filter:list");
  static final String FQQN_SEPARATOR = "::";

  private final String idEndpoint;
  private final Connection nativeConnection;
  private final OpenState openState;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ProtonBrokerConnection(String idEndpoint, Connection nativeConnection, OpenState openState) {
    this.idEndpoint = idEndpoint;
    this.nativeConnection = nativeConnection;
    this.openState = openState;
  }

  @Override
  public BrokerSubscription createSubscription(ConsumerConfiguration configuration) {
    if (this.closed.get()) {
      throw new ConsumerException.ResourceClosedException(
          "Connection of consumer '" + this.idEndpoint + "' is closed");
    }
    String address = address(configuration);
    ReceiverOptions options = receiverOptions(configuration);
    try {
      Receiver receiver;
      if (configuration.durable() && hasText(configuration.queue())) {
        LOGGER.debug(
            "Opening durable subscription '{}' on '{}' for consumer '{}'",
            configuration.queue(),
            configuration.address(),
            this.idEndpoint);
        receiver =
            this.nativeConnection.openDurableReceiver(
                configuration.address(), configuration.queue(), options);
      } else {
        LOGGER.debug("Opening receiver on '{}' for consumer '{}'", address, this.idEndpoint);
        receiver = this.nativeConnection.openReceiver(address, options);
      }
      ExceptionUtils.wrapGet(receiver.openFuture());
      return new ProtonBrokerSubscription(this.idEndpoint, receiver);
    } catch (ClientException e) {
      throw ExceptionUtils.convertSubscriptionFailure(
          e, "Error while subscribing consumer '%s' to '%s'", this.idEndpoint, address);
    }
  }

  @Override
  public boolean isOpened() {
    return !this.closed.get() && this.openState.isOpened();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.openState.interrupted();
      try {
        this.nativeConnection.close();
      } catch (Exception e) {
        LOGGER.warn("Error while closing connection of consumer '{}'", this.idEndpoint, e);
      }
    }
  }

  static String address(ConsumerConfiguration configuration) {
    String address = configuration.address();
    String queue = configuration.queue();
    if (hasText(queue)) {
      return hasText(address) ? address + FQQN_SEPARATOR + queue : queue;
    } else if (hasText(address)) {
      return address;
    } else {
      throw new ConsumerException.SubscriptionException(
          "Consumer '%s' has neither address nor queue", configuration.idEndpoint());
    }
  }

  static ReceiverOptions receiverOptions(ConsumerConfiguration configuration) {
    ReceiverOptions options =
        new ReceiverOptions()
            .deliveryMode(DeliveryMode.AT_LEAST_ONCE)
            .autoAccept(false)
            .autoSettle(false)
            .creditWindow(configuration.credit());
    SourceOptions sourceOptions = options.sourceOptions();
    sourceOptions.capabilities(capabilities(configuration).toArray(new String[0]));
    Map<String, Object> filters = filters(configuration);
    if (!filters.isEmpty()) {
      sourceOptions.filters(filters);
    }
    if (configuration.durable()) {
      sourceOptions.durabilityMode(DurabilityMode.UNSETTLED_STATE).expiryPolicy(ExpiryPolicy.NEVER);
    } else {
      sourceOptions.durabilityMode(DurabilityMode.NONE).expiryPolicy(ExpiryPolicy.LINK_CLOSE);
    }
    return options;
  }

  static List<String> capabilities(ConsumerConfiguration configuration) {
    List<String> capabilities = new ArrayList<>(3);
    capabilities.add(
        configuration.routingType() == RoutingType.MULTICAST ? TOPIC_CAPABILITY : QUEUE_CAPABILITY);
    if (configuration.shared()) {
      capabilities.add(SHARED_CAPABILITY);
      capabilities.add(GLOBAL_CAPABILITY);
    }
    return capabilities;
  }

  static Map<String, Object> filters(ConsumerConfiguration configuration) {
    Map<String, Object> filters = new LinkedHashMap<>();
    if (hasText(configuration.filterExpression())) {
      filters.put(
          SELECTOR_FILTER_NAME,
          new UnknownDescribedType(SELECTOR_FILTER_DESCRIPTOR, configuration.filterExpression()));
    }
    if (configuration.noLocalFilter()) {
      filters.put(
          NO_LOCAL_FILTER_NAME,
          new UnknownDescribedType(NO_LOCAL_FILTER_DESCRIPTOR, "NoLocalFilter{}"));
    }
    return Collections.unmodifiableMap(filters);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  /** Open flag of a native connection, updated by the client connection callbacks. */
  static final class OpenState {

    private final AtomicBoolean opened = new AtomicBoolean(false);

    void opened() {
      this.opened.set(true);
    }

    void interrupted() {
      this.opened.set(false);
    }

    boolean isOpened() {
      return this.opened.get();
    }
  }
}
