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

import static com.brokerworks.consumer.impl.TestUtils.configuration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.brokerworks.consumer.BrokerSubscription;
import com.brokerworks.consumer.ConsumerConfiguration;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.RoutingType;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.qpid.protonj2.client.Connection;
import org.apache.qpid.protonj2.client.DeliveryMode;
import org.apache.qpid.protonj2.client.DurabilityMode;
import org.apache.qpid.protonj2.client.ErrorCondition;
import org.apache.qpid.protonj2.client.ExpiryPolicy;
import org.apache.qpid.protonj2.client.Receiver;
import org.apache.qpid.protonj2.client.ReceiverOptions;
import org.apache.qpid.protonj2.client.exceptions.ClientLinkRemotelyClosedException;
import org.apache.qpid.protonj2.types.DescribedType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class ProtonBrokerConnectionTest {

  @Mock Connection nativeConnection;
  @Mock Receiver receiver;

  ProtonBrokerConnection.OpenState openState;
  ProtonBrokerConnection connection;

  @BeforeEach
  void init() {
    openState = new ProtonBrokerConnection.OpenState();
    openState.opened();
    connection = new ProtonBrokerConnection("orders", nativeConnection, openState);
  }

  @Test
  void addressShouldBeFullyQualifiedWhenQueueIsSet() {
    assertThat(ProtonBrokerConnection.address(configuration("orders").build()))
        .isEqualTo("orders::orders.q");
    assertThat(ProtonBrokerConnection.address(configuration("orders").queue(null).build()))
        .isEqualTo("orders");
    assertThat(ProtonBrokerConnection.address(configuration("orders").address(null).build()))
        .isEqualTo("orders.q");
    assertThatThrownBy(
            () ->
                ProtonBrokerConnection.address(
                    configuration("orders").address(null).queue(null).build()))
        .isInstanceOf(ConsumerException.SubscriptionException.class);
  }

  @Test
  void capabilitiesShouldFollowRoutingTypeAndSharing() {
    assertThat(ProtonBrokerConnection.capabilities(configuration("orders").build()))
        .containsExactly("queue");
    assertThat(
            ProtonBrokerConnection.capabilities(
                configuration("orders").routingType(RoutingType.MULTICAST).build()))
        .containsExactly("topic");
    assertThat(
            ProtonBrokerConnection.capabilities(
                configuration("orders").routingType(RoutingType.MULTICAST).shared(true).build()))
        .containsExactly("topic", "shared", "global");
  }

  @Test
  void filtersShouldBeSetFromConfiguration() {
    assertThat(ProtonBrokerConnection.filters(configuration("orders").build())).isEmpty();

    Map<String, Object> filters =
        ProtonBrokerConnection.filters(
            configuration("orders").filterExpression("region = 'EU'").noLocalFilter(true).build());

    assertThat(filters).containsOnlyKeys("jms-selector", "no-local");
    DescribedType selector = (DescribedType) filters.get("jms-selector");
    assertThat(selector.getDescriptor())
        .isEqualTo(ProtonBrokerConnection.SELECTOR_FILTER_DESCRIPTOR);
    assertThat(selector.getDescribed()).isEqualTo("region = 'EU'");
    DescribedType noLocal = (DescribedType) filters.get("no-local");
    assertThat(noLocal.getDescriptor()).isEqualTo(ProtonBrokerConnection.NO_LOCAL_FILTER_DESCRIPTOR);
  }

  @Test
  void receiverOptionsShouldUseCreditAndManualSettlement() {
    ReceiverOptions options =
        ProtonBrokerConnection.receiverOptions(configuration("orders").credit(50).build());

    assertThat(options.creditWindow()).isEqualTo(50);
    assertThat(options.autoAccept()).isFalse();
    assertThat(options.autoSettle()).isFalse();
    assertThat(options.deliveryMode()).isEqualTo(DeliveryMode.AT_LEAST_ONCE);
    assertThat(options.sourceOptions().durabilityMode()).isEqualTo(DurabilityMode.NONE);
    assertThat(options.sourceOptions().expiryPolicy()).isEqualTo(ExpiryPolicy.LINK_CLOSE);
    assertThat(options.sourceOptions().capabilities()).containsExactly("queue");
  }

  @Test
  void durableReceiverOptionsShouldNeverExpire() {
    ReceiverOptions options =
        ProtonBrokerConnection.receiverOptions(configuration("orders").durable(true).build());

    assertThat(options.sourceOptions().durabilityMode()).isEqualTo(DurabilityMode.UNSETTLED_STATE);
    assertThat(options.sourceOptions().expiryPolicy()).isEqualTo(ExpiryPolicy.NEVER);
  }

  @Test
  void createSubscriptionShouldOpenReceiverOnAddress() throws Exception {
    ConsumerConfiguration configuration = configuration("orders").build();
    when(nativeConnection.openReceiver(eq("orders::orders.q"), any(ReceiverOptions.class)))
        .thenReturn(receiver);
    when(receiver.openFuture()).thenReturn(CompletableFuture.completedFuture(receiver));

    BrokerSubscription subscription = connection.createSubscription(configuration);

    assertThat(subscription).isInstanceOf(ProtonBrokerSubscription.class);
    verify(nativeConnection, never())
        .openDurableReceiver(anyString(), anyString(), any(ReceiverOptions.class));
  }

  @Test
  void createSubscriptionShouldOpenDurableReceiverNamedAfterQueue() throws Exception {
    ConsumerConfiguration configuration = configuration("orders").durable(true).build();
    when(nativeConnection.openDurableReceiver(
            eq("orders"), eq("orders.q"), any(ReceiverOptions.class)))
        .thenReturn(receiver);
    when(receiver.openFuture()).thenReturn(CompletableFuture.completedFuture(receiver));

    connection.createSubscription(configuration);

    verify(nativeConnection, times(1))
        .openDurableReceiver(eq("orders"), eq("orders.q"), any(ReceiverOptions.class));
  }

  @Test
  void refusedSubscriptionShouldFailWithSubscriptionException() throws Exception {
    when(nativeConnection.openReceiver(anyString(), any(ReceiverOptions.class)))
        .thenReturn(receiver);
    CompletableFuture<Receiver> openFuture = new CompletableFuture<>();
    openFuture.completeExceptionally(
        new ClientLinkRemotelyClosedException(
            "queue does not exist", ErrorCondition.create("amqp:not-found", null)));
    when(receiver.openFuture()).thenReturn(openFuture);

    assertThatThrownBy(() -> connection.createSubscription(configuration("orders").build()))
        .isInstanceOf(ConsumerException.SubscriptionException.class)
        .hasMessageContaining("orders::orders.q");
  }

  @Test
  void isOpenedShouldFollowOpenStateAndClose() {
    assertThat(connection.isOpened()).isTrue();
    openState.interrupted();
    assertThat(connection.isOpened()).isFalse();
    openState.opened();
    assertThat(connection.isOpened()).isTrue();

    connection.close();
    connection.close();

    assertThat(connection.isOpened()).isFalse();
    verify(nativeConnection, times(1)).close();
    assertThatThrownBy(() -> connection.createSubscription(configuration("orders").build()))
        .isInstanceOf(ConsumerException.ResourceClosedException.class);
  }
}
