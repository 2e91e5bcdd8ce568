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
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.brokerworks.consumer.metrics.NoOpMetricsCollector;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class ConsumerSessionTest {

  @Mock ConnectionProvider connectionProvider;
  @Mock BrokerConnection connection;
  @Mock BrokerSubscription subscription;
  @Mock MessageHandler handler;
  @Mock Message message;

  ConsumerConfiguration configuration;
  CorrelationContext correlation;
  ConsumerSession session;

  @BeforeEach
  void init() {
    configuration = configuration("orders").build();
    correlation = CorrelationContext.create("orders", () -> "correlation-1");
    session =
        new ConsumerSession(
            configuration, connectionProvider, handler, NoOpMetricsCollector.INSTANCE);
  }

  @Test
  void createConsumerShouldBeIdempotentWhenRunning() {
    when(connectionProvider.connect(anyList())).thenReturn(connection);
    when(connection.createSubscription(configuration)).thenReturn(subscription);
    when(connection.isOpened()).thenReturn(true);

    session.createConsumer();
    session.createConsumer();
    session.createConsumer();

    verify(connectionProvider, times(1)).connect(configuration.endpoints());
    verify(connection, times(1)).createSubscription(configuration);
    assertThat(session.isRunning()).isTrue();
  }

  @Test
  void createConsumerShouldReplaceBrokenHandles() {
    when(connectionProvider.connect(anyList())).thenReturn(connection);
    when(connection.createSubscription(configuration)).thenReturn(subscription);
    when(connection.isOpened()).thenReturn(false);

    session.createConsumer();
    session.createConsumer();

    verify(connectionProvider, times(2)).connect(configuration.endpoints());
    verify(subscription, times(1)).close();
    verify(connection, times(1)).close();
  }

  @Test
  void isRunningShouldBeFalseWithoutHandles() {
    assertThat(session.isRunning()).isFalse();
    verifyNoInteractions(connectionProvider);
  }

  @Test
  void isRunningShouldFollowConnectionStateWithoutClose() {
    when(connectionProvider.connect(anyList())).thenReturn(connection);
    when(connection.createSubscription(configuration)).thenReturn(subscription);
    when(connection.isOpened()).thenReturn(true, false);

    session.createConsumer();

    assertThat(session.isRunning()).isTrue();
    assertThat(session.isRunning()).isFalse();
    verify(connection, never()).close();
    verify(subscription, never()).close();
  }

  @Test
  void createConsumerShouldPropagateConnectionFailure() {
    when(connectionProvider.connect(anyList()))
        .thenThrow(new ConsumerException.ConnectionException("connection refused"));

    assertThatThrownBy(() -> session.createConsumer())
        .isInstanceOf(ConsumerException.ConnectionException.class);
    assertThat(session.isRunning()).isFalse();
    assertThatThrownBy(() -> session.receiveMessage(correlation))
        .isInstanceOf(ConsumerException.ResourceInvalidStateException.class);
  }

  @Test
  void createConsumerShouldPropagateSubscriptionFailureAndKeepConnectionForClose() {
    when(connectionProvider.connect(anyList())).thenReturn(connection);
    when(connection.createSubscription(configuration))
        .thenThrow(new ConsumerException.SubscriptionException("queue not found"));

    assertThatThrownBy(() -> session.createConsumer())
        .isInstanceOf(ConsumerException.SubscriptionException.class);
    assertThat(session.isRunning()).isFalse();
    assertThatThrownBy(() -> session.receiveMessage(correlation))
        .isInstanceOf(ConsumerException.ResourceInvalidStateException.class);

    session.close();
    verify(connection, times(1)).close();
  }

  @Test
  void receiveMessageShouldCallHandlerOnceWithMessage() throws Exception {
    createConsumer();
    when(subscription.receive()).thenReturn(message);
    AtomicReference<CorrelationContext> handlerCorrelation = new AtomicReference<>();
    doAnswer(
            invocation -> {
              MessageHandler.Context context = invocation.getArgument(0);
              handlerCorrelation.set(context.correlation());
              return null;
            })
        .when(handler)
        .handle(any(), eq(message));

    session.receiveMessage(correlation);

    verify(handler, times(1)).handle(any(), eq(message));
    assertThat(handlerCorrelation.get()).isSameAs(correlation);
    assertThat(session.lastReceived()).isSameAs(message);
  }

  @Test
  void receiveMessageShouldPropagateHandlerFailureAndLeaveMessageUnsettled() throws Exception {
    createConsumer();
    when(subscription.receive()).thenReturn(message);
    doThrow(new Exception("handler failure")).when(handler).handle(any(), eq(message));

    assertThatThrownBy(() -> session.receiveMessage(correlation))
        .isInstanceOf(Exception.class)
        .hasMessage("handler failure");
    verify(subscription, never()).accept(any());
    verify(subscription, never()).reject(any());
    verify(subscription, never()).modify(any(), anyBoolean(), anyBoolean());
  }

  @Test
  void receiveMessageShouldFailIfConsumerNotCreated() {
    assertThatThrownBy(() -> session.receiveMessage(correlation))
        .isInstanceOf(ConsumerException.ResourceInvalidStateException.class);
    verifyNoInteractions(handler);
  }

  @Test
  void handlerContextShouldSettleReceivedMessage() throws Exception {
    createConsumer();
    when(subscription.receive()).thenReturn(message);
    doAnswer(
            invocation -> {
              MessageHandler.Context context = invocation.getArgument(0);
              context.accept();
              return null;
            })
        .when(handler)
        .handle(any(), eq(message));

    session.receiveMessage(correlation);

    verify(subscription, times(1)).accept(message);
  }

  @Test
  void retryAndReleaseShouldOnlyDifferOnDeliveryCountIncrement() throws Exception {
    receive();

    session.retry(message);
    session.release(message);

    verify(subscription).modify(message, true, false);
    verify(subscription).modify(message, false, false);
  }

  @Test
  void undeliverableHereFlagShouldBePassedToBroker() throws Exception {
    receive();

    session.retry(message, true);
    session.release(message, true);
    session.delivery(message, DeliveryOutcome.RELEASE, false);

    verify(subscription).modify(message, true, true);
    verify(subscription).modify(message, false, true);
    verify(subscription).modify(message, false, false);
  }

  @Test
  void acceptAndRejectShouldCallBroker() throws Exception {
    receive();

    session.accept(message);
    session.reject(message);

    verify(subscription).accept(message);
    verify(subscription).reject(message);
  }

  @Test
  void deliveryWithNullOutcomeShouldFailWithoutBrokerCall() throws Exception {
    receive();

    assertThatThrownBy(() -> session.delivery(message, null, false))
        .isInstanceOf(InvalidDeliveryOutcomeException.class)
        .isInstanceOf(IllegalArgumentException.class);
    verify(subscription, never()).accept(any());
    verify(subscription, never()).reject(any());
    verify(subscription, never()).modify(any(), anyBoolean(), anyBoolean());
  }

  @Test
  void deliveryWithNullOutcomeShouldFailEvenWithoutSubscription() {
    assertThatThrownBy(() -> session.delivery(message, null, false))
        .isInstanceOf(InvalidDeliveryOutcomeException.class);
    verifyNoInteractions(connectionProvider);
  }

  @Test
  void deliveryOnMessageFromAnotherReceiveShouldFail() throws Exception {
    receive();
    Message otherMessage = org.mockito.Mockito.mock(Message.class);

    assertThatThrownBy(() -> session.accept(otherMessage))
        .isInstanceOf(ConsumerException.ResourceInvalidStateException.class);
    verify(subscription, never()).accept(any());
  }

  @Test
  void deliveryWithoutSubscriptionShouldFail() {
    assertThatThrownBy(() -> session.accept(message))
        .isInstanceOf(ConsumerException.ResourceInvalidStateException.class);
  }

  @Test
  void closeShouldReleaseSubscriptionThenConnectionEvenIfSubscriptionCloseFails() {
    createConsumer();
    doThrow(new IllegalStateException("subscription close failure")).when(subscription).close();

    session.close();
    session.close();

    InOrder inOrder = inOrder(subscription, connection);
    inOrder.verify(subscription).close();
    inOrder.verify(connection).close();
    verify(subscription, times(1)).close();
    verify(connection, times(1)).close();
    assertThat(session.isRunning()).isFalse();
    assertThat(session.isClosed()).isTrue();
  }

  @Test
  void closeOnNeverCreatedSessionShouldDoNothing() {
    session.close();
    session.close();
    verifyNoInteractions(connectionProvider);
    assertThat(session.isRunning()).isFalse();
  }

  @Test
  void operationsOnClosedSessionShouldFail() throws Exception {
    receive();
    session.close();

    assertThatThrownBy(() -> session.createConsumer())
        .isInstanceOf(ConsumerException.ResourceClosedException.class);
    assertThatThrownBy(() -> session.receiveMessage(correlation))
        .isInstanceOf(ConsumerException.ResourceClosedException.class);
    assertThatThrownBy(() -> session.accept(message))
        .isInstanceOf(ConsumerException.ResourceClosedException.class);
    assertThat(session.isRunning()).isFalse();
  }

  @Test
  void metricsShouldBeUpdatedAlongTheLifecycle() throws Exception {
    MetricsCollector metrics = org.mockito.Mockito.mock(MetricsCollector.class);
    session = new ConsumerSession(configuration, connectionProvider, handler, metrics);
    receive();
    session.accept(message);
    session.close();

    InOrder inOrder = inOrder(metrics);
    inOrder.verify(metrics).openConsumer();
    inOrder.verify(metrics).consume();
    inOrder.verify(metrics).consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
    inOrder.verify(metrics).closeConsumer();
  }

  @Test
  void handlerFailureShouldBeCounted() throws Exception {
    MetricsCollector metrics = org.mockito.Mockito.mock(MetricsCollector.class);
    session = new ConsumerSession(configuration, connectionProvider, handler, metrics);
    createConsumer();
    when(subscription.receive()).thenReturn(message);
    doThrow(new IllegalStateException()).when(handler).handle(any(), eq(message));

    assertThatThrownBy(() -> session.receiveMessage(correlation))
        .isInstanceOf(IllegalStateException.class);
    verify(metrics).handlerFailure();
  }

  private void createConsumer() {
    when(connectionProvider.connect(anyList())).thenReturn(connection);
    when(connection.createSubscription(configuration)).thenReturn(subscription);
    session.createConsumer();
  }

  private void receive() throws Exception {
    createConsumer();
    when(subscription.receive()).thenReturn(message);
    session.receiveMessage(correlation);
  }
}
