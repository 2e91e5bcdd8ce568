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

import static com.brokerworks.consumer.impl.ExceptionUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.ConsumerException.ConnectionException;
import com.brokerworks.consumer.ConsumerException.ResourceClosedException;
import com.brokerworks.consumer.ConsumerException.SubscriptionException;
import java.util.concurrent.CompletableFuture;
import javax.net.ssl.SSLException;
import org.apache.qpid.protonj2.client.ErrorCondition;
import org.apache.qpid.protonj2.client.exceptions.*;
import org.junit.jupiter.api.Test;

public class ExceptionUtilsTest {

  @Test
  void convertTest() {
    assertThat(
            convert(
                new ClientSessionRemotelyClosedException(
                    "", errorCondition(ERROR_UNAUTHORIZED_ACCESS))))
        .isInstanceOf(ConsumerException.SecurityException.class);
    assertThat(
            convert(new ClientSessionRemotelyClosedException("", errorCondition(ERROR_NOT_FOUND))))
        .isInstanceOf(SubscriptionException.class);
    assertThat(convert(new ClientSessionRemotelyClosedException("")))
        .isInstanceOf(ResourceClosedException.class);
    assertThat(convert(new ClientLinkRemotelyClosedException("", errorCondition(ERROR_NOT_FOUND))))
        .isInstanceOf(SubscriptionException.class);
    assertThat(
            convert(
                new ClientLinkRemotelyClosedException("", errorCondition(ERROR_RESOURCE_DELETED))))
        .isInstanceOf(SubscriptionException.class);
    assertThat(
            convert(new ClientLinkRemotelyClosedException("", errorCondition(ERROR_INVALID_FIELD))))
        .isInstanceOf(SubscriptionException.class);
    assertThat(convert(new ClientLinkRemotelyClosedException("")))
        .isInstanceOf(ResourceClosedException.class);
    assertThat(convert(new ClientConnectionRemotelyClosedException("connection reset")))
        .isInstanceOf(ConnectionException.class);
    assertThat(
            convert(
                new ClientConnectionRemotelyClosedException(
                    "", errorCondition(ERROR_UNAUTHORIZED_ACCESS))))
        .isInstanceOf(ConsumerException.SecurityException.class);
    assertThat(convert(new ClientConnectionRemotelyClosedException("", new RuntimeException())))
        .isInstanceOf(ConnectionException.class)
        .hasCauseInstanceOf(ClientConnectionRemotelyClosedException.class);
    assertThat(convert(new ClientConnectionRemotelyClosedException("", new SSLException(""))))
        .isInstanceOf(ConsumerException.SecurityException.class)
        .hasCauseInstanceOf(SSLException.class);
    assertThat(convert(new ClientIOException("broken pipe")))
        .isInstanceOf(ConnectionException.class);
    assertThat(convert(new ClientException("")))
        .isInstanceOf(ConsumerException.class)
        .hasCauseInstanceOf(ClientException.class);

    assertThat(
            convert(
                new ClientIllegalStateException(
                    "The Receiver was explicitly closed",
                    new ClientLinkRemotelyClosedException(
                        "", errorCondition(ERROR_RESOURCE_DELETED)))))
        .isInstanceOf(SubscriptionException.class)
        .hasCauseInstanceOf(ClientLinkRemotelyClosedException.class);
  }

  @Test
  void convertShouldUseFormattedMessage() {
    assertThat(convert(new ClientIOException("broken pipe"), "Error for consumer '%s'", "orders"))
        .hasMessage("Error for consumer 'orders'")
        .hasCauseInstanceOf(ClientIOException.class);
  }

  @Test
  void connectionFailureShouldAlwaysBeConnectionOrSecurityException() {
    assertThat(convertConnectionFailure(new ClientException("boom"), "connect %s", "orders"))
        .isInstanceOf(ConnectionException.class)
        .hasMessage("connect orders");
    assertThat(
            convertConnectionFailure(
                new ClientIllegalStateException("illegal state"), "connect %s", "orders"))
        .isInstanceOf(ConnectionException.class);
    assertThat(
            convertConnectionFailure(
                new ClientConnectionRemotelyClosedException(
                    "", errorCondition(ERROR_UNAUTHORIZED_ACCESS)),
                "connect %s",
                "orders"))
        .isInstanceOf(ConsumerException.SecurityException.class);
  }

  @Test
  void subscriptionFailureShouldKeepConnectionAndSecurityTypes() {
    assertThat(convertSubscriptionFailure(new ClientException("boom"), "subscribe"))
        .isInstanceOf(SubscriptionException.class);
    assertThat(convertSubscriptionFailure(new ClientLinkRemotelyClosedException(""), "subscribe"))
        .isInstanceOf(SubscriptionException.class);
    assertThat(convertSubscriptionFailure(new ClientIOException("broken pipe"), "subscribe"))
        .isInstanceOf(ConnectionException.class);
    assertThat(
            convertSubscriptionFailure(
                new ClientLinkRemotelyClosedException(
                    "", errorCondition(ERROR_UNAUTHORIZED_ACCESS)),
                "subscribe"))
        .isInstanceOf(ConsumerException.SecurityException.class);
  }

  @Test
  void wrapGetShouldUnwrapClientException() {
    CompletableFuture<String> future = new CompletableFuture<>();
    future.completeExceptionally(new ClientIOException("broken pipe"));
    assertThatThrownBy(() -> wrapGet(future))
        .isInstanceOf(ClientIOException.class)
        .hasMessage("broken pipe");
  }

  @Test
  void wrapGetShouldReturnValue() throws Exception {
    assertThat(wrapGet(CompletableFuture.completedFuture("value"))).isEqualTo("value");
  }

  ErrorCondition errorCondition(String condition) {
    return ErrorCondition.create(condition, null);
  }
}
