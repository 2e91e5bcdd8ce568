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

import com.brokerworks.consumer.BrokerSubscription;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.Message;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.qpid.protonj2.client.Delivery;
import org.apache.qpid.protonj2.client.DeliveryState;
import org.apache.qpid.protonj2.client.Receiver;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ProtonBrokerSubscription implements BrokerSubscription {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonBrokerSubscription.class);

  private static final DeliveryState REJECTED = DeliveryState.rejected(null, null);

  private final String idEndpoint;
  private final Receiver nativeReceiver;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ProtonBrokerSubscription(String idEndpoint, Receiver nativeReceiver) {
    this.idEndpoint = idEndpoint;
    this.nativeReceiver = nativeReceiver;
  }

  @Override
  public Message receive() {
    while (true) {
      Delivery delivery;
      try {
        delivery = this.nativeReceiver.receive();
      } catch (ClientException e) {
        throw ExceptionUtils.convert(
            e, "Error while receiving message for consumer '%s'", this.idEndpoint);
      }
      if (delivery == null) {
        throw new ConsumerException.ResourceClosedException(
            "Receiver of consumer '" + this.idEndpoint + "' closed while waiting for a message");
      }
      ProtonMessage message = message(delivery);
      if (message != null) {
        return message;
      }
    }
  }

  @Override
  public void accept(Message message) {
    try {
      delivery(message).accept();
    } catch (ClientException e) {
      throw ExceptionUtils.convert(e, "Error while accepting message");
    }
  }

  @Override
  public void reject(Message message) {
    try {
      delivery(message).disposition(REJECTED, true);
    } catch (ClientException e) {
      throw ExceptionUtils.convert(e, "Error while rejecting message");
    }
  }

  @Override
  public void modify(Message message, boolean incrementDeliveryCount, boolean undeliverableHere) {
    try {
      delivery(message).modified(incrementDeliveryCount, undeliverableHere);
    } catch (ClientException e) {
      throw ExceptionUtils.convert(e, "Error while modifying message");
    }
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      try {
        this.nativeReceiver.close();
      } catch (Exception e) {
        LOGGER.warn("Error while closing receiver of consumer '{}'", this.idEndpoint, e);
      }
    }
  }

  private static Delivery delivery(Message message) {
    if (message instanceof ProtonMessage) {
      return ((ProtonMessage) message).delivery();
    } else {
      throw new IllegalArgumentException(
          "Message does not come from this subscription: " + message);
    }
  }

  private ProtonMessage message(Delivery delivery) {
    try {
      return new ProtonMessage(delivery, delivery.message());
    } catch (ClientException e) {
      LOGGER.warn(
          "Error while decoding message for consumer '{}': {}", this.idEndpoint, e.getMessage());
      try {
        delivery.disposition(REJECTED, true);
      } catch (ClientException ex) {
        LOGGER.warn("Error while rejecting non-decoded message: {}", ex.getMessage());
      }
      return null;
    }
  }
}
