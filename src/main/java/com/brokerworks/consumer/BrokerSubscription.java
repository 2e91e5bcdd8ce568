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
package com.brokerworks.consumer;

/** Subscription to a broker queue, the source of received messages. */
public interface BrokerSubscription extends AutoCloseable {

  /**
   * Wait for the next message.
   *
   * <p>Blocks until a message is available or the subscription fails, there is no timeout.
   *
   * @return the next message
   */
  Message receive();

  /**
   * Acknowledge the message, the broker stops tracking it.
   *
   * @param message a message received from this subscription
   */
  void accept(Message message);

  /**
   * Tell the broker the message cannot be processed, it applies its dead-letter policy.
   *
   * @param message a message received from this subscription
   */
  void reject(Message message);

  /**
   * Make the message available for redelivery.
   *
   * @param message a message received from this subscription
   * @param incrementDeliveryCount whether the delivery count of the message is incremented
   * @param undeliverableHere whether the message should not be redelivered to this consumer
   */
  void modify(Message message, boolean incrementDeliveryCount, boolean undeliverableHere);

  @Override
  void close();
}
