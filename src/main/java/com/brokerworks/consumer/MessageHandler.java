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

/**
 * Application logic that processes one received message.
 *
 * <p>The handler is called exactly once per received message. Failures are not caught by the
 * consumer session, they reach the supervising loop which disposes the session and retries after
 * the configured delay. The message is then left unsettled and the broker redelivers it.
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Process a message.
   *
   * @param context delivery and correlation context
   * @param message the received message
   * @throws Exception if the message cannot be processed
   */
  void handle(Context context, Message message) throws Exception;

  /** Context of a received message: dispositions and correlation. */
  interface Context {

    /**
     * Correlation context of the current processing, to use in application logs.
     *
     * @return the correlation context
     */
    CorrelationContext correlation();

    /** Accept the message (AMQP 1.0 <code>accepted</code> outcome). */
    void accept();

    /** Reject the message, it is malformed (AMQP 1.0 <code>rejected</code> outcome). */
    void reject();

    /** Release the message without incrementing its delivery count. */
    void release();

    /**
     * Release the message without incrementing its delivery count.
     *
     * @param undeliverableHere whether this consumer cannot handle the message
     */
    void release(boolean undeliverableHere);

    /** Release the message and increment its delivery count. */
    void retry();

    /**
     * Release the message and increment its delivery count.
     *
     * @param undeliverableHere whether this consumer cannot handle the message
     */
    void retry(boolean undeliverableHere);

    /**
     * Give an outcome to the message.
     *
     * @param outcome the outcome
     * @param undeliverableHere whether this consumer cannot handle the message, used only for
     *     {@link DeliveryOutcome#RELEASE} and {@link DeliveryOutcome#RETRY}
     * @throws InvalidDeliveryOutcomeException if the outcome is not supported
     */
    void delivery(DeliveryOutcome outcome, boolean undeliverableHere);
  }
}
