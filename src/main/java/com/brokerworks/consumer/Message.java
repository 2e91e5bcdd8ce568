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

import java.util.Map;

/**
 * Read-only view of a message received from the broker.
 *
 * <p>Instances are bound to the subscription that produced them, dispositions go through {@link
 * MessageHandler.Context} or the subscription.
 */
public interface Message {

  /**
   * Message ID, can be null.
   *
   * @return the message ID
   */
  Object messageId();

  /**
   * Correlation ID set by the publisher, can be null.
   *
   * <p>Not to be confused with the {@link CorrelationContext} of the consumer logs.
   *
   * @return the correlation ID of the message
   */
  Object correlationId();

  String subject();

  String contentType();

  /**
   * Body of the message, as decoded by the broker client.
   *
   * @return the body, can be null
   */
  Object body();

  /**
   * Body of the message as a byte array.
   *
   * <p>Binary bodies are returned as is, string bodies are encoded in UTF-8.
   *
   * @return the body as a byte array, empty if there is no body
   */
  byte[] bodyAsBinary();

  /**
   * Body of the message as a string.
   *
   * <p>Binary bodies are decoded as UTF-8.
   *
   * @return the body as a string, null if there is no body
   */
  String bodyAsString();

  Object property(String key);

  /**
   * Application properties of the message.
   *
   * @return an immutable copy of the properties, empty if there is none
   */
  Map<String, Object> properties();

  boolean durable();

  byte priority();

  /**
   * Number of prior unsuccessful delivery attempts, as tracked by the broker.
   *
   * @return the delivery count
   */
  long deliveryCount();
}
