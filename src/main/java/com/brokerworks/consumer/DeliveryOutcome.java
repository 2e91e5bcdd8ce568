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

/** Disposition a consumer gives to a received message. */
public enum DeliveryOutcome {

  /**
   * The message has been processed (AMQP 1.0 <code>accepted</code> outcome).
   *
   * <p>The broker removes it from its redelivery tracking.
   */
  ACCEPT,

  /**
   * The message is malformed or cannot be processed (AMQP 1.0 <code>rejected</code> outcome).
   *
   * <p>The broker applies its dead-letter policy.
   */
  REJECT,

  /**
   * The message cannot be processed now but can be redelivered later, delivery count unchanged
   * (AMQP 1.0 <code>modified{delivery-failed = false}</code> outcome).
   */
  RELEASE,

  /**
   * The message cannot be processed now but can be redelivered later, delivery count incremented
   * (AMQP 1.0 <code>modified{delivery-failed = true}</code> outcome).
   *
   * <p>Lets downstream policies detect poison messages with their delivery count.
   */
  RETRY
}
