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
 * Long-running task that keeps one consumer subscribed and consuming.
 *
 * <p>Failures while creating the consumer or processing a message never stop the task: the
 * consumer is disposed, the task waits for the configured retry time and creates a new consumer.
 * The task stops only when it is closed, or right away if its configuration is inactive.
 */
public interface SupervisedConsumer extends AutoCloseable, Resource {

  /**
   * Endpoint identifier of the consumer.
   *
   * @return the endpoint identifier
   */
  String idEndpoint();

  /**
   * Start the supervising loop in the background.
   *
   * <p>Calling this method more than once has no effect.
   */
  void start();

  /**
   * Request cancellation and wait for the supervising loop to stop.
   *
   * <p>An in-flight message processing completes before the loop observes the cancellation.
   */
  @Override
  void close();
}
