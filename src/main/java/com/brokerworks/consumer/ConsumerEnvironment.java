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

import java.util.List;

/**
 * Host of the supervised consumers of an application.
 *
 * <p>An application is expected to maintain a single {@link ConsumerEnvironment} instance, to
 * start it once its consumers are registered and to close it when it exits.
 *
 * @see com.brokerworks.consumer.impl.AmqpConsumerEnvironmentBuilder
 */
public interface ConsumerEnvironment extends AutoCloseable {

  /** Start all the registered consumers. */
  void start();

  /**
   * The registered consumers.
   *
   * @return the consumers, in registration order
   */
  List<SupervisedConsumer> consumers();

  /**
   * Look up a consumer by its endpoint identifier.
   *
   * @param idEndpoint endpoint identifier
   * @return the consumer, null if none is registered with this identifier
   */
  SupervisedConsumer consumer(String idEndpoint);

  /** Stop all the consumers and release their resources. */
  @Override
  void close();
}
