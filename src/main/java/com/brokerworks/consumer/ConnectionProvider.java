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
 * Creates live broker connections from a list of endpoints.
 *
 * <p>Implementations own endpoint selection, failover, reconnection policy, credentials and TLS.
 *
 * @see com.brokerworks.consumer.impl.ProtonConnectionProvider
 */
public interface ConnectionProvider extends AutoCloseable {

  /**
   * Connect to one of the endpoints.
   *
   * @param endpoints the endpoints, the first one is the preferred target
   * @return an open connection
   * @throws ConsumerException.ConnectionException if no connection can be established
   */
  BrokerConnection connect(List<Endpoint> endpoints);

  /** Release the resources of the provider. */
  @Override
  default void close() {}
}
