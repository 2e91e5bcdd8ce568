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
package com.brokerworks.consumer.config;

import com.brokerworks.consumer.ConsumerConfiguration;
import java.util.Set;

/** Source of consumer configurations, one section per endpoint identifier. */
public interface ConfigurationSource {

  /**
   * The configuration of a consumer.
   *
   * <p>The endpoint identifier of the returned configuration is the one used for the lookup.
   *
   * @param idEndpoint the endpoint identifier
   * @return the consumer configuration
   * @throws com.brokerworks.consumer.ConsumerException.ConfigurationNotFoundException if there is
   *     no section for this endpoint identifier
   */
  ConsumerConfiguration consumerConfiguration(String idEndpoint);

  /**
   * The endpoint identifiers with a configuration section.
   *
   * @return endpoint identifiers
   */
  Set<String> idEndpoints();
}
