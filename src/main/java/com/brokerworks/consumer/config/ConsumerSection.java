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
import com.brokerworks.consumer.Endpoint;
import com.brokerworks.consumer.RoutingType;
import java.util.ArrayList;
import java.util.List;

/** Section form of a consumer configuration, bound by Gson. */
final class ConsumerSection {

  String idEndpoint;
  int retryTime = ConsumerConfiguration.DEFAULT_RETRY_TIME;
  boolean isActive = ConsumerConfiguration.DEFAULT_ACTIVE;
  String address;
  String queue;
  RoutingType routingType = ConsumerConfiguration.DEFAULT_ROUTING_TYPE;
  int credit = ConsumerConfiguration.DEFAULT_CREDIT;
  boolean durable = ConsumerConfiguration.DEFAULT_DURABLE;
  String filterExpression;
  boolean noLocalFilter = ConsumerConfiguration.DEFAULT_NO_LOCAL_FILTER;
  boolean shared = ConsumerConfiguration.DEFAULT_SHARED;
  List<EndpointSection> endpoints = new ArrayList<>();

  static ConsumerSection from(ConsumerConfiguration configuration) {
    ConsumerSection section = new ConsumerSection();
    section.idEndpoint = configuration.idEndpoint();
    section.retryTime = configuration.retryTime();
    section.isActive = configuration.active();
    section.address = configuration.address();
    section.queue = configuration.queue();
    section.routingType = configuration.routingType();
    section.credit = configuration.credit();
    section.durable = configuration.durable();
    section.filterExpression = configuration.filterExpression();
    section.noLocalFilter = configuration.noLocalFilter();
    section.shared = configuration.shared();
    for (Endpoint endpoint : configuration.endpoints()) {
      EndpointSection e = new EndpointSection();
      e.host = endpoint.host();
      e.port = endpoint.port();
      e.user = endpoint.user();
      e.password = endpoint.password();
      section.endpoints.add(e);
    }
    return section;
  }

  ConsumerConfiguration toConfiguration(String idEndpoint) {
    ConsumerConfiguration.Builder builder =
        ConsumerConfiguration.builder()
            .idEndpoint(idEndpoint)
            .retryTime(this.retryTime)
            .active(this.isActive)
            .address(this.address)
            .queue(this.queue)
            .routingType(
                this.routingType == null
                    ? ConsumerConfiguration.DEFAULT_ROUTING_TYPE
                    : this.routingType)
            .credit(this.credit)
            .durable(this.durable)
            .filterExpression(this.filterExpression)
            .noLocalFilter(this.noLocalFilter)
            .shared(this.shared);
    if (this.endpoints != null) {
      for (EndpointSection e : this.endpoints) {
        if (e == null) {
          throw new IllegalArgumentException(
              "Null entry in the endpoints of consumer " + idEndpoint);
        }
        builder.endpoint(Endpoint.create(e.host, e.port, e.user, e.password));
      }
    }
    return builder.build();
  }

  static final class EndpointSection {

    String host;
    int port;
    String user;
    String password;
  }
}
