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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Settings of one consumer: endpoint identity, retry delay, subscription parameters and broker
 * endpoints.
 *
 * <p>Instances are immutable and created with {@link #builder()}. The endpoint identifier is the
 * stable identity of the consumer for logging, lookup and configuration binding, it must be unique
 * among the consumers of a process.
 */
public final class ConsumerConfiguration {

  public static final int DEFAULT_RETRY_TIME = 5000;
  public static final boolean DEFAULT_ACTIVE = true;
  public static final RoutingType DEFAULT_ROUTING_TYPE = RoutingType.ANYCAST;
  public static final int DEFAULT_CREDIT = 200;
  public static final boolean DEFAULT_DURABLE = false;
  public static final boolean DEFAULT_NO_LOCAL_FILTER = false;
  public static final boolean DEFAULT_SHARED = false;

  private final String idEndpoint;
  private final int retryTime;
  private final boolean active;
  private final String address;
  private final String queue;
  private final RoutingType routingType;
  private final int credit;
  private final boolean durable;
  private final String filterExpression;
  private final boolean noLocalFilter;
  private final boolean shared;
  private final List<Endpoint> endpoints;

  private ConsumerConfiguration(Builder builder) {
    this.idEndpoint = builder.idEndpoint;
    this.retryTime = builder.retryTime;
    this.active = builder.active;
    this.address = builder.address;
    this.queue = builder.queue;
    this.routingType = builder.routingType;
    this.credit = builder.credit;
    this.durable = builder.durable;
    this.filterExpression = builder.filterExpression;
    this.noLocalFilter = builder.noLocalFilter;
    this.shared = builder.shared;
    this.endpoints = List.copyOf(builder.endpoints);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * A builder initialized with the values of this configuration.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .idEndpoint(this.idEndpoint)
        .retryTime(this.retryTime)
        .active(this.active)
        .address(this.address)
        .queue(this.queue)
        .routingType(this.routingType)
        .credit(this.credit)
        .durable(this.durable)
        .filterExpression(this.filterExpression)
        .noLocalFilter(this.noLocalFilter)
        .shared(this.shared)
        .endpoints(this.endpoints);
  }

  public String idEndpoint() {
    return this.idEndpoint;
  }

  /**
   * Delay in milliseconds before the supervising loop retries after a failure.
   *
   * @return retry delay in milliseconds
   */
  public int retryTime() {
    return this.retryTime;
  }

  /**
   * Whether the consumer should run at all.
   *
   * @return true if the consumer is active
   */
  public boolean active() {
    return this.active;
  }

  public String address() {
    return this.address;
  }

  public String queue() {
    return this.queue;
  }

  public RoutingType routingType() {
    return this.routingType;
  }

  /**
   * Number of messages the broker can have outstanding to the subscription.
   *
   * @return the credit
   */
  public int credit() {
    return this.credit;
  }

  public boolean durable() {
    return this.durable;
  }

  public String filterExpression() {
    return this.filterExpression;
  }

  public boolean noLocalFilter() {
    return this.noLocalFilter;
  }

  public boolean shared() {
    return this.shared;
  }

  public List<Endpoint> endpoints() {
    return this.endpoints;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ConsumerConfiguration that = (ConsumerConfiguration) o;
    return retryTime == that.retryTime
        && active == that.active
        && credit == that.credit
        && durable == that.durable
        && noLocalFilter == that.noLocalFilter
        && shared == that.shared
        && idEndpoint.equals(that.idEndpoint)
        && Objects.equals(address, that.address)
        && Objects.equals(queue, that.queue)
        && routingType == that.routingType
        && Objects.equals(filterExpression, that.filterExpression)
        && endpoints.equals(that.endpoints);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        idEndpoint,
        retryTime,
        active,
        address,
        queue,
        routingType,
        credit,
        durable,
        filterExpression,
        noLocalFilter,
        shared,
        endpoints);
  }

  @Override
  public String toString() {
    return "ConsumerConfiguration{"
        + "idEndpoint='"
        + idEndpoint
        + '\''
        + ", retryTime="
        + retryTime
        + ", active="
        + active
        + ", address='"
        + address
        + '\''
        + ", queue='"
        + queue
        + '\''
        + ", routingType="
        + routingType
        + ", credit="
        + credit
        + ", durable="
        + durable
        + ", filterExpression='"
        + filterExpression
        + '\''
        + ", noLocalFilter="
        + noLocalFilter
        + ", shared="
        + shared
        + ", endpoints="
        + endpoints
        + '}';
  }

  /** Builder for {@link ConsumerConfiguration}. */
  public static final class Builder {

    private String idEndpoint;
    private int retryTime = DEFAULT_RETRY_TIME;
    private boolean active = DEFAULT_ACTIVE;
    private String address;
    private String queue;
    private RoutingType routingType = DEFAULT_ROUTING_TYPE;
    private int credit = DEFAULT_CREDIT;
    private boolean durable = DEFAULT_DURABLE;
    private String filterExpression;
    private boolean noLocalFilter = DEFAULT_NO_LOCAL_FILTER;
    private boolean shared = DEFAULT_SHARED;
    private final List<Endpoint> endpoints = new ArrayList<>();

    private Builder() {}

    public Builder idEndpoint(String idEndpoint) {
      this.idEndpoint = idEndpoint;
      return this;
    }

    public Builder retryTime(int retryTime) {
      this.retryTime = retryTime;
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public Builder address(String address) {
      this.address = address;
      return this;
    }

    public Builder queue(String queue) {
      this.queue = queue;
      return this;
    }

    public Builder routingType(RoutingType routingType) {
      this.routingType = routingType;
      return this;
    }

    public Builder credit(int credit) {
      this.credit = credit;
      return this;
    }

    public Builder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public Builder filterExpression(String filterExpression) {
      this.filterExpression = filterExpression;
      return this;
    }

    public Builder noLocalFilter(boolean noLocalFilter) {
      this.noLocalFilter = noLocalFilter;
      return this;
    }

    public Builder shared(boolean shared) {
      this.shared = shared;
      return this;
    }

    /**
     * Add broker endpoints.
     *
     * <p>The first one is the initial connection target, the others are failover locations.
     *
     * @param endpoints endpoints to add
     * @return this builder
     */
    public Builder endpoints(Endpoint... endpoints) {
      return this.endpoints(Arrays.asList(endpoints));
    }

    /**
     * Replace the broker endpoints.
     *
     * @param endpoints endpoints
     * @return this builder
     */
    public Builder endpoints(List<Endpoint> endpoints) {
      this.endpoints.clear();
      if (endpoints != null) {
        this.endpoints.addAll(endpoints);
      }
      return this;
    }

    public Builder endpoint(Endpoint endpoint) {
      this.endpoints.add(endpoint);
      return this;
    }

    public ConsumerConfiguration build() {
      if (this.idEndpoint == null || this.idEndpoint.isBlank()) {
        throw new IllegalArgumentException("Endpoint identifier cannot be blank");
      }
      if (this.retryTime < 0) {
        throw new IllegalArgumentException("Retry time cannot be negative: " + this.retryTime);
      }
      if (this.credit <= 0) {
        throw new IllegalArgumentException("Credit must be positive: " + this.credit);
      }
      if (this.routingType == null) {
        throw new IllegalArgumentException("Routing type cannot be null");
      }
      if (this.endpoints.isEmpty()) {
        throw new IllegalArgumentException(
            "At least one endpoint is required for consumer " + this.idEndpoint);
      }
      if (this.endpoints.contains(null)) {
        throw new IllegalArgumentException("Endpoints cannot contain null");
      }
      return new ConsumerConfiguration(this);
    }
  }
}
