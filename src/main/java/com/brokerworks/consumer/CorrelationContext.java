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

import java.util.Objects;

/**
 * Correlation identifier and endpoint identifier shared by the log lines of one processing
 * attempt.
 *
 * <p>Instances are immutable and passed explicitly along the receive, handle and log calls. The
 * supervising loop mints a new context at start, after each processed message and after each
 * restart.
 */
public final class CorrelationContext {

  private final String correlationId;
  private final String idEndpoint;
  private final CorrelationIdProvider idProvider;

  private CorrelationContext(
      String correlationId, String idEndpoint, CorrelationIdProvider idProvider) {
    this.correlationId = correlationId;
    this.idEndpoint = idEndpoint;
    this.idProvider = idProvider;
  }

  /**
   * Create a context with a freshly minted identifier.
   *
   * @param idEndpoint endpoint identifier of the consumer
   * @param idProvider identifier provider
   * @return the context
   */
  public static CorrelationContext create(String idEndpoint, CorrelationIdProvider idProvider) {
    Objects.requireNonNull(idProvider, "Correlation ID provider cannot be null");
    return new CorrelationContext(idProvider.newCorrelationId(), idEndpoint, idProvider);
  }

  /**
   * A new context for the same endpoint with a new identifier.
   *
   * @return the next context
   */
  public CorrelationContext next() {
    return new CorrelationContext(
        this.idProvider.newCorrelationId(), this.idEndpoint, this.idProvider);
  }

  public String correlationId() {
    return this.correlationId;
  }

  public String idEndpoint() {
    return this.idEndpoint;
  }

  @Override
  public String toString() {
    return "CorrelationContext{"
        + "correlationId='"
        + correlationId
        + '\''
        + ", idEndpoint='"
        + idEndpoint
        + '\''
        + '}';
  }
}
