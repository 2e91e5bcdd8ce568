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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class CorrelationContextTest {

  @Test
  void nextShouldMintNewIdentifierForSameEndpoint() {
    AtomicInteger sequence = new AtomicInteger();
    CorrelationIdProvider provider = () -> "id-" + sequence.incrementAndGet();

    CorrelationContext first = CorrelationContext.create("orders", provider);
    CorrelationContext second = first.next();

    assertThat(first.correlationId()).isEqualTo("id-1");
    assertThat(first.idEndpoint()).isEqualTo("orders");
    assertThat(second.correlationId()).isEqualTo("id-2");
    assertThat(second.idEndpoint()).isEqualTo("orders");
    assertThat(first.correlationId()).isEqualTo("id-1");
  }

  @Test
  void uuidProviderShouldNotRepeat() {
    CorrelationIdProvider provider = CorrelationIdProvider.uuid();
    CorrelationContext context = CorrelationContext.create("orders", provider);
    assertThat(context.next().correlationId())
        .isNotEqualTo(context.correlationId())
        .hasSize(36);
  }

  @Test
  void providerIsRequired() {
    assertThatThrownBy(() -> CorrelationContext.create("orders", null))
        .isInstanceOf(NullPointerException.class);
  }
}
