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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class RoutingTypeTest {

  @ParameterizedTest
  @CsvSource({
    "Anycast,ANYCAST",
    "anycast,ANYCAST",
    "0,ANYCAST",
    "MULTICAST,MULTICAST",
    "' Multicast ',MULTICAST",
    "1,MULTICAST"
  })
  void fromShouldAcceptLabelsNamesAndCodes(String value, RoutingType expected) {
    assertThat(RoutingType.from(value)).isEqualTo(expected);
  }

  @Test
  void fromCode() {
    assertThat(RoutingType.from(0)).isEqualTo(RoutingType.ANYCAST);
    assertThat(RoutingType.from(1)).isEqualTo(RoutingType.MULTICAST);
    assertThatThrownBy(() -> RoutingType.from(2)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unknownValuesShouldBeRejected() {
    assertThatThrownBy(() -> RoutingType.from("broadcast"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("broadcast");
    assertThatThrownBy(() -> RoutingType.from((String) null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
